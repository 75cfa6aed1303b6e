package org.carma.coalition.model;

/**
 * A physical machine taking part in one allocation problem.
 *
 * @param provider    index of the owning provider
 * @param category    PM type index
 * @param poweredOn   power state before the allocation
 */
public record PhysicalMachine(int provider, int category, boolean poweredOn) {

    public PhysicalMachine {
        if (provider < 0) throw new IllegalArgumentException("Provider cannot be negative");
        if (category < 0) throw new IllegalArgumentException("PM category cannot be negative");
    }
}
