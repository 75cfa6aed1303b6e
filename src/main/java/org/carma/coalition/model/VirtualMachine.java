package org.carma.coalition.model;

/**
 * A virtual machine to be placed in one allocation problem.
 *
 * @param provider  index of the provider the VM originally belongs to
 * @param category  VM type index
 */
public record VirtualMachine(int provider, int category) {

    public VirtualMachine {
        if (provider < 0) throw new IllegalArgumentException("Provider cannot be negative");
        if (category < 0) throw new IllegalArgumentException("VM category cannot be negative");
    }
}
