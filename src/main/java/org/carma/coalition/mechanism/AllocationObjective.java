package org.carma.coalition.mechanism;

/**
 * What the allocation model minimizes.
 */
public enum AllocationObjective {
    /** Electricity, PM switch-on/off and VM migration costs. */
    MIN_COST,
    /** Power drawn by the powered-on PMs. */
    MIN_POWER
}
