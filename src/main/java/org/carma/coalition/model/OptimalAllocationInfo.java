package org.carma.coalition.model;

import java.util.Arrays;

/**
 * Outcome of solving one allocation problem.
 *
 * The decision arrays are indexed like the problem's PM and VM lists:
 * {@code pmPowerStates[h]} tells whether PM h is on after the allocation and
 * {@code vmAllocations[h][v]} whether VM v is placed on PM h. Both are empty
 * when the problem was not solved.
 */
public final class OptimalAllocationInfo {

    private final boolean solved;
    private final boolean optimal;
    private final double objectiveValue;
    private final double cost;
    private final double kilowatts;
    private final boolean[] pmPowerStates;
    private final boolean[][] vmAllocations;

    public OptimalAllocationInfo(boolean solved, boolean optimal, double objectiveValue, double cost,
                                 double kilowatts, boolean[] pmPowerStates, boolean[][] vmAllocations) {
        this.solved = solved;
        this.optimal = optimal;
        this.objectiveValue = objectiveValue;
        this.cost = cost;
        this.kilowatts = kilowatts;
        this.pmPowerStates = pmPowerStates != null ? pmPowerStates.clone() : new boolean[0];
        this.vmAllocations = new boolean[vmAllocations != null ? vmAllocations.length : 0][];
        for (int h = 0; h < this.vmAllocations.length; h++) {
            this.vmAllocations[h] = vmAllocations[h].clone();
        }
    }

    /**
     * Allocation for a problem the solver could not solve.
     */
    public static OptimalAllocationInfo unsolved() {
        return new OptimalAllocationInfo(false, false, Double.NaN, Double.NaN, Double.NaN, null, null);
    }

    public OptimalAllocationInfo withKilowatts(double kw) {
        return new OptimalAllocationInfo(solved, optimal, objectiveValue, cost, kw, pmPowerStates, vmAllocations);
    }

    public boolean isSolved() { return solved; }
    public boolean isOptimal() { return optimal; }
    public double getObjectiveValue() { return objectiveValue; }
    public double getCost() { return cost; }
    public double getKilowatts() { return kilowatts; }

    public int getNumPms() {
        return pmPowerStates.length;
    }

    public boolean isPmPoweredOn(int pm) {
        return pmPowerStates[pm];
    }

    public boolean isVmPlacedOn(int vm, int pm) {
        return vmAllocations[pm][vm];
    }

    @Override
    public String toString() {
        if (!solved) {
            return "OptimalAllocation[unsolved]";
        }
        return String.format("OptimalAllocation[optimal=%s, objective=%.6f, cost=%.6f, kW=%.6f, pms=%s]",
            optimal, objectiveValue, cost, kilowatts, Arrays.toString(pmPowerStates));
    }
}
