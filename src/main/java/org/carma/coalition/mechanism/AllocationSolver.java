package org.carma.coalition.mechanism;

import org.carma.coalition.model.OptimalAllocationInfo;

/**
 * Solves VM-to-PM allocation problems.
 *
 * Implementations report infeasible or unfinished models through
 * {@link OptimalAllocationInfo#isSolved()} and throw
 * {@link AllocationSolverException} only when the backend fails.
 * Implementations must be safe to call from several threads at once.
 */
public interface AllocationSolver {

    OptimalAllocationInfo solve(AllocationProblem problem);

    /**
     * Get the name of this solver backend.
     */
    String getName();
}
