package org.carma.coalition.mechanism;

/**
 * Raised when the solver backend itself fails, as opposed to reporting an
 * infeasible or unsolved model. Aborts the whole analysis.
 */
public class AllocationSolverException extends RuntimeException {

    public AllocationSolverException(String message) {
        super(message);
    }

    public AllocationSolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
