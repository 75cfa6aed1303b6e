package org.carma.coalition.game;

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;
import org.carma.coalition.model.CoalitionId;

import java.util.*;

/**
 * Core analysis of cooperative games.
 *
 * The core is non-empty iff the LP
 * <pre>
 *   minimize   Σ_i x_i
 *   subject to Σ_{i∈S} x_i ≥ v(S)   for every proper non-empty S ⊂ N
 * </pre>
 * has an optimum not greater than v(N) (Bondareva-Shapley).
 */
public class CoreAnalyzer {

    /** Tolerance for comparing LP optima, coarser than the solver's feasibility tolerance. */
    public static final double LP_EPSILON = 1e-6;

    private boolean verbose = false;

    public CoreAnalyzer setVerbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }

    public boolean isCoreEmpty(CooperativeGame game) {
        int n = game.numPlayers();
        if (n <= 1) {
            return false;
        }

        Loader.loadNativeLibraries();
        MPSolver solver = MPSolver.createSolver("GLOP");
        if (solver == null) {
            throw new IllegalStateException("GLOP linear solver is not available");
        }

        try {
            double inf = MPSolver.infinity();
            Map<Integer, MPVariable> x = new TreeMap<>();
            for (int i : game.players()) {
                x.put(i, solver.makeNumVar(-inf, inf, "x_" + i));
            }

            CoalitionId grand = game.grandCoalition();
            for (CoalitionId s : CooperativeGame.subCoalitions(grand)) {
                if (s.equals(grand)) continue;
                MPConstraint c = solver.makeConstraint(game.value(s), inf, "rationality_" + s.bits());
                for (int i : s.members()) {
                    c.setCoefficient(x.get(i), 1.0);
                }
            }

            MPObjective objective = solver.objective();
            for (MPVariable xi : x.values()) {
                objective.setCoefficient(xi, 1.0);
            }
            objective.setMinimization();

            MPSolver.ResultStatus status = solver.solve();
            if (status == MPSolver.ResultStatus.UNBOUNDED) {
                return false;
            }
            if (status != MPSolver.ResultStatus.OPTIMAL) {
                throw new IllegalStateException("Core LP for " + grand + " stopped with status " + status);
            }

            double minTotal = objective.value();
            double grandValue = game.value(grand);
            boolean empty = Tolerance.definitelyGreater(minTotal, grandValue, LP_EPSILON);
            if (verbose) {
                System.out.printf("[Core] %s: min Σx = %.6f, v(N) = %.6f -> %s%n",
                    grand, minTotal, grandValue, empty ? "empty" : "non-empty");
            }
            return empty;
        } finally {
            solver.delete();
        }
    }

    /**
     * Whether a payoff vector is efficient for the grand coalition and
     * coalitionally rational for every sub-coalition.
     */
    public boolean belongsToCore(CooperativeGame game, Map<Integer, Double> payoffs) {
        CoalitionId grand = game.grandCoalition();
        for (int i : game.players()) {
            Double p = payoffs.get(i);
            if (p == null || Double.isNaN(p)) {
                return false;
            }
        }

        if (!Tolerance.approximatelyEqual(sum(payoffs, grand), game.value(grand), LP_EPSILON)) {
            return false;
        }
        for (CoalitionId s : CooperativeGame.subCoalitions(grand)) {
            if (s.equals(grand)) continue;
            if (Tolerance.definitelyLess(sum(payoffs, s), game.value(s), LP_EPSILON)) {
                return false;
            }
        }
        return true;
    }

    private static double sum(Map<Integer, Double> payoffs, CoalitionId coalition) {
        double total = 0;
        for (int i : coalition.members()) {
            total += payoffs.get(i);
        }
        return total;
    }
}
