package org.carma.coalition.mechanism;

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPSolverParameters;
import com.google.ortools.linearsolver.MPVariable;
import org.carma.coalition.game.Tolerance;
import org.carma.coalition.model.OptimalAllocationInfo;
import org.carma.coalition.model.PhysicalMachine;
import org.carma.coalition.model.VirtualMachine;

/**
 * Allocation solver backed by the OR-Tools SCIP mixed-integer solver.
 *
 * Mathematical formulation, for PMs h and VMs v:
 * <pre>
 *   y_vh ∈ {0,1}   VM v placed on PM h
 *   x_h  ∈ {0,1}   PM h powered on
 *   s_h  ∈ [0,1]   CPU share used on PM h
 *
 *   Σ_h y_vh = 1                  ∀v   (every VM placed once)
 *   Σ_v y_vh ≤ |V|·x_h            ∀h   (only on powered-on PMs)
 *   Σ_v y_vh·RAM(v,h) ≤ x_h       ∀h   (RAM capacity)
 *   Σ_v y_vh·CPU(v,h) = s_h       ∀h   (CPU share)
 *   s_h ≤ x_h                     ∀h
 * </pre>
 * Cost objective:
 * <pre>
 *   Σ_h (x_h·Pmin + (Pmax−Pmin)·s_h)·E_{cip(h)}·1e-3
 *     + x_h·(1−o_h)·awake + (1−x_h)·o_h·asleep
 *     + Σ_v y_vh·migration(cip(v), cip(h), type(v))
 * </pre>
 * Power objective: Σ_h x_h·Pmin + (Pmax−Pmin)·s_h. Its reported cost only
 * counts electricity.
 */
public class MipAllocationSolver implements AllocationSolver {

    private static final String BACKEND = "SCIP";

    private double relativeGap = 0;
    private double timeLimitSeconds = -1;
    private boolean verbose = false;

    public MipAllocationSolver() {
        try {
            Loader.loadNativeLibraries();
        } catch (RuntimeException | LinkageError e) {
            throw new AllocationSolverException("Cannot load OR-Tools native libraries", e);
        }
    }

    /**
     * Stop as soon as a solution within this relative gap of the optimum is
     * found. Ignored unless positive.
     */
    public MipAllocationSolver setRelativeGap(double relativeGap) {
        this.relativeGap = relativeGap;
        return this;
    }

    /**
     * Time limit per model in seconds. Ignored unless positive.
     */
    public MipAllocationSolver setTimeLimitSeconds(double timeLimitSeconds) {
        this.timeLimitSeconds = timeLimitSeconds;
        return this;
    }

    public MipAllocationSolver setVerbose(boolean verbose) {
        this.verbose = verbose;
        return this;
    }

    @Override
    public String getName() {
        return "OR-Tools " + BACKEND;
    }

    @Override
    public OptimalAllocationInfo solve(AllocationProblem problem) {
        int npms = problem.getNumPms();
        int nvms = problem.getNumVms();

        if (problem.isEmpty()) {
            return new OptimalAllocationInfo(true, true, 0, 0, 0, new boolean[0], new boolean[0][0]);
        }
        if (npms == 0) {
            System.err.println("(W) No PM available to host " + nvms + " VM(s) (" + problem + ")");
            return OptimalAllocationInfo.unsolved();
        }

        boolean minPower = problem.getObjective() == AllocationObjective.MIN_POWER;
        if (minPower) {
            System.err.println("(W) Power optimization does not work well when PM switch-on/off costs"
                + " and VM migration costs are not zero!");
        }

        MPSolver solver;
        try {
            solver = MPSolver.createSolver(BACKEND);
        } catch (RuntimeException e) {
            throw new AllocationSolverException("Cannot create " + BACKEND + " solver", e);
        }
        if (solver == null) {
            throw new AllocationSolverException(BACKEND + " solver is not available in this OR-Tools build");
        }

        try {
            return solve(problem, solver, npms, nvms, minPower);
        } catch (AllocationSolverException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new AllocationSolverException("Unexpected error during the optimization: " + e.getMessage(), e);
        } finally {
            solver.delete();
        }
    }

    private OptimalAllocationInfo solve(AllocationProblem problem, MPSolver solver,
                                        int npms, int nvms, boolean minPower) {
        double inf = MPSolver.infinity();

        // ====================================================================
        // Decision variables
        // ====================================================================

        MPVariable[][] y = new MPVariable[nvms][npms];
        for (int v = 0; v < nvms; v++) {
            for (int h = 0; h < npms; h++) {
                y[v][h] = solver.makeBoolVar("y_" + v + "_" + h);
            }
        }
        MPVariable[] x = new MPVariable[npms];
        MPVariable[] s = new MPVariable[npms];
        for (int h = 0; h < npms; h++) {
            x[h] = solver.makeBoolVar("x_" + h);
            s[h] = solver.makeNumVar(0.0, 1.0, "s_" + h);
        }

        // ====================================================================
        // Constraints
        // ====================================================================

        // C1: each VM is placed on exactly one PM
        for (int v = 0; v < nvms; v++) {
            MPConstraint c = solver.makeConstraint(1.0, 1.0, "C1_" + v);
            for (int h = 0; h < npms; h++) {
                c.setCoefficient(y[v][h], 1.0);
            }
        }

        for (int h = 0; h < npms; h++) {
            // C2: VMs only go to powered-on PMs
            MPConstraint c2 = solver.makeConstraint(-inf, 0.0, "C2_" + h);
            for (int v = 0; v < nvms; v++) {
                c2.setCoefficient(y[v][h], 1.0);
            }
            c2.setCoefficient(x[h], -nvms);

            // C3: RAM capacity
            MPConstraint c3 = solver.makeConstraint(-inf, 0.0, "C3_" + h);
            for (int v = 0; v < nvms; v++) {
                c3.setCoefficient(y[v][h], problem.getRamShare(v, h));
            }
            c3.setCoefficient(x[h], -1.0);

            // C4: CPU share
            MPConstraint c4 = solver.makeConstraint(0.0, 0.0, "C4_" + h);
            for (int v = 0; v < nvms; v++) {
                c4.setCoefficient(y[v][h], problem.getCpuShare(v, h));
            }
            c4.setCoefficient(s[h], -1.0);

            // C5: no utilization on powered-off PMs
            MPConstraint c5 = solver.makeConstraint(-inf, 0.0, "C5_" + h);
            c5.setCoefficient(s[h], 1.0);
            c5.setCoefficient(x[h], -1.0);
        }

        // ====================================================================
        // Objective
        // ====================================================================

        var scenario = problem.getScenario();
        MPObjective objective = solver.objective();
        double offset = 0;
        for (int h = 0; h < npms; h++) {
            PhysicalMachine pm = problem.getPms().get(h);
            double pmin = scenario.getPmMinPower(pm.category());
            double dC = scenario.getPmMaxPower(pm.category()) - pmin;

            if (minPower) {
                objective.setCoefficient(x[h], pmin);
                objective.setCoefficient(s[h], dC);
                continue;
            }

            double wcost = problem.getWattHourCost(h);
            double on = pm.poweredOn() ? 1.0 : 0.0;
            double awake = scenario.getPmAwakeCost(pm.provider(), pm.category());
            double asleep = scenario.getPmAsleepCost(pm.provider(), pm.category());

            // (1 - x)·o·asleep contributes o·asleep to the offset and -o·asleep to x
            objective.setCoefficient(x[h], pmin * wcost + (1 - on) * awake - on * asleep);
            objective.setCoefficient(s[h], dC * wcost);
            offset += on * asleep;

            for (int v = 0; v < nvms; v++) {
                VirtualMachine vm = problem.getVms().get(v);
                objective.setCoefficient(y[v][h],
                    scenario.getMigrationCost(vm.provider(), pm.provider(), vm.category()));
            }
        }
        objective.setOffset(offset);
        objective.setMinimization();

        // ====================================================================
        // Solve
        // ====================================================================

        MPSolverParameters params = new MPSolverParameters();
        if (Tolerance.definitelyGreater(relativeGap, 0)) {
            params.setDoubleParam(MPSolverParameters.DoubleParam.RELATIVE_MIP_GAP, relativeGap);
        }
        if (Tolerance.definitelyGreater(timeLimitSeconds, 0)) {
            solver.setTimeLimit((long) Math.ceil(timeLimitSeconds * 1000));
        }

        MPSolver.ResultStatus status = solver.solve(params);

        boolean optimal;
        switch (status) {
            case OPTIMAL:
                optimal = true;
                break;
            case FEASIBLE:
                optimal = false;
                System.err.println("(W) Optimization problem solved but non-optimal!");
                break;
            default:
                System.err.println("(W) Optimization was stopped with status = " + status
                    + " (" + problem + ")");
                return OptimalAllocationInfo.unsolved();
        }

        double objectiveValue = objective.value();
        boolean[] powerStates = new boolean[npms];
        boolean[][] placements = new boolean[npms][nvms];
        double cost = minPower ? 0 : objectiveValue;
        for (int h = 0; h < npms; h++) {
            powerStates[h] = Math.round(x[h].solutionValue()) == 1L;
            if (minPower && powerStates[h]) {
                cost += problem.consumedPower(h, s[h].solutionValue()) * problem.getWattHourCost(h);
            }
            for (int v = 0; v < nvms; v++) {
                placements[h][v] = Math.round(y[v][h].solutionValue()) == 1L;
            }
        }

        if (verbose) {
            System.out.printf("[%s] %s -> status=%s, objective=%.6f, cost=%.6f%n",
                getName(), problem, status, objectiveValue, cost);
        }

        return new OptimalAllocationInfo(true, optimal, objectiveValue, cost, Double.NaN, powerStates, placements);
    }
}
