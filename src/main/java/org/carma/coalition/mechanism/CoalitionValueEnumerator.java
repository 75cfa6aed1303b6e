package org.carma.coalition.mechanism;

import org.carma.coalition.config.RunOptions;
import org.carma.coalition.formation.PartitionSelector;
import org.carma.coalition.formation.SubsetGenerator;
import org.carma.coalition.game.CoreAnalyzer;
import org.carma.coalition.game.CooperativeGame;
import org.carma.coalition.game.PayoffDivisionRule;
import org.carma.coalition.model.*;

import java.util.*;
import java.util.concurrent.*;

/**
 * Evaluates every coalition of a scenario and selects the best partitions.
 *
 * Phase 1 solves the allocation problem of each non-empty coalition on a
 * fixed pool of worker threads. Phase 2 runs sequentially once all values
 * are known: core test, payoff division and core membership per coalition.
 * The frozen table is then handed to the partition selector.
 *
 * A coalition whose allocation cannot be solved gets
 * {@link CoalitionInfo#INFEASIBLE_VALUE} in the table. In the cooperative
 * game used for payoffs and core tests it is worth 0, since it hosts no VM
 * and pays nothing.
 */
public class CoalitionValueEnumerator {

    private final AllocationSolver solver;
    private final CoreAnalyzer coreAnalyzer;
    private boolean verbose = false;

    public CoalitionValueEnumerator(AllocationSolver solver) {
        this.solver = Objects.requireNonNull(solver, "Solver cannot be null");
        this.coreAnalyzer = new CoreAnalyzer();
    }

    /**
     * Enumerator on the OR-Tools backend, with the optimizer limits of the options.
     */
    public static CoalitionValueEnumerator create(RunOptions options) {
        MipAllocationSolver mip = new MipAllocationSolver()
            .setRelativeGap(options.getOptimizerRelativeGap())
            .setTimeLimitSeconds(options.getOptimizerTimeLimit())
            .setVerbose(options.isVerbose());
        return new CoalitionValueEnumerator(mip).setVerbose(options.isVerbose());
    }

    public CoalitionValueEnumerator setVerbose(boolean verbose) {
        this.verbose = verbose;
        coreAnalyzer.setVerbose(verbose);
        return this;
    }

    // ========================================================================
    // Entry points
    // ========================================================================

    public CoalitionFormationInfo enumerate(Scenario scenario, RunOptions options) {
        PartitionSelector selector = options.getFormationCriterion().createSelector().setVerbose(options.isVerbose());
        CoalitionTable table = buildTable(scenario, options.getPayoffDivision().createRule(), options.getParallelism());
        List<PartitionInfo> best = selector.select(table);
        if (verbose) {
            System.out.printf("[Enumerator] %s selected %d partition(s)%n", selector.getName(), best.size());
        }
        return new CoalitionFormationInfo(table, best);
    }

    /**
     * Evaluate every non-empty coalition of the scenario.
     *
     * @throws AllocationSolverException if the solver backend fails
     */
    public CoalitionTable buildTable(Scenario scenario, PayoffDivisionRule rule, int parallelism) {
        Map<CoalitionId, SolvedCoalition> solved = solveAll(scenario, parallelism);
        return analyse(scenario, solved, rule);
    }

    // ========================================================================
    // Phase 1: allocation problems
    // ========================================================================

    private Map<CoalitionId, SolvedCoalition> solveAll(Scenario scenario, int parallelism) {
        SubsetGenerator coalitions = SubsetGenerator.ofPlayers(scenario.getNumProviders());
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, parallelism));
        try {
            Map<CoalitionId, Future<SolvedCoalition>> futures = new TreeMap<>();
            for (CoalitionId id : coalitions) {
                futures.put(id, executor.submit(() -> solveCoalition(scenario, id)));
            }

            Map<CoalitionId, SolvedCoalition> results = new TreeMap<>();
            for (Map.Entry<CoalitionId, Future<SolvedCoalition>> e : futures.entrySet()) {
                results.put(e.getKey(), e.getValue().get());
            }
            return results;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new AllocationSolverException("Coalition evaluation failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AllocationSolverException("Coalition evaluation interrupted", e);
        } finally {
            executor.shutdownNow();
        }
    }

    SolvedCoalition solveCoalition(Scenario scenario, CoalitionId id) {
        AllocationProblem problem = AllocationProblem.forCoalition(scenario, id, AllocationObjective.MIN_COST);
        OptimalAllocationInfo allocation = solver.solve(problem);

        if (!allocation.isSolved()) {
            if (verbose) {
                System.out.printf("[Enumerator] CID: %d %s - allocation not solved%n", id.bits(), id);
            }
            return new SolvedCoalition(allocation, CoalitionInfo.INFEASIBLE_VALUE, Map.of());
        }

        double revenue = problem.getRevenue();
        double value = revenue - allocation.getCost();

        Map<Integer, double[]> perProvider = new TreeMap<>();
        for (int cip : id.members()) {
            perProvider.put(cip, new double[3]);
        }
        for (int h = 0; h < problem.getNumPms(); h++) {
            if (!allocation.isPmPoweredOn(h)) continue;
            double[] acc = perProvider.get(problem.getPms().get(h).provider());
            acc[0] += 1;
            double share = 0;
            for (int v = 0; v < problem.getNumVms(); v++) {
                if (allocation.isVmPlacedOn(v, h)) {
                    acc[1] += 1;
                    share += problem.getCpuShare(v, h);
                }
            }
            acc[2] += problem.consumedPower(h, share);
        }

        Map<Integer, ProviderAllocationInfo> providers = new TreeMap<>();
        double kw = 0;
        for (Map.Entry<Integer, double[]> e : perProvider.entrySet()) {
            double[] acc = e.getValue();
            providers.put(e.getKey(), new ProviderAllocationInfo((int) acc[0], (int) acc[1], acc[2]));
            kw += acc[2] * 1e-3;
            if (verbose) {
                System.out.printf("[Enumerator] CID: %d - CIP: %d - # Powered-on PMs: %d - # Hosted VMs: %d"
                        + " - Consumed Watts: %.4f - Energy Cost: %.6f%n",
                    id.bits(), e.getKey(), (int) acc[0], (int) acc[1], acc[2],
                    acc[2] * 1e-3 * scenario.getElectricityCost(e.getKey()));
            }
        }

        if (verbose) {
            System.out.printf("[Enumerator] CID: %d - Revenue: %.6f - Cost: %.6f => v(CID)=%.6f%n",
                id.bits(), revenue, allocation.getCost(), value);
        }
        return new SolvedCoalition(allocation.withKilowatts(kw), value, providers);
    }

    // ========================================================================
    // Phase 2: game analysis
    // ========================================================================

    private CoalitionTable analyse(Scenario scenario, Map<CoalitionId, SolvedCoalition> solved,
                                   PayoffDivisionRule rule) {
        int n = scenario.getNumProviders();

        Map<CoalitionId, Double> values = new HashMap<>();
        for (Map.Entry<CoalitionId, SolvedCoalition> e : solved.entrySet()) {
            values.put(e.getKey(), e.getValue().allocation().isSolved() ? e.getValue().value() : 0.0);
        }
        CooperativeGame game = new CooperativeGame(CoalitionId.grand(n), values);

        CoalitionTable.Builder table = CoalitionTable.builder(n);
        for (Map.Entry<CoalitionId, SolvedCoalition> e : solved.entrySet()) {
            CoalitionId id = e.getKey();
            SolvedCoalition sc = e.getValue();

            CoalitionInfo.Builder info = CoalitionInfo.builder(id)
                .allocation(sc.allocation())
                .value(sc.value());
            sc.providers().forEach(info::providerAllocation);

            if (!sc.allocation().isSolved()) {
                info.coreEmpty(true).payoffsInCore(false);
                table.put(info.build());
                continue;
            }

            CooperativeGame subgame = game.subgame(id);
            boolean coreEmpty = coreAnalyzer.isCoreEmpty(subgame);
            SortedMap<Integer, Double> payoffs = rule.divide(subgame);
            boolean inCore = !coreEmpty && coreAnalyzer.belongsToCore(subgame, payoffs);

            if (verbose) {
                System.out.printf("[Enumerator] CID: %d %s - core %s - %s payoffs %s%s%n",
                    id.bits(), id, coreEmpty ? "empty" : "non-empty", rule.getName(), payoffs,
                    inCore ? " (in core)" : "");
            }

            table.put(info.coreEmpty(coreEmpty).payoffs(payoffs).payoffsInCore(inCore).build());
        }
        return table.build();
    }

    /**
     * Phase-1 outcome for one coalition.
     */
    record SolvedCoalition(OptimalAllocationInfo allocation, double value,
                           Map<Integer, ProviderAllocationInfo> providers) {}
}
