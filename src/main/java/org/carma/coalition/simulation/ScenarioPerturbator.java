package org.carma.coalition.simulation;

import org.apache.commons.math3.distribution.BinomialDistribution;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.distribution.UniformIntegerDistribution;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.carma.coalition.config.RunOptions;
import org.carma.coalition.model.Scenario;

/**
 * Monte-Carlo perturbation of a base scenario.
 *
 * A seed generator seeded with the run seed produces, for each enabled
 * perturbation, one intermediate generator; that generator seeds one
 * Mersenne-Twister per (provider, type) cell. Each call to
 * {@link #next()} draws a fresh variant of the base scenario:
 * <ul>
 *   <li>VM counts: uniform integer in [0, base count];</li>
 *   <li>PM power states: fair coin per PM;</li>
 *   <li>switch-on/off costs: normal transition time (mean 300 µs, sd 50 µs)
 *       times the PM's maximum power times the electricity cost, equal for
 *       both directions, floored at 0;</li>
 *   <li>migration costs between distinct providers: normal migration time
 *       (mean 277 s, sd 61 s, both doubling with each larger VM type) times
 *       the data transfer cost rate, floored at 0; 0 within a provider.</li>
 * </ul>
 * Same base scenario and options always yield the same sequence.
 */
public class ScenarioPerturbator {

    /** Seconds in an hour. */
    private static final double NORM = 3600;

    private static final double SWITCH_TIME_MEAN = 3e-4 / NORM;
    private static final double SWITCH_TIME_SD = 5e-5 / NORM;

    private static final double MIGRATION_TIME_MEAN = 277 / NORM;
    private static final double MIGRATION_TIME_SD = 61 / NORM;
    /** $/MB */
    private static final double DATA_TRANSFER_COST = 1e-5;
    /** Hours between two activations of the allocation. */
    private static final double ACTIVATION_TIME = 12;
    /** MB per hour. */
    private static final double DATA_RATE = 12.5 * NORM;
    private static final double TRANSFER_COST_RATE = DATA_TRANSFER_COST * DATA_RATE / ACTIVATION_TIME;

    private final Scenario base;
    private final RunOptions options;

    private RandomGenerator[][] vmRngs;
    private RandomGenerator[][] powerStateRngs;
    private RandomGenerator[][] switchCostRngs;
    private RandomGenerator[][][] migrationCostRngs;

    public ScenarioPerturbator(Scenario base, RunOptions options) {
        this.base = base;
        this.options = options;

        int nc = base.getNumProviders();
        int np = base.getNumPmTypes();
        int nv = base.getNumVmTypes();
        MersenneTwister seeds = new MersenneTwister(options.getSeed());

        if (options.isRandomVms()) {
            vmRngs = seededGrid(new MersenneTwister(seeds.nextInt()), nc, nv);
        }
        if (options.isRandomPmPowerStates()) {
            powerStateRngs = seededGrid(new MersenneTwister(seeds.nextInt()), nc, np);
        }
        if (options.isRandomPmSwitchCosts()) {
            switchCostRngs = seededGrid(new MersenneTwister(seeds.nextInt()), nc, np);
        }
        if (options.isRandomMigrationCosts()) {
            MersenneTwister rng = new MersenneTwister(seeds.nextInt());
            migrationCostRngs = new RandomGenerator[nc][][];
            for (int c1 = 0; c1 < nc; c1++) {
                migrationCostRngs[c1] = seededGrid(rng, nc, nv);
            }
        }
    }

    private static RandomGenerator[][] seededGrid(RandomGenerator seeder, int rows, int cols) {
        RandomGenerator[][] grid = new RandomGenerator[rows][cols];
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                grid[r][c] = new MersenneTwister(seeder.nextInt());
            }
        }
        return grid;
    }

    /**
     * Number of scenarios the experiment should draw.
     */
    public int getIterations() {
        return options.getEffectiveIterations();
    }

    /**
     * Draw the next scenario. Without any perturbation enabled, this is the
     * base scenario itself.
     */
    public Scenario next() {
        if (!options.isAnyPerturbation()) {
            return base;
        }

        int nc = base.getNumProviders();
        int np = base.getNumPmTypes();
        int nv = base.getNumVmTypes();
        Scenario.Builder b = base.toBuilder();

        if (vmRngs != null) {
            int[][] vms = new int[nc][nv];
            for (int c = 0; c < nc; c++) {
                for (int v = 0; v < nv; v++) {
                    vms[c][v] = new UniformIntegerDistribution(vmRngs[c][v], 0, base.getVmCount(c, v)).sample();
                }
            }
            b.vmCounts(vms);
        }

        if (powerStateRngs != null) {
            boolean[][] states = new boolean[nc][];
            for (int c = 0; c < nc; c++) {
                states[c] = new boolean[base.getPmCount(c)];
                int k = 0;
                for (int p = 0; p < np; p++) {
                    BinomialDistribution coin = new BinomialDistribution(powerStateRngs[c][p], 1, 0.5);
                    for (int i = 0; i < base.getPmCount(c, p); i++) {
                        states[c][k++] = coin.sample() == 1;
                    }
                }
            }
            b.pmPowerStates(states);
        }

        if (switchCostRngs != null) {
            double[][] costs = new double[nc][np];
            for (int c = 0; c < nc; c++) {
                for (int p = 0; p < np; p++) {
                    double transitionCostRate = base.getPmMaxPower(p) * 1e-3 * base.getElectricityCost(c);
                    double time = new NormalDistribution(switchCostRngs[c][p], SWITCH_TIME_MEAN, SWITCH_TIME_SD).sample();
                    costs[c][p] = Math.max(time * transitionCostRate, 0.0);
                }
            }
            b.pmAsleepCosts(costs).pmAwakeCosts(costs);
        }

        if (migrationCostRngs != null) {
            double[][][] costs = new double[nc][nc][nv];
            for (int c1 = 0; c1 < nc; c1++) {
                for (int c2 = 0; c2 < nc; c2++) {
                    if (c1 == c2) continue;
                    double mu = MIGRATION_TIME_MEAN;
                    double sigma = MIGRATION_TIME_SD;
                    // VM types are ordered by increasing size
                    for (int v = 0; v < nv; v++) {
                        double time = new NormalDistribution(migrationCostRngs[c1][c2][v], mu, sigma).sample();
                        costs[c1][c2][v] = Math.max(time * TRANSFER_COST_RATE, 0.0);
                        mu *= 2;
                        sigma *= 2;
                    }
                }
            }
            b.migrationCosts(costs);
        }

        return b.build();
    }
}
