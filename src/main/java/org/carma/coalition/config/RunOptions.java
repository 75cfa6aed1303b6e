package org.carma.coalition.config;

import org.carma.coalition.formation.FormationCriterion;
import org.carma.coalition.game.PayoffDivisionMethod;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Options for one experiment: solver limits, formation and payoff rules,
 * scenario perturbation and output.
 */
public final class RunOptions {

    public static final long DEFAULT_SEED = 5489L;

    private final double optimizerRelativeGap;
    private final double optimizerTimeLimit;
    private final FormationCriterion formationCriterion;
    private final PayoffDivisionMethod payoffDivision;
    private final boolean randomVms;
    private final boolean randomPmPowerStates;
    private final boolean randomPmSwitchCosts;
    private final boolean randomMigrationCosts;
    private final long seed;
    private final int iterations;
    private final Path csvFile;
    private final int parallelism;
    private final boolean verbose;

    private RunOptions(Builder b) {
        this.optimizerRelativeGap = b.optimizerRelativeGap;
        this.optimizerTimeLimit = b.optimizerTimeLimit;
        this.formationCriterion = b.formationCriterion;
        this.payoffDivision = b.payoffDivision;
        this.randomVms = b.randomVms;
        this.randomPmPowerStates = b.randomPmPowerStates;
        this.randomPmSwitchCosts = b.randomPmSwitchCosts;
        this.randomMigrationCosts = b.randomMigrationCosts;
        this.seed = b.seed;
        this.iterations = b.iterations;
        this.csvFile = b.csvFile;
        this.parallelism = b.parallelism;
        this.verbose = b.verbose;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static RunOptions defaults() {
        return builder().build();
    }

    public Builder toBuilder() {
        return new Builder()
            .optimizerRelativeGap(optimizerRelativeGap)
            .optimizerTimeLimit(optimizerTimeLimit)
            .formationCriterion(formationCriterion)
            .payoffDivision(payoffDivision)
            .randomVms(randomVms)
            .randomPmPowerStates(randomPmPowerStates)
            .randomPmSwitchCosts(randomPmSwitchCosts)
            .randomMigrationCosts(randomMigrationCosts)
            .seed(seed)
            .iterations(iterations)
            .csvFile(csvFile)
            .parallelism(parallelism)
            .verbose(verbose);
    }

    public double getOptimizerRelativeGap() { return optimizerRelativeGap; }
    /** Seconds; not positive means unbounded. */
    public double getOptimizerTimeLimit() { return optimizerTimeLimit; }
    public FormationCriterion getFormationCriterion() { return formationCriterion; }
    public PayoffDivisionMethod getPayoffDivision() { return payoffDivision; }
    public boolean isRandomVms() { return randomVms; }
    public boolean isRandomPmPowerStates() { return randomPmPowerStates; }
    public boolean isRandomPmSwitchCosts() { return randomPmSwitchCosts; }
    public boolean isRandomMigrationCosts() { return randomMigrationCosts; }
    public long getSeed() { return seed; }
    public int getIterations() { return iterations; }
    public Optional<Path> getCsvFile() { return Optional.ofNullable(csvFile); }
    public int getParallelism() { return parallelism; }
    public boolean isVerbose() { return verbose; }

    public boolean isAnyPerturbation() {
        return randomVms || randomPmPowerStates || randomPmSwitchCosts || randomMigrationCosts;
    }

    /**
     * Number of scenarios to analyse. Only random VM counts produce distinct
     * iterations; otherwise a single run is made.
     */
    public int getEffectiveIterations() {
        return randomVms ? iterations : 1;
    }

    @Override
    public String toString() {
        return "Options: coalition_formation: " + formationCriterion.getOptionName()
            + ", coalition_value_division: " + payoffDivision.getOptionName()
            + ", optim_relative_gap: " + optimizerRelativeGap
            + ", optim_time_limit: " + optimizerTimeLimit
            + ", random_gen_vms: " + randomVms
            + ", random_gen_pm_power_states: " + randomPmPowerStates
            + ", random_gen_pm_on_off_costs: " + randomPmSwitchCosts
            + ", random_gen_vm_migration_costs: " + randomMigrationCosts
            + ", random_num_iterations: " + iterations
            + ", random_seed: " + seed
            + ", csv_file: " + (csvFile != null ? csvFile : "")
            + ", parallelism: " + parallelism;
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private double optimizerRelativeGap = 0;
        private double optimizerTimeLimit = -1;
        private FormationCriterion formationCriterion = FormationCriterion.NASH;
        private PayoffDivisionMethod payoffDivision = PayoffDivisionMethod.SHAPLEY;
        private boolean randomVms;
        private boolean randomPmPowerStates;
        private boolean randomPmSwitchCosts;
        private boolean randomMigrationCosts;
        private long seed = DEFAULT_SEED;
        private int iterations = 1;
        private Path csvFile;
        private int parallelism = 1;
        private boolean verbose;

        public Builder optimizerRelativeGap(double gap) { this.optimizerRelativeGap = gap; return this; }
        public Builder optimizerTimeLimit(double seconds) { this.optimizerTimeLimit = seconds; return this; }
        public Builder formationCriterion(FormationCriterion c) { this.formationCriterion = c; return this; }
        public Builder payoffDivision(PayoffDivisionMethod m) { this.payoffDivision = m; return this; }
        public Builder randomVms(boolean on) { this.randomVms = on; return this; }
        public Builder randomPmPowerStates(boolean on) { this.randomPmPowerStates = on; return this; }
        public Builder randomPmSwitchCosts(boolean on) { this.randomPmSwitchCosts = on; return this; }
        public Builder randomMigrationCosts(boolean on) { this.randomMigrationCosts = on; return this; }
        public Builder seed(long seed) { this.seed = seed; return this; }
        public Builder iterations(int n) { this.iterations = n; return this; }
        public Builder csvFile(Path file) { this.csvFile = file; return this; }
        public Builder parallelism(int threads) { this.parallelism = threads; return this; }
        public Builder verbose(boolean verbose) { this.verbose = verbose; return this; }

        public RunOptions build() {
            if (Double.isNaN(optimizerRelativeGap) || optimizerRelativeGap < 0 || optimizerRelativeGap > 1) {
                throw new IllegalArgumentException("Relative gap must be within [0,1], got " + optimizerRelativeGap);
            }
            if (formationCriterion == null) throw new IllegalArgumentException("Formation criterion cannot be null");
            if (payoffDivision == null) throw new IllegalArgumentException("Payoff division cannot be null");
            if (iterations < 1) throw new IllegalArgumentException("Iterations must be positive, got " + iterations);
            if (parallelism < 1) throw new IllegalArgumentException("Parallelism must be positive, got " + parallelism);
            return new RunOptions(this);
        }
    }
}
