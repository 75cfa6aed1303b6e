package org.carma.coalition.model;

import org.carma.coalition.safety.ScenarioValidator;

import java.util.Arrays;

/**
 * A fully populated, validated description of a set of cloud infrastructure
 * providers (CIPs) that may pool their physical machines (PMs) and virtual
 * machines (VMs).
 *
 * Indexing conventions:
 * <ul>
 *   <li>providers: 0..numProviders-1</li>
 *   <li>PM types: 0..numPmTypes-1, VM types: 0..numVmTypes-1</li>
 *   <li>the PMs of a provider are numbered in PM-type order: first all its
 *       type-0 PMs, then all its type-1 PMs, and so on. Power states follow
 *       the same numbering.</li>
 * </ul>
 *
 * Units: revenues and cost rates in $/hour, electricity cost in $/kWh,
 * powers in W, CPU and RAM requirements as shares of a PM's capacity.
 *
 * Instances are immutable; use {@link #toBuilder()} to derive variants.
 */
public final class Scenario {

    private final String name;
    private final String description;
    private final int numProviders;
    private final int numPmTypes;
    private final int numVmTypes;
    private final int[][] pmCounts;
    private final int[][] vmCounts;
    private final boolean[][] pmPowerStates;
    private final double[][] revenues;
    private final double[] electricityCosts;
    private final double[][] pmAsleepCosts;
    private final double[][] pmAwakeCosts;
    private final double[][][] migrationCosts;
    private final double[] pmMinPowers;
    private final double[] pmMaxPowers;
    private final double[][] vmCpuShares;
    private final double[][] vmRamShares;

    private Scenario(Builder b) {
        this.name = b.name;
        this.description = b.description;
        this.numProviders = b.numProviders;
        this.numPmTypes = b.numPmTypes;
        this.numVmTypes = b.numVmTypes;
        this.pmCounts = copy(b.pmCounts);
        this.vmCounts = copy(b.vmCounts);
        this.pmPowerStates = copy(b.pmPowerStates);
        this.revenues = copy(b.revenues);
        this.electricityCosts = b.electricityCosts != null ? b.electricityCosts.clone() : null;
        this.pmAsleepCosts = copy(b.pmAsleepCosts);
        this.pmAwakeCosts = copy(b.pmAwakeCosts);
        this.migrationCosts = copy(b.migrationCosts);
        this.pmMinPowers = b.pmMinPowers != null ? b.pmMinPowers.clone() : null;
        this.pmMaxPowers = b.pmMaxPowers != null ? b.pmMaxPowers.clone() : null;
        this.vmCpuShares = copy(b.vmCpuShares);
        this.vmRamShares = copy(b.vmRamShares);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .name(name)
            .description(description)
            .numProviders(numProviders)
            .numPmTypes(numPmTypes)
            .numVmTypes(numVmTypes)
            .pmCounts(pmCounts)
            .vmCounts(vmCounts)
            .pmPowerStates(pmPowerStates)
            .revenues(revenues)
            .electricityCosts(electricityCosts)
            .pmAsleepCosts(pmAsleepCosts)
            .pmAwakeCosts(pmAwakeCosts)
            .migrationCosts(migrationCosts)
            .pmMinPowers(pmMinPowers)
            .pmMaxPowers(pmMaxPowers)
            .vmCpuShares(vmCpuShares)
            .vmRamShares(vmRamShares);
    }

    // ========================================================================
    // Dimensions
    // ========================================================================

    public String getName() { return name; }
    public String getDescription() { return description; }
    public int getNumProviders() { return numProviders; }
    public int getNumPmTypes() { return numPmTypes; }
    public int getNumVmTypes() { return numVmTypes; }

    // ========================================================================
    // Per-provider data
    // ========================================================================

    public int getPmCount(int provider, int pmType) {
        return pmCounts[provider][pmType];
    }

    public int getVmCount(int provider, int vmType) {
        return vmCounts[provider][vmType];
    }

    /**
     * Total number of PMs owned by a provider, over all PM types.
     */
    public int getPmCount(int provider) {
        return Arrays.stream(pmCounts[provider]).sum();
    }

    public int getVmCount(int provider) {
        return Arrays.stream(vmCounts[provider]).sum();
    }

    /**
     * Baseline power state of the k-th PM of a provider (PM-type order).
     */
    public boolean isPmPoweredOn(int provider, int pm) {
        return pmPowerStates[provider][pm];
    }

    public double getRevenue(int provider, int vmType) {
        return revenues[provider][vmType];
    }

    public double getElectricityCost(int provider) {
        return electricityCosts[provider];
    }

    /** Cost paid by a provider for switching off a PM of the given type. */
    public double getPmAsleepCost(int provider, int pmType) {
        return pmAsleepCosts[provider][pmType];
    }

    /** Cost paid by a provider for switching on a PM of the given type. */
    public double getPmAwakeCost(int provider, int pmType) {
        return pmAwakeCosts[provider][pmType];
    }

    public double getMigrationCost(int fromProvider, int toProvider, int vmType) {
        return migrationCosts[fromProvider][toProvider][vmType];
    }

    // ========================================================================
    // Machine specifications
    // ========================================================================

    public double getPmMinPower(int pmType) {
        return pmMinPowers[pmType];
    }

    public double getPmMaxPower(int pmType) {
        return pmMaxPowers[pmType];
    }

    public double getVmCpuShare(int vmType, int pmType) {
        return vmCpuShares[vmType][pmType];
    }

    public double getVmRamShare(int vmType, int pmType) {
        return vmRamShares[vmType][pmType];
    }

    /**
     * Revenue a provider earns from all of its VMs.
     */
    public double getProviderRevenue(int provider) {
        double revenue = 0;
        for (int v = 0; v < numVmTypes; v++) {
            revenue += revenues[provider][v] * vmCounts[provider][v];
        }
        return revenue;
    }

    // ========================================================================
    // Object Methods
    // ========================================================================

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Scenario[").append(name != null ? name : "unnamed").append("]:\n");
        sb.append("  num_cips=").append(numProviders).append("\n");
        sb.append("  num_pm_types=").append(numPmTypes).append("\n");
        sb.append("  num_vm_types=").append(numVmTypes).append("\n");
        sb.append("  cip_revenues=").append(Arrays.deepToString(revenues)).append("\n");
        sb.append("  cip_num_pms=").append(Arrays.deepToString(pmCounts)).append("\n");
        sb.append("  cip_num_vms=").append(Arrays.deepToString(vmCounts)).append("\n");
        sb.append("  cip_pm_power_states=").append(Arrays.deepToString(pmPowerStates)).append("\n");
        sb.append("  cip_electricity_costs=").append(Arrays.toString(electricityCosts)).append("\n");
        sb.append("  cip_pm_asleep_costs=").append(Arrays.deepToString(pmAsleepCosts)).append("\n");
        sb.append("  cip_pm_awake_costs=").append(Arrays.deepToString(pmAwakeCosts)).append("\n");
        sb.append("  cip_to_cip_vm_migration_costs=").append(Arrays.deepToString(migrationCosts)).append("\n");
        sb.append("  pm_spec_min_powers=").append(Arrays.toString(pmMinPowers)).append("\n");
        sb.append("  pm_spec_max_powers=").append(Arrays.toString(pmMaxPowers)).append("\n");
        sb.append("  vm_spec_cpus=").append(Arrays.deepToString(vmCpuShares)).append("\n");
        sb.append("  vm_spec_rams=").append(Arrays.deepToString(vmRamShares)).append("\n");
        return sb.toString();
    }

    // ========================================================================
    // Builder
    // ========================================================================

    /**
     * Builder for scenarios. {@link #build()} fills in the optional tables
     * (all PMs off, zero switch-on/off and migration costs) and validates the
     * result.
     */
    public static class Builder {
        private String name;
        private String description;
        private int numProviders;
        private int numPmTypes;
        private int numVmTypes;
        private int[][] pmCounts;
        private int[][] vmCounts;
        private boolean[][] pmPowerStates;
        private double[][] revenues;
        private double[] electricityCosts;
        private double[][] pmAsleepCosts;
        private double[][] pmAwakeCosts;
        private double[][][] migrationCosts;
        private double[] pmMinPowers;
        private double[] pmMaxPowers;
        private double[][] vmCpuShares;
        private double[][] vmRamShares;

        public Builder name(String name) { this.name = name; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder numProviders(int n) { this.numProviders = n; return this; }
        public Builder numPmTypes(int n) { this.numPmTypes = n; return this; }
        public Builder numVmTypes(int n) { this.numVmTypes = n; return this; }
        public Builder pmCounts(int[][] counts) { this.pmCounts = copy(counts); return this; }
        public Builder vmCounts(int[][] counts) { this.vmCounts = copy(counts); return this; }
        public Builder pmPowerStates(boolean[][] states) { this.pmPowerStates = copy(states); return this; }
        public Builder revenues(double[][] revenues) { this.revenues = copy(revenues); return this; }
        public Builder electricityCosts(double[] costs) {
            this.electricityCosts = costs != null ? costs.clone() : null;
            return this;
        }
        public Builder pmAsleepCosts(double[][] costs) { this.pmAsleepCosts = copy(costs); return this; }
        public Builder pmAwakeCosts(double[][] costs) { this.pmAwakeCosts = copy(costs); return this; }
        public Builder migrationCosts(double[][][] costs) { this.migrationCosts = copy(costs); return this; }
        public Builder pmMinPowers(double[] powers) {
            this.pmMinPowers = powers != null ? powers.clone() : null;
            return this;
        }
        public Builder pmMaxPowers(double[] powers) {
            this.pmMaxPowers = powers != null ? powers.clone() : null;
            return this;
        }
        public Builder vmCpuShares(double[][] shares) { this.vmCpuShares = copy(shares); return this; }
        public Builder vmRamShares(double[][] shares) { this.vmRamShares = copy(shares); return this; }

        public String getName() { return name; }
        public int getNumProviders() { return numProviders; }
        public int getNumPmTypes() { return numPmTypes; }
        public int getNumVmTypes() { return numVmTypes; }
        public int[][] getPmCounts() { return copy(pmCounts); }
        public int[][] getVmCounts() { return copy(vmCounts); }
        public boolean[][] getPmPowerStates() { return copy(pmPowerStates); }
        public double[] getElectricityCosts() { return electricityCosts != null ? electricityCosts.clone() : null; }
        public double[] getPmMaxPowers() { return pmMaxPowers != null ? pmMaxPowers.clone() : null; }

        /**
         * Fill defaults and build a validated scenario.
         *
         * @throws org.carma.coalition.safety.InvalidScenarioException if the scenario is inconsistent
         */
        public Scenario build() {
            applyDefaults();
            Scenario scenario = new Scenario(this);
            ScenarioValidator.requireValid(scenario);
            return scenario;
        }

        private void applyDefaults() {
            if (numProviders < 0 || numPmTypes < 0 || numVmTypes < 0) {
                return;
            }
            if (pmPowerStates == null && pmCounts != null && pmCounts.length == numProviders) {
                pmPowerStates = new boolean[numProviders][];
                for (int c = 0; c < numProviders; c++) {
                    int n = pmCounts[c] != null ? Arrays.stream(pmCounts[c]).sum() : 0;
                    pmPowerStates[c] = new boolean[Math.max(0, n)];
                }
            }
            if (pmAsleepCosts == null) {
                pmAsleepCosts = new double[numProviders][numPmTypes];
            }
            if (pmAwakeCosts == null) {
                pmAwakeCosts = new double[numProviders][numPmTypes];
            }
            if (migrationCosts == null) {
                migrationCosts = new double[numProviders][numProviders][numVmTypes];
            }
        }
    }

    // ========================================================================
    // Raw accessors for validation
    // ========================================================================

    /**
     * Shape-level view of the raw tables, used by {@link ScenarioValidator}.
     */
    public Shape shape() {
        return new Shape(this);
    }

    /**
     * Copies of the raw tables of a scenario, so that the validator can
     * inspect inconsistent scenarios without index errors.
     */
    public static final class Shape {
        private final Scenario s;

        private Shape(Scenario s) {
            this.s = s;
        }

        public int[][] pmCounts() { return copy(s.pmCounts); }
        public int[][] vmCounts() { return copy(s.vmCounts); }
        public boolean[][] pmPowerStates() { return copy(s.pmPowerStates); }
        public double[][] revenues() { return copy(s.revenues); }
        public double[] electricityCosts() { return copy(s.electricityCosts); }
        public double[][] pmAsleepCosts() { return copy(s.pmAsleepCosts); }
        public double[][] pmAwakeCosts() { return copy(s.pmAwakeCosts); }
        public double[][][] migrationCosts() { return copy(s.migrationCosts); }
        public double[] pmMinPowers() { return copy(s.pmMinPowers); }
        public double[] pmMaxPowers() { return copy(s.pmMaxPowers); }
        public double[][] vmCpuShares() { return copy(s.vmCpuShares); }
        public double[][] vmRamShares() { return copy(s.vmRamShares); }
    }

    // ========================================================================
    // Copy helpers
    // ========================================================================

    private static double[] copy(double[] a) {
        return a != null ? a.clone() : null;
    }

    private static int[][] copy(int[][] a) {
        if (a == null) return null;
        int[][] c = new int[a.length][];
        for (int i = 0; i < a.length; i++) c[i] = a[i] != null ? a[i].clone() : null;
        return c;
    }

    private static boolean[][] copy(boolean[][] a) {
        if (a == null) return null;
        boolean[][] c = new boolean[a.length][];
        for (int i = 0; i < a.length; i++) c[i] = a[i] != null ? a[i].clone() : null;
        return c;
    }

    private static double[][] copy(double[][] a) {
        if (a == null) return null;
        double[][] c = new double[a.length][];
        for (int i = 0; i < a.length; i++) c[i] = a[i] != null ? a[i].clone() : null;
        return c;
    }

    private static double[][][] copy(double[][][] a) {
        if (a == null) return null;
        double[][][] c = new double[a.length][][];
        for (int i = 0; i < a.length; i++) c[i] = copy(a[i]);
        return c;
    }
}
