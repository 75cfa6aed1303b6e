package org.carma.coalition.safety;

import org.carma.coalition.model.CoalitionId;
import org.carma.coalition.model.Scenario;

import java.util.*;

/**
 * Consistency checks for scenarios, run whenever a scenario is built.
 *
 * Validates:
 * - dimensions are positive and fit a coalition id
 * - every table has the shape implied by the dimensions
 * - power-state lists match the number of PMs of each provider
 * - counts, powers, costs and CPU/RAM shares are non-negative
 * - PM minimum power does not exceed maximum power
 *
 * VM types that fit on no PM type are only reported as warnings: coalitions
 * hosting such VMs simply have infeasible allocation problems.
 */
public class ScenarioValidator {

    // ========================================================================
    // Result types
    // ========================================================================

    /**
     * Result of scenario validation.
     */
    public static class ValidationResult {
        private final List<ValidationError> errors;
        private final List<ValidationWarning> warnings;

        public ValidationResult(List<ValidationError> errors, List<ValidationWarning> warnings) {
            this.errors = Collections.unmodifiableList(new ArrayList<>(errors));
            this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        }

        public boolean isValid() { return errors.isEmpty(); }
        public List<ValidationError> getErrors() { return errors; }
        public List<ValidationWarning> getWarnings() { return warnings; }
        public boolean hasWarnings() { return !warnings.isEmpty(); }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append(isValid() ? "VALID" : "INVALID");
            if (!errors.isEmpty()) {
                sb.append(" (").append(errors.size()).append(" errors)");
            }
            if (!warnings.isEmpty()) {
                sb.append(" (").append(warnings.size()).append(" warnings)");
            }
            return sb.toString();
        }

        public String toDetailedString() {
            StringBuilder sb = new StringBuilder();
            sb.append("ValidationResult: ").append(isValid() ? "VALID" : "INVALID").append("\n");
            for (ValidationError error : errors) {
                sb.append("  (E) ").append(error).append("\n");
            }
            for (ValidationWarning warning : warnings) {
                sb.append("  (W) ").append(warning).append("\n");
            }
            return sb.toString();
        }
    }

    public static class ValidationError {
        private final String field;
        private final String message;

        public ValidationError(String field, String message) {
            this.field = field;
            this.message = message;
        }

        public String getField() { return field; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return field + ": " + message;
        }
    }

    public static class ValidationWarning {
        private final String field;
        private final String message;

        public ValidationWarning(String field, String message) {
            this.field = field;
            this.message = message;
        }

        public String getField() { return field; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return field + ": " + message;
        }
    }

    // ========================================================================
    // Entry points
    // ========================================================================

    /**
     * Validate a scenario, reporting warnings on stderr as {@code (W)} lines.
     *
     * @throws InvalidScenarioException if the scenario has errors
     */
    public static void requireValid(Scenario scenario) {
        ValidationResult result = new ScenarioValidator().validate(scenario);
        for (ValidationWarning warning : result.getWarnings()) {
            System.err.println("(W) " + warning);
        }
        if (!result.isValid()) {
            throw new InvalidScenarioException(result.getErrors());
        }
    }

    public ValidationResult validate(Scenario scenario) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();

        int nc = scenario.getNumProviders();
        int np = scenario.getNumPmTypes();
        int nv = scenario.getNumVmTypes();

        if (nc < 1 || nc > CoalitionId.MAX_PROVIDERS) {
            errors.add(new ValidationError("num_cips",
                "must be between 1 and " + CoalitionId.MAX_PROVIDERS + ", got " + nc));
        }
        if (np < 1) {
            errors.add(new ValidationError("num_pm_types", "must be positive, got " + np));
        }
        if (nv < 1) {
            errors.add(new ValidationError("num_vm_types", "must be positive, got " + nv));
        }
        if (!errors.isEmpty()) {
            return new ValidationResult(errors, warnings);
        }

        Scenario.Shape shape = scenario.shape();

        checkMatrix(errors, "cip_num_pms", shape.pmCounts(), nc, np);
        checkMatrix(errors, "cip_num_vms", shape.vmCounts(), nc, nv);
        checkMatrix(errors, "cip_revenues", shape.revenues(), nc, nv);
        checkVector(errors, "cip_electricity_costs", shape.electricityCosts(), nc);
        checkMatrix(errors, "cip_pm_asleep_costs", shape.pmAsleepCosts(), nc, np);
        checkMatrix(errors, "cip_pm_awake_costs", shape.pmAwakeCosts(), nc, np);
        checkVector(errors, "pm_spec_min_powers", shape.pmMinPowers(), np);
        checkVector(errors, "pm_spec_max_powers", shape.pmMaxPowers(), np);
        checkMatrix(errors, "vm_spec_cpus", shape.vmCpuShares(), nv, np);
        checkMatrix(errors, "vm_spec_rams", shape.vmRamShares(), nv, np);

        double[][][] migration = shape.migrationCosts();
        if (migration == null) {
            errors.add(new ValidationError("cip_to_cip_vm_migration_costs", "missing"));
        } else if (migration.length != nc) {
            errors.add(new ValidationError("cip_to_cip_vm_migration_costs",
                "expected " + nc + " rows, got " + migration.length));
        } else {
            for (int c = 0; c < nc; c++) {
                checkMatrix(errors, "cip_to_cip_vm_migration_costs[" + c + "]", migration[c], nc, nv);
            }
        }

        if (!errors.isEmpty()) {
            return new ValidationResult(errors, warnings);
        }

        // Shapes are consistent from here on
        int[][] pmCounts = shape.pmCounts();
        int[][] vmCounts = shape.vmCounts();
        double[][] revenues = shape.revenues();
        boolean[][] powerStates = shape.pmPowerStates();
        for (int c = 0; c < nc; c++) {
            int total = 0;
            for (int p = 0; p < np; p++) {
                if (pmCounts[c][p] < 0) {
                    errors.add(new ValidationError("cip_num_pms[" + c + "][" + p + "]", "cannot be negative"));
                }
                total += pmCounts[c][p];
            }
            if (powerStates == null || powerStates.length != nc || powerStates[c] == null) {
                errors.add(new ValidationError("cip_pm_power_states", "missing entry for CIP " + c));
            } else if (powerStates[c].length != total) {
                errors.add(new ValidationError("cip_pm_power_states[" + c + "]",
                    "expected " + total + " states, got " + powerStates[c].length));
            }
            for (int v = 0; v < nv; v++) {
                if (vmCounts[c][v] < 0) {
                    errors.add(new ValidationError("cip_num_vms[" + c + "][" + v + "]", "cannot be negative"));
                }
                if (revenues[c][v] < 0) {
                    warnings.add(new ValidationWarning("cip_revenues[" + c + "][" + v + "]", "negative revenue"));
                }
            }
        }

        checkNonNegative(errors, "cip_electricity_costs", shape.electricityCosts());
        checkNonNegative(errors, "cip_pm_asleep_costs", shape.pmAsleepCosts());
        checkNonNegative(errors, "cip_pm_awake_costs", shape.pmAwakeCosts());
        for (int c = 0; c < nc; c++) {
            checkNonNegative(errors, "cip_to_cip_vm_migration_costs[" + c + "]", migration[c]);
        }
        double[] minPowers = shape.pmMinPowers();
        double[] maxPowers = shape.pmMaxPowers();
        double[][] cpuShares = shape.vmCpuShares();
        double[][] ramShares = shape.vmRamShares();
        checkNonNegative(errors, "pm_spec_min_powers", minPowers);
        checkNonNegative(errors, "pm_spec_max_powers", maxPowers);
        checkNonNegative(errors, "vm_spec_cpus", cpuShares);
        checkNonNegative(errors, "vm_spec_rams", ramShares);

        for (int p = 0; p < np; p++) {
            if (minPowers[p] > maxPowers[p]) {
                errors.add(new ValidationError("pm_spec_min_powers[" + p + "]",
                    "min power " + minPowers[p] + " exceeds max power " + maxPowers[p]));
            }
        }

        for (int v = 0; v < nv; v++) {
            boolean fits = false;
            for (int p = 0; p < np; p++) {
                if (cpuShares[v][p] <= 1 && ramShares[v][p] <= 1) {
                    fits = true;
                }
            }
            if (!fits) {
                warnings.add(new ValidationWarning("vm_spec_cpus[" + v + "]",
                    "VM type " + v + " does not fit on any PM type"));
            }
        }

        return new ValidationResult(errors, warnings);
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static void checkVector(List<ValidationError> errors, String field, double[] values, int size) {
        if (values == null) {
            errors.add(new ValidationError(field, "missing"));
        } else if (values.length != size) {
            errors.add(new ValidationError(field, "expected " + size + " values, got " + values.length));
        }
    }

    private static void checkMatrix(List<ValidationError> errors, String field, int[][] values, int rows, int cols) {
        if (values == null) {
            errors.add(new ValidationError(field, "missing"));
            return;
        }
        if (values.length != rows) {
            errors.add(new ValidationError(field, "expected " + rows + " rows, got " + values.length));
            return;
        }
        for (int r = 0; r < rows; r++) {
            if (values[r] == null || values[r].length != cols) {
                errors.add(new ValidationError(field + "[" + r + "]", "expected " + cols + " values"));
            }
        }
    }

    private static void checkMatrix(List<ValidationError> errors, String field, double[][] values, int rows, int cols) {
        if (values == null) {
            errors.add(new ValidationError(field, "missing"));
            return;
        }
        if (values.length != rows) {
            errors.add(new ValidationError(field, "expected " + rows + " rows, got " + values.length));
            return;
        }
        for (int r = 0; r < rows; r++) {
            if (values[r] == null || values[r].length != cols) {
                errors.add(new ValidationError(field + "[" + r + "]", "expected " + cols + " values"));
            }
        }
    }

    private static void checkNonNegative(List<ValidationError> errors, String field, double[] values) {
        for (int i = 0; i < values.length; i++) {
            if (values[i] < 0 || Double.isNaN(values[i])) {
                errors.add(new ValidationError(field + "[" + i + "]", "must be non-negative, got " + values[i]));
            }
        }
    }

    private static void checkNonNegative(List<ValidationError> errors, String field, double[][] values) {
        for (int i = 0; i < values.length; i++) {
            checkNonNegative(errors, field + "[" + i + "]", values[i]);
        }
    }
}
