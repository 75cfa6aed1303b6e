package org.carma.coalition.formation;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * The coalition formation criteria selectable from the command line.
 */
public enum FormationCriterion {
    MERGE_SPLIT("merge-split"),
    NASH("nash"),
    PARETO("pareto"),
    SOCIAL("social");

    private final String optionName;

    FormationCriterion(String optionName) {
        this.optionName = optionName;
    }

    public String getOptionName() {
        return optionName;
    }

    public AbstractPartitionSelector createSelector() {
        return switch (this) {
            case MERGE_SPLIT -> new MergeSplitStablePartitionSelector();
            case NASH -> new NashStablePartitionSelector();
            case PARETO -> new ParetoOptimalPartitionSelector();
            case SOCIAL -> new SocialOptimumPartitionSelector();
        };
    }

    /**
     * @throws IllegalArgumentException for unknown names
     */
    public static FormationCriterion fromOptionName(String name) {
        for (FormationCriterion c : values()) {
            if (c.optionName.equalsIgnoreCase(name)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown formation criterion '" + name + "', expected one of "
            + Arrays.stream(values()).map(FormationCriterion::getOptionName).collect(Collectors.joining(", ")));
    }
}
