package org.carma.coalition.game;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * The payoff division rules selectable from the command line.
 */
public enum PayoffDivisionMethod {
    BANZHAF("banzhaf"),
    NORMALIZED_BANZHAF("norm-banzhaf"),
    SHAPLEY("shapley");

    private final String optionName;

    PayoffDivisionMethod(String optionName) {
        this.optionName = optionName;
    }

    public String getOptionName() {
        return optionName;
    }

    public PayoffDivisionRule createRule() {
        return switch (this) {
            case BANZHAF -> new BanzhafValue();
            case NORMALIZED_BANZHAF -> new NormalizedBanzhafValue();
            case SHAPLEY -> new ShapleyValue();
        };
    }

    /**
     * @throws IllegalArgumentException for unknown names
     */
    public static PayoffDivisionMethod fromOptionName(String name) {
        for (PayoffDivisionMethod m : values()) {
            if (m.optionName.equalsIgnoreCase(name)) {
                return m;
            }
        }
        throw new IllegalArgumentException("Unknown payoff division '" + name + "', expected one of "
            + Arrays.stream(values()).map(PayoffDivisionMethod::getOptionName).collect(Collectors.joining(", ")));
    }
}
