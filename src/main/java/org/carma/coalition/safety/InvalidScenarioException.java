package org.carma.coalition.safety;

import java.util.List;

/**
 * Thrown when a scenario fails validation. Carries every error found.
 */
public class InvalidScenarioException extends RuntimeException {

    private final List<ScenarioValidator.ValidationError> errors;

    public InvalidScenarioException(List<ScenarioValidator.ValidationError> errors) {
        super(buildMessage(errors));
        this.errors = List.copyOf(errors);
    }

    public List<ScenarioValidator.ValidationError> getErrors() {
        return errors;
    }

    private static String buildMessage(List<ScenarioValidator.ValidationError> errors) {
        StringBuilder sb = new StringBuilder("Invalid scenario (" + errors.size() + " errors)");
        for (ScenarioValidator.ValidationError error : errors) {
            sb.append("\n  ").append(error);
        }
        return sb.toString();
    }
}
