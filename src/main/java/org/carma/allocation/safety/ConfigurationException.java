package org.carma.allocation.safety;

import java.util.List;

/**
 * Thrown when a plan, query or parameter record is malformed.
 * Malformed input is rejected, never silently coerced.
 */
public class ConfigurationException extends RuntimeException {

    private final List<ConfigurationValidator.ValidationError> errors;

    public ConfigurationException(List<ConfigurationValidator.ValidationError> errors) {
        super("Invalid configuration: " + errors);
        this.errors = List.copyOf(errors);
    }

    public ConfigurationException(String category, String field, String message) {
        this(List.of(new ConfigurationValidator.ValidationError(category, field, message)));
    }

    public List<ConfigurationValidator.ValidationError> getErrors() {
        return errors;
    }
}
