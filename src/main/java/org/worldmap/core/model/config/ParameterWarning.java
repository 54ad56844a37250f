package org.worldmap.core.model.config;

/**
 * Non-fatal finding about a parameter set. Generation still runs.
 */
public record ParameterWarning(String field, String message) {

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
