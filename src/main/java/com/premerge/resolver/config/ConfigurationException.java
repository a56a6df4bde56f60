package com.premerge.resolver.config;

import java.util.List;

/**
 * Raised when the project tables cannot be parsed or break an invariant.
 * Holds every problem found so they can be fixed in one pass.
 */
public class ConfigurationException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final List<String> errors;

    public ConfigurationException(String source, List<String> errors) {
        super("Invalid project configuration " + source + ":" + System.lineSeparator()
                + String.join(System.lineSeparator(), errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
