package com.example.orchestrator;

/**
 * Fatal configuration problem: duplicate project names, malformed workspace definitions or
 * invalid option values. Aborts startup.
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
