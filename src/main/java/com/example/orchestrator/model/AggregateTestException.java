package com.example.orchestrator.model;

import java.util.List;

/**
 * Carries several independent failures that happened together, e.g. in parallel hooks.
 */
public class AggregateTestException extends RuntimeException {
    private final List<Throwable> errors;

    public AggregateTestException(String message, List<? extends Throwable> errors) {
        super(message);
        this.errors = List.copyOf(errors);
        this.errors.forEach(this::addSuppressed);
    }

    public List<Throwable> getErrors() {
        return errors;
    }
}
