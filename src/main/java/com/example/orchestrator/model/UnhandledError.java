package com.example.orchestrator.model;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Normalized form of an error that escaped test execution.
 */
public record UnhandledError(
        String type,
        String name,
        String message,
        String stack
) {
    public static UnhandledError from(Object error, String type) {
        if (error instanceof Throwable throwable) {
            StringWriter stack = new StringWriter();
            throwable.printStackTrace(new PrintWriter(stack));
            return new UnhandledError(type, throwable.getClass().getName(), throwable.getMessage(), stack.toString());
        }
        return new UnhandledError(type, "Error", String.valueOf(error), null);
    }
}
