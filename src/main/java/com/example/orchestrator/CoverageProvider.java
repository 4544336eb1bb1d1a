package com.example.orchestrator;

import java.util.Map;

/**
 * Coverage collection hooked into the run lifecycle. Instrumentation itself lives elsewhere.
 */
public interface CoverageProvider {
    /**
     * Removes coverage of earlier runs before a rerun starts.
     */
    default void clean() throws Exception {
    }

    Map<String, Object> generateCoverage(boolean allTestsRun) throws Exception;

    default void reportCoverage(Map<String, Object> coverage, boolean allTestsRun) throws Exception {
    }
}
