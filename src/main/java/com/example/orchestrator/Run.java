package com.example.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * One execution cycle over a list of specs. Carries the generation number and the
 * cancellation token every asynchronous step of the cycle checks.
 */
public final class Run {
    private static final Logger LOGGER = LoggerFactory.getLogger(Run.class);

    private final long generation;
    private final List<WorkspaceSpec> specs;
    private final boolean allTestsRun;
    private final ProjectOverrides overrides;
    private final List<Consumer<CancelReason>> listeners = new ArrayList<>();
    private volatile Set<Path> invalidates = Set.of();
    private CancelReason cancelReason;

    public Run(long generation, List<WorkspaceSpec> specs, boolean allTestsRun, ProjectOverrides overrides) {
        this.generation = generation;
        this.specs = List.copyOf(specs);
        this.allTestsRun = allTestsRun;
        this.overrides = overrides;
    }

    public long generation() {
        return generation;
    }

    public List<WorkspaceSpec> specs() {
        return specs;
    }

    public boolean allTestsRun() {
        return allTestsRun;
    }

    /**
     * Options that take precedence over each project's configuration for this run.
     */
    public ProjectOverrides overrides() {
        return overrides;
    }

    /**
     * Project settings a worker should use for the given file.
     */
    public ProjectConfig configFor(WorkspaceSpec spec) {
        return spec.project().config().withOverrides(overrides);
    }

    /**
     * Files whose cached transforms were dropped since the previous run.
     */
    public Set<Path> invalidates() {
        return invalidates;
    }

    void setInvalidates(Set<Path> invalidates) {
        this.invalidates = Set.copyOf(invalidates);
    }

    public synchronized boolean isCancelled() {
        return cancelReason != null;
    }

    public synchronized Optional<CancelReason> cancelReason() {
        return Optional.ofNullable(cancelReason);
    }

    /**
     * Registers a listener for cancellation of this run. A listener added after the run was
     * cancelled is invoked right away.
     */
    public void onCancel(Consumer<CancelReason> listener) {
        CancelReason reason;
        synchronized (this) {
            if (cancelReason == null) {
                listeners.add(listener);
                return;
            }
            reason = cancelReason;
        }
        notifyListener(listener, reason);
    }

    /**
     * Marks the run cancelled and invokes every registered listener once. Later calls are
     * no-ops.
     */
    public void cancel(CancelReason reason) {
        List<Consumer<CancelReason>> pending;
        synchronized (this) {
            if (cancelReason != null) {
                return;
            }
            cancelReason = reason;
            pending = new ArrayList<>(listeners);
            listeners.clear();
        }
        LOGGER.info("Cancelling run #{} ({})", generation, reason);
        pending.forEach(listener -> notifyListener(listener, reason));
    }

    private void notifyListener(Consumer<CancelReason> listener, CancelReason reason) {
        try {
            listener.accept(reason);
        } catch (RuntimeException ex) {
            LOGGER.warn("Cancel listener of run #{} failed", generation, ex);
        }
    }
}
