package com.example.orchestrator.graph;

import com.example.orchestrator.FilePaths;

import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Files waiting for a debounced rerun, files whose cached transform must be discarded, and
 * the optional restriction of watched tests.
 */
public final class ChangeSet {
    private final Set<Path> changedTests = new LinkedHashSet<>();
    private final Set<Path> invalidates = new LinkedHashSet<>();
    private final Set<Path> watchedTests = new LinkedHashSet<>();

    public synchronized boolean isChanged(Path file) {
        return changedTests.contains(FilePaths.normalize(file));
    }

    public synchronized void markChanged(Path file) {
        changedTests.add(FilePaths.normalize(file));
    }

    public synchronized void markChanged(Collection<Path> files) {
        files.forEach(file -> changedTests.add(FilePaths.normalize(file)));
    }

    public synchronized void removeChanged(Path file) {
        changedTests.remove(FilePaths.normalize(file));
    }

    public synchronized List<Path> changedTests() {
        return List.copyOf(changedTests);
    }

    public synchronized boolean hasChanges() {
        return !changedTests.isEmpty();
    }

    public synchronized void clearChanged() {
        changedTests.clear();
    }

    public synchronized boolean isInvalidated(Path file) {
        return invalidates.contains(FilePaths.normalize(file));
    }

    public synchronized void invalidate(Path file) {
        invalidates.add(FilePaths.normalize(file));
    }

    public synchronized Set<Path> invalidates() {
        return Set.copyOf(invalidates);
    }

    /**
     * Returns the pending invalidations and clears them.
     */
    public synchronized Set<Path> drainInvalidates() {
        Set<Path> snapshot = Set.copyOf(invalidates);
        invalidates.clear();
        return snapshot;
    }

    public synchronized void clearInvalidates() {
        invalidates.clear();
    }

    /**
     * Restricts reruns to the given tests. An empty collection watches everything.
     */
    public synchronized void watchTests(Collection<Path> tests) {
        watchedTests.clear();
        tests.forEach(test -> watchedTests.add(FilePaths.normalize(test)));
    }

    public synchronized Set<Path> watchedTests() {
        return Set.copyOf(watchedTests);
    }

    /**
     * Drops changed tests outside the watched restriction, if one is active.
     */
    public synchronized void retainWatched() {
        if (!watchedTests.isEmpty()) {
            changedTests.retainAll(watchedTests);
        }
    }

    public synchronized void clear() {
        changedTests.clear();
        invalidates.clear();
        watchedTests.clear();
    }
}
