package com.example.orchestrator;

import java.nio.file.Path;

/**
 * Receives file system events from a {@link FileWatcher}, on the watcher thread.
 */
public interface WatchListener {
    void onChange(Path file);

    void onAdd(Path file);

    void onUnlink(Path file);
}
