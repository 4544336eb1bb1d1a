package com.example.orchestrator;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FileWatcherTest {

    @Test
    void reportsFilesAddedInNewDirectories() throws Exception {
        Path root = FilePaths.normalize(Files.createTempDirectory("watch-root"));
        CompletableFuture<Path> added = new CompletableFuture<>();
        WatchListener listener = new WatchListener() {
            @Override
            public void onChange(Path file) {
            }

            @Override
            public void onAdd(Path file) {
                if (file.getFileName().toString().equals("a.test.ts")) {
                    added.complete(file);
                }
            }

            @Override
            public void onUnlink(Path file) {
            }
        };

        try (FileWatcher watcher = new FileWatcher(root, listener)) {
            watcher.start();
            Path directory = Files.createDirectories(root.resolve("src"));
            Files.writeString(directory.resolve("a.test.ts"), "export {}\n");

            assertEquals(root.resolve("src/a.test.ts"), added.get(10, TimeUnit.SECONDS));
        }
    }

    @Test
    void reportsRemovedFiles() throws Exception {
        Path root = FilePaths.normalize(Files.createTempDirectory("watch-root"));
        Path file = TestProjects.write(root, "util.ts", "export {}\n");
        CompletableFuture<Path> removed = new CompletableFuture<>();
        WatchListener listener = new WatchListener() {
            @Override
            public void onChange(Path changed) {
            }

            @Override
            public void onAdd(Path created) {
            }

            @Override
            public void onUnlink(Path deleted) {
                removed.complete(deleted);
            }
        };

        try (FileWatcher watcher = new FileWatcher(root, listener)) {
            watcher.start();
            Files.delete(file);

            assertEquals(file, removed.get(10, TimeUnit.SECONDS));
        }
    }
}
