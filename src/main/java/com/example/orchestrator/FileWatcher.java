package com.example.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Watches a directory tree and reports changed, added and removed files. Directories created
 * while watching are registered as they appear.
 */
public final class FileWatcher implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileWatcher.class);
    static final Set<String> IGNORED_DIRECTORIES = Set.of("node_modules", ".git", ".orchestrator", "target");

    private final Path root;
    private final WatchListener listener;
    private final Map<WatchKey, Path> directories = new ConcurrentHashMap<>();
    private volatile WatchService watchService;
    private boolean closed;

    public FileWatcher(Path root, WatchListener listener) {
        this.root = FilePaths.normalize(root);
        this.listener = listener;
    }

    public synchronized void start() throws IOException {
        if (watchService != null) {
            return;
        }
        watchService = FileSystems.getDefault().newWatchService();
        registerTree(root, false);
        Thread worker = new Thread(this::poll, "orchestrator-file-watcher");
        worker.setDaemon(true);
        worker.start();
        LOGGER.info("Watching {} director(ies) under {}", directories.size(), root);
    }

    private void poll() {
        try {
            while (true) {
                WatchKey key = watchService.take();
                Path directory = directories.get(key);
                if (directory != null) {
                    for (WatchEvent<?> event : key.pollEvents()) {
                        dispatch(directory, event);
                    }
                }
                if (!key.reset()) {
                    directories.remove(key);
                }
            }
        } catch (ClosedWatchServiceException ex) {
            LOGGER.debug("File watcher closed");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.debug("File watcher interrupted");
        }
    }

    private void dispatch(Path directory, WatchEvent<?> event) {
        if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
            LOGGER.warn("File watcher overflowed under {}, some changes may be missed", directory);
            return;
        }
        Path file = directory.resolve((Path) event.context());
        try {
            if (event.kind() == StandardWatchEventKinds.ENTRY_CREATE) {
                if (Files.isDirectory(file, LinkOption.NOFOLLOW_LINKS)) {
                    registerTree(file, true);
                } else {
                    listener.onAdd(file);
                }
            } else if (event.kind() == StandardWatchEventKinds.ENTRY_MODIFY) {
                if (Files.isRegularFile(file)) {
                    listener.onChange(file);
                }
            } else if (event.kind() == StandardWatchEventKinds.ENTRY_DELETE) {
                listener.onUnlink(file);
            }
        } catch (IOException ex) {
            LOGGER.warn("Failed to register new directory {}", file, ex);
        } catch (RuntimeException ex) {
            LOGGER.error("Watch listener failed for {} {}", event.kind().name(), file, ex);
        }
    }

    private void registerTree(Path start, boolean announceFiles) throws IOException {
        Files.walkFileTree(start, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
                Path name = dir.getFileName();
                if (!dir.equals(root) && name != null && IGNORED_DIRECTORIES.contains(name.toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                WatchKey key = dir.register(watchService,
                        StandardWatchEventKinds.ENTRY_CREATE,
                        StandardWatchEventKinds.ENTRY_MODIFY,
                        StandardWatchEventKinds.ENTRY_DELETE);
                directories.put(key, FilePaths.normalize(dir));
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (announceFiles && attrs.isRegularFile()) {
                    listener.onAdd(FilePaths.normalize(file));
                }
                return FileVisitResult.CONTINUE;
            }
        });
    }

    @Override
    public synchronized void close() throws IOException {
        if (watchService == null || closed) {
            return;
        }
        closed = true;
        watchService.close();
        directories.clear();
    }
}
