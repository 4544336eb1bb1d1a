package com.example.orchestrator;

import java.nio.file.Path;

public final class FilePaths {
    private FilePaths() {
    }

    public static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }

    /**
     * Path of {@code file} relative to {@code root} with forward slashes, or the absolute path
     * when the file lives outside the root.
     */
    public static String relativeLabel(Path root, Path file) {
        Path normalizedRoot = normalize(root);
        Path normalizedFile = normalize(file);
        if (!normalizedFile.startsWith(normalizedRoot)) {
            return normalizedFile.toString().replace('\\', '/');
        }
        return normalizedRoot.relativize(normalizedFile).toString().replace('\\', '/');
    }
}
