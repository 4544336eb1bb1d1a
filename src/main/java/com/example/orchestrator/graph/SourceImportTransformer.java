package com.example.orchestrator.graph;

import com.example.orchestrator.FilePaths;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Built-in transformer for JavaScript and TypeScript sources. It does not rewrite code; it
 * only extracts static ({@code import ... from}, {@code export ... from}, bare {@code import})
 * and dynamic ({@code import()}, {@code require()}) specifiers, and resolves relative ones
 * against the file system.
 */
public final class SourceImportTransformer implements ModuleTransformer {
    private static final Pattern STATIC_IMPORT = Pattern.compile(
            "(?m)^\\s*(?:import|export)\\s+(?:[^'\";]*?\\s+from\\s+)?['\"]([^'\"]+)['\"]");
    private static final Pattern DYNAMIC_IMPORT = Pattern.compile(
            "(?:\\bimport|\\brequire)\\s*\\(\\s*['\"]([^'\"]+)['\"]\\s*\\)");
    private static final List<String> EXTENSIONS = List.of(".ts", ".tsx", ".mts", ".cts", ".js", ".jsx", ".mjs", ".cjs");

    @Override
    public TransformResult transform(Path file, TransformMode mode) throws IOException {
        String code = Files.readString(file);
        return new TransformResult(code, matches(STATIC_IMPORT, code), matches(DYNAMIC_IMPORT, code));
    }

    @Override
    public Optional<Path> resolveId(String id, Path importer, TransformMode mode) {
        if (!id.startsWith(".") && !id.startsWith("/")) {
            return Optional.empty();
        }
        Path base = id.startsWith("/") || importer == null
                ? Path.of(id)
                : importer.getParent().resolve(id);
        Path candidate = FilePaths.normalize(base);
        if (Files.isRegularFile(candidate)) {
            return Optional.of(candidate);
        }
        for (String extension : EXTENSIONS) {
            Path withExtension = candidate.resolveSibling(candidate.getFileName() + extension);
            if (Files.isRegularFile(withExtension)) {
                return Optional.of(withExtension);
            }
        }
        if (Files.isDirectory(candidate)) {
            for (String extension : EXTENSIONS) {
                Path index = candidate.resolve("index" + extension);
                if (Files.isRegularFile(index)) {
                    return Optional.of(index);
                }
            }
        }
        return Optional.empty();
    }

    private List<String> matches(Pattern pattern, String code) {
        List<String> specifiers = new ArrayList<>();
        Matcher matcher = pattern.matcher(code);
        while (matcher.find()) {
            String specifier = matcher.group(1);
            if (!specifiers.contains(specifier)) {
                specifiers.add(specifier);
            }
        }
        return specifiers;
    }
}
