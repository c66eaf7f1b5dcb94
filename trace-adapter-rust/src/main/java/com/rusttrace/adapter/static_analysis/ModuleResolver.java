package com.rusttrace.adapter.static_analysis;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resolves a {@code mod name;} declaration to the source file that holds the module body.
 *
 * From main.rs, lib.rs or mod.rs the module is looked up next to the declaring file:
 * <ol>
 *   <li>{@code name.rs} in the same directory (no extra namespace)</li>
 *   <li>{@code name/mod.rs} (namespace {@code name})</li>
 * </ol>
 * From any other file {@code foo.rs} the same two lookups happen inside the sibling
 * directory {@code foo/}, and the result is prefixed with namespace {@code foo}.
 *
 * I/O errors while listing directories make the resolution fail; they are never thrown.
 */
public class ModuleResolver {

    static final Set<String> ROOT_LIKE_STEMS = Set.of("main", "lib", "mod");
    static final String EXTENSION = ".rs";
    static final String DIRECTORY_MODULE_MARKER = "mod.rs";

    /**
     * A resolved module file and the namespace increment it adds on top of the declaring file's.
     */
    public record ResolvedModule(Path path, NamespaceContext context) {}

    public Optional<ResolvedModule> resolve(Path currentFile, String targetModule) {
        Path fileName = currentFile.getFileName();
        if (fileName == null) return Optional.empty();

        Path directory = currentFile.getParent() != null ? currentFile.getParent() : Paths.get("");
        String currentStem = stem(fileName.toString());

        Optional<List<Path>> entries = listEntries(directory);
        if (entries.isEmpty()) return Optional.empty();

        if (ROOT_LIKE_STEMS.contains(currentStem)) {
            return fileModule(entries.get(), targetModule)
                .or(() -> directoryModule(entries.get(), targetModule));
        }
        return nestedModule(entries.get(), targetModule, currentStem);
    }

    /** Strategy A: {@code target.rs} among the given entries. */
    private Optional<ResolvedModule> fileModule(List<Path> entries, String targetModule) {
        String fileTarget = targetModule + EXTENSION;
        return entries.stream()
            .filter(p -> fileTarget.equals(p.getFileName().toString()))
            .filter(p -> !Files.isDirectory(p))
            .findFirst()
            .map(p -> new ResolvedModule(p, NamespaceContext.EMPTY));
    }

    /** Strategy B: a {@code target/} directory containing a mod.rs. */
    private Optional<ResolvedModule> directoryModule(List<Path> entries, String targetModule) {
        for (Path entry : entries) {
            if (!Files.isDirectory(entry) || !targetModule.equals(entry.getFileName().toString())) {
                continue;
            }
            Optional<List<Path>> subEntries = listEntries(entry);
            if (subEntries.isEmpty()) return Optional.empty();
            for (Path candidate : subEntries.get()) {
                if (DIRECTORY_MODULE_MARKER.equals(candidate.getFileName().toString())) {
                    return Optional.of(new ResolvedModule(candidate, NamespaceContext.of(targetModule)));
                }
            }
        }
        return Optional.empty();
    }

    /** Strategies A and B applied inside the directory named after the declaring file. */
    private Optional<ResolvedModule> nestedModule(List<Path> entries, String targetModule, String currentStem) {
        Optional<Path> subdirectory = entries.stream()
            .filter(Files::isDirectory)
            .filter(p -> currentStem.equals(p.getFileName().toString()))
            .findFirst();
        if (subdirectory.isEmpty()) return Optional.empty();

        Optional<List<Path>> subEntries = listEntries(subdirectory.get());
        if (subEntries.isEmpty()) return Optional.empty();

        NamespaceContext prefix = NamespaceContext.of(currentStem);
        return fileModule(subEntries.get(), targetModule)
            .or(() -> directoryModule(subEntries.get(), targetModule))
            .map(resolved -> new ResolvedModule(resolved.path(), prefix.combine(resolved.context())));
    }

    private Optional<List<Path>> listEntries(Path directory) {
        try (Stream<Path> list = Files.list(directory)) {
            return Optional.of(list.sorted().collect(Collectors.toList()));
        } catch (IOException e) {
            System.err.println("[trace-adapter] WARNING: could not list directory " + directory + ": " + e.getMessage());
            return Optional.empty();
        }
    }

    static String stem(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
