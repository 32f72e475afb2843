package org.pragmatica.css.compiler;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered list of directories used to locate imported files and validation scripts.
 */
public final class SearchPaths {
    private final List<Path> paths = new ArrayList<>();

    public static SearchPaths of(List<Path> paths) {
        var result = new SearchPaths();
        paths.forEach(result::add);
        return result;
    }

    public void add(Path path) {
        paths.add(path);
    }

    public void clear() {
        paths.clear();
    }

    public List<Path> paths() {
        return List.copyOf(paths);
    }

    /**
     * Resolve a name: absolute names are used as is, relative names are tried against each
     * directory in order and the first regular file found wins.
     */
    public Optional<Path> find(String name) {
        if (name.isEmpty()) {
            return Optional.empty();
        }
        var candidate = Path.of(name);
        if (candidate.isAbsolute()) {
            return Files.isRegularFile(candidate)
                   ? Optional.of(candidate)
                   : Optional.empty();
        }
        for (var directory : paths) {
            var resolved = directory.resolve(candidate);
            if (Files.isRegularFile(resolved)) {
                return Optional.of(resolved.toAbsolutePath().normalize());
            }
        }
        return Optional.empty();
    }
}
