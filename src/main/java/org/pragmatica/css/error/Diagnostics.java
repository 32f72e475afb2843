package org.pragmatica.css.error;

import org.pragmatica.css.tree.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Sink receiving the diagnostics of one parse/compile run.
 *
 * <p>Nothing reported here aborts processing; callers that want to fail a build
 * check {@link #errorCount()} once the run is over. Every diagnostic is also logged.
 * Not thread-safe: one instance per run.
 */
public final class Diagnostics {
    private static final Logger log = LoggerFactory.getLogger(Diagnostics.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void report(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        switch (diagnostic.severity()) {
            case ERROR -> log.error(diagnostic.formatSimple());
            case WARNING -> log.warn(diagnostic.formatSimple());
            case INFO -> log.info(diagnostic.formatSimple());
        }
    }

    public void error(Position position, String message) {
        report(Diagnostic.error(position, message));
    }

    public void warning(Position position, String message) {
        report(Diagnostic.warning(position, message));
    }

    public void info(Position position, String message) {
        report(Diagnostic.info(position, message));
    }

    public List<Diagnostic> diagnostics() {
        return List.copyOf(diagnostics);
    }

    public int errorCount() {
        return count(Diagnostic.Severity.ERROR);
    }

    public int warningCount() {
        return count(Diagnostic.Severity.WARNING);
    }

    public boolean hasErrors() {
        return errorCount() > 0;
    }

    public void clear() {
        diagnostics.clear();
    }

    /**
     * Format all diagnostics, one per paragraph.
     */
    public String format() {
        var sb = new StringBuilder();
        for (var diagnostic : diagnostics) {
            sb.append(diagnostic.format());
        }
        return sb.toString();
    }

    private int count(Diagnostic.Severity severity) {
        return (int) diagnostics.stream()
                                .filter(d -> d.severity() == severity)
                                .count();
    }
}
