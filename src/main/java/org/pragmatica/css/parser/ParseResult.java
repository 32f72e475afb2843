package org.pragmatica.css.parser;

import org.pragmatica.css.error.Diagnostic;
import org.pragmatica.css.tree.Node;

import java.util.List;

/**
 * Result of parsing: the best-effort tree together with the diagnostics reported while building it.
 *
 * <p>The tree is always present; when the source has errors it holds every construct
 * that could be recovered.
 *
 * @param root        The stylesheet as a {@code LIST} node
 * @param diagnostics Problems found while lexing and parsing
 */
public record ParseResult(Node root, List<Diagnostic> diagnostics) {

    public ParseResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isSuccess() {
        return diagnostics.stream().noneMatch(Diagnostic::isError);
    }

    public boolean hasErrors() {
        return !isSuccess();
    }

    public int errorCount() {
        return (int) diagnostics.stream()
                                .filter(Diagnostic::isError)
                                .count();
    }
}
