package org.pragmatica.css;

import org.pragmatica.css.error.Diagnostic;
import org.pragmatica.css.tree.Node;

import java.util.List;

/**
 * Result of a compilation: the compiled tree, its CSS text and everything reported on the way.
 *
 * @param root        The compiled stylesheet
 * @param css         The assembled output
 * @param diagnostics Problems reported by the lexer, the parser and the compiler, in order
 */
public record CompileResult(Node root, String css, List<Diagnostic> diagnostics) {

    public CompileResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isSuccess() {
        return diagnostics.stream().noneMatch(Diagnostic::isError);
    }

    public boolean hasErrors() {
        return !isSuccess();
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream()
                          .filter(Diagnostic::isError)
                          .toList();
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream()
                          .filter(d -> d.severity() == Diagnostic.Severity.WARNING)
                          .toList();
    }
}
