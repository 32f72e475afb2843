package org.pragmatica.css.error;

/**
 * Internal invariant violation, such as popping an empty parent stack.
 * Never part of the reported diagnostics; it signals a bug in the compiler.
 */
public final class CompilerLogicException extends IllegalStateException {
    public CompilerLogicException(String message) {
        super(message);
    }
}
