package org.pragmatica.css.error;

import org.pragmatica.css.tree.Position;

/**
 * A single reported problem.
 *
 * <p>Example output of {@link #format()}:
 * <pre>
 * error: ':' missing in your declaration starting with "color".
 *   --> style.scss:3
 * </pre>
 *
 * @param severity Severity level
 * @param message  Human readable message
 * @param position Where the problem was found
 */
public record Diagnostic(Severity severity, String message, Position position) {

    /**
     * Severity levels.
     */
    public enum Severity {
        ERROR("error"),
        WARNING("warning"),
        INFO("info");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    public static Diagnostic error(Position position, String message) {
        return new Diagnostic(Severity.ERROR, message, position);
    }

    public static Diagnostic warning(Position position, String message) {
        return new Diagnostic(Severity.WARNING, message, position);
    }

    public static Diagnostic info(Position position, String message) {
        return new Diagnostic(Severity.INFO, message, position);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Two line format with the location on its own line.
     */
    public String format() {
        return severity.display() + ": " + message + "\n  --> " + position + "\n";
    }

    /**
     * Single-line format, {@code file:line: severity: message}.
     */
    public String formatSimple() {
        return position + ": " + severity.display() + ": " + message;
    }
}
