package org.pragmatica.css.validation;

/**
 * Outcome of running a validation script.
 *
 * @param passed  Whether the checked construct is acceptable
 * @param message Explanation of a failure, empty when passed
 */
public record Verdict(boolean passed, String message) {
    public static final Verdict PASSED = new Verdict(true, "");

    public static Verdict failed(String message) {
        return new Verdict(false, message);
    }
}
