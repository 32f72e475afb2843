package org.pragmatica.css.validation;

/**
 * A validation program loaded by a {@link ValidationRuntime}.
 */
public interface ValidationScript {
    String name();
}
