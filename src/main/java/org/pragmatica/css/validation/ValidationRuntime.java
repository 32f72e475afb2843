package org.pragmatica.css.validation;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Runtime able to load and execute validation scripts.
 *
 * <p>The compiler locates scripts, caches what {@link #load} returns and feeds
 * each run with the variables it exposes ({@code selector}, {@code property}, {@code value}).
 */
public interface ValidationRuntime {
    ValidationScript load(String name, Path path) throws IOException;

    Verdict run(ValidationScript script, Map<String, String> variables);
}
