package org.pragmatica.css.compiler;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Compiler configuration options.
 *
 * @param emptyOnUndefinedVariable Undefined variables expand to nothing instead of being reported
 * @param searchPaths              Directories searched for {@code @import} targets and validation scripts
 * @param validators               Names of the validation scripts run against every declaration
 * @param fatalValidation          Report validation failures as errors rather than warnings
 * @param header                   Text of the preserved banner comment added outside bare mode
 * @param footer                   Text of the comment appended outside bare mode, empty for none
 */
public record CompilerConfig(
    boolean emptyOnUndefinedVariable,
    List<Path> searchPaths,
    List<String> validators,
    boolean fatalValidation,
    String header,
    String footer
) {
    public static final String DEFAULT_HEADER = "@preserve Compiled with java-csspp";

    public static final CompilerConfig DEFAULT = new CompilerConfig(
        false,
        List.of(),
        List.of(),
        false,
        DEFAULT_HEADER,
        ""
    );

    public CompilerConfig {
        searchPaths = List.copyOf(searchPaths);
        validators = List.copyOf(validators);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean emptyOnUndefinedVariable;
        private final List<Path> searchPaths = new ArrayList<>();
        private final List<String> validators = new ArrayList<>();
        private boolean fatalValidation;
        private String header = DEFAULT_HEADER;
        private String footer = "";

        private Builder() {}

        public Builder emptyOnUndefinedVariable(boolean enabled) {
            this.emptyOnUndefinedVariable = enabled;
            return this;
        }

        public Builder searchPath(Path path) {
            this.searchPaths.add(path);
            return this;
        }

        public Builder validator(String scriptName) {
            this.validators.add(scriptName);
            return this;
        }

        public Builder fatalValidation(boolean fatal) {
            this.fatalValidation = fatal;
            return this;
        }

        public Builder header(String header) {
            this.header = header;
            return this;
        }

        public Builder footer(String footer) {
            this.footer = footer;
            return this;
        }

        public CompilerConfig build() {
            return new CompilerConfig(emptyOnUndefinedVariable, searchPaths, validators, fatalValidation, header, footer);
        }
    }
}
