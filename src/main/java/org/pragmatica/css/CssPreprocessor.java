package org.pragmatica.css;

import org.pragmatica.css.assembler.Assembler;
import org.pragmatica.css.compiler.Compiler;
import org.pragmatica.css.compiler.CompilerConfig;
import org.pragmatica.css.error.Diagnostics;
import org.pragmatica.css.lexer.CssLexer;
import org.pragmatica.css.parser.Parser;
import org.pragmatica.css.validation.PatternValidationRuntime;
import org.pragmatica.css.validation.ValidationRuntime;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Entry point: lex, parse, compile and assemble a stylesheet in one call.
 *
 * <p>Example usage:
 * <pre>{@code
 * var result = CssPreprocessor.compile("""
 *     $color: red;
 *     a { color: $color; b { color: blue; } }
 *     """);
 *
 * result.css(); // a{color:red}\na b{color:blue}\n
 * }</pre>
 */
public final class CssPreprocessor {
    private static final String DEFAULT_FILENAME = "<input>";

    private CssPreprocessor() {}

    /**
     * Compile source text in bare mode with the default configuration.
     */
    public static CompileResult compile(String source) {
        return builder().build().compile(source);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A configured preprocessor; each call to {@link #compile(String)} gets its own diagnostics.
     */
    public static final class Configured {
        private final CompilerConfig config;
        private final ValidationRuntime runtime;
        private final boolean bare;
        private final Instant timestamp;

        private Configured(CompilerConfig config, ValidationRuntime runtime, boolean bare, Instant timestamp) {
            this.config = config;
            this.runtime = runtime;
            this.bare = bare;
            this.timestamp = timestamp;
        }

        public CompileResult compile(String source) {
            return compile(source, DEFAULT_FILENAME);
        }

        public CompileResult compile(String source, String filename) {
            var diagnostics = new Diagnostics();
            var root = Parser.create(CssLexer.create(source, filename, diagnostics), diagnostics)
                             .stylesheet();
            var compiler = Compiler.create(diagnostics, config, runtime);
            if (timestamp != null) {
                compiler.setDateTimeVariables(timestamp);
            }
            compiler.setRoot(root);
            compiler.compile(bare);
            return new CompileResult(root, Assembler.assemble(root), diagnostics.diagnostics());
        }
    }

    public static final class Builder {
        private final CompilerConfig.Builder config = CompilerConfig.builder();
        private ValidationRuntime runtime = new PatternValidationRuntime();
        private boolean bare = true;
        private Instant timestamp;

        private Builder() {}

        public Builder searchPath(Path path) {
            config.searchPath(path);
            return this;
        }

        public Builder emptyOnUndefinedVariable(boolean enabled) {
            config.emptyOnUndefinedVariable(enabled);
            return this;
        }

        public Builder bare(boolean bare) {
            this.bare = bare;
            return this;
        }

        public Builder validator(String scriptName) {
            config.validator(scriptName);
            return this;
        }

        public Builder fatalValidation(boolean fatal) {
            config.fatalValidation(fatal);
            return this;
        }

        public Builder validationRuntime(ValidationRuntime runtime) {
            this.runtime = runtime;
            return this;
        }

        public Builder header(String header) {
            config.header(header);
            return this;
        }

        public Builder footer(String footer) {
            config.footer(footer);
            return this;
        }

        /**
         * Fix the timestamp behind the {@code $_css_*} date variables; the current time otherwise.
         */
        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Configured build() {
            return new Configured(config.build(), runtime, bare, timestamp);
        }
    }
}
