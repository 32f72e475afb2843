package org.pragmatica.css.validation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PatternValidationRuntimeTest {
    private final PatternValidationRuntime runtime = new PatternValidationRuntime();

    private static Map<String, String> declaration(String property, String value) {
        return Map.of("selector", "a", "property", property, "value", value);
    }

    @Test
    void matchingValues_pass() {
        var script = PatternValidationRuntime.parse("colors", List.of("*color = #[0-9a-f]{3,6}"));

        assertTrue(runtime.run(script, declaration("color", "#fff")).passed());
        assertTrue(runtime.run(script, declaration("background-color", "#a0b1c2")).passed());
        assertTrue(runtime.run(script, declaration("width", "anything")).passed());
    }

    @Test
    void mismatchingValue_failsWithExplanation() {
        var script = PatternValidationRuntime.parse("colors", List.of("*color = #[0-9a-f]{3,6}"));

        var verdict = runtime.run(script, declaration("color", "red"));

        assertFalse(verdict.passed());
        assertThat(verdict.message()).contains("\"red\"").contains("\"color\"");
    }

    @Test
    void commentsAndBlankLines_areSkipped() {
        var script = PatternValidationRuntime.parse("s", List.of("# units", "", "  width = [0-9]+px  "));

        assertTrue(runtime.run(script, declaration("width", "10px")).passed());
        assertFalse(runtime.run(script, declaration("width", "10em")).passed());
    }

    @Test
    void malformedLines_areRejected() {
        var missing = assertThrows(IllegalArgumentException.class,
                                   () -> PatternValidationRuntime.parse("bad", List.of("# ok", "no equals sign")));
        assertThat(missing.getMessage()).startsWith("bad:2:");

        assertThrows(IllegalArgumentException.class,
                     () -> PatternValidationRuntime.parse("bad", List.of("color = [unclosed")));
    }

    @Test
    void foreignScripts_fail() {
        ValidationScript foreign = () -> "other";

        assertFalse(runtime.run(foreign, declaration("color", "red")).passed());
    }

    @Test
    void load_readsTheScriptFile(@TempDir Path dir) throws IOException {
        var file = Files.writeString(dir.resolve("colors"), "*color = #[0-9a-f]{3,6}\n");

        var script = runtime.load("colors", file);

        assertEquals("colors", script.name());
        assertFalse(runtime.run(script, declaration("color", "red")).passed());
    }
}
