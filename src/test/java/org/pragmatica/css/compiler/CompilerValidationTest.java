package org.pragmatica.css.compiler;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pragmatica.css.error.Diagnostics;
import org.pragmatica.css.lexer.CssLexer;
import org.pragmatica.css.parser.Parser;
import org.pragmatica.css.tree.Position;
import org.pragmatica.css.validation.ValidationRuntime;
import org.pragmatica.css.validation.ValidationScript;
import org.pragmatica.css.validation.Verdict;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CompilerValidationTest {

    @TempDir
    Path dir;

    private ValidationRuntime runtime;
    private ValidationScript script;
    private Diagnostics diagnostics;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(dir.resolve("colors"), "*color = #.*\n");
        runtime = mock(ValidationRuntime.class);
        script = mock(ValidationScript.class);
        when(script.name()).thenReturn("colors");
        when(runtime.load(eq("colors"), any(Path.class))).thenReturn(script);
    }

    private Compiler compiler(CompilerConfig config) {
        diagnostics = new Diagnostics();
        return Compiler.create(diagnostics, config, runtime);
    }

    private void compile(String source, CompilerConfig config) {
        var compiler = compiler(config);
        compiler.setRoot(Parser.create(CssLexer.create(source, "test.scss", diagnostics), diagnostics).stylesheet());
        compiler.compile(true);
    }

    @Test
    void failingDeclaration_isAWarning() throws IOException {
        when(runtime.run(eq(script), anyMap())).thenReturn(Verdict.failed("not a hex color"));

        compile("a { color: red; }", CompilerConfig.builder().searchPath(dir).validator("colors").build());

        assertEquals(1, diagnostics.warningCount());
        assertEquals(0, diagnostics.errorCount());
        assertTrue(diagnostics.diagnostics().get(0).message().contains("not a hex color"));
        verify(runtime).run(eq(script), argThat(variables -> variables.equals(Map.of("selector", "a",
                                                                                      "property", "color",
                                                                                      "value", "red"))));
    }

    @Test
    void fatalValidation_reportsErrors() {
        when(runtime.run(eq(script), anyMap())).thenReturn(Verdict.failed("nope"));

        compile("a { color: red; }",
                CompilerConfig.builder().searchPath(dir).validator("colors").fatalValidation(true).build());

        assertEquals(1, diagnostics.errorCount());
    }

    @Test
    void scripts_areLoadedOnce() throws IOException {
        when(runtime.run(eq(script), anyMap())).thenReturn(Verdict.PASSED);

        compile("a { color: red; background-color: blue; } b { color: green; }",
                CompilerConfig.builder().searchPath(dir).validator("colors").build());

        verify(runtime, times(1)).load(eq("colors"), any(Path.class));
        verify(runtime, times(3)).run(eq(script), anyMap());
        assertTrue(diagnostics.diagnostics().isEmpty());
    }

    @Test
    void missingScript_isReportedOnce() throws IOException {
        compile("a { color: red; width: 1px; }", CompilerConfig.builder().searchPath(dir).validator("absent").build());

        assertEquals(1, diagnostics.errorCount());
        verify(runtime, never()).load(eq("absent"), any(Path.class));
    }

    @Test
    void brokenScript_isReported() throws IOException {
        when(runtime.load(eq("colors"), any(Path.class))).thenThrow(new IOException("disk on fire"));

        compile("a { color: red; }", CompilerConfig.builder().searchPath(dir).validator("colors").build());

        assertTrue(diagnostics.diagnostics().get(0).message().contains("disk on fire"));
    }

    @Test
    void checkOnly_returnsTheVerdictWithoutReporting() {
        when(runtime.run(eq(script), anyMap())).thenReturn(Verdict.failed("bad"));
        var compiler = compiler(CompilerConfig.builder().searchPath(dir).build());

        compiler.setValidationScript("colors", Position.start("test.scss"));
        compiler.addValidationVariable("property", "color");

        assertFalse(compiler.runValidation(true));
        assertTrue(diagnostics.diagnostics().isEmpty());
        assertFalse(compiler.runValidation(false));
        assertEquals(1, diagnostics.warningCount());
    }

    @Test
    void validationVariables_areClearedAfterEachRun() {
        when(runtime.run(eq(script), anyMap())).thenReturn(Verdict.PASSED);
        var compiler = compiler(CompilerConfig.builder().searchPath(dir).build());

        compiler.setValidationScript("colors", Position.start("test.scss"));
        compiler.addValidationVariable("property", "color");
        compiler.runValidation(false);
        compiler.runValidation(false);

        verify(runtime).run(eq(script), argThat(variables -> variables.isEmpty()));
    }
}
