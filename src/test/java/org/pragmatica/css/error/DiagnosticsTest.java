package org.pragmatica.css.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.css.tree.Position;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticsTest {
    private static final Position POS = Position.start("style.scss").nextLine().nextLine();

    @Test
    void countsPerSeverity() {
        var diagnostics = new Diagnostics();
        diagnostics.error(POS, "first");
        diagnostics.warning(POS, "second");
        diagnostics.warning(POS, "third");
        diagnostics.info(POS, "fourth");

        assertEquals(1, diagnostics.errorCount());
        assertEquals(2, diagnostics.warningCount());
        assertTrue(diagnostics.hasErrors());
        assertEquals(4, diagnostics.diagnostics().size());
    }

    @Test
    void clear_forgetsEverything() {
        var diagnostics = new Diagnostics();
        diagnostics.error(POS, "oops");
        diagnostics.clear();

        assertFalse(diagnostics.hasErrors());
        assertTrue(diagnostics.diagnostics().isEmpty());
    }

    @Test
    void formatsWithPosition() {
        var diagnostic = Diagnostic.error(POS, "':' missing in your declaration starting with \"color\".");

        assertEquals("style.scss:3: error: ':' missing in your declaration starting with \"color\".",
                     diagnostic.formatSimple());
        assertEquals("error: ':' missing in your declaration starting with \"color\".\n  --> style.scss:3\n",
                     diagnostic.format());
    }

    @Test
    void diagnosticsList_isASnapshot() {
        var diagnostics = new Diagnostics();
        var snapshot = diagnostics.diagnostics();
        diagnostics.warning(POS, "later");

        assertTrue(snapshot.isEmpty());
        assertFalse(diagnostics.diagnostics().get(0).isError());
    }
}
