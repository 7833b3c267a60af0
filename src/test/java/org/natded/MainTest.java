package org.natded;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MainTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void remainingArgumentsFormOneFormula() {
        assertEquals(Main.EXIT_OK, Main.run(new String[]{"forall", "x.", "P(x,", "y)", "&", "q"}, out));

        String text = output();
        assertTrue(text.contains("[I] Formula letta: ∀x.(P(x, y) ∧ q)"), text);
        assertTrue(text.contains("Universal"), text);
        assertTrue(text.contains("Variabili libere:  y"), text);
        assertTrue(text.contains("Sottoformula:      (P(x, y) ∧ q)"), text);
    }

    @Test
    void binaryFormulaShowsOperands() {
        assertEquals(Main.EXIT_OK, Main.run(new String[]{"p -> q"}, out));

        String text = output();
        assertTrue(text.contains("Sinistra:          p"), text);
        assertTrue(text.contains("Destra:            q"), text);
    }

    @Test
    void parseErrorIsReportedWithFailureExitCode() {
        assertEquals(Main.EXIT_PARSE_FAILURE, Main.run(new String[]{"p", "&"}, out));
        assertTrue(output().contains("[E] Errore di parsing in 'p &'"), output());
    }

    @Test
    void substitutionOptionAppliesCaptureAvoidingSubstitution() {
        assertEquals(Main.EXIT_OK, Main.run(new String[]{"-sub", "x", "f(y)", "forall y. P(x, y)"}, out));

        String text = output();
        assertTrue(text.contains("[x := f(y)]: ∀y0.P(f(y), y0)"), text);
        assertTrue(text.contains("no"), text);
    }

    @Test
    void invalidSubstitutionTermIsBadArgument() {
        assertEquals(Main.EXIT_BAD_ARGUMENTS, Main.run(new String[]{"-sub", "x", "f(", "p"}, out));
        assertTrue(output().contains("[E] Termine di sostituzione non valido"), output());
    }

    @Test
    void fileModeSkipsBlankLinesAndComments(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("formule.txt");
        Files.write(file, List.of("# esempi", "p & q", "", "exists x. R(x, y)", "P(x,)"), StandardCharsets.UTF_8);

        assertEquals(Main.EXIT_PARSE_FAILURE, Main.run(new String[]{"-f", file.toString()}, out));

        String text = output();
        assertTrue(text.contains("[I] Formula letta: (p ∧ q)"), text);
        assertTrue(text.contains("[I] Formula letta: ∃x.R(x, y)"), text);
        assertTrue(text.contains("[E] Errore di parsing in 'P(x,)'"), text);
        assertFalse(text.contains("esempi'"), text);
    }

    @Test
    void missingFileIsReported(@TempDir Path dir) {
        String missing = dir.resolve("assente.txt").toString();
        assertEquals(Main.EXIT_PARSE_FAILURE, Main.run(new String[]{"-f", missing}, out));
        assertTrue(output().contains("[E] Impossibile leggere il file"), output());
    }

    @Test
    void examplesCatalogueParses() {
        assertEquals(Main.EXIT_OK, Main.run(new String[]{"-examples"}, out));

        String text = output();
        assertTrue(text.contains("Modus ponens"), text);
        assertTrue(text.contains("Quantificatori Unicode"), text);
        assertFalse(text.contains("✗"), text);
    }

    @Test
    void helpAndArgumentErrors() {
        assertEquals(Main.EXIT_OK, Main.run(new String[]{"-h"}, out));
        assertTrue(output().contains("Uso: natded"), output());

        assertEquals(Main.EXIT_BAD_ARGUMENTS, Main.run(new String[]{}, out));
        assertEquals(Main.EXIT_BAD_ARGUMENTS, Main.run(new String[]{"-f"}, out));
        assertEquals(Main.EXIT_BAD_ARGUMENTS, Main.run(new String[]{"-sub", "x"}, out));
    }
}
