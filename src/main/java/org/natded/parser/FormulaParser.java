package org.natded.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.natded.antlr.FolFormulaLexer;
import org.natded.antlr.FolFormulaParser;
import org.natded.formula.Formula;
import org.natded.term.Term;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PARSER FORMULE - Punto di ingresso per la lettura di formule e termini
 *
 * PIPELINE:
 * 1. Lexer FolFormula: token ASCII e Unicode, spazi ignorati
 * 2. Parser FolFormula: discesa ricorsiva per livelli di precedenza
 * 3. FormulaTreeBuilder: albero sintattico -> AST immutabile
 *
 * GESTIONE ERRORI:
 * • Il primo errore di lexer o parser interrompe l'analisi (nessun recupero)
 * • Input residuo dopo una formula completa è un errore (regola terminata da EOF)
 * • Quantificazione su predicati rifiutata appena letta la testa del quantificatore
 * • Ogni errore arriva al chiamante come {@link ParseException} con posizione
 *
 * L'istanza non ha stato: ogni chiamata crea lexer, parser e visitor propri,
 * quindi può essere condivisa tra thread.
 */
public class FormulaParser {

    private static final Logger LOGGER = Logger.getLogger(FormulaParser.class.getName());

    /**
     * Legge una formula.
     *
     * @param text testo della formula
     * @return albero della formula
     * @throws ParseException se il testo non rispetta la grammatica o contiene input residuo
     */
    public Formula parse(String text) throws ParseException {
        return parseDetailed(text).formula();
    }

    /**
     * Legge una formula restituendo anche le costanti incontrate.
     *
     * @param text testo della formula
     * @return formula e costanti
     * @throws ParseException se il testo non rispetta la grammatica o contiene input residuo
     */
    public ParsedFormula parseDetailed(String text) throws ParseException {
        requireText(text);
        LOGGER.fine("Inizio parsing formula: " + text);

        FolFormulaParser parser = createParser(text);
        FormulaTreeBuilder builder = new FormulaTreeBuilder();
        try {
            Formula formula = builder.visit(parser.parse());
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Formula letta: " + formula);
            }
            return new ParsedFormula(formula, builder.getConstants());
        } catch (ParseCancellationException e) {
            throw unwrap(e);
        }
    }

    /**
     * Legge un singolo termine (variabile, costante o applicazione di funzione).
     *
     * @param text testo del termine
     * @return termine letto
     * @throws ParseException se il testo non è un termine o contiene input residuo
     */
    public Term parseTerm(String text) throws ParseException {
        requireText(text);
        LOGGER.fine("Inizio parsing termine: " + text);

        FolFormulaParser parser = createParser(text);
        FormulaTreeBuilder builder = new FormulaTreeBuilder();
        try {
            return builder.buildTerm(parser.standaloneTerm().term());
        } catch (ParseCancellationException e) {
            throw unwrap(e);
        }
    }

    //region SUPPORTO PIPELINE ANTLR

    private static FolFormulaParser createParser(String text) {
        FolFormulaLexer lexer = new FolFormulaLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(SyntaxErrorListener.INSTANCE);

        FolFormulaParser parser = new FolFormulaParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(SyntaxErrorListener.INSTANCE);
        parser.addParseListener(new QuantifierHeadListener(parser.getInputStream()));
        return parser;
    }

    private static ParseException unwrap(ParseCancellationException e) {
        if (e.getCause() instanceof ParseException parseError) {
            LOGGER.fine("Parsing fallito: " + parseError.getMessage());
            return parseError;
        }
        throw e;
    }

    private static void requireText(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Testo da analizzare non può essere null");
        }
    }

    //endregion
}
