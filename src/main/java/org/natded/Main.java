package org.natded;

import org.natded.formula.BinaryFormula;
import org.natded.formula.Formula;
import org.natded.formula.Negation;
import org.natded.formula.QuantifiedFormula;
import org.natded.parser.FormulaParser;
import org.natded.parser.ParseException;
import org.natded.term.Term;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * ANALIZZATORE DI FORMULE - Front end a linea di comando
 *
 * Legge formule proposizionali e del primo ordine, ne stampa la forma canonica,
 * il tipo, le variabili libere e le sottoformule immediate. Opzionalmente
 * applica una sostituzione senza cattura a ogni formula letta.
 *
 * MODALITÀ OPERATIVE:
 * - Argomenti liberi: uniti da uno spazio e letti come un'unica formula
 * - File (-f): una formula per riga, righe vuote e commenti '#' ignorati
 * - Esempi (-examples): catalogo di formule dimostrative con esito ✓/✗
 * - Sostituzione (-sub var termine): applicata a tutte le formule lette
 *
 * CODICI DI USCITA:
 * - 0: tutte le formule lette correttamente
 * - 1: almeno una formula rifiutata o file non leggibile
 * - 2: parametri non validi
 */
public final class Main {
    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String SUBSTITUTION_PARAM = "-sub";
    private static final String EXAMPLES_PARAM = "-examples";

    /**
     * Prefisso delle righe di commento nei file di formule
     * */
    private static final String COMMENT_PREFIX = "#";

    /**
     * Codici di uscita
     * */
    static final int EXIT_OK = 0;
    static final int EXIT_PARSE_FAILURE = 1;
    static final int EXIT_BAD_ARGUMENTS = 2;

    /**
     * Catalogo di esempi: descrizione e testo della formula
     * */
    private static final String[][] PROPOSITIONAL_EXAMPLES = {
            {"Atomo", "p"},
            {"Negazione", "~p"},
            {"Congiunzione", "p & q"},
            {"Disgiunzione", "p | q"},
            {"Implicazione", "p -> q"},
            {"Modus ponens", "(p & (p -> q)) -> q"},
            {"De Morgan", "~(p & q) -> (~p | ~q)"},
            {"Contrapposizione", "(p -> q) -> (~q -> ~p)"},
            {"Ex falso", "⊥ -> p"},
            {"Doppia negazione", "p -> ~~p"}
    };

    private static final String[][] FIRST_ORDER_EXAMPLES = {
            {"Predicato", "P(x)"},
            {"Relazione binaria", "R(x, y)"},
            {"Universale", "forall x. P(x)"},
            {"Esistenziale", "exists x. P(x)"},
            {"Universale condizionale", "forall x. (P(x) -> Q(x))"},
            {"Esistenziale congiunto", "exists x. (P(x) & Q(x))"},
            {"Quantificatori annidati", "forall x. exists y. R(x, y)"},
            {"Funzione", "P(f(x))"},
            {"Complessa", "forall x. (P(x) -> exists y. R(x, y))"},
            {"Quantificatori Unicode", "∀x. ∃y. R(x, y)"}
    };

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale dell'applicazione.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        int exitCode = run(args, System.out);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    /**
     * Esegue l'applicazione scrivendo su out e restituisce il codice di uscita.
     *
     * FLUSSO ESECUZIONE:
     * 1. Parsing e validazione parametri linea di comando
     * 2. Raccolta delle formule da argomenti, file o catalogo esempi
     * 3. Analisi di ogni formula; un errore non interrompe le successive
     *
     * @param args parametri linea di comando
     * @param out destinazione dell'output
     * @return codice di uscita
     */
    static int run(String[] args, PrintStream out) {
        CliConfiguration config;
        try {
            config = new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            out.println("Usa -h per visualizzare l'help completo.");
            return EXIT_BAD_ARGUMENTS;
        }

        if (config == null) {
            printApplicationHelp(out);
            return EXIT_OK;
        }

        FormulaParser parser = new FormulaParser();

        Term replacement = null;
        if (config.substitutionVariable != null) {
            try {
                replacement = parser.parseTerm(config.substitutionTerm);
            } catch (ParseException e) {
                out.println("[E] Termine di sostituzione non valido: " + e.getMessage());
                return EXIT_BAD_ARGUMENTS;
            }
        }

        boolean allParsed = true;

        if (config.runExamples) {
            allParsed &= runExamples(parser, out);
        }

        List<String> formulas;
        try {
            formulas = collectFormulas(config);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Lettura file fallita: " + config.inputFile, e);
            out.println("[E] Impossibile leggere il file " + config.inputFile + ": " + e.getMessage());
            return EXIT_PARSE_FAILURE;
        }

        for (String text : formulas) {
            allParsed &= analyzeFormula(parser, text, config.substitutionVariable, replacement, out);
        }

        return allParsed ? EXIT_OK : EXIT_PARSE_FAILURE;
    }

    //endregion

    //region ANALISI FORMULE

    /**
     * Legge e descrive una singola formula, applicando la sostituzione se richiesta.
     *
     * @return true se la formula è stata letta
     */
    private static boolean analyzeFormula(FormulaParser parser, String text,
                                          String variable, Term replacement, PrintStream out) {
        Formula formula;
        try {
            formula = parser.parse(text);
        } catch (ParseException e) {
            LOGGER.warning("Formula rifiutata: " + text);
            out.println("[E] Errore di parsing in '" + text + "': " + e.getMessage());
            return false;
        }

        out.println("[I] Formula letta: " + formula);
        out.println("    Tipo:              " + formula.getClass().getSimpleName());

        TreeSet<String> freeVariables = new TreeSet<>(formula.freeVariables());
        if (!freeVariables.isEmpty()) {
            out.println("    Variabili libere:  " + String.join(", ", freeVariables));
        }

        if (formula instanceof BinaryFormula binary) {
            out.println("    Sinistra:          " + binary.left());
            out.println("    Destra:            " + binary.right());
        } else if (formula instanceof Negation negation) {
            out.println("    Sottoformula:      " + negation.formula());
        } else if (formula instanceof QuantifiedFormula quantified) {
            out.println("    Sottoformula:      " + quantified.formula());
        }

        if (replacement != null) {
            out.println("    Libero per " + variable + ":     " + (formula.isFreeFor(replacement, variable) ? "sì" : "no"));
            out.println("    [" + variable + " := " + replacement + "]: " + formula.substitute(variable, replacement));
        }
        return true;
    }

    /**
     * Legge il catalogo di esempi e riporta l'esito di ciascuno.
     *
     * @return true se tutti gli esempi sono stati letti
     */
    private static boolean runExamples(FormulaParser parser, PrintStream out) {
        out.println("\n-->> LOGICA PROPOSIZIONALE <<--");
        boolean allParsed = runExampleGroup(parser, PROPOSITIONAL_EXAMPLES, out);

        out.println("\n-->> LOGICA DEL PRIMO ORDINE <<--");
        allParsed &= runExampleGroup(parser, FIRST_ORDER_EXAMPLES, out);
        return allParsed;
    }

    private static boolean runExampleGroup(FormulaParser parser, String[][] examples, PrintStream out) {
        boolean allParsed = true;
        for (String[] example : examples) {
            try {
                parser.parse(example[1]);
                out.println(String.format("%-25s %-40s ✓", example[0], example[1]));
            } catch (ParseException e) {
                out.println(String.format("%-25s %-40s ✗ (%s)", example[0], example[1], e.getMessage()));
                allParsed = false;
            }
        }
        return allParsed;
    }

    /**
     * Raccoglie i testi delle formule da analizzare: righe del file o argomenti liberi.
     */
    private static List<String> collectFormulas(CliConfiguration config) throws IOException {
        List<String> formulas = new ArrayList<>();

        if (config.inputFile != null) {
            for (String line : Files.readAllLines(Path.of(config.inputFile), StandardCharsets.UTF_8)) {
                String trimmed = line.trim();
                if (!trimmed.isEmpty() && !trimmed.startsWith(COMMENT_PREFIX)) {
                    formulas.add(trimmed);
                }
            }
        }

        if (config.formulaText != null) {
            formulas.add(config.formulaText);
        }
        return formulas;
    }

    //endregion

    //region HELP

    private static void printApplicationHelp(PrintStream out) {
        out.println("Uso: natded [-h] [-examples] [-f <file>] [-sub <var> <termine>] [formula ...]");
        out.println();
        out.println("  -h                   Mostra questo help");
        out.println("  -examples            Legge il catalogo di formule di esempio");
        out.println("  -f <file>            Legge una formula per riga (# per i commenti)");
        out.println("  -sub <var> <termine> Sostituisce termine a var in ogni formula letta");
        out.println();
        out.println("Sintassi delle formule:");
        out.println("  Atomi:          p, q, r, ...");
        out.println("  Negazione:      ~p  ¬p  !p");
        out.println("  Congiunzione:   p & q   p ∧ q");
        out.println("  Disgiunzione:   p | q   p ∨ q");
        out.println("  Implicazione:   p -> q  p → q");
        out.println("  Falso:          ⊥  _");
        out.println("  Predicati:      P(x), Q(x, y), ...");
        out.println("  Funzioni:       f(x), g(x, y), ...");
        out.println("  Universale:     forall x. P(x)   ∀x. P(x)");
        out.println("  Esistenziale:   exists x. P(x)   ∃x. P(x)");
    }

    //endregion

    //region CONFIGURAZIONE E PARSING ARGOMENTI

    /**
     * Configurazione validata della linea di comando.
     */
    private static class CliConfiguration {
        final String formulaText;
        final String inputFile;
        final String substitutionVariable;
        final String substitutionTerm;
        final boolean runExamples;

        CliConfiguration(String formulaText, String inputFile, String substitutionVariable,
                         String substitutionTerm, boolean runExamples) {
            this.formulaText = formulaText;
            this.inputFile = inputFile;
            this.substitutionVariable = substitutionVariable;
            this.substitutionTerm = substitutionTerm;
            this.runExamples = runExamples;
        }
    }

    /**
     * Parser dei parametri della linea di comando.
     */
    private static class ArgumentParser {

        /**
         * Processa sequenzialmente i parametri e costruisce la configurazione.
         *
         * @param args parametri da linea comando
         * @return configurazione validata, oppure null se è stato richiesto l'help
         * @throws IllegalArgumentException se parametri mancanti o incoerenti
         */
        CliConfiguration parse(String[] args) {
            String inputFile = null;
            String substitutionVariable = null;
            String substitutionTerm = null;
            boolean runExamples = false;
            List<String> formulaParts = new ArrayList<>();

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        return null;
                    }
                    case FILE_PARAM -> {
                        if (inputFile != null) {
                            throw new IllegalArgumentException("Parametro -f specificato più volte");
                        }
                        inputFile = getNextArgument(args, ++i, "file");
                    }
                    case SUBSTITUTION_PARAM -> {
                        substitutionVariable = getNextArgument(args, ++i, "variabile");
                        substitutionTerm = getNextArgument(args, ++i, "termine");
                    }
                    case EXAMPLES_PARAM -> runExamples = true;
                    default -> formulaParts.add(args[i]);
                }
            }

            String formulaText = formulaParts.isEmpty() ? null : String.join(" ", formulaParts);
            if (formulaText == null && inputFile == null && !runExamples) {
                throw new IllegalArgumentException("Nessuna formula da analizzare");
            }

            return new CliConfiguration(formulaText, inputFile, substitutionVariable, substitutionTerm, runExamples);
        }

        private String getNextArgument(String[] args, int index, String description) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Manca il valore per " + description);
            }
            return args[index];
        }
    }

    //endregion
}
