package org.natded.formula;

import org.natded.term.Term;

import java.util.Set;

/**
 * Connettivo binario: congiunzione, disgiunzione o implicazione.
 *
 * Variabili libere, sostituzione e test "libero per" sono identici per i tre
 * connettivi e sono definiti qui una sola volta; ogni variante fornisce solo
 * i propri operandi, il simbolo e il costruttore.
 */
public sealed interface BinaryFormula extends Formula permits Conjunction, Disjunction, Implication {

    /** Operando sinistro (antecedente per l'implicazione) */
    Formula left();

    /** Operando destro (conseguente per l'implicazione) */
    Formula right();

    /** Simbolo Unicode usato nella stampa canonica */
    String symbol();

    /**
     * Costruisce un nodo dello stesso connettivo con nuovi operandi.
     */
    BinaryFormula rebuild(Formula left, Formula right);

    @Override
    default Set<String> freeVariables() {
        Set<String> result = left().freeVariables();
        result.addAll(right().freeVariables());
        return result;
    }

    @Override
    default Formula substitute(String var, Term term) {
        return rebuild(left().substitute(var, term), right().substitute(var, term));
    }

    @Override
    default boolean isFreeFor(Term term, String var) {
        return left().isFreeFor(term, var) && right().isFreeFor(term, var);
    }

    /**
     * Stampa canonica {@code (L op R)}.
     *
     * Un operando sinistro che termina con un quantificatore aperto viene
     * racchiuso tra parentesi, altrimenti il corpo del quantificatore
     * assorbirebbe l'operatore alla rilettura.
     */
    static String render(BinaryFormula formula) {
        String left = formula.left().toString();
        if (endsWithOpenQuantifier(formula.left())) {
            left = "(" + left + ")";
        }
        return "(" + left + " " + formula.symbol() + " " + formula.right() + ")";
    }

    private static boolean endsWithOpenQuantifier(Formula formula) {
        if (formula instanceof QuantifiedFormula) {
            return true;
        }
        if (formula instanceof Negation negation) {
            return endsWithOpenQuantifier(negation.formula());
        }
        return false;
    }
}
