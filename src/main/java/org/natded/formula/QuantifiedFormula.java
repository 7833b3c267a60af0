package org.natded.formula;

import org.natded.term.Term;

import java.util.Set;

/**
 * Formula quantificata: quantificatore universale o esistenziale.
 *
 * Il nome vincolato sottrae sé stesso dalle variabili libere del corpo.
 * Sostituzione e test "libero per" sono comuni ai due quantificatori e sono
 * implementati da {@link QuantifierSupport}.
 */
public sealed interface QuantifiedFormula extends Formula permits Universal, Existential {

    /** Nome della variabile vincolata */
    String variable();

    /** Corpo del quantificatore */
    Formula formula();

    /** Simbolo Unicode del quantificatore */
    String symbol();

    /**
     * Costruisce un quantificatore dello stesso tipo con nuovo vincolo e corpo.
     */
    QuantifiedFormula rebind(String variable, Formula formula);

    @Override
    default Set<String> freeVariables() {
        Set<String> result = formula().freeVariables();
        result.remove(variable());
        return result;
    }

    @Override
    default Formula substitute(String var, Term term) {
        return QuantifierSupport.substitute(this, var, term);
    }

    @Override
    default boolean isFreeFor(Term term, String var) {
        return QuantifierSupport.isFreeFor(this, term, var);
    }
}
