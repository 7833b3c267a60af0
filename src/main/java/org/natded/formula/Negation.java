package org.natded.formula;

import org.natded.term.Term;

import java.util.Objects;
import java.util.Set;

/**
 * Negazione ¬φ.
 *
 * Se φ è un connettivo binario la stampa aggiunge un ulteriore livello di
 * parentesi: {@code ¬((p ∧ q))}.
 */
public record Negation(Formula formula) implements Formula {

    public Negation {
        Objects.requireNonNull(formula, "Operando per negazione non può essere null");
    }

    @Override
    public Set<String> freeVariables() {
        return formula.freeVariables();
    }

    @Override
    public Formula substitute(String var, Term term) {
        return new Negation(formula.substitute(var, term));
    }

    @Override
    public boolean isFreeFor(Term term, String var) {
        return formula.isFreeFor(term, var);
    }

    @Override
    public int hashCode() {
        return Objects.hash("Negation", formula);
    }

    @Override
    public String toString() {
        if (formula instanceof BinaryFormula) {
            return "¬(" + formula + ")";
        }
        return "¬" + formula;
    }
}
