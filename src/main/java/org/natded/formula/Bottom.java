package org.natded.formula;

import org.natded.support.Identifiers;
import org.natded.term.Term;

import java.util.HashSet;
import java.util.Set;

/**
 * Il falso ⊥. Tutte le istanze sono uguali.
 */
public record Bottom() implements Formula {

    @Override
    public Set<String> freeVariables() {
        return new HashSet<>();
    }

    @Override
    public Formula substitute(String var, Term term) {
        return this;
    }

    @Override
    public boolean isFreeFor(Term term, String var) {
        return true;
    }

    @Override
    public int hashCode() {
        return "Bottom".hashCode();
    }

    @Override
    public String toString() {
        return Identifiers.BOTTOM_SYMBOL;
    }
}
