package org.natded.formula;

import java.util.Objects;

/**
 * Disgiunzione φ ∨ ψ, associativa a sinistra in lettura.
 */
public record Disjunction(Formula left, Formula right) implements BinaryFormula {

    public Disjunction {
        Objects.requireNonNull(left, "Operando sinistro non può essere null");
        Objects.requireNonNull(right, "Operando destro non può essere null");
    }

    @Override
    public String symbol() {
        return "∨";
    }

    @Override
    public BinaryFormula rebuild(Formula left, Formula right) {
        return new Disjunction(left, right);
    }

    @Override
    public int hashCode() {
        return Objects.hash("Disjunction", left, right);
    }

    @Override
    public String toString() {
        return BinaryFormula.render(this);
    }
}
