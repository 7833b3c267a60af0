package org.natded.formula;

import java.util.Objects;

/**
 * Congiunzione φ ∧ ψ, associativa a sinistra in lettura.
 */
public record Conjunction(Formula left, Formula right) implements BinaryFormula {

    public Conjunction {
        Objects.requireNonNull(left, "Operando sinistro non può essere null");
        Objects.requireNonNull(right, "Operando destro non può essere null");
    }

    @Override
    public String symbol() {
        return "∧";
    }

    @Override
    public BinaryFormula rebuild(Formula left, Formula right) {
        return new Conjunction(left, right);
    }

    @Override
    public int hashCode() {
        return Objects.hash("Conjunction", left, right);
    }

    @Override
    public String toString() {
        return BinaryFormula.render(this);
    }
}
