package org.natded.formula;

import java.util.Objects;

/**
 * Implicazione φ → ψ.
 *
 * In lettura è associativa a destra ({@code p -> q -> r} = {@code p → (q → r)});
 * strutturalmente è una semplice coppia antecedente/conseguente.
 */
public record Implication(Formula antecedent, Formula consequent) implements BinaryFormula {

    public Implication {
        Objects.requireNonNull(antecedent, "Antecedente non può essere null");
        Objects.requireNonNull(consequent, "Conseguente non può essere null");
    }

    @Override
    public Formula left() {
        return antecedent;
    }

    @Override
    public Formula right() {
        return consequent;
    }

    @Override
    public String symbol() {
        return "→";
    }

    @Override
    public BinaryFormula rebuild(Formula left, Formula right) {
        return new Implication(left, right);
    }

    @Override
    public int hashCode() {
        return Objects.hash("Implication", antecedent, consequent);
    }

    @Override
    public String toString() {
        return BinaryFormula.render(this);
    }
}
