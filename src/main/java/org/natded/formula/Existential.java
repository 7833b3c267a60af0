package org.natded.formula;

import java.util.Objects;

/**
 * Quantificazione esistenziale ∃x.φ.
 */
public record Existential(String variable, Formula formula) implements QuantifiedFormula {

    public Existential {
        if (variable == null || variable.isEmpty()) {
            throw new IllegalArgumentException("Variabile vincolata non può essere null o vuota");
        }
        Objects.requireNonNull(formula, "Corpo del quantificatore non può essere null");
    }

    @Override
    public String symbol() {
        return "∃";
    }

    @Override
    public QuantifiedFormula rebind(String variable, Formula formula) {
        return new Existential(variable, formula);
    }

    @Override
    public int hashCode() {
        return Objects.hash("Existential", variable, formula);
    }

    @Override
    public String toString() {
        return symbol() + variable + "." + formula;
    }
}
