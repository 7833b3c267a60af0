package org.natded.term;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Variabile oggetto, libera o vincolata a seconda del contesto.
 */
public record Variable(String name) implements Term {

    public Variable {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Nome variabile non può essere null o vuoto");
        }
    }

    @Override
    public Set<String> variables() {
        Set<String> result = new HashSet<>();
        result.add(name);
        return result;
    }

    @Override
    public Term substitute(String var, Term replacement) {
        return name.equals(var) ? replacement : this;
    }

    @Override
    public int hashCode() {
        return Objects.hash("Variable", name);
    }

    @Override
    public String toString() {
        return name;
    }
}
