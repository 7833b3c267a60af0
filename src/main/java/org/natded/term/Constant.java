package org.natded.term;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Costante: oggetto fisso del dominio, nessuna variabile.
 */
public record Constant(String name) implements Term {

    public Constant {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Nome costante non può essere null o vuoto");
        }
    }

    @Override
    public Set<String> variables() {
        return new HashSet<>();
    }

    @Override
    public Term substitute(String var, Term replacement) {
        return this;
    }

    @Override
    public int hashCode() {
        return Objects.hash("Constant", name);
    }

    @Override
    public String toString() {
        return name;
    }
}
