package org.natded.term;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Applicazione di funzione f(t1, ..., tn).
 *
 * La lista degli argomenti è copiata in forma immutabile alla costruzione;
 * l'ordine conta per l'uguaglianza. L'arità zero è ammessa ({@code f()}).
 */
public record FunctionApplication(String function, List<Term> args) implements Term {

    public FunctionApplication {
        if (function == null || function.isEmpty()) {
            throw new IllegalArgumentException("Nome funzione non può essere null o vuoto");
        }
        if (args == null) {
            throw new IllegalArgumentException("Lista argomenti non può essere null");
        }
        args = List.copyOf(args); // rifiuta anche elementi null
    }

    @Override
    public Set<String> variables() {
        Set<String> result = new HashSet<>();
        for (Term arg : args) {
            result.addAll(arg.variables());
        }
        return result;
    }

    @Override
    public Term substitute(String var, Term replacement) {
        List<Term> substituted = new ArrayList<>(args.size());
        for (Term arg : args) {
            substituted.add(arg.substitute(var, replacement));
        }
        return new FunctionApplication(function, substituted);
    }

    @Override
    public int hashCode() {
        return Objects.hash("FunctionApplication", function, args);
    }

    @Override
    public String toString() {
        return args.stream()
                .map(Term::toString)
                .collect(Collectors.joining(", ", function + "(", ")"));
    }
}
