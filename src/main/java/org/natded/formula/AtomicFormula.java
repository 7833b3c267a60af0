package org.natded.formula;

import org.natded.term.Term;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Formula atomica P(t1, ..., tn); con zero argomenti è un atomo proposizionale.
 *
 * La stampa omette le parentesi quando non ci sono argomenti, quindi
 * {@code P()} e {@code P} producono la stessa formula.
 */
public record AtomicFormula(String predicate, List<Term> args) implements Formula {

    public AtomicFormula {
        if (predicate == null || predicate.isEmpty()) {
            throw new IllegalArgumentException("Nome predicato non può essere null o vuoto");
        }
        args = args == null ? List.of() : List.copyOf(args);
    }

    /**
     * Atomo proposizionale senza argomenti.
     */
    public AtomicFormula(String predicate) {
        this(predicate, List.of());
    }

    @Override
    public Set<String> freeVariables() {
        Set<String> result = new HashSet<>();
        for (Term arg : args) {
            result.addAll(arg.variables());
        }
        return result;
    }

    @Override
    public Formula substitute(String var, Term term) {
        List<Term> substituted = new ArrayList<>(args.size());
        for (Term arg : args) {
            substituted.add(arg.substitute(var, term));
        }
        return new AtomicFormula(predicate, substituted);
    }

    @Override
    public boolean isFreeFor(Term term, String var) {
        return true; // nessun vincolo
    }

    @Override
    public int hashCode() {
        return Objects.hash("AtomicFormula", predicate, args);
    }

    @Override
    public String toString() {
        if (args.isEmpty()) {
            return predicate;
        }
        return args.stream()
                .map(Term::toString)
                .collect(Collectors.joining(", ", predicate + "(", ")"));
    }
}
