package org.natded.parser;

import org.natded.formula.Formula;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Risultato completo di un parsing: la formula e le costanti incontrate.
 *
 * Le costanti sono i termini con iniziale non minuscola, nell'ordine di prima
 * apparizione. Sono informazioni accessorie: nessuna operazione sulla formula
 * dipende da esse.
 *
 * @param formula albero della formula letta
 * @param constants nomi delle costanti incontrate (insieme immutabile)
 */
public record ParsedFormula(Formula formula, Set<String> constants) {

    public ParsedFormula {
        Objects.requireNonNull(formula, "Formula non può essere null");
        constants = constants == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(constants));
    }
}
