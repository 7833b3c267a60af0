package org.natded.term;

import java.util.Set;

/**
 * TERMINE DEL PRIMO ORDINE - Variante chiusa {Variable, Constant, FunctionApplication}
 *
 * Ogni variante è un record immutabile: uguaglianza e hash sono strutturali e
 * includono il tipo della variante, quindi {@code Variable("x")} e
 * {@code Constant("x")} sono diversi.
 *
 * OPERAZIONI:
 * • variables(): tutti i nomi di variabile che compaiono nel termine
 * • substitute(var, replacement): copia con ogni occorrenza di var sostituita
 * • toString(): stampa canonica, {@code name} oppure {@code f(a1, ..., an)}
 */
public sealed interface Term permits Variable, Constant, FunctionApplication {

    /**
     * Insieme dei nomi di variabile del termine.
     *
     * @return nuovo insieme modificabile, di proprietà del chiamante
     */
    Set<String> variables();

    /**
     * Sostituisce ogni occorrenza della variabile var con replacement.
     * Operazione totale: costanti e variabili diverse restano invariate.
     *
     * @param var nome della variabile da sostituire
     * @param replacement termine da inserire al suo posto
     * @return termine risultante (può essere this se nulla cambia)
     */
    Term substitute(String var, Term replacement);
}
