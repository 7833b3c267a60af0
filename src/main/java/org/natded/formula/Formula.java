package org.natded.formula;

import org.natded.term.Term;

import java.util.Set;

/**
 * FORMULA LOGICA - Variante chiusa delle formule proposizionali e del primo ordine
 *
 * VARIANTI:
 * • {@link AtomicFormula}: predicato con argomenti (zero argomenti = atomo proposizionale)
 * • {@link Bottom}: il falso ⊥
 * • {@link Negation}: ¬φ
 * • {@link BinaryFormula}: {@link Conjunction}, {@link Disjunction}, {@link Implication}
 * • {@link QuantifiedFormula}: {@link Universal}, {@link Existential}
 *
 * INVARIANTI:
 * • Albero immutabile senza condivisione né cicli: sostituzione e ridenominazione
 *   costruiscono sempre nuovi nodi
 * • Uguaglianza e hash strutturali, ricorsivi, comprensivi del tipo di variante
 * • toString() produce la forma canonica rileggibile dal parser
 */
public sealed interface Formula permits AtomicFormula, Bottom, Negation, BinaryFormula, QuantifiedFormula {

    /**
     * Variabili libere: nomi che compaiono in posizione di termine senza essere
     * vincolati da un quantificatore che lega lo stesso nome.
     *
     * @return nuovo insieme modificabile, di proprietà del chiamante
     */
    Set<String> freeVariables();

    /**
     * Sostituzione senza cattura del termine term al posto della variabile var.
     *
     * Le variabili vincolate che comparirebbero in term vengono rinominate
     * con un nome fresco prima di scendere nel corpo del quantificatore.
     *
     * @param var variabile da sostituire
     * @param term termine da inserire
     * @return nuova formula (o this quando la sostituzione è vacua)
     */
    Formula substitute(String var, Term term);

    /**
     * Verifica se term è libero per var in questa formula, cioè se la
     * sostituzione ingenua non catturerebbe alcuna variabile di term.
     *
     * @param term termine candidato
     * @param var variabile da sostituire
     * @return true se nessuna variabile di term finirebbe sotto un vincolo
     */
    boolean isFreeFor(Term term, String var);
}
