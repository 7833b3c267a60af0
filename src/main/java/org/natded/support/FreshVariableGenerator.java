package org.natded.support;

import java.util.Set;

/**
 * GENERATORE DI VARIABILI FRESCHE - Nomi nuovi per la ridenominazione dei vincoli
 *
 * Dato un nome base b e un insieme di nomi proibiti U, produce il primo nome
 * della sequenza b0, b1, b2, ... che non appartiene a U.
 *
 * PROPRIETÀ:
 * • Deterministico: stessi argomenti, stesso risultato
 * • Totale: U è finito, quindi il contatore trova sempre un nome libero
 * • Senza stato: nessun contatore globale condiviso tra chiamate
 */
public final class FreshVariableGenerator {

    private FreshVariableGenerator() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Restituisce il primo nome {@code base + n} (n = 0, 1, 2, ...) non presente in forbidden.
     *
     * @param base nome di partenza, tipicamente la variabile vincolata da rinominare
     * @param forbidden nomi già in uso (non null)
     * @return nome fresco, mai contenuto in forbidden
     * @throws IllegalArgumentException se base o forbidden null
     */
    public static String fresh(String base, Set<String> forbidden) {
        if (base == null) {
            throw new IllegalArgumentException("Nome base non può essere null");
        }
        if (forbidden == null) {
            throw new IllegalArgumentException("Insieme dei nomi proibiti non può essere null");
        }

        long counter = 0;
        String candidate = base + counter;
        while (forbidden.contains(candidate)) {
            counter++;
            candidate = base + counter;
        }
        return candidate;
    }
}
