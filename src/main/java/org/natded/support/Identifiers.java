package org.natded.support;

/**
 * CLASSIFICAZIONE IDENTIFICATORI - Regole lessicali condivise sui nomi
 *
 * Il lexer ANTLR decide quali caratteri formano un identificatore; questa classe
 * decide cosa rappresenta un identificatore già riconosciuto, in base al suo
 * primo carattere.
 *
 * REGOLE:
 * • Iniziale minuscola in posizione di termine: variabile
 * • Qualsiasi altra iniziale (maiuscola, ⊥, _): costante
 * • Iniziale maiuscola come variabile quantificata seguita da '(': errore
 *   (si sta quantificando su un nome di predicato)
 * • In posizione di formula un nome che inizia con 'forall' o 'exists' è un
 *   quantificatore: il resto del nome è la variabile vincolata
 *
 * La classificazione usa le categorie Unicode di {@link Character}, quindi vale
 * anche per lettere non ASCII.
 */
public final class Identifiers {

    /** Simbolo canonico del falso nella stampa delle formule */
    public static final String BOTTOM_SYMBOL = "⊥";

    public static final String FORALL_KEYWORD = "forall";
    public static final String EXISTS_KEYWORD = "exists";

    private Identifiers() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * Verifica se un identificatore in posizione di termine denota una variabile.
     *
     * @param name identificatore riconosciuto dal lexer (non vuoto)
     * @return true se il primo carattere è una lettera minuscola
     * @throws IllegalArgumentException se name null o vuoto
     */
    public static boolean isVariableName(String name) {
        requireName(name);
        return Character.isLowerCase(name.codePointAt(0));
    }

    /**
     * Verifica se un identificatore inizia con una lettera maiuscola.
     * I simboli del falso e le lettere senza caso non sono maiuscole.
     *
     * @param name identificatore riconosciuto dal lexer (non vuoto)
     * @return true se il primo carattere è una lettera maiuscola
     * @throws IllegalArgumentException se name null o vuoto
     */
    public static boolean startsUpperCase(String name) {
        requireName(name);
        return Character.isUpperCase(name.codePointAt(0));
    }

    /**
     * Verifica se un identificatore inizia con una parola chiave di quantificatore.
     *
     * @param name identificatore riconosciuto dal lexer (non vuoto)
     * @return true se name inizia con "forall" o "exists"
     * @throws IllegalArgumentException se name null o vuoto
     */
    public static boolean startsWithQuantifierKeyword(String name) {
        requireName(name);
        return name.startsWith(FORALL_KEYWORD) || name.startsWith(EXISTS_KEYWORD);
    }

    /**
     * Rimuove la parola chiave iniziale: "forallx" diventa "x".
     *
     * @param name identificatore che inizia con una parola chiave di quantificatore
     * @return parte del nome che segue la parola chiave (eventualmente vuota)
     * @throws IllegalArgumentException se name non inizia con una parola chiave
     */
    public static String stripQuantifierKeyword(String name) {
        if (!startsWithQuantifierKeyword(name)) {
            throw new IllegalArgumentException("'" + name + "' non inizia con una parola chiave di quantificatore");
        }
        String keyword = name.startsWith(FORALL_KEYWORD) ? FORALL_KEYWORD : EXISTS_KEYWORD;
        return name.substring(keyword.length());
    }

    private static void requireName(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Identificatore non può essere null o vuoto");
        }
    }
}
