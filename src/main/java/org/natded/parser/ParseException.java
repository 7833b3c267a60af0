package org.natded.parser;

/**
 * Errore di parsing di una formula o di un termine.
 *
 * Porta un messaggio leggibile e la posizione (indice di code point, a partire
 * da 0) del punto in cui l'analisi si è fermata. Lo stesso input fallisce
 * sempre nella stessa posizione con lo stesso messaggio.
 */
public class ParseException extends Exception {

    private final int offset;

    public ParseException(String message, int offset) {
        super(message + " (posizione " + offset + ")");
        this.offset = offset;
    }

    /**
     * @return posizione nell'input del token o carattere che ha causato l'errore
     */
    public int getOffset() {
        return offset;
    }
}
