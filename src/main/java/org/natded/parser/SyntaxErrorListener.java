package org.natded.parser;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.LexerNoViableAltException;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/**
 * LISTENER ERRORI DI SINTASSI - Interrompe lexer e parser al primo errore
 *
 * Il recupero automatico di ANTLR continuerebbe a costruire un albero parziale;
 * qui ogni segnalazione diventa una {@link ParseException} immediata, trasportata
 * fuori dal parser dentro una {@link ParseCancellationException}.
 *
 * POSIZIONE DELL'ERRORE:
 * • errori del parser: indice di inizio del token incriminato (EOF = lunghezza input)
 * • errori del lexer: indice del primo carattere non riconosciuto
 */
final class SyntaxErrorListener extends BaseErrorListener {

    static final SyntaxErrorListener INSTANCE = new SyntaxErrorListener();

    private SyntaxErrorListener() {
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                            int line, int charPositionInLine, String msg, RecognitionException e) {
        int offset = charPositionInLine;
        if (offendingSymbol instanceof Token token) {
            offset = token.getStartIndex();
        } else if (e instanceof LexerNoViableAltException lexerError) {
            offset = lexerError.getStartIndex();
        }

        throw new ParseCancellationException(new ParseException("Errore di sintassi: " + msg, offset));
    }
}
