package org.natded.parser;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.TokenStream;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTreeListener;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.natded.antlr.FolFormulaParser;
import org.natded.antlr.FolFormulaParser.AtomicContext;
import org.natded.antlr.FolFormulaParser.ExistentialHeadContext;
import org.natded.antlr.FolFormulaParser.IdentifierContext;
import org.natded.antlr.FolFormulaParser.UniversalHeadContext;
import org.natded.support.Identifiers;

/**
 * CONTROLLI SUI QUANTIFICATORI - Listener eseguito durante il parsing
 *
 * Registrato con {@code addParseListener}, riceve l'uscita di ogni regola
 * appena riconosciuta, quando il token successivo è già visibile ma il resto
 * dell'input non è ancora stato letto. Gli errori partono quindi prima che
 * il corpo del quantificatore venga analizzato.
 *
 * CONTROLLI:
 * • Testa di quantificatore con nome maiuscolo seguito da '(': quantificazione
 *   su un predicato ("forall P(x, y)"), errore sulla parentesi
 * • Atomo che inizia con 'forall' o 'exists' non seguiti da una lettera
 *   ("forall1"): la parola chiave vale come quantificatore e manca il nome
 *   vincolato, errore subito dopo la parola chiave
 */
final class QuantifierHeadListener implements ParseTreeListener {

    private final TokenStream tokens;

    QuantifierHeadListener(TokenStream tokens) {
        this.tokens = tokens;
    }

    /**
     * Nome vincolato da una testa di quantificatore: il nome separato dopo la
     * parola chiave o il simbolo, oppure il resto del token fuso ("forallx").
     *
     * @return nome vincolato, null o vuoto se la testa è incompleta
     */
    static String boundVariable(IdentifierContext identifier, TerminalNode fused) {
        if (fused != null) {
            return Identifiers.stripQuantifierKeyword(fused.getText());
        }
        return identifier == null ? null : identifier.getText();
    }

    @Override
    public void exitEveryRule(ParserRuleContext ctx) {
        if (ctx instanceof UniversalHeadContext head) {
            rejectPredicateBinder(boundVariable(head.identifier(), head.FORALL_BOUND()));
        } else if (ctx instanceof ExistentialHeadContext head) {
            rejectPredicateBinder(boundVariable(head.identifier(), head.EXISTS_BOUND()));
        } else if (ctx instanceof AtomicContext atomic) {
            rejectKeywordPrefix(atomic.IDENTIFIER());
        }
    }

    private void rejectPredicateBinder(String name) {
        if (name == null || name.isEmpty() || !Identifiers.startsUpperCase(name)) {
            return;
        }
        Token next = tokens.LT(1);
        if (next.getType() == FolFormulaParser.LPAR) {
            throw new ParseCancellationException(new ParseException(
                    "Quantificazione non ammessa sul predicato '" + name + "'",
                    next.getStartIndex()));
        }
    }

    private void rejectKeywordPrefix(TerminalNode predicate) {
        if (predicate == null || !Identifiers.startsWithQuantifierKeyword(predicate.getText())) {
            return;
        }
        String name = predicate.getText();
        int keywordLength = name.length() - Identifiers.stripQuantifierKeyword(name).length();
        int keywordEnd = predicate.getSymbol().getStartIndex() + keywordLength;
        throw new ParseCancellationException(new ParseException(
                "Identificatore atteso dopo il quantificatore", keywordEnd));
    }

    @Override
    public void enterEveryRule(ParserRuleContext ctx) {
    }

    @Override
    public void visitTerminal(TerminalNode node) {
    }

    @Override
    public void visitErrorNode(ErrorNode node) {
    }
}
