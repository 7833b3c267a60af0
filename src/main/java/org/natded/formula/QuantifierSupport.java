package org.natded.formula;

import org.natded.support.FreshVariableGenerator;
import org.natded.term.Term;
import org.natded.term.Variable;

import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * SUPPORTO QUANTIFICATORI - Sostituzione senza cattura sotto ∀ e ∃
 *
 * Per Q(y, φ).substitute(var, t):
 * 1. var == y: nessuna occorrenza libera di var nel campo d'azione, formula invariata
 * 2. y compare in t: la sostituzione ingenua legherebbe la y di t. Si sceglie
 *    y' fresco rispetto a vars(t) ∪ FV(φ), si rinomina y in y' dentro φ e poi si
 *    sostituisce var con t nel corpo rinominato
 * 3. altrimenti: nessun rischio di cattura, si scende nel corpo
 *
 * La condizione di cattura confronta sempre il nome vincolato originale y con le
 * variabili del termine sostituito, non con var.
 */
final class QuantifierSupport {

    private static final Logger LOGGER = Logger.getLogger(QuantifierSupport.class.getName());

    private QuantifierSupport() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    static Formula substitute(QuantifiedFormula quantified, String var, Term term) {
        String bound = quantified.variable();
        Formula body = quantified.formula();

        if (var.equals(bound)) {
            return quantified;
        }

        Set<String> termVariables = term.variables();
        if (termVariables.contains(bound)) {
            Set<String> forbidden = termVariables;
            forbidden.addAll(body.freeVariables());
            String renamed = FreshVariableGenerator.fresh(bound, forbidden);

            if (LOGGER.isLoggable(Level.FINEST)) {
                LOGGER.finest(String.format("Ridenominazione vincolo %s%s -> %s per sostituire %s con %s",
                        quantified.symbol(), bound, renamed, var, term));
            }

            Formula renamedBody = body.substitute(bound, new Variable(renamed));
            return quantified.rebind(renamed, renamedBody.substitute(var, term));
        }

        return quantified.rebind(bound, body.substitute(var, term));
    }

    static boolean isFreeFor(QuantifiedFormula quantified, Term term, String var) {
        String bound = quantified.variable();
        Formula body = quantified.formula();

        if (var.equals(bound)) {
            return true; // sostituzione vacua
        }
        if (term.variables().contains(bound)) {
            // term verrebbe inserito sotto il vincolo di bound
            return !body.freeVariables().contains(var);
        }
        return body.isFreeFor(term, var);
    }
}
