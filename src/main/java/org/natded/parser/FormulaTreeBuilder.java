package org.natded.parser;

import org.natded.antlr.FolFormulaBaseVisitor;
import org.natded.antlr.FolFormulaParser.ArgumentsContext;
import org.natded.antlr.FolFormulaParser.AtomicContext;
import org.natded.antlr.FolFormulaParser.BottomContext;
import org.natded.antlr.FolFormulaParser.ConjunctionContext;
import org.natded.antlr.FolFormulaParser.DisjunctionContext;
import org.natded.antlr.FolFormulaParser.ExistentialContext;
import org.natded.antlr.FolFormulaParser.ExistentialHeadContext;
import org.natded.antlr.FolFormulaParser.FormulaContext;
import org.natded.antlr.FolFormulaParser.ImplicationContext;
import org.natded.antlr.FolFormulaParser.NotContext;
import org.natded.antlr.FolFormulaParser.ParenthesizedContext;
import org.natded.antlr.FolFormulaParser.ParseContext;
import org.natded.antlr.FolFormulaParser.PositiveContext;
import org.natded.antlr.FolFormulaParser.TermContext;
import org.natded.antlr.FolFormulaParser.UniversalContext;
import org.natded.antlr.FolFormulaParser.UniversalHeadContext;
import org.natded.formula.AtomicFormula;
import org.natded.formula.Bottom;
import org.natded.formula.Conjunction;
import org.natded.formula.Disjunction;
import org.natded.formula.Existential;
import org.natded.formula.Formula;
import org.natded.formula.Implication;
import org.natded.formula.Negation;
import org.natded.formula.Universal;
import org.natded.support.Identifiers;
import org.natded.term.Constant;
import org.natded.term.FunctionApplication;
import org.natded.term.Term;
import org.natded.term.Variable;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * COSTRUTTORE ALBERO FORMULE - Visitor dall'albero sintattico ANTLR all'AST immutabile
 *
 * Ogni metodo visit gestisce un livello di precedenza della grammatica
 * FolFormula e costruisce i nodi dal basso verso l'alto.
 *
 * ASSOCIATIVITÀ:
 * • Implicazione: ricorsione sulla regola stessa, quindi a destra
 * • Disgiunzione e congiunzione: piegatura da sinistra degli operandi
 *
 * TERMINI:
 * • Identificatore con argomenti: applicazione di funzione
 * • Iniziale minuscola: variabile
 * • Altrimenti: costante, registrata fra le costanti incontrate
 *
 * I controlli sui quantificatori avvengono già durante il parsing
 * ({@link QuantifierHeadListener}); qui si estrae solo il nome vincolato.
 *
 * Un'istanza serve un solo parsing: le costanti incontrate si accumulano
 * nell'istanza.
 */
final class FormulaTreeBuilder extends FolFormulaBaseVisitor<Formula> {

    private static final Logger LOGGER = Logger.getLogger(FormulaTreeBuilder.class.getName());

    /** Costanti incontrate, in ordine di prima apparizione */
    private final Set<String> constants = new LinkedHashSet<>();

    Set<String> getConstants() {
        return constants;
    }

    //region FORMULA E CONNETTIVI BINARI

    @Override
    public Formula visitParse(ParseContext ctx) {
        return visit(ctx.formula());
    }

    @Override
    public Formula visitFormula(FormulaContext ctx) {
        return visit(ctx.implication());
    }

    /**
     * A -> B -> C è letto come A -> (B -> C): il conseguente è a sua volta
     * una regola implication.
     */
    @Override
    public Formula visitImplication(ImplicationContext ctx) {
        Formula antecedent = visit(ctx.disjunction());
        if (ctx.implication() == null) {
            return antecedent;
        }
        return new Implication(antecedent, visit(ctx.implication()));
    }

    @Override
    public Formula visitDisjunction(DisjunctionContext ctx) {
        Formula result = visit(ctx.conjunction(0));
        for (int i = 1; i < ctx.conjunction().size(); i++) {
            result = new Disjunction(result, visit(ctx.conjunction(i)));
        }
        return result;
    }

    @Override
    public Formula visitConjunction(ConjunctionContext ctx) {
        Formula result = visit(ctx.negation(0));
        for (int i = 1; i < ctx.negation().size(); i++) {
            result = new Conjunction(result, visit(ctx.negation(i)));
        }
        return result;
    }

    //endregion

    //region NEGAZIONE E FORMULE PRIMARIE

    @Override
    public Formula visitNot(NotContext ctx) {
        return new Negation(visit(ctx.negation()));
    }

    @Override
    public Formula visitPositive(PositiveContext ctx) {
        return visit(ctx.primary());
    }

    @Override
    public Formula visitParenthesized(ParenthesizedContext ctx) {
        return visit(ctx.formula());
    }

    @Override
    public Formula visitUniversal(UniversalContext ctx) {
        UniversalHeadContext head = ctx.universalHead();
        String variable = QuantifierHeadListener.boundVariable(head.identifier(), head.FORALL_BOUND());
        return new Universal(variable, visit(ctx.formula()));
    }

    @Override
    public Formula visitExistential(ExistentialContext ctx) {
        ExistentialHeadContext head = ctx.existentialHead();
        String variable = QuantifierHeadListener.boundVariable(head.identifier(), head.EXISTS_BOUND());
        return new Existential(variable, visit(ctx.formula()));
    }

    @Override
    public Formula visitBottom(BottomContext ctx) {
        return new Bottom();
    }

    /**
     * Predicato con argomenti o atomo proposizionale; il caso del nome è
     * irrilevante in posizione di formula.
     */
    @Override
    public Formula visitAtomic(AtomicContext ctx) {
        String predicate = ctx.IDENTIFIER().getText();
        return new AtomicFormula(predicate, buildArguments(ctx.arguments()));
    }

    //endregion

    //region TERMINI

    /**
     * Costruisce un termine dal contesto sintattico corrispondente.
     */
    Term buildTerm(TermContext ctx) {
        String name = ctx.identifier().getText();

        if (ctx.arguments() != null) {
            return new FunctionApplication(name, buildArguments(ctx.arguments()));
        }
        if (Identifiers.isVariableName(name)) {
            return new Variable(name);
        }

        if (constants.add(name)) {
            LOGGER.finest("Nuova costante incontrata: " + name);
        }
        return new Constant(name);
    }

    private List<Term> buildArguments(ArgumentsContext ctx) {
        if (ctx == null) {
            return List.of();
        }
        List<Term> arguments = new ArrayList<>(ctx.term().size());
        for (TermContext termCtx : ctx.term()) {
            arguments.add(buildTerm(termCtx));
        }
        return arguments;
    }

    //endregion
}
