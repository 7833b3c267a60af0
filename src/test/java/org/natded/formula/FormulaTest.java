package org.natded.formula;

import org.junit.jupiter.api.Test;
import org.natded.term.Constant;
import org.natded.term.FunctionApplication;
import org.natded.term.Term;
import org.natded.term.Variable;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class FormulaTest {

    private static final Variable X = new Variable("x");
    private static final Variable Y = new Variable("y");

    private static AtomicFormula atom(String predicate, Term... args) {
        return new AtomicFormula(predicate, List.of(args));
    }

    //region VARIABILI LIBERE

    @Test
    void freeVariablesOfAtomsAndBottom() {
        assertEquals(Set.of("x", "y"), atom("P", X, new FunctionApplication("f", List.of(Y))).freeVariables());
        assertEquals(Set.of(), atom("p").freeVariables());
        assertEquals(Set.of(), new Bottom().freeVariables());
    }

    @Test
    void quantifierRemovesOnlyItsOwnName() {
        Formula formula = new Universal("x", atom("P", X, Y));
        assertEquals(Set.of("y"), formula.freeVariables());
        assertEquals(Set.of(), new Existential("y", formula).freeVariables());
    }

    @Test
    void connectivesUnionTheirOperands() {
        Formula formula = new Implication(new Universal("x", atom("P", X)), atom("Q", X));
        assertEquals(Set.of("x"), formula.freeVariables());
        assertEquals(Set.of("x", "y"), new Negation(new Disjunction(atom("P", X), atom("Q", Y))).freeVariables());
    }

    @Test
    void freeVariablesReturnsCallerOwnedSet() {
        Formula formula = atom("P", X);
        formula.freeVariables().add("z");
        assertEquals(Set.of("x"), formula.freeVariables());
    }

    //endregion

    //region SOSTITUZIONE

    @Test
    void substitutionRenamesBoundVariableToAvoidCapture() {
        Formula formula = new Universal("y", atom("P", X, Y));
        Term replacement = new FunctionApplication("f", List.of(Y));

        Formula result = formula.substitute("x", replacement);

        assertEquals(new Universal("y0", atom("P", replacement, new Variable("y0"))), result);
        QuantifiedFormula quantified = (QuantifiedFormula) result;
        assertFalse(replacement.variables().contains(quantified.variable()));
    }

    @Test
    void freshNameAvoidsFreeVariablesOfBody() {
        Formula formula = new Existential("y", atom("P", X, Y, new Variable("y0")));

        Formula result = formula.substitute("x", Y);

        assertEquals(new Existential("y1", atom("P", Y, new Variable("y1"), new Variable("y0"))), result);
    }

    @Test
    void substitutionUnderMatchingBinderIsVacuous() {
        Formula formula = new Universal("x", atom("P", X));
        assertSame(formula, formula.substitute("x", new Constant("c")));
    }

    @Test
    void substitutionWithoutCaptureRiskKeepsBoundName() {
        Formula formula = new Existential("y", atom("R", X, Y));
        assertEquals(new Existential("y", atom("R", new Constant("C"), Y)), formula.substitute("x", new Constant("C")));
    }

    @Test
    void substitutionOfNonFreeVariableIsIdentity() {
        Formula formula = new Conjunction(atom("P", Y), new Universal("x", atom("Q", X)));
        assertEquals(formula, formula.substitute("z", new Variable("w")));
        assertEquals(formula, formula.substitute("x", Y));
    }

    @Test
    void substitutionRecursesThroughEveryConnective() {
        Formula formula = new Implication(
                new Negation(atom("P", X)),
                new Disjunction(new Bottom(), new Conjunction(atom("Q", X), atom("q"))));
        Constant c = new Constant("C");

        Formula expected = new Implication(
                new Negation(atom("P", c)),
                new Disjunction(new Bottom(), new Conjunction(atom("Q", c), atom("q"))));
        assertEquals(expected, formula.substitute("x", c));
    }

    @Test
    void substitutionDoesNotMutateOriginal() {
        Formula formula = new Universal("y", atom("P", X, Y));
        String before = formula.toString();
        formula.substitute("x", Y);
        assertEquals(before, formula.toString());
    }

    //endregion

    //region LIBERO PER

    @Test
    void atomsAndBottomAreAlwaysFreeFor() {
        assertTrue(atom("P", X).isFreeFor(Y, "x"));
        assertTrue(new Bottom().isFreeFor(Y, "x"));
    }

    @Test
    void termMentioningBinderIsNotFreeForVariableFreeInBody() {
        Formula formula = new Universal("y", atom("P", X, Y));
        assertFalse(formula.isFreeFor(Y, "x"));
        assertFalse(formula.isFreeFor(new FunctionApplication("f", List.of(Y)), "x"));
        assertTrue(formula.isFreeFor(new Variable("z"), "x"));
    }

    @Test
    void termMentioningBinderIsFreeWhenVariableDoesNotOccur() {
        assertTrue(new Universal("y", atom("P", Y)).isFreeFor(Y, "x"));
    }

    @Test
    void matchingBinderMakesSubstitutionVacuouslyFree() {
        assertTrue(new Existential("x", atom("P", X, Y)).isFreeFor(Y, "x"));
    }

    @Test
    void connectivesRequireEveryOperand() {
        Formula formula = new Conjunction(atom("P", X), new Existential("y", atom("Q", X, Y)));
        assertFalse(formula.isFreeFor(Y, "x"));
        assertFalse(new Negation(formula).isFreeFor(Y, "x"));
        assertTrue(new Implication(atom("P", X), atom("Q", X)).isFreeFor(Y, "x"));
    }

    @Test
    void nestedBinderIsInspected() {
        Formula formula = new Universal("z", new Existential("y", atom("R", X, Y)));
        assertFalse(formula.isFreeFor(Y, "x"));
    }

    //endregion

    //region UGUAGLIANZA E STAMPA

    @Test
    void structuralEqualityAndHash() {
        Formula a = new Conjunction(atom("p"), atom("q"));
        Formula b = new Conjunction(atom("p"), atom("q"));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertNotEquals(a, new Conjunction(atom("q"), atom("p")));
        assertNotEquals(a, new Disjunction(atom("p"), atom("q")));
        assertNotEquals(new Universal("x", atom("p")), new Existential("x", atom("p")));
        assertEquals(new Bottom(), new Bottom());
        assertEquals(new Bottom().hashCode(), new Bottom().hashCode());
        assertEquals(atom("P"), new AtomicFormula("P"));
    }

    @Test
    void canonicalPrinting() {
        assertEquals("P(x, y)", atom("P", X, Y).toString());
        assertEquals("p", atom("p").toString());
        assertEquals("⊥", new Bottom().toString());
        assertEquals("(p ∧ q)", new Conjunction(atom("p"), atom("q")).toString());
        assertEquals("(p ∨ q)", new Disjunction(atom("p"), atom("q")).toString());
        assertEquals("(p → q)", new Implication(atom("p"), atom("q")).toString());
        assertEquals("¬p", new Negation(atom("p")).toString());
        assertEquals("¬((p ∧ q))", new Negation(new Conjunction(atom("p"), atom("q"))).toString());
        assertEquals("¬¬p", new Negation(new Negation(atom("p"))).toString());
        assertEquals("∀x.∃y.R(x, y)", new Universal("x", new Existential("y", atom("R", X, Y))).toString());
    }

    @Test
    void quantifierOnTheLeftOfConnectiveIsParenthesized() {
        Formula formula = new Implication(new Universal("x", atom("P", X)), atom("Q", X));
        assertEquals("((∀x.P(x)) → Q(x))", formula.toString());

        Formula negated = new Conjunction(new Negation(new Existential("x", atom("P", X))), atom("q"));
        assertEquals("((¬∃x.P(x)) ∧ q)", negated.toString());

        Formula right = new Conjunction(atom("q"), new Existential("x", atom("P", X)));
        assertEquals("(q ∧ ∃x.P(x))", right.toString());
    }

    //endregion
}
