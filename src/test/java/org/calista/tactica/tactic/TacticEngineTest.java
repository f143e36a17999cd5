package org.calista.tactica.tactic;

import org.calista.tactica.proof.BoundVariable;
import org.calista.tactica.proof.ProofState;
import org.calista.tactica.proof.Theorem;
import org.calista.tactica.term.MathExpression;
import org.calista.tactica.term.MathObjectType;
import org.calista.tactica.term.MathRelation;
import org.calista.tactica.term.Position;
import org.calista.tactica.term.TypeView;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.calista.tactica.term.MathExpression.add;
import static org.calista.tactica.term.MathExpression.var;
import static org.junit.Assert.*;

public class TacticEngineTest {

    private final MathExpression a = var("a");
    private final MathExpression b = var("b");
    private final MathExpression c = var("c");

    private final ProofState start = ProofState.initial(MathRelation.equal(add(a, b), c), "p0");

    @Test
    public void introduceBindsVariableAndKeepsStatement() {
        TypeView g = TypeView.of(TypeView.Kind.AS_GROUP_ELEMENT);
        ProofState out = new Tactic.Introduce("x", a, g, 1).apply(start);

        assertEquals(start.statement(), out.statement());
        assertEquals(1, out.variables().size());
        BoundVariable x = out.variables().get(0);
        assertEquals("x", x.name());
        assertEquals(MathExpression.viewAs(a, g), x.value());
        assertEquals(MathObjectType.GROUP_ELEMENT, x.type());
        assertEquals("Introduced variable 'x' of type GROUP_ELEMENT", out.justification());
        assertEquals("p0_1", out.path());
        // origin untouched
        assertTrue(start.variables().isEmpty());
    }

    @Test
    public void introduceWithoutViewClassifiesExpression() {
        ProofState out = new Tactic.Introduce("s", add(a, b), null, 1).apply(start);
        assertEquals(MathObjectType.OPERATION, out.variables().get(0).type());
        assertEquals(add(a, b), out.variables().get(0).value());
    }

    @Test
    public void substituteReplacesFirstOccurrence() {
        ProofState out = new Tactic.Substitute(b, c, null, 1).apply(start);

        assertEquals(MathRelation.equal(add(a, c), c), out.statement());
        assertEquals("Substituted b with c at [0, 1]", out.justification());
        assertEquals("p0_1", out.path());
    }

    @Test
    public void substituteAtExplicitPosition() {
        ProofState s = ProofState.initial(MathRelation.equal(a, a), "p0");
        ProofState out = new Tactic.Substitute(a, b, Position.of(1), 1).apply(s);
        assertEquals(MathRelation.equal(a, b), out.statement());
    }

    @Test
    public void substituteMissIsSoftAndIdempotent() {
        Tactic miss = new Tactic.Substitute(var("z"), c, null, 1);

        ProofState once = miss.apply(start);
        ProofState twice = miss.apply(once);

        assertEquals(start.statement(), once.statement());
        assertEquals(start.statement(), twice.statement());
        assertEquals("Substitution pattern not found: z", once.justification());
        assertNotEquals(start.justification(), once.justification());
        assertEquals("p0", once.path());
    }

    @Test
    public void substituteWithWrongPositionIsSoftFailure() {
        ProofState out = new Tactic.Substitute(a, c, Position.of(1), 1).apply(start);
        assertEquals(start.statement(), out.statement());
        assertTrue(out.justification().startsWith("Substitution pattern not found"));
    }

    @Test
    public void rewriteForwardUsesRightSide() {
        MathExpression eq = MathExpression.of(MathRelation.equal(a, b));
        ProofState s = ProofState.initial(MathRelation.equal(add(a, c), c), "p0");

        ProofState out = new Tactic.Rewrite(a, eq, RewriteDirection.FORWARD, null, 1).apply(s);

        assertEquals(MathRelation.equal(add(b, c), c), out.statement());
        assertEquals("Rewrote a using [a = b] (forward)", out.justification());
    }

    @Test
    public void rewriteBackwardUsesLeftSide() {
        MathExpression eq = MathExpression.of(MathRelation.equal(a, b));
        ProofState s = ProofState.initial(MathRelation.equal(add(b, c), c), "p0");

        ProofState out = new Tactic.Rewrite(b, eq, RewriteDirection.BACKWARD, null, 1).apply(s);

        assertEquals(MathRelation.equal(add(a, c), c), out.statement());
    }

    @Test
    public void rewriteWithNonEquationSubstitutesWholeExpression() {
        MathExpression notAnEquation = add(b, b);
        ProofState out = new Tactic.Rewrite(c, notAnEquation, RewriteDirection.FORWARD, null, 1).apply(start);
        assertEquals(MathRelation.equal(add(a, b), add(b, b)), out.statement());
    }

    @Test
    public void rewriteTargetMissIsSoftFailure() {
        MathExpression eq = MathExpression.of(MathRelation.equal(a, b));
        ProofState out = new Tactic.Rewrite(var("q"), eq, RewriteDirection.FORWARD, null, 1).apply(start);

        assertEquals(start.statement(), out.statement());
        assertEquals("Rewrite target not found: q", out.justification());
    }

    @Test
    public void applyTheoremUnknownIdIsSoftFailure() {
        ProofState out = new Tactic.ApplyTheorem("thm_missing", Map.of(), null, 1).apply(start);

        assertEquals(start.statement(), out.statement());
        assertEquals("Could not apply theorem 'thm_missing'", out.justification());
    }

    @Test
    public void applyTheoremRegisteredKeepsStatement() {
        InMemoryTheoremRegistry registry = new InMemoryTheoremRegistry();
        registry.register(Theorem.of("add comm", ProofState.initial(MathRelation.equal(add(a, b), add(b, a)), null)));

        ProofState out = new Tactic.ApplyTheorem("thm_add_comm", Map.of("x", a, "y", b), null, 1)
                .apply(start, registry);

        assertEquals(start.statement(), out.statement());
        assertEquals("Applied theorem 'thm_add_comm' with 2 instantiations", out.justification());
        assertEquals("p0_1", out.path());
    }

    @Test
    public void applyTheoremMissingTargetIsSoftFailure() {
        InMemoryTheoremRegistry registry = new InMemoryTheoremRegistry();
        registry.register(Theorem.of("t", start));

        ProofState out = new Tactic.ApplyTheorem("thm_t", Map.of(), var("zz"), 1).apply(start, registry);

        assertEquals("Could not apply theorem 'thm_t' to the target expression", out.justification());
    }

    @Test
    public void caseAnalysisOnlyRecordsMetadata() {
        ProofState out = new Tactic.CaseAnalysis(a, List.of(), List.of("even", "odd"), 1).apply(start);

        assertEquals(start.statement(), out.statement());
        assertEquals("Case analysis on a with 2 cases: even, odd", out.justification());
    }

    @Test
    public void placeholderTacticsOnlyJustify() {
        ProofState s1 = new Tactic.Simplify(a, List.of("ring"), 1).apply(start);
        ProofState s2 = new Tactic.Decompose(add(a, b), DecompositionMethod.FACTOR, null, 2).apply(start);
        ProofState s3 = new Tactic.Induction("n", InductionType.NATURAL, null, null, 3).apply(start);
        ProofState s4 = new Tactic.Custom("norm_num", List.of("a", "b"), 4).apply(start);

        for (ProofState s : List.of(s1, s2, s3, s4)) {
            assertEquals(start.statement(), s.statement());
        }
        assertEquals("Simplified expression: a with hints: ring", s1.justification());
        assertEquals("Decomposed expression '(a + b)' using factoring method", s2.justification());
        assertEquals("Applied mathematical induction on variable 'n'", s3.justification());
        assertEquals("Applied custom tactic 'norm_num' with arguments: a, b", s4.justification());
    }

    @Test
    public void otherMethodUsesDetail() {
        ProofState out = new Tactic.Decompose(a, DecompositionMethod.OTHER, "partial fractions", 1).apply(start);
        assertEquals("Decomposed expression 'a' using partial fractions method", out.justification());
    }

    @Test
    public void describeIsStableAndCarriesParameters() {
        Tactic t = new Tactic.Rewrite(a, MathExpression.of(MathRelation.equal(a, b)),
                RewriteDirection.BACKWARD, Position.of(0, 0), 7);

        assertEquals("Rewrite a using [a = b] (←) at [0, 0] #7", t.describe());
        assertEquals(t.describe(), TacticEngine.describe(t));

        Tactic inst = new Tactic.ApplyTheorem("thm", Map.of("y", b, "x", a), null, 2);
        assertEquals("Apply theorem 'thm' with {x ↦ a, y ↦ b} #2", inst.describe());
    }

    @Test
    public void applyNeverMutatesInput() {
        ProofState before = start;
        new Tactic.Substitute(a, b, null, 1).apply(start);
        new Tactic.Introduce("x", a, null, 2).apply(start);
        assertEquals(before, start);
        assertTrue(start.variables().isEmpty());
        assertNull(start.justification());
    }
}
