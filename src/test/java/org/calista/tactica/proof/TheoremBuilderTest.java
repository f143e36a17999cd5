package org.calista.tactica.proof;

import org.calista.tactica.forest.ForestListener;
import org.calista.tactica.forest.ProofForestException;
import org.calista.tactica.forest.ProofNode;
import org.calista.tactica.forest.ProofStatus;
import org.calista.tactica.tactic.TacticEngine;
import org.calista.tactica.term.MathExpression;
import org.calista.tactica.term.MathRelation;
import org.junit.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

import static org.calista.tactica.term.MathExpression.add;
import static org.calista.tactica.term.MathExpression.var;
import static org.junit.Assert.*;

public class TheoremBuilderTest {

    private final MathExpression a = var("a");
    private final MathExpression b = var("b");
    private final MathRelation stmt = MathRelation.equal(add(a, b), add(b, a));

    @Test
    public void seedsSingleRoot() {
        TheoremBuilder tb = new TheoremBuilder("Addition is commutative", stmt,
                List.of(MathRelation.custom("ring", var("R"))));

        assertEquals(1, tb.forest().size());
        assertEquals(1, tb.forest().roots().size());
        assertEquals(stmt, tb.forest().rootState().statement());
        assertEquals("p0", tb.forest().rootState().path());
        assertEquals("Initial state for theorem: Addition is commutative",
                tb.forest().get(tb.forest().roots().get(0)).note());
        assertEquals(1, tb.assumptions().size());
    }

    @Test
    public void buildProducesArtifact() {
        TheoremBuilder tb = new TheoremBuilder("Addition is commutative", stmt, List.of());
        tb.initialBranch().introduce("a", a, 1).markComplete();

        Theorem t = tb.build();

        assertEquals("thm_addition_is_commutative", t.id());
        assertEquals("Addition is commutative", t.name());
        assertEquals("Theorem: Addition is commutative", t.description());
        assertEquals(stmt, t.initialProofState().statement());
        assertEquals("p0", t.initialProofState().path());
        assertNull(t.initialProofState().justification());
        assertEquals(1, tb.completedNodes().size());
    }

    @Test
    public void branchAtUsesNodeLabel() {
        TheoremBuilder tb = new TheoremBuilder("T", stmt, List.of());
        ProofBranch n = tb.initialBranch().introduce("a", a, 1).introduce("b", b, 2);

        ProofBranch again = tb.branchAt(n.nodeId());

        assertEquals(n.nodeId(), again.nodeId());
        assertEquals("p2", again.pathLabel());
        assertEquals(n.state(), again.state());
    }

    @Test
    public void branchAtBookmark() {
        TheoremBuilder tb = new TheoremBuilder("T", stmt, List.of());
        ProofBranch n = tb.initialBranch().introduce("a", a, 1).bookmark("intro");

        assertEquals(n.nodeId(), tb.branchAtBookmark("intro").orElseThrow().nodeId());
        assertFalse(tb.branchAtBookmark("missing").isPresent());
    }

    @Test(expected = ProofForestException.class)
    public void branchAtUnknownNodeIsFatal() {
        new TheoremBuilder("T", stmt, List.of()).branchAt(99L);
    }

    @Test
    public void abandonedPathsStayInForest() {
        TheoremBuilder tb = new TheoremBuilder("T", stmt, List.of());
        ProofBranch root = tb.initialBranch();
        root.introduce("x", var("x"), 1).markAbandoned();
        root.branch().introduce("a", a, 1).markComplete();

        assertEquals(3, tb.forest().size());
        assertEquals(1, tb.forest().nodesWithStatus(ProofStatus.ABANDONED).size());
        assertEquals(1, tb.completedNodes().size());
    }

    @Test
    public void failingJournalStillReturnsCursor() {
        ForestListener broken = new ForestListener() {
            @Override
            public void onNodeAdded(ProofNode node) {
                throw new UncheckedIOException(new IOException("disk full"));
            }
        };
        TheoremBuilder tb = new TheoremBuilder("T", stmt, List.of(), TacticEngine.standalone(), broken, "p0");

        ProofBranch next = tb.initialBranch().introduce("a", a, 1);

        assertEquals(2, tb.forest().size());
        assertEquals(Long.valueOf(0L), next.node().parent());
        assertEquals("p0_1", next.pathLabel());
    }

    @Test
    public void idLowercasesAndJoinsWords() {
        assertEquals("thm_square_parity", Theorem.idFor("Square Parity"));
    }
}
