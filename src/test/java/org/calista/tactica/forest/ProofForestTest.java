package org.calista.tactica.forest;

import org.calista.tactica.proof.ProofState;
import org.calista.tactica.tactic.Tactic;
import org.calista.tactica.term.MathExpression;
import org.calista.tactica.term.MathRelation;
import org.junit.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.Assert.*;

public class ProofForestTest {

    private final ProofState state = ProofState.initial(
            MathRelation.equal(MathExpression.var("a"), MathExpression.var("b")), "p0");

    @Test
    public void idsAreStrictlyIncreasing() {
        ProofForest f = new ProofForest();
        long root = f.addRoot(state, "root");
        long prev = root;
        for (int i = 0; i < 50; i++) {
            long parent = (i % 3 == 0) ? root : prev;
            long id = f.addChild(parent, state, null, "n" + i);
            assertTrue(id > prev);
            prev = id;
        }
        assertEquals(51, f.size());
        assertEquals(0L, root);
    }

    @Test
    public void parentAndChildrenAgree() {
        ProofForest f = new ProofForest();
        long root = f.addRoot(state, "root");
        long x = f.addChild(root, state, null, "x");
        long y = f.addChild(root, state, null, "y");
        long z = f.addChild(x, state, null, "z");

        assertEquals(List.of(x, y), f.get(root).children());
        assertEquals(List.of(z), f.get(x).children());

        for (ProofNode n : f.nodes()) {
            if (n.parent() != null) {
                assertTrue(f.get(n.parent()).children().contains(n.id()));
            }
            for (long child : n.children()) {
                assertEquals(Long.valueOf(n.id()), f.get(child).parent());
            }
        }
    }

    @Test
    public void rootsAreExactlyParentlessNodes() {
        ProofForest f = new ProofForest();
        long r1 = f.addRoot(state, "r1");
        f.addChild(r1, state, null, "c");
        long r2 = f.addNode(null, state, null, "r2", ProofStatus.TODO);

        assertEquals(List.of(r1, r2), f.roots());
        for (ProofNode n : f.nodes()) {
            assertEquals(n.isRoot(), f.roots().contains(n.id()));
        }
        assertEquals(ProofStatus.TODO, f.get(r2).status());
    }

    @Test
    public void getPathEndsAtNodeAndStartsAtRoot() {
        ProofForest f = new ProofForest();
        long root = f.addRoot(state, "root");
        long a = f.addChild(root, state, null, "a");
        long b = f.addChild(a, state, null, "b");
        f.addChild(root, state, null, "side");

        assertEquals(List.of(root, a, b), f.getPath(b));
        assertEquals(List.of(root), f.getPath(root));
    }

    @Test
    public void bookmarkSurvivesLaterInserts() {
        ProofForest f = new ProofForest();
        long root = f.addRoot(state, "root");
        long n = f.addChild(root, state, null, "target");
        f.addBookmark("foo", n);

        long cur = n;
        for (int i = 0; i < 200; i++) cur = f.addChild(cur, state, null, "filler");

        assertEquals(Optional.of(n), f.getBookmark("foo"));
        assertEquals(Optional.empty(), f.getBookmark("bar"));
    }

    @Test
    public void bookmarkIsLastWriterWins() {
        ProofForest f = new ProofForest();
        long root = f.addRoot(state, "root");
        long n = f.addChild(root, state, null, "n");
        f.addBookmark("here", root);
        f.addBookmark("here", n);
        assertEquals(Optional.of(n), f.getBookmark("here"));
    }

    @Test
    public void statusMutatorsOnlyTouchStatus() {
        ProofForest f = new ProofForest();
        long root = f.addRoot(state, "root");
        long n = f.addChild(root, state, null, "n");
        ProofNode before = f.get(n);

        assertEquals(ProofStatus.IN_PROGRESS, before.status());
        f.markWip(n);
        assertEquals(ProofStatus.WIP, f.get(n).status());
        f.markTodo(n);
        assertEquals(ProofStatus.TODO, f.get(n).status());
        f.markAbandoned(n);
        assertEquals(ProofStatus.ABANDONED, f.get(n).status());
        f.markComplete(n);

        ProofNode after = f.get(n);
        assertEquals(ProofStatus.COMPLETE, after.status());
        assertSame(before.state(), after.state());
        assertEquals(before.note(), after.note());
        assertEquals(before.createdAtEpochMs(), after.createdAtEpochMs());
        assertEquals(1, f.nodesWithStatus(ProofStatus.COMPLETE).size());
    }

    @Test(expected = ProofForestException.class)
    public void addingUnderMissingParentIsFatal() {
        ProofForest f = new ProofForest();
        f.addRoot(state, "root");
        f.addChild(42L, state, null, "orphan");
    }

    @Test(expected = ProofForestException.class)
    public void unknownIdIsFatal() {
        new ProofForest().get(3L);
    }

    @Test(expected = ProofForestException.class)
    public void markingUnknownIdIsFatal() {
        new ProofForest().markComplete(0L);
    }

    @Test(expected = ProofForestException.class)
    public void rootStateOfEmptyForestIsFatal() {
        new ProofForest().rootState();
    }

    @Test
    public void listenersSeeEveryMutation() {
        List<String> seen = new ArrayList<>();
        ProofForest f = new ProofForest();
        f.addListener(new ForestListener() {
            @Override
            public void onNodeAdded(ProofNode node) {
                seen.add("add " + node.id());
            }

            @Override
            public void onStatusChanged(ProofNode node, ProofStatus previous) {
                seen.add("status " + node.id() + " " + previous + "->" + node.status());
            }

            @Override
            public void onBookmarked(String name, long nodeId) {
                // listeners may read the forest
                seen.add("mark " + name + " " + f.get(nodeId).note());
            }
        });

        long root = f.addRoot(state, "root");
        f.markWip(root);
        f.addBookmark("start", root);

        assertEquals(List.of("add 0", "status 0 IN_PROGRESS->WIP", "mark start root"), seen);
    }

    @Test
    public void failingListenerDoesNotAbortMutation() {
        List<String> seen = new ArrayList<>();
        ProofForest f = new ProofForest();
        f.addListener(new ForestListener() {
            @Override
            public void onNodeAdded(ProofNode node) {
                throw new UncheckedIOException(new IOException("journal unavailable"));
            }

            @Override
            public void onStatusChanged(ProofNode node, ProofStatus previous) {
                throw new IllegalStateException("boom");
            }
        });
        f.addListener(new ForestListener() {
            @Override
            public void onNodeAdded(ProofNode node) {
                seen.add("add " + node.id());
            }

            @Override
            public void onStatusChanged(ProofNode node, ProofStatus previous) {
                seen.add("status " + node.id());
            }
        });

        long root = f.addRoot(state, "root");
        long child = f.addChild(root, state, null, "child");
        f.markComplete(child);

        assertEquals(2, f.size());
        assertEquals(List.of(child), f.get(root).children());
        assertEquals(ProofStatus.COMPLETE, f.get(child).status());
        assertEquals(List.of("add 0", "add 1", "status 1"), seen);
    }

    @Test
    public void visualizeShowsTreeGlyphsAndBookmarks() {
        ProofForest f = new ProofForest();
        long root = f.addRoot(state, "Initial");
        long child = f.addChild(root, state.withPath("p0_1"),
                new Tactic.Custom("step", List.of(), 1), "first step");
        f.markComplete(child);
        f.addBookmark("done", child);

        String out = f.visualize();

        assertTrue(out.startsWith("Proof Forest:\n"));
        assertTrue(out.contains("→ Node 0 (path: p0) - Initial\n"));
        assertTrue(out.contains("  ✓ Node 1 [Custom step() #1] (path: p0_1) - first step\n"));
        assertTrue(out.contains("Bookmarks:\n  done -> Node 1\n"));
    }
}
