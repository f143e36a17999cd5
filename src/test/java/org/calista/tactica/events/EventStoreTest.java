package org.calista.tactica.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.tactica.io.FileIO;
import org.calista.tactica.proof.ProofBranch;
import org.calista.tactica.proof.TheoremBuilder;
import org.calista.tactica.tactic.TacticEngine;
import org.calista.tactica.term.MathExpression;
import org.calista.tactica.term.MathRelation;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.Assert.*;

public class EventStoreTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private EventStore store;

    @Before
    public void setUp() {
        FileIO io = new FileIO(tmp.getRoot().toPath());
        store = new EventStore(io, new ObjectMapper(), io.resolve("journal/events.jsonl"));
    }

    @Test
    public void missingJournalReadsEmpty() throws Exception {
        assertTrue(store.readAll().isEmpty());
    }

    @Test
    public void appendedEventsReadBackInOrder() throws Exception {
        store.append(ProofEvent.of(ProofEvent.NODE_ADDED, "s", 0L, "root", 10L));
        ProofEvent b = ProofEvent.of(ProofEvent.BOOKMARKED, "s", 0L, null, 11L);
        b.bookmark = "start";
        store.append(b);

        List<String> raw = store.readAllRawLines();
        assertEquals(2, raw.size());
        assertFalse("null fields are left out", raw.get(1).contains("\"text\""));

        List<ProofEvent> all = store.readAll();
        assertEquals(ProofEvent.NODE_ADDED, all.get(0).type);
        assertEquals("root", all.get(0).text);
        assertEquals(10L, all.get(0).tsEpochMs);
        assertEquals("start", all.get(1).bookmark);
    }

    @Test
    public void listenerJournalsForestMutations() throws Exception {
        Clock fixed = Clock.fixed(Instant.ofEpochMilli(1_000L), ZoneOffset.UTC);
        MathExpression a = MathExpression.var("a");
        TheoremBuilder tb = new TheoremBuilder("T", MathRelation.equal(a, a), List.of(),
                TacticEngine.standalone(), new JournalingListener(store, "T", fixed), "p0");

        ProofBranch n = tb.initialBranch().introduce("a", a, 1);
        n.markWip();

        List<ProofEvent> all = store.readAll();
        assertEquals(3, all.size());

        ProofEvent root = all.get(0);
        assertEquals(ProofEvent.NODE_ADDED, root.type);
        assertNull(root.parentId);
        assertEquals("Initial state for theorem: T", root.text);
        assertEquals("p0", root.path);

        ProofEvent child = all.get(1);
        assertEquals(Long.valueOf(0L), child.parentId);
        assertEquals("Introduce 'a' := a #1", child.text);
        assertEquals("IN_PROGRESS", child.status);
        assertEquals("p0_1", child.path);

        ProofEvent status = all.get(2);
        assertEquals(ProofEvent.STATUS_CHANGED, status.type);
        assertEquals("WIP", status.status);
        assertEquals("IN_PROGRESS", status.previousStatus);
        assertEquals(1_000L, status.tsEpochMs);
    }
}
