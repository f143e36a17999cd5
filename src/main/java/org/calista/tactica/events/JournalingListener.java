package org.calista.tactica.events;

import org.calista.tactica.forest.ForestListener;
import org.calista.tactica.forest.ProofNode;
import org.calista.tactica.forest.ProofStatus;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.Objects;

/**
 * Writes every forest mutation to an {@link EventStore}.
 * I/O failures are thrown as {@link UncheckedIOException}; the forest logs them and keeps going.
 */
public final class JournalingListener implements ForestListener {

    private final EventStore store;
    private final String sessionId;
    private final Clock clock;

    public JournalingListener(EventStore store, String sessionId) {
        this(store, sessionId, Clock.systemUTC());
    }

    public JournalingListener(EventStore store, String sessionId, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.sessionId = sessionId;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void onNodeAdded(ProofNode node) {
        String text = node.tactic() == null ? node.note() : node.tactic().describe();
        ProofEvent e = ProofEvent.of(ProofEvent.NODE_ADDED, sessionId, node.id(), text, clock.millis());
        e.parentId = node.parent();
        e.status = node.status().name();
        e.path = node.state().path();
        write(e);
    }

    @Override
    public void onStatusChanged(ProofNode node, ProofStatus previous) {
        ProofEvent e = ProofEvent.of(ProofEvent.STATUS_CHANGED, sessionId, node.id(), node.note(), clock.millis());
        e.status = node.status().name();
        e.previousStatus = previous == null ? null : previous.name();
        write(e);
    }

    @Override
    public void onBookmarked(String name, long nodeId) {
        ProofEvent e = ProofEvent.of(ProofEvent.BOOKMARKED, sessionId, nodeId, null, clock.millis());
        e.bookmark = name;
        write(e);
    }

    private void write(ProofEvent e) {
        try {
            store.append(e);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to journal " + e.type + " for node " + e.nodeId, ex);
        }
    }
}
