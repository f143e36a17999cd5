package org.calista.tactica.forest;

import org.calista.tactica.proof.ProofState;
import org.calista.tactica.tactic.Tactic;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ProofNode: one immutable snapshot of a node in the forest.
 *
 * <p>The forest replaces the stored instance when a child is appended or the status changes;
 * {@link #state()} is the same object for the whole life of the node.</p>
 *
 * @param parent null for roots
 * @param tactic the step that produced this node; null only for roots
 * @param note   free text, never null
 */
public record ProofNode(long id,
                        Long parent,
                        List<Long> children,
                        ProofState state,
                        Tactic tactic,
                        ProofStatus status,
                        String note,
                        long createdAtEpochMs) {

    public ProofNode {
        children = children == null ? List.of() : List.copyOf(children);
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(status, "status");
        note = note == null ? "" : note;
    }

    public boolean isRoot() {
        return parent == null;
    }

    ProofNode withChild(long childId) {
        ArrayList<Long> next = new ArrayList<>(children.size() + 1);
        next.addAll(children);
        next.add(childId);
        return new ProofNode(id, parent, next, state, tactic, status, note, createdAtEpochMs);
    }

    ProofNode withStatus(ProofStatus newStatus) {
        return new ProofNode(id, parent, children, state, tactic, newStatus, note, createdAtEpochMs);
    }
}
