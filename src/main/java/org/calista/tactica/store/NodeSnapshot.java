package org.calista.tactica.store;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.calista.tactica.forest.ProofNode;

import java.util.ArrayList;
import java.util.List;

/** Flat, render-only view of one node as written to the snapshot file. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class NodeSnapshot {
    public long id;
    public Long parent;
    public List<Long> children = new ArrayList<>();
    public String status;
    public String note;
    public String tactic;          // Tactic.describe(), null at roots
    public String path;
    public String justification;
    public String statement;       // rendered
    public long createdAtEpochMs;

    public static NodeSnapshot of(ProofNode n) {
        NodeSnapshot s = new NodeSnapshot();
        s.id = n.id();
        s.parent = n.parent();
        s.children = new ArrayList<>(n.children());
        s.status = n.status().name();
        s.note = n.note();
        s.tactic = n.tactic() == null ? null : n.tactic().describe();
        s.path = n.state().path();
        s.justification = n.state().justification();
        s.statement = n.state().statement().render();
        s.createdAtEpochMs = n.createdAtEpochMs();
        return s;
    }
}
