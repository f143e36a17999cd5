// TheoremBuilder.java
package org.calista.tactica.proof;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.tactica.forest.ForestListener;
import org.calista.tactica.forest.ProofForest;
import org.calista.tactica.forest.ProofForestException;
import org.calista.tactica.forest.ProofNode;
import org.calista.tactica.forest.ProofStatus;
import org.calista.tactica.tactic.InMemoryTheoremRegistry;
import org.calista.tactica.tactic.TacticEngine;
import org.calista.tactica.term.MathRelation;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * TheoremBuilder: entry point of a proving session.
 *
 * <p>
 * Lifecycle:
 * 1) constructor seeds a fresh forest with one root holding the statement
 * 2) callers explore from {@link #initialBranch()} (and {@link #branchAt(long)})
 * 3) {@link #build()} scans for completed nodes and returns the {@link Theorem}
 * </p>
 *
 * <p>The theorem does not carry the derivation; completed nodes are only reported.</p>
 */
public final class TheoremBuilder {

    private static final Logger log = LogManager.getLogger(TheoremBuilder.class);

    private final String name;
    private final MathRelation statement;
    private final List<MathRelation> assumptions;
    private final ProofForest forest;
    private final TacticEngine engine;
    private final String rootLabel;

    public TheoremBuilder(String name, MathRelation statement, List<MathRelation> assumptions) {
        this(name, statement, assumptions, new TacticEngine(new InMemoryTheoremRegistry()), null, PathLabels.ROOT);
    }

    /**
     * @param listener  optional forest observer, attached before the root is inserted
     * @param rootLabel display label of the root, normally {@code p0}
     */
    public TheoremBuilder(String name,
                          MathRelation statement,
                          List<MathRelation> assumptions,
                          TacticEngine engine,
                          ForestListener listener,
                          String rootLabel) {
        this.name = Objects.requireNonNull(name, "name");
        this.statement = Objects.requireNonNull(statement, "statement");
        this.assumptions = assumptions == null ? List.of() : List.copyOf(assumptions);
        this.engine = Objects.requireNonNull(engine, "engine");
        this.rootLabel = (rootLabel == null || rootLabel.isBlank()) ? PathLabels.ROOT : rootLabel.trim();

        this.forest = new ProofForest();
        if (listener != null) forest.addListener(listener);
        forest.addRoot(ProofState.initial(statement, this.rootLabel), "Initial state for theorem: " + name);

        log.debug("Theorem session '{}' opened: {}", name, statement.render());
    }

    public String name() {
        return name;
    }

    public MathRelation statement() {
        return statement;
    }

    public List<MathRelation> assumptions() {
        return assumptions;
    }

    public ProofForest forest() {
        return forest;
    }

    // =========================
    // Cursors
    // =========================

    public ProofBranch initialBranch() {
        List<Long> roots = forest.roots();
        if (roots.isEmpty()) throw new ProofForestException("Proof forest has no root node");
        return new ProofBranch(roots.get(0), forest, rootLabel, engine);
    }

    /**
     * Cursor on an existing node, labelled {@code p<nodeId>}.
     *
     * @throws ProofForestException for an unknown id
     */
    public ProofBranch branchAt(long nodeId) {
        if (!forest.contains(nodeId)) throw new ProofForestException("Cannot branch at unknown node " + nodeId);
        return new ProofBranch(nodeId, forest, PathLabels.forNode(nodeId), engine);
    }

    public Optional<ProofBranch> branchAtBookmark(String bookmark) {
        return forest.getBookmark(bookmark).map(this::branchAt);
    }

    public List<ProofNode> completedNodes() {
        return forest.nodesWithStatus(ProofStatus.COMPLETE);
    }

    // =========================
    // Result
    // =========================

    public Theorem build() {
        List<ProofNode> completed = completedNodes();
        Theorem t = Theorem.of(name, ProofState.initial(statement, rootLabel));
        log.info("Theorem '{}' built as {} ({} nodes, {} complete)", name, t.id(), forest.size(), completed.size());
        return t;
    }
}
