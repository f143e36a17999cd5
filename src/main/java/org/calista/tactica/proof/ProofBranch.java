// ProofBranch.java
package org.calista.tactica.proof;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.tactica.forest.ProofForest;
import org.calista.tactica.forest.ProofNode;
import org.calista.tactica.tactic.RewriteDirection;
import org.calista.tactica.tactic.Tactic;
import org.calista.tactica.tactic.TacticEngine;
import org.calista.tactica.term.MathExpression;
import org.calista.tactica.term.Position;
import org.calista.tactica.term.TypeView;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * ProofBranch: cursor into a {@link ProofForest}.
 *
 * <p>
 * A branch is a node id, the shared forest and a display path label. It holds no state of its
 * own: every call reads the forest, and {@link #applyTactic} is the only call that inserts a node.
 * Branch objects are immutable; methods that move the cursor return a new branch.
 * </p>
 *
 * <p>Path labels are display only. Navigation always goes through node ids.</p>
 */
public final class ProofBranch {

    private static final Logger log = LogManager.getLogger(ProofBranch.class);

    private final long nodeId;
    private final ProofForest forest;
    private final String pathLabel;
    private final TacticEngine engine;

    public ProofBranch(long nodeId, ProofForest forest, String pathLabel, TacticEngine engine) {
        this.nodeId = nodeId;
        this.forest = Objects.requireNonNull(forest, "forest");
        this.pathLabel = Objects.requireNonNull(pathLabel, "pathLabel");
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    public long nodeId() {
        return nodeId;
    }

    public ProofForest forest() {
        return forest;
    }

    public String pathLabel() {
        return pathLabel;
    }

    TacticEngine engine() {
        return engine;
    }

    /** @throws org.calista.tactica.forest.ProofForestException if the node is gone from the forest */
    public ProofNode node() {
        return forest.get(nodeId);
    }

    public ProofState state() {
        return node().state();
    }

    // =========================
    // Moving the cursor
    // =========================

    /**
     * Applies {@code tactic} to this node's state, inserts the result as a child and returns a
     * cursor on the child. The label's trailing number is incremented and stamped on the stored
     * state, so transcripts show the cursor's label.
     */
    public ProofBranch applyTactic(Tactic tactic, String note) {
        Objects.requireNonNull(tactic, "tactic");

        String label = PathLabels.next(pathLabel);
        ProofState next = engine.apply(tactic, state()).withPath(label);
        long child = forest.addChild(nodeId, next, tactic, note);

        if (log.isDebugEnabled()) {
            log.debug("{} -> {} via {}", pathLabel, label, tactic.describe());
        }
        return new ProofBranch(child, forest, label, engine);
    }

    /** Another approach from the same node; suffix is the current number of children. */
    public ProofBranch branch() {
        int siblings = node().children().size();
        return new ProofBranch(nodeId, forest, PathLabels.branch(pathLabel, siblings), engine);
    }

    public ProofBranch branchWithId(long branchId) {
        return new ProofBranch(nodeId, forest, PathLabels.branch(pathLabel, branchId), engine);
    }

    // =========================
    // Status / bookmarks
    // =========================

    public ProofBranch markComplete() {
        forest.markComplete(nodeId);
        return this;
    }

    /** Same as {@link #markComplete()}; reads better at the end of a derivation. */
    public ProofBranch shouldComplete() {
        return markComplete();
    }

    public ProofBranch markWip() {
        forest.markWip(nodeId);
        return this;
    }

    public ProofBranch markTodo() {
        forest.markTodo(nodeId);
        return this;
    }

    public ProofBranch markAbandoned() {
        forest.markAbandoned(nodeId);
        return this;
    }

    public ProofBranch bookmark(String name) {
        forest.addBookmark(name, nodeId);
        return this;
    }

    // =========================
    // Tactic shortcuts
    // =========================

    public ProofBranch introduce(String name, MathExpression expression, int sequence) {
        return introduce(name, expression, null, sequence);
    }

    public ProofBranch introduce(String name, MathExpression expression, TypeView view, int sequence) {
        return applyTactic(new Tactic.Introduce(name, expression, view, sequence),
                "Introduce variable '" + name + "'");
    }

    public ProofBranch substitute(MathExpression pattern, MathExpression replacement, int sequence) {
        return applyTactic(new Tactic.Substitute(pattern, replacement, null, sequence),
                "Substitute " + pattern.render() + " with " + replacement.render());
    }

    public ProofBranch applyTheorem(String theoremId, Map<String, MathExpression> instantiation, int sequence) {
        return applyTactic(new Tactic.ApplyTheorem(theoremId, instantiation, null, sequence),
                "Apply theorem '" + theoremId + "'");
    }

    public ProofBranch rewrite(MathExpression target, MathExpression equation, RewriteDirection direction,
                               int sequence) {
        return applyTactic(new Tactic.Rewrite(target, equation, direction, null, sequence),
                "Rewrite " + target.render());
    }

    public ProofBranch rewrite(MathExpression target, MathExpression equation, RewriteDirection direction,
                               Position position, int sequence) {
        return applyTactic(new Tactic.Rewrite(target, equation, direction, position, sequence),
                "Rewrite " + target.render() + " at " + position);
    }

    public ProofBranch simplify(MathExpression target, List<String> hints, int sequence) {
        return applyTactic(new Tactic.Simplify(target, hints, sequence), "Simplify " + target.render());
    }

    /** Records the split on this line of derivation; use {@link #cases} to open the case nodes. */
    public ProofBranch caseAnalysis(MathExpression target, List<String> caseNames, int sequence) {
        return applyTactic(new Tactic.CaseAnalysis(target, List.of(), caseNames, sequence),
                "Case analysis on " + target.render());
    }

    // =========================
    // Case analysis
    // =========================

    /**
     * Opens one case per name under a new case-split node.
     *
     * <p>Layout: this node, then the split node (CaseAnalysis on {@code proposition}, label
     * {@code <path>_cases}), then one child per case labelled {@code <path>_c1}, {@code <path>_c2}.
     * Every case starts from this node's state and carries an Introduce marker naming the case.</p>
     */
    public CaseResult cases(List<String> caseNames) {
        Objects.requireNonNull(caseNames, "caseNames");

        ProofState parentState = state();
        MathExpression proposition = MathExpression.var("proposition");
        Tactic split = new Tactic.CaseAnalysis(proposition, List.of(), caseNames, 0);
        long splitId = forest.addChild(nodeId, parentState, split,
                "Case analysis with " + caseNames.size() + " cases");

        ArrayList<ProofBranch> out = new ArrayList<>(caseNames.size());
        for (int i = 0; i < caseNames.size(); i++) {
            String name = caseNames.get(i);
            String label = PathLabels.caseLabel(pathLabel, i + 1);
            ProofState caseState = parentState
                    .withPath(label)
                    .withJustification("Case " + (i + 1) + ": " + name);
            Tactic marker = new Tactic.Introduce(name, proposition, null, i + 1);
            long caseId = forest.addNode(splitId, caseState, marker, name, null);
            out.add(new ProofBranch(caseId, forest, label, engine));
        }

        log.debug("{}: {} cases opened under node {}", pathLabel, out.size(), splitId);
        ProofBranch splitBranch = new ProofBranch(splitId, forest, PathLabels.casesLabel(pathLabel), engine);
        return new CaseResult(splitBranch, out, pathLabel);
    }

    public CaseAnalysisBuilder caseAnalysis() {
        return new CaseAnalysisBuilder(this);
    }

    // =========================
    // Display
    // =========================

    /** Root-to-here transcript. */
    public String summary() {
        StringBuilder sb = new StringBuilder("Proof Branch Summary:\n");
        List<Long> path = forest.getPath(nodeId);
        for (int i = 0; i < path.size(); i++) {
            ProofNode n = forest.get(path.get(i));
            sb.append("  ".repeat(i))
                    .append(n.status().glyph())
                    .append(" Node ").append(n.id());
            if (n.tactic() != null) sb.append(" [").append(n.tactic().describe()).append(']');
            sb.append(" - ").append(n.note()).append('\n');
        }
        return sb.toString();
    }

    public String visualizeForest() {
        return forest.visualize();
    }

    @Override
    public String toString() {
        return "ProofBranch{node=" + nodeId + ", path=" + pathLabel + '}';
    }
}
