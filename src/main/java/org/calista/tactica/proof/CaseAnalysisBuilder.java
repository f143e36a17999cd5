package org.calista.tactica.proof;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.tactica.tactic.Tactic;
import org.calista.tactica.term.MathExpression;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * CaseAnalysisBuilder: scoped case split.
 *
 * <pre>{@code
 * branch.caseAnalysis()
 *       .onExpression(n)
 *       .caseOf("n is even", c -> c.simplify(...))
 *       .caseOf("n is odd",  c -> c.simplify(...))
 *       .build();
 * }</pre>
 *
 * <p>{@link #caseOf} only records the case. {@link #build()} inserts the split node under the
 * starting branch, then one case node per recorded case under the split node, and runs each
 * continuation on its case in order. Continuations run with no forest lock held and may
 * insert nodes freely.</p>
 *
 * <p>The split is not checked for exhaustiveness.</p>
 *
 * <p>Not reusable: call {@link #build()} once.</p>
 */
public final class CaseAnalysisBuilder {

    private static final Logger log = LogManager.getLogger(CaseAnalysisBuilder.class);

    private record PendingCase(String description, UnaryOperator<ProofBranch> continuation) {}

    private final ProofBranch origin;
    private final List<PendingCase> pending = new ArrayList<>();
    private MathExpression target;
    private boolean built;

    CaseAnalysisBuilder(ProofBranch origin) {
        this.origin = Objects.requireNonNull(origin, "origin");
    }

    public CaseAnalysisBuilder onExpression(MathExpression expression) {
        this.target = Objects.requireNonNull(expression, "expression");
        return this;
    }

    public CaseAnalysisBuilder onVariable(String name) {
        return onExpression(MathExpression.var(name));
    }

    /**
     * Adds a case.
     *
     * @param continuation receives a branch on the fresh case node, returns the branch where the
     *                     case ends up
     */
    public CaseAnalysisBuilder caseOf(String description, UnaryOperator<ProofBranch> continuation) {
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(continuation, "continuation");
        ensureNotBuilt();
        pending.add(new PendingCase(description, continuation));
        return this;
    }

    public int size() {
        return pending.size();
    }

    public CaseResult build() {
        ensureNotBuilt();
        built = true;

        MathExpression on = target == null ? MathExpression.var("expression") : target;
        List<String> names = new ArrayList<>(pending.size());
        for (PendingCase c : pending) names.add(c.description());

        ProofState parentState = origin.state();
        String path = origin.pathLabel();
        Tactic split = new Tactic.CaseAnalysis(on, List.of(), names, 0);
        long splitId = origin.forest().addChild(origin.nodeId(), parentState, split,
                "Case analysis with " + pending.size() + " cases");

        ArrayList<ProofBranch> finished = new ArrayList<>(pending.size());
        for (int i = 0; i < pending.size(); i++) {
            PendingCase c = pending.get(i);
            int index = i + 1;
            String note = target == null
                    ? "Case: " + c.description()
                    : "Case: " + target.render() + " where " + c.description();
            String label = PathLabels.caseLabel(path, index);

            ProofState caseState = parentState
                    .withPath(label)
                    .withJustification("Case " + index + ": " + c.description());
            Tactic marker = new Tactic.Introduce(note, on, null, index);
            long caseId = origin.forest().addNode(splitId, caseState, marker, note, null);

            ProofBranch start = new ProofBranch(caseId, origin.forest(), label, origin.engine());
            ProofBranch end = c.continuation().apply(start);
            finished.add(end == null ? start : end);
        }

        log.debug("{}: case analysis on {} built with {} cases", path, on.render(), finished.size());
        ProofBranch splitBranch = new ProofBranch(splitId, origin.forest(), PathLabels.casesLabel(path), origin.engine());
        return new CaseResult(splitBranch, finished, path);
    }

    private void ensureNotBuilt() {
        if (built) throw new IllegalStateException("Case analysis already built");
    }
}
