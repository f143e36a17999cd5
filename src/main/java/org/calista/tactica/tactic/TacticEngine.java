package org.calista.tactica.tactic;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.tactica.proof.BoundVariable;
import org.calista.tactica.proof.ProofState;
import org.calista.tactica.term.MathExpression;
import org.calista.tactica.term.MathObjectType;
import org.calista.tactica.term.MathRelation;
import org.calista.tactica.term.TermNavigator;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * TacticEngine: the one place where tactics are turned into new proof states.
 *
 * <p>Semantics:</p>
 * <ul>
 *   <li>pure: the input state is never changed, a new state is always returned</li>
 *   <li>soft failures (pattern or target not found, theorem not applicable) return the input
 *       state with only the justification replaced; the path label is kept</li>
 *   <li>successful steps advance the path label ({@code p0 -> p0_1})</li>
 *   <li>Simplify, Decompose, Induction and Custom record a justification only</li>
 * </ul>
 *
 * <p>Dispatch is an exhaustive switch over {@link Tactic.Kind}.</p>
 */
public final class TacticEngine {

    private static final Logger log = LogManager.getLogger(TacticEngine.class);

    private static final TacticEngine STANDALONE = new TacticEngine(new InMemoryTheoremRegistry());

    private final TheoremRegistry registry;

    public TacticEngine(TheoremRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /** Engine backed by an empty registry. */
    public static TacticEngine standalone() {
        return STANDALONE;
    }

    public TheoremRegistry registry() {
        return registry;
    }

    // ---------------------------------------------------------------------
    // Apply
    // ---------------------------------------------------------------------

    public ProofState apply(Tactic tactic, ProofState state) {
        Objects.requireNonNull(tactic, "tactic");
        Objects.requireNonNull(state, "state");

        ProofState out = switch (tactic.kind()) {
            case INTRODUCE -> introduce((Tactic.Introduce) tactic, state);
            case SUBSTITUTE -> substitute((Tactic.Substitute) tactic, state);
            case APPLY_THEOREM -> applyTheorem((Tactic.ApplyTheorem) tactic, state);
            case CASE_ANALYSIS -> caseAnalysis((Tactic.CaseAnalysis) tactic, state);
            case REWRITE -> rewrite((Tactic.Rewrite) tactic, state);
            case SIMPLIFY -> simplify((Tactic.Simplify) tactic, state);
            case DECOMPOSE -> decompose((Tactic.Decompose) tactic, state);
            case INDUCTION -> induction((Tactic.Induction) tactic, state);
            case CUSTOM -> custom((Tactic.Custom) tactic, state);
        };

        if (log.isDebugEnabled()) {
            log.debug("{} : {} -> {}", describe(tactic), state.path(), out.justification());
        }
        return out;
    }

    private static ProofState introduce(Tactic.Introduce t, ProofState state) {
        MathExpression value = t.view() == null
                ? t.expression()
                : MathExpression.viewAs(t.expression(), t.view());
        MathObjectType type = t.view() == null
                ? MathObjectType.classify(t.expression())
                : MathObjectType.classify(t.view());

        return state
                .withVariable(new BoundVariable(t.name(), value, type))
                .advance(state.statement(), "Introduced variable '" + t.name() + "' of type " + type);
    }

    private static ProofState substitute(Tactic.Substitute t, ProofState state) {
        Optional<TermNavigator.Located> hit = TermNavigator.locate(state.statement(), t.pattern(), t.position());
        if (hit.isEmpty()) {
            return softFailure(state, "Substitution pattern not found: " + t.pattern().render());
        }

        TermNavigator.Located at = hit.get();
        MathRelation next = TermNavigator.replace(state.statement(), at.position(), t.replacement());
        return state.advance(next, "Substituted " + t.pattern().render()
                + " with " + t.replacement().render()
                + " at " + at.position());
    }

    private ProofState applyTheorem(Tactic.ApplyTheorem t, ProofState state) {
        Optional<MathRelation> result = registry.applyTheorem(
                t.theoremId(), state.statement(), t.instantiation(), t.target());

        if (result.isEmpty()) {
            String why = "Could not apply theorem '" + t.theoremId() + "'"
                    + (t.target() != null ? " to the target expression" : "");
            return softFailure(state, why);
        }
        return state.advance(result.get(), "Applied theorem '" + t.theoremId()
                + "' with " + t.instantiation().size() + " instantiations");
    }

    private static ProofState caseAnalysis(Tactic.CaseAnalysis t, ProofState state) {
        List<String> names = caseNames(t);
        return state.advance(state.statement(), "Case analysis on " + t.target().render()
                + " with " + names.size() + " cases: " + String.join(", ", names));
    }

    private static ProofState rewrite(Tactic.Rewrite t, ProofState state) {
        Optional<TermNavigator.Located> hit = TermNavigator.locate(state.statement(), t.target(), t.position());
        if (hit.isEmpty()) {
            return softFailure(state, "Rewrite target not found: " + t.target().render());
        }

        MathExpression replacement = sideOf(t.equation(), t.direction());
        MathRelation next = TermNavigator.replace(state.statement(), hit.get().position(), replacement);
        return state.advance(next, "Rewrote " + t.target().render()
                + " using " + t.equation().render()
                + " (" + t.direction().label() + ")");
    }

    /**
     * Side of an equation selected by the direction. An equation that is not an {@code Equal}
     * is substituted as a whole.
     */
    static MathExpression sideOf(MathExpression equation, RewriteDirection direction) {
        if (equation instanceof MathExpression.RelationExpr rel && rel.relation() instanceof MathRelation.Equal eq) {
            return direction == RewriteDirection.FORWARD ? eq.right() : eq.left();
        }
        return equation;
    }

    private static ProofState simplify(Tactic.Simplify t, ProofState state) {
        String j = "Simplified expression: " + t.target().render();
        if (!t.hints().isEmpty()) j += " with hints: " + String.join(", ", t.hints());
        return state.advance(state.statement(), j);
    }

    private static ProofState decompose(Tactic.Decompose t, ProofState state) {
        return state.advance(state.statement(), "Decomposed expression '" + t.target().render()
                + "' using " + methodLabel(t) + " method");
    }

    private static ProofState induction(Tactic.Induction t, ProofState state) {
        String j = "Applied " + inductionLabel(t) + " induction on variable '" + t.variable() + "'";
        if (t.schema() != null) j += " with schema " + t.schema().render();
        return state.advance(state.statement(), j);
    }

    private static ProofState custom(Tactic.Custom t, ProofState state) {
        return state.advance(state.statement(), "Applied custom tactic '" + t.name()
                + "' with arguments: " + String.join(", ", t.args()));
    }

    private static ProofState softFailure(ProofState state, String justification) {
        log.warn("{}", justification);
        return state.withJustification(justification);
    }

    // ---------------------------------------------------------------------
    // Describe
    // ---------------------------------------------------------------------

    public static String describe(Tactic tactic) {
        Objects.requireNonNull(tactic, "tactic");
        return switch (tactic.kind()) {
            case INTRODUCE -> {
                Tactic.Introduce t = (Tactic.Introduce) tactic;
                String v = t.view() == null ? "" : " viewed " + t.view().render();
                yield "Introduce '" + t.name() + "' := " + t.expression().render() + v + seq(t);
            }
            case SUBSTITUTE -> {
                Tactic.Substitute t = (Tactic.Substitute) tactic;
                String at = t.position() == null ? "" : " at " + t.position();
                yield "Substitute " + t.pattern().render() + " ↦ " + t.replacement().render() + at + seq(t);
            }
            case APPLY_THEOREM -> {
                Tactic.ApplyTheorem t = (Tactic.ApplyTheorem) tactic;
                String inst = t.instantiation().isEmpty() ? "" : " with " + renderInstantiation(t.instantiation());
                String on = t.target() == null ? "" : " on " + t.target().render();
                yield "Apply theorem '" + t.theoremId() + "'" + inst + on + seq(t);
            }
            case CASE_ANALYSIS -> {
                Tactic.CaseAnalysis t = (Tactic.CaseAnalysis) tactic;
                yield "Case analysis on " + t.target().render() + ": " + String.join(", ", caseNames(t)) + seq(t);
            }
            case REWRITE -> {
                Tactic.Rewrite t = (Tactic.Rewrite) tactic;
                String at = t.position() == null ? "" : " at " + t.position();
                yield "Rewrite " + t.target().render() + " using " + t.equation().render()
                        + " (" + t.direction().arrow() + ")" + at + seq(t);
            }
            case SIMPLIFY -> {
                Tactic.Simplify t = (Tactic.Simplify) tactic;
                String hints = t.hints().isEmpty() ? "" : " [" + String.join(", ", t.hints()) + "]";
                yield "Simplify " + t.target().render() + hints + seq(t);
            }
            case DECOMPOSE -> {
                Tactic.Decompose t = (Tactic.Decompose) tactic;
                yield "Decompose " + t.target().render() + " (" + methodLabel(t) + ")" + seq(t);
            }
            case INDUCTION -> {
                Tactic.Induction t = (Tactic.Induction) tactic;
                String schema = t.schema() == null ? "" : " schema " + t.schema().render();
                yield "Induction on " + t.variable() + " (" + inductionLabel(t) + ")" + schema + seq(t);
            }
            case CUSTOM -> {
                Tactic.Custom t = (Tactic.Custom) tactic;
                yield "Custom " + t.name() + "(" + String.join(", ", t.args()) + ")" + seq(t);
            }
        };
    }

    private static String seq(Tactic t) {
        return " #" + t.sequence();
    }

    private static String renderInstantiation(Map<String, MathExpression> inst) {
        // sorted by variable name
        return inst.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + " ↦ " + e.getValue().render())
                .collect(Collectors.joining(", ", "{", "}"));
    }

    private static String methodLabel(Tactic.Decompose t) {
        if (t.method() == DecompositionMethod.OTHER && t.detail() != null && !t.detail().isBlank()) {
            return t.detail();
        }
        return t.method().label();
    }

    private static String inductionLabel(Tactic.Induction t) {
        if (t.type() == InductionType.OTHER && t.detail() != null && !t.detail().isBlank()) {
            return t.detail();
        }
        return t.type().label();
    }

    /** Case names of a split tactic, falling back to rendered case expressions. */
    public static List<String> caseNames(Tactic.CaseAnalysis t) {
        if (!t.caseNames().isEmpty()) return t.caseNames();
        return t.caseExpressions().stream().map(MathExpression::render).collect(Collectors.toList());
    }
}
