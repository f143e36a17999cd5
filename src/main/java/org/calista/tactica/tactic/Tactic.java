package org.calista.tactica.tactic;

import org.calista.tactica.proof.ProofState;
import org.calista.tactica.term.MathExpression;
import org.calista.tactica.term.Position;
import org.calista.tactica.term.TypeView;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Tactic: closed set of parameterized proof-state transformers.
 *
 * <p>Each variant carries exactly what it needs to apply itself and to describe itself.
 * Behaviour lives in {@link TacticEngine}, which switches over {@link Kind}; adding a variant
 * without handling it there does not compile.</p>
 *
 * <p>Nullable components: Introduce.view, Substitute.position, ApplyTheorem.target,
 * Rewrite.position, Decompose.detail, Induction.detail and Induction.schema.</p>
 */
public sealed interface Tactic {

    enum Kind {
        INTRODUCE,
        SUBSTITUTE,
        APPLY_THEOREM,
        CASE_ANALYSIS,
        REWRITE,
        SIMPLIFY,
        DECOMPOSE,
        INDUCTION,
        CUSTOM
    }

    Kind kind();

    /** Ordering number supplied by the caller, display only. */
    int sequence();

    /** Pure application with an empty theorem registry. */
    default ProofState apply(ProofState state) {
        return TacticEngine.standalone().apply(this, state);
    }

    default ProofState apply(ProofState state, TheoremRegistry registry) {
        return new TacticEngine(registry).apply(this, state);
    }

    /** Short display string. Never branch on it. */
    default String describe() {
        return TacticEngine.describe(this);
    }

    // ---------------------------------------------------------------------
    // Variants
    // ---------------------------------------------------------------------

    record Introduce(String name, MathExpression expression, TypeView view, int sequence) implements Tactic {
        public Introduce {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(expression, "expression");
        }

        @Override
        public Kind kind() {
            return Kind.INTRODUCE;
        }
    }

    record Substitute(MathExpression pattern, MathExpression replacement, Position position, int sequence)
            implements Tactic {
        public Substitute {
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(replacement, "replacement");
        }

        @Override
        public Kind kind() {
            return Kind.SUBSTITUTE;
        }
    }

    record ApplyTheorem(String theoremId, Map<String, MathExpression> instantiation, MathExpression target,
                        int sequence) implements Tactic {
        public ApplyTheorem {
            Objects.requireNonNull(theoremId, "theoremId");
            instantiation = instantiation == null ? Map.of() : Map.copyOf(instantiation);
        }

        @Override
        public Kind kind() {
            return Kind.APPLY_THEOREM;
        }
    }

    /** Case metadata only; the branching constructs consume it. */
    record CaseAnalysis(MathExpression target, List<MathExpression> caseExpressions, List<String> caseNames,
                        int sequence) implements Tactic {
        public CaseAnalysis {
            Objects.requireNonNull(target, "target");
            caseExpressions = caseExpressions == null ? List.of() : List.copyOf(caseExpressions);
            caseNames = caseNames == null ? List.of() : List.copyOf(caseNames);
        }

        @Override
        public Kind kind() {
            return Kind.CASE_ANALYSIS;
        }
    }

    record Rewrite(MathExpression target, MathExpression equation, RewriteDirection direction, Position position,
                   int sequence) implements Tactic {
        public Rewrite {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(equation, "equation");
            Objects.requireNonNull(direction, "direction");
        }

        @Override
        public Kind kind() {
            return Kind.REWRITE;
        }
    }

    record Simplify(MathExpression target, List<String> hints, int sequence) implements Tactic {
        public Simplify {
            Objects.requireNonNull(target, "target");
            hints = hints == null ? List.of() : List.copyOf(hints);
        }

        @Override
        public Kind kind() {
            return Kind.SIMPLIFY;
        }
    }

    /** @param detail method name when {@code method == OTHER} */
    record Decompose(MathExpression target, DecompositionMethod method, String detail, int sequence)
            implements Tactic {
        public Decompose {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(method, "method");
        }

        @Override
        public Kind kind() {
            return Kind.DECOMPOSE;
        }
    }

    /** @param detail induction name when {@code type == OTHER} */
    record Induction(String variable, InductionType type, String detail, MathExpression schema, int sequence)
            implements Tactic {
        public Induction {
            Objects.requireNonNull(variable, "variable");
            Objects.requireNonNull(type, "type");
        }

        @Override
        public Kind kind() {
            return Kind.INDUCTION;
        }
    }

    record Custom(String name, List<String> args, int sequence) implements Tactic {
        public Custom {
            Objects.requireNonNull(name, "name");
            args = args == null ? List.of() : List.copyOf(args);
        }

        @Override
        public Kind kind() {
            return Kind.CUSTOM;
        }
    }
}
