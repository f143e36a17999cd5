package org.calista.tactica.term;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * MathRelation: statement half of the grammar: logical connectives, equality and
 * named domain relations.
 *
 * Child indices:
 * - Equal / Implies / Equivalent: 0 = left (antecedent), 1 = right (consequent)
 * - And / Or / Custom: i = i-th operand
 * - Not: 0 = operand
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "@type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MathRelation.Equal.class, name = "equal"),
        @JsonSubTypes.Type(value = MathRelation.And.class, name = "and"),
        @JsonSubTypes.Type(value = MathRelation.Or.class, name = "or"),
        @JsonSubTypes.Type(value = MathRelation.Not.class, name = "not"),
        @JsonSubTypes.Type(value = MathRelation.Implies.class, name = "implies"),
        @JsonSubTypes.Type(value = MathRelation.Equivalent.class, name = "equivalent"),
        @JsonSubTypes.Type(value = MathRelation.Custom.class, name = "custom")
})
public sealed interface MathRelation extends Term {

    @Override
    MathRelation withChild(int index, Term child);

    // ---------------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------------

    static Equal equal(MathExpression left, MathExpression right) {
        return new Equal(left, right);
    }

    static And and(MathRelation... operands) {
        return new And(Arrays.asList(operands));
    }

    static Or or(MathRelation... operands) {
        return new Or(Arrays.asList(operands));
    }

    static Not not(MathRelation operand) {
        return new Not(operand);
    }

    static Implies implies(MathRelation antecedent, MathRelation consequent) {
        return new Implies(antecedent, consequent);
    }

    static Equivalent equivalent(MathRelation left, MathRelation right) {
        return new Equivalent(left, right);
    }

    static Custom custom(String name, MathExpression... expressions) {
        return new Custom(name, Arrays.asList(expressions));
    }

    static Custom lessThan(MathExpression left, MathExpression right) {
        return custom("<", left, right);
    }

    static Custom elementOf(MathExpression element, MathExpression set) {
        return custom("∈", element, set);
    }

    // ---------------------------------------------------------------------
    // Variants
    // ---------------------------------------------------------------------

    record Equal(MathExpression left, MathExpression right) implements MathRelation {
        public Equal {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public List<Term> children() {
            return List.of(left, right);
        }

        @Override
        public MathRelation withChild(int index, Term child) {
            if (index == 0) return new Equal(Terms.expectExpression(this, child), right);
            if (index == 1) return new Equal(left, Terms.expectExpression(this, child));
            throw Terms.noSuchChild(this, index);
        }

        @Override
        public String render() {
            return left.render() + " = " + right.render();
        }
    }

    record And(List<MathRelation> operands) implements MathRelation {
        public And {
            operands = operands == null ? List.of() : List.copyOf(operands);
        }

        @Override
        public List<Term> children() {
            return List.copyOf(operands);
        }

        @Override
        public MathRelation withChild(int index, Term child) {
            return new And(Terms.replaceRelation(this, operands, index, child));
        }

        @Override
        public String render() {
            return Terms.renderJunction(" ∧ ", operands);
        }
    }

    record Or(List<MathRelation> operands) implements MathRelation {
        public Or {
            operands = operands == null ? List.of() : List.copyOf(operands);
        }

        @Override
        public List<Term> children() {
            return List.copyOf(operands);
        }

        @Override
        public MathRelation withChild(int index, Term child) {
            return new Or(Terms.replaceRelation(this, operands, index, child));
        }

        @Override
        public String render() {
            return Terms.renderJunction(" ∨ ", operands);
        }
    }

    record Not(MathRelation operand) implements MathRelation {
        public Not {
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public List<Term> children() {
            return List.of(operand);
        }

        @Override
        public MathRelation withChild(int index, Term child) {
            if (index != 0) throw Terms.noSuchChild(this, index);
            return new Not(Terms.expectRelation(this, child));
        }

        @Override
        public String render() {
            return "¬" + operand.render();
        }
    }

    record Implies(MathRelation antecedent, MathRelation consequent) implements MathRelation {
        public Implies {
            Objects.requireNonNull(antecedent, "antecedent");
            Objects.requireNonNull(consequent, "consequent");
        }

        @Override
        public List<Term> children() {
            return List.of(antecedent, consequent);
        }

        @Override
        public MathRelation withChild(int index, Term child) {
            if (index == 0) return new Implies(Terms.expectRelation(this, child), consequent);
            if (index == 1) return new Implies(antecedent, Terms.expectRelation(this, child));
            throw Terms.noSuchChild(this, index);
        }

        @Override
        public String render() {
            return "(" + antecedent.render() + " → " + consequent.render() + ")";
        }
    }

    record Equivalent(MathRelation left, MathRelation right) implements MathRelation {
        public Equivalent {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public List<Term> children() {
            return List.of(left, right);
        }

        @Override
        public MathRelation withChild(int index, Term child) {
            if (index == 0) return new Equivalent(Terms.expectRelation(this, child), right);
            if (index == 1) return new Equivalent(left, Terms.expectRelation(this, child));
            throw Terms.noSuchChild(this, index);
        }

        @Override
        public String render() {
            return "(" + left.render() + " ↔ " + right.render() + ")";
        }
    }

    /** Named domain relation ({@code <}, {@code ∈}, {@code divides}, ...). */
    record Custom(String name, List<MathExpression> expressions) implements MathRelation {
        public Custom {
            Objects.requireNonNull(name, "name");
            expressions = expressions == null ? List.of() : List.copyOf(expressions);
        }

        @Override
        public List<Term> children() {
            return List.copyOf(expressions);
        }

        @Override
        public MathRelation withChild(int index, Term child) {
            if (index < 0 || index >= expressions.size()) throw Terms.noSuchChild(this, index);
            ArrayList<MathExpression> next = new ArrayList<>(expressions);
            next.set(index, Terms.expectExpression(this, child));
            return new Custom(name, next);
        }

        @Override
        public String render() {
            return Terms.renderApplication(name, expressions);
        }
    }
}
