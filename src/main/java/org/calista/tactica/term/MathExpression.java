package org.calista.tactica.term;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * MathExpression: expression half of the statement grammar.
 *
 * <p>Closed set of variants (sealed + records). Jackson writes the variant name into {@code @type}.</p>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "@type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = MathExpression.Var.class, name = "var"),
        @JsonSubTypes.Type(value = MathExpression.Num.class, name = "num"),
        @JsonSubTypes.Type(value = MathExpression.Operation.class, name = "operation"),
        @JsonSubTypes.Type(value = MathExpression.ViewAs.class, name = "viewAs"),
        @JsonSubTypes.Type(value = MathExpression.RelationExpr.class, name = "relation")
})
public sealed interface MathExpression extends Term {

    @Override
    MathExpression withChild(int index, Term child);

    // ---------------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------------

    static Var var(String name) {
        return new Var(name);
    }

    static Num num(long value) {
        return new Num(Long.toString(value));
    }

    static Operation op(String operator, MathExpression... operands) {
        return new Operation(operator, Arrays.asList(operands));
    }

    static Operation add(MathExpression left, MathExpression right) {
        return op("+", left, right);
    }

    static Operation mul(MathExpression left, MathExpression right) {
        return op("*", left, right);
    }

    static ViewAs viewAs(MathExpression expression, TypeView view) {
        return new ViewAs(expression, view);
    }

    static RelationExpr of(MathRelation relation) {
        return new RelationExpr(relation);
    }

    // ---------------------------------------------------------------------
    // Variants
    // ---------------------------------------------------------------------

    /** Named variable. */
    record Var(String name) implements MathExpression {
        public Var {
            Objects.requireNonNull(name, "name");
            if (name.isBlank()) throw new IllegalArgumentException("Var.name is blank");
        }

        @Override
        public List<Term> children() {
            return List.of();
        }

        @Override
        public MathExpression withChild(int index, Term child) {
            throw Terms.noSuchChild(this, index);
        }

        @Override
        public String render() {
            return name;
        }
    }

    /** Numeric literal, kept verbatim. */
    record Num(String value) implements MathExpression {
        public Num {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public List<Term> children() {
            return List.of();
        }

        @Override
        public MathExpression withChild(int index, Term child) {
            throw Terms.noSuchChild(this, index);
        }

        @Override
        public String render() {
            return value;
        }
    }

    /**
     * Operator or function application. Symbolic binary operators render infix,
     * everything else as {@code name(args)}.
     */
    record Operation(String operator, List<MathExpression> operands) implements MathExpression {
        public Operation {
            Objects.requireNonNull(operator, "operator");
            operands = operands == null ? List.of() : List.copyOf(operands);
        }

        @Override
        public List<Term> children() {
            return List.copyOf(operands);
        }

        @Override
        public MathExpression withChild(int index, Term child) {
            if (index < 0 || index >= operands.size()) throw Terms.noSuchChild(this, index);
            ArrayList<MathExpression> next = new ArrayList<>(operands);
            next.set(index, Terms.expectExpression(this, child));
            return new Operation(operator, next);
        }

        @Override
        public String render() {
            return Terms.renderApplication(operator, operands);
        }
    }

    /** Expression read through an interpretation view (number as group element, ...). */
    record ViewAs(MathExpression expression, TypeView view) implements MathExpression {
        public ViewAs {
            Objects.requireNonNull(expression, "expression");
            Objects.requireNonNull(view, "view");
        }

        @Override
        public List<Term> children() {
            return List.of(expression);
        }

        @Override
        public MathExpression withChild(int index, Term child) {
            if (index != 0) throw Terms.noSuchChild(this, index);
            return new ViewAs(Terms.expectExpression(this, child), view);
        }

        @Override
        public String render() {
            return expression.render() + " as " + view.render();
        }
    }

    /** A relation used in expression position, e.g. the equation handed to a rewrite. */
    record RelationExpr(MathRelation relation) implements MathExpression {
        public RelationExpr {
            Objects.requireNonNull(relation, "relation");
        }

        @Override
        public List<Term> children() {
            return List.of(relation);
        }

        @Override
        public MathExpression withChild(int index, Term child) {
            if (index != 0) throw Terms.noSuchChild(this, index);
            return new RelationExpr(Terms.expectRelation(this, child));
        }

        @Override
        public String render() {
            return "[" + relation.render() + "]";
        }
    }
}
