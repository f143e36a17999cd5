package org.calista.tactica.proof;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.calista.tactica.term.MathRelation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ProofState: immutable snapshot of a derivation at one node.
 *
 * <p>Every tactic produces a new instance through the {@code with*} helpers; a stored state is
 * never changed after it enters the forest.</p>
 *
 * @param quantifiers   quantified objects, in order
 * @param variables     bound variables, in order of introduction
 * @param statement     the relation being proven
 * @param path          display label such as {@code p0_1}; null when absent
 * @param justification how this state was produced; null for the initial state
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProofState(List<QuantifiedObject> quantifiers,
                         List<BoundVariable> variables,
                         MathRelation statement,
                         String path,
                         String justification) {

    public ProofState {
        quantifiers = quantifiers == null ? List.of() : List.copyOf(quantifiers);
        variables = variables == null ? List.of() : List.copyOf(variables);
        Objects.requireNonNull(statement, "statement");
    }

    public static ProofState initial(MathRelation statement, String path) {
        return new ProofState(List.of(), List.of(), statement, path, null);
    }

    // -------------------- copy-on-write --------------------

    public ProofState withPath(String newPath) {
        return new ProofState(quantifiers, variables, statement, newPath, justification);
    }

    public ProofState withJustification(String newJustification) {
        return new ProofState(quantifiers, variables, statement, path, newJustification);
    }

    public ProofState withVariable(BoundVariable binding) {
        Objects.requireNonNull(binding, "binding");
        ArrayList<BoundVariable> next = new ArrayList<>(variables.size() + 1);
        next.addAll(variables);
        next.add(binding);
        return new ProofState(quantifiers, next, statement, path, justification);
    }

    public ProofState withQuantifier(QuantifiedObject object) {
        Objects.requireNonNull(object, "object");
        ArrayList<QuantifiedObject> next = new ArrayList<>(quantifiers.size() + 1);
        next.addAll(quantifiers);
        next.add(object);
        return new ProofState(next, variables, statement, path, justification);
    }

    /**
     * State for the next step: statement replaced and path label advanced.
     * {@code p0 -> p0_1}, {@code p0_1 -> p0_2}.
     */
    public ProofState advance(MathRelation newStatement, String newJustification) {
        String next = path == null ? null : PathLabels.next(path);
        return new ProofState(quantifiers, variables, newStatement, next, newJustification);
    }

    // -------------------- display --------------------

    @Override
    public String toString() {
        return "ProofState{path=" + path
                + ", vars=" + variables.size()
                + ", quantifiers=" + quantifiers.size()
                + ", statement=" + statement.render()
                + '}';
    }
}
