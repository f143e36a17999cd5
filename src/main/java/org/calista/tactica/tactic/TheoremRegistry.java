// TheoremRegistry.java
package org.calista.tactica.tactic;

import org.calista.tactica.proof.Theorem;
import org.calista.tactica.term.MathExpression;
import org.calista.tactica.term.MathRelation;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * TheoremRegistry: lookup of named theorems for the ApplyTheorem tactic.
 *
 * <p>Interface + implementation, like the rest of the engine. Implementations must be
 * deterministic: the same inputs give the same answer.</p>
 */
public interface TheoremRegistry {

    /** @return true if no theorem was registered under the same id before */
    boolean register(Theorem theorem);

    Optional<Theorem> get(String id);

    /** Registered ids, sorted. */
    List<String> ids();

    /**
     * Applies theorem {@code theoremId} to {@code statement}.
     *
     * @param instantiation variable name to expression; may be empty
     * @param target        optional subexpression the theorem should act on
     * @return the resulting statement, or empty when the theorem is unknown or does not apply
     */
    Optional<MathRelation> applyTheorem(String theoremId,
                                        MathRelation statement,
                                        Map<String, MathExpression> instantiation,
                                        MathExpression target);
}
