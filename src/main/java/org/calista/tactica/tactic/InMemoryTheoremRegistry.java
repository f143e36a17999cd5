// InMemoryTheoremRegistry.java
package org.calista.tactica.tactic;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.tactica.proof.Theorem;
import org.calista.tactica.term.MathExpression;
import org.calista.tactica.term.MathRelation;
import org.calista.tactica.term.TermNavigator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * InMemoryTheoremRegistry: map-backed registry.
 *
 * <p>Application rules:</p>
 * <ul>
 *   <li>unknown id: empty</li>
 *   <li>target given but not present in the statement: empty</li>
 *   <li>otherwise the statement is returned as is</li>
 * </ul>
 *
 * <p>No matching or instantiation is performed here. Subclass and override
 * {@link #instantiate(Theorem, MathRelation, Map, MathExpression)} to plug a real matcher in.</p>
 */
public class InMemoryTheoremRegistry implements TheoremRegistry {

    private static final Logger log = LogManager.getLogger(InMemoryTheoremRegistry.class);

    private final Map<String, Theorem> byId = new HashMap<>();
    private final ReentrantReadWriteLock rw = new ReentrantReadWriteLock();

    @Override
    public boolean register(Theorem theorem) {
        Objects.requireNonNull(theorem, "theorem");
        rw.writeLock().lock();
        try {
            Theorem prev = byId.put(theorem.id(), theorem);
            if (prev != null) {
                log.warn("Theorem '{}' replaced", theorem.id());
            }
            return prev == null;
        } finally {
            rw.writeLock().unlock();
        }
    }

    @Override
    public Optional<Theorem> get(String id) {
        if (id == null) return Optional.empty();
        rw.readLock().lock();
        try {
            return Optional.ofNullable(byId.get(id));
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public List<String> ids() {
        rw.readLock().lock();
        try {
            ArrayList<String> out = new ArrayList<>(byId.keySet());
            Collections.sort(out);
            return Collections.unmodifiableList(out);
        } finally {
            rw.readLock().unlock();
        }
    }

    @Override
    public Optional<MathRelation> applyTheorem(String theoremId,
                                               MathRelation statement,
                                               Map<String, MathExpression> instantiation,
                                               MathExpression target) {
        Objects.requireNonNull(statement, "statement");

        Optional<Theorem> theorem = get(theoremId);
        if (theorem.isEmpty()) {
            log.debug("Unknown theorem '{}'", theoremId);
            return Optional.empty();
        }
        if (target != null && TermNavigator.locate(statement, target).isEmpty()) {
            log.debug("Theorem '{}': target '{}' not in statement", theoremId, target.render());
            return Optional.empty();
        }
        return instantiate(theorem.get(), statement,
                instantiation == null ? Map.of() : instantiation, target);
    }

    /** Produces the statement after applying {@code theorem}. Identity by default. */
    protected Optional<MathRelation> instantiate(Theorem theorem,
                                                 MathRelation statement,
                                                 Map<String, MathExpression> instantiation,
                                                 MathExpression target) {
        return Optional.of(statement);
    }
}
