// ProofForest.java
package org.calista.tactica.forest;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.tactica.proof.ProofState;
import org.calista.tactica.tactic.Tactic;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * ProofForest: append-only arena of proof nodes.
 *
 * <p>
 * Rules:
 * - ids start at 0, are strictly increasing and never reused
 * - {@link #addNode} is the only way a node enters the forest; nothing is ever removed
 * - a child id is in its parent's children iff the child's parent is that parent
 * - status is the only field that changes in place
 * - bookmarks: name to id, last writer wins
 * </p>
 *
 * <p>Every call takes the read/write lock for its own duration only. Listeners are notified
 * after the lock is released; their failures never reach the mutating caller.</p>
 */
public final class ProofForest {

    private static final Logger log = LogManager.getLogger(ProofForest.class);

    private final Map<Long, ProofNode> nodes = new HashMap<>();
    private final List<Long> roots = new ArrayList<>();
    private final Map<String, Long> bookmarks = new HashMap<>();
    private long nextId = 0L;

    private final ReentrantReadWriteLock rw = new ReentrantReadWriteLock();
    private final List<ForestListener> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public ProofForest() {
        this(Clock.systemUTC());
    }

    public ProofForest(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public void addListener(ForestListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    // =========================
    // Insertion
    // =========================

    /**
     * Stores a new node and links it to its parent (or to the roots when {@code parent} is null).
     *
     * @return the new node id
     * @throws ProofForestException if {@code parent} is not in the forest
     */
    public long addNode(Long parent, ProofState state, Tactic tactic, String note, ProofStatus status) {
        Objects.requireNonNull(state, "state");
        ProofStatus st = status == null ? ProofStatus.IN_PROGRESS : status;

        ProofNode node;
        rw.writeLock().lock();
        try {
            ProofNode parentNode = null;
            if (parent != null) {
                parentNode = nodes.get(parent);
                if (parentNode == null) {
                    throw new ProofForestException("Cannot add child: parent node " + parent + " does not exist");
                }
            }

            long id = nextId++;
            node = new ProofNode(id, parent, List.of(), state, tactic, st, note, clock.millis());
            nodes.put(id, node);

            if (parentNode == null) {
                roots.add(id);
            } else {
                nodes.put(parent, parentNode.withChild(id));
            }
        } finally {
            rw.writeLock().unlock();
        }

        if (log.isDebugEnabled()) {
            log.debug("node {} added (parent={}, status={}, path={})", node.id(), parent, st, state.path());
        }
        notifyListeners("onNodeAdded", l -> l.onNodeAdded(node));
        return node.id();
    }

    public long addRoot(ProofState state, String note) {
        return addNode(null, state, null, note, ProofStatus.IN_PROGRESS);
    }

    public long addChild(long parent, ProofState state, Tactic tactic, String note) {
        return addNode(parent, state, tactic, note, ProofStatus.IN_PROGRESS);
    }

    // =========================
    // Lookup
    // =========================

    /** @throws ProofForestException for an unknown id */
    public ProofNode get(long id) {
        return find(id).orElseThrow(() -> ProofForestException.unknownNode(id));
    }

    public Optional<ProofNode> find(long id) {
        rw.readLock().lock();
        try {
            return Optional.ofNullable(nodes.get(id));
        } finally {
            rw.readLock().unlock();
        }
    }

    public boolean contains(long id) {
        return find(id).isPresent();
    }

    /** Ids from a root down to {@code id}, root first. */
    public List<Long> getPath(long id) {
        rw.readLock().lock();
        try {
            ArrayList<Long> path = new ArrayList<>();
            ProofNode cur = nodes.get(id);
            if (cur == null) throw ProofForestException.unknownNode(id);
            while (cur != null) {
                path.add(cur.id());
                cur = cur.parent() == null ? null : nodes.get(cur.parent());
            }
            Collections.reverse(path);
            return Collections.unmodifiableList(path);
        } finally {
            rw.readLock().unlock();
        }
    }

    /** State of the first root. */
    public ProofState rootState() {
        rw.readLock().lock();
        try {
            if (roots.isEmpty()) {
                throw new ProofForestException("Forest has no root node");
            }
            return nodes.get(roots.get(0)).state();
        } finally {
            rw.readLock().unlock();
        }
    }

    public List<Long> roots() {
        rw.readLock().lock();
        try {
            return List.copyOf(roots);
        } finally {
            rw.readLock().unlock();
        }
    }

    public int size() {
        rw.readLock().lock();
        try {
            return nodes.size();
        } finally {
            rw.readLock().unlock();
        }
    }

    /** All nodes ordered by id. */
    public List<ProofNode> nodes() {
        rw.readLock().lock();
        try {
            ArrayList<ProofNode> out = new ArrayList<>(nodes.values());
            out.sort((a, b) -> Long.compare(a.id(), b.id()));
            return Collections.unmodifiableList(out);
        } finally {
            rw.readLock().unlock();
        }
    }

    public List<ProofNode> nodesWithStatus(ProofStatus status) {
        Objects.requireNonNull(status, "status");
        ArrayList<ProofNode> out = new ArrayList<>();
        for (ProofNode n : nodes()) {
            if (n.status() == status) out.add(n);
        }
        return Collections.unmodifiableList(out);
    }

    // =========================
    // Bookmarks
    // =========================

    /** @throws ProofForestException if {@code nodeId} is not in the forest */
    public void addBookmark(String name, long nodeId) {
        Objects.requireNonNull(name, "name");
        rw.writeLock().lock();
        try {
            if (!nodes.containsKey(nodeId)) throw ProofForestException.unknownNode(nodeId);
            bookmarks.put(name, nodeId);
        } finally {
            rw.writeLock().unlock();
        }
        log.debug("bookmark '{}' -> {}", name, nodeId);
        notifyListeners("onBookmarked", l -> l.onBookmarked(name, nodeId));
    }

    public Optional<Long> getBookmark(String name) {
        if (name == null) return Optional.empty();
        rw.readLock().lock();
        try {
            return Optional.ofNullable(bookmarks.get(name));
        } finally {
            rw.readLock().unlock();
        }
    }

    /** Bookmarks sorted by name. */
    public Map<String, Long> bookmarks() {
        rw.readLock().lock();
        try {
            return Collections.unmodifiableMap(new TreeMap<>(bookmarks));
        } finally {
            rw.readLock().unlock();
        }
    }

    // =========================
    // Status
    // =========================

    public void markComplete(long id) {
        setStatus(id, ProofStatus.COMPLETE);
    }

    public void markWip(long id) {
        setStatus(id, ProofStatus.WIP);
    }

    public void markTodo(long id) {
        setStatus(id, ProofStatus.TODO);
    }

    public void markAbandoned(long id) {
        setStatus(id, ProofStatus.ABANDONED);
    }

    public void setStatus(long id, ProofStatus status) {
        Objects.requireNonNull(status, "status");
        ProofNode updated;
        ProofStatus previous;
        rw.writeLock().lock();
        try {
            ProofNode cur = nodes.get(id);
            if (cur == null) throw ProofForestException.unknownNode(id);
            previous = cur.status();
            updated = cur.withStatus(status);
            nodes.put(id, updated);
        } finally {
            rw.writeLock().unlock();
        }
        if (log.isDebugEnabled()) {
            log.debug("node {} status {} -> {}", id, previous, status);
        }
        notifyListeners("onStatusChanged", l -> l.onStatusChanged(updated, previous));
    }

    /**
     * The mutation is already committed when listeners run: a failing listener is logged and
     * the remaining listeners are still notified.
     */
    private void notifyListeners(String event, Consumer<ForestListener> call) {
        for (ForestListener l : listeners) {
            try {
                call.accept(l);
            } catch (RuntimeException e) {
                log.warn("Listener {} failed on {}: {}", l.getClass().getName(), event, e.toString());
            }
        }
    }

    // =========================
    // Transcript
    // =========================

    /**
     * Indented tree, one line per node:
     * {@code <glyph> Node <id> [<tactic>] (path: <label>) - <note>}, then the bookmarks.
     */
    public String visualize() {
        rw.readLock().lock();
        try {
            StringBuilder sb = new StringBuilder("Proof Forest:\n");
            for (long root : roots) {
                appendTree(sb, root, 0);
            }
            if (!bookmarks.isEmpty()) {
                sb.append("\nBookmarks:\n");
                for (Map.Entry<String, Long> e : new TreeMap<>(bookmarks).entrySet()) {
                    sb.append("  ").append(e.getKey()).append(" -> Node ").append(e.getValue()).append('\n');
                }
            }
            return sb.toString();
        } finally {
            rw.readLock().unlock();
        }
    }

    private void appendTree(StringBuilder sb, long id, int depth) {
        ProofNode n = nodes.get(id);
        if (n == null) return;

        sb.append("  ".repeat(depth))
                .append(n.status().glyph())
                .append(" Node ").append(n.id());
        if (n.tactic() != null) sb.append(" [").append(n.tactic().describe()).append(']');
        if (n.state().path() != null) sb.append(" (path: ").append(n.state().path()).append(')');
        sb.append(" - ").append(n.note()).append('\n');

        for (long child : n.children()) {
            appendTree(sb, child, depth + 1);
        }
    }
}
