// ForestSnapshotStore.java
package org.calista.tactica.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.tactica.forest.ProofForest;
import org.calista.tactica.forest.ProofNode;
import org.calista.tactica.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * ForestSnapshotStore: writes a forest as JSONL for transcripts and diffs.
 *
 * <p>
 * Format: first line {"_schema":"forest-jsonl-v1"}, then one {@link NodeSnapshot} per line
 * ordered by id. Written atomically through {@link FileIO}.
 * </p>
 *
 * <p>
 * Snapshots are read back as {@link NodeSnapshot}s only; tactics are stored as their display
 * string so a forest cannot be rebuilt from them. Broken rows are skipped with a warning.
 * </p>
 */
public final class ForestSnapshotStore {

    private static final Logger log = LogManager.getLogger(ForestSnapshotStore.class);

    static final String SCHEMA_LINE = "{\"_schema\":\"forest-jsonl-v1\"}";

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path snapshotFile;

    public ForestSnapshotStore(FileIO io, ObjectMapper mapper, Path snapshotFile) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.snapshotFile = Objects.requireNonNull(snapshotFile, "snapshotFile");
    }

    public Path file() {
        return snapshotFile;
    }

    /** @return number of nodes written */
    public int save(ProofForest forest) throws IOException {
        Objects.requireNonNull(forest, "forest");
        List<ProofNode> nodes = forest.nodes();

        FileIO.WriterHandle h = io.openWriter(snapshotFile);
        try {
            h.writer.write(SCHEMA_LINE);
            h.writer.newLine();
            for (ProofNode n : nodes) {
                h.writer.write(mapper.writeValueAsString(NodeSnapshot.of(n)));
                h.writer.newLine();
            }
            io.commit(h);
        } catch (IOException | RuntimeException e) {
            io.rollback(h);
            throw e;
        }

        log.info("Forest snapshot saved: {} ({} nodes)", snapshotFile, nodes.size());
        return nodes.size();
    }

    public List<NodeSnapshot> load() throws IOException {
        ArrayList<NodeSnapshot> out = new ArrayList<>();
        for (String line : io.readJsonl(snapshotFile)) {
            if (line.contains("\"_schema\"")) continue;
            try {
                out.add(mapper.readValue(line, NodeSnapshot.class));
            } catch (IOException rowErr) {
                log.warn("Skipping broken snapshot row in {}: {}", snapshotFile, rowErr.getMessage());
            }
        }
        return out;
    }
}
