package org.calista.tactica.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.tactica.events.EventStore;
import org.calista.tactica.events.JournalingListener;
import org.calista.tactica.forest.ForestListener;
import org.calista.tactica.io.FileIO;
import org.calista.tactica.proof.Theorem;
import org.calista.tactica.proof.TheoremBuilder;
import org.calista.tactica.store.ForestSnapshotStore;
import org.calista.tactica.store.TheoremStore;
import org.calista.tactica.tactic.InMemoryTheoremRegistry;
import org.calista.tactica.tactic.TacticEngine;
import org.calista.tactica.tactic.TheoremRegistry;
import org.calista.tactica.term.MathRelation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * ProverKernel: instance-owned runtime container.
 *
 * Lifecycle:
 *   1) builder().build(configFile) -> loadOrCreate config, bind I/O to baseDir, create stores
 *   2) newTheorem(...)             -> one proving session per call, journaled when enabled
 *   3) finish(builder)             -> build, register, export theorem + forest snapshot
 *   4) close()
 *
 * No static singletons.
 */
public final class ProverKernel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProverKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final ProverConfig cfg;

    private final TheoremRegistry registry;
    private final TacticEngine engine;
    private final EventStore events;

    private volatile boolean closed = false;

    private ProverKernel(FileIO io, ObjectMapper mapper, ProverConfig cfg, TheoremRegistry registry) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.engine = new TacticEngine(registry);
        this.events = new EventStore(io, mapper, io.resolve(cfg.journal.file));
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /** Directory the config file is resolved against; baseDir comes from the config itself. */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;
        private TheoremRegistry registry;

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        public Builder registry(TheoremRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry");
            return this;
        }

        public ProverKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();

            FileIO external = new FileIO(configRoot, charset, true);
            Path cfgPath = configFile.isAbsolute() ? configFile : configRoot.resolve(configFile);
            ProverConfig cfg = ProverConfig.loadOrCreate(external, cfgPath, om);

            // relative baseDir is taken relative to configRoot
            Path base = Path.of(cfg.baseDir);
            if (!base.isAbsolute()) base = configRoot.resolve(base);
            FileIO io = new FileIO(base, charset, true);

            TheoremRegistry reg = (this.registry != null) ? this.registry : new InMemoryTheoremRegistry();
            ProverKernel k = new ProverKernel(io, om, cfg, reg);

            log.info("ProverKernel created: config={}, baseDir={}, journal={}",
                    cfgPath, io.baseDir(), cfg.journal.enabled ? cfg.journal.file : "off");
            return k;
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Sessions
    // ---------------------------------------------------------------------

    /** Opens a proving session wired to this kernel's registry and, when enabled, the journal. */
    public TheoremBuilder newTheorem(String name, MathRelation statement, List<MathRelation> assumptions) {
        ensureOpen();
        ForestListener listener = cfg.journal.enabled ? new JournalingListener(events, name) : null;
        return new TheoremBuilder(name, statement, assumptions, engine, listener, cfg.forest.rootPathLabel);
    }

    /**
     * Builds the theorem, registers it for later ApplyTheorem steps and writes the
     * theorem file and the forest snapshot.
     */
    public Theorem finish(TheoremBuilder builder) throws IOException {
        ensureOpen();
        Theorem t = builder.build();
        if (cfg.forest.visualizeOnBuild && log.isInfoEnabled()) {
            log.info("Forest for '{}':\n{}", builder.name(), builder.forest().visualize());
        }
        registry.register(t);
        theoremStore(t.id()).save(t);
        snapshotStore(t.id()).save(builder.forest());
        return t;
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() {
        return io;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public ProverConfig config() {
        return cfg;
    }

    public TheoremRegistry registry() {
        return registry;
    }

    public TacticEngine engine() {
        return engine;
    }

    public EventStore events() {
        return events;
    }

    public TheoremStore theoremStore(String theoremId) {
        return new TheoremStore(io, mapper, io.resolve(cfg.export.dir + "/" + theoremId + ".json"));
    }

    public ForestSnapshotStore snapshotStore(String theoremId) {
        return new ForestSnapshotStore(io, mapper, io.resolve(cfg.export.dir + "/" + theoremId + ".forest.jsonl"));
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("ProverKernel is closed");
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        log.info("ProverKernel closed");
    }
}
