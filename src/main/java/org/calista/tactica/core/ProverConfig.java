package org.calista.tactica.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.tactica.io.FileIO;
import org.calista.tactica.proof.PathLabels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * ProverConfig: plain POJO config:
 * - defaults live in the fields
 * - loadOrCreate() writes the default file when it is missing or blank
 * - validate() normalises values
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ProverConfig {

    private static final Logger log = LoggerFactory.getLogger(ProverConfig.class);

    public String baseDir = "data";
    public Forest forest = new Forest();
    public Journal journal = new Journal();
    public Export export = new Export();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Forest {
        public String rootPathLabel = PathLabels.ROOT;
        /** Log the forest transcript when a theorem is built. */
        public boolean visualizeOnBuild = true;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Journal {
        public boolean enabled = true;
        public String file = "proof-events.jsonl";
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Export {
        /** Under baseDir; one {@code <id>.json} and one {@code <id>.forest.jsonl} per theorem. */
        public String dir = "theorems";
    }

    // -------------------- Load / Create --------------------

    public static ProverConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            ProverConfig created = new ProverConfig();
            created.validate();
            save(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            ProverConfig created = new ProverConfig();
            created.validate();
            save(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        ProverConfig cfg = mapper.readValue(json, ProverConfig.class);
        if (cfg == null) cfg = new ProverConfig();
        cfg.validate();
        return cfg;
    }

    public static void save(FileIO io, Path configFile, ObjectMapper mapper, ProverConfig cfg) throws IOException {
        Objects.requireNonNull(cfg, "cfg");
        cfg.validate();
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation --------------------

    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";

        if (forest == null) forest = new Forest();
        if (forest.rootPathLabel == null || forest.rootPathLabel.isBlank()) {
            forest.rootPathLabel = PathLabels.ROOT;
        } else {
            forest.rootPathLabel = forest.rootPathLabel.trim();
        }

        if (journal == null) journal = new Journal();
        if (journal.file == null || journal.file.isBlank()) journal.file = "proof-events.jsonl";

        if (export == null) export = new Export();
        if (export.dir == null || export.dir.isBlank()) export.dir = "theorems";
    }
}
