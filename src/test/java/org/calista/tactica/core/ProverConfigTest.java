package org.calista.tactica.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.tactica.io.FileIO;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class ProverConfigTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    public void missingFileIsCreatedWithDefaults() throws Exception {
        FileIO io = new FileIO(tmp.getRoot().toPath());
        Path cfgFile = io.resolve("config/tactica.json");

        ProverConfig cfg = ProverConfig.loadOrCreate(io, cfgFile, mapper);

        assertTrue(Files.exists(cfgFile));
        assertEquals("data", cfg.baseDir);
        assertEquals("p0", cfg.forest.rootPathLabel);
        assertTrue(cfg.journal.enabled);
        assertEquals("theorems", cfg.export.dir);
    }

    @Test
    public void blankFileIsRecreated() throws Exception {
        FileIO io = new FileIO(tmp.getRoot().toPath());
        Path cfgFile = io.resolve("tactica.json");
        Files.writeString(cfgFile, "   ");

        ProverConfig cfg = ProverConfig.loadOrCreate(io, cfgFile, mapper);

        assertEquals("proof-events.jsonl", cfg.journal.file);
        assertFalse(io.readString(cfgFile).isBlank());
    }

    @Test
    public void partialFileIsNormalised() throws Exception {
        FileIO io = new FileIO(tmp.getRoot().toPath());
        Path cfgFile = io.resolve("tactica.json");
        Files.writeString(cfgFile, "{\"baseDir\":\" \",\"forest\":{\"rootPathLabel\":\" root \"},"
                + "\"journal\":null,\"unknownKey\":1}");

        ProverConfig cfg = ProverConfig.loadOrCreate(io, cfgFile, mapper);

        assertEquals("data", cfg.baseDir);
        assertEquals("root", cfg.forest.rootPathLabel);
        assertNotNull(cfg.journal);
        assertNotNull(cfg.export);
    }
}
