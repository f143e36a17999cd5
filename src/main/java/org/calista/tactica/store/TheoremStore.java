package org.calista.tactica.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.tactica.io.FileIO;
import org.calista.tactica.proof.Theorem;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/** Pretty JSON export of a {@link Theorem}, including its full statement tree. */
public final class TheoremStore {

    private static final Logger log = LogManager.getLogger(TheoremStore.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public TheoremStore(FileIO io, ObjectMapper mapper, Path file) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path file() {
        return file;
    }

    public void save(Theorem theorem) throws IOException {
        Objects.requireNonNull(theorem, "theorem");
        String json = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(theorem);
        io.writeString(file, json + System.lineSeparator());
        log.info("Theorem {} exported to {}", theorem.id(), file);
    }

    public Optional<Theorem> load() throws IOException {
        Optional<String> json = io.readStringIfExists(file);
        if (json.isEmpty() || json.get().isBlank()) return Optional.empty();
        return Optional.of(mapper.readValue(json.get(), Theorem.class));
    }
}
