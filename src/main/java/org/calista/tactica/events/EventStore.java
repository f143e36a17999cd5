package org.calista.tactica.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.tactica.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Append-only JSONL journal of {@link ProofEvent}s. */
public final class EventStore {
    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public EventStore(FileIO io, ObjectMapper mapper, Path file) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path file() {
        return file;
    }

    public void append(ProofEvent e) throws IOException {
        io.appendJsonl(file, mapper.writeValueAsString(e));
    }

    public List<String> readAllRawLines() throws IOException {
        return io.readJsonl(file);
    }

    public List<ProofEvent> readAll() throws IOException {
        List<String> lines = readAllRawLines();
        ArrayList<ProofEvent> out = new ArrayList<>(lines.size());
        for (String line : lines) {
            out.add(mapper.readValue(line, ProofEvent.class));
        }
        return out;
    }
}
