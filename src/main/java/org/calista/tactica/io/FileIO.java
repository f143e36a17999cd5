package org.calista.tactica.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * FileIO: the single place where the prover touches the file system.
 *
 * <p>
 * - every path is resolved inside {@code baseDir}; ".." escapes and absolute paths are rejected
 * - whole-file writes go to a {@code .tmp} sibling and are moved over the target
 * - JSONL helpers: append one record per line, read back trimmed non-empty lines
 * </p>
 *
 * All I/O errors propagate as {@link IOException}.
 */
public final class FileIO {

    private static final Logger log = LogManager.getLogger(FileIO.class);

    private final Path baseDir;
    private final Charset charset;
    private final boolean atomicWrites;

    public FileIO(Path baseDir) {
        this(baseDir, StandardCharsets.UTF_8, true);
    }

    public FileIO(Path baseDir, Charset charset, boolean atomicWrites) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.charset = Objects.requireNonNull(charset, "charset");
        this.atomicWrites = atomicWrites;
        try {
            Files.createDirectories(this.baseDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create base directory " + this.baseDir, e);
        }
        log.debug("FileIO: baseDir={}, charset={}, atomicWrites={}", this.baseDir, charset, atomicWrites);
    }

    public Path baseDir() {
        return baseDir;
    }

    // ----------------------------
    // Resolve
    // ----------------------------

    /** Resolves {@code relative} under the base directory. */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        Path rel = Paths.get(relative.replace('\\', '/'));
        if (rel.isAbsolute()) {
            throw new IllegalArgumentException("Absolute paths are not accepted: " + relative);
        }
        Path p = baseDir.resolve(rel).normalize().toAbsolutePath();
        if (!p.startsWith(baseDir)) {
            throw new IllegalArgumentException("Path escapes base directory: " + relative);
        }
        return p;
    }

    public void ensureParentDir(Path file) throws IOException {
        Path parent = Objects.requireNonNull(file, "file").getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    public boolean exists(Path file) {
        return Files.exists(Objects.requireNonNull(file, "file"));
    }

    // ----------------------------
    // Text
    // ----------------------------

    public String readString(Path file) throws IOException {
        return Files.readString(Objects.requireNonNull(file, "file"), charset);
    }

    public Optional<String> readStringIfExists(Path file) throws IOException {
        if (!exists(file)) return Optional.empty();
        return Optional.of(readString(file));
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        ensureParentDir(file);

        if (!atomicWrites) {
            Files.writeString(file, content, charset,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            return;
        }
        Path tmp = tempSibling(file);
        Files.writeString(tmp, content, charset,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        moveIntoPlace(tmp, file);
    }

    public synchronized void appendLine(Path file, String line) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(line, "line");
        ensureParentDir(file);
        Files.writeString(file, line + System.lineSeparator(), charset,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    // ----------------------------
    // JSONL
    // ----------------------------

    public void appendJsonl(Path file, String jsonLine) throws IOException {
        Objects.requireNonNull(jsonLine, "jsonLine");
        String s = jsonLine.trim();
        if (s.isEmpty()) return;
        appendLine(file, s);
    }

    /** Non-empty trimmed lines; empty list when the file does not exist. */
    public List<String> readJsonl(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!exists(file)) return List.of();
        try (Stream<String> s = Files.lines(file, charset)) {
            List<String> out = s.map(String::trim).filter(x -> !x.isEmpty()).collect(Collectors.toList());
            log.debug("readJsonl: {} ({} records)", file, out.size());
            return out;
        }
    }

    // ----------------------------
    // Writer handle
    // ----------------------------

    /**
     * Opens a writer on a temporary sibling (or on the target when atomic writes are off).
     * Finish with {@link #commit(WriterHandle)} or {@link #rollback(WriterHandle)}.
     */
    public WriterHandle openWriter(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        ensureParentDir(file);
        Path out = atomicWrites ? tempSibling(file) : file;
        BufferedWriter w = Files.newBufferedWriter(out, charset,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        return new WriterHandle(file, atomicWrites ? out : null, w);
    }

    public void commit(WriterHandle h) throws IOException {
        Objects.requireNonNull(h, "handle");
        h.writer.close();
        if (h.tmpFile != null) moveIntoPlace(h.tmpFile, h.targetFile);
    }

    public void rollback(WriterHandle h) {
        if (h == null) return;
        try {
            h.writer.close();
        } catch (IOException e) {
            log.warn("rollback: close failed for {}: {}", h.targetFile, e.toString());
        }
        if (h.tmpFile != null) {
            try {
                Files.deleteIfExists(h.tmpFile);
            } catch (IOException e) {
                log.warn("rollback: cannot delete {}: {}", h.tmpFile, e.toString());
            }
        }
    }

    public static final class WriterHandle {
        public final Path targetFile;
        public final Path tmpFile; // null when writing in place
        public final BufferedWriter writer;

        private WriterHandle(Path targetFile, Path tmpFile, BufferedWriter writer) {
            this.targetFile = targetFile;
            this.tmpFile = tmpFile;
            this.writer = writer;
        }
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private static Path tempSibling(Path target) {
        return target.resolveSibling(target.getFileName().toString() + ".tmp");
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.trace("atomic move unsupported, plain replace: {}", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
