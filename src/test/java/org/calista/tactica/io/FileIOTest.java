package org.calista.tactica.io;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.*;

public class FileIOTest {

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    @Test(expected = IllegalArgumentException.class)
    public void traversalIsRejected() {
        new FileIO(tmp.getRoot().toPath()).resolve("../outside.txt");
    }

    @Test
    public void writeCreatesParentsAndLeavesNoTempFile() throws Exception {
        FileIO io = new FileIO(tmp.getRoot().toPath());
        Path f = io.resolve("a/b/c.txt");

        io.writeString(f, "one");
        io.writeString(f, "two");

        assertEquals("two", io.readString(f));
        assertFalse(Files.exists(f.resolveSibling("c.txt.tmp")));
    }

    @Test
    public void jsonlSkipsBlankLines() throws Exception {
        FileIO io = new FileIO(tmp.getRoot().toPath());
        Path f = io.resolve("x.jsonl");

        io.appendJsonl(f, " {\"a\":1} ");
        io.appendJsonl(f, "   ");
        io.appendLine(f, "");
        io.appendJsonl(f, "{\"a\":2}");

        assertEquals(List.of("{\"a\":1}", "{\"a\":2}"), io.readJsonl(f));
    }

    @Test
    public void rollbackDiscardsPendingWrite() throws Exception {
        FileIO io = new FileIO(tmp.getRoot().toPath());
        Path f = io.resolve("snap.jsonl");
        io.writeString(f, "kept");

        FileIO.WriterHandle h = io.openWriter(f);
        h.writer.write("discarded");
        io.rollback(h);

        assertEquals("kept", io.readString(f));
        assertFalse(Files.exists(h.tmpFile));
    }
}
