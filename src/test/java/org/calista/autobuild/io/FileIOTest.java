package org.calista.autobuild.io;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileIOTest {

    @TempDir
    Path dir;

    @Test
    void writeStringReplacesContentAtomically() throws Exception {
        FileIO io = new FileIO(dir);
        Path f = io.resolve("nested/config.json");

        io.writeString(f, "{\"a\":1}");
        io.writeString(f, "{\"a\":2}");

        assertEquals("{\"a\":2}", io.readString(f));
        assertFalse(Files.exists(f.resolveSibling("config.json.tmp")));
    }

    @Test
    void readingAMissingFileFails() {
        FileIO io = new FileIO(dir);
        assertThrows(NoSuchFileException.class, () -> io.readString(io.resolve("missing.json")));
    }

    @Test
    void resolveStaysInsideBaseDir() {
        FileIO io = new FileIO(dir);
        assertThrows(IllegalArgumentException.class, () -> io.resolve("../escape.json"));
        assertThrows(IllegalArgumentException.class, () -> io.resolve(dir.toAbsolutePath().toString()));
        assertEquals(io.baseDir().resolve("a/b.json"), io.resolve("a\\b.json"));
    }

    @Test
    void jsonlAppendsSkipBlankRecords() throws Exception {
        FileIO io = new FileIO(dir);
        Path f = io.resolve("log.jsonl");

        assertEquals(List.of(), io.readJsonl(f));
        io.appendJsonl(f, "{\"n\":1}");
        io.appendJsonl(f, "   ");
        io.appendJsonl(f, " {\"n\":2} ");

        assertEquals(List.of("{\"n\":1}", "{\"n\":2}"), io.readJsonl(f));
    }
}
