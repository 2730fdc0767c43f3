package org.calista.autobuild.solver.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.autobuild.io.FileIO;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Append-only JSONL log of progress events.
 */
public final class DiagnosticsStore {

    private static final Logger log = LogManager.getLogger(DiagnosticsStore.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;

    public DiagnosticsStore(FileIO io, ObjectMapper mapper, Path file) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path file() {
        return file;
    }

    public void append(ProgressEvent e) throws IOException {
        io.appendJsonl(file, mapper.writeValueAsString(e));
    }

    /**
     * Listener that appends every event. IO failures surface as {@link UncheckedIOException}
     * on the search thread.
     */
    public ProgressListener asListener() {
        return e -> {
            try {
                append(e);
            } catch (IOException ex) {
                throw new UncheckedIOException("diagnostics append failed: " + file, ex);
            }
        };
    }

    public List<ProgressEvent> readAll() throws IOException {
        List<String> lines = io.readJsonl(file);
        List<ProgressEvent> out = new ArrayList<>(lines.size());
        for (String line : lines) {
            try {
                out.add(mapper.readValue(line, ProgressEvent.class));
            } catch (JsonProcessingException ex) {
                log.warn("Skipping malformed diagnostics line in {}: {}", file, ex.getOriginalMessage());
            }
        }
        return out;
    }
}
