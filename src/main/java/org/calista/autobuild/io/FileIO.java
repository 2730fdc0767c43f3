package org.calista.autobuild.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * FileIO — единая точка файлового I/O солвера.
 *
 * <p>Конфиг пишется атомарно (tmp + move), журнал диагностики дописывается построчно в JSONL.
 * Относительные пути резолвятся внутри baseDir с защитой от выхода через "..".</p>
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    public static final class Options {
        public final Charset charset;
        public final boolean atomicWrites;
        public final boolean fsyncOnCommit;
        public final boolean lockWrites;
        public final Duration lockTimeout;

        private Options(Builder b) {
            this.charset = Objects.requireNonNull(b.charset, "charset");
            this.atomicWrites = b.atomicWrites;
            this.fsyncOnCommit = b.fsyncOnCommit;
            this.lockWrites = b.lockWrites;
            this.lockTimeout = Objects.requireNonNull(b.lockTimeout, "lockTimeout");
            if (lockTimeout.isNegative()) throw new IllegalArgumentException("lockTimeout must be >= 0");
        }

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private Charset charset = StandardCharsets.UTF_8;
            private boolean atomicWrites = true;
            private boolean fsyncOnCommit = false;
            private boolean lockWrites = true;
            private Duration lockTimeout = Duration.ofSeconds(2);

            private Builder() {}

            public Builder charset(Charset v) { this.charset = v; return this; }
            public Builder atomicWrites(boolean v) { this.atomicWrites = v; return this; }
            public Builder fsyncOnCommit(boolean v) { this.fsyncOnCommit = v; return this; }
            public Builder lockWrites(boolean v) { this.lockWrites = v; return this; }
            public Builder lockTimeout(Duration v) { this.lockTimeout = v; return this; }

            public Options build() {
                return new Options(this);
            }
        }
    }

    private final Path baseDir;
    private final Options opt;

    public FileIO(Path baseDir) {
        this(baseDir, Options.builder().build());
    }

    public FileIO(Path baseDir, Options options) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.opt = Objects.requireNonNull(options, "options");
        log.debug("FileIO init: baseDir={}, charset={}, atomicWrites={}, lockWrites={}",
                this.baseDir, opt.charset, opt.atomicWrites, opt.lockWrites);
        try {
            ensureBaseDir();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to ensure base directory exists: " + this.baseDir, e);
        }
    }

    public Path baseDir() {
        return baseDir;
    }

    public Options options() {
        return opt;
    }

    public void ensureBaseDir() throws IOException {
        Files.createDirectories(baseDir);
    }

    /**
     * Резолвит относительный путь внутри baseDir. Абсолютные пути и выход через ".." запрещены.
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        Path rel = Paths.get(relative.replace('\\', '/'));
        if (rel.isAbsolute()) throw new IllegalArgumentException("resolve(relative) does not accept absolute paths: " + relative);

        Path p = baseDir.resolve(rel).normalize().toAbsolutePath();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path traversal detected: " + relative);
        return p;
    }

    public boolean exists(Path file) {
        return Files.exists(Objects.requireNonNull(file, "file"));
    }

    public void ensureParentDir(Path file) throws IOException {
        Path parent = Objects.requireNonNull(file, "file").getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    /** Весь файл как строка; отсутствующий файл даёт {@link java.nio.file.NoSuchFileException}. */
    public String readString(Path file) throws IOException {
        return Files.readString(Objects.requireNonNull(file, "file"), opt.charset);
    }

    public void writeString(Path file, String content) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(content, "content");
        ensureParentDir(file);

        if (!opt.atomicWrites) {
            Files.writeString(file, content, opt.charset,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            return;
        }
        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        Files.writeString(tmp, content, opt.charset,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        commit(tmp, file);
    }

    /** Одна JSON-запись на строку; пустые записи пропускаются. */
    public void appendJsonl(Path file, String jsonLine) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(jsonLine, "jsonLine");
        String s = jsonLine.trim();
        if (s.isEmpty()) return;
        ensureParentDir(file);

        String line = s + System.lineSeparator();
        if (!opt.lockWrites) {
            append(file, line);
            return;
        }
        withWriteLock(file, () -> append(file, line));
    }

    /** Непустые строки JSONL-файла (trim). Отсутствующий файл даёт пустой список. */
    public List<String> readJsonl(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.exists(file)) return List.of();
        try (Stream<String> s = Files.lines(file, opt.charset)) {
            List<String> out = s.map(String::trim).filter(x -> !x.isEmpty()).collect(Collectors.toList());
            log.debug("readJsonl: {} ({} records)", file, out.size());
            return out;
        }
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private void append(Path file, String line) throws IOException {
        Files.writeString(file, line, opt.charset,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    private void commit(Path tmp, Path target) throws IOException {
        if (opt.fsyncOnCommit) {
            try (FileChannel ch = FileChannel.open(tmp, StandardOpenOption.WRITE)) {
                ch.force(true);
            }
        }
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move unsupported for {}, falling back to replace", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void withWriteLock(Path file, IoRunnable action) throws IOException {
        if (!Files.exists(file)) {
            try {
                Files.createFile(file);
            } catch (FileAlreadyExistsException e) {
                log.trace("Lock file appeared concurrently: {}", file);
            }
        }

        long deadlineNs = System.nanoTime() + opt.lockTimeout.toNanos();
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.WRITE)) {
            while (true) {
                try {
                    FileLock lock = ch.tryLock();
                    if (lock != null) {
                        try (lock) {
                            action.run();
                            if (opt.fsyncOnCommit) ch.force(true);
                            return;
                        }
                    }
                } catch (OverlappingFileLockException e) {
                    log.trace("Lock held in-process for {}, retrying", file);
                }
                if (System.nanoTime() >= deadlineNs) {
                    throw new IOException("Write lock timeout for " + file);
                }
                pause();
            }
        }
    }

    private static void pause() throws IOException {
        try {
            Thread.sleep(10);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for write lock", ie);
        }
    }

    @FunctionalInterface
    private interface IoRunnable {
        void run() throws IOException;
    }
}
