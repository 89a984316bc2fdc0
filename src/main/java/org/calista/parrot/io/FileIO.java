package org.calista.parrot.io;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * FileIO: единая точка I/O в проекте.
 *
 * <p>
 * Bound to a base directory (runtime data dir). Relative paths are resolved inside it,
 * escaping via ".." is rejected. Text writes are atomic by default: content goes to a
 * temp sibling first and is then moved over the target, so a crash never leaves a
 * half-written dictionary behind.
 * </p>
 *
 * Без внешних зависимостей.
 */
public final class FileIO {
    private static final Logger log = LogManager.getLogger(FileIO.class);

    // ----------------------------
    // Options / Builder
    // ----------------------------

    public static final class Options {
        public final Charset charset;
        public final boolean atomicWrites;
        public final boolean fsyncOnCommit;

        private Options(Builder b) {
            this.charset = b.charset;
            this.atomicWrites = b.atomicWrites;
            this.fsyncOnCommit = b.fsyncOnCommit;
        }

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private Charset charset = StandardCharsets.UTF_8;
            private boolean atomicWrites = true;
            private boolean fsyncOnCommit = false;

            public Builder charset(Charset v) {
                this.charset = Objects.requireNonNull(v);
                return this;
            }

            public Builder atomicWrites(boolean v) {
                this.atomicWrites = v;
                return this;
            }

            public Builder fsyncOnCommit(boolean v) {
                this.fsyncOnCommit = v;
                return this;
            }

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

    public FileIO(Path baseDir, Charset charset, boolean atomicWrites) {
        this(baseDir, Options.builder()
                .charset(Objects.requireNonNull(charset, "charset"))
                .atomicWrites(atomicWrites)
                .build());
    }

    public FileIO(Path baseDir, Options options) {
        this.baseDir = Objects.requireNonNull(baseDir, "baseDir").toAbsolutePath().normalize();
        this.opt = Objects.requireNonNull(options, "options");
        log.debug("FileIO init: baseDir={}, charset={}, atomicWrites={}, fsyncOnCommit={}",
                this.baseDir, opt.charset, opt.atomicWrites, opt.fsyncOnCommit);
        try {
            ensureBaseDir();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to ensure base directory exists: " + this.baseDir, e);
        }
    }

    // ----------------------------
    // Base dir / Resolve
    // ----------------------------

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
     * Резолвит относительный путь внутри baseDir и защищает от выхода через "..".
     * Абсолютные пути запрещены.
     */
    public Path resolve(String relative) {
        Objects.requireNonNull(relative, "relative");
        Path rel = Paths.get(relative.replace('\\', '/'));
        if (rel.isAbsolute()) throw new IllegalArgumentException("resolve(relative) does not accept absolute paths: " + relative);

        Path p = baseDir.resolve(rel).normalize().toAbsolutePath();
        if (!p.startsWith(baseDir)) throw new IllegalArgumentException("Path traversal detected: " + relative);
        return p;
    }

    public void ensureParentDir(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
    }

    // ----------------------------
    // Existence / Text
    // ----------------------------

    /** True only for regular files; a directory at {@code file} is not "existing" here. */
    public boolean exists(Path file) {
        Objects.requireNonNull(file, "file");
        return Files.isRegularFile(file);
    }

    public String readString(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.readString(file, opt.charset);
    }

    public Optional<String> readStringIfExists(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!exists(file)) return Optional.empty();
        return Optional.of(readString(file));
    }

    public List<String> readLines(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        return Files.readAllLines(file, opt.charset);
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

        Path tmp = tempSibling(file);
        Files.writeString(tmp, content, opt.charset,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        atomicCommit(tmp, file);
    }

    // ----------------------------
    // Internals
    // ----------------------------

    private static Path tempSibling(Path target) {
        return target.resolveSibling(target.getFileName().toString() + ".tmp");
    }

    private void atomicCommit(Path tmp, Path target) throws IOException {
        if (opt.fsyncOnCommit) fsync(tmp);

        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.trace("atomicCommit: {} -> {} (ATOMIC)", tmp, target);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.trace("atomicCommit: {} -> {} (NON-ATOMIC fallback)", tmp, target);
        } finally {
            // если move не удался, tmp может остаться
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException e) {
                log.warn("atomicCommit: failed to delete tmp {}", tmp, e);
            }
        }
    }

    private static void fsync(Path file) {
        try (FileChannel ch = FileChannel.open(file, StandardOpenOption.READ)) {
            ch.force(true);
        } catch (IOException e) {
            log.debug("fsync ignored for {}: {}", file, e.toString());
        }
    }
}
