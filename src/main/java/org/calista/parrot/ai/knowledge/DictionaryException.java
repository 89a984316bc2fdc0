package org.calista.parrot.ai.knowledge;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Failure to load or persist a {@link Dictionary}.
 *
 * <p>{@link Kind#IO} wraps a filesystem fault unchanged as the cause; {@link Kind#FORMAT}
 * means the document on disk is malformed (or the state could not be serialized).
 * Nothing is retried: the caller decides whether to abort or go on with an empty store.</p>
 */
public class DictionaryException extends IOException {

    public enum Kind { IO, FORMAT }

    private final Kind kind;
    private final Path file;

    public DictionaryException(Kind kind, Path file, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.file = file;
    }

    public static DictionaryException io(Path file, IOException cause) {
        return new DictionaryException(Kind.IO, file, "Dictionary I/O failed: " + file + ": " + cause.getMessage(), cause);
    }

    public static DictionaryException format(Path file, Throwable cause) {
        return new DictionaryException(Kind.FORMAT, file, "Malformed dictionary: " + file + ": " + cause.getMessage(), cause);
    }

    public Kind getKind() {
        return kind;
    }

    /** File the operation was working on; may be null. */
    public Path getFile() {
        return file;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
                + "{kind=" + kind
                + ", file=" + file
                + ", message=" + getMessage()
                + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
                + '}';
    }
}
