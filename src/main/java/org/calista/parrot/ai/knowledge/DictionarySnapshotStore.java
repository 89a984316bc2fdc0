package org.calista.parrot.ai.knowledge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.parrot.ai.tokenizer.Tokenizer;
import org.calista.parrot.ai.tokenizer.impl.DelimiterTokenizer;
import org.calista.parrot.io.FileIO;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * DictionarySnapshotStore: persist/load a {@link Dictionary} as one JSON document.
 *
 * <p>
 * Пишем атомарно через FileIO. Loading is strict: a broken document fails the whole load
 * with {@link DictionaryException.Kind#FORMAT}, nothing is skipped or repaired. Filesystem
 * faults surface as {@link DictionaryException.Kind#IO}.
 * </p>
 *
 * <p>A missing file on {@link #load()} yields a fresh empty dictionary, written to disk at once.</p>
 */
public final class DictionarySnapshotStore {
    private static final Logger log = LogManager.getLogger(DictionarySnapshotStore.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final Path file;
    private final Tokenizer tokenizer;

    public DictionarySnapshotStore(FileIO io, ObjectMapper mapper, Path file, Tokenizer tokenizer) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.file = Objects.requireNonNull(file, "file");
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
    }

    /**
     * Store over an arbitrary path with the default mapper and tokenizer.
     *
     * @throws DictionaryException (IO) if the parent directory cannot be created
     */
    public static DictionarySnapshotStore forFile(Path file) throws DictionaryException {
        Objects.requireNonNull(file, "file");
        Path abs = file.toAbsolutePath().normalize();
        Path dir = abs.getParent() == null ? abs.getRoot() : abs.getParent();
        FileIO io;
        try {
            io = new FileIO(dir);
        } catch (UncheckedIOException e) {
            throw DictionaryException.io(abs, e.getCause());
        }
        return new DictionarySnapshotStore(io, defaultMapper(), abs, new DelimiterTokenizer());
    }

    /**
     * Mapper for dictionary documents: positions must be real JSON integers, sentences real
     * JSON strings (no "1", 1.5 or true either way), and nothing after the closing brace.
     */
    public static ObjectMapper defaultMapper() {
        ObjectMapper om = new ObjectMapper();
        om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        om.configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false);
        om.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
        om.coercionConfigFor(LogicalType.Integer).setCoercion(CoercionInputShape.String, CoercionAction.Fail);
        om.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        return om;
    }

    public Path file() {
        return file;
    }

    public Dictionary load() throws DictionaryException {
        if (!io.exists(file)) {
            Dictionary created = new Dictionary(tokenizer);
            save(created);
            log.info("Dictionary not found. Created empty dictionary at {}", file);
            return created;
        }

        String json;
        try {
            json = io.readString(file);
        } catch (IOException e) {
            throw DictionaryException.io(file, e);
        }

        Dictionary d = parse(json);
        log.info("Dictionary loaded: file={}, sentences={}, words={}", file, d.size(), d.wordCount());
        if (d.needsIndexRebuild()) {
            log.warn("Dictionary {} has sentences but no indices; rebuild required", file);
        }
        return d;
    }

    public void save(Dictionary dictionary) throws DictionaryException {
        Objects.requireNonNull(dictionary, "dictionary");

        String json;
        try {
            json = mapper.writeValueAsString(DictionarySnapshot.of(dictionary));
        } catch (JsonProcessingException e) {
            throw DictionaryException.format(file, e);
        }

        try {
            io.writeString(file, json);
        } catch (IOException e) {
            throw DictionaryException.io(file, e);
        }
        log.debug("Dictionary saved: file={}, sentences={}, words={}", file, dictionary.size(), dictionary.wordCount());
    }

    private Dictionary parse(String json) throws DictionaryException {
        DictionarySnapshot snapshot;
        try {
            snapshot = mapper.readValue(json, DictionarySnapshot.class);
        } catch (JsonProcessingException e) {
            throw DictionaryException.format(file, e);
        }
        if (snapshot == null) {
            throw DictionaryException.format(file, new IllegalArgumentException("document is JSON null"));
        }
        if (snapshot.sentences == null || snapshot.indices == null) {
            throw DictionaryException.format(file, new IllegalArgumentException("'sentences' and 'indices' must not be null"));
        }

        try {
            return new Dictionary(tokenizer, snapshot.sentences, snapshot.indices);
        } catch (IllegalArgumentException e) {
            throw DictionaryException.format(file, e);
        }
    }
}
