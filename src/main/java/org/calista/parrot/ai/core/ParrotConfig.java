package org.calista.parrot.ai.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.parrot.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * ParrotConfig. Простой POJO конфиг:
 * - дефолты в полях
 * - loadOrCreate() создаёт файл, если его нет
 * - validate() нормализует значения
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ParrotConfig {

    private static final Logger log = LoggerFactory.getLogger(ParrotConfig.class);

    public String baseDir = "data";
    public DictionarySection dictionary = new DictionarySection();
    public Corpora corpora = new Corpora();
    public Behavior behavior = new Behavior();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class DictionarySection {
        /** Relative to baseDir. */
        public String file = "dictionary.json";
        public int autoSaveEveryTurns = 5;
        /** Re-sort and reindex on every start, not only when the index is missing. */
        public boolean rebuildOnStartup = false;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Corpora {
        public String dir = "corpora";
        /** Plain-text files, one utterance per line. */
        public List<String> bootstrap = List.of();
        public boolean failFast = false;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Behavior {
        public boolean learning = true;
        public boolean speaking = true;
        /** Probability of answering a line that could be answered. */
        public double replyRate = 1.0;
        /** Fixed seed for a reproducible session; null = seeded from the clock. */
        public Long seed = null;
    }

    // -------------------- Load / Create --------------------

    /**
     * Загружает конфиг. Если файла нет (или он пустой), создаёт дефолтный и пишет на диск.
     */
    public static ParrotConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            ParrotConfig created = new ParrotConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            ParrotConfig created = new ParrotConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        ParrotConfig cfg = mapper.readValue(json, ParrotConfig.class);
        if (cfg == null) cfg = new ParrotConfig();

        cfg.validate();
        return cfg;
    }

    public static void save(FileIO io, Path configFile, ObjectMapper mapper, ParrotConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, ParrotConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";

        if (dictionary == null) dictionary = new DictionarySection();
        if (dictionary.file == null || dictionary.file.isBlank()) dictionary.file = "dictionary.json";
        if (dictionary.autoSaveEveryTurns < 1) dictionary.autoSaveEveryTurns = 1;

        if (corpora == null) corpora = new Corpora();
        if (corpora.dir == null || corpora.dir.isBlank()) corpora.dir = "corpora";
        if (corpora.bootstrap == null) corpora.bootstrap = List.of();

        if (behavior == null) behavior = new Behavior();
        if (!Double.isFinite(behavior.replyRate)) behavior.replyRate = 1.0;
        if (behavior.replyRate < 0.0) behavior.replyRate = 0.0;
        if (behavior.replyRate > 1.0) behavior.replyRate = 1.0;
    }
}
