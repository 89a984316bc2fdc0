package org.calista.parrot.ai.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.parrot.ai.bootstrap.CorpusBootstrapper;
import org.calista.parrot.ai.knowledge.Dictionary;
import org.calista.parrot.ai.knowledge.DictionaryException;
import org.calista.parrot.ai.knowledge.DictionarySnapshotStore;
import org.calista.parrot.ai.think.RandomSource;
import org.calista.parrot.ai.think.textGenerator.TextGenerator;
import org.calista.parrot.ai.think.textGenerator.impl.PivotSpliceTextGenerator;
import org.calista.parrot.ai.tokenizer.Tokenizer;
import org.calista.parrot.ai.tokenizer.impl.DelimiterTokenizer;
import org.calista.parrot.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.SplittableRandom;

/**
 * ParrotKernel: instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(config)  -> loadOrCreate config + FileIO + dictionary (NO corpus bootstrap)
 *   2) bootstrap()    -> learn corpora listed in config (explicit)
 *   3) use            -> learn / respondTo
 *   4) close()        -> save dictionary
 *
 * Single owner, single thread: nothing here is synchronized except bootstrap().
 */
public final class ParrotKernel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ParrotKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final ParrotConfig cfg;

    private final Tokenizer tokenizer;
    private final Dictionary dictionary;
    private final DictionarySnapshotStore snapshots;
    private final TextGenerator generator;

    /** Feeds the splice draws only. */
    private final RandomSource random;
    /** Reply-rate coin; kept apart so it never shifts the splice stream. */
    private final SplittableRandom replyCoin;

    private volatile boolean bootstrapped = false;

    private ParrotKernel(FileIO io,
                         ObjectMapper mapper,
                         ParrotConfig cfg,
                         Tokenizer tokenizer,
                         Dictionary dictionary,
                         DictionarySnapshotStore snapshots,
                         long seed) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.dictionary = Objects.requireNonNull(dictionary, "dictionary");
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.generator = new PivotSpliceTextGenerator(dictionary, tokenizer);

        SplittableRandom root = new SplittableRandom(seed);
        this.random = RandomSource.of(root.split());
        this.replyCoin = root.split();
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /** Root directory where config lives. Config is read BEFORE baseDir is known. */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;
        private Tokenizer tokenizer;

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        public Builder tokenizer(Tokenizer tokenizer) {
            this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
            return this;
        }

        /**
         * Creates the kernel: loads/creates config, loads/creates the dictionary and
         * rebuilds its index when stale (or always, if configured). Does NOT bootstrap corpora.
         */
        public ParrotKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper configMapper = (this.mapper != null) ? this.mapper : defaultMapper();
            Tokenizer tk = (this.tokenizer != null) ? this.tokenizer : new DelimiterTokenizer();

            Path cfgPath = configFile.isAbsolute() ? configFile : configRoot.resolve(configFile);
            FileIO external = new FileIO(cfgPath.toAbsolutePath().normalize().getParent(), charset, true);
            ParrotConfig cfg = ParrotConfig.loadOrCreate(external, cfgPath, configMapper);

            Path base = Path.of(cfg.baseDir);
            if (!base.isAbsolute()) base = configRoot.resolve(base);
            FileIO io = new FileIO(base, charset, true);

            DictionarySnapshotStore snapshots = new DictionarySnapshotStore(
                    io, DictionarySnapshotStore.defaultMapper(), io.resolve(cfg.dictionary.file), tk);
            Dictionary dictionary = snapshots.load();

            if (cfg.dictionary.rebuildOnStartup || dictionary.needsIndexRebuild()) {
                log.info("Rebuilding dictionary indices: sentences={}, forced={}",
                        dictionary.size(), cfg.dictionary.rebuildOnStartup);
                dictionary.rebuildIndices();
            }

            long seed = (cfg.behavior.seed != null) ? cfg.behavior.seed : System.nanoTime();
            ParrotKernel k = new ParrotKernel(io, configMapper, cfg, tk, dictionary, snapshots, seed);

            log.info("ParrotKernel created: config={}, baseDir={}, dictionary={}, sentences={}, words={}",
                    cfgPath, io.baseDir(), snapshots.file(), dictionary.size(), dictionary.wordCount());
            return k;
        }

        private static ObjectMapper defaultMapper() {
            ObjectMapper om = new ObjectMapper();
            om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            return om;
        }
    }

    // ---------------------------------------------------------------------
    // Bootstrap (explicit)
    // ---------------------------------------------------------------------

    /**
     * Learns corpora listed in config. Can be called once; repeated calls are no-ops.
     */
    public synchronized void bootstrap() throws IOException {
        if (bootstrapped) return;

        Path corporaDir = io.baseDir().resolve(cfg.corpora.dir).normalize();
        CorpusBootstrapper bs = new CorpusBootstrapper(io);

        int files = 0;
        int learned = 0;
        for (String name : cfg.corpora.bootstrap) {
            if (name == null || name.isBlank()) continue;
            learned += bs.loadInto(dictionary, corporaDir.resolve(name), cfg.corpora.failFast).learned;
            files++;
        }

        bootstrapped = true;
        log.info("ParrotKernel bootstrap done: corporaDir={}, files={}, learnedLines={}, failFast={}",
                corporaDir, files, learned, cfg.corpora.failFast);
    }

    public boolean isBootstrapped() {
        return bootstrapped;
    }

    // ---------------------------------------------------------------------
    // Conversation
    // ---------------------------------------------------------------------

    /** Learns the line unless learning is switched off. */
    public boolean learn(String line) {
        if (!cfg.behavior.learning) return false;
        return dictionary.learn(line);
    }

    /**
     * Answers with the kernel's own random stream, honoring {@code behavior.speaking}
     * and {@code behavior.replyRate}.
     */
    public Optional<String> respondTo(String line) {
        if (!cfg.behavior.speaking) return Optional.empty();
        if (cfg.behavior.replyRate < 1.0 && replyCoin.nextDouble() >= cfg.behavior.replyRate) {
            return Optional.empty();
        }
        return generator.respondTo(line, random);
    }

    /** Answers with an explicit random source. Ignores speaking/replyRate. */
    public Optional<String> respondTo(String line, RandomSource random) {
        return generator.respondTo(line, random);
    }

    public void save() throws DictionaryException {
        snapshots.save(dictionary);
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public ParrotConfig config() { return cfg; }
    public Tokenizer tokenizer() { return tokenizer; }
    public Dictionary dictionary() { return dictionary; }
    public DictionarySnapshotStore snapshotStore() { return snapshots; }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /** Saves the dictionary. */
    @Override
    public void close() throws DictionaryException {
        save();
        log.info("ParrotKernel closed: sentences={}, words={}", dictionary.size(), dictionary.wordCount());
    }
}
