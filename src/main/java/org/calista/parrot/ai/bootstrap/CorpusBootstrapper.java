package org.calista.parrot.ai.bootstrap;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.parrot.ai.knowledge.KnowledgeBase;
import org.calista.parrot.io.FileIO;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Seeds a knowledge base from a plain-text corpus: every non-blank line is learned as if a
 * user had typed it.
 */
public final class CorpusBootstrapper {
    private static final Logger log = LogManager.getLogger(CorpusBootstrapper.class);

    private final FileIO io;

    public CorpusBootstrapper(FileIO io) {
        this.io = Objects.requireNonNull(io, "io");
    }

    /**
     * @param failFast rethrow the first failing line instead of logging and moving on
     */
    public Report loadInto(KnowledgeBase kb, Path corpusFile, boolean failFast) throws IOException {
        Objects.requireNonNull(kb, "kb");
        Objects.requireNonNull(corpusFile, "corpusFile");

        if (!io.exists(corpusFile)) {
            log.warn("Corpus not found: {}", corpusFile);
            return new Report(corpusFile, 0, 0, 0);
        }

        int lines = 0, learned = 0, bad = 0;
        List<String> raw = io.readLines(corpusFile);
        for (String line : raw) {
            if (line == null || line.isBlank()) continue;
            lines++;
            try {
                if (kb.learn(line)) learned++;
            } catch (RuntimeException e) {
                bad++;
                log.warn("Bad corpus line {} in {}: {}", lines, corpusFile, e.toString());
                if (failFast) throw new IOException("Bad corpus line " + lines + " in " + corpusFile + ": " + e, e);
            }
        }

        log.info("Corpus loaded: {} (lines={}, learned={}, bad={})", corpusFile, lines, learned, bad);
        return new Report(corpusFile, lines, learned, bad);
    }

    public static final class Report {
        public final Path file;
        /** Non-blank lines seen. */
        public final int lines;
        /** Lines that added at least one new sentence. */
        public final int learned;
        public final int bad;

        public Report(Path file, int lines, int learned, int bad) {
            this.file = file;
            this.lines = lines;
            this.learned = learned;
            this.bad = bad;
        }
    }
}
