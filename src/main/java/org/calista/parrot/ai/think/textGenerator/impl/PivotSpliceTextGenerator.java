package org.calista.parrot.ai.think.textGenerator.impl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.parrot.ai.knowledge.KnowledgeBase;
import org.calista.parrot.ai.think.RandomSource;
import org.calista.parrot.ai.think.textGenerator.TextGenerator;
import org.calista.parrot.ai.tokenizer.Tokenizer;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Pivot splice generator.
 *
 * <p>Pipeline (each step either halts with no response or moves on):</p>
 * <ol>
 *   <li>known words of the input (duplicates kept); none → empty</li>
 *   <li>pivot = random pick among them</li>
 *   <li>sentences indexed under the pivot; fewer than 2 → empty</li>
 *   <li>two independent picks with replacement: left donor, right donor</li>
 *   <li>left donor words before the first pivot + right donor words from the first pivot on</li>
 * </ol>
 *
 * <p>Draw order is fixed: pivot, left donor, right donor. Tests rely on it.</p>
 */
public final class PivotSpliceTextGenerator implements TextGenerator {
    private static final Logger log = LogManager.getLogger(PivotSpliceTextGenerator.class);

    private final KnowledgeBase kb;
    private final Tokenizer tokenizer;

    public PivotSpliceTextGenerator(KnowledgeBase kb, Tokenizer tokenizer) {
        this.kb = Objects.requireNonNull(kb, "kb");
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
    }

    @Override
    public Optional<String> respondTo(String line, RandomSource random) {
        Objects.requireNonNull(random, "random");

        List<String> knownWords = kb.knownWords(line);
        if (knownWords.isEmpty()) return Optional.empty();

        String pivot = random.pick(knownWords);

        List<String> candidates = kb.sentencesWithWord(pivot);
        if (candidates.size() < 2) {
            log.debug("No response: pivot '{}' is in {} sentence(s)", pivot, candidates.size());
            return Optional.empty();
        }

        String left = random.pick(candidates);
        String right = random.pick(candidates);

        String leftContext = String.join(" ", wordsBeforePivot(left, pivot));
        String rightContext = String.join(" ", wordsFromPivot(right, pivot));

        String response = leftContext.isEmpty() ? rightContext : leftContext + " " + rightContext;
        if (log.isDebugEnabled()) {
            log.debug("Response: pivot='{}', left='{}', right='{}' -> '{}'", pivot, left, right, response);
        }
        return Optional.of(response);
    }

    /** Words strictly before the first pivot; empty if the pivot opens the sentence or is absent. */
    List<String> wordsBeforePivot(String sentence, String pivot) {
        List<String> words = words(sentence);
        int at = words.indexOf(pivot);
        return at < 0 ? List.of() : words.subList(0, at);
    }

    /** Words from the first pivot to the end, pivot included. */
    List<String> wordsFromPivot(String sentence, String pivot) {
        List<String> words = words(sentence);
        int at = words.indexOf(pivot);
        if (at < 0) {
            throw new IllegalStateException("index lists sentence without pivot '" + pivot + "': " + sentence);
        }
        return words.subList(at, words.size());
    }

    /** The index is built from lowercased sentences, so donors are split the same way. */
    private List<String> words(String sentence) {
        return tokenizer.tokenize(sentence.toLowerCase(Locale.ROOT));
    }
}
