package org.calista.parrot.ai.knowledge;

import java.util.List;
import java.util.Map;

/**
 * KnowledgeBase: sentence memory plus its word index.
 *
 * <p>Реализация: {@link Dictionary}. Generators and bootstrappers see only this interface.</p>
 *
 * <p>Not thread-safe. One owner mutates and reads it; callers serialize access themselves.</p>
 */
public interface KnowledgeBase {

    /**
     * Learns every sentence of {@code line} that is not known yet.
     *
     * @return true if at least one sentence was added
     */
    boolean learn(String line);

    boolean knowsSentence(String sentence);

    boolean knowsWord(String word);

    /** Sentence texts indexed under {@code word}, in index order. Empty for unknown words. */
    List<String> sentencesWithWord(String word);

    /**
     * Words of {@code line} (lowercased) that are in the index, in input order.
     * Repeated words are kept: they weigh more when a pivot is drawn.
     */
    List<String> knownWords(String line);

    /** Sentences present but index empty: loaded legacy data or an external reset. */
    boolean needsIndexRebuild();

    /** Full recompute. Re-sorts sentences, so positions are not stable across a rebuild. */
    void rebuildIndices();

    /** Read-only view, position order. */
    List<String> sentences();

    /** Read-only view of word -> positions. */
    Map<String, List<Integer>> indices();

    int size();

    int wordCount();
}
