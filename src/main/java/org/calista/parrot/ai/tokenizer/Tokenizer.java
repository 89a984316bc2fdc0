package org.calista.parrot.ai.tokenizer;

import java.util.List;

/**
 * Splits raw text into sentences and words.
 *
 * <p>Implementations are pure and stateless: same input, same output. Case is left
 * untouched; callers lowercase before building or querying the index.</p>
 */
public interface Tokenizer {

    /** Sentences in original order, trimmed, never empty. */
    List<String> splitSentences(String text);

    /** Words in original order, delimiters stripped, never empty. */
    List<String> tokenize(String text);
}
