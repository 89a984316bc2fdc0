package org.calista.parrot.ai.tokenizer.impl;

import org.calista.parrot.ai.tokenizer.Tokenizer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Delimiter tokenizer:
 * - sentence boundary = whitespace right after '.', '!' or '?'
 * - "we.cant.split.urls." stays one sentence (no whitespace after the dots)
 * - word delimiters = runs of , . ! ? : and whitespace
 */
public final class DelimiterTokenizer implements Tokenizer {

    /** One lookbehind char is enough: a run of [.!?] always ends with one of them. */
    private static final Pattern SENTENCE_BOUNDARY =
            Pattern.compile("(?<=[.!?])\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern WORD_DELIMITERS =
            Pattern.compile("[,.!?:\\s]+", Pattern.UNICODE_CHARACTER_CLASS);

    @Override
    public List<String> splitSentences(String text) {
        if (text == null || text.isEmpty()) return List.of();

        String[] parts = SENTENCE_BOUNDARY.split(text);
        ArrayList<String> out = new ArrayList<>(parts.length);
        for (String p : parts) {
            String s = p.strip();
            if (!s.isEmpty()) out.add(s);
        }
        return out;
    }

    @Override
    public List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) return List.of();

        String[] parts = WORD_DELIMITERS.split(text);
        ArrayList<String> out = new ArrayList<>(parts.length);
        for (String p : parts) if (!p.isEmpty()) out.add(p);
        return out;
    }
}
