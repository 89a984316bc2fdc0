package org.calista.parrot.ai.knowledge;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.parrot.ai.tokenizer.Tokenizer;
import org.calista.parrot.ai.tokenizer.impl.DelimiterTokenizer;

import java.nio.file.Path;
import java.util.*;

/**
 * Dictionary: the knowledge store: ordered sentences + inverted word index.
 *
 * <p>
 * Sentences are addressed by position. The index maps a lowercase word to the
 * positions of the sentences containing it, each position at most once per word.
 * {@link #learn(String)} appends and updates the index incrementally;
 * {@link #rebuildIndices()} re-sorts everything and recomputes from scratch.
 * </p>
 *
 * <p>
 * The index is either empty or consistent with the sentences. An empty index next to
 * non-empty sentences (old files, manual edits) is reported by {@link #needsIndexRebuild()};
 * the owner is expected to rebuild before answering.
 * </p>
 */
public final class Dictionary implements KnowledgeBase {
    private static final Logger log = LogManager.getLogger(Dictionary.class);

    /** Lowercase, compared by code point (same order as UTF-8 bytes). */
    private static final Comparator<String> BY_LOWERCASE =
            (a, b) -> compareCodePoints(lower(a), lower(b));

    private final Tokenizer tokenizer;

    private final ArrayList<String> sentences;
    /** Same content as {@link #sentences}, for O(1) {@link #knowsSentence(String)}. */
    private final HashSet<String> knownSentences;
    private final LinkedHashMap<String, List<Integer>> indices;

    public Dictionary() {
        this(new DelimiterTokenizer());
    }

    public Dictionary(Tokenizer tokenizer) {
        this(tokenizer, List.of(), Map.of());
    }

    /**
     * Restores a dictionary from persisted parts. The index is taken as-is (it may be empty
     * and stale), but every position must point at an existing sentence, once per word.
     *
     * @throws IllegalArgumentException on null entries, out-of-range or repeated positions
     */
    public Dictionary(Tokenizer tokenizer, List<String> sentences, Map<String, List<Integer>> indices) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        Objects.requireNonNull(sentences, "sentences");
        Objects.requireNonNull(indices, "indices");

        this.sentences = new ArrayList<>(sentences.size());
        for (int i = 0; i < sentences.size(); i++) {
            String s = sentences.get(i);
            if (s == null) throw new IllegalArgumentException("sentence #" + i + " is null");
            this.sentences.add(s);
        }
        this.knownSentences = new HashSet<>(this.sentences);

        this.indices = new LinkedHashMap<>(Math.max(16, indices.size() * 2));
        for (Map.Entry<String, List<Integer>> e : indices.entrySet()) {
            String word = e.getKey();
            List<Integer> positions = e.getValue();
            if (word == null) throw new IllegalArgumentException("index word is null");
            if (positions == null) throw new IllegalArgumentException("positions of '" + word + "' are null");

            ArrayList<Integer> copy = new ArrayList<>(positions.size());
            HashSet<Integer> seen = new HashSet<>();
            for (Integer p : positions) {
                if (p == null || p < 0 || p >= this.sentences.size()) {
                    throw new IllegalArgumentException("position " + p + " of '" + word
                            + "' is outside [0, " + this.sentences.size() + ")");
                }
                if (!seen.add(p)) {
                    throw new IllegalArgumentException("position " + p + " listed twice for '" + word + "'");
                }
                copy.add(p);
            }
            this.indices.put(word, copy);
        }
    }

    public static Dictionary newEmpty() {
        return new Dictionary();
    }

    // =========================
    // Persistence shortcuts
    // =========================

    /**
     * Loads the dictionary stored at {@code path}. A missing file is not an error:
     * an empty dictionary is created, written there and returned.
     */
    public static Dictionary load(Path path) throws DictionaryException {
        return DictionarySnapshotStore.forFile(path).load();
    }

    public void writeToDisk(Path path) throws DictionaryException {
        DictionarySnapshotStore.forFile(path).save(this);
    }

    // =========================
    // Index maintenance
    // =========================

    @Override
    public boolean needsIndexRebuild() {
        return !sentences.isEmpty() && indices.isEmpty();
    }

    @Override
    public void rebuildIndices() {
        indices.clear();
        sentences.sort(BY_LOWERCASE); // List.sort is stable: ties keep their order

        for (int i = 0; i < sentences.size(); i++) {
            String sentence = lower(sentences.get(i));
            log.trace("Indexing #{}: {}", i, sentence);
            indexSentence(sentence, i);
        }
        log.info("Indices rebuilt: sentences={}, words={}", sentences.size(), indices.size());
    }

    private void indexSentence(String lowercaseSentence, int position) {
        for (String word : tokenizer.tokenize(lowercaseSentence)) {
            insertWord(word, position);
        }
    }

    /** Appends {@code position} under {@code word} unless already listed. */
    void insertWord(String word, int position) {
        List<Integer> positions = indices.computeIfAbsent(word, k -> new ArrayList<>(4));
        // restored lists are not guaranteed sorted: scan, don't peek at the tail
        if (!positions.contains(position)) positions.add(position);
    }

    // =========================
    // Learn / lookup
    // =========================

    @Override
    public boolean learn(String line) {
        Objects.requireNonNull(line, "line");

        boolean learnedSomething = false;
        for (String sentence : tokenizer.splitSentences(lower(line))) {
            if (knowsSentence(sentence)) continue;

            int position = sentences.size();
            sentences.add(sentence);
            knownSentences.add(sentence);
            indexSentence(sentence, position);

            learnedSomething = true;
            if (log.isDebugEnabled()) log.debug("Learned #{}: {}", position, sentence);
        }
        return learnedSomething;
    }

    @Override
    public boolean knowsSentence(String sentence) {
        if (sentence == null) return false;
        return knownSentences.contains(lower(sentence));
    }

    @Override
    public boolean knowsWord(String word) {
        if (word == null) return false;
        return indices.containsKey(word);
    }

    @Override
    public List<String> sentencesWithWord(String word) {
        List<Integer> positions = (word == null) ? null : indices.get(word);
        if (positions == null) return List.of();

        ArrayList<String> out = new ArrayList<>(positions.size());
        for (int p : positions) out.add(sentences.get(p));
        return out;
    }

    @Override
    public List<String> knownWords(String line) {
        if (line == null) return List.of();

        ArrayList<String> out = new ArrayList<>();
        for (String word : tokenizer.tokenize(lower(line))) {
            if (knowsWord(word)) out.add(word);
        }
        return out;
    }

    // =========================
    // Views / stats
    // =========================

    @Override
    public List<String> sentences() {
        return Collections.unmodifiableList(sentences);
    }

    /** Read-only down to the position lists; the lists themselves stay live. */
    @Override
    public Map<String, List<Integer>> indices() {
        LinkedHashMap<String, List<Integer>> view = new LinkedHashMap<>(Math.max(16, indices.size() * 2));
        indices.forEach((word, positions) -> view.put(word, Collections.unmodifiableList(positions)));
        return Collections.unmodifiableMap(view);
    }

    @Override
    public int size() {
        return sentences.size();
    }

    @Override
    public int wordCount() {
        return indices.size();
    }

    public Tokenizer tokenizer() {
        return tokenizer;
    }

    // =========================
    // Equality (tests, round trips)
    // =========================

    /** Same sentences in the same order and same word -> positions lists. Key order is ignored. */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Dictionary other)) return false;
        return sentences.equals(other.sentences) && indices.equals(other.indices);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sentences, indices);
    }

    @Override
    public String toString() {
        return "Dictionary{sentences=" + sentences.size() + ", words=" + indices.size() + '}';
    }

    // =========================
    // Helpers
    // =========================

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }

    private static int compareCodePoints(String a, String b) {
        int i = 0, j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) return Integer.compare(ca, cb);
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }
}
