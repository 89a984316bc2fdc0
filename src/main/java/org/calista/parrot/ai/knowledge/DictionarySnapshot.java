package org.calista.parrot.ai.knowledge;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * On-disk shape of a {@link Dictionary}:
 * <pre>{"sentences":["..."],"indices":{"word":[0,3]}}</pre>
 * Both fields are required. Unknown extra fields are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"sentences", "indices"})
public final class DictionarySnapshot {

    public final List<String> sentences;
    public final Map<String, List<Integer>> indices;

    @JsonCreator
    public DictionarySnapshot(
            @JsonProperty(value = "sentences", required = true) List<String> sentences,
            @JsonProperty(value = "indices", required = true) Map<String, List<Integer>> indices) {
        this.sentences = sentences;
        this.indices = indices;
    }

    public static DictionarySnapshot of(KnowledgeBase kb) {
        LinkedHashMap<String, List<Integer>> idx = new LinkedHashMap<>();
        kb.indices().forEach((word, positions) -> idx.put(word, List.copyOf(positions)));
        return new DictionarySnapshot(new ArrayList<>(kb.sentences()), idx);
    }
}
