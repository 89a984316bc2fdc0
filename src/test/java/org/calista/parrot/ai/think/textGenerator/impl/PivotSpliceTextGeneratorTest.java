package org.calista.parrot.ai.think.textGenerator.impl;

import org.calista.parrot.ai.knowledge.Dictionary;
import org.calista.parrot.ai.think.RandomSource;
import org.calista.parrot.ai.think.StepRandomSource;
import org.calista.parrot.ai.tokenizer.Tokenizer;
import org.calista.parrot.ai.tokenizer.impl.DelimiterTokenizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class PivotSpliceTextGeneratorTest {

  private final Tokenizer tokenizer = new DelimiterTokenizer();
  private Dictionary crabs;

  @BeforeEach
  void setUp() {
    crabs = new Dictionary(
        tokenizer,
        List.of(
            "hey there everyone",
            "everyone is a crab",
            "crabs are great",
            "there are many crabs",
            "crabs"),
        Map.of(
            "hey", List.of(0),
            "there", List.of(0, 3),
            "everyone", List.of(0, 1),
            "is", List.of(1),
            "a", List.of(1),
            "crab", List.of(1),
            "crabs", List.of(2, 3, 4),
            "are", List.of(2, 3),
            "great", List.of(3),
            "many", List.of(3)));
  }

  private Optional<String> respond(Dictionary d, String line, RandomSource random) {
    return new PivotSpliceTextGenerator(d, tokenizer).respondTo(line, random);
  }

  @Test
  @DisplayName("Draw order is pivot, left donor, right donor; each value taken mod list size")
  void splicesAroundDrawnPivot() {
    // pivot everyone (2 % 3), left donor #1 (3 % 2), right donor #0 (4 % 2)
    assertEquals(Optional.of("everyone"), respond(crabs, "Hey there everyone!", new StepRandomSource(2, 1)));
    // pivot everyone (8 % 3), both donors #0
    assertEquals(Optional.of("hey there everyone"), respond(crabs, "Hey there everyone!", new StepRandomSource(8, 10)));
    // pivot crabs (2 % 3), left donor "crabs are great", right donor "there are many crabs"
    assertEquals(Optional.of("crabs"), respond(crabs, "hey there crabs people", new StepRandomSource(2, 7)));
  }

  @Test
  void noResponseWhenPivotIsInFewerThanTwoSentences() {
    assertEquals(Optional.empty(), respond(crabs, "hey there crab people", new StepRandomSource(2, 7)));
  }

  @Test
  void noResponseWithoutKnownWords() {
    assertEquals(Optional.empty(), respond(crabs, "nothing in common", new StepRandomSource(0, 1)));
    assertEquals(Optional.empty(), respond(crabs, "", new StepRandomSource(0, 1)));
    assertEquals(Optional.empty(), respond(Dictionary.newEmpty(), "hey there", new StepRandomSource(0, 1)));
  }

  @Test
  void leftContextIsJoinedWithRightContext() {
    // pivot are; left donor "there are many crabs", right donor "crabs are great"
    assertEquals(Optional.of("there are great"), respond(crabs, "are", new StepRandomSource(0, 1)));
  }

  @Test
  @DisplayName("Both donors may be the same sentence")
  void sameSentenceMayDonateBothSides() {
    assertEquals(Optional.of("hey there everyone"), respond(crabs, "everyone", new StepRandomSource(0, 0)));
  }

  @Test
  void respondsAfterRebuildUsingNewPositions() {
    Dictionary d = new Dictionary(tokenizer, crabs.sentences(), Map.of());
    d.rebuildIndices();
    assertEquals(List.of(2, 3), d.indices().get("everyone"));

    // left donor "hey there everyone", right donor "everyone is a crab"
    assertEquals(Optional.of("hey there everyone is a crab"), respond(d, "Hey there everyone!", new StepRandomSource(2, 1)));
  }

  @Test
  void repeatedInputWordsWeighPivotChoice() {
    // known words: [there, there, everyone]; 1 % 3 picks the second "there"
    Optional<String> r = respond(crabs, "there there everyone", new StepRandomSource(1, 1));
    // there -> [#0, #3]; left #0 (2 % 2) "hey", right #1 (3 % 2) "there are many crabs"
    assertEquals(Optional.of("hey there are many crabs"), r);
  }

  @Test
  void punctuationOfDonorsIsDropped() {
    Dictionary d = Dictionary.newEmpty();
    d.learn("Hello, my friend! My dog: barks loudly.");
    d.learn("my cat sleeps.");

    Optional<String> r = respond(d, "MY", new StepRandomSource(0, 1));
    assertThat(r).isPresent();
    assertThat(r.get()).doesNotContain(",", "!", ".", ":");
    assertThat(r.get()).contains("my");
  }

  @Test
  @DisplayName("Right donor without the pivot fails loudly instead of producing garbage")
  void indexPointingAtSentenceWithoutPivotIsAnInvariantViolation() {
    Dictionary broken = new Dictionary(tokenizer, List.of("a b", "c d"), Map.of("a", List.of(0, 1)));

    // left donor #0 is fine, right donor #1 lacks the pivot
    assertThrows(IllegalStateException.class, () -> respond(broken, "a", new StepRandomSource(1, 1)));
  }
}
