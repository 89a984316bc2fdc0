package org.calista.parrot.ai.knowledge;

import org.calista.parrot.ai.tokenizer.impl.DelimiterTokenizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

public class DictionarySnapshotStoreTest {

  @Test
  void loadCreatesEmptyDictionaryWhenFileIsMissing(@TempDir Path tmp) throws Exception {
    Path file = tmp.resolve("dictionary.json");
    assertFalse(Files.exists(file));

    Dictionary d = Dictionary.load(file);

    assertEquals(0, d.size());
    assertEquals(0, d.wordCount());
    assertTrue(Files.exists(file));
    assertEquals("{\"sentences\":[],\"indices\":{}}", Files.readString(file));
  }

  @Test
  void loadCreatesMissingParentDirectories(@TempDir Path tmp) throws Exception {
    Path file = tmp.resolve("nested/deeper/dictionary.json");
    Dictionary.load(file);
    assertTrue(Files.isRegularFile(file));
  }

  @Test
  void writeThenLoadRoundTrips(@TempDir Path tmp) throws Exception {
    Path file = tmp.resolve("dictionary.json");
    Dictionary d = Dictionary.newEmpty();
    d.learn("Hey there, everyone! How is everyone doing today?!");
    d.learn("I've been doing fine today, what about you?");

    d.writeToDisk(file);
    Dictionary loaded = Dictionary.load(file);

    assertEquals(d, loaded);
    assertEquals(d.sentences(), loaded.sentences());

    // re-serializing the loaded copy gives the same document
    String first = Files.readString(file);
    loaded.writeToDisk(file);
    assertEquals(first, Files.readString(file));
  }

  @Test
  void roundTripKeepsPerWordPositionOrder(@TempDir Path tmp) throws Exception {
    Path file = tmp.resolve("dictionary.json");
    Dictionary d = new Dictionary(new DelimiterTokenizer(), List.of("a b", "b c", "c a"), Map.of("a", List.of(2, 0)));

    d.writeToDisk(file);
    Dictionary loaded = Dictionary.load(file);

    assertEquals(List.of(2, 0), loaded.indices().get("a"));
    assertEquals(d, loaded);
  }

  @Test
  void legacyFileWithoutIndexNeedsRebuild(@TempDir Path tmp) throws Exception {
    Path file = tmp.resolve("dictionary.json");
    Files.writeString(file, "{\"sentences\":[\"b c\",\"a b\"],\"indices\":{},\"extra\":true}");

    Dictionary d = Dictionary.load(file);

    assertTrue(d.needsIndexRebuild());
    d.rebuildIndices();
    assertEquals(List.of("a b", "b c"), d.sentences());
    assertEquals(List.of(0, 1), d.indices().get("b"));
  }

  @Test
  void malformedDocumentsFailWithFormatKind(@TempDir Path tmp) throws Exception {
    assertFormatError(tmp, "{not json");
    assertFormatError(tmp, "");
    assertFormatError(tmp, "null");
    assertFormatError(tmp, "{\"sentences\":[\"a\"],\"indices\":{\"a\":[0]");
    assertFormatError(tmp, "{\"sentences\":\"oops\",\"indices\":{}}");
    assertFormatError(tmp, "{\"sentences\":[\"a\"]}");
    assertFormatError(tmp, "{\"indices\":{}}");
    assertFormatError(tmp, "{\"sentences\":[\"a\"],\"indices\":{\"a\":0}}");
    assertFormatError(tmp, "{\"sentences\":[\"a\"],\"indices\":{\"a\":[1]}}");
    assertFormatError(tmp, "{\"sentences\":[\"a\"],\"indices\":{\"a\":[-1]}}");
    assertFormatError(tmp, "{\"sentences\":[\"a\"],\"indices\":{\"a\":[0.5]}}");
    assertFormatError(tmp, "{\"sentences\":[null],\"indices\":{}}");
    assertFormatError(tmp, "{\"sentences\":[true, 1.5],\"indices\":{}}");
    assertFormatError(tmp, "{\"sentences\":[false],\"indices\":{}}");
    assertFormatError(tmp, "{\"sentences\":[2.5],\"indices\":{}}");
    assertFormatError(tmp, "{\"sentences\":[7],\"indices\":{}}");
    assertFormatError(tmp, "{\"sentences\":[\"a\"],\"indices\":{\"a\":[0,0]}}");
    assertFormatError(tmp, "{\"sentences\":[],\"indices\":{}} trailing");
  }

  private static void assertFormatError(Path tmp, String content) throws Exception {
    Path file = tmp.resolve("broken.json");
    Files.writeString(file, content);

    DictionaryException e = assertThrows(DictionaryException.class, () -> Dictionary.load(file), content);
    assertEquals(DictionaryException.Kind.FORMAT, e.getKind(), content);
    assertEquals(file.toAbsolutePath().normalize(), e.getFile());
    assertNotNull(e.getCause());
  }

  @Test
  void writingOverDirectoryFailsWithIoKind(@TempDir Path tmp) throws Exception {
    Path dir = Files.createDirectories(tmp.resolve("dictionary.json"));
    Files.writeString(dir.resolve("occupant.txt"), "x");

    DictionaryException e = assertThrows(DictionaryException.class, () -> Dictionary.newEmpty().writeToDisk(dir));

    assertEquals(DictionaryException.Kind.IO, e.getKind());
    assertThat(e.getCause()).isInstanceOf(java.io.IOException.class);
    assertFalse(Files.exists(tmp.resolve("dictionary.json.tmp")));
  }

  @Test
  void unusableParentFailsWithIoKind(@TempDir Path tmp) throws Exception {
    Path notADir = Files.writeString(tmp.resolve("plain.txt"), "x");

    DictionaryException e = assertThrows(DictionaryException.class, () -> Dictionary.load(notADir.resolve("dictionary.json")));

    assertEquals(DictionaryException.Kind.IO, e.getKind());
  }
}
