package com.scholary.speech.gateway.transcript;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OverlapDeduplicatorTest {

  private OverlapDeduplicator deduplicator;

  @BeforeEach
  void setUp() {
    deduplicator = new OverlapDeduplicator(5);
  }

  @Test
  void dedupe_shouldStripWordsRepeatedFromTheWindow() {
    DedupResult result = deduplicator.dedupe(List.of("the", "quick", "brown"), "brown fox jumps");

    assertThat(result.strippedText()).isEqualTo("fox jumps");
    assertThat(result.overlapWords()).isEqualTo(1);
    assertThat(result.trailingWindow()).containsExactly("the", "quick", "brown", "fox", "jumps");
  }

  @Test
  void dedupe_shouldPreferTheLongestOverlap() {
    DedupResult result =
        deduplicator.dedupe(List.of("a", "b", "a", "b"), "a b a b c");

    assertThat(result.overlapWords()).isEqualTo(4);
    assertThat(result.strippedText()).isEqualTo("c");
  }

  @Test
  void dedupe_shouldIgnoreCaseAndSurroundingPunctuation() {
    DedupResult result =
        deduplicator.dedupe(List.of("said", "hello", "World."), "world, and goodbye");

    assertThat(result.overlapWords()).isEqualTo(1);
    assertThat(result.strippedText()).isEqualTo("and goodbye");
  }

  @Test
  void dedupe_withoutOverlapShouldKeepEverything() {
    DedupResult result = deduplicator.dedupe(List.of("one", "two"), "three four");

    assertThat(result.overlapWords()).isZero();
    assertThat(result.strippedText()).isEqualTo("three four");
    assertThat(result.trailingWindow()).containsExactly("one", "two", "three", "four");
  }

  @Test
  void dedupe_shouldOnlyMatchAtTheFragmentStart() {
    DedupResult result = deduplicator.dedupe(List.of("brown"), "the brown fox");

    assertThat(result.overlapWords()).isZero();
    assertThat(result.strippedText()).isEqualTo("the brown fox");
  }

  @Test
  void dedupe_fullyRepeatedFragmentShouldBecomeEmpty() {
    DedupResult result = deduplicator.dedupe(List.of("x", "fox", "jumps"), "fox jumps");

    assertThat(result.strippedText()).isEmpty();
    assertThat(result.trailingWindow()).containsExactly("x", "fox", "jumps");
  }

  @Test
  void dedupe_punctuationOnlyTokensShouldNeverMatch() {
    DedupResult result = deduplicator.dedupe(List.of("end", "..."), "... start");

    assertThat(result.overlapWords()).isZero();
    assertThat(result.strippedText()).isEqualTo("... start");
  }

  @Test
  void dedupe_shouldBoundTheWindow() {
    DedupResult result =
        deduplicator.dedupe(List.of(), "one two three four five six seven");

    assertThat(result.trailingWindow()).containsExactly("three", "four", "five", "six", "seven");
  }

  @Test
  void dedupe_emptyInputsShouldBeHarmless() {
    assertThat(deduplicator.dedupe(List.of(), "").strippedText()).isEmpty();
    assertThat(deduplicator.dedupe(List.of("a"), "   ").trailingWindow()).containsExactly("a");
    assertThat(deduplicator.dedupe(List.of(), "first words").strippedText())
        .isEqualTo("first words");
  }

  @Test
  void tokenize_shouldSplitOnAnyWhitespace() {
    assertThat(OverlapDeduplicator.tokenize("  a\tb\n\nc  ")).containsExactly("a", "b", "c");
    assertThat(OverlapDeduplicator.tokenize(null)).isEmpty();
  }

  @Test
  void constructor_shouldRejectNonPositiveWindow() {
    assertThatThrownBy(() -> new OverlapDeduplicator(0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
