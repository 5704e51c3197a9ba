package com.scholary.speech.gateway.access;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.speech.gateway.testutil.TestProperties;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ModelCatalogTest {

  private final ModelCatalog catalog =
      new ModelCatalog(TestProperties.access(Duration.ofSeconds(2)));

  @Test
  void canonicalize_followsDeprecatedAliases() {
    assertThat(catalog.canonicalize("gemini-2.5-flash-preview-04-17"))
        .isEqualTo("gemini-2.5-flash-preview-05-20");
    assertThat(catalog.canonicalize("whisper-1")).isEqualTo("gpt-4o-mini-transcribe");
    assertThat(catalog.canonicalize("gemini")).isEqualTo("gemini-2.0-flash-lite");
  }

  @Test
  void canonicalize_isIdempotent() {
    for (String id :
        new String[] {"gemini-2.5-flash-preview-04-17", "whisper-1", "gemini-2.5-pro", "nope"}) {
      String once = catalog.canonicalize(id);
      assertThat(catalog.canonicalize(once)).isEqualTo(once);
    }
  }

  @Test
  void canonicalize_blankMeansBaseline() {
    assertThat(catalog.canonicalize(null)).isEqualTo("gemini-2.5-flash");
    assertThat(catalog.canonicalize("  ")).isEqualTo("gemini-2.5-flash");
  }

  @Test
  void canonicalize_normalizesCaseAndWhitespace() {
    assertThat(catalog.canonicalize(" Gemini-2.5-Pro ")).isEqualTo("gemini-2.5-pro");
  }

  @Test
  void canonicalize_unknownModelPassesThrough() {
    assertThat(catalog.canonicalize("my-custom-model")).isEqualTo("my-custom-model");
    assertThat(catalog.find("my-custom-model")).isEmpty();
  }

  @Test
  void configuredAliases_chainThroughBuiltIns() {
    ModelCatalog custom =
        new ModelCatalog(
            new AccessProperties(
                "gemini-2.5-flash",
                Duration.ofSeconds(2),
                Duration.ofSeconds(3),
                2,
                10,
                Map.of("legacy-stt", "whisper-1")));

    assertThat(custom.canonicalize("legacy-stt")).isEqualTo("gpt-4o-mini-transcribe");
    assertThat(custom.aliasesOf("gpt-4o-mini-transcribe"))
        .containsExactly("legacy-stt", "whisper-1");
  }

  @Test
  void aliasCycle_failsStartup() {
    assertThatThrownBy(
            () ->
                new ModelCatalog(
                    new AccessProperties(
                        "gemini-2.5-flash",
                        Duration.ofSeconds(2),
                        Duration.ofSeconds(3),
                        2,
                        10,
                        Map.of("a", "b", "b", "a"))))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("cycle");
  }

  @Test
  void aliasToUnknownModel_failsStartup() {
    assertThatThrownBy(
            () ->
                new ModelCatalog(
                    new AccessProperties(
                        "gemini-2.5-flash",
                        Duration.ofSeconds(2),
                        Duration.ofSeconds(3),
                        2,
                        10,
                        Map.of("old", "does-not-exist"))))
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void baseline_supportsTranscriptionButNotTts() {
    assertThat(catalog.baselineModel()).isEqualTo("gemini-2.5-flash");
    assertThat(catalog.baselineSupports(ServiceType.TRANSCRIPTION)).isTrue();
    assertThat(catalog.baselineSupports(ServiceType.TTS)).isFalse();
  }
}
