package com.scholary.speech.gateway.access;

import static com.scholary.speech.gateway.access.ServiceType.INTERPRETATION;
import static com.scholary.speech.gateway.access.ServiceType.TRANSCRIPTION;
import static com.scholary.speech.gateway.access.ServiceType.TRANSLATION;
import static com.scholary.speech.gateway.access.ServiceType.TTS;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Known models and the alias table that upgrades deprecated identifiers.
 *
 * <p>Canonicalization follows alias chains to a fixed point, so it is idempotent. Configured
 * aliases are merged over the built-in table; a cycle or an alias that leads to no known model
 * fails start-up.
 */
@Component
public class ModelCatalog {

  private static final Logger LOGGER = LoggerFactory.getLogger(ModelCatalog.class);

  private static final List<ModelInfo> MODELS =
      List.of(
          new ModelInfo(
              "gemini-2.5-flash",
              "gemini",
              PlanType.FREE,
              Set.of(TRANSCRIPTION, TRANSLATION, INTERPRETATION),
              "Gemini 2.5 Flash"),
          new ModelInfo(
              "gemini-2.0-flash-lite",
              "gemini",
              PlanType.FREE,
              Set.of(TRANSCRIPTION, TRANSLATION),
              "Gemini 2.0 Flash Lite"),
          new ModelInfo(
              "gemini-2.5-flash-preview-05-20",
              "gemini",
              PlanType.BASIC,
              Set.of(TRANSCRIPTION, INTERPRETATION),
              "Gemini 2.5 Flash Preview (May 2025)"),
          new ModelInfo(
              "gemini-2.5-flash-preview-09-2025",
              "gemini",
              PlanType.BASIC,
              Set.of(TRANSCRIPTION, INTERPRETATION),
              "Gemini 2.5 Flash Preview (Sept 2025)"),
          new ModelInfo(
              "gemini-2.5-pro",
              "gemini",
              PlanType.PROFESSIONAL,
              Set.of(TRANSCRIPTION, INTERPRETATION),
              "Gemini 2.5 Pro"),
          new ModelInfo(
              "gpt-4o-mini-transcribe",
              "openai",
              PlanType.BASIC,
              Set.of(TRANSCRIPTION),
              "OpenAI GPT-4o Mini Transcribe"),
          new ModelInfo(
              "gpt-4o-transcribe",
              "openai",
              PlanType.BASIC,
              Set.of(TRANSCRIPTION),
              "OpenAI GPT-4o Transcribe"),
          new ModelInfo(
              "gpt-4.1-mini", "openai", PlanType.BASIC, Set.of(TRANSLATION), "GPT-4.1 Mini"),
          new ModelInfo(
              "gemini-2.5-flash-tts",
              "gemini",
              PlanType.BASIC,
              Set.of(TTS),
              "Gemini 2.5 Flash TTS"),
          new ModelInfo("gpt4o-mini", "openai", PlanType.BASIC, Set.of(TTS), "GPT-4o Mini TTS"),
          new ModelInfo("openai", "openai", PlanType.BASIC, Set.of(TTS), "OpenAI TTS-1"));

  private static final Map<String, String> BUILT_IN_ALIASES =
      Map.of(
          "gemini-2.5-flash-preview-04-17", "gemini-2.5-flash-preview-05-20",
          "gemini-2.5-flash-preview", "gemini-2.5-flash",
          "gemini", "gemini-2.0-flash-lite",
          "gemini-2.5-pro-preview", "gemini-2.0-flash-lite",
          "whisper-1", "gpt-4o-mini-transcribe");

  private final Map<String, ModelInfo> models;
  private final Map<String, String> aliases;
  private final String baselineModel;

  public ModelCatalog(AccessProperties properties) {
    Map<String, ModelInfo> byName = new LinkedHashMap<>();
    MODELS.forEach(model -> byName.put(model.name(), model));
    this.models = Collections.unmodifiableMap(byName);

    Map<String, String> merged = new LinkedHashMap<>(BUILT_IN_ALIASES);
    properties
        .modelAliases()
        .forEach((alias, target) -> merged.put(normalize(alias), normalize(target)));
    validateAliases(merged, byName);
    this.aliases = Collections.unmodifiableMap(merged);

    this.baselineModel = canonicalize(properties.baselineModel());
    if (!models.containsKey(baselineModel)) {
      throw new IllegalStateException("Baseline model is not in the catalog: " + baselineModel);
    }
    LOGGER.info(
        "Model catalog loaded: models={}, aliases={}, baseline={}",
        models.size(),
        aliases.size(),
        baselineModel);
  }

  /**
   * Map a possibly deprecated identifier to its current one. Unknown identifiers come back
   * normalized but otherwise unchanged; a blank identifier becomes the baseline model.
   */
  public String canonicalize(String requested) {
    if (requested == null || requested.isBlank()) {
      return baselineModel;
    }
    String current = normalize(requested);
    // Chains were checked for cycles at start-up, so this terminates
    while (aliases.containsKey(current)) {
      current = aliases.get(current);
    }
    return current;
  }

  public Optional<ModelInfo> find(String model) {
    return Optional.ofNullable(models.get(canonicalize(model)));
  }

  public String baselineModel() {
    return baselineModel;
  }

  /** True when the free baseline can serve the given service type. */
  public boolean baselineSupports(ServiceType serviceType) {
    return models.get(baselineModel).supports(serviceType);
  }

  public List<ModelInfo> models() {
    return List.copyOf(models.values());
  }

  /** All identifiers that canonicalize to the given model, excluding the model itself. */
  public List<String> aliasesOf(String canonicalModel) {
    List<String> result = new ArrayList<>();
    for (String alias : aliases.keySet()) {
      if (canonicalize(alias).equals(canonicalModel)) {
        result.add(alias);
      }
    }
    Collections.sort(result);
    return result;
  }

  private static void validateAliases(Map<String, String> aliases, Map<String, ModelInfo> models) {
    for (String start : aliases.keySet()) {
      Set<String> seen = new HashSet<>();
      String current = start;
      while (aliases.containsKey(current)) {
        if (!seen.add(current)) {
          throw new IllegalStateException("Model alias cycle involving: " + start);
        }
        current = aliases.get(current);
      }
      if (!models.containsKey(current)) {
        throw new IllegalStateException(
            String.format("Model alias %s leads to unknown model %s", start, current));
      }
    }
  }

  private static String normalize(String model) {
    return model.trim().toLowerCase(Locale.ROOT);
  }
}
