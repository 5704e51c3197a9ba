package com.scholary.speech.gateway.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.speech.gateway.chunking.AudioContainer;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Client for Gemini's {@code generateContent} endpoint, sending the audio inline as base64 with a
 * transcription prompt.
 */
@Component
public class GeminiTranscriptionClient extends HttpSpeechProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeminiTranscriptionClient.class);

  public static final String NAME = "gemini";

  private static final String PROMPT =
      "Please transcribe the following audio file to text only.%s Do not include timestamps,"
          + " speaker labels, or any metadata - just provide the spoken text.";

  private final ObjectMapper objectMapper;

  public GeminiTranscriptionClient(ProviderProperties properties, ObjectMapper objectMapper) {
    super(properties.gemini());
    this.objectMapper = objectMapper;
    LOGGER.info("Initialized Gemini client: baseUrl={}", properties.gemini().baseUrl());
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  protected HttpRequest buildRequest(
      byte[] audio, AudioContainer container, String language, String model) throws IOException {
    String path =
        "/v1beta/models/" + URLEncoder.encode(model, StandardCharsets.UTF_8) + ":generateContent";

    return HttpRequest.newBuilder()
        .uri(URI.create(endpoint.baseUrl() + path))
        .timeout(readTimeout())
        .header("x-goog-api-key", endpoint.apiKey())
        .header("Content-Type", "application/json")
        .POST(BodyPublishers.ofByteArray(requestBody(audio, container, language)))
        .build();
  }

  byte[] requestBody(byte[] audio, AudioContainer container, String language)
      throws IOException {
    String languageHint =
        language == null || language.isBlank() || "auto".equalsIgnoreCase(language)
            ? ""
            : " The language is " + language + ".";

    ObjectNode root = objectMapper.createObjectNode();
    ObjectNode content = root.putArray("contents").addObject();
    ArrayNode parts = content.putArray("parts");
    parts.addObject().put("text", String.format(PROMPT, languageHint));
    ObjectNode inline = parts.addObject().putObject("inline_data");
    inline.put("mime_type", container.contentType());
    inline.put("data", Base64.getEncoder().encodeToString(audio));

    ObjectNode generation = root.putObject("generationConfig");
    generation.put("temperature", 0.2);
    generation.put("topP", 0.95);
    generation.put("maxOutputTokens", 8192);

    return objectMapper.writeValueAsBytes(root);
  }

  @Override
  protected String parseResponse(String body) throws IOException {
    JsonNode candidates = objectMapper.readTree(body).path("candidates");
    if (!candidates.isArray() || candidates.isEmpty()) {
      throw new ProviderException(NAME, "Response has no candidates: " + body);
    }
    StringBuilder text = new StringBuilder();
    for (JsonNode part : candidates.get(0).path("content").path("parts")) {
      text.append(part.path("text").asText(""));
    }
    return text.toString();
  }
}
