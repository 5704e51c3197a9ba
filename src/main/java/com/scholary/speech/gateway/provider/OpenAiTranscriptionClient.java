package com.scholary.speech.gateway.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.speech.gateway.chunking.AudioContainer;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Client for OpenAI's {@code /v1/audio/transcriptions} endpoint.
 *
 * <p>The JDK HttpClient has no multipart support, so the form body is assembled by hand:
 *
 * <pre>
 * --boundary
 * Content-Disposition: form-data; name="file"; filename="chunk.webm"
 * Content-Type: audio/webm
 *
 * [binary data]
 * --boundary
 * Content-Disposition: form-data; name="model"
 *
 * gpt-4o-mini-transcribe
 * --boundary--
 * </pre>
 */
@Component
public class OpenAiTranscriptionClient extends HttpSpeechProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(OpenAiTranscriptionClient.class);

  public static final String NAME = "openai";

  private final ObjectMapper objectMapper;

  public OpenAiTranscriptionClient(ProviderProperties properties, ObjectMapper objectMapper) {
    super(properties.openai());
    this.objectMapper = objectMapper;
    LOGGER.info("Initialized OpenAI client: baseUrl={}", properties.openai().baseUrl());
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  protected HttpRequest buildRequest(
      byte[] audio, AudioContainer container, String language, String model) throws IOException {
    String boundary = UUID.randomUUID().toString();
    byte[] body = multipartBody(audio, container, language, model, boundary);

    return HttpRequest.newBuilder()
        .uri(URI.create(endpoint.baseUrl() + "/v1/audio/transcriptions"))
        .timeout(readTimeout())
        .header("Authorization", "Bearer " + endpoint.apiKey())
        .header("Content-Type", "multipart/form-data; boundary=" + boundary)
        .POST(BodyPublishers.ofByteArray(body))
        .build();
  }

  @Override
  protected String parseResponse(String body) throws IOException {
    JsonNode text = objectMapper.readTree(body).path("text");
    if (!text.isTextual()) {
      throw new ProviderException(NAME, "Response has no text field");
    }
    return text.asText();
  }

  static byte[] multipartBody(
      byte[] audio, AudioContainer container, String language, String model, String boundary)
      throws IOException {
    ByteArrayOutputStream body = new ByteArrayOutputStream(audio.length + 1024);

    StringBuilder head = new StringBuilder();
    head.append("--").append(boundary).append("\r\n");
    head.append("Content-Disposition: form-data; name=\"file\"; filename=\"chunk.")
        .append(container.extension())
        .append("\"\r\n");
    head.append("Content-Type: ").append(container.contentType()).append("\r\n\r\n");
    body.write(head.toString().getBytes(StandardCharsets.UTF_8));
    body.write(audio);
    body.write("\r\n".getBytes(StandardCharsets.UTF_8));

    StringBuilder fields = new StringBuilder();
    appendField(fields, boundary, "model", model);
    appendField(fields, boundary, "response_format", "json");
    if (language != null && !language.isBlank() && !"auto".equalsIgnoreCase(language)) {
      appendField(fields, boundary, "language", language);
    }
    fields.append("--").append(boundary).append("--\r\n");
    body.write(fields.toString().getBytes(StandardCharsets.UTF_8));

    return body.toByteArray();
  }

  private static void appendField(StringBuilder sb, String boundary, String name, String value) {
    sb.append("--").append(boundary).append("\r\n");
    sb.append("Content-Disposition: form-data; name=\"").append(name).append("\"\r\n\r\n");
    sb.append(value).append("\r\n");
  }
}
