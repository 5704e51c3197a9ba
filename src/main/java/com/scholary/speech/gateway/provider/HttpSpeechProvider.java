package com.scholary.speech.gateway.provider;

import com.scholary.speech.gateway.chunking.AudioContainer;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared plumbing for providers reached over HTTP: one JDK HttpClient per provider, per-request
 * read timeouts, and retries with exponential backoff plus jitter.
 *
 * <p>Transport errors, 429 and 5xx responses are retried. Any other non-2xx status fails at once,
 * because repeating a request with a bad key or an unsupported model won't help.
 */
public abstract class HttpSpeechProvider implements SpeechProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpSpeechProvider.class);

  protected final HttpClient httpClient;
  protected final ProviderProperties.Endpoint endpoint;

  protected HttpSpeechProvider(ProviderProperties.Endpoint endpoint) {
    this.endpoint = endpoint;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(endpoint.connectTimeout()))
            .build();
  }

  /** Build the request for one attempt. */
  protected abstract HttpRequest buildRequest(
      byte[] audio, AudioContainer container, String language, String model) throws IOException;

  /** Extract the transcript from a 2xx response body. */
  protected abstract String parseResponse(String body) throws IOException;

  @Override
  public String transcribe(byte[] audio, AudioContainer container, String language, String model) {
    if (endpoint.apiKey() == null || endpoint.apiKey().isBlank()) {
      throw new ProviderException(name(), name() + " API key is not configured");
    }

    int attempt = 0;
    IOException lastException = null;

    while (attempt < endpoint.maxRetries()) {
      try {
        return attemptTranscribe(audio, container, language, model);
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < endpoint.maxRetries()) {
          long backoffMs = backoffMillis(attempt);
          LOGGER.warn(
              "{} attempt {} failed, retrying in {}ms: {}",
              name(),
              attempt,
              backoffMs,
              e.getMessage());
          sleep(backoffMs);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new ProviderException(name(), "Transcription interrupted", e);
      }
    }

    throw new ProviderException(
        name(),
        String.format("%s failed after %d attempts", name(), endpoint.maxRetries()),
        lastException);
  }

  private String attemptTranscribe(
      byte[] audio, AudioContainer container, String language, String model)
      throws IOException, InterruptedException {
    HttpRequest request = buildRequest(audio, container, language, model);
    LOGGER.debug("Sending transcription request to {}", request.uri());

    HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    int status = response.statusCode();

    if (status == 429 || status >= 500) {
      throw new IOException(
          String.format("%s returned status %d: %s", name(), status, abbreviate(response.body())));
    }
    if (status < 200 || status >= 300) {
      throw new ProviderException(
          name(),
          String.format("%s returned status %d: %s", name(), status, abbreviate(response.body())));
    }

    String text = parseResponse(response.body());
    LOGGER.info("{} transcription successful: model={}, chars={}", name(), model, text.length());
    return text;
  }

  long backoffMillis(int attempt) {
    long base = endpoint.retryBackoffMillis();
    long jitter = base > 0 ? ThreadLocalRandom.current().nextLong(base) : 0;
    return (1L << (attempt - 1)) * base + jitter;
  }

  private void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new ProviderException(name(), "Transcription interrupted", ie);
    }
  }

  protected Duration readTimeout() {
    return Duration.ofSeconds(endpoint.readTimeout());
  }

  private static String abbreviate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() <= 300 ? body : body.substring(0, 300) + "...";
  }
}
