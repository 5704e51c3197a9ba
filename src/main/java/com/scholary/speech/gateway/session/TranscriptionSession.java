package com.scholary.speech.gateway.session;

import com.scholary.speech.gateway.access.Role;
import com.scholary.speech.gateway.chunking.LiveSegmentProducer;
import com.scholary.speech.gateway.transcript.SessionTranscript;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * State of one transcription session.
 *
 * <p>A session is either fed by client-side chunks posted to the chunk endpoint, or by a
 * server-side {@link LiveSegmentProducer}. Both paths merge into the same {@link
 * SessionTranscript}.
 */
public class TranscriptionSession {

  private final String sessionId;
  private final String userId;
  private final Role role;
  private final Instant createdAt;
  private final SessionTranscript transcript;
  private final AtomicInteger chunksTranscribed = new AtomicInteger();
  private final AtomicInteger chunksFailed = new AtomicInteger();

  private volatile String language;
  private volatile String requestedModel;
  private volatile String lastModel;
  private volatile boolean degraded;
  private volatile LiveSegmentProducer producer;

  public TranscriptionSession(
      String sessionId, String userId, Role role, Instant createdAt, SessionTranscript transcript) {
    this.sessionId = sessionId;
    this.userId = userId;
    this.role = role;
    this.createdAt = createdAt;
    this.transcript = transcript;
  }

  public String getSessionId() {
    return sessionId;
  }

  public String getUserId() {
    return userId;
  }

  public Role getRole() {
    return role;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public SessionTranscript getTranscript() {
    return transcript;
  }

  public String getLanguage() {
    return language;
  }

  public void setLanguage(String language) {
    this.language = language;
  }

  public String getRequestedModel() {
    return requestedModel;
  }

  public void setRequestedModel(String requestedModel) {
    this.requestedModel = requestedModel;
  }

  /** Model that produced the most recent fragment. */
  public String getLastModel() {
    return lastModel;
  }

  /** True once any chunk of the session ran on a degraded access decision. */
  public boolean isDegraded() {
    return degraded;
  }

  public void recordSuccess(String model, boolean degradedDecision) {
    chunksTranscribed.incrementAndGet();
    lastModel = model;
    if (degradedDecision) {
      degraded = true;
    }
  }

  public void recordFailure() {
    chunksFailed.incrementAndGet();
  }

  public int getChunksTranscribed() {
    return chunksTranscribed.get();
  }

  public int getChunksFailed() {
    return chunksFailed.get();
  }

  public Optional<LiveSegmentProducer> getProducer() {
    return Optional.ofNullable(producer);
  }

  public void attachProducer(LiveSegmentProducer producer) {
    this.producer = producer;
  }

  public boolean isLive() {
    LiveSegmentProducer current = producer;
    return current != null && current.isRecording();
  }
}
