package com.scholary.speech.gateway.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.scholary.speech.gateway.access.Role;
import com.scholary.speech.gateway.chunking.LiveSegmentProducer;
import com.scholary.speech.gateway.config.TranscriptionProperties;
import com.scholary.speech.gateway.transcript.OverlapDeduplicator;
import com.scholary.speech.gateway.transcript.SessionTranscript;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * In-memory registry of open transcription sessions.
 *
 * <p>Uses a Caffeine cache so idle sessions expire on their own. A live session that is evicted
 * has its recording stopped.
 */
@Repository
public class SessionRegistry {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionRegistry.class);

  private final Cache<String, TranscriptionSession> cache;
  private final OverlapDeduplicator deduplicator;
  private final Clock clock;
  private final int maxBuffered;

  public SessionRegistry(
      TranscriptionProperties properties, OverlapDeduplicator deduplicator, Clock clock) {
    this.deduplicator = deduplicator;
    this.clock = clock;
    this.maxBuffered = properties.merge().maxBufferedFragments();
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(properties.session().maxSessions())
            .expireAfterAccess(Duration.ofMinutes(properties.session().ttlMinutes()))
            .removalListener(this::onRemoval)
            .build();

    LOGGER.info(
        "Initialized session registry: maxSessions={}, ttlMinutes={}",
        properties.session().maxSessions(),
        properties.session().ttlMinutes());
  }

  /**
   * Return the session with this id, creating it for the given caller if it doesn't exist.
   *
   * @throws IllegalArgumentException if the session exists and belongs to another user
   */
  public TranscriptionSession getOrCreate(String sessionId, String userId, Role role) {
    TranscriptionSession session =
        cache.get(
            sessionId,
            id ->
                new TranscriptionSession(
                    id,
                    userId,
                    role,
                    clock.instant(),
                    new SessionTranscript(id, deduplicator, maxBuffered)));
    if (!session.getUserId().equals(userId)) {
      throw new IllegalArgumentException("Session " + sessionId + " belongs to another user");
    }
    return session;
  }

  public Optional<TranscriptionSession> find(String sessionId) {
    return Optional.ofNullable(cache.getIfPresent(sessionId));
  }

  public void remove(String sessionId) {
    cache.invalidate(sessionId);
  }

  public long size() {
    cache.cleanUp();
    return cache.estimatedSize();
  }

  private void onRemoval(String sessionId, TranscriptionSession session, RemovalCause cause) {
    if (session == null) {
      return;
    }
    if (cause.wasEvicted() && session.isLive()) {
      LOGGER.warn("Live session {} evicted ({}), stopping recording", sessionId, cause);
      session.getProducer().ifPresent(LiveSegmentProducer::stop);
    } else {
      LOGGER.debug("Session {} removed: {}", sessionId, cause);
    }
  }
}
