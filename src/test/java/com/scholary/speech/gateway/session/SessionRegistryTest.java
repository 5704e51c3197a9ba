package com.scholary.speech.gateway.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.speech.gateway.access.Role;
import com.scholary.speech.gateway.testutil.MutableClock;
import com.scholary.speech.gateway.testutil.TestProperties;
import com.scholary.speech.gateway.transcript.OverlapDeduplicator;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SessionRegistryTest {

  private SessionRegistry registry;

  @BeforeEach
  void setUp() {
    registry =
        new SessionRegistry(
            TestProperties.transcription(System.getProperty("java.io.tmpdir")),
            new OverlapDeduplicator(10),
            MutableClock.at("2025-03-10T12:00:00Z"));
  }

  @Test
  void getOrCreate_shouldReturnTheSameSessionForTheOwner() {
    TranscriptionSession first = registry.getOrCreate("s-1", "alice", Role.NORMAL_USER);
    TranscriptionSession second = registry.getOrCreate("s-1", "alice", Role.NORMAL_USER);

    assertThat(second).isSameAs(first);
    assertThat(first.getUserId()).isEqualTo("alice");
    assertThat(first.getCreatedAt()).isEqualTo(Instant.parse("2025-03-10T12:00:00Z"));
    assertThat(first.isLive()).isFalse();
  }

  @Test
  void getOrCreate_otherUserShouldBeRejected() {
    registry.getOrCreate("s-1", "alice", Role.NORMAL_USER);

    assertThatThrownBy(() -> registry.getOrCreate("s-1", "mallory", Role.NORMAL_USER))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("belongs to another user");
  }

  @Test
  void remove_shouldForgetTheSession() {
    registry.getOrCreate("s-1", "alice", Role.NORMAL_USER);
    registry.getOrCreate("s-2", "bob", Role.NORMAL_USER);
    assertThat(registry.size()).isEqualTo(2);

    registry.remove("s-1");

    assertThat(registry.find("s-1")).isEmpty();
    assertThat(registry.find("s-2")).isPresent();
    assertThat(registry.size()).isEqualTo(1);
  }

  @Test
  void recordSuccess_shouldKeepDegradedSticky() {
    TranscriptionSession session = registry.getOrCreate("s-1", "alice", Role.NORMAL_USER);

    session.recordSuccess("gemini-2.5-flash", true);
    session.recordSuccess("gemini-2.0-flash-lite", false);
    session.recordFailure();

    assertThat(session.isDegraded()).isTrue();
    assertThat(session.getLastModel()).isEqualTo("gemini-2.0-flash-lite");
    assertThat(session.getChunksTranscribed()).isEqualTo(2);
    assertThat(session.getChunksFailed()).isEqualTo(1);
  }
}
