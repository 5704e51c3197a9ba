package com.scholary.speech.gateway.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.speech.gateway.testutil.MutableClock;
import com.scholary.speech.gateway.testutil.TestAudio;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.TaskScheduler;

class LiveSegmentProducerTest {

  private static final Duration INTERVAL = Duration.ofSeconds(65);

  private MutableClock clock;
  private FakeEncoder encoder;
  private TaskScheduler scheduler;
  private ScheduledFuture<?> timer;
  private final List<Chunk> chunks = new ArrayList<>();
  private int completions;

  private LiveSegmentProducer producer;

  @BeforeEach
  void setUp() {
    clock = MutableClock.at("2025-03-10T09:00:00Z");
    encoder = new FakeEncoder(clock);
    scheduler = mock(TaskScheduler.class);
    timer = mock(ScheduledFuture.class);
    when(scheduler.scheduleAtFixedRate(any(Runnable.class), any(Instant.class), eq(INTERVAL)))
        .thenAnswer(invocation -> timer);

    producer =
        new LiveSegmentProducer(
            "live-1",
            encoder,
            scheduler,
            clock,
            INTERVAL,
            new ChunkListener() {
              @Override
              public void onChunk(Chunk chunk) {
                chunks.add(chunk);
              }

              @Override
              public void onComplete() {
                completions++;
              }
            });
  }

  @Test
  void recordingOf150Seconds_yieldsThreeChunks() {
    producer.start();
    verify(scheduler)
        .scheduleAtFixedRate(
            any(Runnable.class), eq(Instant.parse("2025-03-10T09:01:05Z")), eq(INTERVAL));

    clock.advance(INTERVAL);
    producer.rotate();
    clock.advance(INTERVAL);
    producer.rotate();
    clock.advance(Duration.ofSeconds(20));
    producer.stop();

    assertThat(chunks).extracting(Chunk::sequenceNumber).containsExactly(0, 1, 2);
    assertThat(chunks)
        .extracting(Chunk::durationHint)
        .containsExactly(INTERVAL, INTERVAL, Duration.ofSeconds(20));
    assertThat(chunks).allSatisfy(c -> assertThat(c.sourceSessionId()).isEqualTo("live-1"));
    assertThat(chunks)
        .allSatisfy(c -> assertThat(AudioContainer.problem(c.audio())).isEmpty());
    assertThat(completions).isEqualTo(1);
    verify(timer).cancel(false);
  }

  @Test
  void recordingOf150Seconds_canBeConsumedAsBlockingIterator() throws Exception {
    BlockingChunkIterator iterator = new BlockingChunkIterator();
    LiveSegmentProducer pulled =
        new LiveSegmentProducer("live-3", encoder, scheduler, clock, INTERVAL, iterator);
    CompletableFuture<List<Chunk>> consumer =
        CompletableFuture.supplyAsync(
            () -> {
              List<Chunk> seen = new ArrayList<>();
              iterator.forEachRemaining(seen::add);
              return seen;
            });

    pulled.start();
    clock.advance(INTERVAL);
    pulled.rotate();
    clock.advance(INTERVAL);
    pulled.rotate();
    assertThat(consumer).isNotDone();
    clock.advance(Duration.ofSeconds(20));
    pulled.stop();

    List<Chunk> seen = consumer.get(5, TimeUnit.SECONDS);
    assertThat(seen).extracting(Chunk::sequenceNumber).containsExactly(0, 1, 2);
    assertThat(seen)
        .extracting(Chunk::durationHint)
        .containsExactly(INTERVAL, INTERVAL, Duration.ofSeconds(20));
    assertThat(iterator.hasNext()).isFalse();
    assertThatThrownBy(iterator::next).isInstanceOf(NoSuchElementException.class);
  }

  @Test
  void blockingIterator_waitsForTheNextChunk() throws Exception {
    BlockingChunkIterator iterator = new BlockingChunkIterator();
    LiveSegmentProducer pulled =
        new LiveSegmentProducer("live-4", encoder, scheduler, clock, INTERVAL, iterator);
    pulled.start();
    CompletableFuture<Chunk> first = CompletableFuture.supplyAsync(iterator::next);

    Thread.sleep(100);
    assertThat(first).isNotDone();

    clock.advance(INTERVAL);
    pulled.rotate();

    assertThat(first.get(5, TimeUnit.SECONDS).sequenceNumber()).isZero();
    assertThat(pulled.isRecording()).isTrue();
  }

  @Test
  void blockingIterator_stopBeforeStartEndsImmediately() {
    BlockingChunkIterator iterator = new BlockingChunkIterator();
    new LiveSegmentProducer("live-5", encoder, scheduler, clock, INTERVAL, iterator).stop();

    assertThat(iterator.hasNext()).isFalse();
  }

  @Test
  void eachChunkIsAFreshRecording() {
    producer.start();
    clock.advance(INTERVAL);
    producer.rotate();
    clock.advance(Duration.ofSeconds(10));
    producer.stop();

    assertThat(encoder.starts).isEqualTo(2);
    assertThat(encoder.stops).isEqualTo(2);
    assertThat(WavWriter.duration(chunks.get(1).audio())).isEqualTo(Duration.ofSeconds(10));
    assertThat(encoder.recording).isFalse();
  }

  @Test
  void stop_isIdempotent() {
    producer.start();
    clock.advance(Duration.ofSeconds(5));

    producer.stop();
    producer.stop();

    assertThat(chunks).hasSize(1);
    assertThat(completions).isEqualTo(1);
    assertThat(producer.isRecording()).isFalse();
  }

  @Test
  void rotateAfterStop_doesNothing() {
    producer.start();
    clock.advance(Duration.ofSeconds(5));
    producer.stop();

    clock.advance(INTERVAL);
    producer.rotate();

    assertThat(chunks).hasSize(1);
  }

  @Test
  void invalidRecording_isDroppedWithoutConsumingSequenceNumber() {
    producer.start();
    encoder.nextResult = new byte[0];
    clock.advance(INTERVAL);
    producer.rotate();
    clock.advance(Duration.ofSeconds(30));
    producer.stop();

    assertThat(chunks).hasSize(1);
    assertThat(chunks.get(0).sequenceNumber()).isZero();
    assertThat(chunks.get(0).durationHint()).isEqualTo(Duration.ofSeconds(30));
  }

  @Test
  void start_twice_fails() {
    producer.start();

    assertThatThrownBy(() -> producer.start()).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void stopBeforeStart_completesWithoutChunks() {
    producer.stop();

    assertThat(chunks).isEmpty();
    assertThat(completions).isEqualTo(1);
    assertThat(encoder.starts).isZero();
  }

  @Test
  void listenerFailure_doesNotStopRecording() {
    List<Chunk> received = new ArrayList<>();
    LiveSegmentProducer fragile =
        new LiveSegmentProducer(
            "live-2",
            encoder,
            scheduler,
            clock,
            INTERVAL,
            chunk -> {
              received.add(chunk);
              throw new IllegalStateException("downstream down");
            });

    fragile.start();
    clock.advance(INTERVAL);
    fragile.rotate();

    assertThat(received).hasSize(1);
    assertThat(fragile.isRecording()).isTrue();
  }

  /** Produces a WAV file as long as the time between start and stop. */
  private static final class FakeEncoder implements AudioEncoder {

    private final MutableClock clock;
    private Instant startedAt;
    private boolean recording;
    private int starts;
    private int stops;
    private byte[] nextResult;

    FakeEncoder(MutableClock clock) {
      this.clock = clock;
    }

    @Override
    public void start() {
      if (recording) {
        throw new IllegalStateException("already recording");
      }
      recording = true;
      startedAt = clock.instant();
      starts++;
    }

    @Override
    public byte[] stop() {
      recording = false;
      stops++;
      if (nextResult != null) {
        byte[] result = nextResult;
        nextResult = null;
        return result;
      }
      return TestAudio.wav(Duration.between(startedAt, clock.instant()));
    }
  }
}
