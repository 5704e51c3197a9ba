package com.scholary.speech.gateway.transcript;

import com.scholary.speech.gateway.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running transcript of one session.
 *
 * <p>Fragments can finish out of order because chunks are transcribed concurrently. They are
 * held until every lower sequence number has either merged or been marked missing, then merged
 * through the {@link OverlapDeduplicator} in sequence order. When more than {@code maxBuffered}
 * fragments are waiting on a gap, the gap is given up as missing so the transcript keeps
 * moving.
 *
 * <p>All methods are synchronized; one instance is shared by every request of its session.
 */
public class SessionTranscript {

  private static final Logger LOGGER = LoggerFactory.getLogger(SessionTranscript.class);
  private static final StructuredLogger STRUCTURED_LOGGER = new StructuredLogger(LOGGER);

  /** What a single offer released into the transcript. */
  public record MergeResult(
      String appendedText, List<Integer> mergedSequences, boolean duplicate) {

    public MergeResult {
      mergedSequences = List.copyOf(mergedSequences);
    }

    static MergeResult ofDuplicate() {
      return new MergeResult("", List.of(), true);
    }
  }

  private final String sessionId;
  private final OverlapDeduplicator deduplicator;
  private final int maxBuffered;

  // null value marks a sequence that failed
  private final NavigableMap<Integer, TranscriptFragment> pending = new TreeMap<>();
  private final SortedSet<Integer> missing = new TreeSet<>();
  private final StringBuilder text = new StringBuilder();
  private List<String> window = List.of();
  private int nextSequence;

  public SessionTranscript(String sessionId, OverlapDeduplicator deduplicator, int maxBuffered) {
    this(sessionId, deduplicator, maxBuffered, 0);
  }

  public SessionTranscript(
      String sessionId, OverlapDeduplicator deduplicator, int maxBuffered, int firstSequence) {
    this.sessionId = sessionId;
    this.deduplicator = deduplicator;
    this.maxBuffered = maxBuffered;
    this.nextSequence = firstSequence;
  }

  /** Add a transcribed fragment and merge everything that is now in order. */
  public synchronized MergeResult offer(TranscriptFragment fragment) {
    int sequence = fragment.sequenceNumber();
    if (isKnown(sequence)) {
      LOGGER.info("Ignoring duplicate fragment {} in session {}", sequence, sessionId);
      return MergeResult.ofDuplicate();
    }
    pending.put(sequence, fragment);
    return drain();
  }

  /** Record that a chunk will never produce text, releasing later fragments. */
  public synchronized MergeResult markMissing(int sequence) {
    if (isKnown(sequence)) {
      return MergeResult.ofDuplicate();
    }
    pending.put(sequence, null);
    return drain();
  }

  /** True once the sequence has merged, is buffered, or was given up as missing. */
  public synchronized boolean isSettled(int sequence) {
    return isKnown(sequence);
  }

  public synchronized String fullText() {
    return text.toString();
  }

  public synchronized List<Integer> missing() {
    return List.copyOf(missing);
  }

  public synchronized int nextSequence() {
    return nextSequence;
  }

  public synchronized int bufferedCount() {
    return pending.size();
  }

  public String sessionId() {
    return sessionId;
  }

  private boolean isKnown(int sequence) {
    return sequence < nextSequence || pending.containsKey(sequence);
  }

  private MergeResult drain() {
    StringBuilder appended = new StringBuilder();
    List<Integer> merged = new ArrayList<>();

    while (true) {
      while (pending.containsKey(nextSequence)) {
        TranscriptFragment fragment = pending.remove(nextSequence);
        if (fragment == null) {
          missing.add(nextSequence);
        } else {
          append(fragment, appended);
          merged.add(nextSequence);
        }
        nextSequence++;
      }
      if (pending.size() <= maxBuffered) {
        break;
      }
      skipGap();
    }

    return new MergeResult(appended.toString(), merged, false);
  }

  private void skipGap() {
    int resumeAt = pending.firstKey();
    LOGGER.warn(
        "Session {} waited too long for chunks {}..{}, marking them missing",
        sessionId,
        nextSequence,
        resumeAt - 1);
    for (int sequence = nextSequence; sequence < resumeAt; sequence++) {
      missing.add(sequence);
    }
    nextSequence = resumeAt;
  }

  private void append(TranscriptFragment fragment, StringBuilder appended) {
    DedupResult result = deduplicator.dedupe(window, fragment.text());
    window = result.trailingWindow();
    if (result.overlapWords() > 0) {
      STRUCTURED_LOGGER.logOverlapMerge(
          sessionId, fragment.sequenceNumber(), result.overlapWords());
    }
    if (result.strippedText().isEmpty()) {
      return;
    }
    if (text.length() > 0) {
      text.append(' ');
    }
    text.append(result.strippedText());
    if (appended.length() > 0) {
      appended.append(' ');
    }
    appended.append(result.strippedText());
  }
}
