package com.scholary.speech.gateway.transcript;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Removes the words a fragment repeats from the end of the previous one.
 *
 * <p>Consecutive live chunks share a few seconds of audio, so the start of a fragment usually
 * repeats the last words of the transcript so far. The deduplicator finds the longest {@code k}
 * such that the last {@code k} tokens of the trailing window equal the first {@code k} tokens of
 * the fragment, and drops those {@code k} tokens from the fragment.
 *
 * <p>Example: window {@code [the, quick, brown]} and fragment {@code "brown fox jumps"} give
 * {@code "fox jumps"} and window {@code [the, quick, brown, fox, jumps]}.
 *
 * <p>Tokens are compared case-insensitively with surrounding punctuation removed. The class is
 * stateless; callers keep the window between calls.
 */
public class OverlapDeduplicator {

  public static final int DEFAULT_WINDOW_SIZE = 10;

  private final int windowSize;

  public OverlapDeduplicator(int windowSize) {
    if (windowSize < 1) {
      throw new IllegalArgumentException("windowSize must be positive: " + windowSize);
    }
    this.windowSize = windowSize;
  }

  public OverlapDeduplicator() {
    this(DEFAULT_WINDOW_SIZE);
  }

  public int windowSize() {
    return windowSize;
  }

  /**
   * Strip the overlap between the trailing window and a new fragment.
   *
   * @param window the last tokens of the transcript so far, oldest first; may be empty
   * @param text the new fragment
   * @return the fragment without the overlap, and the window to use for the next fragment
   */
  public DedupResult dedupe(List<String> window, String text) {
    List<String> tokens = tokenize(text);
    int overlap = longestOverlap(window, tokens);
    List<String> kept = tokens.subList(overlap, tokens.size());

    List<String> combined = new ArrayList<>(window.size() + kept.size());
    combined.addAll(window);
    combined.addAll(kept);
    List<String> nextWindow =
        combined.subList(Math.max(0, combined.size() - windowSize), combined.size());

    return new DedupResult(String.join(" ", kept), nextWindow, overlap);
  }

  /** Split text on whitespace, dropping empty tokens. */
  public static List<String> tokenize(String text) {
    List<String> tokens = new ArrayList<>();
    if (text == null) {
      return tokens;
    }
    for (String token : text.trim().split("\\s+")) {
      if (!token.isEmpty()) {
        tokens.add(token);
      }
    }
    return tokens;
  }

  static int longestOverlap(List<String> window, List<String> tokens) {
    int max = Math.min(window.size(), tokens.size());
    for (int k = max; k > 0; k--) {
      if (matches(window.subList(window.size() - k, window.size()), tokens.subList(0, k))) {
        return k;
      }
    }
    return 0;
  }

  private static boolean matches(List<String> tail, List<String> head) {
    for (int i = 0; i < tail.size(); i++) {
      String left = normalize(tail.get(i));
      // a token that is only punctuation never counts as a match
      if (left.isEmpty() || !left.equals(normalize(head.get(i)))) {
        return false;
      }
    }
    return true;
  }

  static String normalize(String token) {
    return token
        .toLowerCase(Locale.ROOT)
        .replaceAll("^[\\p{Punct}\\p{IsPunctuation}]+", "")
        .replaceAll("[\\p{Punct}\\p{IsPunctuation}]+$", "");
  }
}
