package com.scholary.speech.gateway.transcript;

import java.util.List;

/**
 * Outcome of stripping the overlap from a fragment.
 *
 * @param strippedText the fragment without its leading overlap, whitespace normalized
 * @param trailingWindow the last tokens of the transcript after appending {@code strippedText}
 * @param overlapWords number of leading tokens removed from the fragment
 */
public record DedupResult(String strippedText, List<String> trailingWindow, int overlapWords) {

  public DedupResult {
    trailingWindow = List.copyOf(trailingWindow);
  }
}
