package com.scholary.speech.gateway.provider;

import java.util.List;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Removes timestamps, timestamped speaker labels and sound markers that some models insert even
 * when asked for plain text.
 *
 * <p>Text without such artifacts only has its whitespace collapsed.
 */
@Component
public class TranscriptCleaner {

  private static final Logger LOGGER = LoggerFactory.getLogger(TranscriptCleaner.class);

  private static final String CLOCK = "\\d{1,2}:\\d{2}(?::\\d{2})?";

  private static final List<Pattern> ARTIFACTS =
      List.of(
          // Speaker 1 [00:00:00]:
          Pattern.compile(
              "Speaker\\s+\\d+\\s*\\[" + CLOCK + "]\\s*:?\\s*", Pattern.CASE_INSENSITIVE),
          // [00:00 - 00:30]
          Pattern.compile("\\[" + CLOCK + "\\s*[-\u2013\u2014]\\s*" + CLOCK + "]"),
          // [00:00:00.250]
          Pattern.compile("\\[\\d{1,2}:\\d{2}:\\d{2}\\.\\d{1,3}]"),
          // [00:00] and (00:00)
          Pattern.compile("\\[" + CLOCK + "]"),
          Pattern.compile("\\(" + CLOCK + "\\)"),
          // 00:00 - at line start or standing alone
          Pattern.compile("(?m)(?:^|(?<=\\s))" + CLOCK + "\\s*[-\u2013\u2014]?\\s*(?=\\S|$)"),
          Pattern.compile(
              "\\[(?:MUSIC|SOUND|NOISE|SILENCE|APPLAUSE|LAUGHTER|INAUDIBLE|CROSSTALK)]",
              Pattern.CASE_INSENSITIVE),
          // trailing bracketed note
          Pattern.compile("\\s*\\[[^\\]]+]\\s*$"));

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  public String clean(String text) {
    if (text == null) {
      return "";
    }
    String cleaned = text;
    for (Pattern artifact : ARTIFACTS) {
      cleaned = artifact.matcher(cleaned).replaceAll(" ");
    }
    cleaned = WHITESPACE.matcher(cleaned).replaceAll(" ").trim();

    if (cleaned.length() < text.trim().length() - 1) {
      LOGGER.debug(
          "Cleaned transcript: removed {} characters of timestamps or markers",
          text.length() - cleaned.length());
    }
    return cleaned;
  }
}
