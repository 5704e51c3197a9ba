package com.scholary.speech.gateway.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Error body returned by every endpoint.
 *
 * <p>{@code text} accompanies a chunk given up as missing. It holds the text of later chunks that
 * were waiting on it and merged once it was given up, and is empty when none were. The
 * client appends it like the text of a successful response.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String status, String error, Integer chunkNumber, String text) {

  public static ErrorResponse of(String error) {
    return new ErrorResponse("error", error, null, null);
  }

  public static ErrorResponse forChunk(String error, int chunkNumber) {
    return new ErrorResponse("error", error, chunkNumber, null);
  }

  public static ErrorResponse forChunk(String error, int chunkNumber, String releasedText) {
    return new ErrorResponse("error", error, chunkNumber, releasedText);
  }
}
