package com.scholary.speech.gateway.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.speech.gateway.service.FileTranscriptionService.FileResult;
import java.util.List;

/** Response for a whole-file transcription. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FileTranscriptionResponse(
    String text,
    int chunks,
    String model,
    List<Integer> failedChunks,
    boolean degraded,
    String savedKey) {

  static FileTranscriptionResponse from(FileResult result) {
    return new FileTranscriptionResponse(
        result.text(),
        result.chunks(),
        result.model(),
        result.failedChunks(),
        result.degraded(),
        result.savedKey());
  }
}
