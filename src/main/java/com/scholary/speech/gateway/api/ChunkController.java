package com.scholary.speech.gateway.api;

import com.scholary.speech.gateway.access.Role;
import com.scholary.speech.gateway.service.ChunkTranscriptionService;
import com.scholary.speech.gateway.service.ChunkTranscriptionService.ChunkResult;
import com.scholary.speech.gateway.service.ChunkTranscriptionService.ChunkSubmission;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** Progressive transcription of chunks recorded in the browser. */
@RestController
@Tag(name = "Chunks", description = "Progressive transcription of client-recorded chunks")
public class ChunkController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkController.class);

  private final ChunkTranscriptionService chunkService;

  public ChunkController(ChunkTranscriptionService chunkService) {
    this.chunkService = chunkService;
  }

  /**
   * Transcribe one chunk of a recording.
   *
   * <p>Chunk numbers start at 0 for each {@code sessionElementId}. Every chunk must be a complete
   * audio file with its own container header.
   */
  @PostMapping(value = "/api/transcribe/chunk", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Transcribe a chunk",
      description = "Transcribe one chunk and return the deduplicated text to append")
  public ChunkTranscriptionResponse transcribeChunk(
      @RequestParam("audio") MultipartFile audio,
      @RequestParam("chunkNumber") int chunkNumber,
      @RequestParam(value = "language", defaultValue = "en") String language,
      @RequestParam(value = "model", required = false) String model,
      @RequestParam("sessionElementId") String sessionElementId,
      @RequestHeader(value = CallerHeaders.USER_ID, defaultValue = CallerHeaders.ANONYMOUS)
          String userId,
      @RequestHeader(value = CallerHeaders.ROLE, required = false) String role)
      throws IOException {
    LOGGER.info(
        "Chunk request: session={}, chunk={}, bytes={}, model={}",
        sessionElementId,
        chunkNumber,
        audio.getSize(),
        model);

    ChunkResult result =
        chunkService.transcribe(
            new ChunkSubmission(
                sessionElementId,
                userId,
                Role.fromHeader(role),
                chunkNumber,
                audio.getBytes(),
                language,
                model));

    return new ChunkTranscriptionResponse(
        result.text(),
        result.chunkNumber(),
        "ok",
        result.model(),
        result.degraded(),
        null,
        result.mergedChunks());
  }
}
