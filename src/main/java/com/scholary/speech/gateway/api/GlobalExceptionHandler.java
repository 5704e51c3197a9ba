package com.scholary.speech.gateway.api;

import com.scholary.speech.gateway.access.AccessDeniedException;
import com.scholary.speech.gateway.chunking.AudioCaptureException;
import com.scholary.speech.gateway.chunking.ChunkInvalidException;
import com.scholary.speech.gateway.objectstore.ObjectStoreException;
import com.scholary.speech.gateway.provider.TranscriptionFailedException;
import com.scholary.speech.gateway.service.ChunkFailedException;
import com.scholary.speech.gateway.usage.ResetFailedException;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Maps exceptions to HTTP responses.
 *
 * <p>Every error body has the same shape: {@code {status: "error", error, chunkNumber, text}},
 * with the chunk number present only when the failure belongs to one chunk.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(ChunkInvalidException.class)
  public ResponseEntity<ErrorResponse> handleChunkInvalid(ChunkInvalidException e) {
    LOGGER.warn("Invalid chunk: {}", e.getMessage());
    return ResponseEntity.badRequest()
        .body(ErrorResponse.forChunk(e.getMessage(), e.getChunkNumber()));
  }

  @ExceptionHandler(ChunkFailedException.class)
  public ResponseEntity<ErrorResponse> handleChunkFailed(ChunkFailedException e) {
    HttpStatus status;
    if (e.getCause() instanceof ChunkInvalidException) {
      LOGGER.warn("Invalid chunk: {}", e.getMessage());
      status = HttpStatus.BAD_REQUEST;
    } else if (e.getCause() instanceof AccessDeniedException) {
      LOGGER.warn("Access denied for chunk {}: {}", e.getChunkNumber(), e.getMessage());
      status = HttpStatus.FORBIDDEN;
    } else {
      LOGGER.error("Transcription failed for chunk {}: {}", e.getChunkNumber(), e.getMessage());
      status = HttpStatus.BAD_GATEWAY;
    }
    return ResponseEntity.status(status)
        .body(ErrorResponse.forChunk(e.getMessage(), e.getChunkNumber(), e.getReleasedText()));
  }

  @ExceptionHandler(TranscriptionFailedException.class)
  public ResponseEntity<ErrorResponse> handleTranscriptionFailed(TranscriptionFailedException e) {
    LOGGER.error("Transcription failed for chunk {}: {}", e.getChunkNumber(), e.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
        .body(ErrorResponse.forChunk(e.getMessage(), e.getChunkNumber()));
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ErrorResponse> handleAccessDenied(AccessDeniedException e) {
    LOGGER.warn("Access denied: {}", e.getMessage());
    return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ErrorResponse.of(e.getMessage()));
  }

  @ExceptionHandler(ResetFailedException.class)
  public ResponseEntity<ErrorResponse> handleResetFailed(ResetFailedException e) {
    LOGGER.error("Usage reset failed for {}: {}", e.getUserId(), e.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(ErrorResponse.of(e.getMessage()));
  }

  @ExceptionHandler(ObjectStoreException.class)
  public ResponseEntity<ErrorResponse> handleObjectStore(ObjectStoreException e) {
    if (e.isNotFound()) {
      LOGGER.warn("Object not found: {}", e.getMessage());
      return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(e.getMessage()));
    }
    LOGGER.error("Object store failure", e);
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(ErrorResponse.of(e.getMessage()));
  }

  @ExceptionHandler(NoSuchElementException.class)
  public ResponseEntity<ErrorResponse> handleNotFound(NoSuchElementException e) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of(e.getMessage()));
  }

  @ExceptionHandler(AudioCaptureException.class)
  public ResponseEntity<ErrorResponse> handleCapture(AudioCaptureException e) {
    LOGGER.error("Audio capture unavailable", e);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(ErrorResponse.of(e.getMessage()));
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
    String message =
        e.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    return ResponseEntity.badRequest().body(ErrorResponse.of(message));
  }

  @ExceptionHandler({
    MissingServletRequestParameterException.class,
    MissingServletRequestPartException.class,
    HttpMessageNotReadableException.class,
    IllegalArgumentException.class
  })
  public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
    return ResponseEntity.badRequest().body(ErrorResponse.of(e.getMessage()));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
    if (e instanceof org.springframework.web.ErrorResponse framework) {
      // routing and binding errors raised by Spring MVC carry their own status
      return ResponseEntity.status(framework.getStatusCode())
          .body(ErrorResponse.of(e.getMessage()));
    }
    LOGGER.error("Unexpected error", e);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ErrorResponse.of("An unexpected error occurred"));
  }
}
