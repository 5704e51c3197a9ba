package com.scholary.speech.gateway.api;

import com.scholary.speech.gateway.access.Role;
import com.scholary.speech.gateway.config.TranscriptionProperties;
import com.scholary.speech.gateway.service.ChunkProcessor.Caller;
import com.scholary.speech.gateway.service.FileTranscriptionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * Whole-file transcription.
 *
 * <p>Both endpoints are synchronous: large files are split into segments and the merged
 * transcript is returned once every segment has been processed.
 */
@RestController
@Tag(name = "Files", description = "Transcription of uploaded and stored recordings")
public class FileTranscriptionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileTranscriptionController.class);

  private final FileTranscriptionService fileService;
  private final TranscriptionProperties properties;

  public FileTranscriptionController(
      FileTranscriptionService fileService, TranscriptionProperties properties) {
    this.fileService = fileService;
    this.properties = properties;
  }

  @PostMapping(value = "/api/transcribe/file", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Transcribe an uploaded file",
      description = "Split the file if it exceeds the limits and return the merged transcript")
  public FileTranscriptionResponse transcribeFile(
      @RequestParam("file") MultipartFile file,
      @RequestParam(value = "language", defaultValue = "en") String language,
      @RequestParam(value = "model", required = false) String model,
      @RequestHeader(value = CallerHeaders.USER_ID, defaultValue = CallerHeaders.ANONYMOUS)
          String userId,
      @RequestHeader(value = CallerHeaders.ROLE, required = false) String role)
      throws IOException {
    LOGGER.info(
        "File request: name={}, bytes={}, model={}",
        file.getOriginalFilename(),
        file.getSize(),
        model);

    Path workDir = Files.createDirectories(Paths.get(properties.tempDir()));
    Path upload = Files.createTempFile(workDir, "upload-", suffixOf(file.getOriginalFilename()));
    try {
      file.transferTo(upload);
      return FileTranscriptionResponse.from(
          fileService.transcribeFile(
              upload, new Caller(userId, Role.fromHeader(role), model, language)));
    } finally {
      Files.deleteIfExists(upload);
    }
  }

  @PostMapping("/api/transcribe/object")
  @Operation(
      summary = "Transcribe a stored object",
      description = "Fetch an audio object from storage, transcribe it and optionally save a .txt")
  public FileTranscriptionResponse transcribeObject(
      @Valid @RequestBody ObjectTranscriptionRequest request,
      @RequestHeader(value = CallerHeaders.USER_ID, defaultValue = CallerHeaders.ANONYMOUS)
          String userId,
      @RequestHeader(value = CallerHeaders.ROLE, required = false) String role)
      throws IOException {
    LOGGER.info("Object request: bucket={}, key={}", request.bucket(), request.key());
    return FileTranscriptionResponse.from(
        fileService.transcribeObject(
            request.bucket(),
            request.key(),
            request.save(),
            new Caller(userId, Role.fromHeader(role), request.model(), request.language())));
  }

  private static String suffixOf(String filename) {
    if (filename == null) {
      return ".audio";
    }
    int dot = filename.lastIndexOf('.');
    return dot >= 0 && dot > filename.lastIndexOf('/') ? filename.substring(dot) : ".audio";
  }
}
