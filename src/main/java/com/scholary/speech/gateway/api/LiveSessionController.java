package com.scholary.speech.gateway.api;

import com.scholary.speech.gateway.access.Role;
import com.scholary.speech.gateway.service.LiveRecordingService;
import com.scholary.speech.gateway.service.LiveRecordingService.LiveStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** Recording from the gateway host's capture device, cut into chunks on a fixed interval. */
@RestController
@RequestMapping("/api/live/sessions")
@Tag(name = "Live", description = "Server-side live recording sessions")
public class LiveSessionController {

  private final LiveRecordingService liveService;

  public LiveSessionController(LiveRecordingService liveService) {
    this.liveService = liveService;
  }

  @PostMapping
  @ResponseStatus(HttpStatus.CREATED)
  @Operation(summary = "Start recording", description = "Open a live session and start recording")
  public LiveStatus start(
      @RequestBody(required = false) LiveSessionRequest request,
      @RequestHeader(value = CallerHeaders.USER_ID, defaultValue = CallerHeaders.ANONYMOUS)
          String userId,
      @RequestHeader(value = CallerHeaders.ROLE, required = false) String role) {
    LiveSessionRequest options = request != null ? request : new LiveSessionRequest(null, null);
    return liveService.start(userId, Role.fromHeader(role), options.language(), options.model());
  }

  @PostMapping("/{sessionId}/stop")
  @Operation(
      summary = "Stop recording",
      description = "Flush the final chunk; chunks already being transcribed still complete")
  public LiveStatus stop(
      @PathVariable String sessionId,
      @RequestHeader(value = CallerHeaders.USER_ID, defaultValue = CallerHeaders.ANONYMOUS)
          String userId) {
    return liveService.stop(sessionId, userId);
  }

  @GetMapping("/{sessionId}")
  @Operation(summary = "Session status", description = "Transcript so far and chunk counters")
  public LiveStatus status(
      @PathVariable String sessionId,
      @RequestHeader(value = CallerHeaders.USER_ID, defaultValue = CallerHeaders.ANONYMOUS)
          String userId) {
    return liveService.status(sessionId, userId);
  }
}
