package com.scholary.speech.gateway.api;

import com.scholary.speech.gateway.usage.ResetCoordinator;
import com.scholary.speech.gateway.usage.ResetOutcome;
import com.scholary.speech.gateway.usage.ResetReport;
import com.scholary.speech.gateway.usage.ResetTokenVerifier;
import com.scholary.speech.gateway.usage.UsageAccount;
import com.scholary.speech.gateway.usage.UsageStatistics;
import com.scholary.speech.gateway.usage.UsageStatisticsService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Usage queries and the monthly reset.
 *
 * <p>The reset endpoints are called by an external scheduler or an operator and require the
 * shared reset token in {@code X-Reset-Token}.
 */
@RestController
@RequestMapping("/api/usage")
@Tag(name = "Usage", description = "Usage statistics and monthly reset")
public class UsageController {

  private static final Logger LOGGER = LoggerFactory.getLogger(UsageController.class);

  private final ResetCoordinator resetCoordinator;
  private final ResetTokenVerifier tokenVerifier;
  private final UsageStatisticsService statisticsService;

  public UsageController(
      ResetCoordinator resetCoordinator,
      ResetTokenVerifier tokenVerifier,
      UsageStatisticsService statisticsService) {
    this.resetCoordinator = resetCoordinator;
    this.tokenVerifier = tokenVerifier;
    this.statisticsService = statisticsService;
  }

  @PostMapping("/reset")
  @Operation(
      summary = "Reset all due accounts",
      description = "Archive and zero every account whose period ended, or all with forceReset")
  public ResponseEntity<?> resetAll(
      @RequestHeader(value = CallerHeaders.RESET_TOKEN, required = false) String token,
      @RequestBody(required = false) ResetRequest request) {
    if (!tokenVerifier.matches(token)) {
      LOGGER.warn("Rejected bulk reset with invalid token");
      return unauthorized();
    }
    boolean force = request != null && request.force();
    ResetReport report = resetCoordinator.bulkReset(force);
    return ResponseEntity.ok(report);
  }

  @PostMapping("/{userId}/reset")
  @Operation(summary = "Reset one account", description = "Archive and zero a single account")
  public ResponseEntity<?> resetUser(
      @PathVariable String userId,
      @RequestHeader(value = CallerHeaders.RESET_TOKEN, required = false) String token,
      @RequestBody(required = false) ResetRequest request) {
    if (!tokenVerifier.matches(token)) {
      LOGGER.warn("Rejected reset of {} with invalid token", userId);
      return unauthorized();
    }
    boolean force = request != null && request.force();
    ResetOutcome outcome = resetCoordinator.reset(userId, force);
    if (outcome.status() == ResetOutcome.Status.NOT_FOUND) {
      return ResponseEntity.status(HttpStatus.NOT_FOUND)
          .body(ErrorResponse.of("No usage recorded for user " + userId));
    }
    return ResponseEntity.ok(outcome);
  }

  @GetMapping("/statistics")
  @Operation(summary = "Usage statistics", description = "Totals across all accounts")
  public UsageStatistics statistics() {
    return statisticsService.statistics();
  }

  @GetMapping("/{userId}")
  @Operation(summary = "Account usage", description = "Current period of one account")
  public ResponseEntity<UsageAccount> usage(@PathVariable String userId) {
    return statisticsService
        .usage(userId)
        .map(ResponseEntity::ok)
        .orElse(ResponseEntity.notFound().build());
  }

  private static ResponseEntity<ErrorResponse> unauthorized() {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .body(ErrorResponse.of("Invalid reset token"));
  }
}
