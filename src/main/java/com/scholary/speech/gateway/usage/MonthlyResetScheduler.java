package com.scholary.speech.gateway.usage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * In-process trigger for the monthly bulk reset, for deployments without an external scheduler.
 * Off unless {@code usage.reset.schedule-enabled} is true.
 */
@Component
@ConditionalOnProperty(prefix = "usage.reset", name = "schedule-enabled", havingValue = "true")
public class MonthlyResetScheduler {

  private static final Logger LOGGER = LoggerFactory.getLogger(MonthlyResetScheduler.class);

  private final ResetCoordinator resetCoordinator;

  public MonthlyResetScheduler(ResetCoordinator resetCoordinator) {
    this.resetCoordinator = resetCoordinator;
  }

  @Scheduled(cron = "${usage.reset.cron}", zone = "UTC")
  public void runMonthlyReset() {
    LOGGER.info("Scheduled monthly usage reset starting");
    ResetReport report = resetCoordinator.bulkReset(false);
    if (!report.errors().isEmpty()) {
      LOGGER.error(
          "Scheduled reset finished with {} failed users: {}",
          report.errors().size(),
          report.errors());
    }
  }
}
