package com.ridwan.slackexport.progress;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import lombok.extern.slf4j.Slf4j;

/**
 * Tracks and logs progress for a batch of API work with ETA calculations.
 *
 * <p>Features:
 *
 * <ul>
 *   <li>Processing rate calculation (items/minute)
 *   <li>ETA estimation
 *   <li>Smart logging (every N items or time interval)
 * </ul>
 *
 * <p>Not a Spring bean: each phase creates its own tracker.
 */
@Slf4j
public class ProgressTracker {

  private static final int LOG_INTERVAL_ITEMS = 10;
  private static final long LOG_INTERVAL_SECONDS = 30;

  private final String label;
  private final Clock clock;

  private int totalItems;
  private int processedItems;
  private Instant startTime;
  private Instant lastLogTime;

  public ProgressTracker(String label) {
    this(label, Clock.systemUTC());
  }

  ProgressTracker(String label, Clock clock) {
    this.label = label;
    this.clock = clock;
  }

  /**
   * Initialize progress tracking.
   *
   * @param total Total number of items to process
   * @param alreadyDone Items completed by an earlier run
   */
  public void start(int total, int alreadyDone) {
    this.totalItems = total;
    this.processedItems = alreadyDone;
    this.startTime = clock.instant();
    this.lastLogTime = startTime;

    log.info("{}: {} to process ({} already done)", label, total - alreadyDone, alreadyDone);
  }

  /** Update progress after processing an item. */
  public void increment() {
    processedItems++;

    if (shouldLog()) {
      logProgress();
      lastLogTime = clock.instant();
    }
  }

  /** Complete progress tracking and log final summary. */
  public void complete() {
    logProgress();

    Duration totalDuration = Duration.between(startTime, clock.instant());
    log.info("{} complete in {}", label, formatDuration(totalDuration));
  }

  private boolean shouldLog() {
    if (processedItems % LOG_INTERVAL_ITEMS == 0) {
      return true;
    }

    Duration timeSinceLastLog = Duration.between(lastLogTime, clock.instant());
    return timeSinceLastLog.getSeconds() >= LOG_INTERVAL_SECONDS;
  }

  private void logProgress() {
    Duration elapsed = Duration.between(startTime, clock.instant());

    double elapsedMinutes = elapsed.getSeconds() / 60.0;
    double rate = elapsedMinutes > 0 ? processedItems / elapsedMinutes : 0;

    int remaining = totalItems - processedItems;

    log.info(
        "{}: {}/{} ({}) | Rate: {}/min | ETA: {}",
        label,
        processedItems,
        totalItems,
        String.format("%.1f%%", getPercentComplete()),
        String.format("%.1f", rate),
        calculateETA(remaining, rate));
  }

  private String calculateETA(int remaining, double rate) {
    if (rate <= 0 || remaining <= 0) {
      return "calculating...";
    }

    double minutesRemaining = remaining / rate;
    return formatDuration(Duration.ofSeconds((long) (minutesRemaining * 60)));
  }

  static String formatDuration(Duration duration) {
    long hours = duration.toHours();
    long minutes = duration.toMinutesPart();
    long seconds = duration.toSecondsPart();

    if (hours > 0) {
      return String.format("%dh %dm %ds", hours, minutes, seconds);
    } else if (minutes > 0) {
      return String.format("%dm %ds", minutes, seconds);
    } else {
      return String.format("%ds", seconds);
    }
  }

  /**
   * Get current progress percentage.
   *
   * @return Percentage complete (0-100)
   */
  public double getPercentComplete() {
    if (totalItems == 0) {
      return 100;
    }
    return (processedItems * 100.0) / totalItems;
  }

  public int getProcessedCount() {
    return processedItems;
  }
}
