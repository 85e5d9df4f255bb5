package com.ridwan.slackexport.progress;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.Test;

import com.ridwan.slackexport.testsupport.ManualClock;

class ProgressTrackerTest {

  @Test
  void shouldCountResumedItemsAsProcessed() {
    ManualClock clock = new ManualClock(Instant.parse("2026-01-05T09:00:00Z"));
    ProgressTracker tracker = new ProgressTracker("Threads", clock);

    tracker.start(8, 2);
    tracker.increment();
    clock.advance(Duration.ofSeconds(45));
    tracker.increment();

    assertEquals(4, tracker.getProcessedCount());
    assertEquals(50.0, tracker.getPercentComplete(), 0.001);
  }

  @Test
  void shouldReportCompleteForEmptyBatch() {
    ProgressTracker tracker =
        new ProgressTracker("Threads", new ManualClock(Instant.parse("2026-01-05T09:00:00Z")));

    tracker.start(0, 0);
    tracker.complete();

    assertEquals(100.0, tracker.getPercentComplete(), 0.001);
  }

  @Test
  void shouldFormatDurations() {
    assertEquals("1h 2m 3s", ProgressTracker.formatDuration(Duration.ofSeconds(3723)));
    assertEquals("2m 5s", ProgressTracker.formatDuration(Duration.ofSeconds(125)));
    assertEquals("7s", ProgressTracker.formatDuration(Duration.ofSeconds(7)));
  }
}
