package com.ridwan.slackexport.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

class ExportJobTest {

  @Test
  void shouldRememberStatusWhenPaused() {
    ExportJob job = ExportJob.builder().status(ExportStatus.FETCHING_THREADS).build();

    job.pause();

    assertEquals(ExportStatus.PAUSED, job.getStatus());
    assertEquals(ExportStatus.FETCHING_THREADS, job.getSuspendedStatus());
  }

  @Test
  void shouldRestoreSuspendedStatusOnUnpause() {
    ExportJob job = ExportJob.builder().status(ExportStatus.WRITING_OUTPUT).build();
    job.pause();

    job.unpause();

    assertEquals(ExportStatus.WRITING_OUTPUT, job.getStatus());
    assertNull(job.getSuspendedStatus());
  }

  @Test
  void shouldNotPauseCompletedJob() {
    ExportJob job = ExportJob.builder().status(ExportStatus.COMPLETED).build();

    job.pause();

    assertEquals(ExportStatus.COMPLETED, job.getStatus());
  }

  @Test
  void shouldReturnRemainingThreadsInDiscoveryOrder() {
    ThreadProgress progress = new ThreadProgress();
    assertTrue(progress.addPending(ThreadKey.of("C1", "3.0")));
    progress.addPending(ThreadKey.of("C1", "1.0"));
    progress.addPending(ThreadKey.of("C2", "2.0"));
    assertFalse(progress.addPending(ThreadKey.of("C1", "1.0")));

    progress.markFetched(ThreadKey.of("C1", "1.0"));

    assertEquals(
        List.of(ThreadKey.of("C1", "3.0"), ThreadKey.of("C2", "2.0")),
        progress.getRemaining());
    assertEquals("C1:1.0", progress.getCursor());
  }
}
