package com.ridwan.slackexport.error;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ErrorKindTest {

  @Test
  void shouldMapSlackErrorCodes() {
    assertEquals(ErrorKind.RATE_LIMITED, ErrorKind.fromSlackError("ratelimited"));
    assertEquals(ErrorKind.NOT_FOUND, ErrorKind.fromSlackError("thread_not_found"));
    assertEquals(ErrorKind.NOT_FOUND, ErrorKind.fromSlackError("channel_not_found"));
    assertEquals(ErrorKind.NOT_ACCESSIBLE, ErrorKind.fromSlackError("not_in_channel"));
    assertEquals(ErrorKind.NOT_ACCESSIBLE, ErrorKind.fromSlackError("access_denied"));
    assertEquals(ErrorKind.AUTH_FAILURE, ErrorKind.fromSlackError("invalid_auth"));
    assertEquals(ErrorKind.AUTH_FAILURE, ErrorKind.fromSlackError("token_revoked"));
  }

  @Test
  void shouldTreatUnrecognisedCodesAsUnknown() {
    assertEquals(ErrorKind.UNKNOWN, ErrorKind.fromSlackError("something_new"));
    assertEquals(ErrorKind.UNKNOWN, ErrorKind.fromSlackError(null));
  }

  @Test
  void shouldOnlySkipPermanentlyForMissingOrInaccessibleThreads() {
    assertTrue(ErrorKind.NOT_FOUND.isPermanentSkip());
    assertTrue(ErrorKind.NOT_ACCESSIBLE.isPermanentSkip());
    assertFalse(ErrorKind.RATE_LIMITED.isPermanentSkip());
    assertFalse(ErrorKind.AUTH_FAILURE.isPermanentSkip());
  }

  @Test
  void shouldGiveCallersDistinctExitCodes() {
    assertNotEquals(
        ErrorKind.RATE_LIMITED.getExitCode(), ErrorKind.NOTHING_TO_RESUME.getExitCode());
    assertNotEquals(
        ErrorKind.NOTHING_TO_RESUME.getExitCode(), ErrorKind.CONFIGURATION_ERROR.getExitCode());
    assertTrue(ErrorKind.RATE_LIMITED.isRetryable());
    assertFalse(ErrorKind.CONFIGURATION_ERROR.isRetryable());
  }

  @Test
  void shouldExposeKindAsExitCode() {
    SlackExportException exception =
        SlackExportException.fromSlackError("not_in_channel", "conversations.replies");

    assertEquals(ErrorKind.NOT_ACCESSIBLE, exception.getKind());
    assertEquals("not_in_channel", exception.getCode());
    assertEquals(77, exception.getExitCode());
    assertEquals("conversations.replies failed: not_in_channel", exception.getMessage());
  }
}
