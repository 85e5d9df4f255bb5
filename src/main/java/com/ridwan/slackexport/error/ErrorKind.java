package com.ridwan.slackexport.error;

import java.util.Set;

/**
 * Closed set of failure categories recorded in the job error log and reported to callers.
 *
 * <p>Each kind carries a process exit code so scripts can tell "retry later", "nothing to
 * resume" and "configuration problem" apart without parsing messages.
 */
public enum ErrorKind {
  RATE_LIMITED(75, true),
  NOT_FOUND(66, false),
  NOT_ACCESSIBLE(77, false),
  AUTH_FAILURE(67, false),
  CONFIGURATION_ERROR(78, false),
  NOTHING_TO_RESUME(65, false),
  JOB_IN_PROGRESS(73, true),
  UNKNOWN(1, true);

  private static final Set<String> NOT_FOUND_CODES =
      Set.of("thread_not_found", "channel_not_found", "message_not_found");

  private static final Set<String> NOT_ACCESSIBLE_CODES =
      Set.of("not_in_channel", "access_denied", "is_archived", "restricted_action");

  private static final Set<String> AUTH_CODES =
      Set.of("invalid_auth", "not_authed", "account_inactive", "token_revoked", "token_expired");

  private final int exitCode;
  private final boolean retryable;

  ErrorKind(int exitCode, boolean retryable) {
    this.exitCode = exitCode;
    this.retryable = retryable;
  }

  public int getExitCode() {
    return exitCode;
  }

  public boolean isRetryable() {
    return retryable;
  }

  /** Thread-level errors that mean the thread can never be fetched with these credentials. */
  public boolean isPermanentSkip() {
    return this == NOT_FOUND || this == NOT_ACCESSIBLE;
  }

  public static ErrorKind fromSlackError(String code) {
    if (code == null) {
      return UNKNOWN;
    }
    if ("ratelimited".equals(code)) {
      return RATE_LIMITED;
    }
    if (NOT_FOUND_CODES.contains(code)) {
      return NOT_FOUND;
    }
    if (NOT_ACCESSIBLE_CODES.contains(code)) {
      return NOT_ACCESSIBLE;
    }
    if (AUTH_CODES.contains(code)) {
      return AUTH_FAILURE;
    }
    return UNKNOWN;
  }
}
