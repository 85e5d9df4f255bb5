package com.ridwan.slackexport.error;

import org.springframework.boot.ExitCodeGenerator;

public class SlackExportException extends RuntimeException implements ExitCodeGenerator {

  private final ErrorKind kind;
  private final String code;

  public SlackExportException(ErrorKind kind, String message) {
    this(kind, null, message, null);
  }

  public SlackExportException(ErrorKind kind, String code, String message) {
    this(kind, code, message, null);
  }

  public SlackExportException(ErrorKind kind, String code, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.code = code;
  }

  /** Builds an exception from a Slack {@code error} field. */
  public static SlackExportException fromSlackError(String code, String context) {
    ErrorKind kind = ErrorKind.fromSlackError(code);
    return new SlackExportException(kind, code, context + " failed: " + code);
  }

  public ErrorKind getKind() {
    return kind;
  }

  public String getCode() {
    return code;
  }

  @Override
  public int getExitCode() {
    return kind.getExitCode();
  }
}
