package com.ridwan.slackexport.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ExportStatus {
  SEARCHING("searching"),
  FETCHING_THREADS("fetching_threads"),
  WRITING_OUTPUT("writing_output"),
  COMPLETED("completed"),
  PAUSED("paused");

  private final String value;

  ExportStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static ExportStatus fromValue(String value) {
    for (ExportStatus status : values()) {
      if (status.value.equals(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown export status: " + value);
  }
}
