package com.ridwan.slackexport.model;

import java.time.LocalDate;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Inclusive range of calendar days. */
@Value
@Builder
@Jacksonized
public class DateRange {

  @JsonProperty("from")
  LocalDate from;

  @JsonProperty("to")
  LocalDate to;

  public static DateRange of(LocalDate from, LocalDate to) {
    return new DateRange(from, to);
  }
}
