package com.ridwan.slackexport.model;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ridwan.slackexport.error.ErrorKind;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorEntry {

  @JsonProperty("timestamp")
  Instant timestamp;

  @JsonProperty("kind")
  ErrorKind kind;

  // Raw Slack error string, e.g. "not_in_channel"
  @JsonProperty("code")
  String code;

  @JsonProperty("detail")
  String detail;
}
