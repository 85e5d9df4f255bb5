package com.ridwan.slackexport.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ridwan.slackexport.error.ErrorKind;

import lombok.Value;

@Value
public class WorkspaceFailure {

  @JsonProperty("workspace")
  String workspace;

  @JsonProperty("kind")
  ErrorKind kind;

  @JsonProperty("message")
  String message;
}
