package com.ridwan.slackexport.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/** A configured Slack workspace and the browser credentials used to reach it. */
@Value
@Builder
public class Workspace {

  String name;

  @ToString.Exclude
  String xoxcToken;

  @ToString.Exclude
  String xoxdToken;

  String domain;
}
