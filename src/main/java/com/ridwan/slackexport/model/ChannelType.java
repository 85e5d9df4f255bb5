package com.ridwan.slackexport.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ChannelType {
  CHANNEL("channel"),
  DM("dm"),
  GROUP("group"),
  UNKNOWN("unknown");

  private final String value;

  ChannelType(String value) {
    this.value = value;
  }

  /** Slack encodes the conversation type in the first character of its id. */
  public static ChannelType fromId(String channelId) {
    if (channelId == null || channelId.isEmpty()) {
      return UNKNOWN;
    }
    switch (channelId.charAt(0)) {
      case 'C':
        return CHANNEL;
      case 'D':
        return DM;
      case 'G':
        return GROUP;
      default:
        return UNKNOWN;
    }
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static ChannelType fromValue(String value) {
    for (ChannelType type : values()) {
      if (type.value.equals(value)) {
        return type;
      }
    }
    return UNKNOWN;
  }
}
