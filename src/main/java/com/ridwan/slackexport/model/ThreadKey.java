package com.ridwan.slackexport.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import lombok.Value;

/**
 * Identity of a conversation thread: the channel plus the timestamp of the parent message.
 * Serialized as {@code "<channelId>:<threadTs>"}.
 */
@Value
public class ThreadKey {

  String channelId;
  String threadTs;

  public static ThreadKey of(String channelId, String threadTs) {
    return new ThreadKey(channelId, threadTs);
  }

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public static ThreadKey parse(String value) {
    int separator = value == null ? -1 : value.indexOf(':');
    if (separator <= 0 || separator == value.length() - 1) {
      throw new IllegalArgumentException("Invalid thread key: " + value);
    }
    return new ThreadKey(value.substring(0, separator), value.substring(separator + 1));
  }

  @JsonValue
  @Override
  public String toString() {
    return channelId + ":" + threadTs;
  }
}
