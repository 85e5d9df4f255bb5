package com.ridwan.slackexport.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** A message that at-mentions the target user. */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MentionRecord {

  @JsonProperty("workspace")
  String workspace;

  @JsonProperty("channel_id")
  String channelId;

  @JsonProperty("channel_name")
  String channelName;

  @JsonProperty("user_id")
  String userId;

  @JsonProperty("sender")
  String senderName;

  @JsonProperty("text")
  String text;

  @JsonProperty("ts")
  String ts;

  @JsonProperty("thread_ts")
  String threadTs;

  @JsonProperty("permalink")
  String permalink;

  // True when the target user posted in the thread after this mention
  @JsonProperty("handled")
  boolean handled;
}
