package com.ridwan.slackexport.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** A message by someone else in a thread the target user took part in. */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReplyRecord {

  @JsonProperty("workspace")
  String workspace;

  @JsonProperty("channel_id")
  String channelId;

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

  @JsonProperty("after_last_own_message")
  boolean afterLastOwnMessage;
}
