package com.ridwan.slackexport.model;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ThreadRecord {

  @JsonProperty("thread_key")
  ThreadKey threadKey;

  @JsonProperty("total_message_count")
  int totalMessageCount;

  @JsonProperty("target_user_message_count")
  int targetUserMessageCount;

  @JsonProperty("messages")
  List<MessageRecord> messages;
}
