package com.ridwan.slackexport.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MessageRecord {

  @JsonProperty("ts")
  String ts;

  @JsonProperty("channel_id")
  String channelId;

  @JsonProperty("user_id")
  String userId;

  @JsonProperty("text")
  String text;

  @JsonProperty("is_target_user")
  boolean authoredByTargetUser;

  @JsonProperty("permalink")
  String permalink;
}
