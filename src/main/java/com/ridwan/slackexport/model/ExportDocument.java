package com.ridwan.slackexport.model;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Builder;
import lombok.Value;

/** The artifact written by a completed export. */
@Value
@Builder
@JsonPropertyOrder({"metadata", "users", "channels", "threads", "standalone_messages"})
public class ExportDocument {

  @JsonProperty("metadata")
  ExportMetadata metadata;

  // author id -> display name
  @JsonProperty("users")
  Map<String, String> users;

  @JsonProperty("channels")
  List<ChannelMeta> channels;

  @JsonProperty("threads")
  List<ThreadRecord> threads;

  @JsonProperty("standalone_messages")
  List<MessageRecord> standaloneMessages;
}
