package com.ridwan.slackexport.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccumulatedData {

  @JsonProperty("channels")
  @Builder.Default
  private Map<String, ChannelMeta> channels = new LinkedHashMap<>();

  @JsonProperty("threads")
  @Builder.Default
  private List<ThreadRecord> threads = new ArrayList<>();

  @JsonProperty("standalone_messages")
  @Builder.Default
  private List<MessageRecord> standaloneMessages = new ArrayList<>();

  /** Registers the channel unless it is already known. */
  public void registerChannel(String channelId, String name) {
    channels.computeIfAbsent(channelId, id -> ChannelMeta.of(id, name));
  }
}
