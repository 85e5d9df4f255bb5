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
public class ChannelMeta {

  @JsonProperty("id")
  String id;

  @JsonProperty("name")
  String name;

  @JsonProperty("type")
  ChannelType type;

  public static ChannelMeta of(String id, String name) {
    return ChannelMeta.builder().id(id).name(name).type(ChannelType.fromId(id)).build();
  }
}
