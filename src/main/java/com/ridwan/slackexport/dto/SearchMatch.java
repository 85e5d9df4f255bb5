package com.ridwan.slackexport.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchMatch {

    @JsonProperty("ts")
    private String ts;

    // Only present on some responses; the permalink usually carries it instead
    @JsonProperty("thread_ts")
    private String threadTs;

    @JsonProperty("text")
    private String text;

    @JsonProperty("user")
    private String user;

    @JsonProperty("username")
    private String username;

    @JsonProperty("channel")
    private SearchChannel channel;

    @JsonProperty("permalink")
    private String permalink;

    @JsonProperty("blocks")
    private List<JsonNode> blocks;
}
