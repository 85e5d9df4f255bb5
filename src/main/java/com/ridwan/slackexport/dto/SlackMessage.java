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
public class SlackMessage {

    @JsonProperty("ts")
    private String ts;

    @JsonProperty("thread_ts")
    private String threadTs;

    @JsonProperty("user")
    private String user;

    @JsonProperty("bot_id")
    private String botId;

    @JsonProperty("subtype")
    private String subtype;

    @JsonProperty("text")
    private String text;

    @JsonProperty("reply_count")
    private Integer replyCount;

    @JsonProperty("blocks")
    private List<JsonNode> blocks;
}
