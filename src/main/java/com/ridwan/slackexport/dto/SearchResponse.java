package com.ridwan.slackexport.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchResponse implements SlackApiResponse {

    @JsonProperty("ok")
    private boolean ok;

    @JsonProperty("error")
    private String error;

    @JsonProperty("query")
    private String query;

    @JsonProperty("messages")
    private SearchMessages messages;
}
