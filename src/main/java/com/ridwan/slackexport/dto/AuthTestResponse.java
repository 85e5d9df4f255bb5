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
public class AuthTestResponse implements SlackApiResponse {

    @JsonProperty("ok")
    private boolean ok;

    @JsonProperty("error")
    private String error;

    @JsonProperty("user_id")
    private String userId;

    @JsonProperty("user")
    private String user;

    @JsonProperty("team")
    private String team;

    // e.g. https://acme.slack.com/
    @JsonProperty("url")
    private String url;
}
