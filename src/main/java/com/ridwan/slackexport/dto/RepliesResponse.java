package com.ridwan.slackexport.dto;

import java.util.ArrayList;
import java.util.List;

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
public class RepliesResponse implements SlackApiResponse {

    @JsonProperty("ok")
    private boolean ok;

    @JsonProperty("error")
    private String error;

    @JsonProperty("messages")
    @Builder.Default
    private List<SlackMessage> messages = new ArrayList<>();

    @JsonProperty("has_more")
    private boolean hasMore;

    @JsonProperty("response_metadata")
    private ResponseMetadata responseMetadata;

    public String nextCursor() {
        if (!hasMore || responseMetadata == null) {
            return null;
        }
        String cursor = responseMetadata.getNextCursor();
        return cursor == null || cursor.isEmpty() ? null : cursor;
    }
}
