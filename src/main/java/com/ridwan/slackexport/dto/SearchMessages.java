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
public class SearchMessages {

    @JsonProperty("total")
    private int total;

    @JsonProperty("matches")
    @Builder.Default
    private List<SearchMatch> matches = new ArrayList<>();

    @JsonProperty("paging")
    private Paging paging;
}
