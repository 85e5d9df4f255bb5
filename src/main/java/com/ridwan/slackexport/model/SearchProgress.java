package com.ridwan.slackexport.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchProgress {

  @JsonProperty("total_matches")
  private int totalMatches;

  // Last page fully processed and checkpointed; 0 before the first page
  @JsonProperty("current_page")
  private int currentPage;

  @JsonProperty("total_pages")
  private int totalPages;

  @JsonProperty("messages_fetched")
  private int messagesFetched;
}
