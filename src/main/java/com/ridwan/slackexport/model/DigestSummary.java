package com.ridwan.slackexport.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class DigestSummary {

  @JsonProperty("total_mentions")
  private int totalMentions;

  @JsonProperty("unhandled_mentions")
  private int unhandledMentions;

  @JsonProperty("total_replies")
  private int totalReplies;

  public void countMention(boolean handled) {
    totalMentions++;
    if (!handled) {
      unhandledMentions++;
    }
  }

  public void countReply() {
    totalReplies++;
  }
}
