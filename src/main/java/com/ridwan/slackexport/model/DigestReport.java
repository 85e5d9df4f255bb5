package com.ridwan.slackexport.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DigestReport {

  @JsonProperty("period_start")
  private Instant periodStart;

  @JsonProperty("period_end")
  private Instant periodEnd;

  @JsonProperty("generated_at")
  private Instant generatedAt;

  @JsonProperty("summary")
  @Builder.Default
  private DigestSummary summary = new DigestSummary();

  @JsonProperty("mentions")
  @Builder.Default
  private List<MentionRecord> mentions = new ArrayList<>();

  @JsonProperty("replies")
  @Builder.Default
  private List<ReplyRecord> replies = new ArrayList<>();

  @JsonProperty("failed_workspaces")
  @Builder.Default
  private List<WorkspaceFailure> failedWorkspaces = new ArrayList<>();

  public void addMention(MentionRecord mention) {
    mentions.add(mention);
    summary.countMention(mention.isHandled());
  }

  public void addReply(ReplyRecord reply) {
    replies.add(reply);
    summary.countReply();
  }
}
