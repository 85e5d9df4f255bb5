package com.ridwan.slackexport.model;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ExportMetadata {

  @JsonProperty("job_id")
  String jobId;

  @JsonProperty("workspace")
  String workspace;

  @JsonProperty("user_id")
  String userId;

  @JsonProperty("username")
  String username;

  @JsonProperty("date_range")
  DateRange dateRange;

  @JsonProperty("completed_at")
  Instant completedAt;

  @JsonProperty("total_matches")
  int totalMatches;

  @JsonProperty("thread_count")
  int threadCount;

  @JsonProperty("standalone_count")
  int standaloneCount;

  @JsonProperty("message_count")
  int messageCount;

  @JsonProperty("error_count")
  int errorCount;
}
