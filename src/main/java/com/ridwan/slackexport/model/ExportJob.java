package com.ridwan.slackexport.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.ridwan.slackexport.error.ErrorKind;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Durable state of one export for one workspace. The whole object is rewritten on every
 * checkpoint, so a reloaded job always reflects a fully processed prefix of the work.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExportJob {

  @JsonProperty("id")
  private String id;

  @JsonProperty("workspace")
  private String workspace;

  @JsonProperty("user_id")
  private String userId;

  @JsonProperty("username")
  private String username;

  // Workspace subdomain, used to build permalinks for thread replies
  @JsonProperty("domain")
  private String domain;

  @JsonProperty("status")
  private ExportStatus status;

  // Status to re-enter when resuming a paused job
  @JsonProperty("suspended_status")
  private ExportStatus suspendedStatus;

  @JsonProperty("date_range")
  private DateRange dateRange;

  @JsonProperty("output_path")
  private String outputPath;

  @JsonProperty("search_progress")
  @Builder.Default
  private SearchProgress searchProgress = new SearchProgress();

  @JsonProperty("thread_progress")
  @Builder.Default
  private ThreadProgress threadProgress = new ThreadProgress();

  @JsonProperty("accumulated_data")
  @Builder.Default
  private AccumulatedData accumulatedData = new AccumulatedData();

  @JsonProperty("errors")
  @Builder.Default
  private List<ErrorEntry> errors = new ArrayList<>();

  @JsonProperty("created_at")
  private Instant createdAt;

  @JsonProperty("updated_at")
  private Instant updatedAt;

  @JsonProperty("completed_at")
  private Instant completedAt;

  public void appendError(Instant timestamp, ErrorKind kind, String code, String detail) {
    errors.add(
        ErrorEntry.builder().timestamp(timestamp).kind(kind).code(code).detail(detail).build());
  }

  /** Suspends the job; the current status is kept so resume can re-enter it. */
  public void pause() {
    if (status == ExportStatus.PAUSED || status == ExportStatus.COMPLETED) {
      return;
    }
    suspendedStatus = status;
    status = ExportStatus.PAUSED;
  }

  /** Leaves the paused state, restoring the status the job was suspended in. */
  public void unpause() {
    if (status != ExportStatus.PAUSED) {
      return;
    }
    status = suspendedStatus != null ? suspendedStatus : ExportStatus.SEARCHING;
    suspendedStatus = null;
  }
}
