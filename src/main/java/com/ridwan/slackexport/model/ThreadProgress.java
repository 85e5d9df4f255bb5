package com.ridwan.slackexport.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ThreadProgress {

  // Discovery order decides the order threads are fetched and written
  @JsonProperty("pending")
  @JsonDeserialize(as = LinkedHashSet.class)
  @Builder.Default
  private Set<ThreadKey> pending = new LinkedHashSet<>();

  @JsonProperty("fetched")
  @JsonDeserialize(as = LinkedHashSet.class)
  @Builder.Default
  private Set<ThreadKey> fetched = new LinkedHashSet<>();

  // Last thread key processed
  @JsonProperty("cursor")
  private String cursor;

  /** @return true if the key was not already pending */
  public boolean addPending(ThreadKey key) {
    return pending.add(key);
  }

  /** Records a terminal outcome (fetched or permanently skipped) for the key. */
  public void markFetched(ThreadKey key) {
    fetched.add(key);
    cursor = key.toString();
  }

  public boolean isFetched(ThreadKey key) {
    return fetched.contains(key);
  }

  /** Pending keys without a terminal outcome, in the order they were discovered. */
  @JsonIgnore
  public List<ThreadKey> getRemaining() {
    return pending.stream().filter(key -> !fetched.contains(key)).toList();
  }
}
