package com.ridwan.slackexport.users;

import java.util.Map;

import com.ridwan.slackexport.model.Workspace;

/**
 * Cache of user id to display name, per workspace. Each {@link #lookup} is an independent
 * snapshot; a refresh may replace the cache between two lookups of the same run.
 */
public interface UserDirectory {

  Map<String, String> lookup(String workspace);

  boolean isEmpty(String workspace);

  boolean isStale(String workspace);

  /** Rebuilds the cache from users.list before returning. */
  void refresh(Workspace workspace);

  /** Starts a refresh without waiting for it. */
  void triggerBackgroundRefresh(Workspace workspace);
}
