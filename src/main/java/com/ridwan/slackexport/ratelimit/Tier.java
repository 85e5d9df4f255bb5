package com.ridwan.slackexport.ratelimit;

/** Class of Slack endpoints sharing one per-minute quota. */
public enum Tier {

  /** {@code search.messages}, Slack Tier 2. */
  SEARCH(20),

  /** {@code conversations.replies} / {@code conversations.history}, Slack Tier 3. */
  THREAD_FETCH(50);

  private final int platformLimitPerMinute;

  Tier(int platformLimitPerMinute) {
    this.platformLimitPerMinute = platformLimitPerMinute;
  }

  public int getPlatformLimitPerMinute() {
    return platformLimitPerMinute;
  }
}
