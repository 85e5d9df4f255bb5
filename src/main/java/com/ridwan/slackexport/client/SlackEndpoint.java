package com.ridwan.slackexport.client;

import com.ridwan.slackexport.ratelimit.Tier;

/** Web API methods used by this tool and the pacing tier each one is charged against. */
public enum SlackEndpoint {
  AUTH_TEST("auth.test", null),
  SEARCH_MESSAGES("search.messages", Tier.SEARCH),
  CONVERSATIONS_REPLIES("conversations.replies", Tier.THREAD_FETCH),
  CONVERSATIONS_HISTORY("conversations.history", Tier.THREAD_FETCH),
  CONVERSATIONS_LIST("conversations.list", null),
  USERS_LIST("users.list", null),
  CHAT_POST_MESSAGE("chat.postMessage", null);

  private final String method;
  private final Tier tier;

  SlackEndpoint(String method, Tier tier) {
    this.method = method;
    this.tier = tier;
  }

  public String getMethod() {
    return method;
  }

  /** @return the paced tier, or null when only the shared backoff applies */
  public Tier getTier() {
    return tier;
  }
}
