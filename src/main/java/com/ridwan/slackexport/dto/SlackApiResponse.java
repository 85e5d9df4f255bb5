package com.ridwan.slackexport.dto;

/** Envelope shared by every Slack Web API response. */
public interface SlackApiResponse {

  boolean isOk();

  String getError();

  default boolean isRateLimited() {
    return !isOk() && "ratelimited".equals(getError());
  }
}
