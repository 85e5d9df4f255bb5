package com.ridwan.slackexport.config;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "slack")
public class SlackConfig {

  private String baseUrl = "https://slack.com/api";

  // Sent with every request; the browser tokens are only honoured for browser-like clients
  private String userAgent =
      "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 "
          + "(KHTML, like Gecko) Chrome/143.0.0.0 Safari/537.36";

  private Map<String, Credentials> workspaces = new LinkedHashMap<>();
  private RateLimit rateLimit = new RateLimit();

  @Data
  public static class Credentials {
    private String xoxcToken;
    private String xoxdToken;
    // e.g. "acme" for https://acme.slack.com, used for permalinks
    private String domain;
  }

  @Data
  public static class RateLimit {
    private int searchPerMinute = 18;
    private int threadFetchPerMinute = 45;
  }
}
