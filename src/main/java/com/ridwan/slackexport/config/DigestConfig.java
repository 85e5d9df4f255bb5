package com.ridwan.slackexport.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "digest")
public class DigestConfig {
  private int lookbackHours = 24;
  private int pageSize = 100;
  private int maxPages = 5;
  private int maxTextLength = 500;
  private int maxRateLimitRetries = 10;
  private String outputPath = "results/digest.json";
}
