package com.ridwan.slackexport.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "export")
public class ExportConfig {
  private String stateDir = "results/state";
  private String outputDir = "results/exports";
  private int pageSize = 100;
  private int checkpointInterval = 10;
  private int maxRateLimitRetries = 10;
}
