package com.ridwan.slackexport.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "user-cache")
public class UserCacheConfig {
  private String dir = "results/users";
  private int ttlHours = 24;
  private int pageSize = 200;
}
