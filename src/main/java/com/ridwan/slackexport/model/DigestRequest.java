package com.ridwan.slackexport.model;

import java.util.List;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DigestRequest {
  // Empty means every configured workspace
  @Builder.Default List<String> workspaces = List.of();
  Integer lookbackHours;
  String outputPath;
}
