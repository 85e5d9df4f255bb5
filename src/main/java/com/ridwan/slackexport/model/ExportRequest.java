package com.ridwan.slackexport.model;

import java.time.LocalDate;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ExportRequest {
  String workspace;
  LocalDate from;
  LocalDate to;
  String outputPath;
  boolean resume;
}
