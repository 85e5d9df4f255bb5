package com.ridwan.slackexport.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.springframework.stereotype.Component;

import com.ridwan.slackexport.config.SlackConfig;
import com.ridwan.slackexport.error.ErrorKind;
import com.ridwan.slackexport.error.SlackExportException;
import com.ridwan.slackexport.model.ExportRequest;
import com.ridwan.slackexport.ratelimit.Tier;

import lombok.extern.slf4j.Slf4j;

@Component
@Slf4j
public class ConfigValidator {

  private static final String XOXC_PREFIX = "xoxc-";
  private static final int MIN_TOKEN_LENGTH = 20;

  public void validateCredentials(String workspace, SlackConfig.Credentials credentials) {
    if (credentials == null) {
      throw configError(
          "Unknown workspace: "
              + workspace
              + "\n"
              + "Please configure slack.workspaces."
              + workspace
              + ".xoxc-token and .xoxd-token in application.properties");
    }

    String xoxc = credentials.getXoxcToken();
    if (xoxc == null || xoxc.trim().isEmpty()) {
      throw configError(
          "xoxc token is not set for workspace " + workspace + ".\n"
              + "Copy it from the browser's localStorage (localConfig_v2 -> teams -> token)");
    }
    if (!xoxc.startsWith(XOXC_PREFIX) || xoxc.length() < MIN_TOKEN_LENGTH) {
      throw configError(
          "xoxc token for workspace "
              + workspace
              + " appears to be invalid (expected "
              + XOXC_PREFIX
              + "..., at least "
              + MIN_TOKEN_LENGTH
              + " characters)");
    }

    String xoxd = credentials.getXoxdToken();
    if (xoxd == null || xoxd.trim().isEmpty()) {
      throw configError(
          "xoxd token (the 'd' cookie) is not set for workspace " + workspace + ".\n"
              + "Copy it from the browser's cookies for slack.com");
    }

    log.debug("Credential validation passed for workspace {}", workspace);
  }

  public void validateExportRequest(ExportRequest request) {
    if (request.getWorkspace() == null || request.getWorkspace().trim().isEmpty()) {
      throw configError("Workspace is not set for export");
    }

    if (request.isResume()) {
      // Date range and output come from the stored job
      return;
    }

    if (request.getFrom() == null || request.getTo() == null) {
      throw configError("Export date range is incomplete: --from and --to are both required");
    }
    if (request.getFrom().isAfter(request.getTo())) {
      throw configError(
          "Export date range is inverted: from " + request.getFrom() + " is after " + request.getTo());
    }

    validateOutputPath(request.getOutputPath());

    log.debug(
        "Export request validation passed: {} {}..{}",
        request.getWorkspace(),
        request.getFrom(),
        request.getTo());
  }

  public void validateRateLimits(SlackConfig.RateLimit rateLimit) {
    validateCeiling(Tier.SEARCH, rateLimit.getSearchPerMinute());
    validateCeiling(Tier.THREAD_FETCH, rateLimit.getThreadFetchPerMinute());
  }

  private void validateCeiling(Tier tier, int perMinute) {
    if (perMinute <= 0) {
      throw configError(tier + " rate limit must be greater than 0, got: " + perMinute);
    }
    if (perMinute >= tier.getPlatformLimitPerMinute()) {
      throw configError(
          tier
              + " rate limit must stay below Slack's limit of "
              + tier.getPlatformLimitPerMinute()
              + "/min, got: "
              + perMinute);
    }
  }

  private void validateOutputPath(String outputPath) {
    if (outputPath == null || outputPath.trim().isEmpty()) {
      throw configError("Output path is not configured");
    }

    Path parentDir = Paths.get(outputPath).toAbsolutePath().getParent();
    if (parentDir != null && Files.exists(parentDir) && !Files.isWritable(parentDir)) {
      throw configError(
          "Output directory is not writable: " + parentDir + "\n" + "Please check directory permissions");
    }

    log.debug("Output path validation passed: {}", outputPath);
  }

  private SlackExportException configError(String message) {
    return new SlackExportException(ErrorKind.CONFIGURATION_ERROR, message);
  }
}
