package com.ridwan.slackexport.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.ridwan.slackexport.error.ErrorKind;
import com.ridwan.slackexport.error.SlackExportException;
import com.ridwan.slackexport.model.Workspace;
import com.ridwan.slackexport.validation.ConfigValidator;

/** Resolves workspace names to validated credentials. */
@Component
public class WorkspaceRegistry {

  private final SlackConfig slackConfig;
  private final ConfigValidator configValidator;

  public WorkspaceRegistry(SlackConfig slackConfig, ConfigValidator configValidator) {
    this.slackConfig = slackConfig;
    this.configValidator = configValidator;
  }

  public Workspace resolve(String name) {
    SlackConfig.Credentials credentials = slackConfig.getWorkspaces().get(name);
    configValidator.validateCredentials(name, credentials);

    return Workspace.builder()
        .name(name)
        .xoxcToken(credentials.getXoxcToken())
        .xoxdToken(credentials.getXoxdToken())
        .domain(
            credentials.getDomain() == null || credentials.getDomain().isBlank()
                ? null
                : credentials.getDomain())
        .build();
  }

  /** All configured workspaces, in declaration order. */
  public List<String> names() {
    if (slackConfig.getWorkspaces().isEmpty()) {
      throw new SlackExportException(
          ErrorKind.CONFIGURATION_ERROR,
          "No workspaces configured. Please add slack.workspaces.<name>.xoxc-token to application.properties");
    }
    return new ArrayList<>(slackConfig.getWorkspaces().keySet());
  }
}
