package com.ridwan.slackexport.config;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.ridwan.slackexport.error.ErrorKind;
import com.ridwan.slackexport.error.SlackExportException;
import com.ridwan.slackexport.model.Workspace;
import com.ridwan.slackexport.validation.ConfigValidator;

class WorkspaceRegistryTest {

  private SlackConfig slackConfig;
  private WorkspaceRegistry registry;

  @BeforeEach
  void setUp() {
    slackConfig = new SlackConfig();
    registry = new WorkspaceRegistry(slackConfig, new ConfigValidator());
  }

  @Test
  void shouldResolveConfiguredWorkspace() {
    slackConfig.getWorkspaces().put("acme", credentials("acme"));

    Workspace workspace = registry.resolve("acme");

    assertEquals("acme", workspace.getName());
    assertEquals("acme", workspace.getDomain());
    assertEquals("xoxd-cookie", workspace.getXoxdToken());
  }

  @Test
  void shouldTreatBlankDomainAsUnknown() {
    slackConfig.getWorkspaces().put("acme", credentials(""));

    assertNull(registry.resolve("acme").getDomain());
  }

  @Test
  void shouldKeepTokensOutOfToString() {
    slackConfig.getWorkspaces().put("acme", credentials("acme"));

    String text = registry.resolve("acme").toString();

    assertFalse(text.contains("xoxc-"));
    assertFalse(text.contains("xoxd-"));
  }

  @Test
  void shouldListWorkspacesInDeclarationOrder() {
    slackConfig.getWorkspaces().put("zeta", credentials(null));
    slackConfig.getWorkspaces().put("acme", credentials(null));

    assertEquals(List.of("zeta", "acme"), registry.names());
  }

  @Test
  void shouldFailWhenNoWorkspacesConfigured() {
    SlackExportException exception = assertThrows(SlackExportException.class, registry::names);

    assertEquals(ErrorKind.CONFIGURATION_ERROR, exception.getKind());
  }

  private static SlackConfig.Credentials credentials(String domain) {
    SlackConfig.Credentials credentials = new SlackConfig.Credentials();
    credentials.setXoxcToken("xoxc-1234567890-abcdefghij");
    credentials.setXoxdToken("xoxd-cookie");
    credentials.setDomain(domain);
    return credentials;
  }
}
