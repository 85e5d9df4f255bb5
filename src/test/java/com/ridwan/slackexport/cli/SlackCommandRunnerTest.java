package com.ridwan.slackexport.cli;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CancellationException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridwan.slackexport.client.SlackClient;
import com.ridwan.slackexport.config.DigestConfig;
import com.ridwan.slackexport.config.SlackConfig;
import com.ridwan.slackexport.config.WorkspaceRegistry;
import com.ridwan.slackexport.error.ErrorKind;
import com.ridwan.slackexport.error.SlackExportException;
import com.ridwan.slackexport.model.DigestReport;
import com.ridwan.slackexport.model.DigestRequest;
import com.ridwan.slackexport.model.ExportJob;
import com.ridwan.slackexport.model.ExportRequest;
import com.ridwan.slackexport.model.ExportStatus;
import com.ridwan.slackexport.output.JsonReportWriter;
import com.ridwan.slackexport.service.DigestAggregator;
import com.ridwan.slackexport.service.ExportPipeline;
import com.ridwan.slackexport.testsupport.TestObjectMappers;
import com.ridwan.slackexport.validation.ConfigValidator;

@ExtendWith(MockitoExtension.class)
class SlackCommandRunnerTest {

  @Mock private ExportPipeline exportPipeline;
  @Mock private DigestAggregator digestAggregator;
  @Mock private SlackClient slackClient;
  @Mock private JsonReportWriter reportWriter;

  @TempDir Path tempDir;

  private SlackConfig slackConfig;
  private ObjectMapper objectMapper;
  private SlackCommandRunner runner;

  private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
  private PrintStream originalOut;

  @BeforeEach
  void setUp() {
    slackConfig = new SlackConfig();
    SlackConfig.Credentials credentials = new SlackConfig.Credentials();
    credentials.setXoxcToken("xoxc-1234567890-abcdefghij");
    credentials.setXoxdToken("xoxd-cookie");
    credentials.setDomain("acme");
    slackConfig.getWorkspaces().put("acme", credentials);

    ConfigValidator validator = new ConfigValidator();
    objectMapper = TestObjectMappers.create();
    runner =
        new SlackCommandRunner(
            exportPipeline,
            digestAggregator,
            slackClient,
            new WorkspaceRegistry(slackConfig, validator),
            reportWriter,
            validator,
            slackConfig,
            new DigestConfig(),
            objectMapper);

    originalOut = System.out;
    System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
  }

  @AfterEach
  void tearDown() {
    System.setOut(originalOut);
    Thread.interrupted();
  }

  @Test
  void shouldPrintUsageWithoutCommand() {
    runner.run(new DefaultApplicationArguments());

    assertEquals(SlackCommandRunner.EXIT_USAGE, runner.getExitCode());
    assertTrue(output().contains("Usage: slack-export"));
  }

  @Test
  void shouldRejectUnknownCommand() {
    runner.run(new DefaultApplicationArguments("frobnicate"));

    assertEquals(SlackCommandRunner.EXIT_USAGE, runner.getExitCode());
  }

  @Test
  void shouldBuildExportRequestFromOptions() {
    ExportJob job =
        ExportJob.builder().id("job-1").status(ExportStatus.COMPLETED).outputPath("out.json").build();
    when(exportPipeline.run(any())).thenReturn(job);

    runner.run(
        new DefaultApplicationArguments(
            "export", "--workspace=acme", "--from=2026-01-01", "--to=2026-01-02", "--output=out.json"));

    ArgumentCaptor<ExportRequest> captor = ArgumentCaptor.forClass(ExportRequest.class);
    verify(exportPipeline).run(captor.capture());
    ExportRequest request = captor.getValue();
    assertEquals("acme", request.getWorkspace());
    assertEquals(LocalDate.of(2026, 1, 1), request.getFrom());
    assertEquals(LocalDate.of(2026, 1, 2), request.getTo());
    assertEquals("out.json", request.getOutputPath());
    assertFalse(request.isResume());
    assertEquals(0, runner.getExitCode());
  }

  @Test
  void shouldUseErrorKindExitCodeOnFailure() {
    when(exportPipeline.run(any()))
        .thenThrow(new SlackExportException(ErrorKind.NOTHING_TO_RESUME, "No export to resume"));

    runner.run(new DefaultApplicationArguments("export", "--workspace=acme", "--resume"));

    assertEquals(ErrorKind.NOTHING_TO_RESUME.getExitCode(), runner.getExitCode());
  }

  @Test
  void shouldExitWith130WhenInterrupted() {
    when(exportPipeline.run(any())).thenThrow(new CancellationException("interrupted"));

    runner.run(new DefaultApplicationArguments("export", "--workspace=acme", "--resume"));

    assertEquals(SlackCommandRunner.EXIT_INTERRUPTED, runner.getExitCode());
  }

  @Test
  void shouldRejectMalformedDate() {
    runner.run(new DefaultApplicationArguments("export", "--workspace=acme", "--from=01/02/2026"));

    assertEquals(ErrorKind.CONFIGURATION_ERROR.getExitCode(), runner.getExitCode());
    verifyNoInteractions(exportPipeline);
  }

  @Test
  void shouldRejectRateLimitsAtPlatformCeiling() {
    slackConfig.getRateLimit().setSearchPerMinute(20);

    runner.run(new DefaultApplicationArguments("auth"));

    assertEquals(ErrorKind.CONFIGURATION_ERROR.getExitCode(), runner.getExitCode());
    verifyNoInteractions(slackClient);
  }

  @Test
  void shouldGenerateAndWriteDigest() throws Exception {
    DigestReport report = DigestReport.builder().build();
    when(digestAggregator.generate(any())).thenReturn(report);
    String output = tempDir.resolve("digest.json").toString();

    runner.run(
        new DefaultApplicationArguments(
            "digest", "--workspace=acme, beta", "--hours=12", "--output=" + output));

    ArgumentCaptor<DigestRequest> captor = ArgumentCaptor.forClass(DigestRequest.class);
    verify(digestAggregator).generate(captor.capture());
    assertEquals(List.of("acme", "beta"), captor.getValue().getWorkspaces());
    assertEquals(12, captor.getValue().getLookbackHours());
    verify(reportWriter).writeDigest(eq(output), eq(report));
    assertEquals(0, runner.getExitCode());
  }

  @Test
  void shouldBuildPermalinkFromConfiguredDomain() throws Exception {
    runner.run(
        new DefaultApplicationArguments(
            "permalink", "--channel=C1", "--ts=1712345678.123456", "--style=browser"));

    assertEquals(0, runner.getExitCode());
    verifyNoInteractions(slackClient);
    assertEquals(
        "https://acme.slack.com/messages/C1/p1712345678123456",
        objectMapper.readTree(output()).get("permalink").asText());
  }

  @Test
  void shouldRequireChannelForHistory() {
    runner.run(new DefaultApplicationArguments("history"));

    assertEquals(ErrorKind.CONFIGURATION_ERROR.getExitCode(), runner.getExitCode());
    verify(slackClient, never()).conversationsHistory(any(), anyString(), anyInt());
  }

  private String output() {
    return stdout.toString(StandardCharsets.UTF_8);
  }
}
