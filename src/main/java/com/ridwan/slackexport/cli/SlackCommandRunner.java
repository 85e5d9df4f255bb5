package com.ridwan.slackexport.cli;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridwan.slackexport.client.Permalinks;
import com.ridwan.slackexport.client.SlackClient;
import com.ridwan.slackexport.config.DigestConfig;
import com.ridwan.slackexport.config.SlackConfig;
import com.ridwan.slackexport.config.WorkspaceRegistry;
import com.ridwan.slackexport.dto.AuthTestResponse;
import com.ridwan.slackexport.error.ErrorKind;
import com.ridwan.slackexport.error.SlackExportException;
import com.ridwan.slackexport.model.DigestReport;
import com.ridwan.slackexport.model.DigestRequest;
import com.ridwan.slackexport.model.ExportJob;
import com.ridwan.slackexport.model.ExportRequest;
import com.ridwan.slackexport.model.Workspace;
import com.ridwan.slackexport.output.JsonReportWriter;
import com.ridwan.slackexport.service.DigestAggregator;
import com.ridwan.slackexport.service.ExportPipeline;
import com.ridwan.slackexport.validation.ConfigValidator;

import lombok.extern.slf4j.Slf4j;

/**
 * Command line entry point.
 *
 * <pre>
 * export --workspace=W --from=YYYY-MM-DD --to=YYYY-MM-DD [--output=PATH] [--resume]
 * digest [--workspace=W1,W2] [--hours=N] [--output=PATH]
 * auth | channels [--types=] | users | history --channel= [--limit=]
 * replies --channel= --ts= | search --query= [--count=]
 * send --channel= --text= [--thread-ts=] | permalink --channel= --ts= [--style=app|browser]
 * </pre>
 *
 * The pass-through commands take {@code --workspace=W} too, defaulting to the first configured
 * workspace. Ctrl-C interrupts the running command; an export is paused and can be resumed.
 */
@Slf4j
@Component
public class SlackCommandRunner implements ApplicationRunner, ExitCodeGenerator {

  static final int EXIT_INTERRUPTED = 130;
  static final int EXIT_USAGE = 64;

  private static final long SHUTDOWN_GRACE_SECONDS = 30;

  private final ExportPipeline exportPipeline;
  private final DigestAggregator digestAggregator;
  private final SlackClient slackClient;
  private final WorkspaceRegistry workspaceRegistry;
  private final JsonReportWriter reportWriter;
  private final ConfigValidator configValidator;
  private final SlackConfig slackConfig;
  private final DigestConfig digestConfig;
  private final ObjectMapper objectMapper;

  private int exitCode;

  public SlackCommandRunner(
      ExportPipeline exportPipeline,
      DigestAggregator digestAggregator,
      SlackClient slackClient,
      WorkspaceRegistry workspaceRegistry,
      JsonReportWriter reportWriter,
      ConfigValidator configValidator,
      SlackConfig slackConfig,
      DigestConfig digestConfig,
      ObjectMapper objectMapper) {
    this.exportPipeline = exportPipeline;
    this.digestAggregator = digestAggregator;
    this.slackClient = slackClient;
    this.workspaceRegistry = workspaceRegistry;
    this.reportWriter = reportWriter;
    this.configValidator = configValidator;
    this.slackConfig = slackConfig;
    this.digestConfig = digestConfig;
    this.objectMapper = objectMapper;
  }

  @Override
  public void run(ApplicationArguments args) {
    List<String> commands = args.getNonOptionArgs();
    if (commands.isEmpty()) {
      printUsage();
      exitCode = EXIT_USAGE;
      return;
    }

    Thread worker = Thread.currentThread();
    CountDownLatch finished = new CountDownLatch(1);
    Thread hook =
        new Thread(
            () -> {
              log.warn("Shutdown requested - stopping {}", commands.get(0));
              worker.interrupt();
              try {
                finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS);
              } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
              }
            },
            "slack-export-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);

    try {
      configValidator.validateRateLimits(slackConfig.getRateLimit());
      exitCode = dispatch(commands.get(0), args);
    } catch (CancellationException e) {
      log.warn("Interrupted: {}. Run the export again with --resume to continue", e.getMessage());
      exitCode = EXIT_INTERRUPTED;
    } catch (SlackExportException e) {
      log.error("{} ({})", e.getMessage(), e.getKind());
      exitCode = e.getExitCode();
    } finally {
      finished.countDown();
      try {
        Runtime.getRuntime().removeShutdownHook(hook);
      } catch (IllegalStateException e) {
        log.debug("JVM already shutting down");
      }
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }

  int dispatch(String command, ApplicationArguments args) {
    switch (command) {
      case "export":
        return export(args);
      case "digest":
        return digest(args);
      case "auth":
        print(slackClient.authTest(workspace(args)));
        return 0;
      case "channels":
        print(
            slackClient.channelsList(
                workspace(args),
                option(args, "types", "public_channel,private_channel,im,mpim"),
                200));
        return 0;
      case "users":
        print(slackClient.usersList(workspace(args), 200, option(args, "cursor", null)));
        return 0;
      case "history":
        print(
            slackClient.conversationsHistory(
                workspace(args),
                required(args, "channel"),
                Integer.parseInt(option(args, "limit", "100"))));
        return 0;
      case "replies":
        print(
            slackClient.conversationsReplies(
                workspace(args), required(args, "channel"), required(args, "ts"), null));
        return 0;
      case "search":
        print(
            slackClient.searchMessages(
                workspace(args),
                required(args, "query"),
                1,
                Integer.parseInt(option(args, "count", "20")),
                "timestamp",
                "desc"));
        return 0;
      case "send":
        print(
            slackClient.postMessage(
                workspace(args),
                required(args, "channel"),
                required(args, "text"),
                option(args, "thread-ts", null)));
        return 0;
      case "permalink":
        return permalink(args);
      default:
        log.error("Unknown command: {}", command);
        printUsage();
        return EXIT_USAGE;
    }
  }

  private int export(ApplicationArguments args) {
    ExportRequest request =
        ExportRequest.builder()
            .workspace(option(args, "workspace", null))
            .from(date(args, "from"))
            .to(date(args, "to"))
            .outputPath(option(args, "output", null))
            .resume(args.containsOption("resume"))
            .build();

    ExportJob job = exportPipeline.run(request);
    log.info("Export {} is {}: {}", job.getId(), job.getStatus().getValue(), job.getOutputPath());
    return 0;
  }

  private int digest(ApplicationArguments args) {
    String workspaces = option(args, "workspace", null);
    String hours = option(args, "hours", null);
    String output = option(args, "output", digestConfig.getOutputPath());

    DigestRequest request =
        DigestRequest.builder()
            .workspaces(
                workspaces == null
                    ? List.of()
                    : Arrays.stream(workspaces.split(","))
                        .map(String::trim)
                        .filter(s -> !s.isEmpty())
                        .collect(Collectors.toList()))
            .lookbackHours(hours == null ? null : Integer.valueOf(hours))
            .outputPath(output)
            .build();

    DigestReport report = digestAggregator.generate(request);
    try {
      reportWriter.writeDigest(output, report);
    } catch (IOException e) {
      throw new SlackExportException(
          ErrorKind.UNKNOWN, null, "Failed to write digest to " + output + ": " + e.getMessage(), e);
    }
    return 0;
  }

  private int permalink(ApplicationArguments args) {
    Workspace workspace = workspace(args);
    String domain = workspace.getDomain();
    if (domain == null) {
      AuthTestResponse auth = slackClient.authTest(workspace);
      if (!auth.isOk()) {
        throw SlackExportException.fromSlackError(auth.getError(), "auth.test");
      }
      domain = Permalinks.domainFromUrl(auth.getUrl());
    }

    String link =
        Permalinks.build(
            domain,
            required(args, "channel"),
            required(args, "ts"),
            Permalinks.Style.fromName(option(args, "style", "app")));
    print(objectMapper.createObjectNode().put("ok", true).put("permalink", link));
    return 0;
  }

  private Workspace workspace(ApplicationArguments args) {
    String name = option(args, "workspace", null);
    return workspaceRegistry.resolve(name != null ? name : workspaceRegistry.names().get(0));
  }

  private static LocalDate date(ApplicationArguments args, String name) {
    String value = option(args, name, null);
    if (value == null) {
      return null;
    }
    try {
      return LocalDate.parse(value);
    } catch (DateTimeParseException e) {
      throw new SlackExportException(
          ErrorKind.CONFIGURATION_ERROR, "--" + name + " must be YYYY-MM-DD, got: " + value);
    }
  }

  private static String option(ApplicationArguments args, String name, String fallback) {
    List<String> values = args.getOptionValues(name);
    return values == null || values.isEmpty() ? fallback : values.get(0);
  }

  private static String required(ApplicationArguments args, String name) {
    String value = option(args, name, null);
    if (value == null) {
      throw new SlackExportException(ErrorKind.CONFIGURATION_ERROR, "--" + name + " is required");
    }
    return value;
  }

  private void print(Object value) {
    try {
      System.out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
    } catch (JsonProcessingException e) {
      throw new SlackExportException(
          ErrorKind.UNKNOWN, null, "Could not render result: " + e.getMessage(), e);
    }
  }

  private static void printUsage() {
    System.out.println(
        String.join(
            System.lineSeparator(),
            "Usage: slack-export <command> [--workspace=NAME] [options]",
            "  export --from=YYYY-MM-DD --to=YYYY-MM-DD [--output=PATH] [--resume]",
            "  digest [--workspace=W1,W2] [--hours=N] [--output=PATH]",
            "  auth",
            "  channels [--types=public_channel,private_channel,im,mpim]",
            "  users [--cursor=CURSOR]",
            "  history --channel=ID [--limit=N]",
            "  replies --channel=ID --ts=THREAD_TS",
            "  search --query=QUERY [--count=N]",
            "  send --channel=ID --text=TEXT [--thread-ts=TS]",
            "  permalink --channel=ID --ts=TS [--style=app|browser]"));
  }
}
