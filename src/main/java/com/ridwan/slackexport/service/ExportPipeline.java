package com.ridwan.slackexport.service;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.ridwan.slackexport.checkpoint.ExportStateStore.WorkspaceLock;
import com.ridwan.slackexport.checkpoint.ExportStateStore;
import com.ridwan.slackexport.client.MessageText;
import com.ridwan.slackexport.client.Permalinks;
import com.ridwan.slackexport.client.SlackClient;
import com.ridwan.slackexport.config.ExportConfig;
import com.ridwan.slackexport.config.WorkspaceRegistry;
import com.ridwan.slackexport.dto.AuthTestResponse;
import com.ridwan.slackexport.dto.RepliesResponse;
import com.ridwan.slackexport.dto.SearchMatch;
import com.ridwan.slackexport.dto.SearchMessages;
import com.ridwan.slackexport.dto.SearchResponse;
import com.ridwan.slackexport.dto.SlackApiResponse;
import com.ridwan.slackexport.dto.SlackMessage;
import com.ridwan.slackexport.error.ErrorKind;
import com.ridwan.slackexport.error.SlackExportException;
import com.ridwan.slackexport.model.AccumulatedData;
import com.ridwan.slackexport.model.ChannelMeta;
import com.ridwan.slackexport.model.DateRange;
import com.ridwan.slackexport.model.ExportDocument;
import com.ridwan.slackexport.model.ExportJob;
import com.ridwan.slackexport.model.ExportMetadata;
import com.ridwan.slackexport.model.ExportRequest;
import com.ridwan.slackexport.model.ExportStatus;
import com.ridwan.slackexport.model.MessageRecord;
import com.ridwan.slackexport.model.SearchProgress;
import com.ridwan.slackexport.model.ThreadKey;
import com.ridwan.slackexport.model.ThreadProgress;
import com.ridwan.slackexport.model.ThreadRecord;
import com.ridwan.slackexport.model.Workspace;
import com.ridwan.slackexport.output.JsonReportWriter;
import com.ridwan.slackexport.progress.ProgressTracker;
import com.ridwan.slackexport.users.UserDirectory;
import com.ridwan.slackexport.validation.ConfigValidator;

import lombok.extern.slf4j.Slf4j;

/**
 * Exports every message a user wrote in a date range, with the full threads they took part in.
 *
 * <p>Runs as a resumable state machine: {@code searching -> fetching_threads -> writing_output ->
 * completed}. Progress is checkpointed to the {@link ExportStateStore} after every search page and
 * every few threads, so a killed or interrupted run resumes without redoing checkpointed work.
 */
@Slf4j
@Service
public class ExportPipeline {

  private static final String SEARCH_SORT = "timestamp";
  private static final String SEARCH_SORT_DIR = "asc";

  private final SlackClient slackClient;
  private final ExportStateStore stateStore;
  private final UserDirectory userDirectory;
  private final JsonReportWriter reportWriter;
  private final WorkspaceRegistry workspaceRegistry;
  private final ConfigValidator configValidator;
  private final ExportConfig exportConfig;
  private final Clock clock;

  @Autowired
  public ExportPipeline(
      SlackClient slackClient,
      ExportStateStore stateStore,
      UserDirectory userDirectory,
      JsonReportWriter reportWriter,
      WorkspaceRegistry workspaceRegistry,
      ConfigValidator configValidator,
      ExportConfig exportConfig) {
    this(
        slackClient,
        stateStore,
        userDirectory,
        reportWriter,
        workspaceRegistry,
        configValidator,
        exportConfig,
        Clock.systemUTC());
  }

  ExportPipeline(
      SlackClient slackClient,
      ExportStateStore stateStore,
      UserDirectory userDirectory,
      JsonReportWriter reportWriter,
      WorkspaceRegistry workspaceRegistry,
      ConfigValidator configValidator,
      ExportConfig exportConfig,
      Clock clock) {
    this.slackClient = slackClient;
    this.stateStore = stateStore;
    this.userDirectory = userDirectory;
    this.reportWriter = reportWriter;
    this.workspaceRegistry = workspaceRegistry;
    this.configValidator = configValidator;
    this.exportConfig = exportConfig;
    this.clock = clock;
  }

  /**
   * Starts a fresh export, or resumes the stored one when {@code request.isResume()}.
   *
   * @return the job in its final state; a job that was already completed is returned untouched
   * @throws SlackExportException for configuration, authentication and fatal API errors
   * @throws CancellationException when the thread is interrupted; the job is left paused
   */
  public ExportJob run(ExportRequest request) {
    ExportRequest effective = withDefaultOutput(request);
    configValidator.validateExportRequest(effective);
    Workspace workspace = workspaceRegistry.resolve(effective.getWorkspace());

    WorkspaceLock lock =
        stateStore
            .tryLock(workspace.getName())
            .orElseThrow(
                () ->
                    new SlackExportException(
                        ErrorKind.JOB_IN_PROGRESS,
                        "Another export is already running for workspace " + workspace.getName()));

    try (lock) {
      ExportJob job =
          effective.isResume() ? loadForResume(workspace) : createJob(workspace, effective);

      if (job.getStatus() == ExportStatus.COMPLETED) {
        log.info(
            "Export {} for {} is already completed ({}); start a fresh export to redo it",
            job.getId(),
            workspace.getName(),
            job.getOutputPath());
        return job;
      }

      job.unpause();
      execute(workspace, job);
      return job;
    }
  }

  private ExportJob loadForResume(Workspace workspace) {
    ExportJob job =
        stateStore
            .load(workspace.getName())
            .orElseThrow(
                () ->
                    new SlackExportException(
                        ErrorKind.NOTHING_TO_RESUME,
                        "No export to resume for workspace " + workspace.getName()));

    log.info(
        "Resuming export {} from status {} ({} pending threads, {} fetched)",
        job.getId(),
        job.getStatus().getValue(),
        job.getThreadProgress().getPending().size(),
        job.getThreadProgress().getFetched().size());
    return job;
  }

  private ExportJob createJob(Workspace workspace, ExportRequest request) {
    AuthTestResponse auth = authenticate(workspace);
    Instant now = clock.instant();

    ExportJob job =
        ExportJob.builder()
            .id(UUID.randomUUID().toString().substring(0, 8))
            .workspace(workspace.getName())
            .userId(auth.getUserId())
            .username(auth.getUser())
            .domain(
                workspace.getDomain() != null
                    ? workspace.getDomain()
                    : Permalinks.domainFromUrl(auth.getUrl()))
            .status(ExportStatus.SEARCHING)
            .dateRange(DateRange.of(request.getFrom(), request.getTo()))
            .outputPath(request.getOutputPath())
            .createdAt(now)
            .build();

    log.info(
        "Starting export {} for {} ({}) from {} to {}",
        job.getId(),
        job.getUsername(),
        workspace.getName(),
        request.getFrom(),
        request.getTo());

    stateStore.save(workspace.getName(), job);
    return job;
  }

  private AuthTestResponse authenticate(Workspace workspace) {
    AuthTestResponse auth = null;
    for (int attempt = 0; attempt <= exportConfig.getMaxRateLimitRetries(); attempt++) {
      auth = slackClient.authTest(workspace);
      if (!auth.isRateLimited()) {
        break;
      }
    }

    if (auth == null || !auth.isOk()) {
      String code = auth == null ? null : auth.getError();
      throw new SlackExportException(
          "ratelimited".equals(code) ? ErrorKind.RATE_LIMITED : ErrorKind.AUTH_FAILURE,
          code,
          "Authentication failed for workspace " + workspace.getName() + ": " + code);
    }
    return auth;
  }

  private void execute(Workspace workspace, ExportJob job) {
    try {
      if (job.getStatus() == ExportStatus.SEARCHING) {
        runSearchPhase(workspace, job);
      }
      if (job.getStatus() == ExportStatus.FETCHING_THREADS) {
        runThreadPhase(workspace, job);
      }
      if (job.getStatus() == ExportStatus.WRITING_OUTPUT) {
        runWritePhase(workspace, job);
      }
    } catch (CancellationException e) {
      // Clear the flag so the checkpoint write is not refused by an interruptible channel
      boolean interrupted = Thread.interrupted();
      log.warn("Export {} interrupted during {} - pausing", job.getId(), job.getStatus().getValue());
      job.pause();
      checkpoint(workspace, job);
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
      throw e;
    } catch (SlackExportException e) {
      throw e;
    } catch (RuntimeException e) {
      throw failJob(
          workspace,
          job,
          ErrorKind.UNKNOWN,
          null,
          "Export failed during " + job.getStatus().getValue() + ": " + e.getMessage(),
          e);
    }
  }

  // ── Phase 1: search ───────────────────────────────────────────────────────

  private void runSearchPhase(Workspace workspace, ExportJob job) {
    SearchProgress progress = job.getSearchProgress();
    String query = buildSearchQuery(job);
    log.info("Searching messages with query: {}", query);

    while (progress.getCurrentPage() == 0
        || progress.getCurrentPage() < progress.getTotalPages()) {
      checkCancelled();
      int page = progress.getCurrentPage() + 1;

      SearchResponse response =
          callWithRetry(
              workspace,
              job,
              "Search page " + page,
              () ->
                  slackClient.searchMessages(
                      workspace,
                      query,
                      page,
                      exportConfig.getPageSize(),
                      SEARCH_SORT,
                      SEARCH_SORT_DIR));

      if (!response.isOk()) {
        throw failJob(
            workspace,
            job,
            ErrorKind.fromSlackError(response.getError()),
            response.getError(),
            "Search page " + page + " failed: " + response.getError(),
            null);
      }

      SearchMessages messages = response.getMessages();
      List<SearchMatch> matches = messages == null ? List.of() : messages.getMatches();
      for (SearchMatch match : matches) {
        processMatch(job, match);
      }

      progress.setCurrentPage(page);
      progress.setTotalPages(
          messages == null || messages.getPaging() == null ? 0 : messages.getPaging().getPages());
      progress.setTotalMatches(messages == null ? 0 : messages.getTotal());
      progress.setMessagesFetched(progress.getMessagesFetched() + matches.size());
      checkpoint(workspace, job);

      log.info(
          "Search page {}/{}: {} matches ({} threads pending, {} standalone)",
          page,
          progress.getTotalPages(),
          matches.size(),
          job.getThreadProgress().getPending().size(),
          job.getAccumulatedData().getStandaloneMessages().size());
    }

    job.setStatus(ExportStatus.FETCHING_THREADS);
    checkpoint(workspace, job);
  }

  private void processMatch(ExportJob job, SearchMatch match) {
    if (match.getChannel() == null || match.getChannel().getId() == null) {
      log.warn("Ignoring search match {} without a channel", match.getTs());
      return;
    }

    String channelId = match.getChannel().getId();
    AccumulatedData data = job.getAccumulatedData();
    data.registerChannel(channelId, match.getChannel().getName());

    String threadTs = threadTsOf(match);
    if (threadTs != null) {
      job.getThreadProgress().addPending(ThreadKey.of(channelId, threadTs));
      return;
    }

    data.getStandaloneMessages()
        .add(
            MessageRecord.builder()
                .ts(match.getTs())
                .channelId(channelId)
                .userId(match.getUser() != null ? match.getUser() : job.getUserId())
                .text(MessageText.extract(match.getText(), match.getBlocks()))
                .authoredByTargetUser(true)
                .permalink(match.getPermalink())
                .build());
  }

  static String threadTsOf(SearchMatch match) {
    if (match.getThreadTs() != null && !match.getThreadTs().isEmpty()) {
      return match.getThreadTs();
    }
    return Permalinks.extractThreadTs(match.getPermalink());
  }

  private String buildSearchQuery(ExportJob job) {
    // Slack's after:/before: filters are exclusive
    LocalDate from = job.getDateRange().getFrom();
    LocalDate to = job.getDateRange().getTo();
    return "from:<@" + job.getUserId() + "> after:" + from.minusDays(1) + " before:" + to.plusDays(1);
  }

  // ── Phase 2: thread expansion ─────────────────────────────────────────────

  private void runThreadPhase(Workspace workspace, ExportJob job) {
    ThreadProgress threads = job.getThreadProgress();
    List<ThreadKey> remaining = threads.getRemaining();

    ProgressTracker tracker = new ProgressTracker("Thread fetch");
    tracker.start(threads.getPending().size(), threads.getPending().size() - remaining.size());

    int sinceCheckpoint = 0;
    for (ThreadKey key : remaining) {
      checkCancelled();

      fetchThread(workspace, job, key);
      threads.markFetched(key);
      tracker.increment();

      if (++sinceCheckpoint >= exportConfig.getCheckpointInterval()) {
        checkpoint(workspace, job);
        sinceCheckpoint = 0;
      }
    }

    tracker.complete();
    job.setStatus(ExportStatus.WRITING_OUTPUT);
    checkpoint(workspace, job);
  }

  /** Appends a record for the thread, or logs a permanent skip. Throws on fatal errors. */
  private void fetchThread(Workspace workspace, ExportJob job, ThreadKey key) {
    List<SlackMessage> messages = new ArrayList<>();
    String cursor = null;

    do {
      String pageCursor = cursor;
      RepliesResponse response =
          callWithRetry(
              workspace,
              job,
              "Thread " + key,
              () ->
                  slackClient.conversationsReplies(
                      workspace, key.getChannelId(), key.getThreadTs(), pageCursor));

      if (!response.isOk()) {
        ErrorKind kind = ErrorKind.fromSlackError(response.getError());
        if (kind.isPermanentSkip()) {
          log.warn("Skipping thread {}: {}", key, response.getError());
          job.appendError(
              clock.instant(), kind, response.getError(), "Thread " + key + " skipped");
          return;
        }
        throw failJob(
            workspace,
            job,
            kind,
            response.getError(),
            "Fetching thread " + key + " failed: " + response.getError(),
            null);
      }

      messages.addAll(response.getMessages());
      cursor = response.nextCursor();
    } while (cursor != null);

    List<MessageRecord> records = new ArrayList<>(messages.size());
    int ownCount = 0;
    for (SlackMessage message : messages) {
      String author = message.getUser() != null ? message.getUser() : message.getBotId();
      boolean own = job.getUserId().equals(author);
      if (own) {
        ownCount++;
      }
      records.add(
          MessageRecord.builder()
              .ts(message.getTs())
              .channelId(key.getChannelId())
              .userId(author)
              .text(MessageText.extract(message.getText(), message.getBlocks()))
              .authoredByTargetUser(own)
              .permalink(
                  job.getDomain() == null
                      ? null
                      : Permalinks.buildReply(
                          job.getDomain(), key.getChannelId(), message.getTs(), key.getThreadTs()))
              .build());
    }

    job.getAccumulatedData()
        .getThreads()
        .add(
            ThreadRecord.builder()
                .threadKey(key)
                .totalMessageCount(records.size())
                .targetUserMessageCount(ownCount)
                .messages(records)
                .build());
  }

  // ── Phase 3: output ───────────────────────────────────────────────────────

  private void runWritePhase(Workspace workspace, ExportJob job) {
    AccumulatedData data = job.getAccumulatedData();
    Instant completedAt = clock.instant();

    int messageCount =
        data.getStandaloneMessages().size()
            + data.getThreads().stream().mapToInt(ThreadRecord::getTotalMessageCount).sum();

    ExportDocument document =
        ExportDocument.builder()
            .metadata(
                ExportMetadata.builder()
                    .jobId(job.getId())
                    .workspace(job.getWorkspace())
                    .userId(job.getUserId())
                    .username(job.getUsername())
                    .dateRange(job.getDateRange())
                    .completedAt(completedAt)
                    .totalMatches(job.getSearchProgress().getTotalMatches())
                    .threadCount(data.getThreads().size())
                    .standaloneCount(data.getStandaloneMessages().size())
                    .messageCount(messageCount)
                    .errorCount(job.getErrors().size())
                    .build())
            .users(resolveAuthorNames(workspace, data))
            .channels(new ArrayList<>(data.getChannels().values()))
            .threads(data.getThreads())
            .standaloneMessages(data.getStandaloneMessages())
            .build();

    try {
      reportWriter.writeExport(job.getOutputPath(), document);
    } catch (IOException e) {
      throw failJob(
          workspace,
          job,
          ErrorKind.UNKNOWN,
          null,
          "Writing " + job.getOutputPath() + " failed: " + e.getMessage(),
          e);
    }

    job.setCompletedAt(completedAt);
    job.setStatus(ExportStatus.COMPLETED);
    checkpoint(workspace, job);

    log.info("=== Export {} Complete ===", job.getId());
    log.info("Threads: {}", data.getThreads().size());
    log.info("Standalone messages: {}", data.getStandaloneMessages().size());
    log.info("Skipped or failed: {}", job.getErrors().size());
    log.info("Output: {}", job.getOutputPath());
  }

  private Map<String, String> resolveAuthorNames(Workspace workspace, AccumulatedData data) {
    if (userDirectory.isEmpty(workspace.getName())) {
      try {
        userDirectory.refresh(workspace);
      } catch (SlackExportException e) {
        log.warn("Exporting without display names, user cache refresh failed: {}", e.getMessage());
      }
    }
    Map<String, String> directory = userDirectory.lookup(workspace.getName());

    Map<String, String> names = new TreeMap<>();
    data.getStandaloneMessages().forEach(m -> addName(names, directory, m.getUserId()));
    data.getThreads()
        .forEach(t -> t.getMessages().forEach(m -> addName(names, directory, m.getUserId())));
    return names;
  }

  private static void addName(Map<String, String> names, Map<String, String> directory, String id) {
    if (id != null && directory.containsKey(id)) {
      names.put(id, directory.get(id));
    }
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  /**
   * Repeats a call while Slack answers {@code ratelimited}. The client has already told the
   * pacer, so each retry waits out the backoff. Gives up after the configured retry bound.
   */
  private <T extends SlackApiResponse> T callWithRetry(
      Workspace workspace, ExportJob job, String what, Supplier<T> call) {
    int rejections = 0;
    while (true) {
      T response = call.get();
      if (!response.isRateLimited()) {
        return response;
      }

      rejections++;
      if (rejections > exportConfig.getMaxRateLimitRetries()) {
        throw failJob(
            workspace,
            job,
            ErrorKind.RATE_LIMITED,
            response.getError(),
            what + " still rate limited after " + rejections + " attempts",
            null);
      }
      log.warn(
          "{} rate limited - retrying ({}/{})",
          what,
          rejections,
          exportConfig.getMaxRateLimitRetries());
      checkCancelled();
    }
  }

  private SlackExportException failJob(
      Workspace workspace,
      ExportJob job,
      ErrorKind kind,
      String code,
      String detail,
      Throwable cause) {
    log.error("Export {} failed: {}", job.getId(), detail);
    job.appendError(clock.instant(), kind, code, detail);
    SlackExportException failure = new SlackExportException(kind, code, detail, cause);
    try {
      checkpoint(workspace, job);
    } catch (RuntimeException e) {
      failure.addSuppressed(e);
    }
    return failure;
  }

  private void checkpoint(Workspace workspace, ExportJob job) {
    stateStore.save(workspace.getName(), job);
  }

  private static void checkCancelled() {
    if (Thread.currentThread().isInterrupted()) {
      throw new CancellationException("Export cancelled");
    }
  }

  private ExportRequest withDefaultOutput(ExportRequest request) {
    if (request.isResume() || request.getOutputPath() != null || request.getFrom() == null
        || request.getTo() == null) {
      return request;
    }
    String fileName =
        "export_" + request.getWorkspace() + "_" + request.getFrom() + "_" + request.getTo() + ".json";
    return request.toBuilder()
        .outputPath(Paths.get(exportConfig.getOutputDir(), fileName).toString())
        .build();
  }
}
