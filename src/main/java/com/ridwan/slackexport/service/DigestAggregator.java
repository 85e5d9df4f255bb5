package com.ridwan.slackexport.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import com.ridwan.slackexport.client.MessageText;
import com.ridwan.slackexport.client.Permalinks;
import com.ridwan.slackexport.client.SlackClient;
import com.ridwan.slackexport.config.DigestConfig;
import com.ridwan.slackexport.config.WorkspaceRegistry;
import com.ridwan.slackexport.dto.AuthTestResponse;
import com.ridwan.slackexport.dto.RepliesResponse;
import com.ridwan.slackexport.dto.SearchMatch;
import com.ridwan.slackexport.dto.SearchResponse;
import com.ridwan.slackexport.dto.SlackApiResponse;
import com.ridwan.slackexport.dto.SlackMessage;
import com.ridwan.slackexport.error.ErrorKind;
import com.ridwan.slackexport.error.SlackExportException;
import com.ridwan.slackexport.model.DigestReport;
import com.ridwan.slackexport.model.DigestRequest;
import com.ridwan.slackexport.model.MentionRecord;
import com.ridwan.slackexport.model.ReplyRecord;
import com.ridwan.slackexport.model.ThreadKey;
import com.ridwan.slackexport.model.Workspace;
import com.ridwan.slackexport.model.WorkspaceFailure;
import com.ridwan.slackexport.users.UserDirectory;

import lombok.extern.slf4j.Slf4j;

/**
 * Builds the activity digest: mentions of the user and replies in threads the user took part
 * in, over a lookback window, across one or more workspaces.
 *
 * <p>Each workspace is processed independently. A failure in one is recorded in the report and
 * the others still run. A message is reported at most once per run; mentions are collected
 * before replies so a message matching both is a mention.
 */
@Slf4j
@Service
public class DigestAggregator {

  private static final Set<String> MEMBERSHIP_SUBTYPES =
      Set.of("channel_join", "channel_leave", "group_join", "group_leave");

  private final SlackClient slackClient;
  private final UserDirectory userDirectory;
  private final WorkspaceRegistry workspaceRegistry;
  private final DigestConfig digestConfig;
  private final Clock clock;

  @Autowired
  public DigestAggregator(
      SlackClient slackClient,
      UserDirectory userDirectory,
      WorkspaceRegistry workspaceRegistry,
      DigestConfig digestConfig) {
    this(slackClient, userDirectory, workspaceRegistry, digestConfig, Clock.systemUTC());
  }

  DigestAggregator(
      SlackClient slackClient,
      UserDirectory userDirectory,
      WorkspaceRegistry workspaceRegistry,
      DigestConfig digestConfig,
      Clock clock) {
    this.slackClient = slackClient;
    this.userDirectory = userDirectory;
    this.workspaceRegistry = workspaceRegistry;
    this.digestConfig = digestConfig;
    this.clock = clock;
  }

  public DigestReport generate(DigestRequest request) {
    List<String> workspaces =
        request.getWorkspaces().isEmpty() ? workspaceRegistry.names() : request.getWorkspaces();
    int lookbackHours =
        request.getLookbackHours() != null
            ? request.getLookbackHours()
            : digestConfig.getLookbackHours();

    Instant now = clock.instant();
    Instant windowStart = now.minus(Duration.ofHours(lookbackHours));

    DigestReport report =
        DigestReport.builder().periodStart(windowStart).periodEnd(now).generatedAt(now).build();
    Set<String> seen = new HashSet<>();

    log.info(
        "Building digest for {} workspace(s), last {} hours", workspaces.size(), lookbackHours);

    for (String name : workspaces) {
      try {
        WorkspaceRun run = new WorkspaceRun(workspaceRegistry.resolve(name), windowStart, seen);
        run.collect();

        // Merge only once the whole workspace succeeded
        seen.addAll(run.seen);
        run.mentions.forEach(report::addMention);
        run.replies.forEach(report::addReply);
        log.info(
            "Workspace {}: {} mentions, {} replies",
            name,
            run.mentions.size(),
            run.replies.size());
      } catch (CancellationException e) {
        throw e;
      } catch (SlackExportException e) {
        log.error("Skipping workspace {}: {}", name, e.getMessage());
        report.getFailedWorkspaces().add(new WorkspaceFailure(name, e.getKind(), e.getMessage()));
      } catch (RuntimeException e) {
        log.error("Skipping workspace {}: {}", name, e.getMessage(), e);
        report
            .getFailedWorkspaces()
            .add(new WorkspaceFailure(name, ErrorKind.UNKNOWN, e.toString()));
      }
    }

    log.info("=== Digest Complete ===");
    log.info("Mentions: {}", report.getSummary().getTotalMentions());
    log.info("Unhandled mentions: {}", report.getSummary().getUnhandledMentions());
    log.info("Replies: {}", report.getSummary().getTotalReplies());
    log.info("Failed workspaces: {}", report.getFailedWorkspaces().size());
    return report;
  }

  /** State for a single workspace; discarded when the workspace fails. */
  private final class WorkspaceRun {

    private final Workspace workspace;
    private final Instant windowStart;
    private final Set<String> seen;
    private final List<MentionRecord> mentions = new ArrayList<>();
    private final List<ReplyRecord> replies = new ArrayList<>();
    // A null value marks a thread that could not be fetched
    private final Map<ThreadKey, List<SlackMessage>> threads = new HashMap<>();

    private String userId;
    private String domain;
    private Map<String, String> names;

    WorkspaceRun(Workspace workspace, Instant windowStart, Set<String> globalSeen) {
      this.workspace = workspace;
      this.windowStart = windowStart;
      this.seen = new HashSet<>(globalSeen);
    }

    void collect() {
      AuthTestResponse auth = authenticate();
      userId = auth.getUserId();
      domain =
          workspace.getDomain() != null
              ? workspace.getDomain()
              : Permalinks.domainFromUrl(auth.getUrl());

      prepareUserCache();
      names = userDirectory.lookup(workspace.getName());

      collectMentions();
      collectReplies();
    }

    private AuthTestResponse authenticate() {
      AuthTestResponse auth =
          callWithRetry("auth.test", () -> slackClient.authTest(workspace));
      if (!auth.isOk()) {
        throw new SlackExportException(
            ErrorKind.AUTH_FAILURE,
            auth.getError(),
            "Authentication failed for workspace " + workspace.getName() + ": " + auth.getError());
      }
      return auth;
    }

    private void prepareUserCache() {
      if (userDirectory.isEmpty(workspace.getName())) {
        log.info("User cache for {} is empty, refreshing", workspace.getName());
        try {
          userDirectory.refresh(workspace);
        } catch (SlackExportException e) {
          log.warn("User cache refresh failed for {}: {}", workspace.getName(), e.getMessage());
        }
      } else if (userDirectory.isStale(workspace.getName())) {
        userDirectory.triggerBackgroundRefresh(workspace);
      }
    }

    // ── Mentions ────────────────────────────────────────────────────────────

    private void collectMentions() {
      for (SearchMatch match : search("<@" + userId + ">")) {
        if (match.getChannel() == null || match.getTs() == null) {
          continue;
        }
        String channelId = match.getChannel().getId();
        if (userId.equals(match.getUser()) || !inWindow(match.getTs())) {
          continue;
        }
        if (!seen.add(channelId + ":" + match.getTs())) {
          continue;
        }

        String threadTs = ExportPipeline.threadTsOf(match);
        if (threadTs == null) {
          threadTs = match.getTs();
        }

        mentions.add(
            MentionRecord.builder()
                .workspace(workspace.getName())
                .channelId(channelId)
                .channelName(match.getChannel().getName())
                .userId(match.getUser())
                .senderName(senderName(match.getUser(), match.getUsername()))
                .text(
                    MessageText.truncate(
                        MessageText.extract(match.getText(), match.getBlocks()),
                        digestConfig.getMaxTextLength()))
                .ts(match.getTs())
                .threadTs(threadTs)
                .permalink(match.getPermalink())
                .handled(isHandled(ThreadKey.of(channelId, threadTs), match.getTs()))
                .build());
      }
    }

    private boolean isHandled(ThreadKey key, String mentionTs) {
      List<SlackMessage> messages = thread(key);
      if (messages == null) {
        return false;
      }
      return messages.stream()
          .anyMatch(m -> userId.equals(m.getUser()) && MessageText.isAfter(m.getTs(), mentionTs));
    }

    // ── Replies ─────────────────────────────────────────────────────────────

    private void collectReplies() {
      Set<ThreadKey> keys = new LinkedHashSet<>();
      for (SearchMatch match : search("from:<@" + userId + ">")) {
        if (match.getChannel() == null || match.getTs() == null) {
          continue;
        }
        String threadTs = ExportPipeline.threadTsOf(match);
        keys.add(ThreadKey.of(match.getChannel().getId(), threadTs != null ? threadTs : match.getTs()));
      }

      for (ThreadKey key : keys) {
        List<SlackMessage> messages = thread(key);
        if (messages == null) {
          continue;
        }
        String latestOwn = latestOwnTs(messages);

        for (SlackMessage message : messages) {
          if (message.getUser() == null
              || userId.equals(message.getUser())
              || message.getTs() == null
              || isMembershipEvent(message)
              || !inWindow(message.getTs())) {
            continue;
          }
          if (!seen.add(key.getChannelId() + ":" + message.getTs())) {
            continue;
          }

          replies.add(
              ReplyRecord.builder()
                  .workspace(workspace.getName())
                  .channelId(key.getChannelId())
                  .userId(message.getUser())
                  .senderName(senderName(message.getUser(), null))
                  .text(
                      MessageText.truncate(
                          MessageText.extract(message.getText(), message.getBlocks()),
                          digestConfig.getMaxTextLength()))
                  .ts(message.getTs())
                  .threadTs(key.getThreadTs())
                  .permalink(
                      domain == null
                          ? null
                          : Permalinks.buildReply(
                              domain, key.getChannelId(), message.getTs(), key.getThreadTs()))
                  .afterLastOwnMessage(
                      latestOwn == null || MessageText.isAfter(message.getTs(), latestOwn))
                  .build());
        }
      }
    }

    private String latestOwnTs(List<SlackMessage> messages) {
      String latest = null;
      for (SlackMessage message : messages) {
        if (userId.equals(message.getUser())
            && message.getTs() != null
            && (latest == null || MessageText.isAfter(message.getTs(), latest))) {
          latest = message.getTs();
        }
      }
      return latest;
    }

    // ── Helpers ─────────────────────────────────────────────────────────────

    private List<SearchMatch> search(String userFilter) {
      LocalDate after = windowStart.atZone(ZoneOffset.UTC).toLocalDate().minusDays(1);
      String query = userFilter + " after:" + after;
      log.debug("Digest search on {}: {}", workspace.getName(), query);

      List<SearchMatch> results = new ArrayList<>();
      for (int page = 1; page <= digestConfig.getMaxPages(); page++) {
        int current = page;
        SearchResponse response =
            callWithRetry(
                "Search page " + current,
                () ->
                    slackClient.searchMessages(
                        workspace, query, current, digestConfig.getPageSize(), "timestamp", "desc"));
        if (!response.isOk()) {
          throw SlackExportException.fromSlackError(
              response.getError(), "Search on " + workspace.getName());
        }
        if (response.getMessages() == null || response.getMessages().getMatches() == null) {
          break;
        }
        results.addAll(response.getMessages().getMatches());

        int pages =
            response.getMessages().getPaging() == null
                ? 1
                : response.getMessages().getPaging().getPages();
        if (page >= pages) {
          break;
        }
      }
      return results;
    }

    private List<SlackMessage> thread(ThreadKey key) {
      if (threads.containsKey(key)) {
        return threads.get(key);
      }

      List<SlackMessage> messages = new ArrayList<>();
      String cursor = null;
      try {
        do {
          String pageCursor = cursor;
          RepliesResponse response =
              callWithRetry(
                  "Thread " + key,
                  () ->
                      slackClient.conversationsReplies(
                          workspace, key.getChannelId(), key.getThreadTs(), pageCursor));
          if (!response.isOk()) {
            log.warn("Could not fetch thread {}: {}", key, response.getError());
            messages = null;
            break;
          }
          messages.addAll(response.getMessages());
          cursor = response.nextCursor();
        } while (cursor != null);
      } catch (SlackExportException e) {
        if (e.getKind() != ErrorKind.RATE_LIMITED) {
          throw e;
        }
        log.warn("Could not fetch thread {}: {}", key, e.getMessage());
        messages = null;
      }

      threads.put(key, messages);
      return messages;
    }

    private boolean inWindow(String ts) {
      return !MessageText.toInstant(ts).isBefore(windowStart);
    }

    private String senderName(String id, String fallback) {
      if (id != null && names.containsKey(id)) {
        return names.get(id);
      }
      return fallback != null ? fallback : id;
    }

    private <T extends SlackApiResponse> T callWithRetry(String what, Supplier<T> call) {
      int rejections = 0;
      while (true) {
        T response = call.get();
        if (!response.isRateLimited()) {
          return response;
        }
        rejections++;
        if (rejections > digestConfig.getMaxRateLimitRetries()) {
          throw new SlackExportException(
              ErrorKind.RATE_LIMITED,
              response.getError(),
              what + " on " + workspace.getName() + " still rate limited after " + rejections
                  + " attempts");
        }
        log.warn("{} rate limited - retrying ({}/{})", what, rejections,
            digestConfig.getMaxRateLimitRetries());
        if (Thread.currentThread().isInterrupted()) {
          throw new CancellationException("Digest cancelled");
        }
      }
    }
  }

  // Most messages carry no subtype at all
  static boolean isMembershipEvent(SlackMessage message) {
    return message.getSubtype() != null && MEMBERSHIP_SUBTYPES.contains(message.getSubtype());
  }
}
