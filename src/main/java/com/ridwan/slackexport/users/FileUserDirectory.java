package com.ridwan.slackexport.users;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridwan.slackexport.client.SlackClient;
import com.ridwan.slackexport.config.UserCacheConfig;
import com.ridwan.slackexport.dto.SlackUser;
import com.ridwan.slackexport.dto.UsersListResponse;
import com.ridwan.slackexport.error.SlackExportException;
import com.ridwan.slackexport.model.Workspace;

import jakarta.annotation.PreDestroy;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Display-name cache stored as one JSON file per workspace. Files are replaced atomically, so a
 * background refresh never exposes a half-written cache to a concurrent reader.
 */
@Component
@Slf4j
public class FileUserDirectory implements UserDirectory {

  private static final int MAX_RATE_LIMIT_RETRIES = 5;

  private final SlackClient slackClient;
  private final ObjectMapper objectMapper;
  private final Path cacheDir;
  private final Duration ttl;
  private final int pageSize;
  private final Clock clock;
  private final ExecutorService refreshExecutor;
  private final Set<String> refreshesInFlight = ConcurrentHashMap.newKeySet();

  @Autowired
  public FileUserDirectory(
      SlackClient slackClient, ObjectMapper objectMapper, UserCacheConfig config) {
    this(slackClient, objectMapper, config, Clock.systemUTC());
  }

  FileUserDirectory(
      SlackClient slackClient, ObjectMapper objectMapper, UserCacheConfig config, Clock clock) {
    this.slackClient = slackClient;
    this.objectMapper = objectMapper;
    this.cacheDir = Paths.get(config.getDir());
    this.ttl = Duration.ofHours(config.getTtlHours());
    this.pageSize = config.getPageSize();
    this.clock = clock;
    this.refreshExecutor =
        Executors.newSingleThreadExecutor(
            runnable -> {
              Thread thread = new Thread(runnable, "user-cache-refresh");
              thread.setDaemon(true);
              return thread;
            });
  }

  @Override
  public Map<String, String> lookup(String workspace) {
    UserCache cache = read(workspace);
    return cache == null ? Map.of() : cache.getUsers();
  }

  @Override
  public boolean isEmpty(String workspace) {
    UserCache cache = read(workspace);
    return cache == null || cache.getUsers().isEmpty();
  }

  @Override
  public boolean isStale(String workspace) {
    UserCache cache = read(workspace);
    if (cache == null || cache.getUpdatedAt() == null) {
      return true;
    }
    return cache.getUpdatedAt().plus(ttl).isBefore(clock.instant());
  }

  @Override
  public void refresh(Workspace workspace) {
    log.info("Refreshing user cache for workspace {}", workspace.getName());

    Map<String, String> users = new LinkedHashMap<>();
    String cursor = null;
    int rateLimitedAttempts = 0;

    while (true) {
      UsersListResponse response = slackClient.usersList(workspace, pageSize, cursor);

      if (response.isRateLimited()) {
        if (++rateLimitedAttempts > MAX_RATE_LIMIT_RETRIES) {
          throw SlackExportException.fromSlackError(response.getError(), "users.list");
        }
        // Same cursor again once the pacer's backoff has passed
        continue;
      }
      if (!response.isOk()) {
        throw SlackExportException.fromSlackError(response.getError(), "users.list");
      }

      rateLimitedAttempts = 0;
      for (SlackUser user : response.getMembers()) {
        users.put(user.getId(), user.displayName());
      }
      cursor = response.nextCursor();
      if (cursor == null) {
        break;
      }
    }

    write(workspace.getName(), new UserCache(clock.instant(), users));
    log.info("User cache for {} now holds {} users", workspace.getName(), users.size());
  }

  @Override
  public void triggerBackgroundRefresh(Workspace workspace) {
    if (!refreshesInFlight.add(workspace.getName())) {
      log.debug("User cache refresh already running for {}", workspace.getName());
      return;
    }
    refreshExecutor.execute(
        () -> {
          try {
            refresh(workspace);
          } catch (RuntimeException e) {
            log.warn(
                "Background user cache refresh failed for {}: {}",
                workspace.getName(),
                e.getMessage());
          } finally {
            refreshesInFlight.remove(workspace.getName());
          }
        });
  }

  @PreDestroy
  public void shutdown() {
    refreshExecutor.shutdownNow();
  }

  private UserCache read(String workspace) {
    Path path = cachePath(workspace);
    if (!Files.exists(path)) {
      return null;
    }
    try {
      return objectMapper.readValue(path.toFile(), UserCache.class);
    } catch (IOException e) {
      log.warn("Ignoring unreadable user cache {}: {}", path, e.getMessage());
      return null;
    }
  }

  private void write(String workspace, UserCache cache) {
    Path path = cachePath(workspace);
    Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
    try {
      Files.createDirectories(cacheDir);
      objectMapper.writeValue(tmp.toFile(), cache);
      Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to write user cache " + path, e);
    }
  }

  Path cachePath(String workspace) {
    return cacheDir.resolve("users_" + workspace.replaceAll("[^A-Za-z0-9._-]", "_") + ".json");
  }

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  static class UserCache {

    @JsonProperty("updated_at")
    private Instant updatedAt;

    @JsonProperty("users")
    private Map<String, String> users = new LinkedHashMap<>();
  }
}
