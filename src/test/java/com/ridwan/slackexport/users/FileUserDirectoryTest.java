package com.ridwan.slackexport.users;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.ridwan.slackexport.client.SlackClient;
import com.ridwan.slackexport.config.UserCacheConfig;
import com.ridwan.slackexport.dto.ResponseMetadata;
import com.ridwan.slackexport.dto.SlackUser;
import com.ridwan.slackexport.dto.UsersListResponse;
import com.ridwan.slackexport.error.ErrorKind;
import com.ridwan.slackexport.error.SlackExportException;
import com.ridwan.slackexport.model.Workspace;
import com.ridwan.slackexport.testsupport.ManualClock;
import com.ridwan.slackexport.testsupport.TestObjectMappers;

@ExtendWith(MockitoExtension.class)
class FileUserDirectoryTest {

  private static final Workspace ACME =
      Workspace.builder().name("acme").xoxcToken("xoxc-1").xoxdToken("xoxd-1").build();

  @Mock private SlackClient slackClient;

  @TempDir Path tempDir;

  private ManualClock clock;
  private FileUserDirectory directory;

  @BeforeEach
  void setUp() {
    UserCacheConfig config = new UserCacheConfig();
    config.setDir(tempDir.toString());
    config.setTtlHours(24);
    config.setPageSize(2);

    clock = new ManualClock(Instant.parse("2026-01-05T12:00:00Z"));
    directory = new FileUserDirectory(slackClient, TestObjectMappers.create(), config, clock);
  }

  @AfterEach
  void tearDown() {
    directory.shutdown();
  }

  @Test
  void shouldBeEmptyAndStaleBeforeFirstRefresh() {
    assertTrue(directory.isEmpty("acme"));
    assertTrue(directory.isStale("acme"));
    assertEquals(Map.of(), directory.lookup("acme"));
  }

  @Test
  void shouldFollowCursorAndPreferDisplayNames() {
    when(slackClient.usersList(eq(ACME), eq(2), isNull()))
        .thenReturn(
            UsersListResponse.builder()
                .ok(true)
                .members(
                    List.of(
                        user("U1", "alice", "Alice A", "ally"),
                        user("U2", "bob", "Bob B", "")))
                .responseMetadata(ResponseMetadata.builder().nextCursor("page2").build())
                .build());
    when(slackClient.usersList(eq(ACME), eq(2), eq("page2")))
        .thenReturn(
            UsersListResponse.builder()
                .ok(true)
                .members(List.of(SlackUser.builder().id("U3").name("carol").build()))
                .responseMetadata(ResponseMetadata.builder().nextCursor("").build())
                .build());

    directory.refresh(ACME);

    assertEquals(Map.of("U1", "ally", "U2", "Bob B", "U3", "carol"), directory.lookup("acme"));
    assertFalse(directory.isEmpty("acme"));
    assertFalse(directory.isStale("acme"));
  }

  @Test
  void shouldBecomeStaleAfterTtl() {
    when(slackClient.usersList(any(), anyInt(), any()))
        .thenReturn(
            UsersListResponse.builder()
                .ok(true)
                .members(List.of(user("U1", "alice", null, null)))
                .build());
    directory.refresh(ACME);

    clock.advance(Duration.ofHours(25));

    assertTrue(directory.isStale("acme"));
    assertEquals("alice", directory.lookup("acme").get("U1"));
  }

  @Test
  void shouldRetryRateLimitedPage() {
    when(slackClient.usersList(any(), anyInt(), any()))
        .thenReturn(UsersListResponse.builder().ok(false).error("ratelimited").build())
        .thenReturn(
            UsersListResponse.builder()
                .ok(true)
                .members(List.of(user("U1", "alice", null, null)))
                .build());

    directory.refresh(ACME);

    assertEquals(Map.of("U1", "alice"), directory.lookup("acme"));
    verify(slackClient, times(2)).usersList(any(), anyInt(), any());
  }

  @Test
  void shouldRetryRateLimitedLaterPageWithSameCursor() {
    when(slackClient.usersList(eq(ACME), eq(2), isNull()))
        .thenReturn(
            UsersListResponse.builder()
                .ok(true)
                .members(List.of(user("U1", "alice", null, null)))
                .responseMetadata(ResponseMetadata.builder().nextCursor("page2").build())
                .build());
    when(slackClient.usersList(eq(ACME), eq(2), eq("page2")))
        .thenReturn(UsersListResponse.builder().ok(false).error("ratelimited").build())
        .thenReturn(UsersListResponse.builder().ok(false).error("ratelimited").build())
        .thenReturn(
            UsersListResponse.builder()
                .ok(true)
                .members(List.of(user("U2", "bob", null, null)))
                .build());

    directory.refresh(ACME);

    assertEquals(Map.of("U1", "alice", "U2", "bob"), directory.lookup("acme"));
    verify(slackClient, times(1)).usersList(eq(ACME), eq(2), isNull());
    verify(slackClient, times(3)).usersList(eq(ACME), eq(2), eq("page2"));
  }

  @Test
  void shouldGiveUpWhenFirstPageStaysRateLimited() {
    when(slackClient.usersList(any(), anyInt(), any()))
        .thenReturn(UsersListResponse.builder().ok(false).error("ratelimited").build());

    SlackExportException exception =
        assertThrows(SlackExportException.class, () -> directory.refresh(ACME));

    assertEquals(ErrorKind.RATE_LIMITED, exception.getKind());
    // Nothing is written, so the cache still counts as empty
    assertTrue(directory.isEmpty("acme"));
    assertFalse(Files.exists(directory.cachePath("acme")));
    verify(slackClient, times(6)).usersList(any(), anyInt(), any());
  }

  @Test
  void shouldFailRefreshOnAuthErrorAndKeepOldCache() {
    when(slackClient.usersList(any(), anyInt(), any()))
        .thenReturn(
            UsersListResponse.builder()
                .ok(true)
                .members(List.of(user("U1", "alice", null, null)))
                .build())
        .thenReturn(UsersListResponse.builder().ok(false).error("invalid_auth").build());
    directory.refresh(ACME);

    SlackExportException failure =
        assertThrows(SlackExportException.class, () -> directory.refresh(ACME));

    assertEquals(ErrorKind.AUTH_FAILURE, failure.getKind());
    assertEquals(Map.of("U1", "alice"), directory.lookup("acme"));
  }

  @Test
  void shouldTreatCorruptCacheAsEmpty() throws IOException {
    Files.writeString(directory.cachePath("acme"), "{not json");

    assertTrue(directory.isEmpty("acme"));
    assertTrue(directory.isStale("acme"));
  }

  @Test
  void shouldRefreshInBackground() {
    when(slackClient.usersList(any(), anyInt(), any()))
        .thenReturn(
            UsersListResponse.builder()
                .ok(true)
                .members(List.of(user("U1", "alice", null, null)))
                .build());

    directory.triggerBackgroundRefresh(ACME);

    verify(slackClient, timeout(5000)).usersList(any(), anyInt(), any());
    long deadline = System.currentTimeMillis() + 5000;
    while (directory.isEmpty("acme") && System.currentTimeMillis() < deadline) {
      Thread.onSpinWait();
    }
    assertEquals("alice", directory.lookup("acme").get("U1"));
  }

  private static SlackUser user(String id, String name, String realName, String displayName) {
    return SlackUser.builder()
        .id(id)
        .name(name)
        .profile(new SlackUser.Profile(displayName, realName))
        .build();
  }
}
