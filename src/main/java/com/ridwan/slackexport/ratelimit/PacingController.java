package com.ridwan.slackexport.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import com.ridwan.slackexport.config.SlackConfig;

import lombok.extern.slf4j.Slf4j;

/**
 * Paces Slack calls per endpoint tier with a trailing 60-second window, and backs off
 * exponentially after rate-limit rejections.
 *
 * <p>Strategy:
 *
 * <ul>
 *   <li>Each tier has a ceiling below Slack's published quota (safety margin)
 *   <li>A full window blocks until its oldest call ages out, plus one second
 *   <li>A rejection sets one backoff deadline shared by every tier
 *   <li>Backoff without Retry-After: 30s, 60s, 120s, 240s, then capped at 300s
 * </ul>
 *
 * <p>State lives in memory only. A resumed export starts with an empty window, which can
 * only under-use the quota.
 */
@Component
@Slf4j
public class PacingController {

  static final Duration WINDOW = Duration.ofSeconds(60);
  static final Duration SAFETY_MARGIN = Duration.ofSeconds(1);

  private static final long BASE_BACKOFF_SECONDS = 30;
  private static final long MAX_BACKOFF_SECONDS = 300;

  private final Map<Tier, Integer> ceilings = new EnumMap<>(Tier.class);
  private final Map<Tier, Deque<Instant>> windows = new EnumMap<>(Tier.class);
  private final Clock clock;
  private final Sleeper sleeper;

  private Instant backoffUntil;
  private int consecutiveRejections;

  @Autowired
  public PacingController(SlackConfig slackConfig) {
    this(
        slackConfig.getRateLimit().getSearchPerMinute(),
        slackConfig.getRateLimit().getThreadFetchPerMinute(),
        Clock.systemUTC(),
        duration -> Thread.sleep(duration.toMillis()));
  }

  PacingController(int searchPerMinute, int threadFetchPerMinute, Clock clock, Sleeper sleeper) {
    this.clock = clock;
    this.sleeper = sleeper;
    ceilings.put(Tier.SEARCH, searchPerMinute);
    ceilings.put(Tier.THREAD_FETCH, threadFetchPerMinute);
    for (Tier tier : Tier.values()) {
      windows.put(tier, new ArrayDeque<>());
    }
  }

  /**
   * Block until a call on the given tier can be issued without exceeding its ceiling.
   *
   * @throws InterruptedException if the thread is interrupted while waiting
   */
  public synchronized void awaitSlot(Tier tier) throws InterruptedException {
    awaitBackoff();

    Deque<Instant> window = windows.get(tier);
    int ceiling = ceilings.get(tier);

    prune(window);
    while (window.size() >= ceiling) {
      Instant freeAt = window.peekFirst().plus(WINDOW).plus(SAFETY_MARGIN);
      Duration wait = Duration.between(clock.instant(), freeAt);
      if (!wait.isNegative() && !wait.isZero()) {
        log.debug("{} window full ({}/{}) - waiting {}ms", tier, window.size(), ceiling, wait.toMillis());
        sleeper.sleep(wait);
      }
      prune(window);
    }

    window.addLast(clock.instant());
  }

  /**
   * Block until any active backoff deadline has passed. Used on its own for endpoints that
   * do not belong to a paced tier.
   *
   * @throws InterruptedException if the thread is interrupted while waiting
   */
  public synchronized void awaitBackoff() throws InterruptedException {
    if (backoffUntil == null) {
      return;
    }
    Duration wait = Duration.between(clock.instant(), backoffUntil);
    if (!wait.isNegative() && !wait.isZero()) {
      log.info("Backing off for {}s after rate limiting", wait.toSeconds());
      sleeper.sleep(wait);
    }
    backoffUntil = null;
  }

  /**
   * Record a rate-limit rejection.
   *
   * @param retryAfterSeconds the server's Retry-After hint, or null when none was sent
   */
  public synchronized void onRejected(Integer retryAfterSeconds) {
    consecutiveRejections++;

    long seconds =
        retryAfterSeconds != null ? retryAfterSeconds : computeBackoffSeconds(consecutiveRejections);
    backoffUntil = clock.instant().plusSeconds(seconds);

    log.warn(
        "Rate limited ({} in a row) - pausing all calls for {}s{}",
        consecutiveRejections,
        seconds,
        retryAfterSeconds != null ? " (Retry-After)" : "");
  }

  /** Record a call that was not rejected. */
  public synchronized void onSuccess() {
    if (consecutiveRejections > 0) {
      log.debug("Call succeeded - clearing {} consecutive rejections", consecutiveRejections);
    }
    consecutiveRejections = 0;
  }

  static long computeBackoffSeconds(int rejections) {
    int exponent = Math.min(Math.max(rejections - 1, 0), 16);
    return Math.min(BASE_BACKOFF_SECONDS << exponent, MAX_BACKOFF_SECONDS);
  }

  private void prune(Deque<Instant> window) {
    Instant cutoff = clock.instant().minus(WINDOW);
    while (!window.isEmpty() && window.peekFirst().isBefore(cutoff)) {
      window.removeFirst();
    }
  }

  public synchronized int getConsecutiveRejections() {
    return consecutiveRejections;
  }

  public synchronized Instant getBackoffUntil() {
    return backoffUntil;
  }

  public int getCeiling(Tier tier) {
    return ceilings.get(tier);
  }

  synchronized int callsInWindow(Tier tier) {
    Deque<Instant> window = windows.get(tier);
    prune(window);
    return window.size();
  }

  @FunctionalInterface
  interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }
}
