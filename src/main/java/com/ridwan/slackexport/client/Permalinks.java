package com.ridwan.slackexport.client;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Builds and parses Slack message permalinks. */
public final class Permalinks {

  private static final Pattern THREAD_TS = Pattern.compile("thread_ts=(\\d+\\.\\d+)");

  private Permalinks() {}

  /** Link style: {@code APP} opens the desktop app, {@code BROWSER} the web client. */
  public enum Style {
    APP("archives"),
    BROWSER("messages");

    private final String path;

    Style(String path) {
      this.path = path;
    }

    public static Style fromName(String name) {
      return "browser".equalsIgnoreCase(name) ? BROWSER : APP;
    }
  }

  public static String build(String domain, String channelId, String ts, Style style) {
    return "https://"
        + domain
        + ".slack.com/"
        + style.path
        + "/"
        + channelId
        + "/p"
        + ts.replace(".", "");
  }

  /** Link to a reply, carrying the parent's timestamp the way Slack's own links do. */
  public static String buildReply(String domain, String channelId, String ts, String threadTs) {
    String link = build(domain, channelId, ts, Style.APP);
    if (threadTs == null || threadTs.equals(ts)) {
      return link;
    }
    return link + "?thread_ts=" + threadTs + "&cid=" + channelId;
  }

  /** @return the {@code thread_ts} query parameter, or null when the link has none */
  public static String extractThreadTs(String permalink) {
    if (permalink == null) {
      return null;
    }
    Matcher matcher = THREAD_TS.matcher(permalink);
    return matcher.find() ? matcher.group(1) : null;
  }

  /** Derives the workspace domain from an auth.test URL such as {@code https://acme.slack.com/}. */
  public static String domainFromUrl(String url) {
    if (url == null) {
      return null;
    }
    String domain = url.replace("https://", "").replace("http://", "");
    int slash = domain.indexOf('/');
    if (slash >= 0) {
      domain = domain.substring(0, slash);
    }
    return domain.endsWith(".slack.com")
        ? domain.substring(0, domain.length() - ".slack.com".length())
        : domain;
  }
}
