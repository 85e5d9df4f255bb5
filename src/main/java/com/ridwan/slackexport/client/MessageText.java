package com.ridwan.slackexport.client;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;

/** Helpers for Slack message text and timestamps. */
public final class MessageText {

  private MessageText() {}

  /**
   * Returns the plain text, or when it is empty the first text found in the message
   * blocks (a section's {@code text.text}, or the first text element of a rich_text block).
   */
  public static String extract(String text, List<JsonNode> blocks) {
    if (text != null && !text.isBlank()) {
      return text;
    }
    if (blocks == null) {
      return "";
    }
    for (JsonNode block : blocks) {
      String blockText = block.path("text").path("text").asText("");
      if (!blockText.isBlank()) {
        return blockText;
      }
      String richText = firstRichText(block.path("elements"));
      if (richText != null) {
        return richText;
      }
    }
    return "";
  }

  private static String firstRichText(JsonNode elements) {
    for (JsonNode element : elements) {
      String value = element.path("text").asText("");
      if (!value.isBlank()) {
        return value;
      }
      String nested = firstRichText(element.path("elements"));
      if (nested != null) {
        return nested;
      }
    }
    return null;
  }

  public static String truncate(String text, int maxLength) {
    if (text == null || text.length() <= maxLength) {
      return text;
    }
    return text.substring(0, maxLength);
  }

  /** Orders Slack timestamps ("1700000000.000100") numerically. */
  public static int compareTs(String a, String b) {
    return new BigDecimal(a).compareTo(new BigDecimal(b));
  }

  public static boolean isAfter(String ts, String other) {
    return compareTs(ts, other) > 0;
  }

  public static Instant toInstant(String ts) {
    BigDecimal value = new BigDecimal(ts);
    long seconds = value.longValue();
    long micros = value.subtract(BigDecimal.valueOf(seconds)).movePointRight(6).longValue();
    return Instant.ofEpochSecond(seconds, micros * 1000);
  }
}
