package com.ridwan.slackexport.client;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridwan.slackexport.testsupport.TestObjectMappers;

class MessageTextTest {

  private final ObjectMapper objectMapper = TestObjectMappers.create();

  @Test
  void shouldPreferPlainText() throws Exception {
    JsonNode block = objectMapper.readTree("{\"text\":{\"text\":\"block text\"}}");

    assertEquals("plain", MessageText.extract("plain", List.of(block)));
  }

  @Test
  void shouldFallBackToSectionBlockText() throws Exception {
    JsonNode block =
        objectMapper.readTree("{\"type\":\"section\",\"text\":{\"type\":\"mrkdwn\",\"text\":\"section\"}}");

    assertEquals("section", MessageText.extract("", List.of(block)));
  }

  @Test
  void shouldFallBackToFirstRichTextElement() throws Exception {
    JsonNode divider = objectMapper.readTree("{\"type\":\"divider\"}");
    JsonNode richText =
        objectMapper.readTree(
            "{\"type\":\"rich_text\",\"elements\":[{\"type\":\"rich_text_section\",\"elements\":["
                + "{\"type\":\"user\",\"user_id\":\"U1\"},{\"type\":\"text\",\"text\":\" hello\"}]}]}");

    assertEquals(" hello", MessageText.extract(null, List.of(divider, richText)));
  }

  @Test
  void shouldReturnEmptyWhenNothingTextual() {
    assertEquals("", MessageText.extract(" ", null));
  }

  @Test
  void shouldTruncateLongText() {
    assertEquals("abc", MessageText.truncate("abcdef", 3));
    assertEquals("ab", MessageText.truncate("ab", 3));
    assertNull(MessageText.truncate(null, 3));
  }

  @Test
  void shouldCompareTimestampsNumerically() {
    // Lexical order would get these wrong
    assertTrue(MessageText.isAfter("1700000000.000100", "999999999.999999"));
    assertTrue(MessageText.isAfter("1700000000.000101", "1700000000.000100"));
    assertFalse(MessageText.isAfter("1700000000.000100", "1700000000.000100"));
    assertEquals(0, MessageText.compareTs("1.10", "1.1"));
  }

  @Test
  void shouldConvertTimestampToInstant() {
    assertEquals(
        Instant.ofEpochSecond(1700000000L, 100_000L), MessageText.toInstant("1700000000.000100"));
  }
}
