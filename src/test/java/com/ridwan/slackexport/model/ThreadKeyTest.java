package com.ridwan.slackexport.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ridwan.slackexport.testsupport.TestObjectMappers;

class ThreadKeyTest {

  @Test
  void shouldParseChannelAndTimestamp() {
    ThreadKey key = ThreadKey.parse("C1:1700000000.000100");

    assertEquals("C1", key.getChannelId());
    assertEquals("1700000000.000100", key.getThreadTs());
    assertEquals(ThreadKey.of("C1", "1700000000.000100"), key);
    assertEquals("C1:1700000000.000100", key.toString());
  }

  @Test
  void shouldRejectMalformedKeys() {
    assertThrows(IllegalArgumentException.class, () -> ThreadKey.parse("C1"));
    assertThrows(IllegalArgumentException.class, () -> ThreadKey.parse(":1.1"));
    assertThrows(IllegalArgumentException.class, () -> ThreadKey.parse("C1:"));
    assertThrows(IllegalArgumentException.class, () -> ThreadKey.parse(null));
  }

  @Test
  void shouldSerializeAsPlainString() throws Exception {
    ObjectMapper mapper = TestObjectMappers.create();

    String json = mapper.writeValueAsString(List.of(ThreadKey.of("C1", "1.1")));

    assertEquals("[\"C1:1.1\"]", json);
    assertEquals(ThreadKey.of("C1", "1.1"), mapper.readValue("\"C1:1.1\"", ThreadKey.class));
  }
}
