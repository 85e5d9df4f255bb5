package com.ridwan.slackexport.client;

import java.util.concurrent.CancellationException;

import org.springframework.http.MediaType;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ridwan.slackexport.dto.AuthTestResponse;
import com.ridwan.slackexport.dto.RepliesResponse;
import com.ridwan.slackexport.dto.SearchResponse;
import com.ridwan.slackexport.dto.UsersListResponse;
import com.ridwan.slackexport.error.ErrorKind;
import com.ridwan.slackexport.error.SlackExportException;
import com.ridwan.slackexport.model.Workspace;
import com.ridwan.slackexport.ratelimit.PacingController;

import lombok.extern.slf4j.Slf4j;
import reactor.core.Exceptions;

/**
 * Slack Web API client authenticating with browser credentials (xoxc token + d cookie).
 *
 * <p>Every call is paced through {@link PacingController}. A rate-limit rejection is fed back to
 * the controller and returned to the caller as {@code {ok:false, error:"ratelimited"}}; it is
 * never thrown. Transport failures and 5xx responses are retried by Spring Retry.
 */
@Slf4j
@Service
public class SlackClient {

  private final WebClient webClient;
  private final PacingController pacer;
  private final ObjectMapper objectMapper;

  public SlackClient(WebClient webClient, PacingController pacer, ObjectMapper objectMapper) {
    this.webClient = webClient;
    this.pacer = pacer;
    this.objectMapper = objectMapper;
  }

  @Retryable(
      retryFor = {
        WebClientRequestException.class,
        WebClientResponseException.ServiceUnavailable.class,
        WebClientResponseException.BadGateway.class,
        WebClientResponseException.GatewayTimeout.class
      },
      maxAttempts = 3,
      backoff = @Backoff(delay = 1000, multiplier = 2.0))
  public AuthTestResponse authTest(Workspace workspace) {
    JsonNode body = post(workspace, SlackEndpoint.AUTH_TEST, new LinkedMultiValueMap<>());
    return convert(body, AuthTestResponse.class);
  }

  @Retryable(
      retryFor = {
        WebClientRequestException.class,
        WebClientResponseException.ServiceUnavailable.class,
        WebClientResponseException.BadGateway.class,
        WebClientResponseException.GatewayTimeout.class
      },
      maxAttempts = 3,
      backoff = @Backoff(delay = 1000, multiplier = 2.0))
  public SearchResponse searchMessages(
      Workspace workspace, String query, int page, int count, String sort, String sortDir) {
    MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
    params.add("query", query);
    params.add("page", String.valueOf(page));
    params.add("count", String.valueOf(count));
    params.add("sort", sort);
    params.add("sort_dir", sortDir);

    JsonNode body = post(workspace, SlackEndpoint.SEARCH_MESSAGES, params);
    return convert(body, SearchResponse.class);
  }

  @Retryable(
      retryFor = {
        WebClientRequestException.class,
        WebClientResponseException.ServiceUnavailable.class,
        WebClientResponseException.BadGateway.class,
        WebClientResponseException.GatewayTimeout.class
      },
      maxAttempts = 3,
      backoff = @Backoff(delay = 1000, multiplier = 2.0))
  public RepliesResponse conversationsReplies(
      Workspace workspace, String channel, String threadTs, String cursor) {
    MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
    params.add("channel", channel);
    params.add("ts", threadTs);
    params.add("limit", "200");
    if (cursor != null) {
      params.add("cursor", cursor);
    }

    JsonNode body = post(workspace, SlackEndpoint.CONVERSATIONS_REPLIES, params);
    return convert(body, RepliesResponse.class);
  }

  @Retryable(
      retryFor = {
        WebClientRequestException.class,
        WebClientResponseException.ServiceUnavailable.class,
        WebClientResponseException.BadGateway.class,
        WebClientResponseException.GatewayTimeout.class
      },
      maxAttempts = 3,
      backoff = @Backoff(delay = 1000, multiplier = 2.0))
  public UsersListResponse usersList(Workspace workspace, int limit, String cursor) {
    MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
    params.add("limit", String.valueOf(limit));
    if (cursor != null) {
      params.add("cursor", cursor);
    }

    JsonNode body = post(workspace, SlackEndpoint.USERS_LIST, params);
    return convert(body, UsersListResponse.class);
  }

  // Pass-through calls below are returned untyped for the CLI to print

  public JsonNode conversationsHistory(Workspace workspace, String channel, int limit) {
    MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
    params.add("channel", channel);
    params.add("limit", String.valueOf(limit));
    return post(workspace, SlackEndpoint.CONVERSATIONS_HISTORY, params);
  }

  public JsonNode channelsList(Workspace workspace, String types, int limit) {
    MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
    params.add("types", types);
    params.add("limit", String.valueOf(limit));
    params.add("exclude_archived", "true");
    return post(workspace, SlackEndpoint.CONVERSATIONS_LIST, params);
  }

  public JsonNode postMessage(Workspace workspace, String channel, String text, String threadTs) {
    MultiValueMap<String, String> params = new LinkedMultiValueMap<>();
    params.add("channel", channel);
    params.add("text", text);
    params.add("unfurl_links", "true");
    params.add("unfurl_media", "true");
    if (threadTs != null) {
      params.add("thread_ts", threadTs);
    }
    return post(workspace, SlackEndpoint.CHAT_POST_MESSAGE, params);
  }

  private JsonNode post(
      Workspace workspace, SlackEndpoint endpoint, MultiValueMap<String, String> params) {
    awaitPacing(endpoint);

    MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
    form.add("token", workspace.getXoxcToken());
    form.add("_x_reason", "api-call");
    form.add("_x_mode", "online");
    form.add("_x_sonic", "true");
    form.add("_x_app_name", "client");
    form.addAll(params);

    log.debug("Calling {} on workspace {}", endpoint.getMethod(), workspace.getName());

    try {
      JsonNode body =
          webClient
              .post()
              .uri("/" + endpoint.getMethod())
              .header("Content-Type", MediaType.APPLICATION_FORM_URLENCODED_VALUE)
              .header("Cookie", "d=" + workspace.getXoxdToken())
              .bodyValue(form)
              .retrieve()
              .bodyToMono(JsonNode.class)
              .block();

      if (body == null) {
        throw new SlackExportException(
            ErrorKind.UNKNOWN, null, "Empty response from " + endpoint.getMethod());
      }

      if (!body.path("ok").asBoolean(false) && "ratelimited".equals(body.path("error").asText())) {
        pacer.onRejected(null);
      } else {
        pacer.onSuccess();
      }
      return body;

    } catch (WebClientResponseException.TooManyRequests e) {
      pacer.onRejected(parseRetryAfter(e.getHeaders().getFirst("Retry-After")));
      return rateLimitedBody();
    } catch (RuntimeException e) {
      if (Exceptions.unwrap(e) instanceof InterruptedException) {
        Thread.currentThread().interrupt();
        throw new CancellationException("Interrupted during " + endpoint.getMethod());
      }
      throw e;
    }
  }

  private void awaitPacing(SlackEndpoint endpoint) {
    try {
      if (endpoint.getTier() != null) {
        pacer.awaitSlot(endpoint.getTier());
      } else {
        pacer.awaitBackoff();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting to call {}", endpoint.getMethod());
      throw new CancellationException("Interrupted while waiting to call " + endpoint.getMethod());
    }
  }

  private ObjectNode rateLimitedBody() {
    ObjectNode node = objectMapper.createObjectNode();
    node.put("ok", false);
    node.put("error", "ratelimited");
    return node;
  }

  private <T> T convert(JsonNode body, Class<T> type) {
    try {
      return objectMapper.treeToValue(body, type);
    } catch (JsonProcessingException e) {
      throw new SlackExportException(
          ErrorKind.UNKNOWN, null, "Unreadable " + type.getSimpleName() + ": " + e.getMessage(), e);
    }
  }

  static Integer parseRetryAfter(String header) {
    if (header == null || header.isBlank()) {
      return null;
    }
    try {
      return Integer.valueOf(header.trim());
    } catch (NumberFormatException e) {
      log.debug("Ignoring non-numeric Retry-After header: {}", header);
      return null;
    }
  }
}
