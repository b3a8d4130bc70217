package io.intellixity.tandem.querycache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * POSTs {@code {query, variables}} to a GraphQL endpoint and returns the {@code data} object.\n
 *
 * A non-2xx status, a body that is not JSON, or a non-empty {@code errors} array fail the call.\n
 */
public final class GraphQlHttpOrigin implements QueryOrigin {
  private static final Logger log = LoggerFactory.getLogger(GraphQlHttpOrigin.class);
  private static final ObjectMapper JSON = new ObjectMapper();

  private final HttpClient http;
  private final URI endpoint;
  private final Map<String, String> headers;
  private final Duration timeout;

  public GraphQlHttpOrigin(HttpClient http, URI endpoint, Map<String, String> headers, Duration timeout) {
    this.http = Objects.requireNonNull(http, "http");
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.headers = (headers == null) ? Map.of() : Map.copyOf(headers);
    this.timeout = (timeout == null) ? Duration.ofSeconds(30) : timeout;
  }

  public GraphQlHttpOrigin(URI endpoint, Map<String, String> headers) {
    this(HttpClient.newHttpClient(), endpoint, headers, null);
  }

  @Override
  public Map<String, Object> fetch(String query, Map<String, Object> variables) {
    HttpRequest.Builder rb = HttpRequest.newBuilder(endpoint)
        .timeout(timeout)
        .header("Content-Type", "application/json")
        .header("Accept", "application/json")
        .POST(HttpRequest.BodyPublishers.ofString(requestBody(query, variables), StandardCharsets.UTF_8));
    headers.forEach(rb::header);

    long t0 = System.nanoTime();
    HttpResponse<String> res;
    try {
      res = http.send(rb.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new QueryOriginException("GraphQL request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new QueryOriginException("GraphQL request interrupted", e);
    }
    log.debug("tandem.querycache op=ORIGIN status={} durationMs={} bodyLength={}",
        res.statusCode(), (System.nanoTime() - t0) / 1_000_000L, res.body() == null ? 0 : res.body().length());
    return parse(res.statusCode(), res.body());
  }

  static String requestBody(String query, Map<String, Object> variables) {
    ObjectNode body = JSON.createObjectNode();
    body.put("query", Objects.requireNonNull(query, "query"));
    body.set("variables", JSON.valueToTree(variables == null ? Map.of() : variables));
    try {
      return JSON.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      throw new QueryOriginException("Variables are not JSON-serializable: " + e.getOriginalMessage(), e);
    }
  }

  @SuppressWarnings("unchecked")
  static Map<String, Object> parse(int status, String body) {
    JsonNode root;
    try {
      root = JSON.readTree(body == null ? "" : body);
    } catch (JsonProcessingException e) {
      throw new QueryOriginException("GraphQL endpoint returned non-JSON body (status " + status + ")", status, e);
    }
    if (root == null || !root.isObject()) {
      throw new QueryOriginException("GraphQL endpoint returned no JSON object (status " + status + ")", status, null);
    }
    JsonNode errors = root.path("errors");
    if (errors.isArray() && !errors.isEmpty()) {
      throw new QueryOriginException("GraphQL errors: " + errors.get(0).path("message").asText(errors.toString()),
          status, null);
    }
    if (status < 200 || status >= 300) {
      throw new QueryOriginException("GraphQL endpoint answered HTTP " + status, status, null);
    }
    JsonNode data = root.path("data");
    if (!data.isObject()) return new LinkedHashMap<>();
    return JSON.convertValue(data, Map.class);
  }
}
