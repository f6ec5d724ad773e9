package org.waabox.axis.server.http;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.axis.AuthorizationException;
import org.waabox.axis.Dashboard;
import org.waabox.axis.ValidationException;
import org.waabox.axis.automation.LaunchException;
import org.waabox.axis.event.PushEventCodec;
import org.waabox.axis.event.PushMessage;
import org.waabox.axis.event.Subscription;
import org.waabox.axis.model.ItemContent;
import org.waabox.axis.model.ItemStatus;
import org.waabox.axis.model.Mode;
import org.waabox.axis.provider.ProviderException;

/**
 * Binds a {@link Dashboard} to HTTP.
 *
 * <p>Uses Java's built-in {@code com.sun.net.httpserver.HttpServer} with a
 * cached thread pool, since every open event stream holds a thread for its
 * whole life.
 *
 * <p>Routes:
 * <pre>
 * GET  /api/registry[?refresh=1]
 * GET  /api/registry/content?id=
 * POST /api/status?id=&amp;status=
 * POST /api/status/cycle?id=&amp;direction=forward|back
 * GET  /api/mode[?set=AUTO|MANUAL]
 * POST /api/items/delete?id=
 * POST /api/automation/dispatch   {"task": "..."}
 * GET  /api/events                server-sent events
 * </pre>
 *
 * <p>Failures map to status codes: validation 400, mode policy 403,
 * launch failure 500, provider failure 502, wrong method 405.
 *
 * <p>Typical usage:
 * <pre>{@code
 * AxisHttpServer server = new AxisHttpServer(dashboard,
 *     AxisHttpConfig.create(8080));
 * server.start();
 * // ... on shutdown
 * server.stop();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class AxisHttpServer {

  /** Class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(AxisHttpServer.class);

  /** HTTP 200 OK status code. */
  private static final int HTTP_OK = 200;

  /** HTTP 202 Accepted status code. */
  private static final int HTTP_ACCEPTED = 202;

  /** HTTP 400 Bad Request status code. */
  private static final int HTTP_BAD_REQUEST = 400;

  /** HTTP 403 Forbidden status code. */
  private static final int HTTP_FORBIDDEN = 403;

  /** HTTP 404 Not Found status code. */
  private static final int HTTP_NOT_FOUND = 404;

  /** HTTP 405 Method Not Allowed status code. */
  private static final int HTTP_METHOD_NOT_ALLOWED = 405;

  /** HTTP 500 Internal Server Error status code. */
  private static final int HTTP_INTERNAL_ERROR = 500;

  /** HTTP 502 Bad Gateway status code. */
  private static final int HTTP_BAD_GATEWAY = 502;

  /** The largest accepted request body, in bytes. */
  private static final int MAX_BODY_BYTES = 8192;

  /** Values of the {@code refresh} flag that mean true. */
  private static final Set<String> TRUTHY = Set.of("1", "true", "t", "yes",
      "y", "force", "refresh");

  /** The comment frame written to idle event streams. */
  private static final byte[] KEEP_ALIVE =
      ": keep-alive\n\n".getBytes(StandardCharsets.UTF_8);

  /** The shared JSON mapper. */
  private static final ObjectMapper MAPPER = PushEventCodec.mapper();

  /** The dashboard served, never null. */
  private final Dashboard dashboard;

  /** The configuration, never null. */
  private final AxisHttpConfig config;

  /** The routes by exact path. */
  private final Map<String, Route> routes = new HashMap<>();

  /** The HTTP server, null until started. */
  private HttpServer server;

  /** The request threads, null until started. */
  private ExecutorService executor;

  /** Whether event streams should keep running. */
  private volatile boolean running;

  /**
   * Creates a new server for the given dashboard.
   *
   * @param theDashboard the dashboard, never null
   * @param theConfig    the configuration, never null
   */
  public AxisHttpServer(final Dashboard theDashboard,
      final AxisHttpConfig theConfig) {
    dashboard = Objects.requireNonNull(theDashboard,
        "dashboard cannot be null");
    config = Objects.requireNonNull(theConfig, "config cannot be null");

    routes.put("/api/registry", new Route("GET", this::handleRegistry));
    routes.put("/api/registry/content",
        new Route("GET", this::handleContent));
    routes.put("/api/status", new Route("POST", this::handleStatus));
    routes.put("/api/status/cycle", new Route("POST", this::handleCycle));
    routes.put("/api/mode", new Route("GET", this::handleMode));
    routes.put("/api/items/delete", new Route("POST", this::handleDelete));
    routes.put("/api/automation/dispatch",
        new Route("POST", this::handleAutomation));
    routes.put("/api/events", new Route("GET", this::handleEvents));
  }

  /**
   * Starts listening.
   *
   * @throws IllegalStateException if the port cannot be bound
   */
  public void start() {
    final AtomicInteger threadCount = new AtomicInteger();
    executor = Executors.newCachedThreadPool(r -> {
      final Thread thread = new Thread(r,
          "axis-http-" + threadCount.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
    try {
      server = HttpServer.create(new InetSocketAddress(config.port()), 0);
    } catch (final IOException e) {
      executor.shutdownNow();
      throw new IllegalStateException(
          "Failed to start HTTP server on port " + config.port(), e);
    }
    server.createContext("/api/", this::dispatch);
    server.setExecutor(executor);
    running = true;
    server.start();

    log.info("AxisHttpServer started on port {}", port());
  }

  /** Stops listening and ends every open event stream. */
  public void stop() {
    running = false;
    if (server != null) {
      server.stop(0);
      log.info("HTTP server stopped");
    }
    if (executor != null) {
      executor.shutdownNow();
    }
  }

  /**
   * Returns the bound port, which differs from the configured one when
   * that was 0.
   *
   * @return the port
   *
   * @throws IllegalStateException if the server was not started
   */
  public int port() {
    if (server == null) {
      throw new IllegalStateException("server not started");
    }
    return server.getAddress().getPort();
  }

  /**
   * Routes one request and maps failures to status codes.
   *
   * @param exchange the HTTP exchange, never null
   * @throws IOException if writing the response fails
   */
  private void dispatch(final HttpExchange exchange) throws IOException {
    try {
      final String path = exchange.getRequestURI().getPath();
      final Route route = routes.get(path);
      if (route == null) {
        sendError(exchange, HTTP_NOT_FOUND, "not found");
        return;
      }
      if (!route.method().equalsIgnoreCase(exchange.getRequestMethod())) {
        exchange.getResponseHeaders().set("Allow", route.method());
        sendError(exchange, HTTP_METHOD_NOT_ALLOWED, "method not allowed");
        return;
      }
      route.endpoint().handle(exchange,
          parseQuery(exchange.getRequestURI().getRawQuery()));
    } catch (final ValidationException e) {
      sendError(exchange, HTTP_BAD_REQUEST, e.getMessage());
    } catch (final AuthorizationException e) {
      sendError(exchange, HTTP_FORBIDDEN, e.getMessage());
    } catch (final ProviderException e) {
      log.warn("Provider call failed: {}", e.getMessage());
      sendError(exchange, HTTP_BAD_GATEWAY, e.getMessage());
    } catch (final LaunchException e) {
      sendError(exchange, HTTP_INTERNAL_ERROR, "automation dispatch failed");
    } catch (final RuntimeException e) {
      log.error("Failed to handle {} {}", exchange.getRequestMethod(),
          exchange.getRequestURI(), e);
      sendError(exchange, HTTP_INTERNAL_ERROR, "internal server error");
    } finally {
      exchange.close();
    }
  }

  /** Handles {@code GET /api/registry}. */
  private void handleRegistry(final HttpExchange exchange,
      final Map<String, String> query) throws IOException {
    final boolean refresh = isTruthy(query.get("refresh"));
    sendJson(exchange, HTTP_OK,
        PushEventCodec.items(dashboard.registry(refresh)));
  }

  /** Handles {@code GET /api/registry/content}. */
  private void handleContent(final HttpExchange exchange,
      final Map<String, String> query) throws IOException {
    final ItemContent content = dashboard.content(query.get("id"));
    final ObjectNode body = MAPPER.createObjectNode();
    body.put("id", content.id());
    body.put("content", content.content());
    if (content.status() != null) {
      body.put("status", content.status().value());
    }
    sendJson(exchange, HTTP_OK, body);
  }

  /** Handles {@code POST /api/status}. */
  private void handleStatus(final HttpExchange exchange,
      final Map<String, String> query) throws IOException {
    final String id = query.get("id");
    final ItemStatus status = dashboard.setStatus(id, query.get("status"));
    sendJson(exchange, HTTP_OK, statusBody(id, status));
  }

  /** Handles {@code POST /api/status/cycle}. */
  private void handleCycle(final HttpExchange exchange,
      final Map<String, String> query) throws IOException {
    final String id = query.get("id");
    final ItemStatus status = dashboard.cycleStatus(id,
        query.get("direction"));
    sendJson(exchange, HTTP_OK, statusBody(id, status));
  }

  /** Handles {@code GET /api/mode}. */
  private void handleMode(final HttpExchange exchange,
      final Map<String, String> query) throws IOException {
    final String requested = query.get("set");
    final Mode mode = requested == null || requested.isEmpty()
        ? dashboard.mode()
        : dashboard.switchMode(requested);
    final ObjectNode body = MAPPER.createObjectNode();
    body.put("mode", mode.name());
    sendJson(exchange, HTTP_OK, body);
  }

  /** Handles {@code POST /api/items/delete}. */
  private void handleDelete(final HttpExchange exchange,
      final Map<String, String> query) throws IOException {
    final String id = query.get("id");
    dashboard.delete(id);
    final ObjectNode body = MAPPER.createObjectNode();
    body.put("id", id);
    body.put("deleted", true);
    sendJson(exchange, HTTP_OK, body);
  }

  /** Handles {@code POST /api/automation/dispatch}. */
  private void handleAutomation(final HttpExchange exchange,
      final Map<String, String> query) throws IOException {
    final byte[] raw;
    try (InputStream is = exchange.getRequestBody()) {
      raw = is.readNBytes(MAX_BODY_BYTES + 1);
    }
    if (raw.length > MAX_BODY_BYTES) {
      throw new ValidationException("request payload too large");
    }

    final JsonNode request;
    try {
      request = MAPPER.readTree(raw);
    } catch (final JsonProcessingException e) {
      throw new ValidationException("invalid request payload");
    }
    if (request == null || !request.isObject()) {
      throw new ValidationException("invalid request payload");
    }
    final JsonNode task = request.get("task");

    dashboard.dispatchAutomation(
        task != null && task.isTextual() ? task.asText() : null);

    final ObjectNode body = MAPPER.createObjectNode();
    body.put("status", "accepted");
    sendJson(exchange, HTTP_ACCEPTED, body);
  }

  /**
   * Handles {@code GET /api/events}: streams push messages until the client
   * goes away or the server stops. A keep-alive comment is written after
   * every idle interval so a dead connection fails on write.
   */
  private void handleEvents(final HttpExchange exchange,
      final Map<String, String> query) throws IOException {
    exchange.getResponseHeaders().set("Content-Type", "text/event-stream");
    exchange.getResponseHeaders().set("Cache-Control", "no-cache");
    exchange.getResponseHeaders().set("Connection", "keep-alive");
    exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
    exchange.sendResponseHeaders(HTTP_OK, 0);

    try (Subscription subscription = dashboard.subscribe();
         OutputStream os = exchange.getResponseBody()) {
      os.flush();
      while (running) {
        final Optional<PushMessage> message =
            subscription.poll(config.keepAliveInterval());
        if (message.isPresent()) {
          os.write(message.get().toWireFormat()
              .getBytes(StandardCharsets.UTF_8));
        } else {
          os.write(KEEP_ALIVE);
        }
        os.flush();
      }
    } catch (final IOException e) {
      log.debug("Event stream closed by the client: {}", e.getMessage());
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      log.debug("Event stream interrupted");
    }
  }

  /**
   * Builds the response body of a status mutation.
   *
   * @param id     the item id
   * @param status the stored status
   * @return the body, never null
   */
  private static ObjectNode statusBody(final String id,
      final ItemStatus status) {
    final ObjectNode body = MAPPER.createObjectNode();
    body.put("id", id);
    body.put("status", status.value());
    return body;
  }

  /**
   * Whether a {@code refresh} flag value means true.
   *
   * @param value the raw value, may be null
   * @return true for the accepted truthy spellings
   */
  static boolean isTruthy(final String value) {
    if (value == null) {
      return false;
    }
    return TRUTHY.contains(value.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Parses a raw query string. The first occurrence of a key wins.
   *
   * @param rawQuery the raw query, may be null
   * @return the decoded parameters, never null
   */
  static Map<String, String> parseQuery(final String rawQuery) {
    final Map<String, String> params = new HashMap<>();
    if (rawQuery == null || rawQuery.isEmpty()) {
      return params;
    }
    for (final String pair : rawQuery.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      final int eq = pair.indexOf('=');
      final String key = eq < 0 ? pair : pair.substring(0, eq);
      final String value = eq < 0 ? "" : pair.substring(eq + 1);
      params.putIfAbsent(decode(key), decode(value));
    }
    return params;
  }

  /**
   * Decodes one URL-encoded query component.
   *
   * @param value the raw component, never null
   * @return the decoded text, never null
   */
  private static String decode(final String value) {
    try {
      return URLDecoder.decode(value, StandardCharsets.UTF_8);
    } catch (final IllegalArgumentException e) {
      throw new ValidationException("malformed query component: " + value);
    }
  }

  /**
   * Sends a JSON response.
   *
   * @param exchange   the HTTP exchange
   * @param statusCode the HTTP status code
   * @param body       the JSON body
   * @throws IOException if writing the response fails
   */
  private static void sendJson(final HttpExchange exchange,
      final int statusCode, final JsonNode body) throws IOException {
    final byte[] bytes = MAPPER.writeValueAsBytes(body);
    exchange.getResponseHeaders().set("Content-Type", "application/json");
    exchange.sendResponseHeaders(statusCode, bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }

  /**
   * Sends a JSON error response, {@code {"error": "..."}}.
   *
   * @param exchange   the HTTP exchange
   * @param statusCode the HTTP status code
   * @param message    the error message
   * @throws IOException if writing the response fails
   */
  private static void sendError(final HttpExchange exchange,
      final int statusCode, final String message) throws IOException {
    final ObjectNode body = MAPPER.createObjectNode();
    body.put("error", message == null ? "" : message);
    sendJson(exchange, statusCode, body);
  }

  /** One request handler. */
  @FunctionalInterface
  private interface Endpoint {

    /**
     * Handles a routed request and writes the response.
     *
     * @param exchange the HTTP exchange, never null
     * @param query    the decoded query parameters, never null
     * @throws IOException if writing the response fails
     */
    void handle(HttpExchange exchange, Map<String, String> query)
        throws IOException;
  }

  /**
   * A route of the API.
   *
   * @param method   the accepted HTTP method
   * @param endpoint the handler
   */
  private record Route(String method, Endpoint endpoint) {
  }
}
