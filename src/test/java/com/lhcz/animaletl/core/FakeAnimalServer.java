package com.lhcz.animaletl.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lhcz.animaletl.config.AppConfig;
import com.lhcz.animaletl.util.JsonUtil;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/** 测试用的上游服务：列表 / 详情 / home 写入 / docs 探活 */
final class FakeAnimalServer implements AutoCloseable {
  static final String LIST_PATH = "/animals/v1/animals";
  static final String HOME_PATH = "/animals/v1/home";
  static final String DOCS_PATH = "/docs";

  private final HttpServer server;
  private final ExecutorService executor = Executors.newCachedThreadPool();
  private final Map<String, AtomicInteger> requestCounts = new ConcurrentHashMap<>();
  private final Map<String, Deque<Integer>> scriptedStatuses = new ConcurrentHashMap<>();
  private final Map<Long, Integer> detailFailures = new ConcurrentHashMap<>();
  private final Map<Long, String> detailBodies = new ConcurrentHashMap<>();
  private final Map<Integer, String> pageBodies = new ConcurrentHashMap<>();
  private final List<JsonNode> loadedBatches = Collections.synchronizedList(new ArrayList<>());
  private final AtomicInteger inFlightDetails = new AtomicInteger();
  private final AtomicInteger maxInFlightDetails = new AtomicInteger();
  private volatile List<List<Long>> pages = List.of();
  private volatile int homeStatus = 200;
  private volatile String docsBody = "<html>docs</html>";

  FakeAnimalServer() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext(LIST_PATH, this::handleAnimals);
    server.createContext(HOME_PATH, this::handleHome);
    server.createContext(DOCS_PATH, this::handleDocs);
    server.setExecutor(executor);
    server.start();
  }

  String baseUrl() {
    return "http://127.0.0.1:" + server.getAddress().getPort();
  }

  AppConfig.ApiConfig apiConfig() {
    return new AppConfig.ApiConfig(baseUrl(), 1_000, 5_000, 100, 20);
  }

  void setPages(List<List<Long>> pages) {
    this.pages = pages;
  }

  /** 指定某一页原样返回的响应体 (200)，优先于 setPages */
  void pageBody(int page, String body) {
    pageBodies.put(page, body);
  }

  /** 指定路径接下来依次返回的状态码，用完后恢复正常处理 */
  void script(String path, Integer... statuses) {
    scriptedStatuses.computeIfAbsent(path, p -> new ConcurrentLinkedDeque<>()).addAll(List.of(statuses));
  }

  void failDetail(long id, int status) {
    detailFailures.put(id, status);
  }

  void detailBody(long id, String json) {
    detailBodies.put(id, json);
  }

  void homeStatus(int status) {
    this.homeStatus = status;
  }

  void docsBody(String body) {
    this.docsBody = body;
  }

  int requestCount(String path) {
    AtomicInteger count = requestCounts.get(path);
    return count == null ? 0 : count.get();
  }

  List<JsonNode> loadedBatches() {
    synchronized (loadedBatches) {
      return new ArrayList<>(loadedBatches);
    }
  }

  int maxInFlightDetails() {
    return maxInFlightDetails.get();
  }

  private void handleAnimals(HttpExchange exchange) throws IOException {
    String path = exchange.getRequestURI().getPath();
    count(path);
    if (replyScripted(exchange, path)) return;

    if (path.equals(LIST_PATH)) {
      int page = Integer.parseInt(query(exchange.getRequestURI(), "page", "1"));
      String raw = pageBodies.get(page);
      if (raw != null) {
        reply(exchange, 200, raw);
        return;
      }
      ObjectNode body = JsonUtil.mapper().createObjectNode();
      ArrayNode items = body.putArray("items");
      if (page >= 1 && page <= pages.size()) {
        for (Long id : pages.get(page - 1)) {
          items.addObject().put("id", id).put("name", "animal-" + id);
        }
      }
      reply(exchange, 200, body.toString());
      return;
    }

    long id = Long.parseLong(path.substring(path.lastIndexOf('/') + 1));
    int inFlight = inFlightDetails.incrementAndGet();
    maxInFlightDetails.accumulateAndGet(inFlight, Math::max);
    try {
      Integer failure = detailFailures.get(id);
      if (failure != null) {
        reply(exchange, failure, "{\"detail\":\"animal " + id + " unavailable\"}");
        return;
      }
      String body = detailBodies.getOrDefault(id,
          "{\"id\":" + id + ",\"name\":\"animal-" + id + "\",\"friends\":\" Alice, Bob ,,\","
              + "\"born_at\":\"2020-01-15 10:30:00\",\"species\":\"cat\"}");
      reply(exchange, 200, body);
    } finally {
      inFlightDetails.decrementAndGet();
    }
  }

  private void handleHome(HttpExchange exchange) throws IOException {
    count(HOME_PATH);
    byte[] raw;
    try (InputStream in = exchange.getRequestBody()) {
      raw = in.readAllBytes();
    }
    if (replyScripted(exchange, HOME_PATH)) return;
    if (homeStatus != 200) {
      reply(exchange, homeStatus, "{\"detail\":\"rejected\"}");
      return;
    }
    loadedBatches.add(JsonUtil.readTree(new String(raw, StandardCharsets.UTF_8)));
    reply(exchange, 200, "{\"message\":\"ok\"}");
  }

  private void handleDocs(HttpExchange exchange) throws IOException {
    count(DOCS_PATH);
    if (replyScripted(exchange, DOCS_PATH)) return;
    reply(exchange, 200, docsBody);
  }

  private boolean replyScripted(HttpExchange exchange, String path) throws IOException {
    Deque<Integer> statuses = scriptedStatuses.get(path);
    Integer status = statuses == null ? null : statuses.pollFirst();
    if (status == null || status == 200) return false;
    reply(exchange, status, "{\"detail\":\"scripted " + status + "\"}");
    return true;
  }

  private void count(String path) {
    requestCounts.computeIfAbsent(path, p -> new AtomicInteger()).incrementAndGet();
  }

  private static String query(URI uri, String key, String fallback) {
    String query = uri.getQuery();
    if (query == null) return fallback;
    for (String pair : query.split("&")) {
      int eq = pair.indexOf('=');
      if (eq > 0 && pair.substring(0, eq).equals(key)) {
        return pair.substring(eq + 1);
      }
    }
    return fallback;
  }

  private static void reply(HttpExchange exchange, int status, String body) throws IOException {
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().set("Content-Type", "application/json");
    // 空响应体要用 -1 声明，否则 0 表示 chunked
    exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
    try (OutputStream os = exchange.getResponseBody()) {
      os.write(bytes);
    }
  }

  @Override
  public void close() {
    server.stop(0);
    executor.shutdownNow();
  }
}
