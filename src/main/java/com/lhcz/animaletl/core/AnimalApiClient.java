package com.lhcz.animaletl.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.lhcz.animaletl.config.AppConfig;
import com.lhcz.animaletl.exception.ApiException;
import com.lhcz.animaletl.exception.ClientRequestException;
import com.lhcz.animaletl.exception.TransientServerException;
import com.lhcz.animaletl.exception.ValidationException;
import com.lhcz.animaletl.model.Animal;
import com.lhcz.animaletl.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.DoubleSupplier;

/**
 * Animal 服务客户端
 * <p>
 * 每次逻辑调用内部按 {@link RetryPolicy} 重试：传输层失败和 500/502/503/504 会退避后重试，
 * 4xx、非法 JSON 和其它状态码立即失败。底层 HttpClient 首次使用时创建，所有调用共用同一个连接池，
 * 用完必须 {@link #close()} (推荐 try-with-resources)。
 */
public class AnimalApiClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(AnimalApiClient.class);

    static final Set<Integer> RETRY_STATUS_CODES = Set.of(500, 502, 503, 504);
    public static final int MAX_LOAD_BATCH = 100;

    /**
     * 退避等待，测试里替换成记录型实现
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration delay) throws InterruptedException;
    }

    private final String baseUrl;
    private final RetryPolicy retryPolicy;
    private final Duration connectTimeout;
    private final Duration requestTimeout;
    private final ConnectionLimiter limiter;
    private final Sleeper sleeper;
    private final DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();

    private HttpClient httpClient;
    private ExecutorService httpExecutor;
    private boolean closed;

    private final AtomicLong attemptCount = new AtomicLong();
    private final AtomicLong retryCount = new AtomicLong();

    public AnimalApiClient(AppConfig.ApiConfig api, RetryPolicy retryPolicy) {
        this(api, retryPolicy, delay -> TimeUnit.NANOSECONDS.sleep(delay.toNanos()));
    }

    public AnimalApiClient(AppConfig.ApiConfig api, RetryPolicy retryPolicy, Sleeper sleeper) {
        String url = api.baseUrl();
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.retryPolicy = retryPolicy;
        this.connectTimeout = Duration.ofMillis(api.connectTimeoutMs());
        this.requestTimeout = Duration.ofMillis(api.requestTimeoutMs());
        this.limiter = new ConnectionLimiter(api.maxConnections(), api.maxConnectionsPerHost());
        this.sleeper = sleeper;
    }

    /**
     * 分页列出记录，返回 {items: [...]}；items 为空表示翻页结束
     */
    public JsonNode listPage(int page, int perPage) throws InterruptedException {
        URI uri = URI.create(baseUrl + "/animals/v1/animals?page=" + page + "&per_page=" + perPage);
        log.info("拉取列表 第 {} 页 (每页 {})", page, perPage);
        return requestJson("GET", uri, null);
    }

    public JsonNode fetchDetail(long id) throws InterruptedException {
        URI uri = URI.create(baseUrl + "/animals/v1/animals/" + id);
        log.debug("拉取详情 animal {}", id);
        return requestJson("GET", uri, null);
    }

    /**
     * 批量写入 home 接口，超过 100 条直接拒绝，不发请求
     */
    public JsonNode loadBatch(List<Animal> animals) throws InterruptedException {
        if (animals.size() > MAX_LOAD_BATCH) {
            throw new ValidationException("单批最多写入 " + MAX_LOAD_BATCH + " 条，实际 " + animals.size());
        }
        URI uri = URI.create(baseUrl + "/animals/v1/home");
        String body = JsonUtil.toJson(JsonUtil.toJsonArray(animals));
        log.info("写入 home 接口 {} 条", animals.size());
        return requestJson("POST", uri, body);
    }

    /**
     * 探活，任何失败都返回 false
     */
    public boolean healthCheck() {
        try {
            exchange("GET", URI.create(baseUrl + "/docs"), null);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("健康检查被中断");
            return false;
        } catch (RuntimeException e) {
            log.error("健康检查失败: {}", e.getMessage());
            return false;
        }
    }

    private JsonNode requestJson(String method, URI uri, String body) throws InterruptedException {
        String responseBody = exchange(method, uri, body);
        JsonNode node;
        try {
            node = JsonUtil.readTree(responseBody);
        } catch (JsonProcessingException e) {
            // 解析失败不重试
            log.error("❌ 响应不是合法 JSON: {} {}", method, uri);
            throw new ClientRequestException(200, "Invalid JSON response from " + uri + ": " + e.getOriginalMessage(), e);
        }
        // 空响应体解析出来是 MissingNode，同样按解析失败处理
        if (node == null || node.isMissingNode()) {
            log.error("❌ 响应体为空: {} {}", method, uri);
            throw new ClientRequestException(200, "Empty JSON response from " + uri);
        }
        return node;
    }

    /**
     * 带重试的请求，成功时返回 200 响应体
     */
    String exchange(String method, URI uri, String body) throws InterruptedException {
        HttpClient client = ensureClient();
        int maxAttempts = retryPolicy.maxAttempts();
        TransientServerException lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            attemptCount.incrementAndGet();
            log.debug("第 {}/{} 次请求: {} {}", attempt, maxAttempts, method, uri);
            try {
                return sendOnce(client, method, uri, body);
            } catch (TransientServerException e) {
                lastError = e;
                log.warn("⚠️ 第 {}/{} 次请求失败: {} {} -> {}", attempt, maxAttempts, method, uri, e.getMessage());
            }

            if (attempt < maxAttempts) {
                Duration delay = retryPolicy.delayFor(attempt, random);
                retryCount.incrementAndGet();
                log.info("等待 {}ms 后重试 {} {}", delay.toMillis(), method, uri);
                sleeper.sleep(delay);
            }
        }

        log.error("❌ {} 次尝试全部失败: {} {}", maxAttempts, method, uri);
        throw lastError;
    }

    private String sendOnce(HttpClient client, String method, URI uri, String body) throws InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .header("Accept", "application/json");
        if (body != null) {
            builder.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        String host = uri.getHost() + ":" + uri.getPort();
        HttpResponse<String> response;
        limiter.acquire(host);
        try {
            response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            // 连接失败、超时、连接被重置都算临时故障
            throw new TransientServerException(e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        } finally {
            limiter.release(host);
        }

        int status = response.statusCode();
        log.debug("响应状态码: {} ({} {})", status, method, uri);
        if (status == 200) {
            return response.body();
        }
        throw classify(status, response.body());
    }

    static ApiException classify(int status, String body) {
        String detail = abbreviate(body);
        if (RETRY_STATUS_CODES.contains(status)) {
            return new TransientServerException(status, "Server error " + status + ": " + detail);
        }
        if (status >= 400 && status < 500) {
            return new ClientRequestException(status, "Client error " + status + ": " + detail);
        }
        return new ClientRequestException(status, "Unexpected status " + status + ": " + detail);
    }

    private static String abbreviate(String text) {
        if (text == null) return "";
        return text.length() > 200 ? text.substring(0, 200) + "..." : text;
    }

    private synchronized HttpClient ensureClient() {
        if (closed) {
            throw new IllegalStateException("AnimalApiClient 已关闭");
        }
        if (httpClient == null) {
            AtomicInteger seq = new AtomicInteger();
            httpExecutor = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r, "animal-http-" + seq.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            httpClient = HttpClient.newBuilder()
                    .version(HttpClient.Version.HTTP_1_1)
                    .connectTimeout(connectTimeout)
                    .executor(httpExecutor)
                    .build();
            log.info("HTTP 连接池已创建: {} (总连接上限 {}, 请求超时 {}ms)",
                    baseUrl, limiter.availableTotal(), requestTimeout.toMillis());
        }
        return httpClient;
    }

    public long getAttemptCount() {
        return attemptCount.get();
    }

    public long getRetryCount() {
        return retryCount.get();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        if (httpExecutor != null) {
            httpExecutor.shutdownNow();
            log.info("HTTP 连接池已释放: {}", baseUrl);
        }
        httpClient = null;
        httpExecutor = null;
    }
}
