package com.lhcz.animaletl.core;

import com.lhcz.animaletl.model.RunSummary;
import com.lhcz.animaletl.util.JsonUtil;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 简易 Web 管理控制台
 * 提供流水线运行状态监控页面
 */
public class WebConsole {
    private static final Logger log = LoggerFactory.getLogger(WebConsole.class);
    private static final int RECENT_ERRORS = 20;

    private final int port;
    private final Pipeline pipeline;
    private HttpServer server;

    public WebConsole(int port, Pipeline pipeline) {
        this.port = port;
        this.pipeline = pipeline;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/", new DashboardHandler());
            server.createContext("/api/status", new StatusHandler());
            server.setExecutor(null); // creates a default executor
            server.start();
            log.info("🌐 Web 管理控制台已启动: http://localhost:{}", getPort());
        } catch (IOException e) {
            log.error("❌ Web 控制台启动失败", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
    }

    /** 实际监听端口，配置为 0 时由系统分配 */
    public int getPort() {
        return server == null ? port : server.getAddress().getPort();
    }

    Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("state", pipeline.getState().name());
        status.put("currentPage", pipeline.currentPage());
        status.put("pendingWorkItems", pipeline.pendingWorkItems());
        status.put("activeConsumers", pipeline.activeConsumers());

        RunSummary summary = pipeline.currentStatistics();
        if (summary != null) {
            status.put("startedAt", summary.startedAt().toString());
            status.put("endedAt", summary.endedAt() == null ? null : summary.endedAt().toString());
            status.put("fetched", summary.fetched());
            status.put("transformed", summary.transformed());
            status.put("loaded", summary.loaded());
            status.put("batchesProcessed", summary.batchesProcessed());
            status.put("errorCount", summary.errors().size());
            List<String> errors = summary.errors();
            status.put("recentErrors", errors.subList(Math.max(0, errors.size() - RECENT_ERRORS), errors.size()));
        }

        AnimalTransformer.Stats transformStats = pipeline.transformerStats();
        status.put("friendsTransformed", transformStats.friendsTransformed());
        status.put("bornAtTransformed", transformStats.bornAtTransformed());
        status.put("retries", pipeline.getClient().getRetryCount());
        return status;
    }

    private static void send(HttpExchange t, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        t.getResponseHeaders().set("Content-Type", contentType);
        t.sendResponseHeaders(200, bytes.length);
        try (OutputStream os = t.getResponseBody()) {
            os.write(bytes);
        }
    }

    private class DashboardHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange t) throws IOException {
            String html = """
                <!DOCTYPE html>
                <html lang="zh-CN">
                <head>
                    <meta charset="UTF-8">
                    <title>Animal ETL 运行监控</title>
                    <style>
                        body { font-family: -apple-system, "Segoe UI", Roboto, Arial, sans-serif; background: #f3f4f6; padding: 20px; color: #1f2937; }
                        .card { background: white; border-radius: 8px; box-shadow: 0 4px 6px -1px rgba(0,0,0,0.1); padding: 16px 24px; max-width: 900px; margin: 0 auto; }
                        td { padding: 6px 16px; border-bottom: 1px solid #e5e7eb; font-size: 0.875rem; }
                        .text-red { color: #dc2626; }
                        pre { font-size: 0.75rem; white-space: pre-wrap; }
                    </style>
                </head>
                <body>
                    <div class="card">
                        <h1>Animal ETL 运行监控</h1>
                        <table><tbody id="status"></tbody></table>
                        <h3 class="text-red">最近错误</h3>
                        <pre id="errors"></pre>
                    </div>
                    <script>
                        function fetchStatus() {
                            fetch('/api/status')
                                .then(response => response.json())
                                .then(data => {
                                    const rows = Object.entries(data)
                                        .filter(([k]) => k !== 'recentErrors')
                                        .map(([k, v]) => `<tr><td>${k}</td><td>${v}</td></tr>`);
                                    document.getElementById('status').innerHTML = rows.join('');
                                    document.getElementById('errors').textContent = (data.recentErrors || []).join('\\n');
                                })
                                .catch(err => console.error('Error fetching status:', err));
                        }

                        // 每 3 秒刷新一次
                        fetchStatus();
                        setInterval(fetchStatus, 3000);
                    </script>
                </body>
                </html>
            """;
            send(t, "text/html; charset=utf-8", html);
        }
    }

    private class StatusHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange t) throws IOException {
            send(t, "application/json", JsonUtil.toJson(status()));
        }
    }
}
