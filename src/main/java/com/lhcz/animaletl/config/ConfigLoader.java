package com.lhcz.animaletl.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 配置加载
 * 读取顺序：./application.yaml → ./config/application.yaml → Jar 内置默认；
 * 之后用 .env 文件和进程环境变量覆盖 (环境变量优先)，最后补齐默认值并校验。
 */
public class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULT_BASE_URL = "http://localhost:3123";
    public static final int MAX_BATCH_SIZE = 100;

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public AppConfig load() throws IOException {
        Map<String, String> env = new HashMap<>(readDotEnv(Path.of(".env")));
        env.putAll(System.getenv());
        return resolve(readYaml(), env);
    }

    AppConfig readYaml() throws IOException {
        File file = new File("application.yaml");

        // 同级目录没有，再找 config/application.yaml
        if (!file.exists()) {
            file = new File("config/application.yaml");
        }

        if (file.exists()) {
            log.info("读取配置文件: {}", file.getAbsolutePath());
            return mapper.readValue(file, AppConfig.class);
        }

        // 都没有就读 Jar 包内置的默认配置
        try (InputStream is = ConfigLoader.class.getClassLoader().getResourceAsStream("application.yaml")) {
            if (is == null) {
                throw new FileNotFoundException("找不到配置文件 application.yaml");
            }
            return mapper.readValue(is, AppConfig.class);
        }
    }

    public AppConfig read(InputStream in) throws IOException {
        return mapper.readValue(in, AppConfig.class);
    }

    /**
     * 用环境变量覆盖并补齐默认值，返回字段全部非空的配置
     */
    public static AppConfig resolve(AppConfig raw, Map<String, String> env) {
        AppConfig.ApiConfig api = raw == null ? null : raw.api();
        AppConfig.PipelineConfig pipeline = raw == null ? null : raw.pipeline();
        AppConfig.RetryConfig retry = raw == null ? null : raw.retry();
        AppConfig.WebConfig web = raw == null ? null : raw.web();
        AppConfig.DeadLetterConfig deadLetter = raw == null ? null : raw.deadLetter();

        String baseUrl = pick(env, "BASE_URL", Function.identity(), api == null ? null : api.baseUrl(), DEFAULT_BASE_URL);
        AppConfig.ApiConfig resolvedApi = new AppConfig.ApiConfig(
                baseUrl,
                orDefault(api == null ? null : api.connectTimeoutMs(), 10_000),
                orDefault(api == null ? null : api.requestTimeoutMs(), 30_000),
                orDefault(api == null ? null : api.maxConnections(), 100),
                orDefault(api == null ? null : api.maxConnectionsPerHost(), 20));

        AppConfig.PipelineConfig resolvedPipeline = new AppConfig.PipelineConfig(
                pick(env, "BATCH_SIZE", Integer::valueOf, pipeline == null ? null : pipeline.batchSize(), MAX_BATCH_SIZE),
                pick(env, "PER_PAGE", Integer::valueOf, pipeline == null ? null : pipeline.perPage(), 50),
                pick(env, "CONCURRENCY", Integer::valueOf, pipeline == null ? null : pipeline.concurrency(), 5),
                pick(env, "DETAIL_CONCURRENCY", Integer::valueOf, pipeline == null ? null : pipeline.detailConcurrency(), 10));

        AppConfig.RetryConfig resolvedRetry = new AppConfig.RetryConfig(
                pick(env, "MAX_ATTEMPTS", Integer::valueOf, retry == null ? null : retry.maxAttempts(), 5),
                pick(env, "BASE_DELAY", Double::valueOf, retry == null ? null : retry.baseDelaySeconds(), 1.0),
                pick(env, "MAX_DELAY", Double::valueOf, retry == null ? null : retry.maxDelaySeconds(), 60.0),
                pick(env, "BACKOFF_FACTOR", Double::valueOf, retry == null ? null : retry.backoffFactor(), 2.0),
                orDefault(retry == null ? null : retry.jitter(), Boolean.TRUE));

        AppConfig.WebConfig resolvedWeb = new AppConfig.WebConfig(
                pick(env, "WEB_PORT", Integer::valueOf, web == null ? null : web.port(), null));

        AppConfig.DeadLetterConfig resolvedDeadLetter = new AppConfig.DeadLetterConfig(
                pick(env, "DEAD_LETTER_DIR", Function.identity(), deadLetter == null ? null : deadLetter.dir(), "failed_data"));

        AppConfig resolved = new AppConfig(resolvedApi, resolvedPipeline, resolvedRetry, resolvedWeb, resolvedDeadLetter);
        validate(resolved);
        return resolved;
    }

    private static void validate(AppConfig config) {
        if (config.api().baseUrl().isBlank()) {
            throw new IllegalArgumentException("BASE_URL 不能为空");
        }
        requirePositive("api.connectTimeoutMs", config.api().connectTimeoutMs());
        requirePositive("api.requestTimeoutMs", config.api().requestTimeoutMs());
        requirePositive("api.maxConnections", config.api().maxConnections());
        requirePositive("api.maxConnectionsPerHost", config.api().maxConnectionsPerHost());
        requirePositive("CONCURRENCY", config.pipeline().concurrency());
        requirePositive("PER_PAGE", config.pipeline().perPage());
        requirePositive("DETAIL_CONCURRENCY", config.pipeline().detailConcurrency());
        requirePositive("BATCH_SIZE", config.pipeline().batchSize());
        if (config.pipeline().batchSize() > MAX_BATCH_SIZE) {
            throw new IllegalArgumentException("BATCH_SIZE 不能超过 " + MAX_BATCH_SIZE + ": " + config.pipeline().batchSize());
        }
        // 重试参数的校验交给 RetryPolicy
    }

    private static void requirePositive(String key, int value) {
        if (value < 1) {
            throw new IllegalArgumentException(key + " 必须大于 0: " + value);
        }
    }

    private static <T> T pick(Map<String, String> env, String key, Function<String, T> parser, T configured, T fallback) {
        String raw = env.get(key);
        if (raw != null && !raw.isBlank()) {
            try {
                return parser.apply(raw.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("环境变量 " + key + " 格式错误: " + raw, e);
            }
        }
        return configured != null ? configured : fallback;
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }

    /**
     * 读取 KEY=VALUE 格式的 .env 文件，不存在时返回空表
     */
    static Map<String, String> readDotEnv(Path path) throws IOException {
        Map<String, String> values = new HashMap<>();
        if (!Files.isRegularFile(path)) {
            return values;
        }
        List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        for (String line : lines) {
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;
            if (trimmed.startsWith("export ")) trimmed = trimmed.substring(7).trim();
            int eq = trimmed.indexOf('=');
            if (eq <= 0) continue;
            String key = trimmed.substring(0, eq).trim();
            String value = trimmed.substring(eq + 1).trim();
            if (value.length() >= 2
                    && ((value.startsWith("\"") && value.endsWith("\"")) || (value.startsWith("'") && value.endsWith("'")))) {
                value = value.substring(1, value.length() - 1);
            }
            values.put(key, value);
        }
        log.info("已加载 .env 文件: {} 个变量", values.size());
        return values;
    }
}
