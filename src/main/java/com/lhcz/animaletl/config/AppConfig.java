package com.lhcz.animaletl.config;

/**
 * 应用配置记录类
 */
public record AppConfig(ApiConfig api, PipelineConfig pipeline, RetryConfig retry, WebConfig web, DeadLetterConfig deadLetter) {

    /**
     * 上游接口与连接池配置
     */
    public record ApiConfig(
            String baseUrl,
            Integer connectTimeoutMs,   // 建连超时
            Integer requestTimeoutMs,   // 单次请求总超时
            Integer maxConnections,     // 总连接上限
            Integer maxConnectionsPerHost
    ) {}

    public record PipelineConfig(
            Integer batchSize,          // 每次写入条数，不超过 100
            Integer perPage,            // 列表分页大小
            Integer concurrency,        // 消费者数量
            Integer detailConcurrency   // 每个消费者内部的详情并发
    ) {}

    public record RetryConfig(
            Integer maxAttempts,
            Double baseDelaySeconds,
            Double maxDelaySeconds,
            Double backoffFactor,
            Boolean jitter
    ) {}

    // Web 控制台配置，port 为空则不启动
    public record WebConfig(Integer port) {}

    // 写入失败批次的落盘目录，为空则不落盘
    public record DeadLetterConfig(String dir) {}
}
