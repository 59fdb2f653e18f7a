package com.lhcz.animaletl.core;

import com.lhcz.animaletl.config.AppConfig;
import com.lhcz.animaletl.model.RunStatistics;
import com.lhcz.animaletl.model.RunSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 核心流水线控制器
 * 一个翻页生产者 + concurrency 个消费者，中间是容量为 2 × concurrency 的有界队列。
 * 结束顺序：等生产者退出 → 等队列清空 → 取消消费者 → 释放连接 → 返回统计。
 */
public class Pipeline {
    private static final Logger log = LoggerFactory.getLogger(Pipeline.class);

    private static final long WORKER_SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final AppConfig config;
    private final AnimalApiClient client;
    private final AnimalTransformer transformer = new AnimalTransformer();
    private final DeadLetterQueueManager deadLetters;
    private final AtomicInteger activeConsumers = new AtomicInteger();

    private volatile PipelineState state = PipelineState.IDLE;
    private volatile RunStatistics statistics;
    private volatile WorkQueue workQueue;
    private volatile AnimalPageSource source;
    private final List<HomeLoadWorker> workers = new ArrayList<>();

    public Pipeline(AppConfig config) {
        this(config, new AnimalApiClient(config.api(), RetryPolicy.from(config.retry())));
    }

    public Pipeline(AppConfig config, AnimalApiClient client) {
        this.config = config;
        this.client = client;
        String dir = config.deadLetter() == null ? null : config.deadLetter().dir();
        this.deadLetters = dir == null || dir.isBlank() ? null : new DeadLetterQueueManager(dir);
    }

    /**
     * 执行一次完整的抽取-转换-写入，只能调用一次。
     * 单条记录、单个批次的失败都记在返回的统计里，不会抛出。
     */
    public RunSummary run() {
        synchronized (this) {
            if (state != PipelineState.IDLE) {
                throw new IllegalStateException("Pipeline 只能运行一次，当前状态: " + state);
            }
            state = PipelineState.RUNNING;
        }

        int concurrency = config.pipeline().concurrency();
        RunStatistics stats = new RunStatistics(Instant.now());
        WorkQueue queue = new WorkQueue(2 * concurrency);
        this.statistics = stats;
        this.workQueue = queue;

        log.info("🚀 流水线启动: {} (消费者 {}, 每页 {}, 批次 {}, 详情并发 {})",
                client.getBaseUrl(), concurrency, config.pipeline().perPage(),
                config.pipeline().batchSize(), config.pipeline().detailConcurrency());

        ExecutorService producerExecutor = Executors.newSingleThreadExecutor(r -> new Thread(r, "animal-producer"));
        AtomicInteger seq = new AtomicInteger();
        ExecutorService consumerExecutor = Executors.newFixedThreadPool(concurrency,
                r -> new Thread(r, "animal-worker-" + seq.incrementAndGet()));

        try {
            source = new AnimalPageSource(client, queue, stats, config.pipeline().perPage());
            Future<?> producer = producerExecutor.submit(source);

            for (int i = 1; i <= concurrency; i++) {
                HomeLoadWorker worker = new HomeLoadWorker(i, client, transformer, queue, stats, deadLetters,
                        activeConsumers, config.pipeline().batchSize(), config.pipeline().detailConcurrency());
                workers.add(worker);
                activeConsumers.incrementAndGet();
                consumerExecutor.submit(worker);
            }

            // 先等生产者，再等队列清空，保证已入队的工作不会丢
            try {
                producer.get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("❌ 生产者异常退出: {}", cause.getMessage(), cause);
                stats.update(t -> t.addError("producer failed: " + cause.getMessage()));
            }
            state = PipelineState.DRAINING;
            log.info("翻页完成，等待队列清空 (未确认 {} 个)", queue.pendingCount());
            queue.awaitDrained();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("❌ 流水线被中断，提前结束");
            stats.update(t -> t.addError("pipeline interrupted"));
        } catch (RuntimeException e) {
            log.error("❌ 流水线异常: {}", e.getMessage(), e);
            stats.update(t -> t.addError("pipeline failed: " + e.getMessage()));
        } finally {
            shutdown(producerExecutor, consumerExecutor);
            client.close();
        }

        stats.update(t -> t.markEnded(Instant.now()));
        RunSummary summary = stats.snapshot();
        state = summary.hasErrors() ? PipelineState.COMPLETED_WITH_ERRORS : PipelineState.COMPLETED;
        log.info("🏁 流水线结束 [{}]: fetched={}, transformed={}, loaded={}, batches={}, errors={}, 耗时 {}ms",
                state, summary.fetched(), summary.transformed(), summary.loaded(),
                summary.batchesProcessed(), summary.errors().size(), summary.duration().toMillis());
        return summary;
    }

    private void shutdown(ExecutorService producerExecutor, ExecutorService consumerExecutor) {
        if (source != null) {
            source.stop();
        }
        workers.forEach(HomeLoadWorker::stop);
        producerExecutor.shutdownNow();
        consumerExecutor.shutdownNow();
        try {
            if (!consumerExecutor.awaitTermination(WORKER_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("⚠️ 仍有 {} 个消费者未在 {}s 内退出", activeConsumers.get(), WORKER_SHUTDOWN_TIMEOUT_SECONDS);
            }
            producerExecutor.awaitTermination(WORKER_SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public PipelineState getState() {
        return state;
    }

    /** 已入队但尚未确认的工作单元数 */
    public int pendingWorkItems() {
        WorkQueue queue = workQueue;
        return queue == null ? 0 : queue.pendingCount();
    }

    public int activeConsumers() {
        return activeConsumers.get();
    }

    /** 运行中的统计快照，未启动时返回 null */
    public RunSummary currentStatistics() {
        RunStatistics stats = statistics;
        return stats == null ? null : stats.snapshot();
    }

    public int currentPage() {
        AnimalPageSource s = source;
        return s == null ? 0 : s.getCurrentPage();
    }

    public AnimalTransformer.Stats transformerStats() {
        return transformer.getStats();
    }

    public AnimalApiClient getClient() {
        return client;
    }
}
