package com.lhcz.animaletl.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.lhcz.animaletl.exception.ApiException;
import com.lhcz.animaletl.exception.ValidationException;
import com.lhcz.animaletl.model.Animal;
import com.lhcz.animaletl.model.RunStatistics;
import com.lhcz.animaletl.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 消费者：详情拉取 → 转换 → 批量写入
 * 单条记录或单个批次失败只记到统计里，不会让 worker 退出。
 * 从队列取出的每个 WorkItem 无论成功、失败还是被取消，都恰好确认一次。
 */
public class HomeLoadWorker implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(HomeLoadWorker.class);

    private final int workerId;
    private final AnimalApiClient client;
    private final AnimalTransformer transformer;
    private final WorkQueue queue;
    private final RunStatistics statistics;
    private final DeadLetterQueueManager deadLetters;
    private final AtomicInteger activeConsumers;
    private final int batchSize;
    private final int detailConcurrency;
    private volatile boolean running = true;
    private volatile long itemsProcessed;

    public HomeLoadWorker(int workerId, AnimalApiClient client, AnimalTransformer transformer, WorkQueue queue,
                          RunStatistics statistics, DeadLetterQueueManager deadLetters, AtomicInteger activeConsumers,
                          int batchSize, int detailConcurrency) {
        this.workerId = workerId;
        this.client = client;
        this.transformer = transformer;
        this.queue = queue;
        this.statistics = statistics;
        this.deadLetters = deadLetters;
        this.activeConsumers = activeConsumers;
        this.batchSize = batchSize;
        this.detailConcurrency = detailConcurrency;
    }

    @Override
    public void run() {
        AtomicInteger seq = new AtomicInteger();
        ExecutorService detailPool = Executors.newFixedThreadPool(detailConcurrency, r -> {
            Thread t = new Thread(r, "animal-worker-" + workerId + "-detail-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        try {
            while (running) {
                WorkItem item = queue.poll(100, TimeUnit.MILLISECONDS);
                if (item == null) continue;
                try {
                    process(item, detailPool);
                } catch (RuntimeException e) {
                    log.error("❌ worker-{} 处理第 {} 页出现未预期错误: {}", workerId, item.page(), e.getMessage(), e);
                    String error = "page " + item.page() + " aborted: " + e.getMessage();
                    statistics.update(t -> t.addError(error));
                } finally {
                    queue.taskDone();
                    itemsProcessed++;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            detailPool.shutdownNow();
            activeConsumers.decrementAndGet();
            log.info("👋 worker-{} 已结束，共处理 {} 个工作单元", workerId, itemsProcessed);
        }
    }

    void process(WorkItem item, ExecutorService detailPool) throws InterruptedException {
        List<String> errors = new ArrayList<>();
        List<Future<JsonNode>> futures = new ArrayList<>(item.size());
        for (Long id : item.ids()) {
            futures.add(detailPool.submit(() -> client.fetchDetail(id)));
        }

        int fetched = 0;
        List<Animal> transformed = new ArrayList<>(item.size());
        try {
            for (int i = 0; i < futures.size(); i++) {
                long id = item.ids().get(i);
                JsonNode detail;
                try {
                    detail = futures.get(i).get();
                    fetched++;
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    log.error("拉取 animal {} 详情失败: {}", id, cause.getMessage());
                    errors.add("fetch animal " + id + " failed: " + cause.getMessage());
                    continue;
                }

                try {
                    transformed.add(transformer.transform(Animal.fromJson(detail)));
                } catch (ValidationException e) {
                    log.error("转换 animal {} 失败，跳过: {}", id, e.getMessage());
                    errors.add("transform animal " + id + " failed: " + e.getMessage());
                }
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            throw e;
        }

        int loaded = 0;
        int batches = 0;
        for (int from = 0; from < transformed.size(); from += batchSize) {
            List<Animal> batch = transformed.subList(from, Math.min(from + batchSize, transformed.size()));
            try {
                client.loadBatch(batch);
                loaded += batch.size();
                batches++;
                log.info("✅ worker-{} 第 {} 页写入成功 ({} 条)", workerId, item.page(), batch.size());
            } catch (ApiException e) {
                log.error("❌ worker-{} 第 {} 页写入失败 ({} 条): {}", workerId, item.page(), batch.size(), e.getMessage());
                errors.add("load batch of page " + item.page() + " (" + batch.size() + " animals) failed: " + e.getMessage());
                if (deadLetters != null) {
                    deadLetters.save("page" + item.page(), batch, e.getClass().getSimpleName());
                }
            }
        }

        int fetchedCount = fetched;
        int transformedCount = transformed.size();
        int loadedCount = loaded;
        int batchCount = batches;
        statistics.update(t -> {
            t.addFetched(fetchedCount);
            t.addTransformed(transformedCount);
            t.addLoaded(loadedCount);
            for (int i = 0; i < batchCount; i++) t.addBatch();
            t.addErrors(errors);
        });
    }

    public long getItemsProcessed() {
        return itemsProcessed;
    }

    public void stop() {
        this.running = false;
    }
}
