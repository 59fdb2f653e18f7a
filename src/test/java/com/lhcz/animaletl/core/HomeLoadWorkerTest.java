package com.lhcz.animaletl.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.lhcz.animaletl.model.RunStatistics;
import com.lhcz.animaletl.model.RunSummary;
import com.lhcz.animaletl.model.WorkItem;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HomeLoadWorkerTest {
  private FakeAnimalServer server;
  private AnimalApiClient client;
  private final WorkQueue queue = new WorkQueue(2);
  private final RunStatistics statistics = new RunStatistics(Instant.now());
  private final AtomicInteger activeConsumers = new AtomicInteger();

  @BeforeEach
  void setUp() throws Exception {
    server = new FakeAnimalServer();
    // 重试间隔足够长，保证取消时请求仍卡在重试里
    RetryPolicy slow = new RetryPolicy(100, Duration.ofSeconds(30), Duration.ofSeconds(60), 2.0, false);
    client = new AnimalApiClient(server.apiConfig(), slow);
  }

  @AfterEach
  void tearDown() {
    client.close();
    server.close();
  }

  private Thread start(HomeLoadWorker worker) {
    activeConsumers.incrementAndGet();
    Thread thread = new Thread(worker, "test-worker");
    thread.start();
    return thread;
  }

  private HomeLoadWorker worker() {
    return new HomeLoadWorker(1, client, new AnimalTransformer(), queue, statistics, null, activeConsumers, 100, 2);
  }

  @Test
  void cancelledMidRetryStillAcknowledgesItemOnce() throws Exception {
    server.failDetail(1L, 503);
    queue.put(new WorkItem(1, List.of(1L)));

    HomeLoadWorker worker = worker();
    Thread thread = start(worker);

    String detailPath = FakeAnimalServer.LIST_PATH + "/1";
    long deadline = System.currentTimeMillis() + 5_000;
    while (server.requestCount(detailPath) == 0 && System.currentTimeMillis() < deadline) {
      Thread.sleep(10);
    }
    assertEquals(1, server.requestCount(detailPath));

    long stoppedAt = System.currentTimeMillis();
    worker.stop();
    thread.interrupt();
    thread.join(5_000);

    assertFalse(thread.isAlive());
    assertTrue(System.currentTimeMillis() - stoppedAt < 5_000);
    assertEquals(0, queue.pendingCount());
    assertEquals(0, activeConsumers.get());
    assertEquals(1, worker.getItemsProcessed());
    // 没有被重复确认，也没有写入
    queue.awaitDrained();
    assertEquals(0, server.requestCount(FakeAnimalServer.HOME_PATH));
  }

  @Test
  void idleWorkerExitsAfterStop() throws Exception {
    HomeLoadWorker worker = worker();
    Thread thread = start(worker);

    worker.stop();
    thread.join(2_000);

    assertFalse(thread.isAlive());
    assertEquals(0, activeConsumers.get());
    assertEquals(0, worker.getItemsProcessed());
  }

  @Test
  void processesQueuedItemAndRecordsStatistics() throws Exception {
    queue.put(new WorkItem(3, List.of(10L, 11L)));

    HomeLoadWorker worker = worker();
    Thread thread = start(worker);
    queue.awaitDrained();
    worker.stop();
    thread.join(2_000);

    RunSummary summary = statistics.snapshot();
    assertEquals(2, summary.fetched());
    assertEquals(2, summary.transformed());
    assertEquals(2, summary.loaded());
    assertEquals(1, summary.batchesProcessed());
    assertFalse(summary.hasErrors());
  }
}
