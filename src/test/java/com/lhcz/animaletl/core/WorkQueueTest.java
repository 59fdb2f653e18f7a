package com.lhcz.animaletl.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.lhcz.animaletl.model.WorkItem;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class WorkQueueTest {

  @Test
  void drainWaitsForAcknowledgementNotJustRemoval() throws Exception {
    WorkQueue queue = new WorkQueue(2);
    queue.put(new WorkItem(1, List.of(1L, 2L)));
    queue.put(new WorkItem(2, List.of(3L)));

    WorkItem first = queue.poll(1, TimeUnit.SECONDS);
    WorkItem second = queue.poll(1, TimeUnit.SECONDS);
    assertEquals(1, first.page());
    assertEquals(2, second.page());
    assertEquals(0, queue.queuedCount());
    assertEquals(2, queue.pendingCount());
    assertFalse(queue.awaitDrained(50, TimeUnit.MILLISECONDS));

    queue.taskDone();
    queue.taskDone();
    assertTrue(queue.awaitDrained(50, TimeUnit.MILLISECONDS));
    assertEquals(0, queue.pendingCount());
  }

  @Test
  void taskDoneBeyondPutCountFails() {
    WorkQueue queue = new WorkQueue(1);
    assertThrows(IllegalStateException.class, queue::taskDone);
  }

  @Test
  void putBlocksWhenFullUntilConsumerTakes() throws Exception {
    WorkQueue queue = new WorkQueue(1);
    queue.put(new WorkItem(1, List.of(1L)));

    CountDownLatch putDone = new CountDownLatch(1);
    Thread producer = new Thread(() -> {
      try {
        queue.put(new WorkItem(2, List.of(2L)));
        putDone.countDown();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    });
    producer.start();

    assertFalse(putDone.await(100, TimeUnit.MILLISECONDS));
    assertEquals(1, queue.poll(1, TimeUnit.SECONDS).page());
    assertTrue(putDone.await(1, TimeUnit.SECONDS));
    producer.join();
    assertEquals(2, queue.pendingCount());
  }

  @Test
  void interruptedPutDoesNotLeaveAPhantomItem() throws Exception {
    WorkQueue queue = new WorkQueue(1);
    queue.put(new WorkItem(1, List.of(1L)));

    Thread producer = new Thread(() -> {
      try {
        queue.put(new WorkItem(2, List.of(2L)));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    });
    producer.start();
    Thread.sleep(50);
    producer.interrupt();
    producer.join();

    assertEquals(1, queue.pendingCount());
    assertEquals(1, queue.poll(1, TimeUnit.SECONDS).page());
    assertNull(queue.poll(10, TimeUnit.MILLISECONDS));
  }
}
