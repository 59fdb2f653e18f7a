package com.lhcz.animaletl.core;

import com.lhcz.animaletl.model.WorkItem;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 有界工作队列 (背压)
 * 在阻塞队列之外维护"未完成"计数：put 时 +1，消费者处理完调用 {@link #taskDone()} -1，
 * {@link #awaitDrained()} 等到计数归零，即所有放入的工作都已确认。
 */
public class WorkQueue {
    private final BlockingQueue<WorkItem> items;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition drained = lock.newCondition();
    private int unfinished;

    public WorkQueue(int capacity) {
        this.items = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * 放入一个工作单元，队列满时阻塞
     */
    public void put(WorkItem item) throws InterruptedException {
        lock.lock();
        try {
            unfinished++;
        } finally {
            lock.unlock();
        }
        try {
            items.put(item);
        } catch (InterruptedException e) {
            // 没放进去，计数退回
            taskDone();
            throw e;
        }
    }

    /**
     * 取出一个工作单元，超时返回 null。取到的每一项都必须调用一次 taskDone。
     */
    public WorkItem poll(long timeout, TimeUnit unit) throws InterruptedException {
        return items.poll(timeout, unit);
    }

    public void taskDone() {
        lock.lock();
        try {
            if (unfinished <= 0) {
                throw new IllegalStateException("taskDone 调用次数超过放入的工作数");
            }
            unfinished--;
            if (unfinished == 0) {
                drained.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 阻塞直到所有放入的工作都被确认
     */
    public void awaitDrained() throws InterruptedException {
        lock.lock();
        try {
            while (unfinished > 0) {
                drained.await();
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean awaitDrained(long timeout, TimeUnit unit) throws InterruptedException {
        long nanos = unit.toNanos(timeout);
        lock.lock();
        try {
            while (unfinished > 0) {
                if (nanos <= 0) return false;
                nanos = drained.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** 已放入但尚未确认的数量 */
    public int pendingCount() {
        lock.lock();
        try {
            return unfinished;
        } finally {
            lock.unlock();
        }
    }

    /** 队列中等待被取走的数量 */
    public int queuedCount() {
        return items.size();
    }
}
