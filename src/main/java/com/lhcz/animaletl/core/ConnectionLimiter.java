package com.lhcz.animaletl.core;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;

/**
 * 连接数闸门
 * JDK HttpClient 不暴露连接池上限，这里用信号量限制同时在途的请求：总数一把，每个 host 一把。
 */
public class ConnectionLimiter {
    private final Semaphore total;
    private final int perHost;
    private final Map<String, Semaphore> hosts = new ConcurrentHashMap<>();

    public ConnectionLimiter(int maxTotal, int maxPerHost) {
        this.total = new Semaphore(maxTotal, true);
        this.perHost = maxPerHost;
    }

    /**
     * 获取许可，必须与 {@link #release(String)} 成对使用
     */
    public void acquire(String host) throws InterruptedException {
        Semaphore hostPermits = hosts.computeIfAbsent(host, h -> new Semaphore(perHost, true));
        hostPermits.acquire();
        try {
            total.acquire();
        } catch (InterruptedException e) {
            hostPermits.release();
            throw e;
        }
    }

    public void release(String host) {
        total.release();
        Semaphore hostPermits = hosts.get(host);
        if (hostPermits != null) {
            hostPermits.release();
        }
    }

    public int availableTotal() {
        return total.availablePermits();
    }
}
