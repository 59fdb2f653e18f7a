package com.lhcz.animaletl.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.lhcz.animaletl.exception.ApiException;
import com.lhcz.animaletl.model.RunStatistics;
import com.lhcz.animaletl.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 列表翻页任务 (生产者)
 * 从第 1 页开始顺序翻页，每页的 ID 作为一个 WorkItem 放入队列；遇到空页结束。
 * 接口不可恢复的错误只记录并退出，不影响已入队工作的处理。
 */
public class AnimalPageSource implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(AnimalPageSource.class);

    private final AnimalApiClient client;
    private final WorkQueue queue;
    private final RunStatistics statistics;
    private final int perPage;
    private volatile boolean running = true;
    private volatile int currentPage;
    private volatile long idsQueued;

    public AnimalPageSource(AnimalApiClient client, WorkQueue queue, RunStatistics statistics, int perPage) {
        this.client = client;
        this.queue = queue;
        this.statistics = statistics;
        this.perPage = perPage;
    }

    @Override
    public void run() {
        int page = 1;
        log.info("翻页任务启动，每页 {} 条", perPage);

        while (running) {
            currentPage = page;
            try {
                long startTime = System.currentTimeMillis();
                JsonNode response = client.listPage(page, perPage);
                JsonNode items = response.path("items");

                if (!items.isArray() || items.isEmpty()) {
                    log.info("第 {} 页没有数据，翻页结束", page);
                    break;
                }

                List<Long> ids = extractIds(page, items);
                if (!ids.isEmpty()) {
                    // 队列满时阻塞，等消费者跟上
                    queue.put(new WorkItem(page, ids));
                    idsQueued += ids.size();
                }
                log.info("第 {} 页: {} 个 ID 入队，耗时 {}ms", page, ids.size(), System.currentTimeMillis() - startTime);
                page++;

            } catch (InterruptedException e) {
                log.info("翻页任务被中断，停在第 {} 页", page);
                Thread.currentThread().interrupt();
                break;
            } catch (ApiException e) {
                log.error("❌ 拉取第 {} 页失败，翻页任务退出: {}", page, e.getMessage());
                String error = "list page " + page + " failed: " + e.getMessage();
                statistics.update(t -> t.addError(error));
                break;
            }
        }

        log.info("👋 翻页任务结束，共入队 {} 个 ID", idsQueued);
    }

    private List<Long> extractIds(int page, JsonNode items) {
        List<Long> ids = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            Long id = parseId(item.isObject() ? item.get("id") : item);
            if (id != null) {
                ids.add(id);
            } else {
                log.error("第 {} 页存在无法识别的记录: {}", page, item);
                String error = "list page " + page + " has item without valid id: " + item;
                statistics.update(t -> t.addError(error));
            }
        }
        return ids;
    }

    /**
     * 整数或纯数字字符串；超出 long 范围、小数、其他类型都返回 null
     */
    static Long parseId(JsonNode idNode) {
        if (idNode == null) return null;
        if (idNode.isIntegralNumber()) {
            return idNode.canConvertToLong() ? idNode.longValue() : null;
        }
        if (idNode.isTextual()) {
            try {
                return Long.parseLong(idNode.textValue().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public int getCurrentPage() {
        return currentPage;
    }

    public long getIdsQueued() {
        return idsQueued;
    }

    public void stop() {
        this.running = false;
    }
}
