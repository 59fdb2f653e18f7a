package com.lhcz.animaletl.model;

import java.util.List;

/**
 * 队列中传递的工作单元：一页的记录 ID
 * @param page 来源页码 (从 1 开始)
 * @param ids  该页的记录 ID，保持上游顺序
 */
public record WorkItem(int page, List<Long> ids) {
    public WorkItem {
        ids = List.copyOf(ids);
    }

    public int size() {
        return ids.size();
    }
}
