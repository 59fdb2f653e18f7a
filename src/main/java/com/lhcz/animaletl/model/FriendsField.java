package com.lhcz.animaletl.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * friends 字段的输入形态 (标签联合)
 * 上游可能给 CSV 字符串、字符串数组，偶尔也会给其它类型，统一在这里区分。
 */
public interface FriendsField {

    /** 逗号分隔的原始字符串 */
    record Csv(String raw) implements FriendsField {}

    /** 已经是有序列表 */
    record Listed(List<String> items) implements FriendsField {
        public Listed {
            items = items == null ? List.of() : List.copyOf(items);
        }
    }

    /** 其它类型，保留其字符串形式 */
    record Other(String text) implements FriendsField {}

    static FriendsField empty() {
        return new Listed(List.of());
    }

    /**
     * 把任意运行时值归类为对应的变体
     */
    static FriendsField of(Object value) {
        if (value == null) return empty();
        if (value instanceof FriendsField field) return field;
        if (value instanceof JsonNode node) return fromJson(node);
        if (value instanceof String s) return new Csv(s);
        if (value instanceof Collection<?> collection) {
            List<String> items = new ArrayList<>(collection.size());
            for (Object item : collection) {
                if (item != null) items.add(String.valueOf(item));
            }
            return new Listed(items);
        }
        return new Other(String.valueOf(value));
    }

    static FriendsField fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return empty();
        if (node.isTextual()) return new Csv(node.textValue());
        if (node.isArray()) {
            List<String> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                if (item == null || item.isNull()) continue;
                items.add(item.isTextual() ? item.textValue() : item.toString());
            }
            return new Listed(items);
        }
        return new Other(node.isValueNode() ? node.asText() : node.toString());
    }
}
