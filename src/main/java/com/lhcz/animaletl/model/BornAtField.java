package com.lhcz.animaletl.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.temporal.TemporalAccessor;
import java.util.Date;

/**
 * born_at 字段的输入形态 (标签联合)：缺省 / 字符串 / 时间对象
 */
public interface BornAtField {

    BornAtField ABSENT = new Absent();

    record Absent() implements BornAtField {}

    record Text(String value) implements BornAtField {}

    /** 不带时区的时间按 UTC 处理 */
    record Timestamp(TemporalAccessor value) implements BornAtField {}

    static BornAtField of(Object value) {
        if (value == null) return ABSENT;
        if (value instanceof BornAtField field) return field;
        if (value instanceof JsonNode node) return fromJson(node);
        if (value instanceof TemporalAccessor temporal) return new Timestamp(temporal);
        if (value instanceof Date date) return new Timestamp(date.toInstant());
        String text = String.valueOf(value);
        return text.isEmpty() ? ABSENT : new Text(text);
    }

    static BornAtField fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) return ABSENT;
        String text = node.isValueNode() ? node.asText() : node.toString();
        return text.isEmpty() ? ABSENT : new Text(text);
    }
}
