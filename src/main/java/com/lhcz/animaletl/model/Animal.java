package com.lhcz.animaletl.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.lhcz.animaletl.exception.ValidationException;
import com.lhcz.animaletl.util.DateTimeUtil;
import com.lhcz.animaletl.util.JsonUtil;

import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 动物记录 (不可变值对象)
 * 详情接口返回的原始 JSON 在这里做宽松解析；转换后生成新实例而不是修改原对象，
 * 多个 worker 并发处理时不会互相影响。
 *
 * @param id      唯一标识 (必填)
 * @param name    名称 (必填)
 * @param friends 朋友列表的原始或规范形态
 * @param bornAt  出生时间的原始或规范形态
 * @param extras  上游多给的字段，原样透传
 */
public record Animal(long id, String name, FriendsField friends, BornAtField bornAt, Map<String, JsonNode> extras) {

    private static final Set<String> KNOWN_FIELDS = Set.of("id", "name", "friends", "born_at");

    public Animal {
        if (name == null) {
            throw new ValidationException("animal " + id + " 缺少必填字段 name");
        }
        if (friends == null) friends = FriendsField.empty();
        if (bornAt == null) bornAt = BornAtField.ABSENT;
        extras = extras == null || extras.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
    }

    /**
     * 从详情接口的 JSON 构造记录。id 可以是整数或数字字符串，name 必须是字符串。
     */
    public static Animal fromJson(JsonNode node) {
        if (node == null || !node.isObject()) {
            throw new ValidationException("animal 数据不是 JSON 对象: " + node);
        }
        long id = parseId(node.get("id"));
        JsonNode nameNode = node.get("name");
        if (nameNode == null || !nameNode.isTextual()) {
            throw new ValidationException("animal " + id + " 缺少必填字段 name");
        }

        Map<String, JsonNode> extras = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!KNOWN_FIELDS.contains(field.getKey())) {
                extras.put(field.getKey(), field.getValue());
            }
        }

        return new Animal(id, nameNode.textValue(),
                FriendsField.fromJson(node.get("friends")),
                BornAtField.fromJson(node.get("born_at")),
                extras);
    }

    private static long parseId(JsonNode idNode) {
        if (idNode == null || idNode.isNull()) {
            throw new ValidationException("animal 缺少必填字段 id");
        }
        if (idNode.canConvertToLong() && idNode.isIntegralNumber()) {
            return idNode.longValue();
        }
        if (idNode.isTextual()) {
            try {
                return Long.parseLong(idNode.textValue().trim());
            } catch (NumberFormatException e) {
                throw new ValidationException("animal id 不是整数: " + idNode.textValue(), e);
            }
        }
        throw new ValidationException("animal id 不是整数: " + idNode);
    }

    public Animal withFields(FriendsField newFriends, BornAtField newBornAt) {
        return new Animal(id, name, newFriends, newBornAt, extras);
    }

    /**
     * 转换后的不变式：friends 为去空白的非空字符串列表，born_at 缺省或为 UTC 秒级 ISO 格式
     */
    public boolean isNormalized() {
        if (!(friends instanceof FriendsField.Listed listed)) return false;
        for (String friend : listed.items()) {
            if (friend.isEmpty() || !friend.equals(friend.trim())) return false;
        }
        if (bornAt instanceof BornAtField.Absent) return true;
        return bornAt instanceof BornAtField.Text text && DateTimeUtil.isCanonical(text.value());
    }

    /**
     * 写回上游格式，born_at 缺省时输出 null，额外字段原样附加
     */
    public ObjectNode toJson() {
        ObjectNode node = JsonUtil.mapper().createObjectNode();
        node.put("id", id);
        node.put("name", name);

        if (friends instanceof FriendsField.Listed listed) {
            ArrayNode array = node.putArray("friends");
            listed.items().forEach(array::add);
        } else if (friends instanceof FriendsField.Csv csv) {
            node.put("friends", csv.raw());
        } else if (friends instanceof FriendsField.Other other) {
            node.put("friends", other.text());
        }

        if (bornAt instanceof BornAtField.Text text) {
            node.put("born_at", text.value());
        } else if (bornAt instanceof BornAtField.Timestamp ts) {
            node.put("born_at", DateTimeUtil.formatUtc(ts.value()));
        } else {
            node.putNull("born_at");
        }

        extras.forEach((key, value) -> node.set(key, value));
        return node;
    }

    @Override
    public String toString() {
        return "Animal[" + id + "]: " + name;
    }
}
