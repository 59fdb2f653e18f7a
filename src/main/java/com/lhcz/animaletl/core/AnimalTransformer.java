package com.lhcz.animaletl.core;

import com.lhcz.animaletl.exception.TransformationException;
import com.lhcz.animaletl.exception.ValidationException;
import com.lhcz.animaletl.model.Animal;
import com.lhcz.animaletl.model.BornAtField;
import com.lhcz.animaletl.model.FriendsField;
import com.lhcz.animaletl.util.DateTimeUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 字段规范化
 * 纯内存计算，无 I/O；计数器是原子的，多个 worker 共用一个实例也安全。
 */
public class AnimalTransformer {
    private static final Logger log = LoggerFactory.getLogger(AnimalTransformer.class);

    private final AtomicLong friendsTransformed = new AtomicLong();
    private final AtomicLong bornAtTransformed = new AtomicLong();
    private final AtomicLong transformationErrors = new AtomicLong();

    public record Stats(long friendsTransformed, long bornAtTransformed, long transformationErrors) {}

    /**
     * 规范化单条记录，返回新实例
     * @throws ValidationException 重建后的记录不满足不变式 (调用方应跳过该记录)
     */
    public Animal transform(Animal animal) {
        try {
            FriendsField friends = new FriendsField.Listed(normalizeFriends(animal.friends()));
            BornAtField bornAt = normalizeBornAt(animal.bornAt())
                    .<BornAtField>map(BornAtField.Text::new)
                    .orElse(BornAtField.ABSENT);
            Animal transformed = animal.withFields(friends, bornAt);
            if (!transformed.isNormalized()) {
                throw new ValidationException("animal " + animal.id() + " 规范化后仍不满足格式要求");
            }
            return transformed;
        } catch (ValidationException e) {
            transformationErrors.incrementAndGet();
            log.error("转换 animal {} 失败: {}", animal.id(), e.getMessage());
            throw e;
        }
    }

    /**
     * 批量转换，失败的记录记日志后跳过
     */
    public List<Animal> transformBatch(List<Animal> animals) {
        List<Animal> result = new ArrayList<>(animals.size());
        for (Animal animal : animals) {
            try {
                result.add(transform(animal));
            } catch (ValidationException e) {
                log.error("跳过 animal {}: {}", animal.id(), e.getMessage());
            }
        }
        return result;
    }

    public List<String> normalizeFriends(Object value) {
        return normalizeFriends(FriendsField.of(value));
    }

    /**
     * CSV 按逗号拆分；列表逐项 trim；空项丢弃，顺序不变。不会抛异常。
     */
    public List<String> normalizeFriends(FriendsField field) {
        try {
            if (field == null) {
                return List.of();
            }
            if (field instanceof FriendsField.Listed listed) {
                return cleanItems(listed.items());
            }
            if (field instanceof FriendsField.Csv csv) {
                List<String> friends = splitCsv(csv.raw());
                if (!friends.isEmpty()) {
                    friendsTransformed.incrementAndGet();
                }
                log.debug("friends CSV '{}' -> {}", csv.raw(), friends);
                return friends;
            }
            if (field instanceof FriendsField.Other other) {
                log.warn("friends 类型异常，按字符串处理: {}", other.text());
                return normalizeFriends(new FriendsField.Csv(other.text()));
            }
            throw new TransformationException("friends", "未知的 friends 形态: " + field.getClass().getName(), null);
        } catch (RuntimeException e) {
            log.error("转换 friends 失败 '{}': {}", field, e.getMessage());
            return List.of();
        }
    }

    public Optional<String> normalizeBornAt(Object value) {
        return normalizeBornAt(BornAtField.of(value));
    }

    /**
     * 时间对象直接转 UTC；字符串先宽松解析，解析不了返回 empty (记日志，不算错误)
     */
    public Optional<String> normalizeBornAt(BornAtField field) {
        try {
            if (field == null || field instanceof BornAtField.Absent) {
                return Optional.empty();
            }
            if (field instanceof BornAtField.Timestamp ts) {
                String iso = DateTimeUtil.formatUtc(ts.value());
                bornAtTransformed.incrementAndGet();
                return Optional.of(iso);
            }
            if (field instanceof BornAtField.Text text) {
                String trimmed = text.value().trim();
                if (trimmed.isEmpty()) {
                    return Optional.empty();
                }
                Optional<Instant> parsed = DateTimeUtil.parseFlexible(trimmed);
                if (parsed.isEmpty()) {
                    log.error("无法解析 born_at: '{}'", trimmed);
                    return Optional.empty();
                }
                String iso = DateTimeUtil.formatUtc(parsed.get());
                bornAtTransformed.incrementAndGet();
                log.debug("born_at '{}' -> {}", trimmed, iso);
                return Optional.of(iso);
            }
            throw new TransformationException("born_at", "未知的 born_at 形态: " + field.getClass().getName(), null);
        } catch (DateTimeException | TransformationException e) {
            log.error("转换 born_at 失败 '{}': {}", field, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * 校验转换结果：id、name 不变，friends 已是干净列表，born_at 缺省或可被重新解析
     */
    public boolean validateTransformation(Animal original, Animal transformed) {
        if (original.id() != transformed.id()) {
            log.error("ID 不一致: {} != {}", original.id(), transformed.id());
            return false;
        }
        if (!original.name().equals(transformed.name())) {
            log.error("name 不一致: {} != {}", original.name(), transformed.name());
            return false;
        }
        if (!transformed.isNormalized()) {
            log.error("animal {} 的 friends / born_at 未规范化", transformed.id());
            return false;
        }
        if (transformed.bornAt() instanceof BornAtField.Text text && DateTimeUtil.parseFlexible(text.value()).isEmpty()) {
            log.error("born_at 不是合法的 ISO8601: {}", text.value());
            return false;
        }
        return true;
    }

    public Stats getStats() {
        return new Stats(friendsTransformed.get(), bornAtTransformed.get(), transformationErrors.get());
    }

    public void resetStats() {
        friendsTransformed.set(0);
        bornAtTransformed.set(0);
        transformationErrors.set(0);
    }

    private static List<String> splitCsv(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        List<String> items = new ArrayList<>();
        for (String part : raw.split(",")) {
            String trimmed = part.trim();
            if (!trimmed.isEmpty()) items.add(trimmed);
        }
        return items;
    }

    private static List<String> cleanItems(List<String> items) {
        List<String> cleaned = new ArrayList<>(items.size());
        for (String item : items) {
            if (item == null) continue;
            String trimmed = item.trim();
            if (!trimmed.isEmpty()) cleaned.add(trimmed);
        }
        return cleaned;
    }
}
