package com.lhcz.animaletl.util;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 时间解析与格式化
 * 上游的 born_at 格式五花八门，这里按常见格式依次尝试；不带时区的一律视为 UTC。
 */
public final class DateTimeUtil {

    private static final Pattern CANONICAL = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}Z$");

    private static final DateTimeFormatter CANONICAL_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    // 2020-01-15 10:30:00 / 2020-01-15 10:30:00.123+08:00
    private static final DateTimeFormatter SPACE_SEPARATED = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .appendLiteral(' ')
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendOffset("+HH:MM:ss", "Z").optionalEnd()
            .optionalStart().appendLiteral(' ').appendOffset("+HH:MM:ss", "Z").optionalEnd()
            .toFormatter(Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);

    // 2020-01-15T10:30:00+0800，时区不带冒号
    private static final DateTimeFormatter COMPACT_OFFSET = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart().appendLiteral('T').optionalEnd()
            .optionalStart().appendLiteral(' ').optionalEnd()
            .append(DateTimeFormatter.ISO_LOCAL_TIME)
            .optionalStart().appendLiteral(' ').optionalEnd()
            .appendOffset("+HHmm", "Z")
            .toFormatter(Locale.ROOT)
            .withResolverStyle(ResolverStyle.STRICT);

    // 顺序即优先级，ISO 放最前
    private static final List<DateTimeFormatter> FORMATS = List.of(
            DateTimeFormatter.ISO_DATE_TIME,
            SPACE_SEPARATED,
            COMPACT_OFFSET,
            DateTimeFormatter.ISO_LOCAL_DATE,
            strict("uuuu-M-d"),
            strict("uuuu/M/d[ H:mm[:ss]]"),
            strict("M/d/uuuu[ H:mm[:ss]]"),
            strict("uuuuMMdd['T'HHmmss[X]]"),
            DateTimeFormatter.RFC_1123_DATE_TIME,
            strict("d MMM uuuu[ HH:mm[:ss]]"),
            strict("MMM d, uuuu[ HH:mm[:ss]]"),
            strict("MMMM d, uuuu[ HH:mm[:ss]]")
    );

    private DateTimeUtil() {}

    private static DateTimeFormatter strict(String pattern) {
        return new DateTimeFormatterBuilder()
                .parseCaseInsensitive()
                .appendPattern(pattern)
                .toFormatter(Locale.ENGLISH)
                .withResolverStyle(ResolverStyle.STRICT);
    }

    public static boolean isCanonical(String value) {
        return value != null && CANONICAL.matcher(value).matches();
    }

    /**
     * 宽松解析，失败返回 empty 而不是抛异常
     */
    public static Optional<Instant> parseFlexible(String text) {
        if (text == null) return Optional.empty();
        String trimmed = text.trim();
        if (trimmed.isEmpty()) return Optional.empty();

        for (DateTimeFormatter format : FORMATS) {
            try {
                TemporalAccessor parsed = format.parse(trimmed);
                return Optional.of(toInstant(parsed));
            } catch (DateTimeParseException ignored) {
                // 换下一个格式
            } catch (DateTimeException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    /**
     * 格式化为 yyyy-MM-ddTHH:mm:ssZ (UTC, 秒级)
     */
    public static String formatUtc(TemporalAccessor temporal) {
        return CANONICAL_FORMAT.format(toInstant(temporal).truncatedTo(ChronoUnit.SECONDS));
    }

    static Instant toInstant(TemporalAccessor temporal) {
        if (temporal instanceof Instant instant) {
            return instant;
        }
        if (temporal.isSupported(ChronoField.INSTANT_SECONDS)) {
            return Instant.from(temporal);
        }
        if (temporal.isSupported(ChronoField.HOUR_OF_DAY)) {
            return LocalDateTime.from(temporal).toInstant(ZoneOffset.UTC);
        }
        return LocalDate.from(temporal).atStartOfDay().toInstant(ZoneOffset.UTC);
    }
}
