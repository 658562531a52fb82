package com.antigravity.gateway.proxy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 429 重置时间解析
 * <p>
 * 依次尝试响应头（retry-after、x-ratelimit-reset、x-ratelimit-reset-after）与
 * Google 错误体字段（retryDelay、quotaResetDelay、quotaResetTimeStamp）
 */
@Component
public class RateLimitParser {

    private static final Logger log = LoggerFactory.getLogger(RateLimitParser.class);
    // 解析出非正值时的最小等待
    static final long MIN_RESET_MS = 1000;

    private static final Pattern RETRY_DELAY = Pattern.compile("\"retryDelay\"\\s*:\\s*\"([\\d.]+)s\"");
    private static final Pattern QUOTA_RESET_DELAY = Pattern.compile("\"quotaResetDelay\"\\s*:\\s*\"([^\"]+)\"");
    private static final Pattern QUOTA_RESET_TIMESTAMP = Pattern.compile("\"quotaResetTimeStamp\"\\s*:\\s*\"([^\"]+)\"");
    private static final Pattern SECONDS = Pattern.compile("\\d+(\\.\\d+)?");
    private static final Pattern DURATION_PART = Pattern.compile("([\\d.]+)(ms|h|m|s)");

    private final Clock clock;

    public RateLimitParser(Clock clock) {
        this.clock = clock;
    }

    /**
     * 解析距离重置的毫秒数
     *
     * @return 无法解析时返回 null
     */
    public Long parseResetMs(HttpHeaders headers, String body) {
        Long fromHeaders = headers != null ? fromHeaders(headers) : null;
        Long resetMs = fromHeaders != null ? fromHeaders : fromBody(body);
        if (resetMs == null) {
            return null;
        }
        return Math.max(resetMs, MIN_RESET_MS);
    }

    Long fromHeaders(HttpHeaders headers) {
        String retryAfter = headers.getFirst("retry-after");
        if (retryAfter != null) {
            Long parsed = parseRetryAfter(retryAfter.trim());
            if (parsed != null) {
                return parsed;
            }
        }

        String reset = headers.getFirst("x-ratelimit-reset");
        if (reset != null) {
            try {
                // 秒级时间戳
                long epochSeconds = Long.parseLong(reset.trim());
                return epochSeconds * 1000 - clock.millis();
            } catch (NumberFormatException e) {
                log.debug("x-ratelimit-reset 无法解析: {}", reset);
            }
        }

        String resetAfter = headers.getFirst("x-ratelimit-reset-after");
        if (resetAfter != null) {
            try {
                return (long) (Double.parseDouble(resetAfter.trim()) * 1000);
            } catch (NumberFormatException e) {
                log.debug("x-ratelimit-reset-after 无法解析: {}", resetAfter);
            }
        }
        return null;
    }

    Long fromBody(String body) {
        if (body == null || body.isEmpty()) {
            return null;
        }

        Matcher m = QUOTA_RESET_DELAY.matcher(body);
        if (m.find()) {
            Long parsed = parseDuration(m.group(1));
            if (parsed != null) {
                return parsed;
            }
        }

        m = RETRY_DELAY.matcher(body);
        if (m.find()) {
            return (long) (Double.parseDouble(m.group(1)) * 1000);
        }

        m = QUOTA_RESET_TIMESTAMP.matcher(body);
        if (m.find()) {
            try {
                return Instant.parse(m.group(1)).toEpochMilli() - clock.millis();
            } catch (DateTimeParseException e) {
                log.debug("quotaResetTimeStamp 无法解析: {}", m.group(1));
            }
        }
        return null;
    }

    /**
     * 解析 Go 风格时长，如 1h2m3.5s、500ms、12.5s
     */
    static Long parseDuration(String value) {
        Matcher m = DURATION_PART.matcher(value);
        double total = 0;
        boolean matched = false;
        while (m.find()) {
            matched = true;
            double amount = Double.parseDouble(m.group(1));
            total += switch (m.group(2)) {
                case "h" -> amount * 3_600_000;
                case "m" -> amount * 60_000;
                case "s" -> amount * 1000;
                default -> amount;
            };
        }
        return matched ? (long) total : null;
    }

    private Long parseRetryAfter(String value) {
        if (SECONDS.matcher(value).matches()) {
            return (long) (Double.parseDouble(value) * 1000);
        }
        // HTTP 日期
        try {
            ZonedDateTime date = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
            return date.toInstant().toEpochMilli() - clock.millis();
        } catch (DateTimeParseException e) {
            log.debug("retry-after 无法解析: {}", value);
            return null;
        }
    }
}
