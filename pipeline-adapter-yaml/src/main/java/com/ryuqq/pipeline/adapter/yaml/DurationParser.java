package com.ryuqq.pipeline.adapter.yaml;

import com.ryuqq.pipeline.core.error.ConfigurationException;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 사람이 읽는 기간 표현을 {@link Duration}으로 변환.
 *
 * <p><strong>지원 형식:</strong></p>
 * <ul>
 *   <li>{@code 5h}, {@code 30m}, {@code 45s}, {@code 1d}, {@code 2w}</li>
 *   <li>{@code 3 months}, {@code 1 year}, {@code 2 weeks}</li>
 *   <li>{@code 1 hour 30 minutes}, {@code 2h20min}, {@code 3 weeks and 2 days}</li>
 *   <li>단위 없는 숫자는 초 ({@code 3600})</li>
 * </ul>
 *
 * <p>월은 30일, 년은 365일로 계산합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DurationParser {

    private static final Pattern TERM = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*([a-z]*)");

    private static final long MINUTE = 60L;
    private static final long HOUR = 60L * MINUTE;
    private static final long DAY = 24L * HOUR;

    private static final Map<String, Long> UNIT_SECONDS = Map.ofEntries(
        Map.entry("", 1L),
        Map.entry("s", 1L),
        Map.entry("sec", 1L),
        Map.entry("secs", 1L),
        Map.entry("second", 1L),
        Map.entry("seconds", 1L),
        Map.entry("m", MINUTE),
        Map.entry("min", MINUTE),
        Map.entry("mins", MINUTE),
        Map.entry("minute", MINUTE),
        Map.entry("minutes", MINUTE),
        Map.entry("h", HOUR),
        Map.entry("hr", HOUR),
        Map.entry("hrs", HOUR),
        Map.entry("hour", HOUR),
        Map.entry("hours", HOUR),
        Map.entry("d", DAY),
        Map.entry("day", DAY),
        Map.entry("days", DAY),
        Map.entry("w", 7 * DAY),
        Map.entry("wk", 7 * DAY),
        Map.entry("wks", 7 * DAY),
        Map.entry("week", 7 * DAY),
        Map.entry("weeks", 7 * DAY),
        Map.entry("mo", 30 * DAY),
        Map.entry("mos", 30 * DAY),
        Map.entry("month", 30 * DAY),
        Map.entry("months", 30 * DAY),
        Map.entry("y", 365 * DAY),
        Map.entry("yr", 365 * DAY),
        Map.entry("yrs", 365 * DAY),
        Map.entry("year", 365 * DAY),
        Map.entry("years", 365 * DAY)
    );

    private DurationParser() {
    }

    /**
     * 기간 표현 파싱.
     *
     * @param text 기간 표현 (예: {@code "3 months"})
     * @return 양수 Duration
     * @throws ConfigurationException 형식이 잘못되었거나 0인 경우
     */
    public static Duration parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ConfigurationException("Duration cannot be blank");
        }
        String normalized = text.toLowerCase(Locale.ROOT)
            .replace(",", " ")
            .replaceAll("\\band\\b", " ")
            .trim();

        Matcher matcher = TERM.matcher(normalized);
        BigDecimal totalSeconds = BigDecimal.ZERO;
        int position = 0;
        while (matcher.find()) {
            if (!normalized.substring(position, matcher.start()).isBlank()) {
                throw invalid(text);
            }
            Long unit = UNIT_SECONDS.get(matcher.group(2));
            if (unit == null) {
                throw new ConfigurationException("Unknown duration unit '" + matcher.group(2) + "' in '" + text + "'");
            }
            totalSeconds = totalSeconds.add(new BigDecimal(matcher.group(1)).multiply(BigDecimal.valueOf(unit)));
            position = matcher.end();
        }
        if (position == 0 || !normalized.substring(position).isBlank()) {
            throw invalid(text);
        }

        long millis = totalSeconds.movePointRight(3).longValue();
        if (millis <= 0) {
            throw new ConfigurationException("Duration must be positive: '" + text + "'");
        }
        return Duration.ofMillis(millis);
    }

    private static ConfigurationException invalid(String text) {
        return new ConfigurationException("Invalid duration: '" + text + "'");
    }
}
