package com.goormthonuniv.factmerge.scoring;

import java.time.*;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Optional;

/**
 * 유형별 스코어러가 공유하는 순수 함수들.
 */
public final class SignalMath {

    private static final double LN2 = Math.log(2);

    private SignalMath() {}

    public static double round4(double v) {
        return Math.round(v * 10000.0) / 10000.0;
    }

    public static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        if (v < 0.0) return 0.0;
        if (v > 1.0) return 1.0;
        return v;
    }

    /** max(floor, e^(-ln2 * age / halfLife)), 음수 나이는 0 으로 본다 */
    public static double halfLifeDecay(double age, double halfLife, double floor) {
        double a = Math.max(age, 0.0);
        return Math.max(floor, Math.exp(-LN2 * a / halfLife));
    }

    /** min(log(1+count)/log(1+cap), 1). 알 수 없으면 0 (중립으로 가정하지 않는다) */
    public static double logScaled(Integer count, int cap) {
        if (count == null) return 0.0;
        int c = Math.max(count, 0);
        return Math.min(Math.log1p(c) / Math.log1p(cap), 1.0);
    }

    /** 매칭 0개면 zeroScore, 아니면 min(count * perMatch, 1) */
    public static double saturating(int count, double perMatch, double zeroScore) {
        if (count <= 0) return zeroScore;
        return Math.min(count * perMatch, 1.0);
    }

    public static String band(double v, double high, double mid, String highLabel, String midLabel, String lowLabel) {
        if (v >= high) return highLabel;
        if (v >= mid) return midLabel;
        return lowLabel;
    }

    public static long percent(double v) {
        return Math.round(v * 100);
    }

    /**
     * 메타데이터의 날짜 값을 해석. ISO 문자열(Z 포함, 날짜만도 허용) 또는 java.time 값.
     * 해석 불가면 empty.
     */
    public static Optional<OffsetDateTime> parseDate(Object value) {
        if (value == null) return Optional.empty();
        if (value instanceof OffsetDateTime odt) return Optional.of(odt);
        if (value instanceof ZonedDateTime zdt) return Optional.of(zdt.toOffsetDateTime());
        if (value instanceof Instant i) return Optional.of(i.atOffset(ZoneOffset.UTC));
        if (value instanceof LocalDateTime ldt) return Optional.of(ldt.atOffset(ZoneOffset.UTC));
        if (value instanceof LocalDate ld) return Optional.of(ld.atStartOfDay().atOffset(ZoneOffset.UTC));
        if (value instanceof TemporalAccessor) return Optional.empty();

        String s = value.toString().trim();
        if (s.isEmpty()) return Optional.empty();
        try {
            return Optional.of(OffsetDateTime.parse(s));
        } catch (DateTimeParseException ignored) {
            // 오프셋 없는 형식으로 재시도
        }
        try {
            return Optional.of(LocalDateTime.parse(s).atOffset(ZoneOffset.UTC));
        } catch (DateTimeParseException ignored) {
            // 날짜만 있는 형식으로 재시도
        }
        try {
            return Optional.of(LocalDate.parse(s).atStartOfDay().atOffset(ZoneOffset.UTC));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    public static double ageDays(OffsetDateTime date, Clock clock) {
        return Duration.between(date.toInstant(), clock.instant()).toSeconds() / 86_400.0;
    }

    public static Optional<Double> parseDouble(Object value) {
        if (value instanceof Number n) return Optional.of(n.doubleValue());
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Optional.of(Double.parseDouble(s.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
