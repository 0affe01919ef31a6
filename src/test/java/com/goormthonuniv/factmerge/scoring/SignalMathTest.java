package com.goormthonuniv.factmerge.scoring;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SignalMathTest {

    @Test
    void halfLifeDecay() {
        assertThat(SignalMath.halfLifeDecay(365, 365, 0.1)).isCloseTo(0.5, within(1e-9));
        assertThat(SignalMath.halfLifeDecay(0, 365, 0.1)).isEqualTo(1.0);
        assertThat(SignalMath.halfLifeDecay(-10, 365, 0.1)).isEqualTo(1.0);
        assertThat(SignalMath.halfLifeDecay(365 * 20, 365, 0.1)).isEqualTo(0.1);
    }

    @Test
    void logScaledCitations() {
        assertThat(SignalMath.logScaled(null, 5000)).isEqualTo(0.0);
        assertThat(SignalMath.logScaled(0, 5000)).isEqualTo(0.0);
        assertThat(SignalMath.logScaled(5000, 5000)).isCloseTo(1.0, within(1e-12));
        assertThat(SignalMath.logScaled(20000, 5000)).isEqualTo(1.0);
        assertThat(SignalMath.logScaled(100, 5000)).isBetween(0.5, 0.6);
    }

    @Test
    void saturatingUsesZeroScoreOnlyForNoMatches() {
        assertThat(SignalMath.saturating(0, 0.08, 0.2)).isEqualTo(0.2);
        assertThat(SignalMath.saturating(1, 0.08, 0.2)).isEqualTo(0.08);
        assertThat(SignalMath.saturating(20, 0.08, 0.2)).isEqualTo(1.0);
    }

    @Test
    void parsesCommonDateShapes() {
        OffsetDateTime expected = OffsetDateTime.of(2024, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);
        assertThat(SignalMath.parseDate("2024-01-01T00:00:00Z")).contains(expected);
        assertThat(SignalMath.parseDate("2024-01-01T00:00:00")).contains(expected);
        assertThat(SignalMath.parseDate("2024-01-01")).contains(expected);
        assertThat(SignalMath.parseDate(LocalDate.of(2024, 1, 1))).contains(expected);
        assertThat(SignalMath.parseDate("last tuesday")).isEmpty();
        assertThat(SignalMath.parseDate(null)).isEmpty();
    }

    @Test
    void ageInDays() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-11T00:00:00Z"), ZoneOffset.UTC);
        assertThat(SignalMath.ageDays(OffsetDateTime.parse("2024-01-01T00:00:00Z"), clock)).isEqualTo(10.0);
    }

    @Test
    void roundingAndBands() {
        assertThat(SignalMath.round4(0.123456)).isEqualTo(0.1235);
        assertThat(SignalMath.clamp01(1.7)).isEqualTo(1.0);
        assertThat(SignalMath.clamp01(Double.NaN)).isEqualTo(0.0);
        assertThat(SignalMath.band(0.85, 0.8, 0.5, "h", "m", "l")).isEqualTo("h");
        assertThat(SignalMath.band(0.5, 0.8, 0.5, "h", "m", "l")).isEqualTo("m");
        assertThat(SignalMath.band(0.49, 0.8, 0.5, "h", "m", "l")).isEqualTo("l");
    }
}
