package com.worktime.backend.global.common.time;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DateTimesTest {

    private static final ZoneId BERLIN = ZoneId.of("Europe/Berlin");

    @Test
    @DisplayName("wall-clock time is placed on the entry date in the configured zone")
    void parseTimestampPlacesWallClockTimeInZone() {
        OffsetDateTime summer = DateTimes.parseTimestamp(LocalDate.of(2025, 5, 1), "09:00", BERLIN);
        OffsetDateTime winter = DateTimes.parseTimestamp(LocalDate.of(2025, 1, 15), "09:00", BERLIN);

        assertThat(summer).isEqualTo(OffsetDateTime.parse("2025-05-01T09:00+02:00"));
        assertThat(winter).isEqualTo(OffsetDateTime.parse("2025-01-15T09:00+01:00"));
    }

    @Test
    void parseTimestampKeepsExplicitOffset() {
        OffsetDateTime parsed = DateTimes.parseTimestamp(LocalDate.of(2025, 5, 1), "2025-05-01T09:00:00Z", BERLIN);

        assertThat(parsed).isEqualTo(OffsetDateTime.parse("2025-05-01T09:00Z"));
    }

    @Test
    void parseTimestampRejectsGarbage() {
        assertThatThrownBy(() -> DateTimes.parseTimestamp(LocalDate.of(2025, 5, 1), "nine", BERLIN))
                .isInstanceOf(DateTimeParseException.class);
    }

    @Test
    @DisplayName("a wall-clock time inside the spring-forward gap is refused instead of shifted")
    void parseTimestampRejectsDaylightSavingGap() {
        assertThatThrownBy(() -> DateTimes.parseTimestamp(LocalDate.of(2025, 3, 30), "02:30", BERLIN))
                .isInstanceOf(DateTimeException.class)
                .isNotInstanceOf(DateTimeParseException.class)
                .hasMessageContaining("2025-03-30T02:30");

        assertThat(DateTimes.parseTimestamp(LocalDate.of(2025, 3, 30), "03:00", BERLIN))
                .isEqualTo(OffsetDateTime.parse("2025-03-30T03:00+02:00"));
    }

    @Test
    void parseTimestampTakesEarlierOffsetInAutumnOverlap() {
        assertThat(DateTimes.parseTimestamp(LocalDate.of(2025, 10, 26), "02:30", BERLIN))
                .isEqualTo(OffsetDateTime.parse("2025-10-26T02:30+02:00"));
    }

    @Test
    void parseDateAcceptsIsoAndDisplayForm() {
        assertThat(DateTimes.parseDate("2025-12-24")).isEqualTo(LocalDate.of(2025, 12, 24));
        assertThat(DateTimes.parseDate("24.12.2025")).isEqualTo(LocalDate.of(2025, 12, 24));
        assertThat(DateTimes.formatDisplayDate(LocalDate.of(2025, 6, 1))).isEqualTo("01.06.2025");
    }

    @Test
    @DisplayName("nearest rounding goes half up, up and down bound the value")
    void roundHonoursMethod() {
        OffsetDateTime sevenPast = OffsetDateTime.parse("2025-05-01T09:07:00+02:00");
        OffsetDateTime eightPast = OffsetDateTime.parse("2025-05-01T09:08:00+02:00");
        OffsetDateTime halfway = OffsetDateTime.parse("2025-05-01T09:07:30+02:00");

        assertThat(DateTimes.round(sevenPast, 15, RoundingMethod.NEAREST))
                .isEqualTo(OffsetDateTime.parse("2025-05-01T09:00+02:00"));
        assertThat(DateTimes.round(eightPast, 15, RoundingMethod.NEAREST))
                .isEqualTo(OffsetDateTime.parse("2025-05-01T09:15+02:00"));
        assertThat(DateTimes.round(halfway, 15, RoundingMethod.NEAREST))
                .isEqualTo(OffsetDateTime.parse("2025-05-01T09:15+02:00"));
        assertThat(DateTimes.round(sevenPast, 15, RoundingMethod.UP))
                .isEqualTo(OffsetDateTime.parse("2025-05-01T09:15+02:00"));
        assertThat(DateTimes.round(eightPast, 15, RoundingMethod.DOWN))
                .isEqualTo(OffsetDateTime.parse("2025-05-01T09:00+02:00"));
    }

    @Test
    void roundKeepsAlignedValuesAndSkipsWhenDisabled() {
        OffsetDateTime aligned = OffsetDateTime.parse("2025-05-01T17:30:00+02:00");
        OffsetDateTime odd = OffsetDateTime.parse("2025-05-01T17:31:10+02:00");

        assertThat(DateTimes.round(aligned, 15, RoundingMethod.UP)).isEqualTo(aligned);
        assertThat(DateTimes.round(odd, 0, RoundingMethod.NEAREST)).isEqualTo(odd);
    }

    @Test
    void roundUpMayCrossMidnight() {
        OffsetDateTime lateEvening = OffsetDateTime.parse("2025-05-01T23:50:00+02:00");

        assertThat(DateTimes.round(lateEvening, 15, RoundingMethod.UP))
                .isEqualTo(OffsetDateTime.parse("2025-05-02T00:00+02:00"));
    }

    @Test
    void minutesToHoursUsesTwoDecimalsHalfUp() {
        assertThat(DateTimes.minutesToHours(465)).isEqualByComparingTo(new BigDecimal("7.75"));
        assertThat(DateTimes.minutesToHours(1)).isEqualByComparingTo(new BigDecimal("0.02"));
        assertThat(DateTimes.minutesToHours(0)).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(DateTimes.hoursToMinutes(8.5)).isEqualTo(510);
    }

    @Test
    void isoWeekStartsOnMonday() {
        DateRange week = DateTimes.isoWeekOf(LocalDate.of(2025, 6, 8));

        assertThat(week.start()).isEqualTo(LocalDate.of(2025, 6, 2));
        assertThat(week.end()).isEqualTo(LocalDate.of(2025, 6, 8));
        assertThat(DateTimes.inclusiveDays(LocalDate.of(2025, 6, 1), LocalDate.of(2025, 6, 5))).isEqualTo(5);
    }

    @Test
    void dateRangeIntersectionClipsToOverlap() {
        DateRange leave = new DateRange(LocalDate.of(2025, 5, 28), LocalDate.of(2025, 6, 3));
        DateRange june = new DateRange(LocalDate.of(2025, 6, 1), LocalDate.of(2025, 6, 30));

        assertThat(leave.intersect(june)).contains(new DateRange(LocalDate.of(2025, 6, 1), LocalDate.of(2025, 6, 3)));
        assertThat(june.intersect(new DateRange(LocalDate.of(2025, 7, 1), LocalDate.of(2025, 7, 2)))).isEmpty();
    }

    @Test
    void touchingIntervalsDoNotOverlap() {
        TimeInterval morning = TimeInterval.of(
                OffsetDateTime.parse("2025-05-01T09:00+02:00"), OffsetDateTime.parse("2025-05-01T12:00+02:00"));
        TimeInterval afternoon = TimeInterval.of(
                OffsetDateTime.parse("2025-05-01T12:00+02:00"), OffsetDateTime.parse("2025-05-01T15:00+02:00"));
        TimeInterval sameInstantOtherOffset = TimeInterval.of(
                OffsetDateTime.parse("2025-05-01T09:30Z"), OffsetDateTime.parse("2025-05-01T10:30Z"));

        assertThat(morning.overlaps(afternoon)).isFalse();
        assertThat(afternoon.overlaps(morning)).isFalse();
        assertThat(morning.overlaps(sameInstantOtherOffset)).isTrue();
    }
}
