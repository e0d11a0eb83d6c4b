package io.pulse4j.utils;

import io.pulse4j.core.exception.TimeParseException;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.util.EnumSet;
import java.util.List;

import static java.time.DayOfWeek.FRIDAY;
import static java.time.DayOfWeek.MONDAY;
import static java.time.DayOfWeek.SATURDAY;
import static java.time.DayOfWeek.SUNDAY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SkipDaysTest {

    @Test
    void parseShouldAcceptNamesAbbreviationsAndNumbers() {
        assertThat(SkipDays.parse("Saturday, sun")).containsExactlyInAnyOrder(SATURDAY, SUNDAY);
        assertThat(SkipDays.parse("0 6")).containsExactlyInAnyOrder(SUNDAY, SATURDAY);
        assertThat(SkipDays.parse("7,1")).containsExactlyInAnyOrder(SUNDAY, MONDAY);
        assertThat(SkipDays.parse("weekend")).containsExactlyInAnyOrder(SATURDAY, SUNDAY);
        assertThat(SkipDays.parse("weekdays")).hasSize(5).doesNotContain(SATURDAY, SUNDAY);
        assertThat(SkipDays.parse(List.of("mon", "FRIDAY"))).containsExactlyInAnyOrder(MONDAY, FRIDAY);
        assertThat(SkipDays.parse((String) null)).isEmpty();
    }

    @Test
    void parseShouldRejectUnknownTokens() {
        assertThatThrownBy(() -> SkipDays.parse("caturday")).isInstanceOf(TimeParseException.class);
        assertThatThrownBy(() -> SkipDays.parse("8")).isInstanceOf(TimeParseException.class);
    }

    @Test
    void formatShouldBeCanonical() {
        assertThat(SkipDays.format(EnumSet.of(SUNDAY, MONDAY))).isEqualTo("MONDAY,SUNDAY");
        assertThat(SkipDays.format(EnumSet.noneOf(DayOfWeek.class))).isNull();
    }
}
