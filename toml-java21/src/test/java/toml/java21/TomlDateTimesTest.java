package toml.java21;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TomlDateTimesTest extends TomlTestBase {

    @Test
    void testLeapYears() {
        assertThat(TomlDateTimes.isLeapYear(2024)).isTrue();
        assertThat(TomlDateTimes.isLeapYear(2000)).isTrue();
        assertThat(TomlDateTimes.isLeapYear(2023)).isFalse();
        assertThat(TomlDateTimes.isLeapYear(1900)).isFalse();
    }

    @Test
    void testDaysInMonth() {
        assertThat(TomlDateTimes.daysInMonth(2023, 2)).isEqualTo(28);
        assertThat(TomlDateTimes.daysInMonth(2024, 2)).isEqualTo(29);
        assertThat(TomlDateTimes.daysInMonth(2024, 4)).isEqualTo(30);
        assertThat(TomlDateTimes.daysInMonth(2024, 12)).isEqualTo(31);
    }

    @Test
    void testDateValidation() {
        assertThat(TomlDateTimes.date("1979-05-27", 0)).isEqualTo(10);
        assertThat(TomlDateTimes.date("2023-13-01", 0)).isEqualTo(-1);
        assertThat(TomlDateTimes.date("2023-00-10", 0)).isEqualTo(-1);
        assertThat(TomlDateTimes.date("2023-04-31", 0)).isEqualTo(-1);
        assertThat(TomlDateTimes.date("2023-04-0", 0)).isEqualTo(-1);
    }

    @Test
    void testTimeValidation() {
        assertThat(TomlDateTimes.time("23:59:59", 0)).isEqualTo(8);
        assertThat(TomlDateTimes.time("23:59:59.123", 0)).isEqualTo(12);
        assertThat(TomlDateTimes.time("23:59:59,5", 0)).isEqualTo(10);
        assertThat(TomlDateTimes.time("24:00:00", 0)).isEqualTo(-1);
        assertThat(TomlDateTimes.time("12:60:00", 0)).isEqualTo(-1);
        assertThat(TomlDateTimes.time("12:00:00.", 0)).isEqualTo(8);
        assertThat(TomlDateTimes.time("12:00:00, 13:00:00", 0)).isEqualTo(8);
    }

    @Test
    void testOffsets() {
        assertThat(TomlDateTimes.offset("+05:30", 0)).isEqualTo(6);
        assertThat(TomlDateTimes.offset("-07:00", 0)).isEqualTo(6);
        assertThat(TomlDateTimes.offset("+25:00", 0)).isEqualTo(-1);
        assertThat(TomlDateTimes.offset("05:30", 0)).isEqualTo(-1);
    }

    @Test
    void testMatchAtOffset() {
        final var match = TomlDateTimes.match("x = 1979-05-27T07:32:00+01:00", 4);
        assertThat(match).isNotNull();
        assertThat(match.kind()).isEqualTo(SyntaxKind.DATE_TIME_OFFSET);
        assertThat(match.length()).isEqualTo(25);
    }

    @Test
    void testDateFollowedByInvalidTimeIsJustADate() {
        final var match = TomlDateTimes.match("1979-05-27T25:00:00", 0);
        assertThat(match).isNotNull();
        assertThat(match.kind()).isEqualTo(SyntaxKind.DATE);
        assertThat(match.length()).isEqualTo(10);
    }
}
