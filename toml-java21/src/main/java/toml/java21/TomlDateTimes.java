package toml.java21;

/// Date and time recognition for [TomlLexer].
///
/// Matching validates the calendar, not just the shape: months are 1-12,
/// days are checked against the length of the month (with the Gregorian leap
/// year rule), hours are at most 23 and minutes and seconds at most 59. Any
/// failure means no match.
final class TomlDateTimes {

    private TomlDateTimes() {}

    /// Matches a time, a date, a local date-time or an offset date-time at `pos`.
    /// @return the match, or null
    static TomlLexer.Match match(String s, int pos) {
        final int time = time(s, pos);
        if (time > 0) {
            return new TomlLexer.Match(SyntaxKind.TIME, time);
        }

        final int date = date(s, pos);
        if (date < 0) {
            return null;
        }

        final int separator = pos + date;
        if (separator < s.length()) {
            final char c = s.charAt(separator);
            if (c == 'T' || c == 't' || c == ' ') {
                final int timeLen = time(s, separator + 1);
                if (timeLen > 0) {
                    final int total = date + 1 + timeLen;
                    final int end = pos + total;
                    if (end < s.length() && (s.charAt(end) == 'Z' || s.charAt(end) == 'z')) {
                        return new TomlLexer.Match(SyntaxKind.DATE_TIME_OFFSET, total + 1);
                    }
                    final int offset = offset(s, end);
                    if (offset > 0) {
                        return new TomlLexer.Match(SyntaxKind.DATE_TIME_OFFSET, total + offset);
                    }
                    return new TomlLexer.Match(SyntaxKind.DATE_TIME_LOCAL, total);
                }
            }
        }
        return new TomlLexer.Match(SyntaxKind.DATE, date);
    }

    /// `YYYY-MM-DD`
    /// @return 10, or -1
    static int date(String s, int pos) {
        if (pos + 10 > s.length()
                || !digits(s, pos, 4) || s.charAt(pos + 4) != '-'
                || !digits(s, pos + 5, 2) || s.charAt(pos + 7) != '-'
                || !digits(s, pos + 8, 2)) {
            return -1;
        }
        final int year = number(s, pos, 4);
        final int month = number(s, pos + 5, 2);
        final int day = number(s, pos + 8, 2);
        if (month < 1 || month > 12) {
            return -1;
        }
        if (day < 1 || day > daysInMonth(year, month)) {
            return -1;
        }
        return 10;
    }

    static int daysInMonth(int year, int month) {
        return switch (month) {
            case 4, 6, 9, 11 -> 30;
            case 2 -> isLeapYear(year) ? 29 : 28;
            default -> 31;
        };
    }

    static boolean isLeapYear(int year) {
        return (year % 4 == 0 && year % 100 != 0) || year % 400 == 0;
    }

    /// `HH:MM:SS` with an optional fraction introduced by `.` or `,`
    /// @return the length of the time, or -1
    static int time(String s, int pos) {
        if (pos + 8 > s.length()
                || !digits(s, pos, 2) || s.charAt(pos + 2) != ':'
                || !digits(s, pos + 3, 2) || s.charAt(pos + 5) != ':'
                || !digits(s, pos + 6, 2)) {
            return -1;
        }
        if (number(s, pos, 2) > 23 || number(s, pos + 3, 2) > 59 || number(s, pos + 6, 2) > 59) {
            return -1;
        }
        int len = 8;
        // a separator without a digit after it is not part of the time, as in `[07:32:00, 08:00:00]`
        if (pos + len + 1 < s.length()
                && (s.charAt(pos + len) == '.' || s.charAt(pos + len) == ',')
                && TomlLexer.isDigit(s.charAt(pos + len + 1))) {
            len++;
            while (pos + len < s.length() && TomlLexer.isDigit(s.charAt(pos + len))) {
                len++;
            }
        }
        return len;
    }

    /// `+HH:MM` or `-HH:MM`
    /// @return 6, or -1
    static int offset(String s, int pos) {
        if (pos + 6 > s.length()
                || (s.charAt(pos) != '+' && s.charAt(pos) != '-')
                || !digits(s, pos + 1, 2) || s.charAt(pos + 3) != ':'
                || !digits(s, pos + 4, 2)) {
            return -1;
        }
        if (number(s, pos + 1, 2) > 23 || number(s, pos + 4, 2) > 59) {
            return -1;
        }
        return 6;
    }

    private static boolean digits(String s, int pos, int count) {
        for (int i = pos; i < pos + count; i++) {
            if (!TomlLexer.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static int number(String s, int pos, int count) {
        int value = 0;
        for (int i = pos; i < pos + count; i++) {
            value = value * 10 + (s.charAt(i) - '0');
        }
        return value;
    }
}
