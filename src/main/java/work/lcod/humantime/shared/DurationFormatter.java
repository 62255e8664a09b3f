package work.lcod.humantime.shared;

import work.lcod.humantime.api.HumanDuration;

/**
 * Renders a {@link HumanDuration} as text that {@link DurationParser} reads back exactly,
 * e.g. {@code 1year 2months 3days 4h 5m 6s 7ms 8us 9ns}.
 *
 * <p>Years and months use the same 365.25 and 30.44 day constants as the parser.
 */
public final class DurationFormatter {
    private static final long SECONDS_PER_YEAR = 31_557_600L;
    private static final long SECONDS_PER_MONTH = 2_630_016L;
    private static final long SECONDS_PER_DAY = 86_400L;

    private DurationFormatter() {}

    public static String format(HumanDuration duration) {
        if (duration.isZero()) {
            return "0s";
        }
        long secs = duration.seconds();
        long years = Long.divideUnsigned(secs, SECONDS_PER_YEAR);
        long yearRest = Long.remainderUnsigned(secs, SECONDS_PER_YEAR);
        long months = yearRest / SECONDS_PER_MONTH;
        long monthRest = yearRest % SECONDS_PER_MONTH;
        long days = monthRest / SECONDS_PER_DAY;
        long daySeconds = monthRest % SECONDS_PER_DAY;

        int nanos = duration.nanos();
        var out = new StringBuilder();
        plural(out, years, "year");
        plural(out, months, "month");
        plural(out, days, "day");
        item(out, daySeconds / 3_600, "h");
        item(out, daySeconds % 3_600 / 60, "m");
        item(out, daySeconds % 60, "s");
        item(out, nanos / 1_000_000, "ms");
        item(out, nanos / 1_000 % 1_000, "us");
        item(out, nanos % 1_000, "ns");
        return out.toString();
    }

    private static void plural(StringBuilder out, long value, String name) {
        if (value > 0) {
            item(out, value, name);
            if (value > 1) {
                out.append('s');
            }
        }
    }

    private static void item(StringBuilder out, long value, String name) {
        if (value > 0) {
            if (out.length() > 0) {
                out.append(' ');
            }
            out.append(Long.toUnsignedString(value)).append(name);
        }
    }
}
