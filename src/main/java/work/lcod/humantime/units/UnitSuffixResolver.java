package work.lcod.humantime.units;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Maps unit suffixes to {@link DurationUnit}s.
 *
 * <p>Matching is an exact, case-sensitive prefix test at the current position. Families are
 * tried in a fixed order so that the longer, rarer spellings win over the single letters that
 * would otherwise swallow their first character ({@code ms} before {@code m}, {@code mth}
 * before {@code m}, and so on).
 */
public final class UnitSuffixResolver {
    private static final List<Suffix> TABLE = buildTable();

    private UnitSuffixResolver() {}

    /**
     * A recognised spelling of a unit.
     */
    public record Suffix(String text, DurationUnit unit) {}

    /**
     * Result of a successful match: the unit and how many characters the suffix used.
     */
    public record Match(DurationUnit unit, int length) {}

    public static Optional<Match> resolve(CharSequence text, int offset) {
        for (Suffix suffix : TABLE) {
            if (startsWith(text, offset, suffix.text())) {
                return Optional.of(new Match(suffix.unit(), suffix.text().length()));
            }
        }
        return Optional.empty();
    }

    /**
     * All suffixes in matching order.
     */
    static List<Suffix> suffixes() {
        return TABLE;
    }

    public static List<String> suffixesOf(DurationUnit unit) {
        List<String> result = new ArrayList<>();
        for (Suffix suffix : TABLE) {
            if (suffix.unit() == unit) {
                result.add(suffix.text());
            }
        }
        return result;
    }

    private static boolean startsWith(CharSequence text, int offset, String prefix) {
        if (text.length() - offset < prefix.length()) {
            return false;
        }
        for (int i = 0; i < prefix.length(); i++) {
            if (text.charAt(offset + i) != prefix.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    private static List<Suffix> buildTable() {
        List<Suffix> table = new ArrayList<>();
        add(table, DurationUnit.MONTH, "months", "month", "mths", "mth", "M");
        add(table, DurationUnit.DAY, "days", "day", "dys", "dy", "d", "D");
        add(table, DurationUnit.WEEK, "weeks", "week", "wks", "wk", "w", "W");
        add(table, DurationUnit.YEAR, "years", "year", "yrs", "yr", "y", "Y");
        add(table, DurationUnit.NANOSECOND, "nanos", "nsec", "ns");
        add(table, DurationUnit.MICROSECOND, "micros", "usec", "us");
        add(table, DurationUnit.MILLISECOND, "millis", "msec", "ms");
        add(table, DurationUnit.SECOND, "seconds", "second", "secs", "sec", "s");
        add(table, DurationUnit.MINUTE, "minutes", "minute", "mins", "min", "m");
        add(table, DurationUnit.HOUR, "hours", "hour", "hrs", "hr", "h", "H");
        return Collections.unmodifiableList(table);
    }

    private static void add(List<Suffix> table, DurationUnit unit, String... spellings) {
        for (String spelling : spellings) {
            table.add(new Suffix(spelling, unit));
        }
    }
}
