package work.lcod.humantime.shared;

import java.util.Optional;
import work.lcod.humantime.api.DurationParseException;
import work.lcod.humantime.api.DurationParseException.SpanFailure;
import work.lcod.humantime.api.HumanDuration;
import work.lcod.humantime.units.DurationUnit;
import work.lcod.humantime.units.UnitSuffixResolver;

/**
 * Parses user-friendly durations such as {@code 1hour 12min 5s}.
 *
 * <p>The input is a sequence of spans, each a number followed by a unit suffix, optionally
 * separated by whitespace or the word {@code and}. Supported suffixes:
 * <ul>
 *   <li>{@code nanos}, {@code nsec}, {@code ns}</li>
 *   <li>{@code micros}, {@code usec}, {@code us}</li>
 *   <li>{@code millis}, {@code msec}, {@code ms}</li>
 *   <li>{@code seconds}, {@code second}, {@code secs}, {@code sec}, {@code s}</li>
 *   <li>{@code minutes}, {@code minute}, {@code mins}, {@code min}, {@code m}</li>
 *   <li>{@code hours}, {@code hour}, {@code hrs}, {@code hr}, {@code h}, {@code H}</li>
 *   <li>{@code days}, {@code day}, {@code dys}, {@code dy}, {@code d}, {@code D}</li>
 *   <li>{@code weeks}, {@code week}, {@code wks}, {@code wk}, {@code w}, {@code W}</li>
 *   <li>{@code months}, {@code month}, {@code mths}, {@code mth}, {@code M} (30.44 days)</li>
 *   <li>{@code years}, {@code year}, {@code yrs}, {@code yr}, {@code y}, {@code Y} (365.25 days)</li>
 * </ul>
 * Numbers may be fractional or use an exponent ({@code .5m}, {@code 11e-1 days}). A bare
 * {@code 0} is the only number accepted without a unit.
 */
public final class DurationParser {
    private static final String SUPPORTED_UNITS =
        "ns, us, ms, sec, min, hours, days, weeks, months, years (and few variations)";
    private static final String AND = "and";

    private DurationParser() {}

    /**
     * @throws DurationParseException when the input is empty, malformed or leaves trailing text
     */
    public static HumanDuration parse(String raw) {
        String text = raw == null ? "" : raw.strip();
        if (text.isEmpty()) {
            throw DurationParseException.emptyInput();
        }
        if ("0".equals(text)) {
            return HumanDuration.ZERO;
        }

        HumanDuration total = HumanDuration.ZERO;
        int position = 0;
        int spans = 0;
        while (position < text.length()) {
            Span span;
            try {
                span = readSpan(text, position);
            } catch (DurationParseException ex) {
                if (spans == 0) {
                    throw ex;
                }
                throw DurationParseException.parseFailed(text, position, ex.spanFailure());
            }
            try {
                total = total.plus(span.duration());
            } catch (ArithmeticException ex) {
                throw outOfRange(text, position, span.literal());
            }
            spans++;
            position = skipSeparator(text, span.end());
        }
        return total;
    }

    /**
     * Like {@link #parse(String)}, but treats a missing or blank value as "not set".
     */
    public static Optional<HumanDuration> parseOptional(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(parse(raw));
    }

    private record Span(HumanDuration duration, String literal, int end) {}

    private static Span readSpan(String text, int start) {
        int literalEnd = NumericLiteral.scan(text, start);
        if (literalEnd == start) {
            throw missingNumber(text, start);
        }
        String literal = text.substring(start, literalEnd);
        double value = Double.parseDouble(literal);
        if (!NumericLiteral.inRange(value)) {
            throw outOfRange(text, start, literal);
        }

        int unitStart = skipWhitespace(text, literalEnd);
        var match = UnitSuffixResolver.resolve(text, unitStart)
            .orElseThrow(() -> unknownUnit(text, unitStart, literal));

        HumanDuration duration = convert(value, match.unit());
        if (duration == null) {
            throw outOfRange(text, start, literal);
        }
        return new Span(duration, literal, unitStart + match.length());
    }

    /**
     * Converts one span; {@code null} when the whole seconds do not fit 64 unsigned bits.
     */
    static HumanDuration convert(double value, DurationUnit unit) {
        double totalSeconds = unit.toSeconds(value);
        if (!(totalSeconds < NumericLiteral.MAX_VALUE)) {
            return null;
        }
        double whole = Math.floor(totalSeconds);
        long nanos = Math.round((totalSeconds - whole) * 1e9);
        return HumanDuration.of(toUnsignedLong(whole), nanos);
    }

    private static long toUnsignedLong(double whole) {
        if (whole < 0x1p63) {
            return (long) whole;
        }
        return (long) (whole - 0x1p63) ^ Long.MIN_VALUE;
    }

    private static int skipSeparator(String text, int index) {
        int afterSpace = skipWhitespace(text, index);
        if (text.startsWith(AND, afterSpace)) {
            return skipWhitespace(text, afterSpace + AND.length());
        }
        return afterSpace;
    }

    private static int skipWhitespace(String text, int index) {
        while (index < text.length() && Character.isWhitespace(text.charAt(index))) {
            index++;
        }
        return index;
    }

    private static DurationParseException missingNumber(String text, int position) {
        if (position < text.length() && text.charAt(position) == '-'
            && NumericLiteral.scan(text, position + 1) > position + 1) {
            String literal = text.substring(position, NumericLiteral.scan(text, position + 1));
            return outOfRange(text, position, literal);
        }
        return DurationParseException.malformed(
            text,
            position,
            SpanFailure.NUMERIC_LITERAL,
            "expected number at " + position
        );
    }

    private static DurationParseException unknownUnit(String text, int position, String literal) {
        String message;
        if (position >= text.length()) {
            message = "time unit needed, for example " + literal + "sec or " + literal + "ms";
        } else if (Character.isLetter(text.charAt(position))) {
            int end = position;
            while (end < text.length() && Character.isLetter(text.charAt(end))) {
                end++;
            }
            message = "unknown time unit \"" + text.substring(position, end) + "\", supported units: " + SUPPORTED_UNITS;
        } else {
            message = "invalid character at " + position;
        }
        return DurationParseException.malformed(text, position, SpanFailure.UNIT_SUFFIX, message);
    }

    private static DurationParseException outOfRange(String text, int position, String literal) {
        return DurationParseException.malformed(
            text,
            position,
            SpanFailure.OUT_OF_RANGE,
            "number \"" + literal + "\" at " + position + " is out of range for a duration"
        );
    }
}
