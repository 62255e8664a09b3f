package work.lcod.humantime.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import work.lcod.humantime.api.DurationParseException;
import work.lcod.humantime.api.DurationParseException.Kind;
import work.lcod.humantime.api.DurationParseException.SpanFailure;
import work.lcod.humantime.api.HumanDuration;

class DurationParserTest {
    @ParameterizedTest
    @CsvSource({
        "1, nanos, 0, 1",
        "2, nsec, 0, 2",
        "3, ns, 0, 3",
        "1, micros, 0, 1000",
        "2, usec, 0, 2000",
        "3, us, 0, 3000",
        "1, millis, 0, 1000000",
        "2, msec, 0, 2000000",
        "3, ms, 0, 3000000",
        "1, seconds, 1, 0",
        "2, second, 2, 0",
        "3, secs, 3, 0",
        "4, sec, 4, 0",
        "5, s, 5, 0",
        "1, minutes, 60, 0",
        "2, minute, 120, 0",
        "3, mins, 180, 0",
        "4, min, 240, 0",
        "5, m, 300, 0",
        "1, hours, 3600, 0",
        "2, hour, 7200, 0",
        "3, hrs, 10800, 0",
        "4, hr, 14400, 0",
        "5, h, 18000, 0",
        "5, H, 18000, 0",
        "1, days, 86400, 0",
        "2, day, 172800, 0",
        "3, dys, 259200, 0",
        "4, dy, 345600, 0",
        "5, d, 432000, 0",
        "5, D, 432000, 0",
        "1, weeks, 604800, 0",
        "2, week, 1209600, 0",
        "3, wks, 1814400, 0",
        "4, wk, 2419200, 0",
        "5, w, 3024000, 0",
        "5, W, 3024000, 0",
        "1, months, 2630016, 0",
        "2, month, 5260032, 0",
        "3, mths, 7890048, 0",
        "4, mth, 10520064, 0",
        "5, M, 13150080, 0",
        "1, years, 31557600, 0",
        "2, year, 63115200, 0",
        "3, yrs, 94672800, 0",
        "4, yr, 126230400, 0",
        "5, y, 157788000, 0",
        "5, Y, 157788000, 0"
    })
    void parsesEverySuffixWithAndWithoutSpace(String number, String suffix, long seconds, int nanos) {
        var expected = new HumanDuration(seconds, nanos);
        assertEquals(expected, DurationParser.parse(number + suffix));
        assertEquals(expected, DurationParser.parse(number + " " + suffix));
    }

    @Test
    void parsesFractionsAndExponents() {
        assertEquals(HumanDuration.ofSeconds(30), DurationParser.parse(".5m"));
        assertEquals(HumanDuration.ofSeconds(90), DurationParser.parse("1.5m"));
        assertEquals(HumanDuration.ofSeconds(90), DurationParser.parse("1.5 mins"));
        assertEquals(HumanDuration.ofSeconds(297_216), DurationParser.parse("3.44d"));
        assertEquals(new HumanDuration(8, 640_000_000), DurationParser.parse("0.0001 days"));
        assertEquals(HumanDuration.ofSeconds(8_640), DurationParser.parse("0.1 days"));
        assertEquals(HumanDuration.ofSeconds(95_040), DurationParser.parse("11e-1 days"));
        assertEquals(HumanDuration.ofSeconds(96_768), DurationParser.parse("11.2e-1 days"));
        assertEquals(HumanDuration.ofSeconds(2_000), DurationParser.parse("2e3s"));
        assertEquals(HumanDuration.ofSeconds(5), DurationParser.parse("5.s"));
    }

    @Test
    void carriesRoundedNanosIntoSeconds() {
        assertEquals(HumanDuration.ofSeconds(1), DurationParser.parse("0.9999999999s"));
        assertEquals(HumanDuration.ofSeconds(61), DurationParser.parse("1m 0.9999999999s"));
    }

    @Test
    void roundsHalfNanosecondAwayFromZero() {
        assertEquals(new HumanDuration(0, 1), DurationParser.parse("0.0000000005s"));
        assertEquals(new HumanDuration(0, 2), DurationParser.parse("1.5ns"));
    }

    @Test
    void acceptsBareZeroAndZeroWithUnit() {
        assertEquals(HumanDuration.ZERO, DurationParser.parse("0"));
        assertEquals(HumanDuration.ZERO, DurationParser.parse("  0 "));
        assertEquals(HumanDuration.ZERO, DurationParser.parse("0s"));
    }

    @Test
    void combinesSpans() {
        assertEquals(new HumanDuration(1_200, 17), DurationParser.parse("20 min 17 nsec"));
        assertEquals(new HumanDuration(1_200, 17), DurationParser.parse("20min17nsec"));
        assertEquals(HumanDuration.ofSeconds(8_100), DurationParser.parse("2h 15m"));
        assertEquals(HumanDuration.ofSeconds(8_100), DurationParser.parse("2hand15m"));
        assertEquals(HumanDuration.ofSeconds(8_100), DurationParser.parse("2h and 15m"));
        assertEquals(HumanDuration.ofSeconds(8_100), DurationParser.parse("2hand 15m"));
        assertEquals(HumanDuration.ofSeconds(9_420), DurationParser.parse("2h 37min"));
        assertEquals(HumanDuration.ofSeconds(150), DurationParser.parse("2 minutes and 30 seconds"));
        assertEquals(HumanDuration.ofSeconds(7_320), DurationParser.parse("2hrs2mins"));
        assertEquals(HumanDuration.ofSeconds(172_920), DurationParser.parse("2days and 2mins"));
        assertEquals(new HumanDuration(0, 32_000_000), DurationParser.parse("32ms"));
        assertEquals(HumanDuration.ofSeconds(8_100), DurationParser.parse("2h\t\n15m"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", " and ", "and", "and ", " and", "\t"})
    void separatorsAddSpans(String separator) {
        var a = DurationParser.parse("1.5 days");
        var b = DurationParser.parse("7ms");
        assertEquals(a.plus(b), DurationParser.parse("1.5 days" + separator + "7ms"));
    }

    @Test
    void acceptsDanglingAnd() {
        assertEquals(HumanDuration.ofSeconds(7_200), DurationParser.parse("2h and"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"ns", "us", "ms", "s", "m", "h", "d", "w", "M", "Y"})
    void rejectsLiteralsBeyondUnsigned64Bits(String suffix) {
        var input = "100000000000000000000" + suffix;
        var ex = assertThrows(DurationParseException.class, () -> DurationParser.parse(input));
        assertEquals(Kind.MALFORMED_SPAN, ex.kind());
        assertEquals(SpanFailure.OUT_OF_RANGE, ex.spanFailure());
        assertEquals(0, ex.position());
        assertEquals(input, ex.fragment());
    }

    @Test
    void rejectsSpansWhoseSecondsOverflowAfterConversion() {
        var ex = assertThrows(DurationParseException.class, () -> DurationParser.parse("1e19 years"));
        assertEquals(SpanFailure.OUT_OF_RANGE, ex.spanFailure());
        ex = assertThrows(DurationParseException.class, () -> DurationParser.parse("18446744073709551615s"));
        assertEquals(SpanFailure.OUT_OF_RANGE, ex.spanFailure());
    }

    @Test
    void keepsSecondsAboveSignedRange() {
        var duration = DurationParser.parse("9223372036854775808s");
        assertEquals("9223372036854775808", duration.secondsText());
        assertEquals(0, duration.nanos());
    }

    @Test
    void rejectsOverflowingSum() {
        var ex = assertThrows(DurationParseException.class, () ->
            DurationParser.parse("18446744073709549568s 1h")
        );
        assertEquals(Kind.MALFORMED_SPAN, ex.kind());
        assertEquals(SpanFailure.OUT_OF_RANGE, ex.spanFailure());
        assertEquals("1h", ex.fragment());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "\r", "\n\t"})
    void rejectsEmptyInput(String input) {
        var ex = assertThrows(DurationParseException.class, () -> DurationParser.parse(input));
        assertEquals(Kind.EMPTY_INPUT, ex.kind());
        assertEquals("input is empty", ex.getMessage());
    }

    @Test
    void rejectsNullAsEmpty() {
        var ex = assertThrows(DurationParseException.class, () -> DurationParser.parse(null));
        assertEquals(Kind.EMPTY_INPUT, ex.kind());
    }

    @Test
    void reportsTrailingTextExactly() {
        var ex = assertThrows(DurationParseException.class, () -> DurationParser.parse("10 months 1"));
        assertEquals(Kind.PARSE_FAILED, ex.kind());
        assertEquals("1", ex.fragment());
        assertEquals(SpanFailure.UNIT_SUFFIX, ex.spanFailure());
        assertEquals("parsing duration failed at: 1", ex.getMessage());

        ex = assertThrows(DurationParseException.class, () -> DurationParser.parse("2h foo  "));
        assertEquals(Kind.PARSE_FAILED, ex.kind());
        assertEquals("foo", ex.fragment());
        assertEquals(3, ex.position());

        ex = assertThrows(DurationParseException.class, () -> DurationParser.parse("222nsec221nanosmsec7s5msec572s"));
        assertEquals(Kind.PARSE_FAILED, ex.kind());
        assertEquals("msec7s5msec572s", ex.fragment());
        assertEquals(SpanFailure.NUMERIC_LITERAL, ex.spanFailure());

        ex = assertThrows(DurationParseException.class, () -> DurationParser.parse("1s 100000000000000000000ns"));
        assertEquals(Kind.PARSE_FAILED, ex.kind());
        assertEquals(SpanFailure.OUT_OF_RANGE, ex.spanFailure());
        assertEquals("100000000000000000000ns", ex.fragment());
    }

    @Test
    void describesMalformedFirstSpan() {
        var missingUnit = assertThrows(DurationParseException.class, () -> DurationParser.parse("123"));
        assertEquals(Kind.MALFORMED_SPAN, missingUnit.kind());
        assertEquals(SpanFailure.UNIT_SUFFIX, missingUnit.spanFailure());
        assertEquals(3, missingUnit.position());
        assertEquals("time unit needed, for example 123sec or 123ms", missingUnit.getMessage());

        var unknownUnit = assertThrows(DurationParseException.class, () -> DurationParser.parse("10nights"));
        assertEquals(SpanFailure.UNIT_SUFFIX, unknownUnit.spanFailure());
        assertEquals("nights", unknownUnit.fragment());
        assertEquals(
            "unknown time unit \"nights\", supported units: ns, us, ms, sec, min, hours, days, weeks, months, years (and few variations)",
            unknownUnit.getMessage()
        );

        var badCharacter = assertThrows(DurationParseException.class, () -> DurationParser.parse("1~"));
        assertEquals("invalid character at 1", badCharacter.getMessage());

        var noNumber = assertThrows(DurationParseException.class, () -> DurationParser.parse("\0"));
        assertEquals(SpanFailure.NUMERIC_LITERAL, noNumber.spanFailure());
        assertEquals("expected number at 0", noNumber.getMessage());

        var nonAscii = assertThrows(DurationParseException.class, () -> DurationParser.parse("1Nå"));
        assertEquals(SpanFailure.UNIT_SUFFIX, nonAscii.spanFailure());
        assertEquals(1, nonAscii.position());
    }

    @Test
    void rejectsSignedNumbers() {
        var negative = assertThrows(DurationParseException.class, () -> DurationParser.parse("-5s"));
        assertEquals(SpanFailure.OUT_OF_RANGE, negative.spanFailure());
        assertTrue(negative.getMessage().contains("\"-5\""));

        var positive = assertThrows(DurationParseException.class, () -> DurationParser.parse("+5s"));
        assertEquals(SpanFailure.NUMERIC_LITERAL, positive.spanFailure());
    }

    @Test
    void unitMatchingPrefersLongerFamilies() {
        assertEquals(new HumanDuration(0, 1_000_000), DurationParser.parse("1ms"));
        assertEquals(HumanDuration.ofSeconds(2_630_016), DurationParser.parse("1mth"));
        assertEquals(HumanDuration.ofSeconds(60), DurationParser.parse("1min"));
        assertEquals(HumanDuration.ofSeconds(60), DurationParser.parse("1m"));
        assertEquals(HumanDuration.ofSeconds(2_630_016), DurationParser.parse("1M"));
    }

    @Test
    void parseOptionalTreatsBlankAsUnset() {
        assertEquals(Optional.empty(), DurationParser.parseOptional(null));
        assertEquals(Optional.empty(), DurationParser.parseOptional("  "));
        assertEquals(Optional.of(HumanDuration.ofSeconds(30)), DurationParser.parseOptional("30s"));
        assertThrows(DurationParseException.class, () -> DurationParser.parseOptional("30x"));
    }

    @Test
    void parsingIsIndependentAcrossThreads() throws Exception {
        var inputs = List.of("1h", "2 days and 3m", "0.0001 days", "20min17nsec");
        var expected = inputs.stream().map(DurationParser::parse).toList();
        var results = inputs.parallelStream().map(DurationParser::parse).toList();
        assertEquals(expected, results);
    }
}
