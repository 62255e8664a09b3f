package work.lcod.humantime.api;

/**
 * Raised when a duration string cannot be reduced to a {@link HumanDuration}.
 */
public final class DurationParseException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** Nothing left after stripping whitespace. */
        EMPTY_INPUT,
        /** At least one span parsed, but text was left over. */
        PARSE_FAILED,
        /** Not even the first span could be read. */
        MALFORMED_SPAN
    }

    /**
     * Which sub-rule stopped the scanner.
     */
    public enum SpanFailure {
        NUMERIC_LITERAL,
        UNIT_SUFFIX,
        OUT_OF_RANGE
    }

    private final Kind kind;
    private final SpanFailure spanFailure;
    private final String input;
    private final int position;

    private DurationParseException(Kind kind, SpanFailure spanFailure, String input, int position, String message) {
        super(message);
        this.kind = kind;
        this.spanFailure = spanFailure;
        this.input = input;
        this.position = position;
    }

    public static DurationParseException emptyInput() {
        return new DurationParseException(Kind.EMPTY_INPUT, null, "", 0, "input is empty");
    }

    public static DurationParseException parseFailed(String input, int position, SpanFailure reason) {
        return new DurationParseException(
            Kind.PARSE_FAILED,
            reason,
            input,
            position,
            "parsing duration failed at: " + input.substring(position)
        );
    }

    public static DurationParseException malformed(String input, int position, SpanFailure failure, String message) {
        return new DurationParseException(Kind.MALFORMED_SPAN, failure, input, position, message);
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Why the span at {@link #position()} failed; {@code null} for {@link Kind#EMPTY_INPUT}.
     */
    public SpanFailure spanFailure() {
        return spanFailure;
    }

    /**
     * The whitespace-stripped input the positions refer to.
     */
    public String input() {
        return input;
    }

    public int position() {
        return position;
    }

    /**
     * The text from {@link #position()} on; for {@link Kind#PARSE_FAILED} the exact leftover.
     */
    public String fragment() {
        return input.substring(position);
    }
}
