package work.lcod.humantime.shared;

/**
 * Scanner for the unsigned decimal literals that open every span
 * ({@code 5}, {@code .5}, {@code 1.}, {@code 1.5}, {@code 11e-1}).
 */
final class NumericLiteral {
    /** {@code 2^64 - 1} rounded to the nearest double, i.e. {@code 2^64}. */
    static final double MAX_VALUE = 0x1p64;

    private NumericLiteral() {}

    /**
     * Returns the end of the maximal literal starting at {@code start}, or {@code start} when
     * there is none. An exponent is only taken when digits follow the marker.
     */
    static int scan(CharSequence text, int start) {
        int length = text.length();
        int i = skipDigits(text, start);
        int digits = i - start;
        if (i < length && text.charAt(i) == '.') {
            int fractionEnd = skipDigits(text, i + 1);
            digits += fractionEnd - (i + 1);
            if (digits > 0) {
                i = fractionEnd;
            }
        }
        if (digits == 0) {
            return start;
        }
        if (i < length && (text.charAt(i) == 'e' || text.charAt(i) == 'E')) {
            int exponentStart = i + 1;
            if (exponentStart < length && (text.charAt(exponentStart) == '+' || text.charAt(exponentStart) == '-')) {
                exponentStart++;
            }
            int exponentEnd = skipDigits(text, exponentStart);
            if (exponentEnd > exponentStart) {
                i = exponentEnd;
            }
        }
        return i;
    }

    /**
     * Whether a literal value fits the unsigned 64-bit range a duration can hold.
     */
    static boolean inRange(double value) {
        return value >= 0.0 && value <= MAX_VALUE;
    }

    private static int skipDigits(CharSequence text, int index) {
        while (index < text.length() && isDigit(text.charAt(index))) {
            index++;
        }
        return index;
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }
}
