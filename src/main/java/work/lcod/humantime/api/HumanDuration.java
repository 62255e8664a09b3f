package work.lcod.humantime.api;

import java.time.Duration;
import work.lcod.humantime.shared.DurationFormatter;

/**
 * Exact, non-negative elapsed time: unsigned whole seconds plus a nanosecond remainder.
 *
 * <p>{@code seconds} holds an unsigned 64-bit count. Values above {@link Long#MAX_VALUE} show up
 * as negative longs; use {@link #secondsText()} or the {@code Long.*Unsigned} helpers to read them.
 */
public record HumanDuration(long seconds, int nanos) implements Comparable<HumanDuration> {
    public static final int NANOS_PER_SECOND = 1_000_000_000;
    public static final HumanDuration ZERO = new HumanDuration(0L, 0);

    public HumanDuration {
        if (nanos < 0 || nanos >= NANOS_PER_SECOND) {
            throw new IllegalArgumentException("nanos out of range: " + nanos);
        }
    }

    public static HumanDuration ofSeconds(long seconds) {
        return new HumanDuration(seconds, 0);
    }

    /**
     * Builds a duration, carrying whole seconds out of {@code nanos}.
     *
     * @throws ArithmeticException when the carry overflows the unsigned seconds field
     */
    public static HumanDuration of(long seconds, long nanos) {
        if (nanos < 0) {
            throw new IllegalArgumentException("nanos must not be negative: " + nanos);
        }
        long carry = nanos / NANOS_PER_SECOND;
        return new HumanDuration(addUnsigned(seconds, carry), (int) (nanos % NANOS_PER_SECOND));
    }

    public static HumanDuration fromJavaDuration(Duration duration) {
        if (duration.isNegative()) {
            throw new IllegalArgumentException("negative durations are not supported: " + duration);
        }
        return new HumanDuration(duration.getSeconds(), duration.getNano());
    }

    public HumanDuration plus(HumanDuration other) {
        long totalNanos = (long) nanos + other.nanos;
        long sum = addUnsigned(seconds, other.seconds);
        return of(sum, totalNanos);
    }

    public boolean isZero() {
        return seconds == 0L && nanos == 0;
    }

    /**
     * @throws ArithmeticException when the seconds do not fit a signed {@link Duration}
     */
    public Duration toJavaDuration() {
        if (seconds < 0) {
            throw new ArithmeticException("duration too large for java.time.Duration: " + secondsText() + "s");
        }
        return Duration.ofSeconds(seconds, nanos);
    }

    public String secondsText() {
        return Long.toUnsignedString(seconds);
    }

    @Override
    public int compareTo(HumanDuration other) {
        int bySeconds = Long.compareUnsigned(seconds, other.seconds);
        return bySeconds != 0 ? bySeconds : Integer.compare(nanos, other.nanos);
    }

    @Override
    public String toString() {
        return DurationFormatter.format(this);
    }

    private static long addUnsigned(long a, long b) {
        long sum = a + b;
        if (Long.compareUnsigned(sum, a) < 0) {
            throw new ArithmeticException("duration overflow");
        }
        return sum;
    }
}
