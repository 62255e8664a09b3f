package work.lcod.humantime.units;

/**
 * Time units understood by the duration grammar, each with a fixed factor to seconds.
 * Months and years are calendar-approximate (30.44 and 365.25 days).
 */
public enum DurationUnit {
    NANOSECOND(1e-9),
    MICROSECOND(1e-6),
    MILLISECOND(1e-3),
    SECOND(1.),
    MINUTE(60.),
    HOUR(3_600.),
    DAY(86_400.),
    WEEK(604_800.),
    MONTH(30.44 * 86_400.),
    YEAR(365.25 * 86_400.);

    private final double secondsFactor;

    DurationUnit(double secondsFactor) {
        this.secondsFactor = secondsFactor;
    }

    public double secondsFactor() {
        return secondsFactor;
    }

    public double toSeconds(double value) {
        return value * secondsFactor;
    }
}
