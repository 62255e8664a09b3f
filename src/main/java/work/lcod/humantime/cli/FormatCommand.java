package work.lcod.humantime.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.humantime.api.HumanDuration;
import work.lcod.humantime.shared.DurationFormatter;
import work.lcod.humantime.shared.DurationParser;

@CommandLine.Command(
    name = "format",
    description = "Print the canonical text of a duration given as whole seconds or as duration text.",
    mixinStandardHelpOptions = true
)
final class FormatCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private LoggingOptions logging = new LoggingOptions();

    @CommandLine.Parameters(
        index = "0",
        paramLabel = "VALUE",
        description = "Unsigned whole seconds (e.g. 5400) or duration text to normalize (e.g. '90min')."
    )
    private String value;

    @CommandLine.Option(
        names = "--nanos",
        paramLabel = "N",
        description = "Nanoseconds added to VALUE (may exceed one second).",
        defaultValue = "0"
    )
    private long nanos;

    @Override
    public Integer call() {
        logging.apply();
        if (nanos < 0) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--nanos must not be negative");
        }
        HumanDuration base = isWholeSeconds(value) ? fromSeconds(value.strip()) : DurationParser.parse(value);
        HumanDuration duration;
        try {
            duration = base.plus(HumanDuration.of(0, nanos));
        } catch (ArithmeticException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Duration overflows 64-bit seconds");
        }
        var out = spec.commandLine().getOut();
        out.println(DurationFormatter.format(duration));
        out.flush();
        return 0;
    }

    private static boolean isWholeSeconds(String raw) {
        String text = raw.strip();
        if (text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) < '0' || text.charAt(i) > '9') {
                return false;
            }
        }
        return true;
    }

    private HumanDuration fromSeconds(String digits) {
        try {
            return HumanDuration.ofSeconds(Long.parseUnsignedLong(digits));
        } catch (NumberFormatException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Seconds out of range: " + digits);
        }
    }
}
