package work.lcod.humantime.cli;

import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.humantime.units.DurationUnit;

@CommandLine.Command(
    name = "humantime",
    description = "Parse, format and validate human-friendly durations (e.g. 2h 15m, 0.5 days).",
    mixinStandardHelpOptions = true,
    versionProvider = HumantimeCommand.class,
    subcommands = {
        ParseCommand.class,
        FormatCommand.class,
        CheckCommand.class,
        UnitsCommand.class
    }
)
final class HumantimeCommand implements Callable<Integer>, CommandLine.IVersionProvider {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    /**
     * Version plus the calendar approximations this build uses, since they change results.
     */
    @Override
    public String[] getVersion() {
        String implementationVersion = Main.class.getPackage().getImplementationVersion();
        String version = implementationVersion != null ? implementationVersion : "development";
        return new String[] {
            "humantime (java) " + version,
            String.format(
                Locale.ROOT,
                "1month = %.0fs (30.44 days), 1year = %.0fs (365.25 days)",
                DurationUnit.MONTH.secondsFactor(),
                DurationUnit.YEAR.secondsFactor()
            )
        };
    }
}
