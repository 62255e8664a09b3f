package work.lcod.humantime.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.humantime.units.DurationUnit;
import work.lcod.humantime.units.UnitSuffixResolver;

@CommandLine.Command(
    name = "units",
    description = "List the accepted unit suffixes and their length in seconds.",
    mixinStandardHelpOptions = true,
    showDefaultValues = true
)
final class UnitsCommand implements Callable<Integer> {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Output format (${COMPLETION-CANDIDATES}).",
        defaultValue = "text"
    )
    private OutputFormat output = OutputFormat.TEXT;

    @Override
    public Integer call() throws Exception {
        var out = spec.commandLine().getOut();
        if (output == OutputFormat.JSON) {
            List<Map<String, Object>> units = new ArrayList<>();
            for (DurationUnit unit : DurationUnit.values()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("unit", unit.name().toLowerCase(Locale.ROOT));
                entry.put("seconds", unit.secondsFactor());
                entry.put("suffixes", UnitSuffixResolver.suffixesOf(unit));
                units.add(entry);
            }
            out.println(JSON_WRITER.writeValueAsString(units));
        } else {
            for (DurationUnit unit : DurationUnit.values()) {
                out.printf(
                    Locale.ROOT,
                    "%-12s %-16s %s%n",
                    unit.name().toLowerCase(Locale.ROOT),
                    formatFactor(unit.secondsFactor()),
                    String.join(", ", UnitSuffixResolver.suffixesOf(unit))
                );
            }
        }
        out.flush();
        return 0;
    }

    private static String formatFactor(double seconds) {
        if (seconds >= 1 && seconds == Math.rint(seconds)) {
            return String.format(Locale.ROOT, "%.0fs", seconds);
        }
        return String.format(Locale.ROOT, "%gs", seconds);
    }
}
