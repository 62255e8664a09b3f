package work.lcod.humantime.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.lcod.humantime.api.ParseReport;

@CommandLine.Command(
    name = "parse",
    description = "Parse duration strings and print seconds, nanoseconds and canonical text.",
    mixinStandardHelpOptions = true,
    showDefaultValues = true
)
final class ParseCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private LoggingOptions logging = new LoggingOptions();

    @CommandLine.Parameters(
        arity = "1..*",
        paramLabel = "TEXT",
        description = "Durations to parse, e.g. '2h 15m' or '0.1 days'."
    )
    private List<String> inputs = new ArrayList<>();

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Output format (${COMPLETION-CANDIDATES}).",
        defaultValue = "json"
    )
    private OutputFormat output = OutputFormat.JSON;

    @Override
    public Integer call() throws Exception {
        logging.apply();
        var log = LoggerFactory.getLogger(ParseCommand.class);

        List<ParseReport> reports = new ArrayList<>();
        for (String input : inputs) {
            ParseReport report = ParseReport.of(input);
            if (!report.isOk()) {
                log.warn("Rejected '{}': {}", input, report.error().getMessage());
            }
            reports.add(report);
        }
        log.info("Parsed {} value(s)", reports.size());
        return ReportPrinter.print(reports, output, spec.commandLine().getOut());
    }
}
