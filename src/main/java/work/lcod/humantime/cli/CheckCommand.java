package work.lcod.humantime.cli;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import work.lcod.humantime.api.ParseReport;
import work.lcod.humantime.config.DurationConfig;

@CommandLine.Command(
    name = "check",
    description = "Validate the duration entries of a TOML, YAML or JSON config file.",
    mixinStandardHelpOptions = true,
    showDefaultValues = true
)
final class CheckCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private LoggingOptions logging = new LoggingOptions();

    @CommandLine.Parameters(index = "0", paramLabel = "FILE", description = "Config file (.toml, .yaml, .yml, .json).")
    private Path file;

    @CommandLine.Option(
        names = {"-p", "--prefix"},
        description = "Only check keys under this dotted prefix (default: every string entry).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String prefix;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Output format (${COMPLETION-CANDIDATES}).",
        defaultValue = "text"
    )
    private OutputFormat output = OutputFormat.TEXT;

    @Override
    public Integer call() throws Exception {
        logging.apply();
        var log = LoggerFactory.getLogger(CheckCommand.class);

        Path path = file.toAbsolutePath().normalize();
        if (!Files.isRegularFile(path)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Config file not found: " + path);
        }
        DurationConfig config = DurationConfig.load(path);
        List<ParseReport> reports = config.check(prefix);
        if (reports.isEmpty()) {
            log.warn("No duration entries found in {}", path);
        }
        long failures = reports.stream().filter(report -> !report.isOk()).count();
        log.info("Checked {} entries in {}, {} invalid", reports.size(), path, failures);
        return ReportPrinter.print(reports, output, spec.commandLine().getOut());
    }
}
