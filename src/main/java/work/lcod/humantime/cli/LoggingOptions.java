package work.lcod.humantime.cli;

import picocli.CommandLine;
import work.lcod.humantime.api.LogLevel;

/**
 * {@code --log-level} shared by the subcommands. Must be applied before the first logger is
 * created, since slf4j-simple reads its configuration once.
 */
final class LoggingOptions {
    static final String DEFAULT_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|fatal).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    LogLevel apply() {
        LogLevel level = LogLevel.from(logLevelRaw);
        if (logLevelRaw != null) {
            System.setProperty(DEFAULT_LEVEL_PROPERTY, level.simpleLoggerLevel());
        }
        return level;
    }
}
