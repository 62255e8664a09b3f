package work.lcod.humantime.cli;

import picocli.CommandLine;
import work.lcod.humantime.api.DurationParseException;

/**
 * Prints the root message of a failed command. Duration errors also get the input echoed with a
 * caret under the position where the scanner stopped.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    private static final String INDENT = "  ";

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        var err = commandLine.getErr();
        DurationParseException durationError = findDurationError(ex);
        Throwable reported = durationError != null ? durationError : ex;
        String message = reported.getMessage();
        if (message == null || message.isBlank()) {
            message = reported.getClass().getSimpleName();
        }
        err.println(commandLine.getColorScheme().errorText(message));
        if (durationError != null && durationError.kind() != DurationParseException.Kind.EMPTY_INPUT) {
            err.println(INDENT + durationError.input());
            err.println(caretLine(durationError));
        }
        if (Boolean.getBoolean("humantime.debug")) {
            ex.printStackTrace(err);
        }
        err.flush();
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }

    static String caretLine(DurationParseException error) {
        var line = new StringBuilder(INDENT);
        String input = error.input();
        for (int i = 0; i < error.position() && i < input.length(); i++) {
            line.append(input.charAt(i) == '\t' ? '\t' : ' ');
        }
        return line.append('^').toString();
    }

    private static DurationParseException findDurationError(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof DurationParseException parseError) {
                return parseError;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return null;
    }
}
