package work.lcod.humantime.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import work.lcod.humantime.api.ParseReport;

/**
 * Writes parse reports as pretty JSON or one line per report.
 */
final class ReportPrinter {
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    private ReportPrinter() {}

    static int print(List<ParseReport> reports, OutputFormat format, PrintWriter out) throws JsonProcessingException {
        if (format == OutputFormat.TEXT) {
            for (ParseReport report : reports) {
                out.println(report.toText());
            }
        } else {
            List<Map<String, Object>> payload = reports.stream().map(ParseReport::toSerializableMap).toList();
            out.println(JSON_WRITER.writeValueAsString(payload));
        }
        out.flush();
        return exitCode(reports);
    }

    static int exitCode(List<ParseReport> reports) {
        int exitCode = 0;
        for (ParseReport report : reports) {
            exitCode = Math.max(exitCode, report.status().exitCode());
        }
        return exitCode;
    }
}
