package work.lcod.humantime.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import work.lcod.humantime.shared.DurationParser;

/**
 * Outcome of parsing one value (usable by the CLI and embedding apps).
 */
public record ParseReport(String key, String input, Status status, HumanDuration duration, DurationParseException error) {
    public ParseReport {
        Objects.requireNonNull(status, "status");
        if (status == Status.OK) {
            Objects.requireNonNull(duration, "duration");
        } else {
            Objects.requireNonNull(error, "error");
        }
    }

    public static ParseReport of(String input) {
        return of(null, input);
    }

    public static ParseReport of(String key, String input) {
        try {
            return new ParseReport(key, input, Status.OK, DurationParser.parse(input), null);
        } catch (DurationParseException ex) {
            return new ParseReport(key, input, Status.ERROR, null, ex);
        }
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        if (key != null) {
            serializable.put("key", key);
        }
        serializable.put("input", input);
        serializable.put("status", status.name().toLowerCase());
        if (isOk()) {
            serializable.put("seconds", duration.secondsText());
            serializable.put("nanos", duration.nanos());
            serializable.put("formatted", duration.toString());
        } else {
            serializable.put("kind", error.kind().name());
            if (error.spanFailure() != null) {
                serializable.put("spanFailure", error.spanFailure().name());
                serializable.put("position", error.position());
            }
            serializable.put("message", error.getMessage());
        }
        return serializable;
    }

    public String toText() {
        String label = key != null ? key : input;
        if (isOk()) {
            return label + " = " + duration + " (" + duration.secondsText() + "s " + duration.nanos() + "ns)";
        }
        return label + ": " + error.getMessage();
    }

    public enum Status {
        OK(0),
        ERROR(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
