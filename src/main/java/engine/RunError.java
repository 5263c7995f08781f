package engine;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

public record RunError(@JsonProperty("kind") ErrorKind kind, @JsonProperty("message") String message) {

    public RunError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static RunError emptyInput() {
        return new RunError(ErrorKind.EMPTY_INPUT, "Empty string list provided: no strings to analyze");
    }

    public static RunError unknownAlgorithm(String algorithm, String validIds) {
        return new RunError(ErrorKind.UNKNOWN_ALGORITHM,
                "Unknown algorithm: " + algorithm + " (valid: " + validIds + ")");
    }

    public static RunError invalidInput(String message) {
        return new RunError(ErrorKind.INVALID_INPUT, message);
    }

    public static RunError inconsistency(String message) {
        return new RunError(ErrorKind.INTERNAL_INCONSISTENCY, message);
    }
}
