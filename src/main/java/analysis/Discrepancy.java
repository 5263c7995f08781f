package analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Step at which the compared algorithms did not produce the same prefix. A {@code null}
 * value means that algorithm recorded no such step; step {@code 0} marks runs that did not
 * fail the same way.
 */
public record Discrepancy(
        @JsonProperty("step") int step,
        @JsonProperty("prefixes") Map<String, String> prefixesByAlgorithm) {

    public Discrepancy {
        // LinkedHashMap keeps algorithm order and tolerates null prefixes
        prefixesByAlgorithm = Collections.unmodifiableMap(new LinkedHashMap<>(prefixesByAlgorithm));
    }

    public String describe() {
        StringBuilder sb = new StringBuilder("step ").append(step).append(':');
        prefixesByAlgorithm.forEach((algorithm, prefix) -> {
            sb.append(' ').append(algorithm).append('=');
            sb.append(prefix == null ? "<missing>" : "'" + prefix + "'");
        });
        return sb.toString();
    }
}
