package analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import engine.RunError;
import engine.RunResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"algorithms_compared", "input_strings_count", "agreement", "discrepancies",
        "comparison_results", "visualization", "error"})
public record ComparisonReport(
        @JsonProperty("algorithms_compared") List<String> algorithmsCompared,
        @JsonProperty("input_strings_count") int inputStringsCount,
        @JsonProperty("comparison_results") Map<String, RunResult> comparisonResults,
        @JsonProperty("agreement") boolean agreement,
        @JsonProperty("discrepancies") List<Discrepancy> discrepancies,
        @JsonProperty("visualization") VisualizationData visualization,
        @JsonProperty("error") RunError error) {

    public ComparisonReport {
        algorithmsCompared = List.copyOf(algorithmsCompared);
        comparisonResults = Collections.unmodifiableMap(new LinkedHashMap<>(comparisonResults));
        discrepancies = List.copyOf(discrepancies);
    }

    public RunResult resultFor(String algorithm) {
        return comparisonResults.get(algorithm);
    }
}
