package engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import performance.PerformanceRecord;
import performance.PerformanceSummary;

import java.util.List;

/**
 * Complete outcome of one progressive run. Always well formed: input problems are carried in
 * {@link #error()} next to an empty step list instead of being thrown.
 * {@code performanceData} and {@code performanceSummary} are null unless instrumentation was
 * requested.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"results", "total_steps", "algorithm_used", "summary",
        "performance_data", "performance_summary", "error"})
public record RunResult(
        @JsonProperty("results") List<Step> results,
        @JsonProperty("total_steps") int totalSteps,
        @JsonProperty("algorithm_used") String algorithmUsed,
        @JsonProperty("summary") Summary summary,
        @JsonProperty("performance_data") List<PerformanceRecord> performanceData,
        @JsonProperty("performance_summary") PerformanceSummary performanceSummary,
        @JsonProperty("error") RunError error) {

    public RunResult {
        results = List.copyOf(results);
        performanceData = performanceData == null ? null : List.copyOf(performanceData);
    }

    static RunResult failed(String algorithmUsed, int initialStringsCount, RunError error) {
        return new RunResult(List.of(), 0, algorithmUsed, Summary.of(initialStringsCount, ""),
                null, null, error);
    }

    public boolean hasError() {
        return error != null;
    }

    public boolean hasPerformanceData() {
        return performanceData != null;
    }

    // Prefix of step i (1-based), as recorded.
    public String prefixAt(int step) {
        return results.get(step - 1).commonPrefix();
    }
}
