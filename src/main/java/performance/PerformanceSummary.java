package performance;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import java.util.List;
import java.util.Objects;

/**
 * Aggregate over the per-step records of one run. Built by a single pass over the records;
 * an empty run yields {@link #empty()}.
 */
public record PerformanceSummary(
        @JsonProperty("total_execution_time_ms") double totalExecutionTimeMs,
        @JsonProperty("average_execution_time_ms") double averageExecutionTimeMs,
        @JsonProperty("max_execution_time_ms") double maxExecutionTimeMs,
        @JsonProperty("min_execution_time_ms") double minExecutionTimeMs,
        @JsonProperty("peak_memory_estimate_bytes") long peakMemoryEstimateBytes,
        @JsonProperty("total_strings_processed") long totalStringsProcessed) {

    private static final PerformanceSummary EMPTY = new PerformanceSummary(0.0, 0.0, 0.0, 0.0, 0L, 0L);

    public static PerformanceSummary empty() {
        return EMPTY;
    }

    public static PerformanceSummary of(List<PerformanceRecord> records) {
        Objects.requireNonNull(records, "records");
        if (records.isEmpty()) {
            return EMPTY;
        }
        SummaryStatistics times = new SummaryStatistics();
        long peakBytes = 0L;
        long strings = 0L;
        for (PerformanceRecord r : records) {
            times.addValue(r.executionTimeMs());
            peakBytes = Math.max(peakBytes, r.memoryEstimate().estimatedBytes());
            strings += r.stringsCount();
        }
        return new PerformanceSummary(
                times.getSum(),
                times.getMean(),
                times.getMax(),
                times.getMin(),
                peakBytes,
                strings);
    }
}
