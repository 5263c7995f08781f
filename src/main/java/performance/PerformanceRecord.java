package performance;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PerformanceRecord(
        @JsonProperty("step") int step,
        @JsonProperty("strings_count") int stringsCount,
        @JsonProperty("execution_time_ms") double executionTimeMs,
        @JsonProperty("memory_estimate") MemoryEstimate memoryEstimate) {
}
