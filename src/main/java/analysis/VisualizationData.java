package analysis;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

// Chart-ready series extracted from the instrumented runs of a comparison.
public record VisualizationData(
        @JsonProperty("performance_chart") Map<String, List<TimePoint>> performanceChart,
        @JsonProperty("memory_usage") Map<String, List<MemoryPoint>> memoryUsage,
        @JsonProperty("accuracy_check") Map<String, String> accuracyCheck) {

    public record TimePoint(@JsonProperty("step") int step, @JsonProperty("time_ms") double timeMs) {}

    public record MemoryPoint(@JsonProperty("step") int step, @JsonProperty("memory_bytes") long memoryBytes) {}
}
