package performance;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Heuristic footprint of one step, derived from character and string counts only. */
public record MemoryEstimate(
        @JsonProperty("input_chars") long inputChars,
        @JsonProperty("output_chars") long outputChars,
        @JsonProperty("strings_count") int stringsCount,
        @JsonProperty("estimated_bytes") long estimatedBytes) {
}
