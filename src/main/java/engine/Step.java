package engine;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Outcome of incorporating the first {@code stringsCount} strings of the input.
 * {@code analyzedStrings} is exactly that leading slice, in input order, and read-only. Slices
 * handed in by the engine are shared views of its frozen input; any other list is copied.
 */
public record Step(
        @JsonProperty("step") int step,
        @JsonProperty("strings_count") int stringsCount,
        @JsonProperty("common_prefix") String commonPrefix,
        @JsonProperty("analyzed_strings") List<String> analyzedStrings) {

    public Step {
        if (step < 1) {
            throw new IllegalArgumentException("step must be >= 1");
        }
        if (analyzedStrings.size() != stringsCount) {
            throw new IllegalArgumentException("analyzedStrings size " + analyzedStrings.size()
                    + " does not match stringsCount " + stringsCount);
        }
        if (!(analyzedStrings instanceof FrozenSlice)) {
            analyzedStrings = List.copyOf(analyzedStrings);
        }
    }

    public int prefixLength() {
        return commonPrefix.length();
    }
}
