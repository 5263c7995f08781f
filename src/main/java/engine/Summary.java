package engine;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Summary(
        @JsonProperty("initial_strings_count") int initialStringsCount,
        @JsonProperty("final_common_prefix") String finalCommonPrefix,
        @JsonProperty("prefix_length") int prefixLength) {

    public static Summary of(int initialStringsCount, String finalCommonPrefix) {
        return new Summary(initialStringsCount, finalCommonPrefix, finalCommonPrefix.length());
    }
}
