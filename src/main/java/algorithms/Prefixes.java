package algorithms;

import java.util.List;
import java.util.Objects;

public final class Prefixes {
    private Prefixes() {
        throw new AssertionError("Prefixes must not be instantiated");
    }

    // Rejects null/empty lists and null elements.
    public static void requireNonEmpty(List<String> strings) {
        Objects.requireNonNull(strings, "strings");
        if (strings.isEmpty()) {
            throw new IllegalArgumentException("strings cannot be empty");
        }
        for (int i = 0; i < strings.size(); i++) {
            Objects.requireNonNull(strings.get(i), "strings[" + i + "]");
        }
    }

    public static int shortestLength(List<String> strings) {
        int min = Integer.MAX_VALUE;
        for (String s : strings) {
            min = Math.min(min, s.length());
        }
        return strings.isEmpty() ? 0 : min;
    }

    public static boolean isCommonPrefix(String prefix, List<String> strings) {
        for (String s : strings) {
            if (!s.startsWith(prefix)) {
                return false;
            }
        }
        return true;
    }

    /**
     * True when {@code prefix} is common to all strings and cannot be extended by one more
     * character of any of them.
     */
    public static boolean isLongestCommonPrefix(String prefix, List<String> strings) {
        if (!isCommonPrefix(prefix, strings)) {
            return false;
        }
        if (prefix.length() == shortestLength(strings)) {
            return true;
        }
        for (String s : strings) {
            if (s.length() > prefix.length()
                    && isCommonPrefix(s.substring(0, prefix.length() + 1), strings)) {
                return false;
            }
        }
        return true;
    }
}
