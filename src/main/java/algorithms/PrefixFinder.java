package algorithms;

import java.util.List;

/**
 * Computes the longest common prefix of a non-empty list of strings. Implementations are
 * stateless and must return identical output for identical input.
 */
@FunctionalInterface
public interface PrefixFinder {

    /**
     * @param strings non-empty list; a single element is returned unchanged
     * @throws IllegalArgumentException if {@code strings} is empty
     */
    String commonPrefix(List<String> strings);
}
