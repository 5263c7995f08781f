package algorithms;

import java.util.List;

/**
 * Binary search over the prefix length. A length is feasible when the first string's prefix of
 * that length starts every string; feasibility is monotone in the length, so the search
 * converges to the maximal feasible one in O(count * shortest * log(shortest)).
 */
public final class BinarySearchFinder implements PrefixFinder {

    @Override
    public String commonPrefix(List<String> strings) {
        Prefixes.requireNonEmpty(strings);
        String first = strings.get(0);
        if (strings.size() == 1) {
            return first;
        }

        int low = 0;
        int high = Prefixes.shortestLength(strings);
        while (low < high) {
            int mid = (low + high + 1) >>> 1; // round up so low = mid always progresses
            if (isFeasible(first, mid, strings)) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return first.substring(0, low);
    }

    private static boolean isFeasible(String first, int length, List<String> strings) {
        for (String s : strings) {
            if (!s.regionMatches(0, first, 0, length)) {
                return false;
            }
        }
        return true;
    }
}
