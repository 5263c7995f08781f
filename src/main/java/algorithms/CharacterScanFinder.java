package algorithms;

import java.util.List;

// Column-wise scan bounded by the shortest string: O(shortest * count).
public final class CharacterScanFinder implements PrefixFinder {

    @Override
    public String commonPrefix(List<String> strings) {
        Prefixes.requireNonEmpty(strings);
        String first = strings.get(0);
        if (strings.size() == 1) {
            return first;
        }

        int bound = Prefixes.shortestLength(strings);
        int i = 0;
        scan:
        while (i < bound) {
            char c = first.charAt(i);
            for (int s = 1; s < strings.size(); s++) {
                if (strings.get(s).charAt(i) != c) {
                    break scan;
                }
            }
            i++;
        }
        return first.substring(0, i);
    }
}
