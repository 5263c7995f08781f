package algorithms;

import tree.Trie;

import java.util.List;

// Builds a throwaway trie per call and reads the shared path off its root.
public final class TrieFinder implements PrefixFinder {

    @Override
    public String commonPrefix(List<String> strings) {
        Prefixes.requireNonEmpty(strings);
        if (strings.size() == 1) {
            return strings.get(0);
        }

        Trie trie = new Trie();
        for (String s : strings) {
            trie.insert(s);
        }
        return trie.longestCommonPrefixOfAllInserted();
    }
}
