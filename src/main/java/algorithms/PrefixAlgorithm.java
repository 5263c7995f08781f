package algorithms;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

public enum PrefixAlgorithm {
    CHARACTER("character", "Character-by-character scan", new CharacterScanFinder()),
    BINARY_SEARCH("binary_search", "Binary search on prefix length", new BinarySearchFinder()),
    TRIE("trie", "Trie traversal", new TrieFinder());

    public static final PrefixAlgorithm DEFAULT = CHARACTER;

    private final String id;
    private final String displayName;
    private final PrefixFinder finder;

    PrefixAlgorithm(String id, String displayName, PrefixFinder finder) {
        this.id = id;
        this.displayName = displayName;
        this.finder = finder;
    }

    public String id() { return id; }
    public String displayName() { return displayName; }
    public PrefixFinder finder() { return finder; }

    public String commonPrefix(List<String> strings) {
        return finder.commonPrefix(strings);
    }

    public static Optional<PrefixAlgorithm> lookup(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return EnumSet.allOf(PrefixAlgorithm.class).stream()
                .filter(a -> a.id.equals(id))
                .findFirst();
    }

    public static PrefixAlgorithm fromId(String id) {
        return lookup(id).orElseThrow(() -> new IllegalArgumentException(
                "Unknown algorithm: " + id + " (valid: " + validIds() + ")"));
    }

    public static String validIds() {
        return Arrays.stream(values())
                .map(PrefixAlgorithm::id)
                .collect(Collectors.joining(", "));
    }
}
