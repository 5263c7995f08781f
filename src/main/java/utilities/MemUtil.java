package utilities;

import org.openjdk.jol.info.GraphLayout;
import tree.Trie;

import java.util.List;
import java.util.Locale;

/**
 * Measured (JOL) footprint of the trie the trie algorithm builds, for comparison with the
 * deterministic per-step estimate. Only used by benchmarking code paths.
 */
public final class MemUtil {
    private MemUtil() {}

    public static Trie buildTrie(List<String> strings) {
        Trie trie = new Trie();
        for (String s : strings) {
            trie.insert(s);
        }
        return trie;
    }

    public static String trieFootprintReport(List<String> strings) {
        Trie trie = buildTrie(strings);
        GraphLayout layout = GraphLayout.parseInstance(trie);
        long total = layout.totalSize();
        return String.format(Locale.ROOT, "Trie (JOL): %d B (%.3f MiB), nodes=%d, words=%d",
                total, total / (1024.0 * 1024.0), trie.nodeCount(), trie.size());
    }
}
