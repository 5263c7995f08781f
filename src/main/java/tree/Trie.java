package tree;

import it.unimi.dsi.fastutil.chars.Char2IntOpenHashMap;
import it.unimi.dsi.fastutil.chars.CharArrayList;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

/**
 * Prefix tree stored as an arena of nodes addressed by integer handles. Node {@code 0} is the
 * root. A node with one child stores it inline as a {@code (char, handle)} pair; a primitive
 * {@code char -> handle} map is allocated only once a second child appears. Every node also
 * records the number of inserted words passing through it and the number ending at it.
 * Instances are meant to be short lived: build one, query it, drop it.
 */
public final class Trie {

    private static final int ROOT = 0;
    private static final int NO_CHILD = -1;

    // soleChild.getInt(n) is meaningful only while branches.get(n) is null
    private final CharArrayList soleKey = new CharArrayList();
    private final IntArrayList soleChild = new IntArrayList();
    private final ObjectArrayList<Char2IntOpenHashMap> branches = new ObjectArrayList<>();
    private final IntArrayList passCount = new IntArrayList();
    private final IntArrayList endCount = new IntArrayList();

    private int size;

    public Trie() {
        newNode();
    }

    public void insert(String word) {
        if (word == null) {
            throw new IllegalArgumentException("word cannot be null");
        }
        int node = ROOT;
        passCount.set(ROOT, passCount.getInt(ROOT) + 1);
        for (int i = 0; i < word.length(); i++) {
            node = childOrCreate(node, word.charAt(i));
            passCount.set(node, passCount.getInt(node) + 1);
        }
        endCount.set(node, endCount.getInt(node) + 1);
        size++;
    }

    /**
     * Walks down from the root while exactly one child exists, every inserted word passes
     * through that child and no inserted word ends at the current node.
     *
     * @return the accumulated characters, or {@code ""} when nothing was inserted
     */
    public String longestCommonPrefixOfAllInserted() {
        if (size == 0) {
            return "";
        }
        StringBuilder prefix = new StringBuilder();
        int node = ROOT;
        while (endCount.getInt(node) == 0 && branches.get(node) == null) {
            int child = soleChild.getInt(node);
            if (child == NO_CHILD || passCount.getInt(child) != size) {
                break;
            }
            prefix.append(soleKey.getChar(node));
            node = child;
        }
        return prefix.toString();
    }

    // Number of words inserted, duplicates included.
    public int size() {
        return size;
    }

    // Number of nodes in the arena, root included.
    public int nodeCount() {
        return passCount.size();
    }

    public boolean isEmpty() {
        return size == 0;
    }

    private int childOrCreate(int node, char c) {
        Char2IntOpenHashMap kids = branches.get(node);
        if (kids != null) {
            int child = kids.get(c);
            if (child == NO_CHILD) {
                child = newNode();
                kids.put(c, child);
            }
            return child;
        }
        int sole = soleChild.getInt(node);
        if (sole == NO_CHILD) {
            int child = newNode();
            soleKey.set(node, c);
            soleChild.set(node, child);
            return child;
        }
        if (soleKey.getChar(node) == c) {
            return sole;
        }
        // second distinct child: promote to a map
        kids = new Char2IntOpenHashMap(4);
        kids.defaultReturnValue(NO_CHILD);
        kids.put(soleKey.getChar(node), sole);
        int child = newNode();
        kids.put(c, child);
        branches.set(node, kids);
        return child;
    }

    private int newNode() {
        soleKey.add('\0');
        soleChild.add(NO_CHILD);
        branches.add(null);
        passCount.add(0);
        endCount.add(0);
        return passCount.size() - 1;
    }
}
