package engine;

import java.util.AbstractList;
import java.util.List;
import java.util.Objects;
import java.util.RandomAccess;

// Read-only view of the first `size` elements of the engine's frozen input; steps share it
// instead of copying their slice.
final class FrozenSlice extends AbstractList<String> implements RandomAccess {

    private final List<String> frozen;
    private final int size;

    FrozenSlice(List<String> frozen, int size) {
        Objects.checkFromToIndex(0, size, frozen.size());
        this.frozen = frozen;
        this.size = size;
    }

    @Override
    public String get(int index) {
        return frozen.get(Objects.checkIndex(index, size));
    }

    @Override
    public int size() {
        return size;
    }
}
