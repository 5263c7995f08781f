package performance;

import java.util.List;
import java.util.Objects;

/**
 * Deterministic memory-estimate formula:
 * {@code base + (inputChars + outputChars) * bytesPerChar + strings * bytesPerString}.
 * The result is only meaningful relative to other steps estimated with the same model.
 */
public final class MemoryModel {

    public static final int DEFAULT_BYTES_PER_CHAR = 4;

    private final long baseOverheadBytes;
    private final int bytesPerChar;
    private final int bytesPerString;

    private MemoryModel(long baseOverheadBytes, int bytesPerChar, int bytesPerString) {
        if (baseOverheadBytes < 0) {
            throw new IllegalArgumentException("baseOverheadBytes must be non-negative");
        }
        if (bytesPerChar < 0) {
            throw new IllegalArgumentException("bytesPerChar must be non-negative");
        }
        if (bytesPerString < 0) {
            throw new IllegalArgumentException("bytesPerString must be non-negative");
        }
        this.baseOverheadBytes = baseOverheadBytes;
        this.bytesPerChar = bytesPerChar;
        this.bytesPerString = bytesPerString;
    }

    // Four bytes per input and output character, no fixed or per-string cost.
    public static MemoryModel defaults() {
        return new MemoryModel(0L, DEFAULT_BYTES_PER_CHAR, 0);
    }

    public static MemoryModel of(long baseOverheadBytes, int bytesPerChar, int bytesPerString) {
        return new MemoryModel(baseOverheadBytes, bytesPerChar, bytesPerString);
    }

    public MemoryEstimate estimate(List<String> input, String output) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(output, "output");
        long inputChars = 0L;
        for (String s : input) {
            inputChars += s.length();
        }
        long outputChars = output.length();
        long bytes = baseOverheadBytes
                + (inputChars + outputChars) * bytesPerChar
                + (long) input.size() * bytesPerString;
        return new MemoryEstimate(inputChars, outputChars, input.size(), bytes);
    }

    public long baseOverheadBytes() { return baseOverheadBytes; }
    public int bytesPerChar() { return bytesPerChar; }
    public int bytesPerString() { return bytesPerString; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MemoryModel)) return false;
        MemoryModel that = (MemoryModel) o;
        return baseOverheadBytes == that.baseOverheadBytes
                && bytesPerChar == that.bytesPerChar
                && bytesPerString == that.bytesPerString;
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseOverheadBytes, bytesPerChar, bytesPerString);
    }

    @Override
    public String toString() {
        return "MemoryModel{base=" + baseOverheadBytes + ", perChar=" + bytesPerChar
                + ", perString=" + bytesPerString + "}";
    }
}
