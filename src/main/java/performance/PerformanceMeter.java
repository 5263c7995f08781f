package performance;

import algorithms.PrefixFinder;

import java.util.List;
import java.util.Objects;

/**
 * Times a single finder invocation with {@link System#nanoTime()} and attaches a
 * {@link MemoryEstimate} of the step.
 */
public final class PerformanceMeter {

    private static final double NANOS_PER_MS = 1_000_000.0;

    private final MemoryModel memoryModel;

    public PerformanceMeter(MemoryModel memoryModel) {
        this.memoryModel = Objects.requireNonNull(memoryModel, "memoryModel");
    }

    public Measurement measure(int step, List<String> subset, PrefixFinder finder) {
        long start = System.nanoTime();
        String prefix = finder.commonPrefix(subset);
        long elapsed = System.nanoTime() - start;

        PerformanceRecord record = new PerformanceRecord(
                step,
                subset.size(),
                elapsed / NANOS_PER_MS,
                memoryModel.estimate(subset, prefix));
        return new Measurement(prefix, record);
    }

    // Finder output together with the record describing how it was produced.
    public record Measurement(String prefix, PerformanceRecord record) {}
}
