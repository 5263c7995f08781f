package analysis;

import algorithms.PrefixAlgorithm;
import engine.ErrorKind;
import engine.ProgressivePrefixFinder;
import engine.RunError;
import engine.RunResult;
import engine.Step;
import performance.PerformanceRecord;
import utilities.PrefixLogger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Runs every {@link PrefixAlgorithm} over the same input with instrumentation on and checks
 * that they agree step by step. Disagreements are returned as {@link Discrepancy} entries and
 * flagged with an {@link ErrorKind#INTERNAL_INCONSISTENCY} error on the report.
 */
public final class AlgorithmComparator {

    private final ProgressivePrefixFinder engine;

    public AlgorithmComparator() {
        this(new ProgressivePrefixFinder());
    }

    public AlgorithmComparator(ProgressivePrefixFinder engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    public ComparisonReport compareAlgorithms(List<String> strings) {
        return compareAlgorithms(strings, false);
    }

    public ComparisonReport compareAlgorithms(List<String> strings, boolean includeVisualization) {
        Map<String, RunResult> results = new LinkedHashMap<>();
        for (PrefixAlgorithm algorithm : PrefixAlgorithm.values()) {
            results.put(algorithm.id(), engine.run(strings, algorithm.id(), true));
        }
        return compare(results, strings == null ? 0 : strings.size(), includeVisualization);
    }

    // Package-private so tests can feed hand-made, deliberately inconsistent runs.
    static ComparisonReport compare(Map<String, RunResult> results, int inputCount, boolean includeVisualization) {
        List<String> algorithms = new ArrayList<>(results.keySet());
        List<Discrepancy> discrepancies = findDiscrepancies(results);

        RunError error = null;
        RunError inputError = sharedInputError(results);
        if (!discrepancies.isEmpty()) {
            String detail = discrepancies.stream()
                    .map(Discrepancy::describe)
                    .collect(Collectors.joining("; "));
            error = RunError.inconsistency("Algorithms disagree at " + discrepancies.size()
                    + " step(s): " + detail);
            PrefixLogger.warning(error.message());
        } else if (inputError != null) {
            error = inputError;
        }

        return new ComparisonReport(
                algorithms,
                inputCount,
                results,
                discrepancies.isEmpty(),
                discrepancies,
                includeVisualization ? visualize(results) : null,
                error);
    }

    private static List<Discrepancy> findDiscrepancies(Map<String, RunResult> results) {
        List<Discrepancy> out = new ArrayList<>();

        // Runs that failed must all have failed the same way.
        long errorKinds = results.values().stream()
                .map(r -> r.hasError() ? r.error().kind().name() : "OK")
                .distinct()
                .count();
        if (errorKinds > 1) {
            Map<String, String> byAlgorithm = new LinkedHashMap<>();
            results.forEach((id, r) -> byAlgorithm.put(id, r.hasError() ? null : r.summary().finalCommonPrefix()));
            out.add(new Discrepancy(0, byAlgorithm));
            return out;
        }

        int maxSteps = results.values().stream().mapToInt(r -> r.results().size()).max().orElse(0);
        for (int i = 0; i < maxSteps; i++) {
            Map<String, String> byAlgorithm = new LinkedHashMap<>();
            for (Map.Entry<String, RunResult> e : results.entrySet()) {
                List<Step> steps = e.getValue().results();
                byAlgorithm.put(e.getKey(), i < steps.size() ? steps.get(i).commonPrefix() : null);
            }
            if (byAlgorithm.values().stream().distinct().count() > 1) {
                out.add(new Discrepancy(i + 1, byAlgorithm));
            }
        }
        return out;
    }

    private static RunError sharedInputError(Map<String, RunResult> results) {
        for (RunResult r : results.values()) {
            if (r.hasError()) {
                return r.error();
            }
        }
        return null;
    }

    private static VisualizationData visualize(Map<String, RunResult> results) {
        Map<String, List<VisualizationData.TimePoint>> times = new LinkedHashMap<>();
        Map<String, List<VisualizationData.MemoryPoint>> memory = new LinkedHashMap<>();
        Map<String, String> accuracy = new LinkedHashMap<>();

        results.forEach((algorithm, result) -> {
            if (result.hasError() || !result.hasPerformanceData()) {
                return;
            }
            List<VisualizationData.TimePoint> t = new ArrayList<>();
            List<VisualizationData.MemoryPoint> m = new ArrayList<>();
            for (PerformanceRecord p : result.performanceData()) {
                t.add(new VisualizationData.TimePoint(p.step(), p.executionTimeMs()));
                m.add(new VisualizationData.MemoryPoint(p.step(), p.memoryEstimate().estimatedBytes()));
            }
            times.put(algorithm, List.copyOf(t));
            memory.put(algorithm, List.copyOf(m));
            accuracy.put(algorithm, result.summary().finalCommonPrefix());
        });
        return new VisualizationData(times, memory, accuracy);
    }
}
