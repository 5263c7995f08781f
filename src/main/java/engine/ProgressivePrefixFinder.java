package engine;

import algorithms.PrefixAlgorithm;
import algorithms.PrefixFinder;
import performance.PerformanceMeter;
import performance.PerformanceRecord;
import performance.PerformanceSummary;
import utilities.PrefixLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Finds common prefixes progressively: the first two strings, then the first three, and so on
 * until the whole list has been incorporated, recording one {@link Step} per incorporation.
 *
 * <p>The engine keeps no state between runs. Every call copies its input, owns its working
 * structures and returns a fresh {@link RunResult}; malformed input is reported through
 * {@link RunResult#error()}.
 */
public final class ProgressivePrefixFinder {

    public static final String NAME = "progressive_prefix_finder";

    private final ProgressiveConfiguration defaults;

    public ProgressivePrefixFinder() {
        this(ProgressiveConfiguration.defaults());
    }

    public ProgressivePrefixFinder(ProgressiveConfiguration defaults) {
        this.defaults = Objects.requireNonNull(defaults, "defaults");
    }

    public RunResult run(List<String> strings) {
        return run(strings, defaults);
    }

    public RunResult run(List<String> strings, String algorithm) {
        return run(strings, defaults.toBuilder().algorithm(algorithm).build());
    }

    public RunResult run(List<String> strings, String algorithm, boolean includePerformance) {
        return run(strings, defaults.toBuilder()
                .algorithm(algorithm)
                .includePerformance(includePerformance)
                .build());
    }

    public RunResult run(List<String> strings, ProgressiveConfiguration configuration) {
        Objects.requireNonNull(configuration, "configuration");
        String algorithmId = configuration.algorithm();

        if (strings == null || strings.isEmpty()) {
            return reject(algorithmId, 0, RunError.emptyInput());
        }
        Optional<PrefixAlgorithm> algorithm = PrefixAlgorithm.lookup(algorithmId);
        if (algorithm.isEmpty()) {
            return reject(algorithmId, strings.size(),
                    RunError.unknownAlgorithm(algorithmId, PrefixAlgorithm.validIds()));
        }
        int nullAt = firstNull(strings);
        if (nullAt >= 0) {
            return reject(algorithmId, strings.size(),
                    RunError.invalidInput("strings[" + nullAt + "] is null"));
        }

        List<String> input = List.copyOf(strings);
        PrefixLogger.debug("Progressive run: algorithm=" + algorithmId + " strings=" + input.size()
                + " performance=" + configuration.includePerformance());

        RunResult result = input.size() == 1
                ? single(input, algorithmId, configuration.includePerformance())
                : progressive(input, algorithm.get(), configuration);

        PrefixLogger.debug("Progressive run finished: steps=" + result.totalSteps()
                + " finalPrefix='" + result.summary().finalCommonPrefix() + "'");
        return result;
    }

    // One string: a single step whose prefix is the string itself.
    private static RunResult single(List<String> input, String algorithmId, boolean includePerformance) {
        String only = input.get(0);
        Step step = new Step(1, 1, only, input);
        return new RunResult(
                List.of(step),
                1,
                algorithmId,
                Summary.of(1, only),
                includePerformance ? List.of() : null,
                includePerformance ? PerformanceSummary.empty() : null,
                null);
    }

    private static RunResult progressive(List<String> input,
                                         PrefixAlgorithm algorithm,
                                         ProgressiveConfiguration configuration) {
        PrefixFinder finder = algorithm.finder();
        PerformanceMeter meter = configuration.includePerformance()
                ? new PerformanceMeter(configuration.memoryModel())
                : null;

        List<Step> steps = new ArrayList<>(input.size() - 1);
        List<PerformanceRecord> records = meter == null ? null : new ArrayList<>(input.size() - 1);

        for (int k = 2; k <= input.size(); k++) {
            List<String> subset = new FrozenSlice(input, k);
            int stepIndex = k - 1;
            String prefix;
            if (meter != null) {
                PerformanceMeter.Measurement m = meter.measure(stepIndex, subset, finder);
                prefix = m.prefix();
                records.add(m.record());
            } else {
                prefix = finder.commonPrefix(subset);
            }
            steps.add(new Step(stepIndex, k, prefix, subset));
            PrefixLogger.trace("step " + stepIndex + ": " + k + " strings -> '" + prefix + "'");
        }

        String finalPrefix = steps.get(steps.size() - 1).commonPrefix();
        return new RunResult(
                steps,
                steps.size(),
                algorithm.id(),
                Summary.of(input.size(), finalPrefix),
                records,
                records == null ? null : PerformanceSummary.of(records),
                null);
    }

    // Immutable lists reject indexOf(null), so scan by hand.
    private static int firstNull(List<String> strings) {
        for (int i = 0; i < strings.size(); i++) {
            if (strings.get(i) == null) {
                return i;
            }
        }
        return -1;
    }

    private static RunResult reject(String algorithmId, int stringsCount, RunError error) {
        PrefixLogger.warning(NAME + ": " + error.message());
        return RunResult.failed(algorithmId, stringsCount, error);
    }
}
