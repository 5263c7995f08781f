package engine;

import algorithms.PrefixAlgorithm;
import algorithms.Prefixes;
import datagenerators.PrefixDatasetGenerator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import performance.PerformanceRecord;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProgressivePrefixFinder Tests")
class ProgressivePrefixFinderTest {

    private static final List<String> EXAMPLE =
            List.of("prefix_test_1", "prefix_test_2", "prefix_demo", "prefix_example");

    private final ProgressivePrefixFinder finder = new ProgressivePrefixFinder();

    @ParameterizedTest
    @ValueSource(strings = {"character", "binary_search", "trie"})
    @DisplayName("End-to-end example")
    void endToEnd(String algorithm) {
        RunResult result = finder.run(EXAMPLE, algorithm);

        assertFalse(result.hasError());
        assertEquals(algorithm, result.algorithmUsed());
        assertEquals(3, result.totalSteps());
        assertEquals(3, result.results().size());

        Step first = result.results().get(0);
        assertEquals(1, first.step());
        assertEquals(2, first.stringsCount());
        assertEquals("prefix_test_", first.commonPrefix());
        assertEquals(EXAMPLE.subList(0, 2), first.analyzedStrings());

        assertEquals("prefix_", result.prefixAt(2));
        assertEquals(3, result.results().get(1).stringsCount());
        assertEquals("prefix_", result.prefixAt(3));
        assertEquals(EXAMPLE, result.results().get(2).analyzedStrings());

        assertEquals(4, result.summary().initialStringsCount());
        assertEquals("prefix_", result.summary().finalCommonPrefix());
        assertEquals(7, result.summary().prefixLength());

        assertNull(result.performanceData());
        assertNull(result.performanceSummary());
    }

    @Test
    @DisplayName("Default algorithm is character")
    void defaultAlgorithm() {
        assertEquals("character", finder.run(EXAMPLE).algorithmUsed());
        assertEquals("character", finder.run(EXAMPLE, (String) null).algorithmUsed());
    }

    @Test
    @DisplayName("Empty input yields an error and no steps")
    void emptyInput() {
        RunResult result = finder.run(List.of());

        assertTrue(result.hasError());
        assertEquals(ErrorKind.EMPTY_INPUT, result.error().kind());
        assertEquals(0, result.totalSteps());
        assertTrue(result.results().isEmpty());
        assertEquals("", result.summary().finalCommonPrefix());

        assertEquals(ErrorKind.EMPTY_INPUT, finder.run(null).error().kind());
    }

    @Test
    @DisplayName("Unknown algorithm lists the valid identifiers")
    void unknownAlgorithm() {
        RunResult result = finder.run(EXAMPLE, "quantum");

        assertEquals(ErrorKind.UNKNOWN_ALGORITHM, result.error().kind());
        assertTrue(result.error().message().contains("quantum"));
        assertTrue(result.error().message().contains("character, binary_search, trie"));
        assertEquals(0, result.totalSteps());
        assertEquals("quantum", result.algorithmUsed());
    }

    @Test
    @DisplayName("Null element is reported, not thrown")
    void nullElement() {
        RunResult result = finder.run(Arrays.asList("a", null, "b"));

        assertEquals(ErrorKind.INVALID_INPUT, result.error().kind());
        assertTrue(result.error().message().contains("strings[1]"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"character", "binary_search", "trie"})
    @DisplayName("Single string produces one step")
    void singleString(String algorithm) {
        RunResult result = finder.run(List.of("single"), algorithm);

        assertFalse(result.hasError());
        assertEquals(1, result.totalSteps());
        Step only = result.results().get(0);
        assertEquals(1, only.step());
        assertEquals(1, only.stringsCount());
        assertEquals("single", only.commonPrefix());
        assertEquals(List.of("single"), only.analyzedStrings());
        assertEquals("single", result.summary().finalCommonPrefix());
        assertEquals(6, result.summary().prefixLength());
    }

    @Test
    @DisplayName("Edge cases without a common prefix")
    void noCommonPrefix() {
        assertEquals("", finder.run(List.of("abc", "xyz")).prefixAt(1));
        assertEquals("", finder.run(List.of("", "abc")).prefixAt(1));
        assertEquals("", finder.run(List.of("", "", "")).summary().finalCommonPrefix());
    }

    @ParameterizedTest
    @ValueSource(strings = {"character", "binary_search", "trie"})
    @DisplayName("Prefixes shrink monotonically and stay maximal")
    void monotonicAndMaximal(String algorithm) {
        var generator = new PrefixDatasetGenerator(3L, "abc".toCharArray());
        for (int round = 0; round < 50; round++) {
            List<String> strings = generator.decaying(2 + round % 12, 8);
            RunResult result = finder.run(strings, algorithm);

            assertEquals(strings.size() - 1, result.totalSteps());
            int previous = Integer.MAX_VALUE;
            for (Step step : result.results()) {
                assertTrue(step.prefixLength() <= previous, strings::toString);
                assertTrue(Prefixes.isLongestCommonPrefix(step.commonPrefix(), step.analyzedStrings()),
                        strings::toString);
                assertEquals(strings.subList(0, step.stringsCount()), step.analyzedStrings());
                previous = step.prefixLength();
            }
        }
    }

    @Test
    @DisplayName("Input list is copied, not retained")
    void inputCopied() {
        List<String> strings = new ArrayList<>(List.of("abc", "abd"));
        RunResult result = finder.run(strings);
        strings.set(0, "zzz");

        assertEquals(List.of("abc", "abd"), result.results().get(0).analyzedStrings());
        assertThrows(UnsupportedOperationException.class, () -> result.results().add(null));
    }

    @Test
    @DisplayName("Each step holds a read-only view of the leading strings")
    void analyzedStringsAreFrozenSlices() {
        List<String> strings = new PrefixDatasetGenerator(7L).sharedPrefix(5_000, 8, 4);
        RunResult result = finder.run(strings, "binary_search");

        assertEquals(strings.size() - 1, result.totalSteps());
        for (Step step : result.results()) {
            int k = step.stringsCount();
            List<String> analyzed = step.analyzedStrings();
            assertEquals(k, analyzed.size());
            assertEquals(strings.subList(0, k), analyzed);
        }
        List<String> first = result.results().get(0).analyzedStrings();
        assertThrows(UnsupportedOperationException.class, () -> first.add("x"));
        assertThrows(UnsupportedOperationException.class, () -> first.set(0, "x"));
        assertThrows(UnsupportedOperationException.class, () -> first.remove(0));
        assertThrows(UnsupportedOperationException.class, () -> first.subList(0, 1).clear());
    }

    @Test
    @DisplayName("Performance records follow the steps")
    void performanceRecords() {
        RunResult result = finder.run(EXAMPLE, "trie", true);

        assertTrue(result.hasPerformanceData());
        assertEquals(3, result.performanceData().size());
        for (int i = 0; i < 3; i++) {
            PerformanceRecord r = result.performanceData().get(i);
            Step step = result.results().get(i);
            assertEquals(step.step(), r.step());
            assertEquals(step.stringsCount(), r.stringsCount());
            assertTrue(r.executionTimeMs() >= 0.0);
            assertEquals(step.stringsCount(), r.memoryEstimate().stringsCount());
            assertEquals(step.prefixLength(), r.memoryEstimate().outputChars());
        }
        // 13 + 13 chars in, "prefix_test_" out
        assertEquals(26, result.performanceData().get(0).memoryEstimate().inputChars());
        assertEquals((26 + 12) * 4, result.performanceData().get(0).memoryEstimate().estimatedBytes());
    }

    @Test
    @DisplayName("Performance summary aggregates the records")
    void performanceSummary() {
        List<String> strings = new PrefixDatasetGenerator(5L).sharedPrefix(40, 20, 5);
        RunResult result = finder.run(strings, "binary_search", true);

        double sum = result.performanceData().stream().mapToDouble(PerformanceRecord::executionTimeMs).sum();
        long totalStrings = result.results().stream().mapToLong(Step::stringsCount).sum();
        long peak = result.performanceData().stream()
                .mapToLong(r -> r.memoryEstimate().estimatedBytes()).max().orElseThrow();

        assertEquals(sum, result.performanceSummary().totalExecutionTimeMs(), 1e-9);
        assertEquals(totalStrings, result.performanceSummary().totalStringsProcessed());
        assertEquals(peak, result.performanceSummary().peakMemoryEstimateBytes());
        assertTrue(result.performanceSummary().minExecutionTimeMs()
                <= result.performanceSummary().maxExecutionTimeMs());
    }

    @Test
    @DisplayName("Single string with instrumentation has empty performance data")
    void singleStringPerformance() {
        RunResult result = finder.run(List.of("only"), "character", true);

        assertTrue(result.performanceData().isEmpty());
        assertEquals(0.0, result.performanceSummary().totalExecutionTimeMs());
        assertEquals(0L, result.performanceSummary().totalStringsProcessed());
    }

    @Test
    @DisplayName("Configured defaults are used")
    void configuredDefaults() {
        var engine = new ProgressivePrefixFinder(ProgressiveConfiguration.builder()
                .algorithm(PrefixAlgorithm.TRIE)
                .includePerformance(true)
                .build());

        RunResult result = engine.run(EXAMPLE);
        assertEquals("trie", result.algorithmUsed());
        assertTrue(result.hasPerformanceData());

        RunResult plain = engine.run(EXAMPLE, "character", false);
        assertEquals("character", plain.algorithmUsed());
        assertFalse(plain.hasPerformanceData());
    }
}
