package utilities;

import analysis.AlgorithmComparator;
import engine.ProgressivePrefixFinder;
import engine.RunResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ResultJson Tests")
class ResultJsonTest {

    private final ProgressivePrefixFinder finder = new ProgressivePrefixFinder();

    @Test
    @DisplayName("Run result uses the tool's field names")
    @SuppressWarnings("unchecked")
    void runResultFields() {
        RunResult result = finder.run(List.of("prefix_test_1", "prefix_test_2", "prefix_demo"));
        Map<String, Object> map = ResultJson.toMap(result);

        assertEquals(2, map.get("total_steps"));
        assertEquals("character", map.get("algorithm_used"));
        assertFalse(map.containsKey("performance_data"));
        assertFalse(map.containsKey("performance_summary"));
        assertFalse(map.containsKey("error"));

        List<Map<String, Object>> steps = (List<Map<String, Object>>) map.get("results");
        assertEquals(2, steps.size());
        assertEquals(1, steps.get(0).get("step"));
        assertEquals(2, steps.get(0).get("strings_count"));
        assertEquals("prefix_test_", steps.get(0).get("common_prefix"));
        assertEquals(List.of("prefix_test_1", "prefix_test_2"), steps.get(0).get("analyzed_strings"));

        Map<String, Object> summary = (Map<String, Object>) map.get("summary");
        assertEquals(3, summary.get("initial_strings_count"));
        assertEquals("prefix_", summary.get("final_common_prefix"));
        assertEquals(7, summary.get("prefix_length"));
    }

    @Test
    @DisplayName("Performance sections appear when requested")
    @SuppressWarnings("unchecked")
    void performanceFields() {
        Map<String, Object> map = ResultJson.toMap(finder.run(List.of("ab", "ac"), "trie", true));

        List<Map<String, Object>> perf = (List<Map<String, Object>>) map.get("performance_data");
        assertEquals(1, perf.size());
        assertTrue(perf.get(0).containsKey("execution_time_ms"));
        Map<String, Object> memory = (Map<String, Object>) perf.get(0).get("memory_estimate");
        assertEquals(4, memory.get("input_chars"));
        assertEquals(1, memory.get("output_chars"));
        assertEquals(20, memory.get("estimated_bytes"));

        Map<String, Object> summary = (Map<String, Object>) map.get("performance_summary");
        assertEquals(2, summary.get("total_strings_processed"));
        assertEquals(20, summary.get("peak_memory_estimate_bytes"));
    }

    @Test
    @DisplayName("Errors are serialized with kind and message")
    @SuppressWarnings("unchecked")
    void errorField() {
        Map<String, Object> map = ResultJson.toMap(finder.run(List.of()));

        Map<String, Object> error = (Map<String, Object>) map.get("error");
        assertEquals("EMPTY_INPUT", error.get("kind"));
        assertEquals(0, map.get("total_steps"));
        assertEquals(List.of(), map.get("results"));
    }

    @Test
    @DisplayName("Comparison report renders as JSON")
    void comparisonJson() {
        String json = ResultJson.toJson(new AlgorithmComparator().compareAlgorithms(List.of("abc", "abd"), true));

        assertTrue(json.contains("\"algorithms_compared\":[\"character\",\"binary_search\",\"trie\"]"));
        assertTrue(json.contains("\"agreement\":true"));
        assertTrue(json.contains("\"accuracy_check\""));
        assertTrue(ResultJson.toPrettyJson(Map.of("k", 1)).contains("\"k\" : 1"));
    }
}
