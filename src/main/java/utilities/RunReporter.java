package utilities;

import algorithms.PrefixAlgorithm;
import analysis.ComparisonReport;
import analysis.Discrepancy;
import engine.RunResult;
import engine.Step;
import performance.PerformanceRecord;
import performance.PerformanceSummary;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Console and CSV reporting for progressive runs and algorithm comparisons.
 */
public final class RunReporter {

    // analyzed_strings are shown as the first few entries plus "+N more"
    public static final int PREVIEW_LIMIT = 3;

    private static final List<String> PERFORMANCE_HEADER = List.of(
            "algorithm", "step", "strings_count", "execution_time_ms",
            "input_chars", "output_chars", "estimated_bytes", "common_prefix");

    private RunReporter() {}

    public static void printRun(PrintStream out, RunResult result) {
        if (result.hasError()) {
            out.printf(Locale.ROOT, "Error (%s): %s%n", result.error().kind(), result.error().message());
            return;
        }
        out.printf(Locale.ROOT, "Algorithm: %s (%s)%n", result.algorithmUsed(),
                PrefixAlgorithm.lookup(result.algorithmUsed())
                        .map(PrefixAlgorithm::displayName)
                        .orElse("unknown"));
        for (Step step : result.results()) {
            out.printf(Locale.ROOT, "Step %d: %d strings -> '%s'  %s%n",
                    step.step(), step.stringsCount(), step.commonPrefix(), describeAnalyzed(step));
        }
        out.printf(Locale.ROOT, "Final common prefix: '%s' (length %d, %d strings)%n",
                result.summary().finalCommonPrefix(),
                result.summary().prefixLength(),
                result.summary().initialStringsCount());

        if (result.hasPerformanceData()) {
            PerformanceSummary perf = result.performanceSummary();
            out.printf(Locale.ROOT,
                    "Performance: total=%.4f ms, avg=%.4f ms, max=%.4f ms, min=%.4f ms, peakMem=%d B, strings=%d%n",
                    perf.totalExecutionTimeMs(), perf.averageExecutionTimeMs(),
                    perf.maxExecutionTimeMs(), perf.minExecutionTimeMs(),
                    perf.peakMemoryEstimateBytes(), perf.totalStringsProcessed());
        }
    }

    public static void printComparison(PrintStream out, ComparisonReport report) {
        out.printf(Locale.ROOT, "Compared %s over %d string(s)%n",
                report.algorithmsCompared(), report.inputStringsCount());
        report.comparisonResults().forEach((algorithm, result) -> {
            if (result.hasError()) {
                out.printf(Locale.ROOT, "  %s -> error: %s%n", algorithm, result.error().message());
                return;
            }
            PerformanceSummary perf = result.performanceSummary();
            out.printf(Locale.ROOT, "  %s -> '%s' total=%.4f ms avg=%.4f ms peakMem=%d B%n",
                    algorithm, result.summary().finalCommonPrefix(),
                    perf.totalExecutionTimeMs(), perf.averageExecutionTimeMs(),
                    perf.peakMemoryEstimateBytes());
        });
        if (report.agreement()) {
            out.println("All algorithms agree at every step");
        } else {
            out.println("Algorithms DISAGREE:");
            for (Discrepancy d : report.discrepancies()) {
                out.println("  " + d.describe());
            }
        }
    }

    // "[a, b, c] + 2 more" for long subsets, the plain list otherwise.
    public static String describeAnalyzed(Step step) {
        List<String> analyzed = step.analyzedStrings();
        if (analyzed.size() <= PREVIEW_LIMIT) {
            return analyzed.toString();
        }
        return analyzed.subList(0, PREVIEW_LIMIT) + " + " + (analyzed.size() - PREVIEW_LIMIT) + " more";
    }

    public static List<List<Object>> performanceRows(String algorithm, RunResult result) {
        List<List<Object>> rows = new ArrayList<>();
        if (!result.hasPerformanceData()) {
            return rows;
        }
        List<PerformanceRecord> records = result.performanceData();
        for (int i = 0; i < records.size(); i++) {
            PerformanceRecord r = records.get(i);
            List<Object> row = new ArrayList<>(PERFORMANCE_HEADER.size());
            row.add(algorithm);
            row.add(r.step());
            row.add(r.stringsCount());
            row.add(r.executionTimeMs());
            row.add(r.memoryEstimate().inputChars());
            row.add(r.memoryEstimate().outputChars());
            row.add(r.memoryEstimate().estimatedBytes());
            row.add(result.results().get(i).commonPrefix());
            rows.add(row);
        }
        return rows;
    }

    public static Path writePerformanceCsv(Path file, RunResult result) throws IOException {
        List<List<Object>> rows = new ArrayList<>();
        rows.add(new ArrayList<>(PERFORMANCE_HEADER));
        rows.addAll(performanceRows(result.algorithmUsed(), result));
        CsvUtil.writeRows(file, rows);
        return file;
    }

    public static Path writeComparisonCsv(Path file, ComparisonReport report) throws IOException {
        List<List<Object>> rows = new ArrayList<>();
        rows.add(new ArrayList<>(PERFORMANCE_HEADER));
        report.comparisonResults().forEach((algorithm, result) -> rows.addAll(performanceRows(algorithm, result)));
        CsvUtil.writeRows(file, rows);
        return file;
    }
}
