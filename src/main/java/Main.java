import algorithms.PrefixAlgorithm;
import analysis.AlgorithmComparator;
import analysis.ComparisonReport;
import analysis.UsageExample;
import analysis.UsageExamples;
import datagenerators.PrefixDatasetGenerator;
import engine.ProgressiveConfiguration;
import engine.ProgressivePrefixFinder;
import engine.RunResult;
import utilities.MemUtil;
import utilities.ResultJson;
import utilities.RunReporter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Command-line driver for the progressive prefix finder. Input comes from {@code --strings},
 * {@code --file} (one string per line) or {@code --generate}; {@code --compare} runs all three
 * algorithms and {@code --examples} replays the built-in usage examples.
 */
public final class Main {

    private static final int DEFAULT_GENERATE_COUNT = 1_000;
    private static final int DEFAULT_PREFIX_LENGTH = 32;
    private static final int DEFAULT_SUFFIX_LENGTH = 16;
    private static final long DEFAULT_SEED = 42L;

    public static void main(String[] args) throws IOException {
        CliOptions options = CliOptions.parse(args);

        ProgressiveConfiguration configuration = ProgressiveConfiguration.builder()
                .algorithm(options.algorithm)
                .includePerformance(options.performance)
                .build();
        ProgressivePrefixFinder engine = new ProgressivePrefixFinder(configuration);

        if (options.examples) {
            runExamples(engine);
            return;
        }

        List<String> strings = options.loadStrings();

        if (options.compare) {
            ComparisonReport report = new AlgorithmComparator(engine).compareAlgorithms(strings, options.visualize);
            if (options.json) {
                System.out.println(ResultJson.toPrettyJson(report));
            } else {
                RunReporter.printComparison(System.out, report);
            }
            if (options.csv != null) {
                System.out.println("CSV written: " + RunReporter.writeComparisonCsv(options.csv, report).toAbsolutePath());
            }
        } else {
            RunResult result = engine.run(strings);
            if (options.json) {
                System.out.println(ResultJson.toPrettyJson(result));
            } else {
                RunReporter.printRun(System.out, result);
            }
            if (options.csv != null && result.hasPerformanceData()) {
                System.out.println("CSV written: " + RunReporter.writePerformanceCsv(options.csv, result).toAbsolutePath());
            }
        }

        if (options.jol && !strings.isEmpty()) {
            System.out.println(MemUtil.trieFootprintReport(strings));
        }
    }

    private static void runExamples(ProgressivePrefixFinder engine) {
        int failures = 0;
        for (UsageExample example : UsageExamples.generate()) {
            RunResult result = engine.run(example.input());
            boolean ok = example.expectsError()
                    ? result.hasError() && result.error().kind() == example.expectedError()
                    : !result.hasError() && result.summary().finalCommonPrefix().equals(example.expectedFinalPrefix());
            if (!ok) failures++;
            System.out.printf(Locale.ROOT, "%-24s %-4s %-13s %s -> %s%s%n",
                    example.name(), ok ? "OK" : "FAIL", result.algorithmUsed(), example.input(),
                    result.hasError() ? result.error().kind() : "'" + result.summary().finalCommonPrefix() + "'",
                    result.hasPerformanceData()
                            ? String.format(Locale.ROOT, " (%.4f ms)", result.performanceSummary().totalExecutionTimeMs())
                            : "");
        }
        System.out.printf(Locale.ROOT, "%d example(s), %d failure(s)%n", UsageExamples.generate().size(), failures);
    }

    private static final class CliOptions {
        private static final Set<String> FLAGS = Set.of("performance", "compare", "visualize", "examples", "json", "jol");

        final List<String> inlineStrings;
        final Path file;
        final Integer generateCount;
        final int prefixLength;
        final int suffixLength;
        final long seed;
        final String algorithm;
        final boolean performance;
        final boolean compare;
        final boolean visualize;
        final boolean examples;
        final boolean json;
        final boolean jol;
        final Path csv;

        private CliOptions(List<String> inlineStrings,
                           Path file,
                           Integer generateCount,
                           int prefixLength,
                           int suffixLength,
                           long seed,
                           String algorithm,
                           boolean performance,
                           boolean compare,
                           boolean visualize,
                           boolean examples,
                           boolean json,
                           boolean jol,
                           Path csv) {
            this.inlineStrings = inlineStrings;
            this.file = file;
            this.generateCount = generateCount;
            this.prefixLength = prefixLength;
            this.suffixLength = suffixLength;
            this.seed = seed;
            this.algorithm = algorithm;
            this.performance = performance;
            this.compare = compare;
            this.visualize = visualize;
            this.examples = examples;
            this.json = json;
            this.jol = jol;
            this.csv = csv;
        }

        static CliOptions parse(String[] args) {
            List<String> strings = null;
            Path file = null;
            Integer generate = null;
            int prefixLength = DEFAULT_PREFIX_LENGTH;
            int suffixLength = DEFAULT_SUFFIX_LENGTH;
            long seed = DEFAULT_SEED;
            String algorithm = PrefixAlgorithm.DEFAULT.id();
            boolean performance = false;
            boolean compare = false;
            boolean visualize = false;
            boolean examples = false;
            boolean json = false;
            boolean jol = false;
            Path csv = null;

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                if (!arg.startsWith("--")) {
                    continue;
                }
                String key;
                String value;
                int eq = arg.indexOf('=');
                if (eq >= 0) {
                    key = arg.substring(2, eq);
                    value = arg.substring(eq + 1);
                } else {
                    key = arg.substring(2);
                    if (FLAGS.contains(key)) {
                        value = "true";
                    } else {
                        if (i + 1 >= args.length) {
                            throw new IllegalArgumentException("Missing value for option --" + key);
                        }
                        value = args[++i];
                    }
                }
                switch (key) {
                    case "strings" -> strings = Arrays.asList(value.split(",", -1));
                    case "file" -> file = Path.of(value);
                    case "generate" -> generate = Integer.parseInt(value);
                    case "prefix-length" -> prefixLength = Integer.parseInt(value);
                    case "suffix-length" -> suffixLength = Integer.parseInt(value);
                    case "seed" -> seed = Long.parseLong(value);
                    case "algorithm" -> algorithm = value;
                    case "performance" -> performance = Boolean.parseBoolean(value);
                    case "compare" -> compare = Boolean.parseBoolean(value);
                    case "visualize" -> visualize = Boolean.parseBoolean(value);
                    case "examples" -> examples = Boolean.parseBoolean(value);
                    case "json" -> json = Boolean.parseBoolean(value);
                    case "jol" -> jol = Boolean.parseBoolean(value);
                    case "csv" -> csv = Path.of(value);
                    default -> throw new IllegalArgumentException("Unknown option --" + key);
                }
            }

            return new CliOptions(strings, file, generate, prefixLength, suffixLength, seed, algorithm,
                    performance, compare, visualize, examples, json, jol, csv);
        }

        List<String> loadStrings() throws IOException {
            if (inlineStrings != null) {
                return inlineStrings;
            }
            if (file != null) {
                return Files.readAllLines(file, StandardCharsets.UTF_8);
            }
            int count = Objects.requireNonNullElse(generateCount, DEFAULT_GENERATE_COUNT);
            return new PrefixDatasetGenerator(seed).sharedPrefix(count, prefixLength, suffixLength);
        }
    }
}
