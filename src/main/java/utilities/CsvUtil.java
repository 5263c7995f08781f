package utilities;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

public final class CsvUtil {
    private CsvUtil() {}

    // Formatting options; prefixes routinely contain delimiters, so quoting is on demand.
    public static final class Config {
        private final char delimiter;
        private final char quote;
        private final String lineSeparator;
        private final Charset charset;

        private Config(char delimiter, char quote, String lineSeparator, Charset charset) {
            this.delimiter = delimiter;
            this.quote = quote;
            this.lineSeparator = Objects.requireNonNull(lineSeparator, "lineSeparator");
            this.charset = Objects.requireNonNull(charset, "charset");
        }

        // Comma, double quote, "\n", UTF-8.
        public static Config defaults() {
            return new Config(',', '"', "\n", StandardCharsets.UTF_8);
        }

        public Config withDelimiter(char delimiter)  { return new Config(delimiter, quote, lineSeparator, charset); }
    }

    public static void writeRows(Path file, List<? extends List<?>> rows) throws IOException {
        writeRows(file, rows, Config.defaults());
    }

    public static void writeRows(Path file, List<? extends List<?>> rows, Config config) throws IOException {
        try (BufferedWriter bw = Files.newBufferedWriter(file, config.charset)) {
            writeRows(bw, rows, config);
        }
    }

    // Caller closes the writer.
    public static void writeRows(Writer writer, List<? extends List<?>> rows, Config config) throws IOException {
        Objects.requireNonNull(writer, "writer");
        Objects.requireNonNull(rows, "rows");
        Objects.requireNonNull(config, "config");
        for (List<?> row : rows) {
            writer.write(toCsvLine(row, config));
            writer.write(config.lineSeparator);
        }
        writer.flush();
    }

    public static String toCsv(List<? extends List<?>> rows) {
        Config config = Config.defaults();
        StringBuilder sb = new StringBuilder();
        for (List<?> row : rows) {
            sb.append(toCsvLine(row, config)).append(config.lineSeparator);
        }
        return sb.toString();
    }

    public static String toCsvLine(List<?> row, Config config) {
        Objects.requireNonNull(row, "row");
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < row.size(); i++) {
            if (i > 0) sb.append(config.delimiter);
            sb.append(quoteIfNeeded(stringify(row.get(i)), config));
        }
        return sb.toString();
    }

    // null becomes an empty field; doubles are written with a fixed, locale-independent format.
    private static String stringify(Object value) {
        if (value == null) return "";
        if (value instanceof Double d) return String.format(Locale.ROOT, "%.6f", d);
        return String.valueOf(value);
    }

    private static String quoteIfNeeded(String field, Config config) {
        boolean needsQuoting = field.indexOf(config.delimiter) >= 0
                || field.indexOf(config.quote) >= 0
                || field.indexOf('\n') >= 0
                || field.indexOf('\r') >= 0;
        if (!needsQuoting) {
            return field;
        }
        String q = String.valueOf(config.quote);
        return q + field.replace(q, q + q) + q;
    }
}
