package utilities;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CsvUtil Tests")
class CsvUtilTest {

    @Test
    @DisplayName("Fields with delimiters and quotes are quoted")
    void quoting() {
        String line = CsvUtil.toCsvLine(Arrays.asList("plain", "a,b", "say \"hi\"", null, 2, 0.5),
                CsvUtil.Config.defaults());

        assertEquals("plain,\"a,b\",\"say \"\"hi\"\"\",,2,0.500000", line);
    }

    @Test
    @DisplayName("Custom delimiter")
    void delimiter() {
        assertEquals("a;b,c", CsvUtil.toCsvLine(List.of("a", "b,c"), CsvUtil.Config.defaults().withDelimiter(';')));
    }

    @Test
    @DisplayName("Rows are written to file")
    void writeFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("out.csv");
        CsvUtil.writeRows(file, List.of(List.of("h1", "h2"), List.of("x", 1)));

        assertEquals(List.of("h1,h2", "x,1"), Files.readAllLines(file, StandardCharsets.UTF_8));
        assertEquals("h1,h2\nx,1\n", CsvUtil.toCsv(List.of(List.of("h1", "h2"), List.of("x", 1))));
    }
}
