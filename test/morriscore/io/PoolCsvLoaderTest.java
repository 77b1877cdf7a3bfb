package morriscore.io;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PoolCsvLoaderTest {

    private final PoolCsvLoader loader = new PoolCsvLoader();

    @Test
    void readsSemicolonAndCommaDecimals() throws IOException {
        double[][] pool = loader.read(new StringReader("0,25;0,5\n0.75 ; 1\n"), "inline");
        assertThat(pool).hasNumberOfRows(2);
        assertThat(pool[0]).containsExactly(0.25, 0.5);
        assertThat(pool[1]).containsExactly(0.75, 1.0);
    }

    @Test
    void readsWhitespaceSeparatedAndSkipsComments() throws IOException {
        String text = "# header\n\n0.1 0.2\t0.3\n   \n0.4  0.5 0.6\n";
        double[][] pool = loader.read(new StringReader(text), "inline");
        assertThat(pool).hasNumberOfRows(2);
        assertThat(pool[1]).containsExactly(0.4, 0.5, 0.6);
    }

    @Test
    void raggedRowsRejected() {
        assertThatThrownBy(() -> loader.read(new StringReader("0.1;0.2\n0.3\n"), "ragged.txt"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("строке 2")
                .hasMessageContaining("ragged.txt");
    }

    @Test
    void nonNumericCellRejected() {
        assertThatThrownBy(() -> loader.read(new StringReader("0.1;abc\n"), "bad.txt"))
                .isInstanceOf(IOException.class)
                .hasCauseInstanceOf(NumberFormatException.class);
    }

    @Test
    void emptyFileRejected() {
        assertThatThrownBy(() -> loader.read(new StringReader("# only comment\n"), "empty.txt"))
                .isInstanceOf(IOException.class);
    }

    @Test
    void loadsFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("pool.txt");
        Files.writeString(file, "0.2;0.4\n0.6;0.8\n");
        assertThat(loader.load(file.toString())[1]).containsExactly(0.6, 0.8);
    }

    @Test
    void loadsClasspathFixture() throws IOException {
        double[][] pool = loader.loadResource("pool_ishigami_5x3.txt");
        assertThat(pool).hasNumberOfRows(5);
        assertThat(pool[0]).containsExactly(-3.0, 0.5, 1.25);
        assertThat(pool[3]).containsExactly(1.5, 2.75, -2.5);
    }

    @Test
    void missingResourceRejected() {
        assertThatThrownBy(() -> loader.loadResource("no_such_pool.txt")).isInstanceOf(IOException.class);
    }
}
