package convwaves.io;

import convwaves.domain.params.RadiativeCoefficientTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JsonRadiativeCoefficientSourceTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Lee la tabla desde el classpath con los nombres de campo externos")
    void load_fromClasspath() throws IOException {
        RadiativeCoefficientTable table = new JsonRadiativeCoefficientSource("radiation/test_coeff.json").load();

        assertThat(table.rt1Lw()).containsExactly(1.0, 2.0);
        assertThat(table.rqSw()).containsExactly(1.0, 1.0);
        assertThat(table.rw2Sw()).containsExactly(1.0, 2.0);
    }

    @Test
    @DisplayName("Un archivo del sistema tiene prioridad sobre el classpath")
    void load_fromFile() throws IOException {
        Path file = tempDir.resolve("coeff.json");
        Files.writeString(file, "{ \"RT1_lw\": [0.1, 0.2], \"Rw1_sw\": [0.3, 0.4] }");

        RadiativeCoefficientTable table = new JsonRadiativeCoefficientSource(file.toString()).load();

        assertThat(table.rt1Lw()).containsExactly(0.1, 0.2);
        assertThat(table.rw1Sw()).containsExactly(0.3, 0.4);
        assertThat(table.rqLw()).isNull();
    }

    @Test
    @DisplayName("Una ubicación inexistente lanza IOException")
    void load_missing_shouldThrow() {
        assertThrows(IOException.class, () -> new JsonRadiativeCoefficientSource("radiation/no_existe.json").load());
    }
}
