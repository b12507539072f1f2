package convwaves.io;

import convwaves.domain.params.RadiativeCoefficientSource;
import convwaves.domain.params.RadiativeCoefficientTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Fuente de coeficientes radiativos respaldada por un JSON con los campos
 * {@code RT1_lw}, {@code RT1_sw}, ..., {@code Rw2_sw}.
 * <p>
 * La ubicación se busca primero en el sistema de archivos y después en el classpath.
 */
@Slf4j
@RequiredArgsConstructor
public class JsonRadiativeCoefficientSource implements RadiativeCoefficientSource {

    private final JsonFileHandler fileHandler;
    private final String location;

    public JsonRadiativeCoefficientSource(String location) {
        this(new JsonFileHandler(), location);
    }

    @Override
    public RadiativeCoefficientTable load() throws IOException {
        Path path = Path.of(location);
        if (Files.isRegularFile(path)) {
            return fileHandler.readFromFile(path, RadiativeCoefficientTable.class);
        }
        log.debug("{} no es un archivo, se busca en el classpath.", location);
        RadiativeCoefficientTable table = fileHandler.readFromClasspath(location, RadiativeCoefficientTable.class);
        if (table == null) {
            throw new IOException("Tabla de coeficientes radiativos no encontrada: " + location);
        }
        return table;
    }
}
