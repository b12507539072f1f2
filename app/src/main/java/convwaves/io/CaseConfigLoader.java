package convwaves.io;

import convwaves.config.CaseConfig;
import convwaves.exception.ConfigurationException;
import lombok.RequiredArgsConstructor;

import java.io.IOException;

/**
 * Carga la configuración de un caso desde el recurso {@code cases/<caso>.json}.
 */
@RequiredArgsConstructor
public class CaseConfigLoader {

    public static final String CASES_DIRECTORY = "cases/";

    private final JsonFileHandler fileHandler;

    public CaseConfigLoader() {
        this(new JsonFileHandler());
    }

    /**
     * @throws ConfigurationException si el caso no existe o su JSON no es válido.
     */
    public CaseConfig load(String caseName) {
        if (caseName == null || caseName.isBlank()) {
            throw new ConfigurationException("El nombre del caso no puede estar vacío.");
        }
        String resource = CASES_DIRECTORY + caseName + ".json";
        CaseConfig config;
        try {
            config = fileHandler.readFromClasspath(resource, CaseConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Configuración ilegible para el caso '" + caseName + "'.", e);
        }
        if (config == null) {
            throw new ConfigurationException("No hay configuración para el caso '" + caseName + "' (" + resource + ").");
        }
        return config;
    }
}
