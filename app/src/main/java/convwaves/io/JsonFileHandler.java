package convwaves.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lectura y escritura de objetos (POJOs y records) en archivos JSON con Jackson.
 * <p>
 * Los errores de E/S se registran y se relanzan: no hay resultados parciales.
 */
@Slf4j
public class JsonFileHandler {

    // Costoso de crear y thread-safe: una única instancia compartida.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Serializa {@code data} en {@code path}, creando los directorios padre. Sobrescribe
     * el archivo si existe.
     *
     * @throws IOException si falla la escritura.
     */
    public <T> void writeToFile(T data, Path path) throws IOException {
        log.info("Escribiendo {} en {}", data.getClass().getSimpleName(), path.toAbsolutePath());
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), data);
            log.debug("Escritura JSON completada: {}", path.getFileName());
        } catch (IOException e) {
            log.error("Error fatal al escribir el archivo JSON en {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    public <T> void writeToFile(T data, String filePath) throws IOException {
        writeToFile(data, Path.of(filePath));
    }

    /**
     * Reconstruye un objeto de tipo {@code objectType} a partir de un archivo JSON.
     *
     * @throws IOException si el archivo no existe o su contenido no es válido.
     */
    public <T> T readFromFile(Path path, Class<T> objectType) throws IOException {
        log.info("Leyendo {} como {}", path.toAbsolutePath(), objectType.getSimpleName());
        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }
        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el archivo JSON {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    public <T> T readFromFile(String filePath, Class<T> objectType) throws IOException {
        return readFromFile(Path.of(filePath), objectType);
    }

    /**
     * Lee un recurso del classpath (ej: "cases/no_rad.json").
     *
     * @return El objeto, o {@code null} si el recurso no existe.
     * @throws IOException si el contenido no es válido.
     */
    public <T> T readFromClasspath(String resource, Class<T> objectType) throws IOException {
        ClassLoader loader = JsonFileHandler.class.getClassLoader();
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                log.warn("Recurso no encontrado en el classpath: {}", resource);
                return null;
            }
            log.info("Leyendo recurso {} como {}", resource, objectType.getSimpleName());
            return objectMapper.readValue(in, objectType);
        } catch (IOException e) {
            log.error("Error fatal al parsear el recurso JSON {}", resource, e);
            throw e;
        }
    }
}
