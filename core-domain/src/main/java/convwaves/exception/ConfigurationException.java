package convwaves.exception;

/**
 * Configuración de experimento inválida: variante desconocida, factor de escala
 * radiativo fuera de rango o tabla de coeficientes incompleta.
 * <p>
 * Es fatal para la ejecución en curso.
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
