package convwaves.exception;

/**
 * Modo de operador no reconocido (solo existen el sistema completo y el reducido "one-way").
 */
public class UnsupportedModeException extends IllegalArgumentException {

    public UnsupportedModeException(String message) {
        super(message);
    }
}
