package convwaves.exception;

/**
 * Las dimensiones del buffer de trayectoria, la malla temporal, el vector de números
 * de onda y el estado inicial no son coherentes entre sí.
 */
public class DimensionMismatchException extends IllegalArgumentException {

    public DimensionMismatchException(String message) {
        super(message);
    }

    /**
     * Helper para los mensajes del tipo "esperado X, recibido Y".
     */
    public static DimensionMismatchException of(String what, int expected, int actual) {
        return new DimensionMismatchException(
                String.format("Dimensión incoherente en %s: esperado %d, recibido %d", what, expected, actual));
    }
}
