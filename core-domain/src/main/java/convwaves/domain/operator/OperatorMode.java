package convwaves.domain.operator;

import convwaves.exception.UnsupportedModeException;
import lombok.Getter;

import java.util.List;

/**
 * Variante del operador lineal.
 * <ul>
 *     <li>{@link #FULL}: sistema acoplado completo de 6 variables.</li>
 *     <li>{@link #ONE_WAY}: sistema reducido de 4 variables en el que la segunda
 *     temperatura queda ligada a la primera mediante {@code r0}.</li>
 * </ul>
 */
@Getter
public enum OperatorMode {

    FULL("full", List.of("w1", "w2", "T1", "T2", "q", "L")),
    ONE_WAY("oneway", List.of("T1", "T2", "q", "J1"));

    private final String tag;
    private final List<String> stateLabels;

    OperatorMode(String tag, List<String> stateLabels) {
        this.tag = tag;
        this.stateLabels = stateLabels;
    }

    /**
     * Número de variables de estado (dimensión de la matriz).
     */
    public int getDimension() {
        return stateLabels.size();
    }

    /**
     * Resuelve una etiqueta externa ("full", "oneway") al modo correspondiente.
     *
     * @throws UnsupportedModeException si la etiqueta no corresponde a ningún modo.
     */
    public static OperatorMode fromTag(String tag) {
        if (tag != null) {
            for (OperatorMode mode : values()) {
                if (mode.tag.equalsIgnoreCase(tag.trim()) || mode.name().equalsIgnoreCase(tag.trim())) {
                    return mode;
                }
            }
        }
        throw new UnsupportedModeException("Modo de operador desconocido: '" + tag + "'. Use 'full' u 'oneway'.");
    }
}
