package convwaves.domain.params;

import convwaves.exception.ConfigurationException;
import lombok.Getter;

/**
 * Variantes de experimento. Cada una decide qué subconjunto de coeficientes
 * radiativos se rellena a partir de la tabla empírica.
 */
@Getter
public enum ExperimentVariant {

    /** Solo convección. */
    NO_RADIATION("no_rad", false, false),
    /** Convección + radiación de humedad y temperatura. */
    MOISTURE_TEMPERATURE("qt_rad", true, false),
    /** Convección + radiación de nubes (ligada a la velocidad vertical). */
    CLOUD("cld_rad", false, true),
    /** Convección + humedad, temperatura y nubes. */
    FULL("qt_cld_rad", true, true);

    private final String tag;
    private final boolean moistureTemperatureRadiation;
    private final boolean cloudRadiation;

    ExperimentVariant(String tag, boolean moistureTemperatureRadiation, boolean cloudRadiation) {
        this.tag = tag;
        this.moistureTemperatureRadiation = moistureTemperatureRadiation;
        this.cloudRadiation = cloudRadiation;
    }

    /**
     * Indica si la variante necesita consultar la tabla externa de coeficientes.
     */
    public boolean isRadiativelyActive() {
        return moistureTemperatureRadiation || cloudRadiation;
    }

    /**
     * @throws ConfigurationException si la etiqueta no corresponde a ninguna variante.
     */
    public static ExperimentVariant fromTag(String tag) {
        if (tag != null) {
            for (ExperimentVariant variant : values()) {
                if (variant.tag.equalsIgnoreCase(tag.trim()) || variant.name().equalsIgnoreCase(tag.trim())) {
                    return variant;
                }
            }
        }
        throw new ConfigurationException("Tipo de experimento inválido: '" + tag
                + "'. Opciones: no_rad, qt_rad, cld_rad, qt_cld_rad.");
    }
}
