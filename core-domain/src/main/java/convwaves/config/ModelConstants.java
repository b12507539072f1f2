package convwaves.config;

import lombok.Builder;
import lombok.With;

/**
 * Escalas físicas que ligan las variables adimensionales del modelo con unidades reales.
 *
 * @param referenceLengthKm   Escala horizontal de referencia en km (número de onda k = 2π·L/λ).
 * @param referenceTimeSeconds Escala temporal de referencia en segundos (1 día).
 */
@Builder
@With
public record ModelConstants(
        double referenceLengthKm,
        double referenceTimeSeconds
) {

    public static ModelConstants standard() {
        return ModelConstants.builder()
                .referenceLengthKm(4320.0)
                .referenceTimeSeconds(86400.0)
                .build();
    }

    /**
     * Velocidad de referencia en m/s (L·1000 / T). Convierte frecuencias adimensionales
     * en velocidades de fase físicas.
     */
    public double velocityScale() {
        return referenceLengthKm * 1000.0 / referenceTimeSeconds;
    }

    /**
     * Número de onda adimensional para una longitud de onda en km.
     */
    public double toWavenumber(double wavelengthKm) {
        return 2.0 * Math.PI * referenceLengthKm / wavelengthKm;
    }
}
