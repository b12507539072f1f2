package convwaves.domain.params;

import convwaves.config.BaseCoefficients;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Conjunto inmutable de parámetros físicos de una ejecución.
 * <p>
 * Queda completamente determinado por la variante, el factor de escala radiativo,
 * los coeficientes base y la tabla radiativa. Se crea una vez por ejecución
 * (ver {@code ParameterSetFactory}) y es de solo lectura a partir de ahí.
 */
@Value
@Builder
public class ParameterSet {

    @NonNull
    ExperimentVariant variant;

    double radScaling;

    @NonNull
    BaseCoefficients base;

    @NonNull
    @Builder.Default
    RadiativeFeedback radiative = RadiativeFeedback.NONE;
}
