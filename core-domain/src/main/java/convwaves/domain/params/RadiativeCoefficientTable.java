package convwaves.domain.params;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Tabla empírica de coeficientes de retroalimentación radiativa, tal y como llega de la
 * fuente externa. Cada campo es un array indexado por modo vertical (0 = modo 1, 1 = modo 2)
 * y separado en onda larga (lw) y onda corta (sw).
 * <p>
 * El núcleo la trata como datos numéricos opacos.
 */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record RadiativeCoefficientTable(
        @JsonProperty("RT1_lw") double[] rt1Lw,
        @JsonProperty("RT1_sw") double[] rt1Sw,
        @JsonProperty("RT2_lw") double[] rt2Lw,
        @JsonProperty("RT2_sw") double[] rt2Sw,
        @JsonProperty("Rq_lw") double[] rqLw,
        @JsonProperty("Rq_sw") double[] rqSw,
        @JsonProperty("Rw1_lw") double[] rw1Lw,
        @JsonProperty("Rw1_sw") double[] rw1Sw,
        @JsonProperty("Rw2_lw") double[] rw2Lw,
        @JsonProperty("Rw2_sw") double[] rw2Sw
) {
}
