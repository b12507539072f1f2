package convwaves.domain.params;

import lombok.Builder;
import lombok.Value;

/**
 * Coeficientes de retroalimentación radiativa, separados en onda larga (LW) y corta (SW).
 * <p>
 * Convención de índices {@code Rxij}: el estado del modo {@code i} afecta a la tendencia
 * de temperatura del modo {@code j}. Así {@code RT21} acopla T2 con la ecuación de T1.
 * <p>
 * Los coeficientes no poblados valen exactamente cero.
 */
@Value
@Builder(toBuilder = true)
public class RadiativeFeedback {

    public static final RadiativeFeedback NONE = RadiativeFeedback.builder().build();

    // --- Temperatura ---
    double rt11Lw;
    double rt11Sw;
    double rt12Lw;
    double rt12Sw;
    double rt21Lw;
    double rt21Sw;
    double rt22Lw;
    double rt22Sw;

    // --- Humedad ---
    double rq1Lw;
    double rq1Sw;
    double rq2Lw;
    double rq2Sw;

    // --- Velocidad vertical (nubes) ---
    double rw11Lw;
    double rw11Sw;
    double rw12Lw;
    double rw12Sw;
    double rw21Lw;
    double rw21Sw;
    double rw22Lw;
    double rw22Sw;

    // --- Coeficientes agregados (LW + SW) que usa el operador ---

    public double getRT11() {
        return rt11Lw + rt11Sw;
    }

    public double getRT12() {
        return rt12Lw + rt12Sw;
    }

    public double getRT21() {
        return rt21Lw + rt21Sw;
    }

    public double getRT22() {
        return rt22Lw + rt22Sw;
    }

    public double getRq1() {
        return rq1Lw + rq1Sw;
    }

    public double getRq2() {
        return rq2Lw + rq2Sw;
    }

    public double getRw11() {
        return rw11Lw + rw11Sw;
    }

    public double getRw12() {
        return rw12Lw + rw12Sw;
    }

    public double getRw21() {
        return rw21Lw + rw21Sw;
    }

    public double getRw22() {
        return rw22Lw + rw22Sw;
    }
}
