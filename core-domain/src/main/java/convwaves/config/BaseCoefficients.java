package convwaves.config;

import lombok.Builder;
import lombok.With;

/**
 * Coeficientes físicos/empíricos no radiativos. Son idénticos en todas las variantes
 * de experimento.
 *
 * @param a1  Relación entre movimiento vertical (modo 1) y humedad.
 * @param a2  Relación entre movimiento vertical (modo 2) y humedad.
 * @param b1  Relación entre la MSE de capa límite y la temperatura del modo 1.
 * @param b2  Relación entre la MSE de capa límite y la temperatura del modo 2.
 * @param c1  Velocidad de fase adimensional del modo 1.
 * @param c2  Velocidad de fase adimensional del modo 2.
 * @param d1  Retroalimentación convección/humedad (modo 1).
 * @param d2  Retroalimentación convección/humedad (modo 2).
 * @param m1  Acoplamiento humedad-calentamiento.
 * @param m2  Acoplamiento humedad-calentamiento del sistema reducido.
 * @param r0  Relación entre calentamiento bajo (L) y alto (U).
 * @param rq  Relación entre U y la humedad troposférica libre.
 * @param F   Escalado de Clausius-Clapeyron sobre la MSE.
 * @param f   Peso de la temperatura del modo 1 frente al modo 2.
 * @param tauL Tiempo de relajación del calentamiento convectivo (días).
 * @param epsilon Tasa de amortiguamiento lineal uniforme (1/día).
 */
@Builder
@With
public record BaseCoefficients(
        double a1,
        double a2,
        double b1,
        double b2,
        double c1,
        double c2,
        double d1,
        double d2,
        double m1,
        double m2,
        double r0,
        double rq,
        double F,
        double f,
        double tauL,
        double epsilon
) {

    /**
     * Valores de referencia de Kuang (2008).
     */
    public static BaseCoefficients kuang2008() {
        return BaseCoefficients.builder()
                .a1(1.4).a2(0.0)
                .b1(1.0).b2(2.0)
                .c1(1.0).c2(0.5)
                .d1(1.1).d2(-1.0)
                .m1(0.3).m2(1.0)
                .r0(1.0).rq(0.7)
                .F(4.0).f(0.5)
                .tauL(1.0 / 12.0)
                .epsilon(0.1)
                .build();
    }
}
