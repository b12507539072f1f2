package convwaves.factory;

import convwaves.domain.spectral.SpectralState;
import convwaves.exception.DimensionMismatchException;

import java.util.Arrays;
import java.util.Random;

/**
 * Condiciones iniciales para el integrador espectral.
 */
public final class InitialStateFactory {

    /**
     * Amplitud por defecto de la perturbación aleatoria.
     */
    public static final double DEFAULT_SCALE = 0.1;

    private static final double COMPONENT_STD = Math.sqrt(0.5);

    /**
     * Prohibido construir esta clase utilidad
     */
    private InitialStateFactory() {
    }

    /**
     * Perturbación aleatoria reproducible. Cada entrada es z·(1+i)·escala_v, con z complejo
     * normal estándar (partes real e imaginaria N(0, 1/2)).
     *
     * @param scales Amplitud por variable de estado; si es null se usa {@link #DEFAULT_SCALE}.
     * @throws DimensionMismatchException si {@code scales} no tiene {@code variableCount} elementos.
     */
    public static SpectralState randomState(int variableCount, int wavenumberCount, double[] scales, long seed) {
        double[] s = scales;
        if (s == null) {
            s = new double[variableCount];
            Arrays.fill(s, DEFAULT_SCALE);
        } else if (s.length != variableCount) {
            throw DimensionMismatchException.of("escalas iniciales", variableCount, s.length);
        }

        Random random = new Random(seed);
        SpectralState state = new SpectralState(variableCount, wavenumberCount);
        for (int v = 0; v < variableCount; v++) {
            for (int j = 0; j < wavenumberCount; j++) {
                double a = random.nextGaussian() * COMPONENT_STD;
                double b = random.nextGaussian() * COMPONENT_STD;
                // (a + ib)(1 + i) = (a - b) + i(a + b)
                state.set(v, j, (a - b) * s[v], (a + b) * s[v]);
            }
        }
        return state;
    }

    /**
     * Estado nulo salvo una única entrada.
     */
    public static SpectralState impulse(int variableCount, int wavenumberCount,
                                        int variable, int wavenumberIndex, double value) {
        if (variable < 0 || variable >= variableCount || wavenumberIndex < 0 || wavenumberIndex >= wavenumberCount) {
            throw new IllegalArgumentException(String.format(
                    "Impulso fuera de rango: (%d, %d) en un estado (%d, %d)",
                    variable, wavenumberIndex, variableCount, wavenumberCount));
        }
        SpectralState state = new SpectralState(variableCount, wavenumberCount);
        state.set(variable, wavenumberIndex, value, 0.0);
        return state;
    }
}
