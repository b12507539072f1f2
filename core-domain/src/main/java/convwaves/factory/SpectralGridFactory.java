package convwaves.factory;

import convwaves.config.ModelConstants;
import convwaves.config.SimulationConfig;
import convwaves.domain.spectral.SpectralGrid;
import lombok.extern.slf4j.Slf4j;

/**
 * Fábrica de las coordenadas de una ejecución: malla temporal equiespaciada y muestreo de
 * longitudes de onda con su conversión a número de onda adimensional.
 */
@Slf4j
public final class SpectralGridFactory {

    /**
     * Prohibido construir esta clase utilidad
     */
    private SpectralGridFactory() {
    }

    public static SpectralGrid create(SimulationConfig config) {
        double[] time = uniformTimeGrid(config.getDeltaTime(), config.getTotalTime());
        double[] wavelengths = wavelengthSampling(
                config.getMinWavelengthKm(), config.getMaxWavelengthKm(), config.getWavelengthStepKm());
        double[] wavenumbers = toWavenumbers(wavelengths, config.getModelConstants());

        log.info("Malla espectral: Nt={} (Δt={} días), Nk={} (λ {}..{} km)",
                time.length, config.getDeltaTime(), wavenumbers.length,
                wavelengths[0], wavelengths[wavelengths.length - 1]);

        return SpectralGrid.builder()
                .time(time)
                .wavelengthsKm(wavelengths)
                .wavenumbers(wavenumbers)
                .build();
    }

    /**
     * Malla [0, Δt, 2Δt, ..., totalTime]. Cada punto se calcula como n·Δt para no acumular
     * error de redondeo.
     */
    public static double[] uniformTimeGrid(double deltaTime, double totalTime) {
        if (!(deltaTime > 0.0) || !Double.isFinite(deltaTime)) {
            throw new IllegalArgumentException("El paso de tiempo debe ser positivo: " + deltaTime);
        }
        if (totalTime < 0.0 || !Double.isFinite(totalTime)) {
            throw new IllegalArgumentException("El tiempo total debe ser no negativo: " + totalTime);
        }
        int steps = (int) Math.round(totalTime / deltaTime);
        double[] t = new double[steps + 1];
        for (int n = 0; n <= steps; n++) {
            t[n] = n * deltaTime;
        }
        return t;
    }

    /**
     * Longitudes de onda [min, min+paso, ...] sin superar el máximo.
     */
    public static double[] wavelengthSampling(double minKm, double maxKm, double stepKm) {
        if (!(minKm > 0.0) || !(stepKm > 0.0) || maxKm < minKm) {
            throw new IllegalArgumentException(String.format(
                    "Muestreo de longitudes de onda inválido: min=%s, max=%s, paso=%s", minKm, maxKm, stepKm));
        }
        int count = (int) Math.floor((maxKm - minKm) / stepKm + 1e-9) + 1;
        double[] lambda = new double[count];
        for (int i = 0; i < count; i++) {
            lambda[i] = minKm + i * stepKm;
        }
        return lambda;
    }

    /**
     * k = 2π·L_ref/λ para cada longitud de onda.
     */
    public static double[] toWavenumbers(double[] wavelengthsKm, ModelConstants constants) {
        double[] k = new double[wavelengthsKm.length];
        for (int i = 0; i < k.length; i++) {
            if (!(wavelengthsKm[i] > 0.0) || !Double.isFinite(wavelengthsKm[i])) {
                throw new IllegalArgumentException("Longitud de onda no válida en la posición " + i + ": " + wavelengthsKm[i]);
            }
            k[i] = constants.toWavenumber(wavelengthsKm[i]);
        }
        return k;
    }
}
