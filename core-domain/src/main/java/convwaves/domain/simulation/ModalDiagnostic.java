package convwaves.domain.simulation;

import lombok.Getter;

import java.util.Arrays;

/**
 * Tasas de crecimiento (1/día) y velocidades de fase (m/s) de los modos propios del
 * operador, indexadas por (modo, número de onda).
 * <p>
 * El índice de modo NO identifica un modo físico: no hay seguimiento de modos entre números
 * de onda contiguos. Dentro de cada número de onda los modos se listan por tasa de
 * crecimiento descendente.
 */
public class ModalDiagnostic {

    @Getter
    private final int modeCount;
    @Getter
    private final int wavenumberCount;
    private final double[] wavelengthsKm;
    private final double[] wavenumbers;
    private final double[][] growthRates;
    private final double[][] phaseSpeeds;

    public ModalDiagnostic(double[] wavelengthsKm, double[] wavenumbers, int modeCount) {
        if (wavelengthsKm.length != wavenumbers.length) {
            throw new IllegalArgumentException("Longitudes de onda y números de onda deben tener el mismo tamaño.");
        }
        this.wavelengthsKm = Arrays.copyOf(wavelengthsKm, wavelengthsKm.length);
        this.wavenumbers = Arrays.copyOf(wavenumbers, wavenumbers.length);
        this.modeCount = modeCount;
        this.wavenumberCount = wavenumbers.length;
        this.growthRates = new double[modeCount][wavenumberCount];
        this.phaseSpeeds = new double[modeCount][wavenumberCount];
    }

    public double getGrowthRate(int mode, int j) {
        return growthRates[mode][j];
    }

    public double getPhaseSpeed(int mode, int j) {
        return phaseSpeeds[mode][j];
    }

    public void set(int mode, int j, double growthRate, double phaseSpeed) {
        growthRates[mode][j] = growthRate;
        phaseSpeeds[mode][j] = phaseSpeed;
    }

    /**
     * Modo más inestable en el número de onda {@code j}: el de mayor tasa de crecimiento.
     */
    public ModeEstimate getMostUnstable(int j) {
        int best = 0;
        for (int m = 1; m < modeCount; m++) {
            if (growthRates[m][j] > growthRates[best][j]) {
                best = m;
            }
        }
        return new ModeEstimate(growthRates[best][j], phaseSpeeds[best][j]);
    }

    public double[] cloneWavelengths() {
        return Arrays.copyOf(wavelengthsKm, wavelengthsKm.length);
    }

    public double[] cloneWavenumbers() {
        return Arrays.copyOf(wavenumbers, wavenumbers.length);
    }

    public double[][] cloneGrowthRates() {
        return deepCopy(growthRates);
    }

    public double[][] clonePhaseSpeeds() {
        return deepCopy(phaseSpeeds);
    }

    private static double[][] deepCopy(double[][] src) {
        double[][] out = new double[src.length][];
        for (int i = 0; i < src.length; i++) {
            out[i] = Arrays.copyOf(src[i], src[i].length);
        }
        return out;
    }

    /**
     * Par (tasa de crecimiento, velocidad de fase) de un modo.
     */
    public record ModeEstimate(double growthRate, double phaseSpeed) {
    }
}
