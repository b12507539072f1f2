package convwaves.domain.spectral;

import lombok.Getter;

import java.util.Arrays;

/**
 * Estado espectral complejo de forma (Nv, Nk): una amplitud por variable de estado y
 * número de onda. Se usa como condición inicial del integrador.
 * <p>
 * Layout plano: índice = v * Nk + j. Partes real e imaginaria en arrays separados.
 */
public class SpectralState {

    @Getter
    private final int variableCount;
    @Getter
    private final int wavenumberCount;
    private final double[] real;
    private final double[] imag;

    public SpectralState(int variableCount, int wavenumberCount) {
        if (variableCount <= 0 || wavenumberCount <= 0) {
            throw new IllegalArgumentException("Las dimensiones del estado deben ser positivas: ("
                    + variableCount + ", " + wavenumberCount + ")");
        }
        this.variableCount = variableCount;
        this.wavenumberCount = wavenumberCount;
        this.real = new double[variableCount * wavenumberCount];
        this.imag = new double[variableCount * wavenumberCount];
    }

    private int index(int v, int j) {
        return v * wavenumberCount + j;
    }

    public double getReal(int v, int j) {
        return real[index(v, j)];
    }

    public double getImag(int v, int j) {
        return imag[index(v, j)];
    }

    public void set(int v, int j, double re, double im) {
        int idx = index(v, j);
        real[idx] = re;
        imag[idx] = im;
    }

    /**
     * Devuelve una copia multiplicada por el escalar complejo (cr + i·ci).
     */
    public SpectralState scaled(double cr, double ci) {
        SpectralState out = new SpectralState(variableCount, wavenumberCount);
        for (int i = 0; i < real.length; i++) {
            out.real[i] = real[i] * cr - imag[i] * ci;
            out.imag[i] = real[i] * ci + imag[i] * cr;
        }
        return out;
    }

    public double[] cloneReal() {
        return Arrays.copyOf(real, real.length);
    }

    public double[] cloneImag() {
        return Arrays.copyOf(imag, imag.length);
    }
}
