package convwaves.domain.simulation;

import lombok.Getter;

import java.util.Arrays;

/**
 * Matrices del operador lineal para cada número de onda, forma (Nk, Nv, Nv).
 * Cada trabajador escribe únicamente el bloque de su número de onda.
 */
public class OperatorSet {

    @Getter
    private final int wavenumberCount;
    @Getter
    private final int dimension;
    private final double[] wavenumbers;
    private final double[] real;
    private final double[] imag;

    public OperatorSet(double[] wavenumbers, int dimension) {
        this.wavenumbers = Arrays.copyOf(wavenumbers, wavenumbers.length);
        this.wavenumberCount = wavenumbers.length;
        this.dimension = dimension;
        this.real = new double[wavenumberCount * dimension * dimension];
        this.imag = new double[wavenumberCount * dimension * dimension];
    }

    private int index(int j, int row, int col) {
        return (j * dimension + row) * dimension + col;
    }

    public double getReal(int j, int row, int col) {
        return real[index(j, row, col)];
    }

    public double getImag(int j, int row, int col) {
        return imag[index(j, row, col)];
    }

    public void set(int j, int row, int col, double re, double im) {
        int idx = index(j, row, col);
        real[idx] = re;
        imag[idx] = im;
    }

    public double[] cloneWavenumbers() {
        return Arrays.copyOf(wavenumbers, wavenumbers.length);
    }

    public double[][][] toRealCube() {
        return toCube(real);
    }

    public double[][][] toImagCube() {
        return toCube(imag);
    }

    private double[][][] toCube(double[] src) {
        double[][][] cube = new double[wavenumberCount][dimension][dimension];
        for (int j = 0; j < wavenumberCount; j++) {
            for (int r = 0; r < dimension; r++) {
                System.arraycopy(src, index(j, r, 0), cube[j][r], 0, dimension);
            }
        }
        return cube;
    }
}
