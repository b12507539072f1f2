package convwaves.domain.simulation;

import lombok.Getter;

/**
 * Trayectoria compleja indexada por (paso de tiempo, variable de estado, número de onda).
 * <p>
 * PROPIEDAD DE COLUMNAS: la columna {@code j} (todos los tiempos y variables de un número de
 * onda) la escribe un único trabajador. Dos trabajadores nunca tocan la misma columna, por lo
 * que no hace falta sincronización.
 * <p>
 * Layout plano por columnas: índice = (j * Nt + n) * Nv + v, así cada trabajador escribe un
 * bloque contiguo de Nt·Nv elementos. Los accesores reciben (n, v, j).
 */
public class StateTrajectory {

    @Getter
    private final int timeCount;
    @Getter
    private final int variableCount;
    @Getter
    private final int wavenumberCount;
    private final double[] real;
    private final double[] imag;

    private StateTrajectory(int timeCount, int variableCount, int wavenumberCount) {
        this.timeCount = timeCount;
        this.variableCount = variableCount;
        this.wavenumberCount = wavenumberCount;
        long size = (long) timeCount * variableCount * wavenumberCount;
        if (size > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Trayectoria demasiado grande para un array plano: " + size + " elementos");
        }
        this.real = new double[(int) size];
        this.imag = new double[(int) size];
    }

    /**
     * Reserva un buffer a cero de forma (Nt, Nv, Nk).
     */
    public static StateTrajectory allocate(int timeCount, int variableCount, int wavenumberCount) {
        if (timeCount <= 0 || variableCount <= 0 || wavenumberCount <= 0) {
            throw new IllegalArgumentException(String.format(
                    "Las dimensiones de la trayectoria deben ser positivas: (%d, %d, %d)",
                    timeCount, variableCount, wavenumberCount));
        }
        return new StateTrajectory(timeCount, variableCount, wavenumberCount);
    }

    int index(int n, int v, int j) {
        return (j * timeCount + n) * variableCount + v;
    }

    public double getReal(int n, int v, int j) {
        return real[index(n, v, j)];
    }

    public double getImag(int n, int v, int j) {
        return imag[index(n, v, j)];
    }

    public void set(int n, int v, int j, double re, double im) {
        int idx = index(n, v, j);
        real[idx] = re;
        imag[idx] = im;
    }

    /**
     * Módulo |x| de una entrada.
     */
    public double getMagnitude(int n, int v, int j) {
        int idx = index(n, v, j);
        return Math.hypot(real[idx], imag[idx]);
    }

    /**
     * Copia de la parte real como array [Nt][Nv][Nk] (para exportación).
     */
    public double[][][] toRealCube() {
        return toCube(real);
    }

    public double[][][] toImagCube() {
        return toCube(imag);
    }

    private double[][][] toCube(double[] src) {
        double[][][] cube = new double[timeCount][variableCount][wavenumberCount];
        for (int j = 0; j < wavenumberCount; j++) {
            int idx = index(0, 0, j);
            for (int n = 0; n < timeCount; n++) {
                for (int v = 0; v < variableCount; v++) {
                    cube[n][v][j] = src[idx++];
                }
            }
        }
        return cube;
    }
}
