package convwaves.physics.solver;

import convwaves.physics.i.IEigenvalueSolver;
import org.ejml.data.Complex_F64;
import org.ejml.data.ZMatrixRMaj;

/**
 * Autovalores de una matriz compleja general mediante reducción a Hessenberg (reflexiones de
 * Householder) y algoritmo QR con desplazamiento de Wilkinson y deflación.
 * <p>
 * EJML no ofrece descomposición espectral para matrices complejas no hermíticas; este solver
 * cubre ese hueco para el operador reducido, cuya diagonal es compleja (-i·k·c - ε).
 * Esta clase es Thread safe (todo el estado es local a la llamada).
 */
public class HessenbergQrEigenvalueSolver implements IEigenvalueSolver {

    private static final double EPS = Math.ulp(1.0);
    private static final int MAX_ITERATIONS_PER_EIGENVALUE = 60;

    @Override
    public String getName() {
        return "Hessenberg-QR";
    }

    @Override
    public String getDescription() {
        return "Reducción de Householder a Hessenberg + QR complejo con desplazamiento de Wilkinson";
    }

    @Override
    public Complex_F64[] eigenvalues(ZMatrixRMaj matrix) {
        if (matrix.getNumRows() != matrix.getNumCols()) {
            throw new IllegalArgumentException("La matriz debe ser cuadrada: "
                    + matrix.getNumRows() + "x" + matrix.getNumCols());
        }
        final int n = matrix.getNumRows();
        double[][] hr = new double[n][n];
        double[][] hi = new double[n][n];
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                hr[r][c] = matrix.getReal(r, c);
                hi[r][c] = matrix.getImag(r, c);
                if (!Double.isFinite(hr[r][c]) || !Double.isFinite(hi[r][c])) {
                    throw new IllegalStateException("La matriz contiene valores no finitos en (" + r + ", " + c + ")");
                }
            }
        }

        reduceToHessenberg(hr, hi, n);
        return shiftedQr(hr, hi, n);
    }

    // --- 1. Reducción a Hessenberg superior ---

    private static void reduceToHessenberg(double[][] hr, double[][] hi, int n) {
        double[] vr = new double[n];
        double[] vi = new double[n];

        for (int k = 0; k < n - 2; k++) {
            double norm = 0.0;
            for (int i = k + 1; i < n; i++) {
                norm = Math.hypot(norm, Math.hypot(hr[i][k], hi[i][k]));
            }
            if (norm == 0.0) {
                continue;
            }

            // alpha = -e^{i·arg(x0)}·||x||
            double x0r = hr[k + 1][k];
            double x0i = hi[k + 1][k];
            double x0abs = Math.hypot(x0r, x0i);
            double phaseR = x0abs == 0.0 ? 1.0 : x0r / x0abs;
            double phaseI = x0abs == 0.0 ? 0.0 : x0i / x0abs;
            double alphaR = -phaseR * norm;
            double alphaI = -phaseI * norm;

            // v = x - alpha·e1, normalizado
            double vNorm = 0.0;
            for (int i = k + 1; i < n; i++) {
                vr[i] = hr[i][k];
                vi[i] = hi[i][k];
            }
            vr[k + 1] -= alphaR;
            vi[k + 1] -= alphaI;
            for (int i = k + 1; i < n; i++) {
                vNorm = Math.hypot(vNorm, Math.hypot(vr[i], vi[i]));
            }
            if (vNorm == 0.0) {
                continue;
            }
            for (int i = k + 1; i < n; i++) {
                vr[i] /= vNorm;
                vi[i] /= vNorm;
            }

            // H = (I - 2vv*)·H
            for (int j = 0; j < n; j++) {
                double sr = 0.0;
                double si = 0.0;
                for (int i = k + 1; i < n; i++) {
                    // conj(v_i)·H_ij
                    sr += vr[i] * hr[i][j] + vi[i] * hi[i][j];
                    si += vr[i] * hi[i][j] - vi[i] * hr[i][j];
                }
                for (int i = k + 1; i < n; i++) {
                    hr[i][j] -= 2.0 * (vr[i] * sr - vi[i] * si);
                    hi[i][j] -= 2.0 * (vr[i] * si + vi[i] * sr);
                }
            }

            // H = H·(I - 2vv*)
            for (int i = 0; i < n; i++) {
                double sr = 0.0;
                double si = 0.0;
                for (int j = k + 1; j < n; j++) {
                    sr += hr[i][j] * vr[j] - hi[i][j] * vi[j];
                    si += hr[i][j] * vi[j] + hi[i][j] * vr[j];
                }
                for (int j = k + 1; j < n; j++) {
                    // s·conj(v_j)
                    hr[i][j] -= 2.0 * (sr * vr[j] + si * vi[j]);
                    hi[i][j] -= 2.0 * (si * vr[j] - sr * vi[j]);
                }
            }

            // Limpiar los ceros estructurales
            for (int i = k + 2; i < n; i++) {
                hr[i][k] = 0.0;
                hi[i][k] = 0.0;
            }
        }
    }

    // --- 2. QR con desplazamiento ---

    private static Complex_F64[] shiftedQr(double[][] hr, double[][] hi, int n) {
        Complex_F64[] eigenvalues = new Complex_F64[n];
        double[] cs = new double[n];
        double[] snR = new double[n];
        double[] snI = new double[n];

        int end = n - 1;
        int iterations = 0;
        int totalIterations = 0;

        while (end >= 0) {
            if (end == 0) {
                eigenvalues[0] = new Complex_F64(hr[0][0], hi[0][0]);
                break;
            }

            // Buscar subdiagonal despreciable
            int l = end;
            while (l > 0) {
                double sub = Math.hypot(hr[l][l - 1], hi[l][l - 1]);
                double diag = Math.hypot(hr[l - 1][l - 1], hi[l - 1][l - 1]) + Math.hypot(hr[l][l], hi[l][l]);
                if (diag == 0.0) {
                    diag = 1.0;
                }
                if (sub <= EPS * diag) {
                    hr[l][l - 1] = 0.0;
                    hi[l][l - 1] = 0.0;
                    break;
                }
                l--;
            }

            if (l == end) {
                eigenvalues[end] = new Complex_F64(hr[end][end], hi[end][end]);
                end--;
                iterations = 0;
                continue;
            }

            iterations++;
            totalIterations++;
            if (iterations > MAX_ITERATIONS_PER_EIGENVALUE) {
                throw new IllegalStateException("El algoritmo QR no converge tras " + totalIterations + " iteraciones.");
            }

            // Desplazamiento: autovalor del bloque 2x2 final más cercano a H[end][end]
            double muR;
            double muI;
            if (iterations % 11 == 0) {
                // Desplazamiento excepcional para romper ciclos
                double sub = Math.hypot(hr[end][end - 1], hi[end][end - 1]);
                muR = hr[end][end] + 0.75 * sub;
                muI = hi[end][end];
            } else {
                double[] mu = wilkinsonShift(
                        hr[end - 1][end - 1], hi[end - 1][end - 1],
                        hr[end - 1][end], hi[end - 1][end],
                        hr[end][end - 1], hi[end][end - 1],
                        hr[end][end], hi[end][end]);
                muR = mu[0];
                muI = mu[1];
            }

            for (int i = l; i <= end; i++) {
                hr[i][i] -= muR;
                hi[i][i] -= muI;
            }

            // H - μI = QR: rotaciones de Givens por la izquierda
            for (int k = l; k < end; k++) {
                double xr = hr[k][k];
                double xi = hi[k][k];
                double yr = hr[k + 1][k];
                double yi = hi[k + 1][k];
                double xAbs = Math.hypot(xr, xi);
                double nrm = Math.hypot(xAbs, Math.hypot(yr, yi));
                double c;
                double sr;
                double si;
                if (nrm == 0.0) {
                    c = 1.0;
                    sr = 0.0;
                    si = 0.0;
                } else if (xAbs == 0.0) {
                    c = 0.0;
                    sr = 1.0;
                    si = 0.0;
                } else {
                    // s = (x/|x|)·conj(y)/nrm
                    double ar = xr / xAbs;
                    double ai = xi / xAbs;
                    c = xAbs / nrm;
                    sr = (ar * yr + ai * yi) / nrm;
                    si = (ai * yr - ar * yi) / nrm;
                }
                cs[k] = c;
                snR[k] = sr;
                snI[k] = si;

                // [row_k; row_k1] = [c, s; -conj(s), c]·[row_k; row_k1]
                for (int j = k; j <= end; j++) {
                    double ar = hr[k][j];
                    double ai = hi[k][j];
                    double br = hr[k + 1][j];
                    double bi = hi[k + 1][j];
                    hr[k][j] = c * ar + (sr * br - si * bi);
                    hi[k][j] = c * ai + (sr * bi + si * br);
                    hr[k + 1][j] = -(sr * ar + si * ai) + c * br;
                    hi[k + 1][j] = -(sr * ai - si * ar) + c * bi;
                }
            }

            // RQ: mismas rotaciones (conjugadas) por la derecha
            for (int k = l; k < end; k++) {
                double c = cs[k];
                double sr = snR[k];
                double si = snI[k];
                int lastRow = Math.min(k + 1, end);
                for (int i = l; i <= lastRow; i++) {
                    double ar = hr[i][k];
                    double ai = hi[i][k];
                    double br = hr[i][k + 1];
                    double bi = hi[i][k + 1];
                    // col_k = c·a + conj(s)·b ; col_k1 = -s·a + c·b
                    hr[i][k] = c * ar + (sr * br + si * bi);
                    hi[i][k] = c * ai + (sr * bi - si * br);
                    hr[i][k + 1] = -(sr * ar - si * ai) + c * br;
                    hi[i][k + 1] = -(sr * ai + si * ar) + c * bi;
                }
            }

            for (int i = l; i <= end; i++) {
                hr[i][i] += muR;
                hi[i][i] += muI;
            }
        }
        return eigenvalues;
    }

    /**
     * Autovalor de [[a, b], [c, d]] más próximo a d.
     */
    private static double[] wilkinsonShift(double ar, double ai, double br, double bi,
                                           double cr, double ci, double dr, double di) {
        // m = (a + d)/2, h = (a - d)/2, disc = sqrt(h² + b·c)
        double mr = 0.5 * (ar + dr);
        double mi = 0.5 * (ai + di);
        double hRe = 0.5 * (ar - dr);
        double hIm = 0.5 * (ai - di);
        double radR = hRe * hRe - hIm * hIm + (br * cr - bi * ci);
        double radI = 2.0 * hRe * hIm + (br * ci + bi * cr);
        double[] disc = complexSqrt(radR, radI);

        double l1r = mr + disc[0];
        double l1i = mi + disc[1];
        double l2r = mr - disc[0];
        double l2i = mi - disc[1];
        double d1 = Math.hypot(l1r - dr, l1i - di);
        double d2 = Math.hypot(l2r - dr, l2i - di);
        return d1 <= d2 ? new double[]{l1r, l1i} : new double[]{l2r, l2i};
    }

    private static double[] complexSqrt(double re, double im) {
        double mod = Math.hypot(re, im);
        if (mod == 0.0) {
            return new double[]{0.0, 0.0};
        }
        double sr = Math.sqrt(0.5 * (mod + Math.abs(re)));
        if (re >= 0.0) {
            return new double[]{sr, im / (2.0 * sr)};
        }
        double si = Math.copySign(sr, im);
        return new double[]{Math.abs(im) / (2.0 * sr), si};
    }
}
