package convwaves.physics.solver;

import convwaves.physics.i.IMatrixExponential;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.CommonOps_ZDRM;

/**
 * Exponencial de matriz compleja por escalado y cuadrado con aproximante de Padé [13/13]
 * (Higham, 2005).
 * <p>
 * Se escala A por 2^-s hasta que ||A||₁ ≤ θ13, se evalúa r13(A) = (V - U)⁻¹(V + U) y se
 * eleva al cuadrado s veces. Para las matrices pequeñas del modelo (4x4 / 6x6) el error
 * queda en el orden del redondeo de doble precisión.
 * Esta clase es Thread safe (sin estado).
 */
public class PadeMatrixExponential implements IMatrixExponential {

    private static final double THETA_13 = 5.371920351148152;

    private static final double[] PADE_13 = {
            64764752532480000.0, 32382376266240000.0, 7771770303897600.0,
            1187353796428800.0, 129060195264000.0, 10559470521600.0,
            670442572800.0, 33522128640.0, 1323241920.0,
            40840800.0, 960960.0, 16380.0, 182.0, 1.0
    };

    private static final int MAX_SQUARINGS = 1000;

    @Override
    public String getName() {
        return "Padé-13";
    }

    @Override
    public String getDescription() {
        return "Escalado y cuadrado con aproximante de Padé de grado 13 (Higham 2005)";
    }

    @Override
    public ZMatrixRMaj exp(ZMatrixRMaj matrix, double scale) {
        if (matrix.getNumRows() != matrix.getNumCols()) {
            throw new IllegalArgumentException("La exponencial requiere una matriz cuadrada: "
                    + matrix.getNumRows() + "x" + matrix.getNumCols());
        }
        final int n = matrix.getNumRows();

        ZMatrixRMaj a = matrix.copy();
        CommonOps_ZDRM.scale(scale, 0.0, a);

        double norm = norm1(a);
        if (!Double.isFinite(norm)) {
            throw new IllegalStateException("La matriz contiene valores no finitos; no se puede calcular exp(A).");
        }

        int squarings = 0;
        if (norm > THETA_13) {
            squarings = (int) Math.ceil(Math.log(norm / THETA_13) / Math.log(2.0));
            if (squarings > MAX_SQUARINGS) {
                throw new IllegalStateException("Norma demasiado grande para la exponencial: " + norm);
            }
            CommonOps_ZDRM.scale(Math.pow(2.0, -squarings), 0.0, a);
        }

        // Potencias pares
        ZMatrixRMaj a2 = new ZMatrixRMaj(n, n);
        ZMatrixRMaj a4 = new ZMatrixRMaj(n, n);
        ZMatrixRMaj a6 = new ZMatrixRMaj(n, n);
        CommonOps_ZDRM.mult(a, a, a2);
        CommonOps_ZDRM.mult(a2, a2, a4);
        CommonOps_ZDRM.mult(a4, a2, a6);

        final double[] b = PADE_13;

        // U = A·[A6·(b13·A6 + b11·A4 + b9·A2) + b7·A6 + b5·A4 + b3·A2 + b1·I]
        ZMatrixRMaj inner = linearCombination(n, b[13], a6, b[11], a4, b[9], a2, 0.0);
        ZMatrixRMaj tmp = new ZMatrixRMaj(n, n);
        CommonOps_ZDRM.mult(a6, inner, tmp);
        addInPlace(tmp, linearCombination(n, b[7], a6, b[5], a4, b[3], a2, b[1]));
        ZMatrixRMaj u = new ZMatrixRMaj(n, n);
        CommonOps_ZDRM.mult(a, tmp, u);

        // V = A6·(b12·A6 + b10·A4 + b8·A2) + b6·A6 + b4·A4 + b2·A2 + b0·I
        inner = linearCombination(n, b[12], a6, b[10], a4, b[8], a2, 0.0);
        ZMatrixRMaj v = new ZMatrixRMaj(n, n);
        CommonOps_ZDRM.mult(a6, inner, v);
        addInPlace(v, linearCombination(n, b[6], a6, b[4], a4, b[2], a2, b[0]));

        // (V - U)·R = (V + U)
        ZMatrixRMaj lhs = new ZMatrixRMaj(n, n);
        ZMatrixRMaj rhs = new ZMatrixRMaj(n, n);
        CommonOps_ZDRM.subtract(v, u, lhs);
        CommonOps_ZDRM.add(v, u, rhs);

        ZMatrixRMaj result = new ZMatrixRMaj(n, n);
        if (!CommonOps_ZDRM.solve(lhs, rhs, result)) {
            throw new IllegalStateException("Sistema singular al evaluar el aproximante de Padé.");
        }

        // Deshacer el escalado
        ZMatrixRMaj work = new ZMatrixRMaj(n, n);
        for (int i = 0; i < squarings; i++) {
            CommonOps_ZDRM.mult(result, result, work);
            ZMatrixRMaj swap = result;
            result = work;
            work = swap;
        }
        return result;
    }

    /**
     * Norma 1 (máxima suma por columnas de los módulos).
     */
    static double norm1(ZMatrixRMaj m) {
        double max = 0.0;
        for (int c = 0; c < m.getNumCols(); c++) {
            double sum = 0.0;
            for (int r = 0; r < m.getNumRows(); r++) {
                sum += Math.hypot(m.getReal(r, c), m.getImag(r, c));
            }
            max = Math.max(max, sum);
        }
        return max;
    }

    // c6·A6 + c4·A4 + c2·A2 + c0·I (coeficientes reales)
    private static ZMatrixRMaj linearCombination(int n, double c6, ZMatrixRMaj a6,
                                                 double c4, ZMatrixRMaj a4,
                                                 double c2, ZMatrixRMaj a2, double c0) {
        ZMatrixRMaj out = new ZMatrixRMaj(n, n);
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                double re = c6 * a6.getReal(r, c) + c4 * a4.getReal(r, c) + c2 * a2.getReal(r, c);
                double im = c6 * a6.getImag(r, c) + c4 * a4.getImag(r, c) + c2 * a2.getImag(r, c);
                if (r == c) {
                    re += c0;
                }
                out.set(r, c, re, im);
            }
        }
        return out;
    }

    private static void addInPlace(ZMatrixRMaj target, ZMatrixRMaj other) {
        for (int r = 0; r < target.getNumRows(); r++) {
            for (int c = 0; c < target.getNumCols(); c++) {
                target.set(r, c,
                        target.getReal(r, c) + other.getReal(r, c),
                        target.getImag(r, c) + other.getImag(r, c));
            }
        }
    }
}
