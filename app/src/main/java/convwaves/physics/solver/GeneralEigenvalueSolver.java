package convwaves.physics.solver;

import convwaves.physics.i.IEigenvalueSolver;
import org.ejml.data.Complex_F64;
import org.ejml.data.DMatrixRMaj;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;

/**
 * Solver de autovalores para matrices complejas generales.
 * <p>
 * Si la matriz es real (todas las partes imaginarias son cero, caso del sistema completo)
 * se delega en la descomposición espectral general de EJML. En otro caso se usa
 * {@link HessenbergQrEigenvalueSolver}.
 * Esta clase es Thread safe: cada llamada crea su propia descomposición.
 */
public class GeneralEigenvalueSolver implements IEigenvalueSolver {

    private final IEigenvalueSolver complexSolver;

    public GeneralEigenvalueSolver() {
        this(new HessenbergQrEigenvalueSolver());
    }

    public GeneralEigenvalueSolver(IEigenvalueSolver complexSolver) {
        this.complexSolver = complexSolver;
    }

    @Override
    public String getName() {
        return "EJML-EVD/" + complexSolver.getName();
    }

    @Override
    public String getDescription() {
        return "EVD real de EJML para operadores reales; " + complexSolver.getDescription() + " para complejos";
    }

    @Override
    public Complex_F64[] eigenvalues(ZMatrixRMaj matrix) {
        if (!isReal(matrix)) {
            return complexSolver.eigenvalues(matrix);
        }

        final int n = matrix.getNumRows();
        DMatrixRMaj real = new DMatrixRMaj(n, n);
        for (int r = 0; r < n; r++) {
            for (int c = 0; c < n; c++) {
                real.set(r, c, matrix.getReal(r, c));
            }
        }

        EigenDecomposition_F64<DMatrixRMaj> evd = DecompositionFactory_DDRM.eig(n, false);
        if (!evd.decompose(real)) {
            throw new IllegalStateException("La descomposición espectral de EJML no convergió (" + n + "x" + n + ").");
        }

        Complex_F64[] values = new Complex_F64[evd.getNumberOfEigenvalues()];
        for (int i = 0; i < values.length; i++) {
            Complex_F64 ev = evd.getEigenvalue(i);
            values[i] = new Complex_F64(ev.getReal(), ev.getImaginary());
        }
        return values;
    }

    static boolean isReal(ZMatrixRMaj matrix) {
        for (int r = 0; r < matrix.getNumRows(); r++) {
            for (int c = 0; c < matrix.getNumCols(); c++) {
                if (matrix.getImag(r, c) != 0.0) {
                    return false;
                }
            }
        }
        return true;
    }
}
