package convwaves.physics.i;

import org.ejml.data.Complex_F64;
import org.ejml.data.ZMatrixRMaj;

public interface IEigenvalueSolver extends ISolverComponent {
    /**
     * Autovalores de una matriz compleja general (sin suponer simetría).
     * El orden del array devuelto no tiene significado.
     *
     * @throws IllegalStateException si el algoritmo no converge.
     */
    Complex_F64[] eigenvalues(ZMatrixRMaj matrix);
}
