package convwaves.physics.i;

import org.ejml.data.ZMatrixRMaj;

public interface IMatrixExponential extends ISolverComponent {
    /**
     * Calcula exp(scale·A) sin modificar {@code matrix}.
     */
    ZMatrixRMaj exp(ZMatrixRMaj matrix, double scale);
}
