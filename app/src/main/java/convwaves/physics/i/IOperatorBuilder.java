package convwaves.physics.i;

import convwaves.domain.operator.OperatorMode;
import convwaves.domain.params.ParameterSet;
import org.ejml.data.ZMatrixRMaj;

public interface IOperatorBuilder extends ISolverComponent {
    /**
     * Construye la matriz compleja del operador lineal para un número de onda.
     * Debe ser una función pura de sus tres argumentos.
     */
    ZMatrixRMaj build(double wavenumber, ParameterSet params, OperatorMode mode);
}
