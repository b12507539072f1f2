package convwaves.physics.impl;

import convwaves.domain.operator.OperatorMode;
import convwaves.domain.params.ParameterSet;
import convwaves.domain.simulation.OperatorSet;
import convwaves.physics.i.IOperatorBuilder;
import lombok.RequiredArgsConstructor;
import org.ejml.data.ZMatrixRMaj;

import java.util.concurrent.Callable;

/**
 * Copia el operador de un número de onda en su bloque del {@link OperatorSet}.
 */
@RequiredArgsConstructor
public class OperatorAssemblyTask implements Callable<Integer> {

    private final int wavenumberIndex;
    private final double wavenumber;
    private final ParameterSet params;
    private final OperatorMode mode;
    private final OperatorSet target;
    private final IOperatorBuilder operatorBuilder;

    @Override
    public Integer call() {
        ZMatrixRMaj mat = operatorBuilder.build(wavenumber, params, mode);
        for (int r = 0; r < mat.getNumRows(); r++) {
            for (int c = 0; c < mat.getNumCols(); c++) {
                target.set(wavenumberIndex, r, c, mat.getReal(r, c), mat.getImag(r, c));
            }
        }
        return wavenumberIndex;
    }
}
