package convwaves.physics.impl;

import convwaves.domain.operator.OperatorMode;
import convwaves.domain.params.ParameterSet;
import convwaves.domain.simulation.ModalDiagnostic;
import convwaves.physics.i.IEigenvalueSolver;
import convwaves.physics.i.IOperatorBuilder;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.ejml.data.Complex_F64;

import java.util.Arrays;
import java.util.Comparator;
import java.util.concurrent.Callable;

/**
 * Tarea que calcula tasas de crecimiento y velocidades de fase para un número de onda.
 * <p>
 * σ = Re(λ) en 1/día; c = -Im(λ)/k · escala de velocidad en m/s. Los modos se escriben
 * en la columna {@code wavenumberIndex} ordenados por σ descendente.
 */
@Getter
@RequiredArgsConstructor
public class WavenumberEigenTask implements Callable<WavenumberEigenTask> {

    private final int wavenumberIndex;
    private final double wavenumber;
    private final double velocityScale;
    private final ParameterSet params;
    private final OperatorMode mode;
    private final ModalDiagnostic diagnostic; // Compartido; solo se toca la columna propia
    private final IOperatorBuilder operatorBuilder;
    private final IEigenvalueSolver eigenSolver;

    private Complex_F64[] eigenvalues;

    @Override
    public WavenumberEigenTask call() {
        Complex_F64[] values = eigenSolver.eigenvalues(operatorBuilder.build(wavenumber, params, mode));
        Arrays.sort(values, Comparator.comparingDouble((Complex_F64 z) -> z.getReal()).reversed()
                .thenComparingDouble(Complex_F64::getImaginary));
        this.eigenvalues = values;

        int modes = Math.min(values.length, diagnostic.getModeCount());
        for (int m = 0; m < modes; m++) {
            double growth = values[m].getReal();
            double speed = -values[m].getImaginary() / wavenumber * velocityScale;
            diagnostic.set(m, wavenumberIndex, growth, speed);
        }
        return this;
    }
}
