package convwaves.physics.impl;

import convwaves.domain.operator.OperatorMode;
import convwaves.domain.params.ParameterSet;
import convwaves.domain.simulation.StateTrajectory;
import convwaves.domain.spectral.SpectralState;
import convwaves.physics.i.IMatrixExponential;
import convwaves.physics.i.IOperatorBuilder;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.CommonOps_ZDRM;

import java.util.concurrent.Callable;

/**
 * Tarea que integra en el tiempo la columna de un único número de onda.
 * <p>
 * Construye L_j, calcula el propagador exacto Φ_j = exp(Δt·L_j) una sola vez y aplica
 * x_n = Φ_j·x_{n-1}. Solo escribe la columna {@code wavenumberIndex} de la trayectoria.
 */
@Getter
@RequiredArgsConstructor
public class WavenumberPropagationTask implements Callable<WavenumberPropagationTask> {

    // --- Entradas para la tarea ---
    private final int wavenumberIndex;
    private final double wavenumber;
    private final double deltaTime;
    private final ParameterSet params;
    private final OperatorMode mode;
    private final SpectralState initialState;
    private final StateTrajectory trajectory; // Compartida; solo se toca la columna propia
    private final IOperatorBuilder operatorBuilder;
    private final IMatrixExponential exponential;

    // --- Resultado de la tarea ---
    private ZMatrixRMaj propagator;

    @Override
    public WavenumberPropagationTask call() {
        final int j = wavenumberIndex;
        final int nv = trajectory.getVariableCount();
        final int nt = trajectory.getTimeCount();

        ZMatrixRMaj current = new ZMatrixRMaj(nv, 1);
        for (int v = 0; v < nv; v++) {
            double re = initialState.getReal(v, j);
            double im = initialState.getImag(v, j);
            current.set(v, 0, re, im);
            trajectory.set(0, v, j, re, im);
        }

        if (nt == 1) {
            return this;
        }

        ZMatrixRMaj operator = operatorBuilder.build(wavenumber, params, mode);
        this.propagator = exponential.exp(operator, deltaTime);

        ZMatrixRMaj next = new ZMatrixRMaj(nv, 1);
        for (int n = 1; n < nt; n++) {
            propagate(propagator, current, next);
            for (int v = 0; v < nv; v++) {
                trajectory.set(n, v, j, next.getReal(v, 0), next.getImag(v, 0));
            }
            ZMatrixRMaj swap = current;
            current = next;
            next = swap;
        }
        return this;
    }

    /**
     * Un paso: out = Φ·x.
     */
    public static void propagate(ZMatrixRMaj propagator, ZMatrixRMaj state, ZMatrixRMaj out) {
        CommonOps_ZDRM.mult(propagator, state, out);
    }
}
