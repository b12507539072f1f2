package convwaves.physics.simulator;

import convwaves.domain.operator.OperatorMode;
import convwaves.domain.params.ParameterSet;
import convwaves.domain.simulation.StateTrajectory;
import convwaves.domain.spectral.SpectralState;
import convwaves.exception.DimensionMismatchException;
import convwaves.exception.NonUniformTimeGridException;
import convwaves.exception.UnsupportedModeException;
import convwaves.physics.i.IMatrixExponential;
import convwaves.physics.i.IOperatorBuilder;
import convwaves.physics.impl.CoupledWaveOperatorBuilder;
import convwaves.physics.impl.WavenumberPropagationTask;
import convwaves.physics.solver.PadeMatrixExponential;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Integrador temporal del sistema lineal en espacio espectral.
 * <p>
 * Cada número de onda evoluciona de forma independiente con su propagador exacto
 * Φ_j = exp(Δt·L_j), así que no hay error de discretización temporal: solo el de la
 * exponencial y los productos matriz-vector.
 * <p>
 * Precondición: la malla temporal es equiespaciada. Se valida (tolerancia relativa 1e-9)
 * porque un Δt variable daría un propagador incorrecto sin ningún síntoma.
 */
@Slf4j
public class SpectralIntegrator {

    private static final double UNIFORM_GRID_TOLERANCE = 1e-9;

    private final WavenumberParallelExecutor executor;
    private final IOperatorBuilder operatorBuilder;
    private final IMatrixExponential exponential;

    public SpectralIntegrator(WavenumberParallelExecutor executor) {
        this(executor, new CoupledWaveOperatorBuilder(), new PadeMatrixExponential());
    }

    public SpectralIntegrator(WavenumberParallelExecutor executor,
                              IOperatorBuilder operatorBuilder,
                              IMatrixExponential exponential) {
        this.executor = executor;
        this.operatorBuilder = operatorBuilder;
        this.exponential = exponential;
    }

    /**
     * Rellena {@code trajectory} con la evolución de {@code initialState}.
     *
     * @param trajectory   Buffer de forma (Nt, Nv, Nk). Se sobrescribe por completo.
     * @param time         Malla temporal equiespaciada de longitud Nt (días).
     * @param wavenumbers  Números de onda adimensionales, longitud Nk.
     * @param initialState Estado inicial de forma (Nv, Nk).
     * @param params       Parámetros físicos.
     * @param mode         Sistema completo o reducido; Nv debe coincidir con su dimensión.
     * @throws DimensionMismatchException   si las formas no son coherentes.
     * @throws NonUniformTimeGridException  si la malla temporal no es equiespaciada.
     * @throws UnsupportedModeException     si el modo es nulo.
     */
    public void integrate(StateTrajectory trajectory,
                          double[] time,
                          double[] wavenumbers,
                          SpectralState initialState,
                          ParameterSet params,
                          OperatorMode mode) {
        if (mode == null) {
            throw new UnsupportedModeException("Modo de operador nulo. Use FULL u ONE_WAY.");
        }
        validateShapes(trajectory, time, wavenumbers, initialState, mode);
        final double deltaTime = time.length > 1 ? time[1] - time[0] : 0.0;
        validateUniform(time, deltaTime);

        long startTime = System.currentTimeMillis();
        final int nk = wavenumbers.length;

        List<WavenumberPropagationTask> tasks = new ArrayList<>(nk);
        for (int j = 0; j < nk; j++) {
            tasks.add(new WavenumberPropagationTask(
                    j, wavenumbers[j], deltaTime, params, mode,
                    initialState, trajectory, operatorBuilder, exponential));
        }
        executor.invokeAll(tasks);

        log.info("Integración completada: Nt={}, Nv={}, Nk={}, modo={}, Δt={} ({} ms, {})",
                time.length, trajectory.getVariableCount(), nk, mode, deltaTime,
                System.currentTimeMillis() - startTime, exponential.getName());
    }

    private static void validateShapes(StateTrajectory trajectory, double[] time, double[] wavenumbers,
                                       SpectralState initialState, OperatorMode mode) {
        if (trajectory.getTimeCount() != time.length) {
            throw DimensionMismatchException.of("Nt (trayectoria vs malla temporal)", time.length, trajectory.getTimeCount());
        }
        if (trajectory.getWavenumberCount() != wavenumbers.length) {
            throw DimensionMismatchException.of("Nk (trayectoria vs números de onda)", wavenumbers.length, trajectory.getWavenumberCount());
        }
        if (initialState.getWavenumberCount() != wavenumbers.length) {
            throw DimensionMismatchException.of("Nk (estado inicial vs números de onda)", wavenumbers.length, initialState.getWavenumberCount());
        }
        if (initialState.getVariableCount() != trajectory.getVariableCount()) {
            throw DimensionMismatchException.of("Nv (estado inicial vs trayectoria)", trajectory.getVariableCount(), initialState.getVariableCount());
        }
        if (trajectory.getVariableCount() != mode.getDimension()) {
            throw DimensionMismatchException.of("Nv (trayectoria vs dimensión del operador " + mode + ")", mode.getDimension(), trajectory.getVariableCount());
        }
    }

    private static void validateUniform(double[] time, double deltaTime) {
        double tolerance = UNIFORM_GRID_TOLERANCE * Math.max(Math.abs(deltaTime), Double.MIN_NORMAL);
        for (int n = 1; n < time.length; n++) {
            double step = time[n] - time[n - 1];
            if (Math.abs(step - deltaTime) > tolerance) {
                throw new NonUniformTimeGridException(String.format(
                        "Malla temporal no equiespaciada: Δt[%d] = %s frente a Δt = %s", n, step, deltaTime));
            }
        }
    }
}
