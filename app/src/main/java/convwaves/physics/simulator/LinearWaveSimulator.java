package convwaves.physics.simulator;

import convwaves.config.SimulationConfig;
import convwaves.domain.operator.OperatorMode;
import convwaves.domain.params.ParameterSet;
import convwaves.domain.simulation.ModalDiagnostic;
import convwaves.domain.simulation.OperatorSet;
import convwaves.domain.simulation.SimulationOutcome;
import convwaves.domain.simulation.StateTrajectory;
import convwaves.domain.spectral.SpectralGrid;
import convwaves.domain.spectral.SpectralState;
import convwaves.exception.UnsupportedModeException;
import convwaves.factory.InitialStateFactory;
import convwaves.factory.SpectralGridFactory;
import convwaves.physics.i.IEigenvalueSolver;
import convwaves.physics.i.IMatrixExponential;
import convwaves.physics.i.IOperatorBuilder;
import convwaves.physics.impl.CoupledWaveOperatorBuilder;
import convwaves.physics.impl.OperatorAssemblyTask;
import convwaves.physics.solver.GeneralEigenvalueSolver;
import convwaves.physics.solver.PadeMatrixExponential;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Orquestador de una ejecución del modelo lineal.
 * <p>
 * Responsabilidades:
 * 1. Construir la malla espectral y la condición inicial a partir de la configuración.
 * 2. Integrar la trayectoria con {@link SpectralIntegrator}.
 * 3. Exportar los operadores y calcular el diagnóstico modal con {@link ModalDiagnostics}.
 * <p>
 * Es dueño del pool de hilos: debe cerrarse (try-with-resources).
 */
@Slf4j
public class LinearWaveSimulator implements AutoCloseable {

    @Getter
    private final SimulationConfig config;
    @Getter
    private final ParameterSet params;
    private final WavenumberParallelExecutor executor;
    private final IOperatorBuilder operatorBuilder;
    private final SpectralIntegrator integrator;
    private final ModalDiagnostics diagnostics;

    public LinearWaveSimulator(SimulationConfig config, ParameterSet params) {
        this(config, params, new CoupledWaveOperatorBuilder(), new PadeMatrixExponential(), new GeneralEigenvalueSolver());
    }

    public LinearWaveSimulator(SimulationConfig config,
                               ParameterSet params,
                               IOperatorBuilder operatorBuilder,
                               IMatrixExponential exponential,
                               IEigenvalueSolver eigenSolver) {
        if (config.getOperatorMode() == null) {
            throw new UnsupportedModeException("La configuración no define el modo de operador.");
        }
        this.config = config;
        this.params = params;
        this.operatorBuilder = operatorBuilder;
        this.executor = new WavenumberParallelExecutor(config.getCpuProcessorCount());
        this.integrator = new SpectralIntegrator(executor, operatorBuilder, exponential);
        this.diagnostics = new ModalDiagnostics(executor, config.getModelConstants(), operatorBuilder, eigenSolver);
        log.info("LinearWaveSimulator inicializado. (caso: {}, variante: {}, rad_scaling: {}, modo: {})",
                config.getCaseName(), params.getVariant().getTag(), params.getRadScaling(), config.getOperatorMode());
    }

    /**
     * Ejecución completa con la condición inicial aleatoria definida por la configuración.
     */
    public SimulationOutcome run() {
        SpectralGrid grid = SpectralGridFactory.create(config);
        SpectralState initialState = InitialStateFactory.randomState(
                config.getOperatorMode().getDimension(), grid.getWavenumberCount(),
                config.getInitialScales(), config.getSeed());
        return run(grid, initialState);
    }

    /**
     * Ejecución completa sobre una malla y un estado inicial dados.
     */
    public SimulationOutcome run(SpectralGrid grid, SpectralState initialState) {
        long startTime = System.currentTimeMillis();
        OperatorMode mode = config.getOperatorMode();
        log.info("Iniciando simulación: Nt={}, Nk={}, modo={}", grid.getTimeCount(), grid.getWavenumberCount(), mode);

        StateTrajectory trajectory = StateTrajectory.allocate(
                grid.getTimeCount(), mode.getDimension(), grid.getWavenumberCount());
        integrator.integrate(trajectory, grid.time(), grid.wavenumbers(), initialState, params, mode);

        OperatorSet operators = assembleOperators(grid.wavenumbers(), params, mode);
        ModalDiagnostic diagnostic = diagnostics.diagnose(params, grid.wavelengthsKm(), mode);

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("Simulación completada en {} ms.", elapsed);

        return SimulationOutcome.builder()
                .caseName(config.getCaseName())
                .parameters(params)
                .mode(mode)
                .grid(grid)
                .trajectory(trajectory)
                .operators(operators)
                .diagnostic(diagnostic)
                .simulationTime(elapsed)
                .build();
    }

    /**
     * Matrices del operador para cada número de onda, forma (Nk, Nv, Nv).
     */
    public OperatorSet assembleOperators(double[] wavenumbers, ParameterSet params, OperatorMode mode) {
        if (mode == null) {
            throw new UnsupportedModeException("Modo de operador nulo. Use FULL u ONE_WAY.");
        }
        OperatorSet operators = new OperatorSet(wavenumbers, mode.getDimension());
        List<OperatorAssemblyTask> tasks = new ArrayList<>(wavenumbers.length);
        for (int j = 0; j < wavenumbers.length; j++) {
            tasks.add(new OperatorAssemblyTask(j, wavenumbers[j], params, mode, operators, operatorBuilder));
        }
        executor.invokeAll(tasks);
        log.debug("Operadores ensamblados: Nk={}, dimensión={}", wavenumbers.length, mode.getDimension());
        return operators;
    }

    public ModalDiagnostic diagnose(double[] wavelengthsKm) {
        return diagnostics.diagnose(params, wavelengthsKm, config.getOperatorMode());
    }

    @Override
    public void close() {
        executor.close();
    }
}
