package convwaves.physics.simulator;

import convwaves.config.ModelConstants;
import convwaves.domain.operator.OperatorMode;
import convwaves.domain.params.ParameterSet;
import convwaves.domain.simulation.ModalDiagnostic;
import convwaves.exception.UnsupportedModeException;
import convwaves.factory.SpectralGridFactory;
import convwaves.physics.i.IEigenvalueSolver;
import convwaves.physics.i.IOperatorBuilder;
import convwaves.physics.impl.CoupledWaveOperatorBuilder;
import convwaves.physics.impl.WavenumberEigenTask;
import convwaves.physics.solver.GeneralEigenvalueSolver;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Diagnóstico modal: tasas de crecimiento y velocidades de fase a partir de los autovalores
 * del operador en cada longitud de onda.
 */
@Slf4j
public class ModalDiagnostics {

    private final WavenumberParallelExecutor executor;
    private final ModelConstants constants;
    private final IOperatorBuilder operatorBuilder;
    private final IEigenvalueSolver eigenSolver;

    public ModalDiagnostics(WavenumberParallelExecutor executor, ModelConstants constants) {
        this(executor, constants, new CoupledWaveOperatorBuilder(), new GeneralEigenvalueSolver());
    }

    public ModalDiagnostics(WavenumberParallelExecutor executor,
                            ModelConstants constants,
                            IOperatorBuilder operatorBuilder,
                            IEigenvalueSolver eigenSolver) {
        this.executor = executor;
        this.constants = constants;
        this.operatorBuilder = operatorBuilder;
        this.eigenSolver = eigenSolver;
    }

    /**
     * Diagnóstico sobre el sistema completo.
     */
    public ModalDiagnostic diagnose(ParameterSet params, double[] wavelengthsKm) {
        return diagnose(params, wavelengthsKm, OperatorMode.FULL);
    }

    /**
     * @param params        Parámetros físicos.
     * @param wavelengthsKm Longitudes de onda en km, todas positivas y finitas.
     * @param mode          Sistema a diagnosticar.
     * @return Tasas (1/día) y velocidades (m/s) de forma (modos, Nk).
     * @throws IllegalArgumentException si alguna longitud de onda no es positiva o finita.
     */
    public ModalDiagnostic diagnose(ParameterSet params, double[] wavelengthsKm, OperatorMode mode) {
        if (mode == null) {
            throw new UnsupportedModeException("Modo de operador nulo. Use FULL u ONE_WAY.");
        }
        if (wavelengthsKm == null || wavelengthsKm.length == 0) {
            throw new IllegalArgumentException("Se necesita al menos una longitud de onda.");
        }
        long startTime = System.currentTimeMillis();
        double[] wavenumbers = SpectralGridFactory.toWavenumbers(wavelengthsKm, constants);
        ModalDiagnostic diagnostic = new ModalDiagnostic(wavelengthsKm, wavenumbers, mode.getDimension());

        List<WavenumberEigenTask> tasks = new ArrayList<>(wavenumbers.length);
        for (int j = 0; j < wavenumbers.length; j++) {
            tasks.add(new WavenumberEigenTask(j, wavenumbers[j], constants.velocityScale(),
                    params, mode, diagnostic, operatorBuilder, eigenSolver));
        }
        executor.invokeAll(tasks);

        if (log.isDebugEnabled()) {
            for (int j = 0; j < wavenumbers.length; j++) {
                ModalDiagnostic.ModeEstimate top = diagnostic.getMostUnstable(j);
                log.debug("λ={} km: σ={} 1/día, c={} m/s", wavelengthsKm[j], top.growthRate(), top.phaseSpeed());
            }
        }
        log.info("Diagnóstico modal completado: Nk={}, modo={}, solver={} ({} ms)",
                wavenumbers.length, mode, eigenSolver.getName(), System.currentTimeMillis() - startTime);
        return diagnostic;
    }
}
