package convwaves.domain.simulation;

import convwaves.domain.operator.OperatorMode;
import convwaves.domain.params.ParameterSet;
import convwaves.domain.spectral.SpectralGrid;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Resultado completo de una ejecución: trayectoria, operadores y diagnóstico modal junto
 * con las coordenadas y los parámetros que los produjeron.
 */
@Value
@Builder
public class SimulationOutcome {

    String caseName;
    ParameterSet parameters;
    OperatorMode mode;
    SpectralGrid grid;
    StateTrajectory trajectory;
    OperatorSet operators;
    ModalDiagnostic diagnostic;

    /**
     * Tiempo de cómputo total en milisegundos.
     */
    long simulationTime;

    public List<String> getStateLabels() {
        return mode.getStateLabels();
    }
}
