package convwaves.io;

import convwaves.domain.params.ParameterSet;
import convwaves.domain.simulation.ModalDiagnostic;
import convwaves.domain.simulation.OperatorSet;
import convwaves.domain.simulation.SimulationOutcome;
import convwaves.domain.simulation.StateTrajectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Vuelca el resultado de una ejecución en un directorio de salida:
 * {@code state.json}, {@code optrs.json} y {@code diagnose.json}.
 */
@Slf4j
@RequiredArgsConstructor
public class SimulationArchiveWriter {

    public static final String STATE_FILE = "state.json";
    public static final String OPERATORS_FILE = "optrs.json";
    public static final String DIAGNOSTIC_FILE = "diagnose.json";

    private final JsonFileHandler fileHandler;

    public SimulationArchiveWriter() {
        this(new JsonFileHandler());
    }

    /**
     * Directorio de salida de un caso: {@code <root>/<caso>} si la variante no tiene radiación,
     * {@code <root>/<caso>/rad_scaling=<etiqueta>} en otro caso.
     *
     * @param radScalingLabel Factor de escala tal y como se recibió (ej: "0.001").
     */
    public static Path outputDirectory(Path outputRoot, String caseName, ParameterSet params, String radScalingLabel) {
        Path caseDir = outputRoot.resolve(caseName);
        if (!params.getVariant().isRadiativelyActive()) {
            return caseDir;
        }
        return caseDir.resolve("rad_scaling=" + radScalingLabel);
    }

    /**
     * Escribe los tres archivos en {@code outputDir}.
     *
     * @throws IOException si falla cualquiera de las escrituras.
     */
    public void write(SimulationOutcome outcome, Path outputDir) throws IOException {
        log.info("Guardando resultados en {}", outputDir.toAbsolutePath());
        fileHandler.writeToFile(toStateArchive(outcome), outputDir.resolve(STATE_FILE));
        fileHandler.writeToFile(toOperatorArchive(outcome.getOperators(), outcome.getStateLabels(),
                outcome.getMode().getTag()), outputDir.resolve(OPERATORS_FILE));
        fileHandler.writeToFile(toDiagnosticArchive(outcome.getDiagnostic()), outputDir.resolve(DIAGNOSTIC_FILE));
    }

    static StateArchive toStateArchive(SimulationOutcome outcome) {
        StateTrajectory trajectory = outcome.getTrajectory();
        ParameterSet params = outcome.getParameters();
        return new StateArchive(
                outcome.getCaseName(),
                params.getVariant().getTag(),
                params.getRadScaling(),
                outcome.getMode().getTag(),
                outcome.getStateLabels(),
                new ArchiveVariable<>(outcome.getGrid().time(), "day", "time"),
                new ArchiveVariable<>(outcome.getGrid().wavenumbers(), "None", "non-dimensional wavenumber"),
                trajectory.toRealCube(),
                trajectory.toImagCube());
    }

    static OperatorArchive toOperatorArchive(OperatorSet operators, List<String> labels, String modeTag) {
        return new OperatorArchive(
                modeTag,
                labels,
                new ArchiveVariable<>(operators.cloneWavenumbers(), "None", "non-dimensional wavenumber"),
                operators.toRealCube(),
                operators.toImagCube());
    }

    static DiagnosticArchive toDiagnosticArchive(ModalDiagnostic diagnostic) {
        return new DiagnosticArchive(
                new ArchiveVariable<>(diagnostic.cloneWavelengths(), "km", "wavelength"),
                new ArchiveVariable<>(diagnostic.cloneWavenumbers(), "km/km", "non-dimensional wavenumber"),
                new ArchiveVariable<>(diagnostic.cloneGrowthRates(), "1/day", "modal growth rate"),
                new ArchiveVariable<>(diagnostic.clonePhaseSpeeds(), "m/s", "phase speed"));
    }
}
