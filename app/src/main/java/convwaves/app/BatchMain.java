package convwaves.app;

import convwaves.config.CaseConfig;
import convwaves.config.SimulationConfig;
import convwaves.domain.params.ParameterSet;
import convwaves.domain.simulation.SimulationOutcome;
import convwaves.exception.ConfigurationException;
import convwaves.factory.ParameterSetFactory;
import convwaves.io.CaseConfigLoader;
import convwaves.io.JsonRadiativeCoefficientSource;
import convwaves.io.SimulationArchiveWriter;
import convwaves.physics.simulator.LinearWaveSimulator;
import lombok.extern.slf4j.Slf4j;
import org.ejml.concurrency.EjmlConcurrency;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Punto de entrada por lotes.
 * <p>
 * Uso: {@code BatchMain <caso> [rad_scaling] [directorio_salida]}.
 * Por defecto: caso {@code no_rad}, rad_scaling {@code 0.001}, salida {@code output}.
 */
@Slf4j
public class BatchMain {

    static final String DEFAULT_CASE = "no_rad";
    static final String DEFAULT_RAD_SCALING = "0.001";
    static final String DEFAULT_OUTPUT_ROOT = "output";

    public static void main(String[] args) {
        try {
            Path outputDir = run(args);
            log.info("Resultados guardados en {}", outputDir.toAbsolutePath());
        } catch (IOException | RuntimeException e) {
            log.error("La ejecución ha fallado: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * Ejecuta un caso completo y devuelve el directorio donde se guardaron los resultados.
     *
     * @throws ConfigurationException si el caso o sus argumentos no son válidos.
     * @throws IOException            si falla la escritura de resultados.
     */
    public static Path run(String[] args) throws IOException {
        String caseName = args.length >= 1 ? args[0] : DEFAULT_CASE;
        String radScalingLabel = args.length >= 2 ? args[1] : DEFAULT_RAD_SCALING;
        Path outputRoot = Path.of(args.length >= 3 ? args[2] : DEFAULT_OUTPUT_ROOT);
        double radScaling = parseRadScaling(radScalingLabel);
        log.info("Caso: {}, rad_scaling = {}", caseName, radScalingLabel);

        // El paralelismo lo pone el reparto por número de onda
        EjmlConcurrency.USE_CONCURRENT = false;

        CaseConfig caseConfig = new CaseConfigLoader().load(caseName);
        SimulationConfig config = caseConfig.toSimulationConfig(caseName, radScaling);

        ParameterSetFactory parameterFactory = new ParameterSetFactory(
                config.getBaseCoefficients(),
                config.getRadiativeTablePath() == null ? null
                        : new JsonRadiativeCoefficientSource(config.getRadiativeTablePath()));
        ParameterSet params = parameterFactory.build(config.getVariant(), radScaling);

        SimulationOutcome outcome;
        try (LinearWaveSimulator simulator = new LinearWaveSimulator(config, params)) {
            outcome = simulator.run();
        }

        Path outputDir = SimulationArchiveWriter.outputDirectory(outputRoot, caseName, params, radScalingLabel);
        new SimulationArchiveWriter().write(outcome, outputDir);
        return outputDir;
    }

    static double parseRadScaling(String label) {
        try {
            return Double.parseDouble(label);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("rad_scaling no es un número: '" + label + "'", e);
        }
    }
}
