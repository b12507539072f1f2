package convwaves.config;

import convwaves.domain.operator.OperatorMode;
import convwaves.domain.params.ExperimentVariant;
import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Contenedor principal de la configuración de una ejecución.
 * Agrupa la variante del experimento, la discretización espectral/temporal y los
 * recursos de cómputo.
 */
@Value
@Builder
@With
public class SimulationConfig {

    /**
     * Nombre del caso (se usa para el directorio de salida).
     */
    String caseName;

    /**
     * Variante del experimento (qué radiación está activa).
     */
    ExperimentVariant variant;

    /**
     * Factor que multiplica todos los coeficientes radiativos poblados.
     */
    double radScaling;

    /**
     * Sistema completo (6x6) o reducido (4x4).
     */
    @Builder.Default
    OperatorMode operatorMode = OperatorMode.FULL;

    /**
     * Paso de tiempo en días.
     */
    @Builder.Default
    double deltaTime = 0.1;

    /**
     * Tiempo total simulado en días.
     */
    @Builder.Default
    double totalTime = 60.0;

    /**
     * Muestreo de longitudes de onda (km): mínimo, máximo y paso.
     */
    @Builder.Default
    double minWavelengthKm = 540.0;
    @Builder.Default
    double maxWavelengthKm = 43200.0;
    @Builder.Default
    double wavelengthStepKm = 540.0;

    /**
     * Amplitud de la condición inicial aleatoria para cada variable de estado.
     * Si es null se usa 0.1 para todas.
     */
    double[] initialScales;

    /**
     * Semilla de la condición inicial aleatoria.
     */
    @Builder.Default
    long seed = 42L;

    /**
     * Número de hilos para el reparto por número de onda.
     */
    @Builder.Default
    int cpuProcessorCount = Runtime.getRuntime().availableProcessors();

    /**
     * Ruta de la tabla JSON de coeficientes radiativos (solo variantes radiativas).
     */
    String radiativeTablePath;

    /**
     * Escalas físicas de conversión.
     */
    @Builder.Default
    ModelConstants modelConstants = ModelConstants.standard();

    /**
     * Coeficientes base no radiativos.
     */
    @Builder.Default
    BaseCoefficients baseCoefficients = BaseCoefficients.kuang2008();

    public long getTotalTimeSteps() {
        return Math.round(totalTime / deltaTime);
    }
}
