package convwaves.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import convwaves.domain.operator.OperatorMode;
import convwaves.domain.params.ExperimentVariant;
import lombok.Builder;
import lombok.With;

/**
 * Configuración de un caso tal y como se guarda en {@code cases/<caso>.json}.
 * Los campos ausentes toman los valores por defecto de {@link SimulationConfig}.
 */
@Builder
@With
@JsonIgnoreProperties(ignoreUnknown = true)
public record CaseConfig(
        @JsonProperty("variant") String variant,
        @JsonProperty("mode") String mode,
        @JsonProperty("delta_time") Double deltaTime,
        @JsonProperty("total_time") Double totalTime,
        @JsonProperty("min_wavelength_km") Double minWavelengthKm,
        @JsonProperty("max_wavelength_km") Double maxWavelengthKm,
        @JsonProperty("wavelength_step_km") Double wavelengthStepKm,
        @JsonProperty("cpu_processor_count") Integer cpuProcessorCount,
        @JsonProperty("initial_scales") double[] initialScales,
        @JsonProperty("seed") Long seed,
        @JsonProperty("radiative_table") String radiativeTable
) {

    /**
     * Traduce el caso a una {@link SimulationConfig}. Si no se declara la variante, el nombre
     * del caso hace de etiqueta ("no_rad", "qt_rad", ...).
     */
    public SimulationConfig toSimulationConfig(String caseName, double radScaling) {
        SimulationConfig config = SimulationConfig.builder()
                .caseName(caseName)
                .variant(ExperimentVariant.fromTag(variant != null ? variant : caseName))
                .radScaling(radScaling)
                .radiativeTablePath(radiativeTable)
                .initialScales(initialScales)
                .build();
        if (mode != null) {
            config = config.withOperatorMode(OperatorMode.fromTag(mode));
        }
        if (deltaTime != null) {
            config = config.withDeltaTime(deltaTime);
        }
        if (totalTime != null) {
            config = config.withTotalTime(totalTime);
        }
        if (minWavelengthKm != null) {
            config = config.withMinWavelengthKm(minWavelengthKm);
        }
        if (maxWavelengthKm != null) {
            config = config.withMaxWavelengthKm(maxWavelengthKm);
        }
        if (wavelengthStepKm != null) {
            config = config.withWavelengthStepKm(wavelengthStepKm);
        }
        if (cpuProcessorCount != null) {
            config = config.withCpuProcessorCount(cpuProcessorCount);
        }
        if (seed != null) {
            config = config.withSeed(seed);
        }
        return config;
    }
}
