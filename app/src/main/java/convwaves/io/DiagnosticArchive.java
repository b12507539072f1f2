package convwaves.io;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Contenido de {@code diagnose.json}: tasas de crecimiento y velocidades de fase de forma
 * (modos, Nk).
 */
public record DiagnosticArchive(
        @JsonProperty("lambda") ArchiveVariable<double[]> wavelength,
        @JsonProperty("k") ArchiveVariable<double[]> wavenumber,
        @JsonProperty("growth_rate") ArchiveVariable<double[][]> growthRate,
        @JsonProperty("phase_speed") ArchiveVariable<double[][]> phaseSpeed
) {
}
