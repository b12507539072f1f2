package convwaves.io;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Contenido de {@code state.json}: la trayectoria compleja (Nt, Nv, Nk) separada en partes
 * real e imaginaria, con sus coordenadas.
 */
public record StateArchive(
        @JsonProperty("case") String caseName,
        String variant,
        @JsonProperty("rad_scaling") double radScaling,
        String mode,
        List<String> variables,
        ArchiveVariable<double[]> time,
        ArchiveVariable<double[]> wavenumber,
        @JsonProperty("state_real") double[][][] stateReal,
        @JsonProperty("state_imag") double[][][] stateImag
) {
}
