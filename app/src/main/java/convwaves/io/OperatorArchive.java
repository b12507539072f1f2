package convwaves.io;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Contenido de {@code optrs.json}: operadores (Nk, Nv, Nv) por número de onda.
 */
public record OperatorArchive(
        String mode,
        List<String> variables,
        ArchiveVariable<double[]> wavenumber,
        @JsonProperty("optrs_real") double[][][] operatorsReal,
        @JsonProperty("optrs_imag") double[][][] operatorsImag
) {
}
