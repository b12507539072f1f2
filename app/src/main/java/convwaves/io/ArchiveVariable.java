package convwaves.io;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Variable exportada con sus atributos de metadatos.
 *
 * @param values       Datos (array de cualquier rango).
 * @param units        Unidades físicas ("day", "km", "1/day", "m/s", "None").
 * @param standardName Nombre descriptivo.
 */
public record ArchiveVariable<T>(
        T values,
        String units,
        @JsonProperty("standard_name") String standardName
) {
}
