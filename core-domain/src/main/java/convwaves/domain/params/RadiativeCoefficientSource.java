package convwaves.domain.params;

import java.io.IOException;

/**
 * Colaborador externo que proporciona la tabla de coeficientes radiativos
 * (un fichero, un recurso del classpath, un mock en tests...).
 */
@FunctionalInterface
public interface RadiativeCoefficientSource {

    RadiativeCoefficientTable load() throws IOException;
}
