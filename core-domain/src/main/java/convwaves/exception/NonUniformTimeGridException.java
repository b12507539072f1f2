package convwaves.exception;

/**
 * La malla temporal no es equiespaciada. El propagador exp(Δt·L) se calcula una
 * sola vez por número de onda, así que un Δt variable daría resultados incorrectos.
 */
public class NonUniformTimeGridException extends IllegalArgumentException {

    public NonUniformTimeGridException(String message) {
        super(message);
    }
}
