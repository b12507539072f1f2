package convwaves.domain.spectral;

import lombok.Builder;

/**
 * Coordenadas de una ejecución: malla temporal (días), longitudes de onda (km) y números
 * de onda adimensionales asociados.
 */
@Builder
public record SpectralGrid(
        double[] time,
        double[] wavelengthsKm,
        double[] wavenumbers
) {

    public int getTimeCount() {
        return time.length;
    }

    public int getWavenumberCount() {
        return wavenumbers.length;
    }

    public double getDeltaTime() {
        return time.length > 1 ? time[1] - time[0] : 0.0;
    }
}
