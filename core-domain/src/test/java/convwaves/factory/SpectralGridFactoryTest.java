package convwaves.factory;

import convwaves.config.ModelConstants;
import convwaves.config.SimulationConfig;
import convwaves.domain.params.ExperimentVariant;
import convwaves.domain.spectral.SpectralGrid;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SpectralGridFactoryTest {

    @Test
    @DisplayName("La configuración por defecto produce 601 tiempos y 80 longitudes de onda")
    void create_defaultConfig_shouldMatchReferenceSampling() {
        SimulationConfig config = SimulationConfig.builder()
                .caseName("no_rad")
                .variant(ExperimentVariant.NO_RADIATION)
                .build();

        SpectralGrid grid = SpectralGridFactory.create(config);

        assertEquals(601, grid.getTimeCount());
        assertEquals(80, grid.getWavenumberCount());
        assertEquals(0.1, grid.getDeltaTime(), 1e-12);
        assertEquals(60.0, grid.time()[600], 1e-9);
        assertEquals(540.0, grid.wavelengthsKm()[0]);
        assertEquals(43200.0, grid.wavelengthsKm()[79]);
        // λ = 4320 km corresponde a k = 2π
        assertEquals(2.0 * Math.PI, grid.wavenumbers()[7], 1e-12);
        assertEquals(600, config.getTotalTimeSteps());
    }

    @Test
    @DisplayName("Cada instante es exactamente n·Δt")
    void uniformTimeGrid_shouldNotAccumulateRoundingError() {
        double[] t = SpectralGridFactory.uniformTimeGrid(0.1, 10.0);

        assertEquals(101, t.length);
        for (int n = 0; n < t.length; n++) {
            assertEquals(n * 0.1, t[n], 0.0);
        }
    }

    @Test
    @DisplayName("Tiempo total cero produce una malla de un único instante")
    void uniformTimeGrid_zeroTotal_shouldHaveSinglePoint() {
        assertArrayEquals(new double[]{0.0}, SpectralGridFactory.uniformTimeGrid(0.5, 0.0));
    }

    @Test
    @DisplayName("Debería rechazar pasos de tiempo no positivos")
    void uniformTimeGrid_invalidStep_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> SpectralGridFactory.uniformTimeGrid(0.0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> SpectralGridFactory.uniformTimeGrid(-0.1, 1.0));
        assertThrows(IllegalArgumentException.class, () -> SpectralGridFactory.uniformTimeGrid(0.1, -1.0));
    }

    @Test
    @DisplayName("El muestreo de longitudes de onda no supera el máximo")
    void wavelengthSampling_shouldStopAtMaximum() {
        assertArrayEquals(new double[]{1000.0, 1500.0, 2000.0},
                SpectralGridFactory.wavelengthSampling(1000.0, 2200.0, 500.0));
        assertArrayEquals(new double[]{540.0}, SpectralGridFactory.wavelengthSampling(540.0, 540.0, 540.0));
        assertThrows(IllegalArgumentException.class, () -> SpectralGridFactory.wavelengthSampling(0.0, 10.0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> SpectralGridFactory.wavelengthSampling(10.0, 5.0, 1.0));
    }

    @Test
    @DisplayName("k = 2π·L/λ y las longitudes de onda no positivas son inválidas")
    void toWavenumbers_shouldConvertAndValidate() {
        ModelConstants constants = ModelConstants.standard();

        double[] k = SpectralGridFactory.toWavenumbers(new double[]{4320.0, 8640.0}, constants);

        assertEquals(2.0 * Math.PI, k[0], 1e-12);
        assertEquals(Math.PI, k[1], 1e-12);
        assertThrows(IllegalArgumentException.class,
                () -> SpectralGridFactory.toWavenumbers(new double[]{100.0, 0.0}, constants));
        assertThrows(IllegalArgumentException.class,
                () -> SpectralGridFactory.toWavenumbers(new double[]{Double.NaN}, constants));
    }
}
