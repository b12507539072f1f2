package convwaves.physics.impl;

import convwaves.config.BaseCoefficients;
import convwaves.domain.operator.OperatorMode;
import convwaves.domain.params.ExperimentVariant;
import convwaves.domain.params.ParameterSet;
import convwaves.domain.params.RadiativeFeedback;
import convwaves.exception.UnsupportedModeException;
import org.ejml.data.ZMatrixRMaj;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Pruebas de {@link CoupledWaveOperatorBuilder} contra las matrices de referencia de los
 * parámetros de Kuang (2008) en k = 1.
 */
class CoupledWaveOperatorBuilderTest {

    private static final double TOL = 1e-12;

    private CoupledWaveOperatorBuilder builder;
    private ParameterSet noRad;

    @BeforeEach
    void setUp() {
        builder = new CoupledWaveOperatorBuilder();
        noRad = ParameterSet.builder()
                .variant(ExperimentVariant.NO_RADIATION)
                .radScaling(0.0)
                .base(BaseCoefficients.kuang2008())
                .build();
    }

    @Test
    @DisplayName("El operador completo sin radiación en k = 1 coincide con la matriz de referencia")
    void build_full_noRad_shouldMatchReference() {
        double[][] expected = {
                {-0.1, 0.0, 1.0, 0.0, 0.0, 0.0},
                {0.0, -0.1, 0.0, 0.25, 0.0, 0.0},
                {-1.0, 0.0, -1.05, 0.0, 0.7, 2.0},
                {0.0, -1.0, 1.05, 0.0, -0.7, 0.0},
                {1.4, 0.0, 2.205, 0.0, -1.47, -2.2},
                {4.0, 4.0, -2.1, 0.0, 1.4, -12.0}
        };

        ZMatrixRMaj mat = builder.build(1.0, noRad, OperatorMode.FULL);

        assertEquals(6, mat.getNumRows());
        assertEquals(6, mat.getNumCols());
        for (int r = 0; r < 6; r++) {
            for (int c = 0; c < 6; c++) {
                assertEquals(expected[r][c], mat.getReal(r, c), TOL, "Entrada (" + r + ", " + c + ")");
                assertEquals(0.0, mat.getImag(r, c), 0.0);
            }
        }
    }

    @Test
    @DisplayName("El operador reducido en k = 1 coincide con la matriz de referencia")
    void build_oneWay_shouldMatchReference() {
        double[][] expectedRe = {
                {-0.1, 0.0, 0.0, 1.0},
                {1.05, -0.1, -0.7, 0.0},
                {1.05, 0.0, -0.7, 0.3},
                {-48.0, 2.4, 33.6, -36.0}
        };
        double[][] expectedIm = {
                {-1.0, 0.0, 0.0, 0.0},
                {0.0, -0.5, 0.0, 0.0},
                {0.0, 0.0, 0.0, 0.0},
                {24.0, 12.0, 0.0, 0.0}
        };

        ZMatrixRMaj mat = builder.build(1.0, noRad, OperatorMode.ONE_WAY);

        assertEquals(4, mat.getNumRows());
        for (int r = 0; r < 4; r++) {
            for (int c = 0; c < 4; c++) {
                assertEquals(expectedRe[r][c], mat.getReal(r, c), 1e-9, "Re(" + r + ", " + c + ")");
                assertEquals(expectedIm[r][c], mat.getImag(r, c), 1e-9, "Im(" + r + ", " + c + ")");
            }
        }
    }

    @Test
    @DisplayName("Dos llamadas con las mismas entradas devuelven la misma matriz bit a bit")
    void build_shouldBeDeterministic() {
        ZMatrixRMaj a = builder.build(2.7, noRad, OperatorMode.FULL);
        ZMatrixRMaj b = builder.build(2.7, noRad, OperatorMode.FULL);

        assertArrayEquals(a.getData(), b.getData(), 0.0);
    }

    @Test
    @DisplayName("Con coeficientes radiativos nulos cualquier variante produce el operador sin radiación")
    void build_zeroRadiation_shouldCollapseToNoRad() {
        ParameterSet fullZero = ParameterSet.builder()
                .variant(ExperimentVariant.FULL)
                .radScaling(0.0)
                .base(BaseCoefficients.kuang2008())
                .radiative(RadiativeFeedback.builder().build())
                .build();

        ZMatrixRMaj expected = builder.build(1.3, noRad, OperatorMode.FULL);
        ZMatrixRMaj actual = builder.build(1.3, fullZero, OperatorMode.FULL);

        assertArrayEquals(expected.getData(), actual.getData(), 0.0);
    }

    @Test
    @DisplayName("Los coeficientes RT y Rq entran en las filas de temperatura y se propagan a la humedad")
    void build_radiation_shouldEnterTemperatureAndMoistureRows() {
        RadiativeFeedback rad = RadiativeFeedback.builder()
                .rt11Lw(0.2).rt11Sw(0.1)
                .rq2Lw(0.05)
                .build();
        ParameterSet params = ParameterSet.builder()
                .variant(ExperimentVariant.MOISTURE_TEMPERATURE)
                .radScaling(1.0)
                .base(BaseCoefficients.kuang2008())
                .radiative(rad)
                .build();

        ZMatrixRMaj base = builder.build(1.0, noRad, OperatorMode.FULL);
        ZMatrixRMaj mat = builder.build(1.0, params, OperatorMode.FULL);

        // T1: columna T1
        assertEquals(base.getReal(2, 2) + 0.3, mat.getReal(2, 2), TOL);
        // T2: columna q
        assertEquals(base.getReal(3, 4) + 0.05, mat.getReal(3, 4), TOL);
        // q = -d1·T1 - d2·T2 (d1 = 1.1, d2 = -1)
        assertEquals(base.getReal(4, 2) - 1.1 * 0.3, mat.getReal(4, 2), TOL);
        assertEquals(base.getReal(4, 4) + 0.05, mat.getReal(4, 4), TOL);
        // La fila de calentamiento no depende de la radiación
        for (int c = 0; c < 6; c++) {
            assertEquals(base.getReal(5, c), mat.getReal(5, c), 0.0);
        }
    }

    @Test
    @DisplayName("Los coeficientes Rw de nubes no modifican el operador: cld_rad coincide con no_rad")
    void build_cloudRadiation_shouldMatchNoRadiationOperator() {
        ParameterSet cloud = ParameterSet.builder()
                .variant(ExperimentVariant.CLOUD)
                .radScaling(1.0)
                .base(BaseCoefficients.kuang2008())
                .radiative(RadiativeFeedback.builder()
                        .rw11Lw(0.1).rw12Sw(0.3)
                        .rw21Lw(0.4).rw22Sw(0.05)
                        .build())
                .build();

        ZMatrixRMaj expected = builder.build(1.0, noRad, OperatorMode.FULL);
        ZMatrixRMaj actual = builder.build(1.0, cloud, OperatorMode.FULL);

        assertArrayEquals(expected.getData(), actual.getData(), 0.0);
        assertEquals(-1.0, actual.getReal(2, 0), 0.0);
        assertEquals(0.0, actual.getReal(2, 1), 0.0);
        assertEquals(0.0, actual.getReal(3, 0), 0.0);
        assertEquals(-1.0, actual.getReal(3, 1), 0.0);
        assertEquals(1.4, actual.getReal(4, 0), 0.0);
        assertEquals(0.0, actual.getReal(4, 1), 0.0);
    }

    @Test
    @DisplayName("qt_cld_rad produce el mismo operador que qt_rad con los mismos RT y Rq")
    void build_fullRadiation_shouldMatchMoistureTemperatureOperator() {
        RadiativeFeedback qt = RadiativeFeedback.builder()
                .rt11Lw(0.2).rt22Sw(-0.1).rq1Lw(0.05).rq2Sw(0.02)
                .build();
        RadiativeFeedback qtCloud = qt.toBuilder()
                .rw11Lw(0.7).rw21Sw(0.2).rw22Lw(-0.3)
                .build();
        ParameterSet qtRad = ParameterSet.builder()
                .variant(ExperimentVariant.MOISTURE_TEMPERATURE)
                .radScaling(1.0)
                .base(BaseCoefficients.kuang2008())
                .radiative(qt)
                .build();
        ParameterSet qtCldRad = ParameterSet.builder()
                .variant(ExperimentVariant.FULL)
                .radScaling(1.0)
                .base(BaseCoefficients.kuang2008())
                .radiative(qtCloud)
                .build();

        assertArrayEquals(builder.build(2.5, qtRad, OperatorMode.FULL).getData(),
                builder.build(2.5, qtCldRad, OperatorMode.FULL).getData(), 0.0);
    }

    @Test
    @DisplayName("El sistema reducido ignora la radiación")
    void build_oneWay_shouldIgnoreRadiation() {
        ParameterSet params = ParameterSet.builder()
                .variant(ExperimentVariant.FULL)
                .radScaling(1.0)
                .base(BaseCoefficients.kuang2008())
                .radiative(RadiativeFeedback.builder().rt11Lw(1.0).rw22Sw(1.0).build())
                .build();

        assertArrayEquals(builder.build(0.8, noRad, OperatorMode.ONE_WAY).getData(),
                builder.build(0.8, params, OperatorMode.ONE_WAY).getData(), 0.0);
    }

    @Test
    @DisplayName("Modo nulo y número de onda no finito son errores")
    void build_invalidInputs_shouldThrow() {
        assertThrows(UnsupportedModeException.class, () -> builder.build(1.0, noRad, null));
        assertThrows(IllegalArgumentException.class, () -> builder.build(Double.NaN, noRad, OperatorMode.FULL));
        assertThrows(IllegalArgumentException.class,
                () -> builder.build(Double.POSITIVE_INFINITY, noRad, OperatorMode.ONE_WAY));
    }
}
