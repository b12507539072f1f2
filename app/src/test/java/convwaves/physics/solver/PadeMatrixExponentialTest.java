package convwaves.physics.solver;

import convwaves.config.BaseCoefficients;
import convwaves.domain.operator.OperatorMode;
import convwaves.domain.params.ExperimentVariant;
import convwaves.domain.params.ParameterSet;
import convwaves.physics.impl.CoupledWaveOperatorBuilder;
import org.ejml.data.ZMatrixRMaj;
import org.ejml.dense.row.CommonOps_ZDRM;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PadeMatrixExponentialTest {

    private final PadeMatrixExponential exponential = new PadeMatrixExponential();

    private static void assertMatrixEquals(ZMatrixRMaj expected, ZMatrixRMaj actual, double tol) {
        assertEquals(expected.getNumRows(), actual.getNumRows());
        assertEquals(expected.getNumCols(), actual.getNumCols());
        for (int r = 0; r < expected.getNumRows(); r++) {
            for (int c = 0; c < expected.getNumCols(); c++) {
                assertEquals(expected.getReal(r, c), actual.getReal(r, c), tol, "Re(" + r + ", " + c + ")");
                assertEquals(expected.getImag(r, c), actual.getImag(r, c), tol, "Im(" + r + ", " + c + ")");
            }
        }
    }

    @Test
    @DisplayName("exp(0) es la identidad")
    void exp_zero_shouldBeIdentity() {
        ZMatrixRMaj result = exponential.exp(new ZMatrixRMaj(4, 4), 0.1);

        assertMatrixEquals(CommonOps_ZDRM.identity(4), result, 0.0);
    }

    @Test
    @DisplayName("La exponencial de una matriz diagonal compleja es la exponencial de cada entrada")
    void exp_diagonal_shouldExponentiateEntries() {
        ZMatrixRMaj diag = new ZMatrixRMaj(3, 3);
        diag.set(0, 0, -1.0, 0.0);
        diag.set(1, 1, 0.0, Math.PI);
        diag.set(2, 2, -40.0, 3.0);

        ZMatrixRMaj result = exponential.exp(diag, 1.0);

        assertEquals(Math.exp(-1.0), result.getReal(0, 0), 1e-14);
        assertEquals(-1.0, result.getReal(1, 1), 1e-13);
        assertEquals(0.0, result.getImag(1, 1), 1e-13);
        assertEquals(Math.exp(-40.0) * Math.cos(3.0), result.getReal(2, 2), 1e-22);
        assertEquals(Math.exp(-40.0) * Math.sin(3.0), result.getImag(2, 2), 1e-22);
        assertEquals(0.0, result.getReal(0, 1), 0.0);
    }

    @Test
    @DisplayName("Un generador antisimétrico produce una rotación")
    void exp_skewSymmetric_shouldRotate() {
        double theta = 0.7;
        ZMatrixRMaj generator = new ZMatrixRMaj(2, 2);
        generator.set(0, 1, -1.0, 0.0);
        generator.set(1, 0, 1.0, 0.0);

        ZMatrixRMaj result = exponential.exp(generator, theta);

        assertEquals(Math.cos(theta), result.getReal(0, 0), 1e-14);
        assertEquals(-Math.sin(theta), result.getReal(0, 1), 1e-14);
        assertEquals(Math.sin(theta), result.getReal(1, 0), 1e-14);
        assertEquals(Math.cos(theta), result.getReal(1, 1), 1e-14);
    }

    @Test
    @DisplayName("exp(tA)·exp(-tA) = I y exp(tA)^10 = exp(10tA) para el operador del modelo")
    void exp_modelOperator_shouldSatisfyGroupProperties() {
        ParameterSet params = ParameterSet.builder()
                .variant(ExperimentVariant.NO_RADIATION)
                .base(BaseCoefficients.kuang2008())
                .build();
        ZMatrixRMaj operator = new CoupledWaveOperatorBuilder().build(1.0, params, OperatorMode.ONE_WAY);

        ZMatrixRMaj forward = exponential.exp(operator, 0.1);
        ZMatrixRMaj backward = exponential.exp(operator, -0.1);
        ZMatrixRMaj product = new ZMatrixRMaj(4, 4);
        CommonOps_ZDRM.mult(forward, backward, product);
        assertMatrixEquals(CommonOps_ZDRM.identity(4), product, 1e-10);

        ZMatrixRMaj power = forward.copy();
        for (int i = 1; i < 10; i++) {
            ZMatrixRMaj next = new ZMatrixRMaj(4, 4);
            CommonOps_ZDRM.mult(power, forward, next);
            power = next;
        }
        assertMatrixEquals(exponential.exp(operator, 1.0), power, 1e-10);
    }

    @Test
    @DisplayName("Matrices no cuadradas o con valores no finitos son rechazadas")
    void exp_invalidInput_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> exponential.exp(new ZMatrixRMaj(2, 3), 1.0));

        ZMatrixRMaj nan = new ZMatrixRMaj(2, 2);
        nan.set(0, 0, Double.NaN, 0.0);
        assertThrows(IllegalStateException.class, () -> exponential.exp(nan, 1.0));
    }

    @Test
    @DisplayName("La norma 1 es la máxima suma de módulos por columnas")
    void norm1() {
        ZMatrixRMaj m = new ZMatrixRMaj(2, 2);
        m.set(0, 0, 3.0, 4.0);
        m.set(1, 0, 1.0, 0.0);
        m.set(0, 1, 0.0, -2.0);

        assertEquals(6.0, PadeMatrixExponential.norm1(m), 1e-15);
    }
}
