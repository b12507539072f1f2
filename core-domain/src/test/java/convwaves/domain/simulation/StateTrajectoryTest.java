package convwaves.domain.simulation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StateTrajectoryTest {

    @Test
    @DisplayName("Un buffer recién reservado está a cero y conserva su forma")
    void allocate_shouldBeZeroFilled() {
        StateTrajectory trajectory = StateTrajectory.allocate(3, 6, 4);

        assertEquals(3, trajectory.getTimeCount());
        assertEquals(6, trajectory.getVariableCount());
        assertEquals(4, trajectory.getWavenumberCount());
        assertEquals(0.0, trajectory.getReal(2, 5, 3));
        assertEquals(0.0, trajectory.getImag(0, 0, 0));
    }

    @Test
    @DisplayName("Las escrituras en una entrada no afectan a las vecinas")
    void set_shouldAddressSingleEntry() {
        StateTrajectory trajectory = StateTrajectory.allocate(2, 3, 2);

        trajectory.set(1, 2, 0, 3.0, 4.0);

        assertEquals(3.0, trajectory.getReal(1, 2, 0));
        assertEquals(4.0, trajectory.getImag(1, 2, 0));
        assertEquals(5.0, trajectory.getMagnitude(1, 2, 0), 1e-12);
        assertEquals(0.0, trajectory.getReal(1, 2, 1));
        assertEquals(0.0, trajectory.getReal(0, 2, 0));

        double[][][] real = trajectory.toRealCube();
        assertEquals(3.0, real[1][2][0]);
        assertEquals(4.0, trajectory.toImagCube()[1][2][0]);
    }

    @Test
    @DisplayName("Cada número de onda ocupa un bloque contiguo de Nt·Nv elementos")
    void index_shouldKeepWavenumberColumnsContiguous() {
        int nt = 4;
        int nv = 6;
        int nk = 3;
        StateTrajectory trajectory = StateTrajectory.allocate(nt, nv, nk);

        for (int j = 0; j < nk; j++) {
            int first = j * nt * nv;
            int expected = first;
            for (int n = 0; n < nt; n++) {
                for (int v = 0; v < nv; v++) {
                    assertEquals(expected++, trajectory.index(n, v, j));
                }
            }
            assertEquals(first + nt * nv, expected);
        }
    }

    @Test
    @DisplayName("La exportación a cubo respeta el orden (n, v, j) de los accesores")
    void toCube_shouldMatchAccessors() {
        StateTrajectory trajectory = StateTrajectory.allocate(3, 4, 5);
        for (int n = 0; n < 3; n++) {
            for (int v = 0; v < 4; v++) {
                for (int j = 0; j < 5; j++) {
                    trajectory.set(n, v, j, 100 * n + 10 * v + j, -(100 * n + 10 * v + j));
                }
            }
        }

        double[][][] real = trajectory.toRealCube();
        double[][][] imag = trajectory.toImagCube();

        for (int n = 0; n < 3; n++) {
            for (int v = 0; v < 4; v++) {
                for (int j = 0; j < 5; j++) {
                    assertEquals(100 * n + 10 * v + j, real[n][v][j]);
                    assertEquals(-(100 * n + 10 * v + j), imag[n][v][j]);
                    assertEquals(real[n][v][j], trajectory.getReal(n, v, j));
                }
            }
        }
    }

    @Test
    @DisplayName("Dimensiones no positivas son inválidas")
    void allocate_invalidShape_shouldThrow() {
        assertThrows(IllegalArgumentException.class, () -> StateTrajectory.allocate(0, 6, 4));
        assertThrows(IllegalArgumentException.class, () -> StateTrajectory.allocate(3, -1, 4));
    }
}
