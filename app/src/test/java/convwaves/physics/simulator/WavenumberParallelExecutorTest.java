package convwaves.physics.simulator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import static org.junit.jupiter.api.Assertions.*;

class WavenumberParallelExecutorTest {

    @Test
    @DisplayName("Los resultados se devuelven en el orden de las tareas")
    void invokeAll_shouldPreserveOrder() {
        try (WavenumberParallelExecutor executor = new WavenumberParallelExecutor(4)) {
            List<Callable<Integer>> tasks = new ArrayList<>();
            for (int j = 0; j < 50; j++) {
                final int index = j;
                tasks.add(() -> index * index);
            }

            List<Integer> results = executor.invokeAll(tasks);

            assertEquals(50, results.size());
            for (int j = 0; j < 50; j++) {
                assertEquals(j * j, results.get(j));
            }
        }
    }

    @Test
    @DisplayName("Un número de procesadores no positivo se ajusta a un hilo")
    void constructor_shouldClampThreadCount() {
        try (WavenumberParallelExecutor executor = new WavenumberParallelExecutor(0)) {
            List<Callable<String>> tasks = List.of(() -> "ok");

            assertEquals(1, executor.getThreadCount());
            assertEquals(List.of("ok"), executor.invokeAll(tasks));
        }
    }

    @Test
    @DisplayName("Las excepciones no comprobadas de una tarea llegan intactas al llamador")
    void invokeAll_runtimeFailure_shouldPropagateAsIs() {
        try (WavenumberParallelExecutor executor = new WavenumberParallelExecutor(2)) {
            List<Callable<String>> tasks = List.of(
                    () -> "ok",
                    () -> {
                        throw new ArithmeticException("división por cero");
                    });

            ArithmeticException ex = assertThrows(ArithmeticException.class, () -> executor.invokeAll(tasks));
            assertEquals("división por cero", ex.getMessage());
        }
    }

    @Test
    @DisplayName("Las excepciones comprobadas se envuelven en IllegalStateException con su causa")
    void invokeAll_checkedFailure_shouldWrap() {
        try (WavenumberParallelExecutor executor = new WavenumberParallelExecutor(2)) {
            List<Callable<String>> tasks = List.of(() -> {
                throw new IOException("sin datos");
            });

            IllegalStateException ex = assertThrows(IllegalStateException.class, () -> executor.invokeAll(tasks));
            assertInstanceOf(IOException.class, ex.getCause());
            assertTrue(ex.getMessage().contains("0"));
        }
    }
}
