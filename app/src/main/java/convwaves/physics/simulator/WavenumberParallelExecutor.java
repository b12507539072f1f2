package convwaves.physics.simulator;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Pool de hilos fijo que reparte el eje de números de onda.
 * <p>
 * Contrato de propiedad disjunta: la tarea asignada al índice {@code j} solo escribe la
 * columna {@code j} de cada array de salida. Por eso no se usan cerrojos. La visibilidad
 * de las escrituras queda garantizada por {@link Future#get()}.
 */
@Slf4j
public class WavenumberParallelExecutor implements AutoCloseable {

    private final ExecutorService threadPool;
    @Getter
    private final int threadCount;

    public WavenumberParallelExecutor(int processorCount) {
        this.threadCount = Math.max(processorCount, 1);
        this.threadPool = Executors.newFixedThreadPool(threadCount);
        log.info("WavenumberParallelExecutor inicializado con {} hilos.", threadCount);
    }

    /**
     * Ejecuta todas las tareas y espera a que terminen.
     *
     * @return Los resultados en el mismo orden que las tareas.
     * @throws IllegalStateException si el hilo es interrumpido o alguna tarea falla
     *                               (error fatal, no hay resultados parciales).
     */
    public <T> List<T> invokeAll(List<? extends Callable<T>> tasks) {
        List<Future<T>> futures;
        try {
            futures = threadPool.invokeAll(tasks);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Cálculo por números de onda interrumpido.", e);
        }

        List<T> results = new ArrayList<>(futures.size());
        for (int j = 0; j < futures.size(); j++) {
            try {
                results.add(futures.get(j).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Cálculo por números de onda interrumpido.", e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new IllegalStateException("Error en el cálculo del número de onda " + j, cause);
            }
        }
        return results;
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        log.info("WavenumberParallelExecutor cerrado.");
    }
}
