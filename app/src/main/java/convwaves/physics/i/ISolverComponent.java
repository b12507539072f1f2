package convwaves.physics.i;

/**
 * Contrato base para cualquier componente numérico del sistema.
 * Permite tratar a todos los solvers de forma polimórfica para tareas
 * de logging, identificación y depuración.
 */
public interface ISolverComponent {
    /**
     * Nombre corto del algoritmo (ej: "Padé-13", "Hessenberg-QR").
     */
    String getName();

    /**
     * Descripción técnica detallada.
     */
    default String getDescription() {
        return "Sin descripción disponible.";
    }
}
