package sequencer.exceptions;

/**
 * Raised when the candidate set cannot form a valid dependency graph.
 *
 * <p>Validation is all-or-nothing: when this is thrown no schedule exists and
 * no migration has been executed.
 *
 * @see UnresolvedDependencyException
 * @see CyclicDependencyException
 */
public class GraphValidationException extends MigrateException {

    public GraphValidationException(String message) {
        super(message, null, "plan", null);
    }

    public GraphValidationException(String message, String migrationId) {
        super(message, migrationId, "plan", null);
    }
}
