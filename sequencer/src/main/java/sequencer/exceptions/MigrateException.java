package sequencer.exceptions;

/**
 * Base of every checked failure raised by the migration engine.
 *
 * <p>Besides the message and cause, an exception may carry diagnostic context:
 * <ul>
 *   <li>the identity of the migration involved</li>
 *   <li>the engine stage where the failure occurred (discovery, plan, apply, revert, record, ...)</li>
 * </ul>
 * Both are appended to {@link #getMessage()} so log lines stay self-describing.
 *
 * @see sequencer.engine.MigrationManager
 * @see sequencer.engine.ExitStatus
 */
public class MigrateException extends Exception {

    private final String migrationId;
    private final String stage;

    // ---------------- constructors ----------------

    /**
     * Creates a new migration exception with a message.
     *
     * @param message the error message
     */
    public MigrateException(String message) {
        this(message, null, null, null);
    }

    /**
     * Creates a new migration exception with a message and cause.
     *
     * @param message the error message
     * @param cause the underlying cause
     */
    public MigrateException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    /**
     * Creates a new migration exception with diagnostic context.
     *
     * @param message the error message
     * @param migrationId identity of the migration involved, may be null
     * @param stage engine stage where the failure occurred, may be null
     * @param cause the underlying cause, may be null
     */
    public MigrateException(String message, String migrationId, String stage, Throwable cause) {
        super(message, cause);
        this.migrationId = migrationId;
        this.stage = stage;
    }

    // ---------------- getters ----------------

    /**
     * Returns the identity of the migration involved in the failure.
     *
     * @return the migration id, or null if not set
     */
    public String getMigrationId() {
        return migrationId;
    }

    /**
     * Returns the engine stage where the failure occurred.
     *
     * @return the stage name, or null if not set
     */
    public String getStage() {
        return stage;
    }

    /** The message as given to the constructor, without diagnostic context. */
    public String getBaseMessage() {
        return super.getMessage();
    }

    // ---------------- diagnostics ----------------

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(String.valueOf(super.getMessage()));

        if (stage != null) sb.append(" [stage=").append(stage).append("]");
        if (migrationId != null) sb.append(" [migration=").append(migrationId).append("]");

        return sb.toString();
    }
}
