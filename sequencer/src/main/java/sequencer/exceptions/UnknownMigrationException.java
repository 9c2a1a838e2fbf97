package sequencer.exceptions;

/**
 * A requested migration identity or version does not exist where it is needed.
 *
 * <p>Thrown for plan targets that match no discovered unit, rollback targets
 * that are not currently applied, and applied units that discovery no longer
 * produces but which must be reverted.
 */
public class UnknownMigrationException extends MigrateException {

    public UnknownMigrationException(String message, String migrationId) {
        super(message, migrationId, "plan", null);
    }
}
