package sequencer.exceptions;

import sequencer.Direction;

/**
 * A migration's forward or backward operation raised an error or reported failure.
 *
 * <p>When this is thrown by the transaction wrapper the working tree has already
 * been reset to the commit it had before the operation started.
 */
public class MigrationFailedException extends MigrateException {

    private final Direction direction;

    public MigrationFailedException(String migrationId, Direction direction, String reason, Throwable cause) {
        super(direction.verb() + " of '" + migrationId + "' failed: " + reason,
                migrationId, direction.stage(), cause);
        this.direction = direction;
    }

    public Direction direction() {
        return direction;
    }
}
