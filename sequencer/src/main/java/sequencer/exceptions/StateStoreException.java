package sequencer.exceptions;

/**
 * The state ledger could not be read or written.
 */
public class StateStoreException extends MigrateException {

    public StateStoreException(String message, Throwable cause) {
        super(message, null, "state", cause);
    }
}
