package sequencer.engine;

import sequencer.exceptions.ConcurrentRunDetectedException;
import sequencer.exceptions.DiscoveryException;
import sequencer.exceptions.GraphValidationException;
import sequencer.exceptions.UnknownMigrationException;

/**
 * Result codes reported to command-line and UI front ends.
 */
public enum ExitStatus {
    /** Everything requested was done */
    SUCCESS(0),
    /** A migration failed; earlier migrations of the run stay committed */
    PARTIAL_FAILURE(1),
    /** Invalid candidate set or target; nothing was executed */
    VALIDATION_FAILURE(2),
    /** Another run holds the working root */
    CONCURRENCY_CONFLICT(3);

    private final int code;

    ExitStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Maps the outcome of a manager call.
     *
     * @param error what the call threw, or null if it returned normally
     */
    public static ExitStatus forException(Throwable error) {
        if (error == null) {
            return SUCCESS;
        }
        if (error instanceof ConcurrentRunDetectedException) {
            return CONCURRENCY_CONFLICT;
        }
        if (error instanceof GraphValidationException
                || error instanceof UnknownMigrationException
                || error instanceof DiscoveryException) {
            return VALIDATION_FAILURE;
        }
        return PARTIAL_FAILURE;
    }
}
