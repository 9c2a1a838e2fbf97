package sequencer.state;

import sequencer.exceptions.StateStoreException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable ledger of applied and reverted migrations.
 *
 * <p>The ledger is append-only: reverting a migration appends a REVERTED
 * record rather than deleting the APPLIED one, so the full history can be
 * reconstructed. Whether a migration is currently applied, and the order in
 * which applied migrations were applied, are derived by replaying the ledger.
 *
 * <p>Implementations must tolerate concurrent readers. Writes come from a
 * single run at a time, serialized by {@link sequencer.lock.RunLock}. A store
 * backed by shared storage picks up records written by other runs through
 * {@link #refresh()}, and before every append.
 *
 * @see FileStateStore
 * @see InMemoryStateStore
 */
public interface StateStore {

    /**
     * Re-reads the persisted ledger, replacing the in-memory view. A no-op for
     * stores that are not shared.
     *
     * @throws StateStoreException if the ledger cannot be read
     */
    default void refresh() throws StateStoreException {
    }

    /**
     * Appends an APPLIED record.
     *
     * @return the appended record
     * @throws IllegalStateException if the migration is already applied
     * @throws StateStoreException if the record cannot be persisted
     */
    ExecutionRecord recordApplied(String migrationId, String version, String commitRef,
                                  String message, Map<String, String> metadata) throws StateStoreException;

    /**
     * Appends a REVERTED record.
     *
     * @return the appended record
     * @throws IllegalStateException if the migration is not applied
     * @throws StateStoreException if the record cannot be persisted
     */
    ExecutionRecord recordReverted(String migrationId, String version, String commitRef,
                                   String message, Map<String, String> metadata) throws StateStoreException;

    default ExecutionRecord recordApplied(String migrationId, String commitRef) throws StateStoreException {
        return recordApplied(migrationId, null, commitRef, null, null);
    }

    default ExecutionRecord recordReverted(String migrationId, String commitRef) throws StateStoreException {
        return recordReverted(migrationId, null, commitRef, null, null);
    }

    boolean isApplied(String migrationId);

    /** Identities of currently applied migrations, oldest application first. */
    List<String> appliedInOrder();

    /** The APPLIED record of each currently applied migration, oldest first. */
    List<ExecutionRecord> appliedRecords();

    /** The APPLIED record of a currently applied migration. */
    Optional<ExecutionRecord> lastApplied(String migrationId);

    /** Every persisted transition, oldest first. */
    List<ExecutionRecord> history();
}
