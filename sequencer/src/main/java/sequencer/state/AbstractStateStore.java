package sequencer.state;

import sequencer.exceptions.StateStoreException;
import sequencer.state.ExecutionRecord.Status;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Ledger bookkeeping shared by the state stores.
 *
 * <p>Keeps the history in memory, guarded by a read/write lock, and maintains
 * the applied view by replaying each appended record. Subclasses decide how an
 * updated history is persisted.
 */
abstract class AbstractStateStore implements StateStore {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<ExecutionRecord> history = new ArrayList<>();
    private final LinkedHashMap<String, ExecutionRecord> applied = new LinkedHashMap<>();

    /**
     * Persists the full history after a record was appended.
     *
     * @param history the complete ledger, oldest first
     * @throws StateStoreException if the ledger cannot be written
     */
    protected abstract void persist(List<ExecutionRecord> history) throws StateStoreException;

    /**
     * Reads the persisted history.
     *
     * @return the ledger, oldest first, or null when nothing is shared beyond this instance
     * @throws StateStoreException if the ledger cannot be read
     */
    protected List<ExecutionRecord> reload() throws StateStoreException {
        return null;
    }

    @Override
    public void refresh() throws StateStoreException {
        lock.writeLock().lock();
        try {
            List<ExecutionRecord> persisted = reload();
            if (persisted != null) {
                restore(persisted);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Replaces the in-memory ledger, e.g. with records read from disk. */
    protected void restore(List<ExecutionRecord> records) {
        lock.writeLock().lock();
        try {
            history.clear();
            applied.clear();
            for (ExecutionRecord r : records) {
                history.add(r);
                replay(r);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void replay(ExecutionRecord r) {
        if (r.status() == Status.APPLIED) {
            applied.remove(r.migrationId());
            applied.put(r.migrationId(), r);
        } else if (r.status() == Status.REVERTED) {
            applied.remove(r.migrationId());
        }
    }

    @Override
    public ExecutionRecord recordApplied(String migrationId, String version, String commitRef,
                                         String message, Map<String, String> metadata) throws StateStoreException {
        lock.writeLock().lock();
        try {
            refresh();
            if (applied.containsKey(migrationId)) {
                throw new IllegalStateException("Migration already applied: " + migrationId);
            }
            return append(ExecutionRecord.applied(migrationId, version, commitRef, message, metadata));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public ExecutionRecord recordReverted(String migrationId, String version, String commitRef,
                                          String message, Map<String, String> metadata) throws StateStoreException {
        lock.writeLock().lock();
        try {
            refresh();
            if (!applied.containsKey(migrationId)) {
                throw new IllegalStateException("Migration not applied: " + migrationId);
            }
            return append(ExecutionRecord.reverted(migrationId, version, commitRef, message, metadata));
        } finally {
            lock.writeLock().unlock();
        }
    }

    // caller holds the write lock
    private ExecutionRecord append(ExecutionRecord record) throws StateStoreException {
        List<ExecutionRecord> updated = new ArrayList<>(history);
        updated.add(record);
        persist(Collections.unmodifiableList(updated));
        history.add(record);
        replay(record);
        return record;
    }

    @Override
    public boolean isApplied(String migrationId) {
        lock.readLock().lock();
        try {
            return applied.containsKey(migrationId);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<String> appliedInOrder() {
        lock.readLock().lock();
        try {
            return List.copyOf(applied.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<ExecutionRecord> appliedRecords() {
        lock.readLock().lock();
        try {
            return List.copyOf(applied.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<ExecutionRecord> lastApplied(String migrationId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(applied.get(migrationId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<ExecutionRecord> history() {
        lock.readLock().lock();
        try {
            return List.copyOf(history);
        } finally {
            lock.readLock().unlock();
        }
    }
}
