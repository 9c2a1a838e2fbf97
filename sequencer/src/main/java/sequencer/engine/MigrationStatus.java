package sequencer.engine;

import sequencer.registry.DiscoveryError;
import sequencer.state.ExecutionRecord;

import java.util.List;
import java.util.Optional;

/**
 * Snapshot of a working root's migration state.
 *
 * @param applied APPLIED record of each applied migration, oldest first
 * @param pending discovered migrations not yet applied, in execution order
 *                (identity order when the dependency graph is invalid)
 * @param orphaned applied migrations that are no longer discovered
 * @param discoveryErrors migrations that failed to load
 * @param validationError why the dependency graph is invalid, null if it is valid
 */
public record MigrationStatus(
        List<ExecutionRecord> applied,
        List<String> pending,
        List<String> orphaned,
        List<DiscoveryError> discoveryErrors,
        String validationError
) {

    public MigrationStatus {
        applied = List.copyOf(applied);
        pending = List.copyOf(pending);
        orphaned = List.copyOf(orphaned);
        discoveryErrors = List.copyOf(discoveryErrors);
    }

    public boolean isValid() {
        return validationError == null;
    }

    public Optional<String> validation() {
        return Optional.ofNullable(validationError);
    }

    public boolean isUpToDate() {
        return pending.isEmpty() && isValid();
    }
}
