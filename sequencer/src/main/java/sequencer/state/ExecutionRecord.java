package sequencer.state;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record of one migration state transition.
 *
 * <p>APPLIED and REVERTED records are appended to the {@link StateStore}
 * ledger and never removed. SKIPPED records are only returned from a run.
 * FAILED records are never persisted; they describe the failing unit in a
 * {@link sequencer.engine.RunReport}.
 *
 * @param migrationId identity of the migration
 * @param version ordering key of the migration at the time of the transition
 * @param status the transition
 * @param timestamp when the transition completed
 * @param commitRef version-control reference of the transition commit, null if none
 * @param message free-form result message, may be empty
 * @param metadata free-form result metadata, immutable
 */
public record ExecutionRecord(
        String migrationId,
        String version,
        Status status,
        Instant timestamp,
        String commitRef,
        String message,
        Map<String, String> metadata
) {

    public enum Status {
        /** Forward operation committed */
        APPLIED,
        /** Backward operation committed */
        REVERTED,
        /** Already applied or not needed; nothing ran */
        SKIPPED,
        /** Operation failed; the working tree was restored */
        FAILED
    }

    public ExecutionRecord {
        Objects.requireNonNull(migrationId, "migrationId");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(timestamp, "timestamp");
        message = message != null ? message : "";
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static ExecutionRecord applied(String migrationId, String version, String commitRef,
                                          String message, Map<String, String> metadata) {
        return new ExecutionRecord(migrationId, version, Status.APPLIED, Instant.now(), commitRef, message, metadata);
    }

    public static ExecutionRecord reverted(String migrationId, String version, String commitRef,
                                           String message, Map<String, String> metadata) {
        return new ExecutionRecord(migrationId, version, Status.REVERTED, Instant.now(), commitRef, message, metadata);
    }

    public static ExecutionRecord skipped(String migrationId, String version, String reason) {
        return new ExecutionRecord(migrationId, version, Status.SKIPPED, Instant.now(), null, reason, null);
    }

    public static ExecutionRecord failed(String migrationId, String version, String errorMessage) {
        return new ExecutionRecord(migrationId, version, Status.FAILED, Instant.now(), null, errorMessage, null);
    }
}
