package sequencer;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a migration's forward or backward operation.
 *
 * <p>Metadata entries are free-form and are persisted with the execution record.
 *
 * @param success whether the operation completed
 * @param message short human-readable summary, may be empty
 * @param metadata free-form result metadata, never null
 */
public record MigrationResult(boolean success, String message, Map<String, String> metadata) {

    public MigrationResult {
        message = message != null ? message : "";
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static MigrationResult ok() {
        return new MigrationResult(true, "", Map.of());
    }

    public static MigrationResult ok(String message) {
        return new MigrationResult(true, message, Map.of());
    }

    public static MigrationResult failed(String message) {
        return new MigrationResult(false, message, Map.of());
    }

    /**
     * Returns a copy of this result with one more metadata entry.
     */
    public MigrationResult withMetadata(String key, String value) {
        Map<String, String> copy = new LinkedHashMap<>(metadata);
        copy.put(key, value);
        return new MigrationResult(success, message, copy);
    }
}
