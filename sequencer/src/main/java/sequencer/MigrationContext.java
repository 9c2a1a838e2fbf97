package sequencer;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Execution context handed to a migration's operations.
 *
 * <p>Provides information about the current execution:
 * <ul>
 *   <li>the working root the migration may modify</li>
 *   <li>the migration being executed and in which direction</li>
 *   <li>the run identifier for logging/tracking</li>
 *   <li>for reverts, the commit that recorded the forward operation</li>
 * </ul>
 */
public final class MigrationContext {

    private final Path workingRoot;
    private final String migrationId;
    private final Direction direction;
    private final long runId;
    private final String forwardCommit;

    public MigrationContext(Path workingRoot, String migrationId, Direction direction, long runId, String forwardCommit) {
        this.workingRoot = Objects.requireNonNull(workingRoot, "workingRoot").toAbsolutePath().normalize();
        this.migrationId = Objects.requireNonNull(migrationId, "migrationId");
        this.direction = Objects.requireNonNull(direction, "direction");
        this.runId = runId;
        this.forwardCommit = forwardCommit;
    }

    /** Root of the codebase being migrated. */
    public Path workingRoot() {
        return workingRoot;
    }

    /**
     * Resolves a path relative to the working root.
     *
     * @param relative a relative path such as {@code src/main/App.java}
     * @return the absolute path
     * @throws IllegalArgumentException if the path escapes the working root
     */
    public Path resolve(String relative) {
        Path resolved = workingRoot.resolve(relative).normalize();
        if (!resolved.startsWith(workingRoot)) {
            throw new IllegalArgumentException("Path escapes working root: " + relative);
        }
        return resolved;
    }

    public String migrationId() {
        return migrationId;
    }

    public Direction direction() {
        return direction;
    }

    /** Identifier of the migrate/rollback run this execution belongs to. */
    public long runId() {
        return runId;
    }

    /**
     * The commit recorded when this migration was applied. Only present while reverting.
     */
    public Optional<String> forwardCommit() {
        return Optional.ofNullable(forwardCommit);
    }
}
