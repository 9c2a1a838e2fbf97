package sequencer;

import sequencer.annotations.MigrationUnit;
import sequencer.exceptions.MigrateException;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A single, identified, reversible transformation of a codebase.
 *
 * <p>Identity, ordering key and dependencies default to the values of the
 * {@link MigrationUnit} annotation on the implementing class; override them to
 * supply the values programmatically. Once a unit has been discovered its
 * identity and dependencies are captured by a {@link sequencer.plan.MigrationDescriptor}
 * and never re-read during that run.
 *
 * <h2>Example:</h2>
 * <pre>
 * {@literal @}MigrationUnit(id = "add-gitignore", version = "0.1.1", dependsOn = "add-src-layout")
 * public class AddGitignore implements Migration {
 *     public boolean isNeeded(MigrationContext ctx) {
 *         return !Files.exists(ctx.resolve(".gitignore"));
 *     }
 *     public MigrationResult apply(MigrationContext ctx) throws IOException {
 *         Files.writeString(ctx.resolve(".gitignore"), "build/\n");
 *         return MigrationResult.ok("created .gitignore");
 *     }
 *     public MigrationResult revert(MigrationContext ctx) throws IOException {
 *         Files.deleteIfExists(ctx.resolve(".gitignore"));
 *         return MigrationResult.ok();
 *     }
 * }
 * </pre>
 *
 * <h2>Side effects:</h2>
 * <p>{@link #apply} and {@link #revert} may only touch files under
 * {@link MigrationContext#workingRoot()} and must not mutate process-wide state.
 * They run inside a {@link sequencer.commit.MigrationTransaction}, which commits
 * their changes on success and discards them on failure, so they need not clean
 * up after themselves when they throw.
 *
 * @see MigrationUnit
 * @see sequencer.engine.MigrationManager
 */
public interface Migration {

    /**
     * Stable, unique identity of this migration.
     *
     * @return the {@link MigrationUnit#id()} when present and not blank, otherwise the simple class name
     */
    default String id() {
        MigrationUnit unit = getClass().getAnnotation(MigrationUnit.class);
        if (unit != null && !unit.id().isBlank()) {
            return unit.id().strip();
        }
        return getClass().getSimpleName();
    }

    /**
     * Ordering key, used as the first tie-break between independent migrations
     * and addressable as a target version.
     */
    default String version() {
        MigrationUnit unit = getClass().getAnnotation(MigrationUnit.class);
        return unit != null ? unit.version() : "0";
    }

    /** Identities of the migrations that must be applied before this one. */
    default Set<String> dependencies() {
        MigrationUnit unit = getClass().getAnnotation(MigrationUnit.class);
        return unit != null ? new LinkedHashSet<>(List.of(unit.dependsOn())) : Set.of();
    }

    default String description() {
        MigrationUnit unit = getClass().getAnnotation(MigrationUnit.class);
        return unit != null ? unit.description() : "";
    }

    /**
     * Applicability check against the current state of the codebase.
     *
     * <p>Must be free of side effects; it may be called any number of times,
     * including by dry runs. A migration that is not needed is recorded as
     * skipped and its {@link #apply} is not invoked.
     *
     * @param ctx the execution context
     * @return true if {@link #apply} should run
     * @throws IOException if the codebase cannot be inspected
     */
    default boolean isNeeded(MigrationContext ctx) throws IOException {
        return true;
    }

    /**
     * Forward operation.
     *
     * @param ctx the execution context
     * @return the outcome; a non-success result is treated like a thrown error
     * @throws IOException if the codebase cannot be modified
     * @throws MigrateException if the migration cannot proceed
     */
    MigrationResult apply(MigrationContext ctx) throws IOException, MigrateException;

    /**
     * Backward operation, restoring the codebase to its state before {@link #apply}.
     *
     * <p>{@link MigrationContext#forwardCommit()} holds the commit that recorded
     * the forward operation, for units that need the original diff.
     *
     * @param ctx the execution context
     * @return the outcome; a non-success result is treated like a thrown error
     * @throws IOException if the codebase cannot be modified
     * @throws MigrateException if the migration cannot be reverted
     */
    MigrationResult revert(MigrationContext ctx) throws IOException, MigrateException;
}
