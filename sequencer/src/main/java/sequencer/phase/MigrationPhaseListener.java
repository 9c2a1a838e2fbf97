package sequencer.phase;

import sequencer.MigrationContext;
import sequencer.exceptions.MigrateException;
import sequencer.state.ExecutionRecord;

/**
 * Listener that receives progress signals while a run executes its plan.
 *
 * <p>Note: these methods are <em>signals</em>, not commands. A listener cannot
 * veto or alter a run; an exception thrown from a callback is logged and the
 * run continues.
 *
 * <h2>Usage:</h2>
 * <pre>
 * MigrationManager manager = MigrationManager.builder()
 *         .workingRoot(root)
 *         .phaseListener(new MigrationPhaseListener() {
 *             public void onAfterMigration(MigrationContext ctx, ExecutionRecord record) {
 *                 progress.step(record.migrationId());
 *             }
 *         })
 *         .build();
 * </pre>
 */
public interface MigrationPhaseListener {

    /**
     * Called before a migration's transaction begins.
     *
     * @param ctx context of the migration about to run
     * @throws MigrateException if the listener cannot process the signal
     */
    default void onBeforeMigration(MigrationContext ctx) throws MigrateException {}

    /**
     * Called after a migration was applied, reverted or skipped.
     *
     * @param ctx context of the migration that ran
     * @param record the outcome
     * @throws MigrateException if the listener cannot process the signal
     */
    default void onAfterMigration(MigrationContext ctx, ExecutionRecord record) throws MigrateException {}

    /**
     * Called when a migration failed and the run is about to halt.
     *
     * @param ctx context of the migration that failed
     * @param error the failure
     * @throws MigrateException if the listener cannot process the signal
     */
    default void onMigrationFailed(MigrationContext ctx, MigrateException error) throws MigrateException {}
}
