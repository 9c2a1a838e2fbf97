package sequencer.exceptions;

import sequencer.engine.RunReport;

/**
 * A migrate or rollback run stopped at a failing migration.
 *
 * <p>The cause is the failure itself ({@link MigrationFailedException},
 * {@link DirtyWorkingTreeException}, ...). The attached {@link RunReport} tells
 * which migrations completed in this run, which one failed and which were
 * left pending. Migrations completed before the failure stay committed.
 */
public class RunHaltedException extends MigrateException {

    private final RunReport report;

    public RunHaltedException(RunReport report, MigrateException cause) {
        super(report.summary(), report.failedMigration(), cause.getStage(), cause);
        this.report = report;
    }

    public RunReport report() {
        return report;
    }
}
