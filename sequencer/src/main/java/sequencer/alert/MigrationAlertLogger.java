package sequencer.alert;

import sequencer.Direction;
import sequencer.config.AlertLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Structured logging for migration run events.
 *
 * <p>Entries use markers like RUN_STARTED, MIGRATION_APPLIED and RUN_HALTED
 * followed by key=value pairs, so log aggregators can parse and alert on them.
 * Each {@link sequencer.engine.MigrationManager} owns its own instance.
 *
 * <h2>Alert Level Configuration:</h2>
 * <ul>
 *   <li>DEBUG: logs all events (debug, info, warn, error)</li>
 *   <li>WARNING: logs warnings and errors only</li>
 *   <li>ERROR: logs errors only</li>
 * </ul>
 *
 * <h2>Example Output:</h2>
 * <pre>
 * 12:00:00.000 INFO  migration - RUN_STARTED id=1 direction=APPLY pending=3 target=-
 * 12:00:00.100 INFO  migration - MIGRATION_APPLIED id=1 migration=A commit=3f2a9c1 duration_ms=40
 * 12:00:00.200 ERROR migration - MIGRATION_FAILED id=1 migration=B direction=APPLY error="boom"
 * 12:00:00.210 ERROR migration - RUN_HALTED id=1 completed=1 failed=B pending=1
 * </pre>
 */
public final class MigrationAlertLogger {

    private final Logger log;
    private volatile AlertLevel alertLevel;

    public MigrationAlertLogger(AlertLevel level) {
        this(LoggerFactory.getLogger("migration"), level);
    }

    public MigrationAlertLogger(Logger log, AlertLevel level) {
        this.log = Objects.requireNonNull(log, "log");
        setAlertLevel(level);
    }

    public void setAlertLevel(AlertLevel level) {
        this.alertLevel = level != null ? level : AlertLevel.WARNING;
    }

    public AlertLevel getAlertLevel() {
        return alertLevel;
    }

    private boolean shouldLogInfo() {
        return alertLevel == AlertLevel.DEBUG;
    }

    private boolean shouldLogWarn() {
        return alertLevel == AlertLevel.DEBUG || alertLevel == AlertLevel.WARNING;
    }

    public void runStarted(long runId, Direction direction, int pending, String target) {
        if (shouldLogInfo()) {
            log.info("RUN_STARTED id={} direction={} pending={} target={}",
                    runId, direction, pending, target != null ? target : "-");
        }
    }

    public void migrationApplied(long runId, String migrationId, String commitRef, long durationMs) {
        if (shouldLogInfo()) {
            log.info("MIGRATION_APPLIED id={} migration={} commit={} duration_ms={}",
                    runId, migrationId, abbreviate(commitRef), durationMs);
        }
    }

    public void migrationReverted(long runId, String migrationId, String commitRef, long durationMs) {
        if (shouldLogInfo()) {
            log.info("MIGRATION_REVERTED id={} migration={} commit={} duration_ms={}",
                    runId, migrationId, abbreviate(commitRef), durationMs);
        }
    }

    public void migrationSkipped(long runId, String migrationId, String reason) {
        if (shouldLogInfo()) {
            log.info("MIGRATION_SKIPPED id={} migration={} reason=\"{}\"", runId, migrationId, reason);
        }
    }

    /**
     * Log when a single migration fails. Always logged.
     */
    public void migrationFailed(long runId, String migrationId, Direction direction, Throwable error) {
        String errorMsg = error != null ? error.getMessage() : "Unknown error";
        log.error("MIGRATION_FAILED id={} migration={} direction={} error=\"{}\"",
                runId, migrationId, direction, errorMsg);
    }

    public void runCompleted(long runId, Direction direction, int completed, long durationMs) {
        if (shouldLogInfo()) {
            log.info("RUN_COMPLETED id={} direction={} completed={} duration_ms={}",
                    runId, direction, completed, durationMs);
        }
    }

    /**
     * Log when a run stops before its plan is exhausted. Always logged.
     */
    public void runHalted(long runId, int completed, String failedMigration, int pending) {
        log.error("RUN_HALTED id={} completed={} failed={} pending={}",
                runId, completed, failedMigration != null ? failedMigration : "-", pending);
    }

    /**
     * Log when the working tree was reset to a known-good commit.
     *
     * @param success whether the reset itself succeeded
     */
    public void workingTreeRestored(long runId, String migrationId, String ref, boolean success) {
        if (success) {
            if (shouldLogWarn()) {
                log.warn("WORKING_TREE_RESTORED id={} migration={} commit={} status=SUCCESS",
                        runId, migrationId, abbreviate(ref));
            }
        } else {
            // Always log errors
            log.error("WORKING_TREE_RESTORED id={} migration={} commit={} status=FAILED",
                    runId, migrationId, abbreviate(ref));
        }
    }

    public void lockConflict(String lockFile, String holder) {
        if (shouldLogWarn()) {
            log.warn("LOCK_CONFLICT lock={} holder=\"{}\"", lockFile, holder);
        }
    }

    private static String abbreviate(String ref) {
        if (ref == null) return "-";
        return ref.length() > 12 ? ref.substring(0, 12) : ref;
    }
}
