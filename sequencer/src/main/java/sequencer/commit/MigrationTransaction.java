package sequencer.commit;

import sequencer.Direction;
import sequencer.MigrationContext;
import sequencer.MigrationResult;
import sequencer.alert.MigrationAlertLogger;
import sequencer.exceptions.DirtyWorkingTreeException;
import sequencer.exceptions.MigrateException;
import sequencer.exceptions.MigrationFailedException;
import sequencer.exceptions.VersionControlException;
import sequencer.vcs.VersionControl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Makes one migration operation atomic with respect to the working tree.
 *
 * <p>For every operation the transaction:
 * <ol>
 *   <li>Refuses to start if the working tree has uncommitted changes</li>
 *   <li>Remembers the current head as the restore point</li>
 *   <li>Runs the operation</li>
 *   <li>On success, commits exactly the paths the operation touched (and tags the commit if configured)</li>
 *   <li>On failure, hard-resets to the restore point and raises {@link MigrationFailedException}</li>
 * </ol>
 *
 * <p>After a failure the working tree is identical to its state before the
 * operation began, provided the reset itself succeeded; a failed reset is
 * attached to the raised exception as a suppressed error.
 *
 * @see VersionControl
 */
public class MigrationTransaction {

    private static final Logger log = LoggerFactory.getLogger(MigrationTransaction.class);

    /**
     * A migration operation run inside the transaction.
     */
    @FunctionalInterface
    public interface Operation {
        MigrationResult run() throws IOException, MigrateException;
    }

    private final VersionControl vcs;
    private final MigrationAlertLogger alerts;
    private final String messagePrefix;
    private final String tagPrefix;

    /**
     * @param vcs the version-control capability
     * @param alerts structured event log
     * @param messagePrefix prepended to every commit message
     * @param tagPrefix prefix of per-migration tags, or null to not tag commits
     */
    public MigrationTransaction(VersionControl vcs, MigrationAlertLogger alerts, String messagePrefix, String tagPrefix) {
        this.vcs = Objects.requireNonNull(vcs, "vcs");
        this.alerts = Objects.requireNonNull(alerts, "alerts");
        this.messagePrefix = messagePrefix != null ? messagePrefix : "";
        this.tagPrefix = tagPrefix;
    }

    /**
     * Runs an operation inside a commit/reset boundary.
     *
     * @param ctx context of the migration being executed
     * @param operation the forward or backward operation
     * @return the commit recording the operation
     * @throws DirtyWorkingTreeException if the working tree was not clean beforehand
     * @throws MigrationFailedException if the operation or its commit failed; the tree has been reset
     * @throws VersionControlException if the pre-flight check could not be performed
     */
    public CommitResult execute(MigrationContext ctx, Operation operation) throws MigrateException {
        String id = ctx.migrationId();
        Direction direction = ctx.direction();

        List<String> dirty = vcs.changedPaths();
        if (!dirty.isEmpty()) {
            throw new DirtyWorkingTreeException(id, direction.stage(), dirty);
        }
        String base = vcs.head();
        log.debug("{} of '{}' starting at {}", direction.verb(), id, base);

        MigrationResult result;
        try {
            result = operation.run();
        } catch (Throwable e) {
            // errors thrown by the unit reset the tree too
            throw restoreAndFail(ctx, base, describe(e), e);
        }
        if (result == null) {
            throw restoreAndFail(ctx, base, "operation returned no result", null);
        }
        if (!result.success()) {
            String reason = result.message().isEmpty() ? "operation reported failure" : result.message();
            throw restoreAndFail(ctx, base, reason, null);
        }

        List<String> touched;
        String ref;
        try {
            touched = vcs.changedPaths();
            ref = vcs.commit(touched, commitMessage(id, direction, result));
        } catch (VersionControlException e) {
            throw restoreAndFail(ctx, base, "commit failed: " + e.getBaseMessage(), e);
        }

        if (tagPrefix != null) {
            String tag = tagName(id, direction);
            try {
                vcs.tag(ref, tag);
            } catch (VersionControlException e) {
                log.warn("Failed to tag {} as '{}' (commit kept)", ref, tag, e);
            }
        }

        log.debug("{} of '{}' committed {} path(s) as {}", direction.verb(), id, touched.size(), ref);
        return new CommitResult(ref, base, touched, result);
    }

    /**
     * Resets the working tree to a known-good commit.
     *
     * @return true if the reset succeeded
     */
    public boolean restore(MigrationContext ctx, String ref, Throwable failure) {
        try {
            vcs.reset(ref);
            alerts.workingTreeRestored(ctx.runId(), ctx.migrationId(), ref, true);
            return true;
        } catch (VersionControlException e) {
            alerts.workingTreeRestored(ctx.runId(), ctx.migrationId(), ref, false);
            if (failure != null) {
                failure.addSuppressed(e);
            } else {
                log.error("Failed to reset working tree to {}", ref, e);
            }
            return false;
        }
    }

    private MigrationFailedException restoreAndFail(MigrationContext ctx, String base, String reason, Throwable cause) {
        MigrationFailedException failure = new MigrationFailedException(ctx.migrationId(), ctx.direction(), reason, cause);
        restore(ctx, base, failure);
        return failure;
    }

    String commitMessage(String id, Direction direction, MigrationResult result) {
        StringBuilder sb = new StringBuilder();
        if (!messagePrefix.isEmpty()) {
            sb.append(messagePrefix).append(' ');
        }
        sb.append(direction.verb()).append(' ').append(id);
        if (!result.message().isEmpty()) {
            sb.append("\n\n").append(result.message());
        }
        return sb.toString();
    }

    String tagName(String id, Direction direction) {
        String safe = id.replaceAll("[^A-Za-z0-9._/-]", "-");
        return direction == Direction.APPLY ? tagPrefix + safe : tagPrefix + safe + "-reverted";
    }

    private static String describe(Throwable e) {
        if (e instanceof MigrateException me) {
            return me.getBaseMessage();
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
