package sequencer.engine;

import sequencer.Direction;
import sequencer.state.ExecutionRecord;
import sequencer.state.ExecutionRecord.Status;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * What a migrate or rollback run did.
 *
 * @param runId identifier of the run, unique per manager
 * @param direction whether the run applied or reverted
 * @param records outcome of every migration processed before the run ended, in order
 * @param failedMigration identity of the migration that halted the run, null if none
 * @param failureReason why it failed, null if none
 * @param pending migrations the run did not reach, in execution order
 * @param startedAt when the run started
 * @param finishedAt when the run ended
 */
public record RunReport(
        long runId,
        Direction direction,
        List<ExecutionRecord> records,
        String failedMigration,
        String failureReason,
        List<String> pending,
        Instant startedAt,
        Instant finishedAt
) {

    public RunReport {
        records = List.copyOf(records);
        pending = List.copyOf(pending);
    }

    public boolean succeeded() {
        return failedMigration == null;
    }

    /** Identities of migrations applied or reverted by this run, in order. */
    public List<String> completed() {
        List<String> ids = new ArrayList<>();
        for (ExecutionRecord r : records) {
            if (r.status() == Status.APPLIED || r.status() == Status.REVERTED) {
                ids.add(r.migrationId());
            }
        }
        return ids;
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    /**
     * One-line account of the run, e.g.
     * {@code Apply run 2 halted at 'B': disk full; completed [A]; pending [C]}.
     */
    public String summary() {
        String verb = direction.verb();
        if (succeeded()) {
            return verb + " run " + runId + " completed; completed " + completed();
        }
        return verb + " run " + runId + " halted at '" + failedMigration + "': " + failureReason
                + "; completed " + completed() + "; pending " + pending;
    }
}
