package sequencer.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * What {@link MigrationManager#migrate(String)} would do, computed without running any transaction.
 *
 * @param target the requested target, null for everything
 * @param entries one entry per planned migration, in execution order
 */
public record DryRunReport(String target, List<Entry> entries) {

    public enum Action {
        /** Would be applied */
        APPLY,
        /** Would be skipped because it is already applied */
        ALREADY_APPLIED,
        /** Would be skipped because its applicability check says so */
        NOT_NEEDED,
        /** The applicability check failed; a real run would halt here */
        CHECK_FAILED
    }

    /**
     * @param migrationId the migration
     * @param version its ordering key
     * @param action what a real run would do with it
     * @param detail description or failure message, may be empty
     */
    public record Entry(String migrationId, String version, Action action, String detail) {}

    public DryRunReport {
        entries = List.copyOf(entries);
    }

    /** Identities that would be applied, in order. */
    public List<String> toApply() {
        List<String> ids = new ArrayList<>();
        for (Entry e : entries) {
            if (e.action() == Action.APPLY) ids.add(e.migrationId());
        }
        return ids;
    }

    public boolean hasFailures() {
        return entries.stream().anyMatch(e -> e.action() == Action.CHECK_FAILED);
    }
}
