package sequencer.exceptions;

import java.util.List;

/**
 * The working tree holds uncommitted changes that do not belong to any migration.
 *
 * <p>Raised before a migration operation runs, so nothing has been mutated.
 * Commit, stash or reset the listed paths and run again.
 */
public class DirtyWorkingTreeException extends MigrateException {

    private static final int LISTED_PATHS = 10;

    private final List<String> paths;

    public DirtyWorkingTreeException(String migrationId, String stage, List<String> paths) {
        super("Working tree has uncommitted changes: " + preview(paths), migrationId, stage, null);
        this.paths = List.copyOf(paths);
    }

    /** The paths reported as modified, added or deleted. */
    public List<String> paths() {
        return paths;
    }

    private static String preview(List<String> paths) {
        if (paths.size() <= LISTED_PATHS) return paths.toString();
        return paths.subList(0, LISTED_PATHS) + " and " + (paths.size() - LISTED_PATHS) + " more";
    }
}
