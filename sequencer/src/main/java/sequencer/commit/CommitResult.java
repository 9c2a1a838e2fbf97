package sequencer.commit;

import sequencer.MigrationResult;

import java.util.List;

/**
 * Outcome of a committed {@link MigrationTransaction}.
 *
 * @param ref the commit recording the operation's changes
 * @param baseRef the head before the operation started; resetting to it undoes the commit
 * @param paths the paths the operation touched, relative to the working root
 * @param result what the operation itself reported
 */
public record CommitResult(String ref, String baseRef, List<String> paths, MigrationResult result) {

    public CommitResult {
        paths = List.copyOf(paths);
    }
}
