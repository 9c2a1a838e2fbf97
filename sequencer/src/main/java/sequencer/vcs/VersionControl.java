package sequencer.vcs;

import sequencer.exceptions.VersionControlException;

import java.util.List;

/**
 * Narrow version-control capability used by {@link sequencer.commit.MigrationTransaction}.
 *
 * <p>Paths are relative to the working root and use {@code /} as separator.
 * The state directory is never reported as changed and never touched by
 * {@link #reset(String)}.
 *
 * @see GitVersionControl
 * @see InMemoryVersionControl
 */
public interface VersionControl {

    /**
     * Paths under the working root that differ from the current head, including
     * untracked and deleted files, sorted.
     */
    List<String> changedPaths() throws VersionControlException;

    default boolean isClean() throws VersionControlException {
        return changedPaths().isEmpty();
    }

    /** Reference of the current head commit. */
    String head() throws VersionControlException;

    /**
     * Records the current content of exactly the given paths in a new commit.
     * An empty path list produces an empty commit.
     *
     * @return reference of the new commit
     */
    String commit(List<String> paths, String message) throws VersionControlException;

    /**
     * Makes the working tree identical to the given commit, discarding tracked
     * modifications and removing untracked files, and moves head to it.
     */
    void reset(String ref) throws VersionControlException;

    /**
     * Attaches a name to a commit, replacing an existing tag of that name.
     */
    void tag(String ref, String name) throws VersionControlException;
}
