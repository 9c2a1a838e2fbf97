package sequencer.config;

/**
 * Version-control capability used by {@link sequencer.engine.MigrationManager#open}.
 */
public enum VcsBackend {
    /** The git command line tool; the working root must be inside a git work tree. */
    GIT,

    /** In-process content snapshots; nothing survives the process. */
    MEMORY
}
