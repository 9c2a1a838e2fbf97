package sequencer.exceptions;

/**
 * A version-control operation (status, commit, reset, tag) could not be performed.
 */
public class VersionControlException extends MigrateException {

    public VersionControlException(String message) {
        super(message, null, "vcs", null);
    }

    public VersionControlException(String message, Throwable cause) {
        super(message, null, "vcs", cause);
    }
}
