package sequencer.exceptions;

import java.nio.file.Path;

/**
 * Another migrate or rollback run holds the write lease on the same working root.
 */
public class ConcurrentRunDetectedException extends MigrateException {

    private final Path lockFile;

    public ConcurrentRunDetectedException(Path lockFile, String holder) {
        super("Another migration run holds " + lockFile
                + (holder == null || holder.isBlank() ? "" : " (" + holder.strip() + ")"),
                null, "lock", null);
        this.lockFile = lockFile;
    }

    public Path lockFile() {
        return lockFile;
    }
}
