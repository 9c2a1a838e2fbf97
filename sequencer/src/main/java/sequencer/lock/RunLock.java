package sequencer.lock;

import sequencer.exceptions.ConcurrentRunDetectedException;
import sequencer.exceptions.StateStoreException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;

/**
 * Exclusive write lease on a working root for the duration of a migrate or rollback call.
 *
 * <p>Backed by an OS file lock on {@code <state dir>/lock}, so it excludes other
 * processes as well as other managers in the same process. The lock file holds
 * the holder's pid and acquisition time for diagnostics; it is left in place on
 * release, since the OS lock rather than the file's existence is what counts.
 *
 * <h2>Usage:</h2>
 * <pre>
 * try (RunLock lock = RunLock.acquire(stateDir)) {
 *     // single writer from here on
 * }
 * </pre>
 */
public final class RunLock implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RunLock.class);

    public static final String FILE_NAME = "lock";

    private final Path file;
    private final FileChannel channel;
    private final FileLock lock;

    private RunLock(Path file, FileChannel channel, FileLock lock) {
        this.file = file;
        this.channel = channel;
        this.lock = lock;
    }

    /**
     * Acquires the lease without waiting.
     *
     * @param stateDir the state directory; created if missing
     * @return the held lease
     * @throws ConcurrentRunDetectedException if another run holds the lease
     * @throws StateStoreException if the lock file cannot be opened
     */
    public static RunLock acquire(Path stateDir) throws ConcurrentRunDetectedException, StateStoreException {
        Path file = stateDir.resolve(FILE_NAME).toAbsolutePath().normalize();
        FileChannel channel;
        try {
            Files.createDirectories(stateDir);
            channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new StateStoreException("Failed to open lock file " + file, e);
        }

        FileLock lock;
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            lock = null;
        } catch (IOException e) {
            closeQuietly(channel);
            throw new StateStoreException("Failed to lock " + file, e);
        }

        if (lock == null) {
            String holder = readHolder(file);
            closeQuietly(channel);
            throw new ConcurrentRunDetectedException(file, holder);
        }

        try {
            String owner = "pid=" + ProcessHandle.current().pid() + " since=" + Instant.now();
            channel.truncate(0);
            channel.write(ByteBuffer.wrap(owner.getBytes(StandardCharsets.UTF_8)), 0);
        } catch (IOException e) {
            log.warn("Could not record lock holder in {}", file, e);
        }
        log.debug("Acquired run lock {}", file);
        return new RunLock(file, channel, lock);
    }

    public Path file() {
        return file;
    }

    public boolean isHeld() {
        return lock.isValid();
    }

    @Override
    public void close() {
        try {
            if (lock.isValid()) {
                lock.release();
            }
        } catch (IOException e) {
            log.warn("Failed to release run lock {}", file, e);
        } finally {
            closeQuietly(channel);
        }
        log.debug("Released run lock {}", file);
    }

    private static String readHolder(Path file) {
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8).trim();
            return content.isEmpty() ? "unknown" : content;
        } catch (IOException e) {
            return "unknown";
        }
    }

    private static void closeQuietly(FileChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("Failed to close lock channel", e);
        }
    }
}
