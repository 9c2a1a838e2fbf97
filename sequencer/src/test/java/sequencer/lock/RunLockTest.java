package sequencer.lock;

import sequencer.exceptions.ConcurrentRunDetectedException;
import sequencer.exceptions.MigrateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RunLock")
class RunLockTest {

    @TempDir
    Path stateDir;

    @Test
    @DisplayName("should create the lock file and record the holder")
    void shouldRecordHolder() throws MigrateException, IOException {
        try (RunLock lock = RunLock.acquire(stateDir.resolve("nested"))) {
            assertThat(lock.isHeld()).isTrue();
            assertThat(Files.readString(lock.file())).startsWith("pid=" + ProcessHandle.current().pid());
        }
    }

    @Test
    @DisplayName("should reject a second holder")
    void shouldRejectSecondHolder() throws MigrateException {
        try (RunLock held = RunLock.acquire(stateDir)) {
            assertThatThrownBy(() -> RunLock.acquire(stateDir))
                    .isInstanceOfSatisfying(ConcurrentRunDetectedException.class, e -> {
                        assertThat(e.lockFile()).isEqualTo(held.file());
                        assertThat(e.getMessage()).contains("pid=");
                    });
            assertThat(held.isHeld()).isTrue();
        }
    }

    @Test
    @DisplayName("should be acquirable again after release")
    void shouldReacquireAfterRelease() throws MigrateException {
        RunLock first = RunLock.acquire(stateDir);
        first.close();

        assertThat(first.isHeld()).isFalse();
        try (RunLock second = RunLock.acquire(stateDir)) {
            assertThat(second.isHeld()).isTrue();
        }
    }
}
