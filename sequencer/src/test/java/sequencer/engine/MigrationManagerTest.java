package sequencer.engine;

import sequencer.Direction;
import sequencer.MigrationContext;
import sequencer.alert.MigrationAlertLogger;
import sequencer.config.AlertLevel;
import sequencer.config.SequencerConfig;
import sequencer.config.VcsBackend;
import sequencer.exceptions.ConcurrentRunDetectedException;
import sequencer.exceptions.CyclicDependencyException;
import sequencer.exceptions.DirtyWorkingTreeException;
import sequencer.exceptions.MigrateException;
import sequencer.exceptions.MigrationFailedException;
import sequencer.exceptions.RunHaltedException;
import sequencer.exceptions.StateStoreException;
import sequencer.exceptions.UnknownMigrationException;
import sequencer.exceptions.UnresolvedDependencyException;
import sequencer.fixtures.FileMigration;
import sequencer.lock.RunLock;
import sequencer.phase.MigrationPhaseListener;
import sequencer.plan.MigrationPlan;
import sequencer.registry.StaticMigrationSource;
import sequencer.state.ExecutionRecord;
import sequencer.state.ExecutionRecord.Status;
import sequencer.state.FileStateStore;
import sequencer.state.InMemoryStateStore;
import sequencer.state.StateStore;
import sequencer.vcs.InMemoryVersionControl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("MigrationManager")
class MigrationManagerTest {

    @TempDir
    Path root;

    private InMemoryVersionControl vcs;
    private InMemoryStateStore store;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(root.resolve("README.md"), "project\n");
        vcs = new InMemoryVersionControl(root, Set.of(".sequencer"));
        store = new InMemoryStateStore();
    }

    private MigrationManager manager(FileMigration... migrations) throws MigrateException {
        return manager(null, migrations);
    }

    private MigrationManager manager(MigrationPhaseListener listener, FileMigration... migrations) throws MigrateException {
        return MigrationManager.builder()
                .workingRoot(root)
                .sources(StaticMigrationSource.of(migrations))
                .stateStore(store)
                .versionControl(vcs)
                .phaseListener(listener)
                .alertLogger(new MigrationAlertLogger(AlertLevel.DEBUG))
                .build();
    }

    /** Regular files under the root, outside the state directory, with their contents. */
    private Map<String, String> tree() throws IOException {
        Map<String, String> files = new TreeMap<>();
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path p : (Iterable<Path>) walk::iterator) {
                String rel = root.relativize(p).toString().replace('\\', '/');
                if (Files.isRegularFile(p) && !rel.startsWith(".sequencer/")) {
                    files.put(rel, Base64.getEncoder().encodeToString(Files.readAllBytes(p)));
                }
            }
        }
        return files;
    }

    private static List<String> ids(List<ExecutionRecord> records) {
        List<String> ids = new ArrayList<>();
        for (ExecutionRecord r : records) ids.add(r.migrationId());
        return ids;
    }

    @Nested
    @DisplayName("migrate")
    class Migrate {

        @Test
        @DisplayName("should apply every migration in dependency order and commit each one")
        void shouldApplyInOrder() throws MigrateException {
            FileMigration a = FileMigration.of("A");
            FileMigration b = FileMigration.of("B", "A");
            FileMigration c = FileMigration.of("C", "B");

            List<ExecutionRecord> records = manager(c, b, a).migrate(null);

            assertThat(ids(records)).containsExactly("A", "B", "C");
            assertThat(records).extracting(ExecutionRecord::status).containsOnly(Status.APPLIED);
            assertThat(store.appliedInOrder()).containsExactly("A", "B", "C");
            assertThat(root.resolve("A.txt")).exists();
            assertThat(root.resolve("C.txt")).exists();

            assertThat(vcs.log()).hasSize(4);
            InMemoryVersionControl.Commit commitA = vcs.log().get(1);
            assertThat(commitA.message()).isEqualTo("[migration] Apply A\n\nwrote A.txt");
            assertThat(commitA.paths()).containsExactly("A.txt");
            assertThat(records.get(0).commitRef()).isEqualTo(commitA.ref());
            assertThat(vcs.isClean()).isTrue();
        }

        @Test
        @DisplayName("should break ties between independent migrations by version, then identity")
        void shouldBreakTiesByVersion() throws MigrateException {
            FileMigration init = FileMigration.of("init");
            FileMigration late = FileMigration.of("aaa", "init").version("0.2");
            FileMigration early = FileMigration.of("zzz", "init").version("0.1");
            FileMigration sibling = FileMigration.of("bbb", "init").version("0.2");

            List<ExecutionRecord> records = manager(init, late, early, sibling).migrate(null);

            assertThat(ids(records)).containsExactly("init", "zzz", "aaa", "bbb");
        }

        @Test
        @DisplayName("should stop at the target and its dependencies")
        void shouldStopAtTarget() throws MigrateException {
            FileMigration a = FileMigration.of("A");
            FileMigration b = FileMigration.of("B", "A");
            FileMigration c = FileMigration.of("C", "A");

            List<ExecutionRecord> records = manager(a, b, c).migrate("B");

            assertThat(ids(records)).containsExactly("A", "B");
            assertThat(c.calls()).isEmpty();
            assertThat(root.resolve("C.txt")).doesNotExist();
        }

        @Test
        @DisplayName("a second run should skip everything without committing")
        void shouldBeIdempotent() throws MigrateException {
            FileMigration a = FileMigration.of("A");
            FileMigration b = FileMigration.of("B", "A");
            MigrationManager manager = manager(a, b);
            manager.migrate(null);
            int commits = vcs.log().size();

            List<ExecutionRecord> again = manager.migrate(null);

            assertThat(again).extracting(ExecutionRecord::status).containsOnly(Status.SKIPPED);
            assertThat(again).extracting(ExecutionRecord::message).containsOnly("already applied");
            assertThat(vcs.log()).hasSize(commits);
            assertThat(a.calls()).containsExactly("isNeeded", "apply");
            assertThat(store.history()).hasSize(2);
        }

        @Test
        @DisplayName("should skip a migration that is not needed without recording it")
        void shouldSkipNotNeeded() throws MigrateException {
            FileMigration a = FileMigration.of("A").notNeeded();
            FileMigration b = FileMigration.of("B", "A");

            List<ExecutionRecord> records = manager(a, b).migrate(null);

            assertThat(records.get(0).status()).isEqualTo(Status.SKIPPED);
            assertThat(records.get(0).message()).isEqualTo("not needed");
            assertThat(records.get(1).status()).isEqualTo(Status.APPLIED);
            assertThat(a.calls()).containsExactly("isNeeded");
            assertThat(store.isApplied("A")).isFalse();
            assertThat(store.appliedInOrder()).containsExactly("B");
        }

        @Test
        @DisplayName("should hand the migration a context rooted at the working root")
        void shouldPassContext() throws MigrateException {
            FileMigration a = FileMigration.of("A");

            manager(a).migrate(null);

            MigrationContext ctx = a.contexts().get(0);
            assertThat(ctx.workingRoot()).isEqualTo(root.toAbsolutePath().normalize());
            assertThat(ctx.migrationId()).isEqualTo("A");
            assertThat(ctx.direction()).isEqualTo(Direction.APPLY);
            assertThat(ctx.forwardCommit()).isEmpty();
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        @DisplayName("an unresolved dependency should abort before anything runs")
        void unresolvedDependency() throws MigrateException {
            FileMigration a = FileMigration.of("A");
            FileMigration b = FileMigration.of("B", "Z");
            MigrationManager manager = manager(a, b);

            assertThatThrownBy(() -> manager.migrate(null))
                    .isInstanceOfSatisfying(UnresolvedDependencyException.class, e -> {
                        assertThat(e.unit()).isEqualTo("B");
                        assertThat(e.missingId()).isEqualTo("Z");
                        assertThat(ExitStatus.forException(e)).isEqualTo(ExitStatus.VALIDATION_FAILURE);
                    });
            assertThat(a.calls()).isEmpty();
            assertThat(store.history()).isEmpty();
            assertThat(vcs.log()).hasSize(1);
        }

        @Test
        @DisplayName("a cycle should abort before anything runs")
        void cycle() throws MigrateException {
            FileMigration a = FileMigration.of("A", "B");
            FileMigration b = FileMigration.of("B", "A");
            FileMigration free = FileMigration.of("free");
            MigrationManager manager = manager(a, b, free);

            assertThatThrownBy(() -> manager.migrate(null))
                    .isInstanceOfSatisfying(CyclicDependencyException.class,
                            e -> assertThat(e.cyclePath()).containsExactly("A", "B", "A"));
            assertThat(free.calls()).isEmpty();
        }

        @Test
        @DisplayName("an unknown target should abort before anything runs")
        void unknownTarget() throws MigrateException {
            FileMigration a = FileMigration.of("A");
            MigrationManager manager = manager(a);

            assertThatThrownBy(() -> manager.migrate("nope"))
                    .isInstanceOf(UnknownMigrationException.class);
            assertThat(a.calls()).isEmpty();
        }
    }

    @Nested
    @DisplayName("failure handling")
    class FailureHandling {

        @Test
        @DisplayName("a failing migration should halt the run and restore the tree")
        void shouldHaltAndRestore() throws MigrateException {
            FileMigration a = FileMigration.of("A");
            FileMigration b = FileMigration.of("B", "A").failingAfterWrite("disk full");
            FileMigration c = FileMigration.of("C", "B");
            MigrationManager manager = manager(a, b, c);

            assertThatThrownBy(() -> manager.migrate(null))
                    .isInstanceOfSatisfying(RunHaltedException.class, e -> {
                        RunReport report = e.report();
                        assertThat(report.completed()).containsExactly("A");
                        assertThat(report.failedMigration()).isEqualTo("B");
                        assertThat(report.failureReason()).contains("disk full");
                        assertThat(report.pending()).containsExactly("C");
                        assertThat(report.records()).extracting(ExecutionRecord::status)
                                .containsExactly(Status.APPLIED, Status.FAILED);
                        assertThat(e.getCause()).isInstanceOf(MigrationFailedException.class);
                        assertThat(ExitStatus.forException(e)).isEqualTo(ExitStatus.PARTIAL_FAILURE);
                    });

            assertThat(root.resolve("A.txt")).exists();
            assertThat(root.resolve("B.txt")).doesNotExist();
            assertThat(store.appliedInOrder()).containsExactly("A");
            assertThat(c.calls()).isEmpty();
            assertThat(vcs.isClean()).isTrue();
        }

        @Test
        @DisplayName("a failing first migration should leave no trace")
        void firstFailureLeavesNoTrace() throws MigrateException {
            FileMigration a = FileMigration.of("A").failingAfterWrite("boom");
            String base = vcs.head();

            assertThatThrownBy(() -> manager(a).migrate(null)).isInstanceOf(RunHaltedException.class);

            assertThat(store.history()).isEmpty();
            assertThat(vcs.head()).isEqualTo(base);
            assertThat(root.resolve("A.txt")).doesNotExist();
            assertThat(root.resolve("README.md")).hasContent("project");
        }

        @Test
        @DisplayName("a failed applicability check should halt the run")
        void failedCheckShouldHalt() throws MigrateException {
            FileMigration a = FileMigration.of("A").failingCheck(new IllegalStateException("cannot parse build file"));

            assertThatThrownBy(() -> manager(a).migrate(null))
                    .isInstanceOf(RunHaltedException.class)
                    .hasMessageContaining("applicability check failed")
                    .hasMessageContaining("cannot parse build file");
            assertThat(a.calls()).containsExactly("isNeeded");
        }

        @Test
        @DisplayName("an error thrown mid-apply should halt the run and restore the tree")
        void errorShouldHaltAndRestore() throws MigrateException {
            FileMigration a = FileMigration.of("A");
            FileMigration b = FileMigration.of("B", "A").writes("half.txt", "partial\n")
                    .erroringAfterWrite(new AssertionError("invariant broken mid-apply"));
            MigrationManager manager = manager(a, b);

            assertThatThrownBy(() -> manager.migrate(null))
                    .isInstanceOfSatisfying(RunHaltedException.class, e -> {
                        assertThat(e.report().completed()).containsExactly("A");
                        assertThat(e.report().failureReason()).contains("invariant broken mid-apply");
                        assertThat(e.getCause()).isInstanceOf(MigrationFailedException.class)
                                .hasCauseInstanceOf(AssertionError.class);
                    });

            assertThat(root.resolve("half.txt")).doesNotExist();
            assertThat(vcs.changedPaths()).isEmpty();
            assertThat(store.appliedInOrder()).containsExactly("A");
            assertThat(b.calls()).containsExactly("isNeeded", "apply");
        }

        @Test
        @DisplayName("an error thrown by the applicability check should halt the run")
        void erroringCheckShouldHalt() throws MigrateException {
            FileMigration a = FileMigration.of("A").erroringCheck(new StackOverflowError());

            assertThatThrownBy(() -> manager(a).migrate(null))
                    .isInstanceOf(RunHaltedException.class)
                    .hasMessageContaining("applicability check failed")
                    .hasMessageContaining("StackOverflowError");
            assertThat(store.history()).isEmpty();
        }

        @Test
        @DisplayName("a dirty working tree should halt the run without touching it")
        void dirtyTreeShouldHalt() throws MigrateException, IOException {
            FileMigration a = FileMigration.of("A");
            Files.writeString(root.resolve("notes.txt"), "work in progress\n");

            assertThatThrownBy(() -> manager(a).migrate(null))
                    .isInstanceOf(RunHaltedException.class)
                    .hasCauseInstanceOf(DirtyWorkingTreeException.class);
            assertThat(root.resolve("notes.txt")).exists();
            assertThat(a.calls()).containsExactly("isNeeded");
        }

        @Test
        @DisplayName("a ledger write failure should undo the committed change")
        void ledgerFailureShouldUndoCommit() throws MigrateException {
            StateStore failing = mock(StateStore.class);
            when(failing.isApplied(anyString())).thenReturn(false);
            when(failing.recordApplied(anyString(), any(), any(), any(), any()))
                    .thenThrow(new StateStoreException("disk full", null));
            String base = vcs.head();
            MigrationManager manager = MigrationManager.builder()
                    .workingRoot(root)
                    .sources(StaticMigrationSource.of(FileMigration.of("A")))
                    .stateStore(failing)
                    .versionControl(vcs)
                    .build();

            assertThatThrownBy(() -> manager.migrate(null))
                    .isInstanceOf(RunHaltedException.class)
                    .hasMessageContaining("could not record the applied migration");
            assertThat(vcs.head()).isEqualTo(base);
            assertThat(root.resolve("A.txt")).doesNotExist();
        }

        @Test
        @DisplayName("a concurrent run should be refused")
        void concurrentRunShouldBeRefused() throws MigrateException {
            FileMigration a = FileMigration.of("A");
            MigrationManager manager = manager(a);

            try (RunLock held = RunLock.acquire(root.resolve(".sequencer"))) {
                assertThatThrownBy(() -> manager.migrate(null))
                        .isInstanceOfSatisfying(ConcurrentRunDetectedException.class,
                                e -> assertThat(ExitStatus.forException(e)).isEqualTo(ExitStatus.CONCURRENCY_CONFLICT));
                assertThatThrownBy(() -> manager.rollback(null))
                        .isInstanceOf(ConcurrentRunDetectedException.class);
            }
            assertThat(a.calls()).isEmpty();
            assertThat(manager.migrate(null)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("shared ledger")
    class SharedLedger {

        private MigrationManager open(FileMigration... migrations) throws MigrateException {
            return MigrationManager.builder()
                    .workingRoot(root)
                    .sources(StaticMigrationSource.of(migrations))
                    .stateStore(FileStateStore.open(root, ".sequencer"))
                    .versionControl(vcs)
                    .build();
        }

        @Test
        @DisplayName("a manager opened before another run should see that run's records")
        void shouldSeeRecordsOfEarlierRun() throws MigrateException {
            FileMigration a = FileMigration.of("A");
            FileMigration b = FileMigration.of("B", "A");
            MigrationManager first = open(a, b);
            MigrationManager second = open(a, b);

            first.migrate("A");
            List<ExecutionRecord> records = second.migrate(null);

            assertThat(records).extracting(ExecutionRecord::status).containsExactly(Status.SKIPPED, Status.APPLIED);
            assertThat(records.get(0).message()).isEqualTo("already applied");
            assertThat(a.calls()).containsExactly("isNeeded", "apply");
            assertThat(FileStateStore.open(root, ".sequencer").appliedInOrder()).containsExactly("A", "B");
        }

        @Test
        @DisplayName("status and rollback should reflect the ledger on disk")
        void statusAndRollbackShouldReadLedger() throws MigrateException {
            FileMigration a = FileMigration.of("A");
            FileMigration b = FileMigration.of("B", "A");
            MigrationManager first = open(a, b);
            MigrationManager second = open(a, b);

            first.migrate(null);

            assertThat(second.status().pending()).isEmpty();
            assertThat(ids(second.rollback(null))).containsExactly("B");
            assertThat(first.status().applied()).extracting(ExecutionRecord::migrationId).containsExactly("A");
            assertThat(first.dryRun(null).toApply()).containsExactly("B");
        }
    }

    @Nested
    @DisplayName("round trip")
    class RoundTrip {

        @Test
        @DisplayName("rolling back once per applied migration should restore the original tree byte for byte")
        void rollbackPerMigrationRestoresTree() throws MigrateException, IOException {
            Files.createDirectories(root.resolve("src"));
            Files.write(root.resolve("src/data.bin"), new byte[]{0, 1, 2, (byte) 0xff});
            vcs.commit(vcs.changedPaths(), "fixture");
            Map<String, String> before = tree();

            FileMigration a = FileMigration.of("A").writes("docs/guide.md", "guide\n");
            FileMigration b = FileMigration.of("B", "A").writes("src/Generated.java", "class Generated {}\n");
            FileMigration c = FileMigration.of("C", "B").version("2");
            FileMigration d = FileMigration.of("D", "A").writes("docs/notes.md", "notes\n");
            MigrationManager manager = manager(a, b, c, d);

            List<String> applied = ids(manager.migrate(null));
            assertThat(applied).hasSize(4);
            assertThat(tree()).isNotEqualTo(before);

            List<String> reverted = new ArrayList<>();
            for (int i = 0; i < applied.size(); i++) {
                reverted.addAll(ids(manager.rollback(null)));
            }

            List<String> expected = new ArrayList<>(applied);
            Collections.reverse(expected);
            assertThat(reverted).containsExactlyElementsOf(expected);
            assertThat(tree()).isEqualTo(before);
            assertThat(store.appliedInOrder()).isEmpty();
            assertThat(vcs.changedPaths()).isEmpty();
            assertThat(manager.rollback(null)).isEmpty();
        }
    }

    @Nested
    @DisplayName("rollback")
    class Rollback {

        private FileMigration a;
        private FileMigration b;
        private FileMigration c;
        private MigrationManager manager;

        @BeforeEach
        void applyAll() throws MigrateException {
            a = FileMigration.of("A").version("1");
            b = FileMigration.of("B", "A").version("2");
            c = FileMigration.of("C", "B").version("3");
            manager = manager(a, b, c);
            manager.migrate(null);
        }

        @Test
        @DisplayName("without a target should revert only the most recent migration")
        void shouldRevertMostRecent() throws MigrateException {
            String forward = store.lastApplied("C").orElseThrow().commitRef();

            List<ExecutionRecord> records = manager.rollback(null);

            assertThat(ids(records)).containsExactly("C");
            assertThat(records.get(0).status()).isEqualTo(Status.REVERTED);
            assertThat(store.appliedInOrder()).containsExactly("A", "B");
            assertThat(root.resolve("C.txt")).doesNotExist();
            MigrationContext ctx = c.contexts().get(c.contexts().size() - 1);
            assertThat(ctx.direction()).isEqualTo(Direction.REVERT);
            assertThat(ctx.forwardCommit()).contains(forward);
            assertThat(vcs.log().get(vcs.log().size() - 1).message()).startsWith("[migration] Revert C");
        }

        @Test
        @DisplayName("with a target should revert everything applied after it")
        void shouldRevertDownToTarget() throws MigrateException {
            List<ExecutionRecord> records = manager.rollback("A");

            assertThat(ids(records)).containsExactly("C", "B");
            assertThat(store.appliedInOrder()).containsExactly("A");
            assertThat(root.resolve("A.txt")).exists();
            assertThat(root.resolve("B.txt")).doesNotExist();
        }

        @Test
        @DisplayName("should accept a version as target")
        void shouldAcceptVersionTarget() throws MigrateException {
            List<ExecutionRecord> records = manager.rollback("2.0");

            assertThat(ids(records)).containsExactly("C");
        }

        @Test
        @DisplayName("targeting the most recent migration should revert nothing")
        void targetingLatestShouldRevertNothing() throws MigrateException {
            assertThat(manager.rollback("C")).isEmpty();
            assertThat(store.appliedInOrder()).containsExactly("A", "B", "C");
        }

        @Test
        @DisplayName("should reject a target that is not applied")
        void shouldRejectUnappliedTarget() {
            assertThatThrownBy(() -> manager.rollback("nope"))
                    .isInstanceOf(UnknownMigrationException.class)
                    .hasMessageContaining("Rollback target 'nope' is not an applied migration");
            assertThat(store.appliedInOrder()).containsExactly("A", "B", "C");
        }

        @Test
        @DisplayName("rollbackAll should revert everything, most recent first")
        void rollbackAll() throws MigrateException {
            List<ExecutionRecord> records = manager.rollbackAll();

            assertThat(ids(records)).containsExactly("C", "B", "A");
            assertThat(store.appliedInOrder()).isEmpty();
            assertThat(store.history()).hasSize(6);
            try (var files = Files.list(root)) {
                assertThat(files.map(p -> p.getFileName().toString()))
                        .containsExactlyInAnyOrder("README.md", ".sequencer");
            } catch (IOException e) {
                throw new AssertionError(e);
            }
        }

        @Test
        @DisplayName("reverted migrations should apply again")
        void shouldReapplyAfterRollback() throws MigrateException {
            manager.rollbackAll();

            List<ExecutionRecord> records = manager.migrate(null);

            assertThat(ids(records)).containsExactly("A", "B", "C");
            assertThat(records).extracting(ExecutionRecord::status).containsOnly(Status.APPLIED);
            assertThat(root.resolve("C.txt")).exists();
        }

        @Test
        @DisplayName("a failing revert should halt and keep the migration applied")
        void failingRevertShouldHalt() throws MigrateException {
            b.failingRevert("file is locked");

            assertThatThrownBy(() -> manager.rollback("A"))
                    .isInstanceOfSatisfying(RunHaltedException.class, e -> {
                        assertThat(e.report().direction()).isEqualTo(Direction.REVERT);
                        assertThat(e.report().completed()).containsExactly("C");
                        assertThat(e.report().failedMigration()).isEqualTo("B");
                        assertThat(e.getStage()).isEqualTo("revert");
                    });
            assertThat(store.appliedInOrder()).containsExactly("A", "B");
            assertThat(root.resolve("B.txt")).exists();
        }

        @Test
        @DisplayName("should refuse to revert a migration that is no longer discovered")
        void shouldRefuseUndiscovered() throws MigrateException {
            MigrationManager withoutC = manager(a, b);

            assertThatThrownBy(withoutC::rollbackAll)
                    .isInstanceOf(UnknownMigrationException.class)
                    .hasMessageContaining("'C' is no longer discovered");
            assertThat(store.appliedInOrder()).containsExactly("A", "B", "C");
            assertThat(b.calls()).doesNotContain("revert");
        }

        @Test
        @DisplayName("should do nothing when nothing is applied")
        void nothingApplied() throws MigrateException {
            manager.rollbackAll();

            assertThat(manager.rollback(null)).isEmpty();
            assertThat(manager.rollbackAll()).isEmpty();
        }
    }

    @Nested
    @DisplayName("read-only operations")
    class ReadOnly {

        @Test
        @DisplayName("plan should include applied migrations")
        void planShouldIncludeApplied() throws MigrateException {
            MigrationManager manager = manager(FileMigration.of("A"), FileMigration.of("B", "A"));
            manager.migrate("A");

            MigrationPlan plan = manager.plan(null);

            assertThat(plan.orderedIds()).containsExactly("A", "B");
        }

        @Test
        @DisplayName("status should report applied, pending and orphaned migrations")
        void status() throws MigrateException {
            store.recordApplied("retired", "old");
            MigrationManager manager = manager(FileMigration.of("A"), FileMigration.of("B", "A"), FileMigration.of("C", "B"));
            manager.migrate("A");

            MigrationStatus status = manager.status();

            assertThat(status.applied()).extracting(ExecutionRecord::migrationId).containsExactly("retired", "A");
            assertThat(status.pending()).containsExactly("B", "C");
            assertThat(status.orphaned()).containsExactly("retired");
            assertThat(status.isValid()).isTrue();
            assertThat(status.isUpToDate()).isFalse();
        }

        @Test
        @DisplayName("status should report an invalid graph instead of throwing")
        void statusWithInvalidGraph() throws MigrateException {
            MigrationManager manager = manager(FileMigration.of("A"), FileMigration.of("B", "Z"));

            MigrationStatus status = manager.status();

            assertThat(status.isValid()).isFalse();
            assertThat(status.validationError()).contains("unknown migration 'Z'");
            assertThat(status.validation()).isPresent();
            assertThat(status.pending()).containsExactly("A", "B");
        }

        @Test
        @DisplayName("dry run should evaluate checks without running anything")
        void dryRun() throws MigrateException {
            FileMigration a = FileMigration.of("A");
            FileMigration b = FileMigration.of("B", "A").notNeeded();
            FileMigration c = FileMigration.of("C", "A").failingCheck(new IllegalStateException("unreadable"));
            FileMigration d = FileMigration.of("D", "A");
            MigrationManager manager = manager(a, b, c, d);
            manager.migrate("A");
            int commits = vcs.log().size();

            DryRunReport report = manager.dryRun(null);

            assertThat(report.entries()).extracting(DryRunReport.Entry::action).containsExactly(
                    DryRunReport.Action.ALREADY_APPLIED,
                    DryRunReport.Action.NOT_NEEDED,
                    DryRunReport.Action.CHECK_FAILED,
                    DryRunReport.Action.APPLY);
            assertThat(report.toApply()).containsExactly("D");
            assertThat(report.hasFailures()).isTrue();
            assertThat(d.calls()).containsExactly("isNeeded");
            assertThat(vcs.log()).hasSize(commits);
        }
    }

    @Nested
    @DisplayName("phase listener")
    class Listener {

        @Test
        @DisplayName("should be told about each migration and failure")
        void shouldReceiveEvents() throws MigrateException {
            List<String> events = new ArrayList<>();
            MigrationPhaseListener listener = new MigrationPhaseListener() {
                @Override
                public void onBeforeMigration(MigrationContext ctx) {
                    events.add("before:" + ctx.migrationId());
                }

                @Override
                public void onAfterMigration(MigrationContext ctx, ExecutionRecord record) {
                    events.add("after:" + ctx.migrationId() + ":" + record.status());
                }

                @Override
                public void onMigrationFailed(MigrationContext ctx, MigrateException error) {
                    events.add("failed:" + ctx.migrationId());
                }
            };
            MigrationManager manager = manager(listener,
                    FileMigration.of("A"),
                    FileMigration.of("B", "A").notNeeded(),
                    FileMigration.of("C", "B").failingApply("nope"));

            assertThatThrownBy(() -> manager.migrate(null)).isInstanceOf(RunHaltedException.class);

            assertThat(events).containsExactly(
                    "before:A", "after:A:APPLIED",
                    "after:B:SKIPPED",
                    "before:C", "failed:C");
        }

        @Test
        @DisplayName("a throwing listener should not affect the run")
        void throwingListenerIsIgnored() throws MigrateException {
            MigrationPhaseListener listener = new MigrationPhaseListener() {
                @Override
                public void onBeforeMigration(MigrationContext ctx) throws MigrateException {
                    throw new MigrateException("listener broke");
                }

                @Override
                public void onAfterMigration(MigrationContext ctx, ExecutionRecord record) {
                    throw new IllegalStateException("listener broke again");
                }
            };

            List<ExecutionRecord> records = manager(listener, FileMigration.of("A")).migrate(null);

            assertThat(records).singleElement().extracting(ExecutionRecord::status).isEqualTo(Status.APPLIED);
        }
    }

    @Nested
    @DisplayName("builder")
    class BuilderTests {

        @Test
        @DisplayName("should require a discovery source")
        void shouldRequireSource() {
            assertThatThrownBy(() -> MigrationManager.builder().workingRoot(root).build())
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should wire the file ledger and in-memory backend from configuration")
        void shouldWireFromConfig() throws MigrateException {
            MigrationManager manager = MigrationManager.builder()
                    .workingRoot(root)
                    .config(SequencerConfig.builder().vcsBackend(VcsBackend.MEMORY).stateDir(".state/migrations").build())
                    .sources(StaticMigrationSource.of(FileMigration.of("A")))
                    .build();

            manager.migrate(null);

            assertThat(root.resolve(".state/migrations/state.yml")).exists();
            assertThat(root.resolve(".state/migrations/lock")).exists();
            assertThat(manager.stateStore().isApplied("A")).isTrue();
            assertThat(manager.workingRoot()).isEqualTo(root.toAbsolutePath().normalize());
        }
    }
}
