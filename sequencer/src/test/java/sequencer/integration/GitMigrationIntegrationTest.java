package sequencer.integration;

import sequencer.config.AlertLevel;
import sequencer.config.SequencerConfig;
import sequencer.engine.MigrationManager;
import sequencer.engine.MigrationStatus;
import sequencer.exceptions.DirtyWorkingTreeException;
import sequencer.exceptions.MigrateException;
import sequencer.exceptions.RunHaltedException;
import sequencer.fixtures.GitRepo;
import sequencer.state.ExecutionRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * End-to-end runs against a real git repository, using annotation discovery
 * and the YAML ledger. Skipped when git is not installed.
 */
@DisplayName("Git migration integration")
class GitMigrationIntegrationTest {

    @TempDir
    Path repo;

    private SequencerConfig config;

    @BeforeEach
    void setUp() throws IOException {
        assumeTrue(GitRepo.available(), "git is not installed");
        GitRepo.init(repo);
        GitRepo.git(repo, "rm", "-q", "README.md");
        GitRepo.git(repo, "commit", "-q", "-m", "start empty");

        config = SequencerConfig.builder()
                .discoveryPackages(List.of("sequencer.fixtures.scan.valid"))
                .tagCommits(true)
                .alertLevel(AlertLevel.DEBUG)
                .build();
    }

    @Test
    @DisplayName("should apply, record, tag and roll back through git")
    void fullCycle() throws MigrateException, IOException {
        MigrationManager manager = MigrationManager.open(repo, config);

        List<ExecutionRecord> applied = manager.migrate(null);

        assertThat(applied).extracting(ExecutionRecord::migrationId).containsExactly("create-readme", "AddGitignore");
        assertThat(repo.resolve("README.md")).hasContent("# Project");
        assertThat(repo.resolve(".gitignore")).exists();
        assertThat(GitRepo.git(repo, "log", "-2", "--format=%s"))
                .isEqualTo("[migration] Apply AddGitignore\n[migration] Apply create-readme");
        assertThat(GitRepo.git(repo, "rev-parse", "migration/create-readme^{commit}"))
                .isEqualTo(applied.get(0).commitRef());
        assertThat(GitRepo.git(repo, "status", "--porcelain")).isEmpty();
        assertThat(repo.resolve(".sequencer/state.yml")).exists();

        List<ExecutionRecord> reverted = manager.rollback(null);

        assertThat(reverted).extracting(ExecutionRecord::migrationId).containsExactly("AddGitignore");
        assertThat(repo.resolve(".gitignore")).doesNotExist();
        assertThat(GitRepo.git(repo, "log", "-1", "--format=%s")).isEqualTo("[migration] Revert AddGitignore");
        assertThat(GitRepo.git(repo, "tag", "--list", "migration/AddGitignore-reverted"))
                .isEqualTo("migration/AddGitignore-reverted");

        MigrationStatus status = MigrationManager.open(repo, config).status();
        assertThat(status.applied()).extracting(ExecutionRecord::migrationId).containsExactly("create-readme");
        assertThat(status.pending()).containsExactly("AddGitignore");
    }

    @Test
    @DisplayName("managers opened side by side should share one ledger")
    void managersShouldShareLedger() throws MigrateException {
        MigrationManager first = MigrationManager.open(repo, config);
        MigrationManager second = MigrationManager.open(repo, config);

        first.migrate("create-readme");
        List<ExecutionRecord> records = second.migrate(null);

        assertThat(records).extracting(ExecutionRecord::status)
                .containsExactly(ExecutionRecord.Status.SKIPPED, ExecutionRecord.Status.APPLIED);
        assertThat(records.get(0).message()).isEqualTo("already applied");
        assertThat(MigrationManager.open(repo, config).status().applied())
                .extracting(ExecutionRecord::migrationId)
                .containsExactly("create-readme", "AddGitignore");
    }

    @Test
    @DisplayName("should refuse to run over uncommitted work")
    void shouldRefuseDirtyTree() throws MigrateException, IOException {
        Files.writeString(repo.resolve("draft.txt"), "unsaved\n");
        String head = GitRepo.git(repo, "rev-parse", "HEAD");

        assertThatThrownBy(() -> MigrationManager.open(repo, config).migrate(null))
                .isInstanceOf(RunHaltedException.class)
                .hasCauseInstanceOf(DirtyWorkingTreeException.class);

        assertThat(repo.resolve("draft.txt")).exists();
        assertThat(repo.resolve("README.md")).doesNotExist();
        assertThat(GitRepo.git(repo, "rev-parse", "HEAD")).isEqualTo(head);
    }

    @Test
    @DisplayName("should skip a migration whose work is already present")
    void shouldSkipWhenNotNeeded() throws MigrateException, IOException {
        Files.writeString(repo.resolve("README.md"), "hand written\n");
        GitRepo.git(repo, "add", "README.md");
        GitRepo.git(repo, "commit", "-q", "-m", "readme by hand");

        List<ExecutionRecord> records = MigrationManager.open(repo, config).migrate(null);

        assertThat(records).extracting(ExecutionRecord::status)
                .containsExactly(ExecutionRecord.Status.SKIPPED, ExecutionRecord.Status.APPLIED);
        assertThat(repo.resolve("README.md")).hasContent("hand written");
    }
}
