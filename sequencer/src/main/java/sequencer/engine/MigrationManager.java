package sequencer.engine;

import sequencer.Direction;
import sequencer.Migration;
import sequencer.MigrationContext;
import sequencer.MigrationVersion;
import sequencer.alert.MigrationAlertLogger;
import sequencer.commit.CommitResult;
import sequencer.commit.MigrationTransaction;
import sequencer.config.SequencerConfig;
import sequencer.exceptions.*;
import sequencer.lock.RunLock;
import sequencer.phase.MigrationPhaseListener;
import sequencer.phase.NoopPhaseListener;
import sequencer.plan.MigrationDescriptor;
import sequencer.plan.MigrationPlan;
import sequencer.registry.AnnotationMigrationSource;
import sequencer.registry.DiscoveryResult;
import sequencer.registry.MigrationRegistry;
import sequencer.registry.MigrationSource;
import sequencer.state.ExecutionRecord;
import sequencer.state.FileStateStore;
import sequencer.state.StateStore;
import sequencer.vcs.GitVersionControl;
import sequencer.vcs.InMemoryVersionControl;
import sequencer.vcs.VersionControl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Orchestrates discovery, planning and execution of migrations against one working root.
 *
 * <p>The manager is the only component front ends talk to. Every call works on
 * the calling thread:
 * <ul>
 *   <li>{@link #discover()}, {@link #plan(String)}, {@link #status()} and {@link #dryRun(String)} only read</li>
 *   <li>{@link #migrate(String)}, {@link #rollback(String)} and {@link #rollbackAll()} hold the
 *       {@link RunLock} for their whole duration and execute one migration at a time</li>
 * </ul>
 *
 * <p>Each migration runs inside a {@link MigrationTransaction}, so a failure leaves
 * the working tree as it was before that migration, and the run halts with a
 * {@link RunHaltedException} whose {@link RunReport} lists what completed, what
 * failed and what is still pending. Migrations committed earlier in the run stay
 * committed and recorded.
 *
 * <h2>Usage:</h2>
 * <pre>
 * MigrationManager manager = MigrationManager.open(projectRoot, SequencerConfigLoader.loadOrDefaults());
 * try {
 *     manager.migrate(null);
 * } catch (MigrateException e) {
 *     System.exit(ExitStatus.forException(e).code());
 * }
 * </pre>
 */
public final class MigrationManager {

    private static final Logger log = LoggerFactory.getLogger(MigrationManager.class);

    private final Path workingRoot;
    private final Path stateDir;
    private final MigrationRegistry registry;
    private final StateStore store;
    private final MigrationPhaseListener listener;
    private final MigrationAlertLogger alerts;
    private final MigrationTransaction transaction;

    private final AtomicLong runCounter = new AtomicLong();

    private MigrationManager(Builder b, StateStore store, VersionControl vcs) {
        this.workingRoot = b.workingRoot;
        this.stateDir = b.workingRoot.resolve(b.config.stateDir());
        this.registry = b.registry;
        this.store = store;
        this.listener = b.listener != null ? b.listener : NoopPhaseListener.INSTANCE;
        this.alerts = b.alerts != null ? b.alerts : new MigrationAlertLogger(b.config.alertLevel());
        this.transaction = new MigrationTransaction(vcs, alerts, b.config.commitMessagePrefix(),
                b.config.tagCommits() ? b.config.tagPrefix() : null);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Wires a manager the standard way: annotation discovery over the configured
     * packages and directory, the YAML ledger under the state directory, and the
     * configured version-control backend.
     *
     * @throws MigrateException if the ledger cannot be read or the version-control backend is unavailable
     */
    public static MigrationManager open(Path workingRoot, SequencerConfig config) throws MigrateException {
        AnnotationMigrationSource source = new AnnotationMigrationSource(
                config.discoveryPackages(), config.discoveryPath().orElse(null), null);
        return builder()
                .workingRoot(workingRoot)
                .config(config)
                .registry(new MigrationRegistry(List.of(source), config.strictDiscovery()))
                .build();
    }

    public Path workingRoot() {
        return workingRoot;
    }

    public StateStore stateStore() {
        return store;
    }

    // ===== read-only operations =====

    /**
     * Loads the candidate set. Does not touch the working root or the ledger.
     *
     * @throws DiscoveryException in strict mode, if any migration failed to load
     */
    public DiscoveryResult discover() throws DiscoveryException {
        return registry.discover();
    }

    /**
     * Computes the execution order a run would use.
     *
     * @param target identity or version to stop at, null for everything
     * @return the plan, including already applied migrations
     * @throws GraphValidationException if dependencies are unresolved, cyclic or duplicated
     * @throws UnknownMigrationException if the target matches nothing
     */
    public MigrationPlan plan(String target) throws MigrateException {
        return MigrationPlan.build(discover().candidates(), target);
    }

    /**
     * Reports applied, pending and orphaned migrations. Never throws for an invalid
     * candidate set; the problem is reported in {@link MigrationStatus#validationError()}.
     */
    public MigrationStatus status() {
        try {
            store.refresh();
        } catch (StateStoreException e) {
            log.warn("Reporting the last known ledger: {}", e.getBaseMessage());
        }

        DiscoveryResult discovered;
        String validation = null;
        try {
            discovered = discover();
        } catch (DiscoveryException e) {
            discovered = new DiscoveryResult(List.of(), e.errors());
            validation = e.getBaseMessage();
        }

        List<String> pending = new ArrayList<>();
        try {
            for (String id : MigrationPlan.build(discovered.candidates()).orderedIds()) {
                if (!store.isApplied(id)) pending.add(id);
            }
        } catch (GraphValidationException e) {
            validation = e.getBaseMessage();
            for (String id : discovered.ids()) {
                if (!store.isApplied(id)) pending.add(id);
            }
        }

        Set<String> known = new HashSet<>(discovered.ids());
        List<String> orphaned = new ArrayList<>();
        for (String id : store.appliedInOrder()) {
            if (!known.contains(id)) orphaned.add(id);
        }

        return new MigrationStatus(store.appliedRecords(), pending, orphaned, discovered.errors(), validation);
    }

    /**
     * Evaluates what {@link #migrate(String)} would do, calling each pending
     * migration's applicability check but running no transaction.
     *
     * @throws GraphValidationException if the candidate set is invalid
     * @throws UnknownMigrationException if the target matches nothing
     */
    public DryRunReport dryRun(String target) throws MigrateException {
        store.refresh();
        MigrationPlan plan = plan(target);
        long runId = runCounter.incrementAndGet();

        List<DryRunReport.Entry> entries = new ArrayList<>();
        for (MigrationDescriptor d : plan.ordered()) {
            String version = d.version().toString();
            if (store.isApplied(d.id())) {
                entries.add(new DryRunReport.Entry(d.id(), version, DryRunReport.Action.ALREADY_APPLIED, d.description()));
                continue;
            }
            MigrationContext ctx = new MigrationContext(workingRoot, d.id(), Direction.APPLY, runId, null);
            try {
                DryRunReport.Action action = d.migration().isNeeded(ctx)
                        ? DryRunReport.Action.APPLY
                        : DryRunReport.Action.NOT_NEEDED;
                entries.add(new DryRunReport.Entry(d.id(), version, action, d.description()));
            } catch (Throwable e) {
                entries.add(new DryRunReport.Entry(d.id(), version, DryRunReport.Action.CHECK_FAILED, String.valueOf(e)));
            }
        }
        return new DryRunReport(target, entries);
    }

    // ===== mutating operations =====

    /**
     * Applies the pending migrations of {@link #plan(String)} in order.
     *
     * <p>Already applied migrations and migrations whose applicability check
     * returns false yield SKIPPED records, which are not written to the ledger.
     *
     * @param target identity or version to stop at, null for everything
     * @return one record per planned migration, in execution order
     * @throws ConcurrentRunDetectedException if another run holds the working root
     * @throws GraphValidationException if the candidate set is invalid; nothing ran
     * @throws UnknownMigrationException if the target matches nothing; nothing ran
     * @throws RunHaltedException if a migration failed; its cause tells why
     */
    public List<ExecutionRecord> migrate(String target) throws MigrateException {
        try (RunLock lock = acquireLock()) {
            store.refresh();
            MigrationPlan plan = plan(target);
            long runId = runCounter.incrementAndGet();
            Instant startedAt = Instant.now();
            List<MigrationDescriptor> ordered = plan.ordered();

            alerts.runStarted(runId, Direction.APPLY, countPending(ordered), target);

            List<ExecutionRecord> records = new ArrayList<>();
            for (int i = 0; i < ordered.size(); i++) {
                MigrationDescriptor d = ordered.get(i);
                MigrationContext ctx = new MigrationContext(workingRoot, d.id(), Direction.APPLY, runId, null);
                try {
                    records.add(applyOne(d, ctx));
                } catch (MigrateException e) {
                    throw halt(ctx, d, e, records, idsOf(ordered.subList(i + 1, ordered.size())), startedAt);
                }
            }

            alerts.runCompleted(runId, Direction.APPLY, records.size(), millisSince(startedAt));
            return List.copyOf(records);
        }
    }

    /**
     * Reverts applied migrations in the reverse of the order they were applied.
     *
     * <p>Without a target only the most recently applied migration is reverted.
     * With a target, every migration applied after it is reverted and the
     * target itself stays applied. The recorded apply order is authoritative:
     * the current dependency graph is not consulted.
     *
     * @param target identity or version of an applied migration, null for the most recent one
     * @return one REVERTED record per reverted migration, in execution order
     * @throws UnknownMigrationException if the target is not applied, or a migration to revert is no longer discovered
     * @throws RunHaltedException if a revert failed; reverts completed before it stay recorded
     */
    public List<ExecutionRecord> rollback(String target) throws MigrateException {
        try (RunLock lock = acquireLock()) {
            store.refresh();
            List<ExecutionRecord> applied = store.appliedRecords();
            if (applied.isEmpty()) {
                log.info("Nothing to roll back");
                return List.of();
            }
            int keep = target == null ? applied.size() - 1 : indexOfTarget(applied, target) + 1;
            return revert(applied.subList(keep, applied.size()), target);
        }
    }

    /**
     * Reverts every applied migration, most recent first.
     *
     * @see #rollback(String)
     */
    public List<ExecutionRecord> rollbackAll() throws MigrateException {
        try (RunLock lock = acquireLock()) {
            store.refresh();
            return revert(store.appliedRecords(), null);
        }
    }

    // ===== execution =====

    private ExecutionRecord applyOne(MigrationDescriptor d, MigrationContext ctx) throws MigrateException {
        String version = d.version().toString();
        if (store.isApplied(d.id())) {
            return ExecutionRecord.skipped(d.id(), version, "already applied");
        }

        boolean needed;
        try {
            needed = d.migration().isNeeded(ctx);
        } catch (Throwable e) {
            throw new MigrationFailedException(d.id(), Direction.APPLY, "applicability check failed: " + e, e);
        }
        if (!needed) {
            ExecutionRecord skipped = ExecutionRecord.skipped(d.id(), version, "not needed");
            alerts.migrationSkipped(ctx.runId(), d.id(), "not needed");
            notifyAfter(ctx, skipped);
            return skipped;
        }

        notifyBefore(ctx);
        long start = System.nanoTime();
        Migration migration = d.migration();
        CommitResult commit = transaction.execute(ctx, () -> migration.apply(ctx));

        ExecutionRecord record;
        try {
            record = store.recordApplied(d.id(), version, commit.ref(),
                    commit.result().message(), commit.result().metadata());
        } catch (StateStoreException e) {
            // keep tree and ledger in agreement
            MigrationFailedException failure = new MigrationFailedException(
                    d.id(), Direction.APPLY, "could not record the applied migration", e);
            transaction.restore(ctx, commit.baseRef(), failure);
            throw failure;
        }

        alerts.migrationApplied(ctx.runId(), d.id(), commit.ref(), (System.nanoTime() - start) / 1_000_000);
        notifyAfter(ctx, record);
        return record;
    }

    private List<ExecutionRecord> revert(List<ExecutionRecord> appliedToRevert, String target) throws MigrateException {
        List<ExecutionRecord> order = new ArrayList<>(appliedToRevert);
        Collections.reverse(order);
        if (order.isEmpty()) {
            return List.of();
        }

        // resolve every unit before touching anything
        Map<String, MigrationDescriptor> byId = new HashMap<>();
        for (MigrationDescriptor d : discover().candidates()) byId.put(d.id(), d);
        for (ExecutionRecord r : order) {
            if (!byId.containsKey(r.migrationId())) {
                throw new UnknownMigrationException(
                        "Applied migration '" + r.migrationId() + "' is no longer discovered and cannot be reverted",
                        r.migrationId());
            }
        }

        long runId = runCounter.incrementAndGet();
        Instant startedAt = Instant.now();
        alerts.runStarted(runId, Direction.REVERT, order.size(), target);

        List<ExecutionRecord> records = new ArrayList<>();
        for (int i = 0; i < order.size(); i++) {
            ExecutionRecord applied = order.get(i);
            MigrationDescriptor d = byId.get(applied.migrationId());
            MigrationContext ctx = new MigrationContext(workingRoot, d.id(), Direction.REVERT, runId, applied.commitRef());
            try {
                records.add(revertOne(d, ctx));
            } catch (MigrateException e) {
                List<String> pending = new ArrayList<>();
                for (ExecutionRecord r : order.subList(i + 1, order.size())) pending.add(r.migrationId());
                throw halt(ctx, d, e, records, pending, startedAt);
            }
        }

        alerts.runCompleted(runId, Direction.REVERT, records.size(), millisSince(startedAt));
        return List.copyOf(records);
    }

    private ExecutionRecord revertOne(MigrationDescriptor d, MigrationContext ctx) throws MigrateException {
        notifyBefore(ctx);
        long start = System.nanoTime();
        Migration migration = d.migration();
        CommitResult commit = transaction.execute(ctx, () -> migration.revert(ctx));

        ExecutionRecord record;
        try {
            record = store.recordReverted(d.id(), d.version().toString(), commit.ref(),
                    commit.result().message(), commit.result().metadata());
        } catch (StateStoreException e) {
            MigrationFailedException failure = new MigrationFailedException(
                    d.id(), Direction.REVERT, "could not record the reverted migration", e);
            transaction.restore(ctx, commit.baseRef(), failure);
            throw failure;
        }

        alerts.migrationReverted(ctx.runId(), d.id(), commit.ref(), (System.nanoTime() - start) / 1_000_000);
        notifyAfter(ctx, record);
        return record;
    }

    private RunHaltedException halt(MigrationContext ctx, MigrationDescriptor failed, MigrateException cause,
                                    List<ExecutionRecord> records, List<String> pending, Instant startedAt) {
        alerts.migrationFailed(ctx.runId(), failed.id(), ctx.direction(), cause);
        notifyFailed(ctx, cause);

        List<ExecutionRecord> all = new ArrayList<>(records);
        all.add(ExecutionRecord.failed(failed.id(), failed.version().toString(), cause.getBaseMessage()));
        RunReport report = new RunReport(ctx.runId(), ctx.direction(), all, failed.id(),
                cause.getBaseMessage(), pending, startedAt, Instant.now());

        alerts.runHalted(ctx.runId(), report.completed().size(), failed.id(), pending.size());
        return new RunHaltedException(report, cause);
    }

    // ===== helpers =====

    private RunLock acquireLock() throws MigrateException {
        try {
            return RunLock.acquire(stateDir);
        } catch (ConcurrentRunDetectedException e) {
            alerts.lockConflict(e.lockFile().toString(), e.getBaseMessage());
            throw e;
        }
    }

    private int indexOfTarget(List<ExecutionRecord> applied, String target) throws UnknownMigrationException {
        String wanted = target.strip();
        for (int i = 0; i < applied.size(); i++) {
            if (applied.get(i).migrationId().equals(wanted)) return i;
        }

        MigrationVersion version;
        try {
            version = MigrationVersion.parse(wanted);
        } catch (IllegalArgumentException e) {
            version = null;
        }
        if (version != null) {
            for (int i = applied.size() - 1; i >= 0; i--) {
                String v = applied.get(i).version();
                if (v != null && sameVersion(v, version)) return i;
            }
        }
        throw new UnknownMigrationException("Rollback target '" + wanted + "' is not an applied migration", wanted);
    }

    private static boolean sameVersion(String recorded, MigrationVersion version) {
        try {
            return MigrationVersion.parse(recorded).equals(version);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private int countPending(List<MigrationDescriptor> ordered) {
        int n = 0;
        for (MigrationDescriptor d : ordered) {
            if (!store.isApplied(d.id())) n++;
        }
        return n;
    }

    private static List<String> idsOf(List<MigrationDescriptor> descriptors) {
        List<String> ids = new ArrayList<>(descriptors.size());
        for (MigrationDescriptor d : descriptors) ids.add(d.id());
        return ids;
    }

    private static long millisSince(Instant start) {
        return Instant.now().toEpochMilli() - start.toEpochMilli();
    }

    private void notifyBefore(MigrationContext ctx) {
        try {
            listener.onBeforeMigration(ctx);
        } catch (Exception e) {
            log.warn("Phase listener threw in onBeforeMigration for '{}' (ignored)", ctx.migrationId(), e);
        }
    }

    private void notifyAfter(MigrationContext ctx, ExecutionRecord record) {
        try {
            listener.onAfterMigration(ctx, record);
        } catch (Exception e) {
            log.warn("Phase listener threw in onAfterMigration for '{}' (ignored)", ctx.migrationId(), e);
        }
    }

    private void notifyFailed(MigrationContext ctx, MigrateException error) {
        try {
            listener.onMigrationFailed(ctx, error);
        } catch (Exception e) {
            log.warn("Phase listener threw in onMigrationFailed for '{}' (ignored)", ctx.migrationId(), e);
        }
    }

    // ===== builder =====

    /**
     * Builder for {@link MigrationManager}.
     *
     * <p>Only the working root and a discovery source are required. Unset
     * collaborators are derived from the configuration: a {@link FileStateStore}
     * under the state directory and the configured version-control backend.
     */
    public static final class Builder {
        private Path workingRoot;
        private SequencerConfig config = SequencerConfig.DEFAULTS;
        private MigrationRegistry registry;
        private List<MigrationSource> sources;
        private StateStore store;
        private VersionControl vcs;
        private MigrationPhaseListener listener;
        private MigrationAlertLogger alerts;

        private Builder() {}

        public Builder workingRoot(Path root) {
            this.workingRoot = root.toAbsolutePath().normalize();
            return this;
        }

        public Builder config(SequencerConfig config) {
            this.config = Objects.requireNonNull(config, "config");
            return this;
        }

        public Builder registry(MigrationRegistry registry) {
            this.registry = registry;
            return this;
        }

        /** Discovers from the given sources, strict according to the configuration. Ignored if a registry is set. */
        public Builder sources(MigrationSource... sources) {
            this.sources = List.of(sources);
            return this;
        }

        public Builder stateStore(StateStore store) {
            this.store = store;
            return this;
        }

        public Builder versionControl(VersionControl vcs) {
            this.vcs = vcs;
            return this;
        }

        public Builder phaseListener(MigrationPhaseListener listener) {
            this.listener = listener;
            return this;
        }

        public Builder alertLogger(MigrationAlertLogger alerts) {
            this.alerts = alerts;
            return this;
        }

        /**
         * @throws StateStoreException if the default ledger cannot be read
         * @throws VersionControlException if the default version-control backend is unavailable
         */
        public MigrationManager build() throws MigrateException {
            Objects.requireNonNull(workingRoot, "workingRoot");
            if (registry == null) {
                if (sources == null) {
                    throw new IllegalStateException("A registry or at least one migration source is required");
                }
                registry = new MigrationRegistry(sources, config.strictDiscovery());
            }

            StateStore s = store != null ? store : FileStateStore.open(workingRoot, config.stateDir());
            VersionControl v = vcs != null ? vcs : defaultVersionControl();
            log.debug("Opening migration manager for {} with {}", workingRoot, config);
            return new MigrationManager(this, s, v);
        }

        private VersionControl defaultVersionControl() throws VersionControlException {
            switch (config.vcsBackend()) {
                case MEMORY:
                    String stateTop = Path.of(config.stateDir()).getName(0).toString();
                    return new InMemoryVersionControl(workingRoot, Set.of(stateTop, ".git"));
                case GIT:
                default:
                    return GitVersionControl.open(workingRoot, config);
            }
        }
    }
}
