package sequencer.plan;

import sequencer.Migration;
import sequencer.MigrationVersion;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable snapshot of a discovered {@link Migration}.
 *
 * <p>A MigrationDescriptor captures, once per run:
 * <ul>
 *   <li>The identity of the unit</li>
 *   <li>Its parsed ordering key</li>
 *   <li>Its declared dependencies, in declaration order</li>
 *   <li>The source it was discovered from (class name or source label)</li>
 *   <li>The unit instance whose operations will be invoked</li>
 * </ul>
 *
 * <p>Graph building and scheduling only read the captured values, so a unit
 * whose accessor methods change their answers mid-run cannot corrupt a plan.
 *
 * @see DependencyGraph
 * @see MigrationPlan
 */
public final class MigrationDescriptor {

    /** Scheduling order among independent migrations: ordering key, then identity. */
    public static final Comparator<MigrationDescriptor> SCHEDULE_ORDER =
            Comparator.comparing(MigrationDescriptor::version).thenComparing(MigrationDescriptor::id);

    private final String id;
    private final MigrationVersion version;
    private final List<String> dependencies;
    private final String description;
    private final String source;
    private final Migration migration;

    /**
     * Captures the identity of a migration.
     *
     * @param migration the unit
     * @param source where the unit was discovered, for diagnostics
     * @throws IllegalArgumentException if the identity is blank, the version cannot
     *         be parsed, or a dependency entry is null or blank
     */
    public MigrationDescriptor(Migration migration, String source) {
        this.migration = Objects.requireNonNull(migration, "migration");
        this.source = source != null ? source : migration.getClass().getName();

        String rawId = migration.id();
        if (rawId == null || rawId.isBlank()) {
            throw new IllegalArgumentException("Migration identity must not be blank");
        }
        this.id = rawId.strip();
        this.version = MigrationVersion.parse(migration.version());

        Set<String> deps = migration.dependencies();
        Set<String> captured = new LinkedHashSet<>();
        if (deps != null) {
            for (String dep : deps) {
                if (dep == null || dep.isBlank()) {
                    throw new IllegalArgumentException("Migration '" + id + "' declares a blank dependency");
                }
                captured.add(dep.strip());
            }
        }
        this.dependencies = List.copyOf(new ArrayList<>(captured));

        String desc = migration.description();
        this.description = desc != null ? desc : "";
    }

    public MigrationDescriptor(Migration migration) {
        this(migration, null);
    }

    public String id() { return id; }

    public MigrationVersion version() { return version; }

    /** Declared dependencies in declaration order, immutable. */
    public List<String> dependencies() { return dependencies; }

    public String description() { return description; }

    /** Where this unit was discovered. */
    public String source() { return source; }

    public Migration migration() { return migration; }

    @Override
    public String toString() {
        return id + "@" + version;
    }
}
