package sequencer.plan;

import sequencer.MigrationVersion;
import sequencer.exceptions.GraphValidationException;
import sequencer.exceptions.UnknownMigrationException;

import java.util.*;

/**
 * Immutable migration plan: the ordered migrations a run would execute.
 *
 * <p>A MigrationPlan is computed fresh per run and never persisted. It provides:
 * <ul>
 *   <li>Lookup of descriptors by identity</li>
 *   <li>The validated {@link DependencyGraph} it was derived from</li>
 *   <li>The execution order (dependencies first), optionally limited to a target's closure</li>
 * </ul>
 *
 * <p>A target is resolved first as a migration identity and then as an
 * ordering key; a version target selects every migration with that version.
 *
 * @see DependencyGraph
 * @see Scheduler
 */
public final class MigrationPlan {

    private final DependencyGraph graph;
    private final List<MigrationDescriptor> ordered;
    private final Map<String, MigrationDescriptor> byId;
    private final String target;

    private MigrationPlan(DependencyGraph graph, List<MigrationDescriptor> ordered, String target) {
        this.graph = graph;
        this.ordered = ordered;
        this.target = target;
        Map<String, MigrationDescriptor> index = new LinkedHashMap<>();
        for (MigrationDescriptor d : ordered) index.put(d.id(), d);
        this.byId = Collections.unmodifiableMap(index);
    }

    // ===== public API =====

    /**
     * @return true if the migration is part of this plan
     */
    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    /**
     * @return the descriptor, or null if the migration is not part of this plan
     */
    public MigrationDescriptor descriptor(String id) {
        return byId.get(id);
    }

    /** Migrations in execution order (dependencies first), immutable. */
    public List<MigrationDescriptor> ordered() {
        return ordered;
    }

    /** Identities in execution order. */
    public List<String> orderedIds() {
        List<String> ids = new ArrayList<>(ordered.size());
        for (MigrationDescriptor d : ordered) ids.add(d.id());
        return ids;
    }

    /** The full validated graph, including migrations outside a target's closure. */
    public DependencyGraph graph() {
        return graph;
    }

    public Optional<String> target() {
        return Optional.ofNullable(target);
    }

    public boolean isEmpty() {
        return ordered.isEmpty();
    }

    // ===== factory =====

    /**
     * Builds a plan covering every candidate.
     *
     * @throws GraphValidationException if the candidate set is invalid
     */
    public static MigrationPlan build(Collection<MigrationDescriptor> descriptors)
            throws GraphValidationException {
        DependencyGraph graph = DependencyGraph.build(descriptors);
        return new MigrationPlan(graph, List.copyOf(Scheduler.order(graph)), null);
    }

    /**
     * Builds a plan limited to a target and its transitive dependencies.
     *
     * @param descriptors the candidate set
     * @param target a migration identity or ordering key; null plans everything
     * @return the plan
     * @throws GraphValidationException if the candidate set is invalid
     * @throws UnknownMigrationException if the target matches no candidate
     */
    public static MigrationPlan build(Collection<MigrationDescriptor> descriptors, String target)
            throws GraphValidationException, UnknownMigrationException {

        if (target == null) {
            return build(descriptors);
        }

        DependencyGraph graph = DependencyGraph.build(descriptors);
        Set<String> roots = resolveTarget(graph, target);
        return new MigrationPlan(graph, List.copyOf(Scheduler.orderClosure(graph, roots)), target);
    }

    /**
     * Resolves a target to the identities it names.
     *
     * @throws UnknownMigrationException if nothing matches
     */
    public static Set<String> resolveTarget(DependencyGraph graph, String target)
            throws UnknownMigrationException {

        String wanted = target.strip();
        if (graph.contains(wanted)) {
            return Set.of(wanted);
        }

        Set<String> matches = new TreeSet<>();
        MigrationVersion version = tryParse(wanted);
        if (version != null) {
            for (MigrationDescriptor d : graph.descriptors()) {
                if (d.version().equals(version)) matches.add(d.id());
            }
        }
        if (matches.isEmpty()) {
            throw new UnknownMigrationException(
                    "Target '" + wanted + "' matches no discovered migration id or version", wanted);
        }
        return matches;
    }

    private static MigrationVersion tryParse(String text) {
        try {
            return MigrationVersion.parse(text);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
