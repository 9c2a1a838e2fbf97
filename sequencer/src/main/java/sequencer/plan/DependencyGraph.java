package sequencer.plan;

import sequencer.exceptions.CyclicDependencyException;
import sequencer.exceptions.GraphValidationException;
import sequencer.exceptions.UnresolvedDependencyException;

import java.util.*;

/**
 * Validated, immutable dependency graph over a candidate set.
 *
 * <p>Nodes are migration identities; an edge {@code A -> B} means "A requires B",
 * so B must be applied before A. {@link #build(Collection)} validates that:
 * <ul>
 *   <li>Identities are unique</li>
 *   <li>Every declared dependency resolves to a candidate</li>
 *   <li>There are no cycles</li>
 * </ul>
 * Validation is all-or-nothing: a graph instance is always valid.
 *
 * @see Scheduler
 */
public final class DependencyGraph {

    private final Map<String, MigrationDescriptor> nodes;
    private final Map<String, List<String>> dependencies;
    private final Map<String, SortedSet<String>> dependents;

    private DependencyGraph(
            Map<String, MigrationDescriptor> nodes,
            Map<String, List<String>> dependencies,
            Map<String, SortedSet<String>> dependents
    ) {
        this.nodes = nodes;
        this.dependencies = dependencies;
        this.dependents = dependents;
    }

    // ===== factory =====

    /**
     * Builds and validates the graph.
     *
     * <p>Checks run in a deterministic order (candidates by identity, dependencies
     * in declaration order) so the same invalid input always reports the same error.
     *
     * @param descriptors the candidate set
     * @return the validated graph
     * @throws UnresolvedDependencyException if a dependency names no candidate
     * @throws CyclicDependencyException if the dependencies form a cycle
     * @throws GraphValidationException if two candidates share an identity
     */
    public static DependencyGraph build(Collection<MigrationDescriptor> descriptors)
            throws GraphValidationException {

        Objects.requireNonNull(descriptors, "descriptors");

        Map<String, MigrationDescriptor> nodes = new TreeMap<>();
        for (MigrationDescriptor d : descriptors) {
            MigrationDescriptor previous = nodes.putIfAbsent(d.id(), d);
            if (previous != null) {
                throw new GraphValidationException(
                        "Duplicate migration id '" + d.id() + "' (" + previous.source() + ", " + d.source() + ")",
                        d.id());
            }
        }

        Map<String, List<String>> dependencies = new LinkedHashMap<>();
        Map<String, SortedSet<String>> dependents = new LinkedHashMap<>();
        for (String id : nodes.keySet()) {
            dependents.put(id, new TreeSet<>());
        }

        for (MigrationDescriptor d : nodes.values()) {
            for (String dep : d.dependencies()) {
                if (!nodes.containsKey(dep)) {
                    throw new UnresolvedDependencyException(d.id(), dep);
                }
                dependents.get(dep).add(d.id());
            }
            dependencies.put(d.id(), d.dependencies());
        }

        detectCycles(nodes.keySet(), dependencies);

        Map<String, SortedSet<String>> frozen = new LinkedHashMap<>();
        dependents.forEach((k, v) -> frozen.put(k, Collections.unmodifiableSortedSet(v)));

        return new DependencyGraph(
                Collections.unmodifiableMap(nodes),
                Collections.unmodifiableMap(dependencies),
                Collections.unmodifiableMap(frozen)
        );
    }

    // ===== validation =====

    private static void detectCycles(Set<String> ids, Map<String, List<String>> edges)
            throws CyclicDependencyException {

        Set<String> visited = new HashSet<>();
        for (String node : ids) {
            List<String> cycle = findCycle(node, edges, visited);
            if (cycle != null) {
                throw new CyclicDependencyException(cycle);
            }
        }
    }

    /**
     * Iterative depth-first search from {@code start} tracking the nodes on the
     * current path.
     *
     * @return the cycle path when one is found, otherwise null
     */
    private static List<String> findCycle(String start, Map<String, List<String>> edges, Set<String> visited) {
        if (!visited.add(start)) return null;

        Deque<String> path = new ArrayDeque<>();
        Set<String> onPath = new HashSet<>();
        Deque<Iterator<String>> frames = new ArrayDeque<>();
        path.addLast(start);
        onPath.add(start);
        frames.push(edges.getOrDefault(start, List.of()).iterator());

        while (!frames.isEmpty()) {
            Iterator<String> it = frames.peek();
            if (!it.hasNext()) {
                frames.pop();
                onPath.remove(path.removeLast());
                continue;
            }
            String next = it.next();
            if (onPath.contains(next)) {
                List<String> trail = new ArrayList<>(path);
                List<String> cycle = new ArrayList<>(trail.subList(trail.indexOf(next), trail.size()));
                cycle.add(next);
                return cycle;
            }
            if (visited.add(next)) {
                path.addLast(next);
                onPath.add(next);
                frames.push(edges.getOrDefault(next, List.of()).iterator());
            }
        }
        return null;
    }

    // ===== queries =====

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    /**
     * @return the descriptor for the identity, or null if it is not a node
     */
    public MigrationDescriptor descriptor(String id) {
        return nodes.get(id);
    }

    /** All nodes, ordered by identity. */
    public Collection<MigrationDescriptor> descriptors() {
        return nodes.values();
    }

    /** Direct dependencies of a node in declaration order. */
    public List<String> dependenciesOf(String id) {
        return dependencies.getOrDefault(id, List.of());
    }

    /** Nodes that directly require the given node, ordered by identity. */
    public SortedSet<String> dependentsOf(String id) {
        return dependents.getOrDefault(id, Collections.emptySortedSet());
    }

    public int size() {
        return nodes.size();
    }
}
