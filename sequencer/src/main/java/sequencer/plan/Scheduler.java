package sequencer.plan;

import java.util.*;

/**
 * Derives a deterministic execution order from a validated {@link DependencyGraph}.
 *
 * <p>Uses Kahn's algorithm: nodes whose dependencies have all been emitted
 * become eligible, and among eligible nodes the one with the lowest ordering
 * key is emitted first, identity breaking ties
 * ({@link MigrationDescriptor#SCHEDULE_ORDER}). The same candidate set therefore
 * always yields the same order, so a dry run and the real run agree.
 */
public final class Scheduler {

    private Scheduler() {}

    /**
     * Orders every node of the graph.
     *
     * @param graph the validated graph
     * @return descriptors in execution order (dependencies first)
     */
    public static List<MigrationDescriptor> order(DependencyGraph graph) {
        return order(graph, new HashSet<>(graphIds(graph)));
    }

    /**
     * Orders only the given targets and everything they transitively require.
     *
     * @param graph the validated graph
     * @param targets identities to include; each must be a node of the graph
     * @return descriptors of the closure in execution order
     * @throws IllegalArgumentException if a target is not a node
     */
    public static List<MigrationDescriptor> orderClosure(DependencyGraph graph, Collection<String> targets) {
        return order(graph, closure(graph, targets));
    }

    /**
     * Computes the targets plus all of their transitive dependencies.
     *
     * @throws IllegalArgumentException if a target is not a node
     */
    public static Set<String> closure(DependencyGraph graph, Collection<String> targets) {
        Set<String> result = new TreeSet<>();
        Deque<String> work = new ArrayDeque<>();
        for (String target : targets) {
            if (!graph.contains(target)) {
                throw new IllegalArgumentException("Not a migration of this graph: " + target);
            }
            work.push(target);
        }
        while (!work.isEmpty()) {
            String id = work.pop();
            if (result.add(id)) {
                graph.dependenciesOf(id).forEach(work::push);
            }
        }
        return result;
    }

    private static List<MigrationDescriptor> order(DependencyGraph graph, Set<String> include) {
        Map<String, Integer> remaining = new HashMap<>();
        PriorityQueue<MigrationDescriptor> ready = new PriorityQueue<>(MigrationDescriptor.SCHEDULE_ORDER);

        for (String id : include) {
            int inDegree = 0;
            for (String dep : graph.dependenciesOf(id)) {
                if (include.contains(dep)) inDegree++;
            }
            remaining.put(id, inDegree);
            if (inDegree == 0) ready.add(graph.descriptor(id));
        }

        List<MigrationDescriptor> result = new ArrayList<>(include.size());
        while (!ready.isEmpty()) {
            MigrationDescriptor next = ready.poll();
            result.add(next);
            for (String dependent : graph.dependentsOf(next.id())) {
                Integer left = remaining.get(dependent);
                if (left == null) continue;
                remaining.put(dependent, left - 1);
                if (left - 1 == 0) ready.add(graph.descriptor(dependent));
            }
        }

        if (result.size() != include.size()) {
            // unreachable for a validated graph
            throw new IllegalStateException("Graph is not acyclic: scheduled "
                    + result.size() + " of " + include.size() + " migrations");
        }
        return result;
    }

    private static Collection<String> graphIds(DependencyGraph graph) {
        List<String> ids = new ArrayList<>();
        for (MigrationDescriptor d : graph.descriptors()) ids.add(d.id());
        return ids;
    }
}
