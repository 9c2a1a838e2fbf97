package sequencer.registry;

import sequencer.plan.MigrationDescriptor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Candidate set produced by discovery, with the errors of units that failed to load.
 *
 * @param candidates loaded migrations, ordered by identity
 * @param errors load failures, in discovery order
 */
public record DiscoveryResult(List<MigrationDescriptor> candidates, List<DiscoveryError> errors) {

    public DiscoveryResult {
        List<MigrationDescriptor> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparing(MigrationDescriptor::id));
        candidates = List.copyOf(sorted);
        errors = List.copyOf(errors);
    }

    public static DiscoveryResult empty() {
        return new DiscoveryResult(List.of(), List.of());
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /** Candidate identities, ordered. */
    public List<String> ids() {
        List<String> ids = new ArrayList<>(candidates.size());
        for (MigrationDescriptor d : candidates) ids.add(d.id());
        return ids;
    }
}
