package sequencer.registry;

import sequencer.exceptions.DiscoveryException;
import sequencer.plan.MigrationDescriptor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Merges the migrations of all sources into one candidate set.
 *
 * <p>Besides the load errors reported by each source, the registry rejects
 * duplicate identities: candidates are visited in source order (class name,
 * then supply order) and any later unit reusing an identity is excluded with
 * a {@link DiscoveryError}. In strict mode any error fails discovery.
 */
public final class MigrationRegistry {

    private static final Logger log = LoggerFactory.getLogger(MigrationRegistry.class);

    private final List<MigrationSource> sources;
    private final boolean strict;

    public MigrationRegistry(List<? extends MigrationSource> sources, boolean strict) {
        this.sources = List.copyOf(Objects.requireNonNull(sources, "sources"));
        this.strict = strict;
    }

    public MigrationRegistry(MigrationSource source) {
        this(List.of(source), false);
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * Loads every source.
     *
     * @return candidates ordered by identity, plus load errors
     * @throws DiscoveryException in strict mode, if any unit failed to load
     */
    public DiscoveryResult discover() throws DiscoveryException {
        List<MigrationDescriptor> loaded = new ArrayList<>();
        List<DiscoveryError> errors = new ArrayList<>();
        for (MigrationSource source : sources) {
            DiscoveryResult result = source.load();
            loaded.addAll(result.candidates());
            errors.addAll(result.errors());
        }

        loaded.sort(Comparator.comparing(MigrationDescriptor::source));
        Map<String, MigrationDescriptor> byId = new HashMap<>();
        List<MigrationDescriptor> candidates = new ArrayList<>();
        for (MigrationDescriptor d : loaded) {
            MigrationDescriptor first = byId.putIfAbsent(d.id(), d);
            if (first == null) {
                candidates.add(d);
            } else {
                errors.add(new DiscoveryError(d.source(), d.id(),
                        "duplicate migration id, already defined by " + first.source()));
            }
        }

        for (DiscoveryError e : errors) {
            log.warn("Skipping migration {}", e.describe());
        }
        if (strict && !errors.isEmpty()) {
            throw new DiscoveryException(errors);
        }

        log.info("Discovered {} migration(s), {} error(s)", candidates.size(), errors.size());
        return new DiscoveryResult(candidates, errors);
    }
}
