package sequencer.registry;

import sequencer.Migration;
import sequencer.plan.MigrationDescriptor;

import java.util.List;
import java.util.Optional;

/**
 * A location migrations are discovered from.
 *
 * <p>A source never throws for a single bad unit: it reports a
 * {@link DiscoveryError} and carries on with the rest.
 *
 * @see AnnotationMigrationSource
 * @see StaticMigrationSource
 */
public interface MigrationSource {

    /** Short label used in logs. */
    String name();

    /**
     * Loads the migrations of this source.
     *
     * @return the loaded units and the load errors; duplicate identities are left to the registry
     */
    DiscoveryResult load();

    /**
     * Captures a loaded unit, recording a discovery error instead when its
     * identity, version or dependencies are invalid.
     */
    static Optional<MigrationDescriptor> describe(Migration migration, String source, List<DiscoveryError> errors) {
        try {
            return Optional.of(new MigrationDescriptor(migration, source));
        } catch (IllegalArgumentException e) {
            errors.add(new DiscoveryError(source, safeId(migration, source), e.getMessage(), e));
        } catch (RuntimeException e) {
            errors.add(new DiscoveryError(source, source, "failed to read identity: " + e, e));
        }
        return Optional.empty();
    }

    private static String safeId(Migration migration, String fallback) {
        try {
            String id = migration.id();
            return id == null || id.isBlank() ? fallback : id;
        } catch (RuntimeException e) {
            return fallback;
        }
    }
}
