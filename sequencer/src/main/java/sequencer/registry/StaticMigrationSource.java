package sequencer.registry;

import sequencer.Migration;
import sequencer.plan.MigrationDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Serves migration instances supplied programmatically.
 */
public final class StaticMigrationSource implements MigrationSource {

    private final List<Migration> migrations;

    public StaticMigrationSource(List<? extends Migration> migrations) {
        this.migrations = List.copyOf(Objects.requireNonNull(migrations, "migrations"));
    }

    public static StaticMigrationSource of(Migration... migrations) {
        return new StaticMigrationSource(List.of(migrations));
    }

    @Override
    public String name() {
        return "static";
    }

    @Override
    public DiscoveryResult load() {
        List<DiscoveryError> errors = new ArrayList<>();
        List<MigrationDescriptor> candidates = new ArrayList<>();
        for (Migration m : migrations) {
            MigrationSource.describe(m, m.getClass().getName(), errors).ifPresent(candidates::add);
        }
        return new DiscoveryResult(candidates, errors);
    }
}
