package sequencer.registry;

import sequencer.Migration;
import sequencer.annotations.MigrationUnit;
import sequencer.plan.MigrationDescriptor;
import sequencer.scanner.AnnotationScanResult;
import sequencer.scanner.AnnotationScanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Discovers classes annotated with {@link MigrationUnit} and instantiates them.
 *
 * <p>Each annotated class must implement {@link Migration}, be concrete and
 * have an accessible no-arg constructor. Classes that fail any of these checks,
 * or fail to load at all, are reported as {@link DiscoveryError}s.
 *
 * @see AnnotationScanner
 */
public final class AnnotationMigrationSource implements MigrationSource {

    private static final Logger log = LoggerFactory.getLogger(AnnotationMigrationSource.class);

    private final List<String> packages;
    private final Path directory;
    private final ClassLoader parent;

    /**
     * @param packages packages to scan
     * @param directory directory of compiled migrations or jars, may be null
     * @param parent class loader to resolve packages with, may be null
     */
    public AnnotationMigrationSource(List<String> packages, Path directory, ClassLoader parent) {
        this.packages = List.copyOf(Objects.requireNonNull(packages, "packages"));
        this.directory = directory;
        this.parent = parent;
    }

    public AnnotationMigrationSource(String... packages) {
        this(List.of(packages), null, null);
    }

    @Override
    public String name() {
        return directory != null ? "annotations" + packages + "@" + directory : "annotations" + packages;
    }

    @Override
    public DiscoveryResult load() {
        List<DiscoveryError> errors = new ArrayList<>();
        AnnotationScanResult scan;
        try {
            scan = AnnotationScanner.scan(packages, directory, parent);
        } catch (UncheckedIOException | IllegalArgumentException e) {
            errors.add(new DiscoveryError(name(), null, "cannot scan: " + e.getMessage(), e));
            return new DiscoveryResult(List.of(), errors);
        }

        List<MigrationDescriptor> candidates = new ArrayList<>();
        for (String className : scan.classNames()) {
            Migration migration = instantiate(className, scan.classLoader(), errors);
            if (migration != null) {
                MigrationSource.describe(migration, className, errors).ifPresent(candidates::add);
            }
        }
        log.debug("Loaded {} migration(s) from {} ({} error(s))", candidates.size(), name(), errors.size());
        return new DiscoveryResult(candidates, errors);
    }

    private static Migration instantiate(String className, ClassLoader loader, List<DiscoveryError> errors) {
        Class<?> cls;
        try {
            cls = Class.forName(className, true, loader);
        } catch (ClassNotFoundException | LinkageError e) {
            errors.add(new DiscoveryError(className, className, "cannot load class: " + e, e));
            return null;
        }

        if (!cls.isAnnotationPresent(MigrationUnit.class) || cls.isAnnotation()) {
            return null;
        }
        if (!Migration.class.isAssignableFrom(cls)) {
            errors.add(new DiscoveryError(className, className,
                    "annotated with @MigrationUnit but does not implement " + Migration.class.getName()));
            return null;
        }
        if (cls.isInterface() || Modifier.isAbstract(cls.getModifiers())) {
            errors.add(new DiscoveryError(className, className, "is abstract"));
            return null;
        }

        try {
            return (Migration) cls.getDeclaredConstructor().newInstance();
        } catch (NoSuchMethodException e) {
            errors.add(new DiscoveryError(className, className, "no no-arg constructor", e));
        } catch (InvocationTargetException e) {
            errors.add(new DiscoveryError(className, className,
                    "constructor threw " + e.getCause(), e.getCause()));
        } catch (ReflectiveOperationException | LinkageError e) {
            errors.add(new DiscoveryError(className, className, "cannot instantiate: " + e, e));
        }
        return null;
    }
}
