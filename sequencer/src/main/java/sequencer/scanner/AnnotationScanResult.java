package sequencer.scanner;

import java.util.SortedSet;

/**
 * Immutable result of scanning for {@link sequencer.annotations.MigrationUnit} classes.
 *
 * <p>Holds class names rather than classes so that the caller decides how load
 * failures are reported; {@link #classLoader()} is the loader able to resolve them.
 *
 * @see AnnotationScanner
 */
public final class AnnotationScanResult {

    private final SortedSet<String> classNames;
    private final ClassLoader classLoader;

    public AnnotationScanResult(SortedSet<String> classNames, ClassLoader classLoader) {
        this.classNames = classNames;
        this.classLoader = classLoader;
    }

    /** Names of annotated classes, in class-name order. */
    public SortedSet<String> classNames() { return classNames; }

    /** The loader to load the discovered classes with. */
    public ClassLoader classLoader() { return classLoader; }

    public boolean isEmpty() { return classNames.isEmpty(); }
}
