package sequencer.scanner;

import sequencer.annotations.MigrationUnit;

import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ClasspathHelper;
import org.reflections.util.ConfigurationBuilder;
import org.reflections.util.FilterBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Scans packages and directories for classes annotated with {@link MigrationUnit}.
 *
 * <p>Uses the Reflections library. Two locations can be searched:
 * <ul>
 *   <li>packages already on the class path of a given class loader</li>
 *   <li>a directory of compiled classes, plus any jars directly inside it,
 *       loaded through a child {@link URLClassLoader}</li>
 * </ul>
 *
 * <h2>Usage:</h2>
 * <pre>
 * // Scan packages on the class path
 * AnnotationScanResult result = AnnotationScanner.scan(List.of("com.example.migrations"), null, null);
 *
 * // Scan a directory of compiled migrations
 * AnnotationScanResult result = AnnotationScanner.scan(List.of(), Path.of("migrations"), null);
 * </pre>
 *
 * @see AnnotationScanResult
 */
public final class AnnotationScanner {

    private static final Logger log = LoggerFactory.getLogger(AnnotationScanner.class);

    private AnnotationScanner() {}

    /**
     * Scans the given packages and directory.
     *
     * @param packages packages to scan; when empty, the whole directory is scanned
     * @param directory directory of classes and jars to scan, or null to skip
     * @param parent class loader for the packages and parent of the directory loader, or null for this class's loader
     * @return the names of annotated classes and the loader to load them with
     * @throws UncheckedIOException if the directory cannot be listed
     */
    public static AnnotationScanResult scan(List<String> packages, Path directory, ClassLoader parent) {
        ClassLoader base = parent != null ? parent : AnnotationScanner.class.getClassLoader();

        if (packages.isEmpty() && directory == null) {
            return new AnnotationScanResult(Collections.emptySortedSet(), base);
        }

        ConfigurationBuilder config = new ConfigurationBuilder()
                .setScanners(Scanners.TypesAnnotated);

        List<URL> urls = new ArrayList<>();
        ClassLoader loader = base;

        if (directory != null) {
            List<URL> dirUrls = directoryUrls(directory);
            loader = new URLClassLoader(dirUrls.toArray(new URL[0]), base);
            urls.addAll(dirUrls);
        }

        if (!packages.isEmpty()) {
            FilterBuilder filter = new FilterBuilder();
            for (String pkg : packages) {
                urls.addAll(ClasspathHelper.forPackage(pkg, loader));
                filter.includePackage(pkg);
            }
            config.filterInputsBy(filter);
        }

        if (urls.isEmpty()) {
            log.warn("No scannable locations found for packages {}", packages);
            return new AnnotationScanResult(Collections.emptySortedSet(), loader);
        }

        config.setUrls(urls);
        config.addClassLoaders(loader);

        Reflections reflections = new Reflections(config);
        SortedSet<String> names = new TreeSet<>(
                reflections.get(Scanners.TypesAnnotated.with(MigrationUnit.class)));
        names.remove(MigrationUnit.class.getName());

        log.debug("Found {} @MigrationUnit class(es) in packages={} directory={}",
                names.size(), packages, directory);
        return new AnnotationScanResult(Collections.unmodifiableSortedSet(names), loader);
    }

    private static List<URL> directoryUrls(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new UncheckedIOException(new IOException("Not a directory: " + directory));
        }
        List<URL> urls = new ArrayList<>();
        try {
            urls.add(directory.toUri().toURL());
            try (Stream<Path> entries = Files.list(directory)) {
                for (Path jar : entries.filter(p -> p.getFileName().toString().endsWith(".jar")).sorted().toList()) {
                    urls.add(jar.toUri().toURL());
                }
            }
        } catch (MalformedURLException e) {
            throw new IllegalArgumentException("Invalid discovery path: " + directory, e);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return urls;
    }
}
