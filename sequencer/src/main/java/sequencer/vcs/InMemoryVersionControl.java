package sequencer.vcs;

import sequencer.exceptions.VersionControlException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * {@link VersionControl} that keeps content snapshots of the working root in memory.
 *
 * <p>Mimics the commit/reset semantics of a real repository without invoking a
 * version-control tool: a commit records the current content of the given
 * paths on top of the head snapshot, and a reset rewrites the working root to
 * match a snapshot, deleting files the snapshot does not contain. The content
 * present at construction becomes the initial commit.
 *
 * <p>Supports failure injection through {@link #failNextCommit(String)} and
 * {@link #failNextReset(String)}.
 */
public final class InMemoryVersionControl implements VersionControl {

    /** One recorded commit. */
    public record Commit(String ref, String parent, String message, List<String> paths) {}

    private final Path root;
    private final Set<String> excludes;

    private final Map<String, Map<String, byte[]>> snapshots = new HashMap<>();
    private final Map<String, String> tags = new LinkedHashMap<>();
    private final List<Commit> log = new ArrayList<>();
    private int sequence;
    private String head;

    private String commitFailure;
    private String resetFailure;

    /**
     * @param root the working root
     * @param excludes top-level directory names never snapshotted, changed or reset (e.g. the state directory)
     */
    public InMemoryVersionControl(Path root, Set<String> excludes) {
        this.root = root.toAbsolutePath().normalize();
        this.excludes = Set.copyOf(excludes);
        Map<String, byte[]> initial = scan();
        this.head = nextRef();
        snapshots.put(head, initial);
        log.add(new Commit(head, null, "initial", List.copyOf(initial.keySet())));
    }

    public InMemoryVersionControl(Path root) {
        this(root, Set.of());
    }

    // ===== VersionControl =====

    @Override
    public synchronized List<String> changedPaths() throws VersionControlException {
        Map<String, byte[]> current = scanChecked();
        Map<String, byte[]> committed = snapshots.get(head);

        TreeSet<String> changed = new TreeSet<>();
        for (var e : current.entrySet()) {
            byte[] before = committed.get(e.getKey());
            if (before == null || !Arrays.equals(before, e.getValue())) {
                changed.add(e.getKey());
            }
        }
        for (String path : committed.keySet()) {
            if (!current.containsKey(path)) changed.add(path);
        }
        return List.copyOf(changed);
    }

    @Override
    public synchronized String head() {
        return head;
    }

    @Override
    public synchronized String commit(List<String> paths, String message) throws VersionControlException {
        if (commitFailure != null) {
            String reason = commitFailure;
            commitFailure = null;
            throw new VersionControlException("Injected commit failure: " + reason);
        }
        Map<String, byte[]> next = new TreeMap<>(snapshots.get(head));
        try {
            for (String path : paths) {
                Path file = resolve(path);
                if (Files.isRegularFile(file)) {
                    next.put(path, Files.readAllBytes(file));
                } else {
                    next.remove(path);
                }
            }
        } catch (IOException e) {
            throw new VersionControlException("Failed to read working tree for commit", e);
        }
        String ref = nextRef();
        snapshots.put(ref, next);
        log.add(new Commit(ref, head, message, List.copyOf(paths)));
        head = ref;
        return ref;
    }

    @Override
    public synchronized void reset(String ref) throws VersionControlException {
        if (resetFailure != null) {
            String reason = resetFailure;
            resetFailure = null;
            throw new VersionControlException("Injected reset failure: " + reason);
        }
        Map<String, byte[]> target = snapshots.get(ref);
        if (target == null) {
            throw new VersionControlException("Unknown commit: " + ref);
        }
        try {
            Map<String, byte[]> current = scan();
            for (String path : current.keySet()) {
                if (!target.containsKey(path)) {
                    Files.delete(resolve(path));
                }
            }
            for (var e : target.entrySet()) {
                byte[] present = current.get(e.getKey());
                if (present == null || !Arrays.equals(present, e.getValue())) {
                    Path file = resolve(e.getKey());
                    Files.createDirectories(file.getParent());
                    Files.write(file, e.getValue());
                }
            }
            pruneEmptyDirectories();
        } catch (IOException | UncheckedIOException e) {
            throw new VersionControlException("Failed to reset working tree to " + ref, e);
        }
        head = ref;
    }

    @Override
    public synchronized void tag(String ref, String name) throws VersionControlException {
        if (!snapshots.containsKey(ref)) {
            throw new VersionControlException("Unknown commit: " + ref);
        }
        tags.put(name, ref);
    }

    // ===== inspection and failure injection =====

    /** Commits in creation order, starting with the initial snapshot. */
    public synchronized List<Commit> log() {
        return List.copyOf(log);
    }

    public synchronized Map<String, String> tags() {
        return Map.copyOf(tags);
    }

    /** Makes the next {@link #commit} throw. */
    public synchronized InMemoryVersionControl failNextCommit(String reason) {
        this.commitFailure = reason;
        return this;
    }

    /** Makes the next {@link #reset} throw. */
    public synchronized InMemoryVersionControl failNextReset(String reason) {
        this.resetFailure = reason;
        return this;
    }

    // ===== internals =====

    private String nextRef() {
        return String.format("mem-%04d", sequence++);
    }

    private Path resolve(String relative) {
        return root.resolve(relative).normalize();
    }

    private Map<String, byte[]> scanChecked() throws VersionControlException {
        try {
            return scan();
        } catch (UncheckedIOException e) {
            throw new VersionControlException("Failed to scan working tree", e.getCause());
        }
    }

    private Map<String, byte[]> scan() {
        Map<String, byte[]> content = new TreeMap<>();
        if (!Files.isDirectory(root)) {
            return content;
        }
        try (Stream<Path> files = Files.walk(root)) {
            files.filter(Files::isRegularFile)
                    .filter(p -> !isExcluded(p))
                    .forEach(p -> content.put(relative(p), readUnchecked(p)));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return content;
    }

    private void pruneEmptyDirectories() throws IOException {
        List<Path> dirs;
        try (Stream<Path> walk = Files.walk(root)) {
            dirs = walk.filter(Files::isDirectory)
                    .filter(p -> !p.equals(root) && !isExcluded(p))
                    .sorted(Comparator.reverseOrder())
                    .toList();
        }
        for (Path dir : dirs) {
            try (Stream<Path> entries = Files.list(dir)) {
                if (entries.findAny().isEmpty()) {
                    Files.delete(dir);
                }
            }
        }
    }

    private boolean isExcluded(Path p) {
        Path rel = root.relativize(p);
        return rel.getNameCount() > 0 && excludes.contains(rel.getName(0).toString());
    }

    private String relative(Path p) {
        return root.relativize(p).toString().replace('\\', '/');
    }

    private static byte[] readUnchecked(Path p) {
        try {
            return Files.readAllBytes(p);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
