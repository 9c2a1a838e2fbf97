package sequencer.state;

import sequencer.exceptions.StateStoreException;
import sequencer.state.ExecutionRecord.Status;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link StateStore} persisted as a YAML ledger file.
 *
 * <h2>File format:</h2>
 * <pre>
 * format: 1
 * history:
 * - migration: add-src-layout
 *   version: '0.1'
 *   status: APPLIED
 *   timestamp: '2024-03-01T10:15:30Z'
 *   commit: 3f2a9c1e...
 *   message: moved sources
 *   metadata: {}
 * </pre>
 *
 * <p>Every append first re-reads the file, keeping records written by another
 * store on the same file, then rewrites it through a temporary sibling
 * followed by an atomic move, so a crash never leaves a truncated ledger
 * behind. Only APPLIED and REVERTED records are written.
 */
public final class FileStateStore extends AbstractStateStore {

    private static final Logger log = LoggerFactory.getLogger(FileStateStore.class);

    public static final String FILE_NAME = "state.yml";
    static final int FORMAT = 1;

    private final Path file;

    /**
     * Opens the ledger, reading existing history if the file exists.
     *
     * @param file the ledger file; its parent directory is created on first write
     * @throws StateStoreException if an existing file cannot be read or parsed
     */
    public FileStateStore(Path file) throws StateStoreException {
        this.file = file.toAbsolutePath().normalize();
        restore(read(this.file));
    }

    /**
     * Opens the ledger in the conventional location under a working root.
     *
     * @param workingRoot the codebase root
     * @param stateDir state directory relative to the root
     */
    public static FileStateStore open(Path workingRoot, String stateDir) throws StateStoreException {
        return new FileStateStore(workingRoot.resolve(stateDir).resolve(FILE_NAME));
    }

    public Path file() {
        return file;
    }

    // ===== persistence =====

    @Override
    protected List<ExecutionRecord> reload() throws StateStoreException {
        return read(file);
    }

    @Override
    protected void persist(List<ExecutionRecord> history) throws StateStoreException {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("format", FORMAT);
        List<Map<String, Object>> entries = new ArrayList<>();
        for (ExecutionRecord r : history) {
            if (r.status() == Status.APPLIED || r.status() == Status.REVERTED) {
                entries.add(toMap(r));
            }
        }
        root.put("history", entries);

        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        try {
            ensureStateDirectory(file.getParent());
            try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
                dumper().dump(root, w);
            }
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Wrote {} ledger entries to {}", entries.size(), file);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw new StateStoreException("Failed to write migration state to " + file, e);
        }
    }

    /**
     * Creates the state directory with a {@code .gitignore} so the ledger and
     * lock file never show up as changes of the working tree.
     */
    static void ensureStateDirectory(Path dir) throws IOException {
        Files.createDirectories(dir);
        Path ignore = dir.resolve(".gitignore");
        if (!Files.exists(ignore)) {
            Files.writeString(ignore, "*\n", StandardCharsets.UTF_8);
        }
    }

    private static List<ExecutionRecord> read(Path file) throws StateStoreException {
        if (!Files.exists(file)) {
            return List.of();
        }
        Object root;
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(r);
        } catch (IOException | YAMLException e) {
            throw new StateStoreException("Failed to read migration state from " + file, e);
        }
        if (root == null) {
            return List.of();
        }
        if (!(root instanceof Map<?, ?> map)) {
            throw new StateStoreException("Malformed migration state in " + file + ": expected a mapping", null);
        }
        Object history = map.get("history");
        if (history == null) {
            return List.of();
        }
        if (!(history instanceof List<?> entries)) {
            throw new StateStoreException("Malformed migration state in " + file + ": 'history' is not a list", null);
        }

        List<ExecutionRecord> records = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            try {
                records.add(fromMap(entries.get(i)));
            } catch (IllegalArgumentException | NullPointerException | DateTimeException e) {
                throw new StateStoreException("Malformed ledger entry #" + i + " in " + file + ": " + e.getMessage(), e);
            }
        }
        log.debug("Read {} ledger entries from {}", records.size(), file);
        return records;
    }

    // ===== mapping =====

    private static Map<String, Object> toMap(ExecutionRecord r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("migration", r.migrationId());
        if (r.version() != null) m.put("version", r.version());
        m.put("status", r.status().name());
        m.put("timestamp", r.timestamp().toString());
        if (r.commitRef() != null) m.put("commit", r.commitRef());
        m.put("message", r.message());
        m.put("metadata", new LinkedHashMap<>(r.metadata()));
        return m;
    }

    private static ExecutionRecord fromMap(Object entry) {
        if (!(entry instanceof Map<?, ?> m)) {
            throw new IllegalArgumentException("expected a mapping");
        }
        Object id = m.get("migration");
        if (id == null) {
            throw new IllegalArgumentException("missing 'migration'");
        }
        Status status = Status.valueOf(String.valueOf(m.get("status")));
        if (status != Status.APPLIED && status != Status.REVERTED) {
            throw new IllegalArgumentException("unexpected status " + status);
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        if (m.get("metadata") instanceof Map<?, ?> meta) {
            meta.forEach((k, v) -> metadata.put(String.valueOf(k), String.valueOf(v)));
        }

        return new ExecutionRecord(
                String.valueOf(id),
                stringOrNull(m.get("version")),
                status,
                toInstant(m.get("timestamp")),
                stringOrNull(m.get("commit")),
                stringOrNull(m.get("message")),
                metadata
        );
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Date d) {
            return d.toInstant();
        }
        if (value == null) {
            throw new IllegalArgumentException("missing 'timestamp'");
        }
        return Instant.parse(value.toString());
    }

    private static String stringOrNull(Object value) {
        return value != null ? value.toString() : null;
    }

    private static Yaml dumper() {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndicatorIndent(0);
        options.setWidth(120);
        return new Yaml(options);
    }
}
