package sequencer.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;

/**
 * Loads sequencer configuration from properties or YAML files.
 *
 * <p>Configuration is searched in the following order:
 * <ol>
 *   <li>{@code sequencer.properties} on the classpath</li>
 *   <li>{@code sequencer.yml} on the classpath</li>
 * </ol>
 *
 * <p>System properties override file-based values, using the same keys
 * (e.g., {@code -Dsequencer.vcs.backend=MEMORY}). Invalid values are logged
 * and the default is kept.
 *
 * <h2>Configuration Properties:</h2>
 * <ul>
 *   <li>{@code sequencer.state.dir} - state directory under the working root</li>
 *   <li>{@code sequencer.discovery.packages} - comma-separated packages to scan</li>
 *   <li>{@code sequencer.discovery.path} - directory of compiled migrations or jars</li>
 *   <li>{@code sequencer.discovery.strict} - true to abort on the first bad migration</li>
 *   <li>{@code sequencer.vcs.backend} - GIT or MEMORY</li>
 *   <li>{@code sequencer.vcs.git.executable} - git binary</li>
 *   <li>{@code sequencer.vcs.timeout} - seconds per VCS invocation</li>
 *   <li>{@code sequencer.vcs.author.name}, {@code sequencer.vcs.author.email} - commit identity</li>
 *   <li>{@code sequencer.vcs.tag.commits}, {@code sequencer.vcs.tag.prefix} - commit tagging</li>
 *   <li>{@code sequencer.commit.message.prefix} - commit message prefix</li>
 *   <li>{@code sequencer.alert.level} - DEBUG, WARNING, or ERROR</li>
 * </ul>
 *
 * @see SequencerConfig
 */
public final class SequencerConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(SequencerConfigLoader.class);

    static final String PROPERTIES_FILE = "sequencer.properties";
    static final String YAML_FILE = "sequencer.yml";

    private SequencerConfigLoader() {}

    /**
     * Load from classpath (sequencer.properties or sequencer.yml).
     * @throws SequencerConfigException if no config file found
     */
    public static SequencerConfig load() {
        return loadFromClasspath().orElseThrow(() -> new SequencerConfigException(
                "Config file required: " + PROPERTIES_FILE + " or " + YAML_FILE));
    }

    /**
     * Load from classpath, falling back to defaults (plus system property
     * overrides) when no config file is present.
     */
    public static SequencerConfig loadOrDefaults() {
        return loadFromClasspath().orElseGet(() -> parse(new Properties()));
    }

    /**
     * Loads configuration from an external file.
     *
     * @param path path to the configuration file (.properties or .yml/.yaml)
     * @return the loaded configuration
     * @throws IOException if the file cannot be read
     * @throws SequencerConfigException if the file cannot be parsed
     */
    public static SequencerConfig loadFromFile(Path path) throws IOException {
        String name = path.getFileName().toString();
        try (InputStream is = Files.newInputStream(path)) {
            if (name.endsWith(".yml") || name.endsWith(".yaml")) {
                return loadYaml(is, name);
            }
            return loadProperties(is, name);
        }
    }

    public static SequencerConfig loadFromFile(String path) throws IOException {
        return loadFromFile(Path.of(path));
    }

    private static Optional<SequencerConfig> loadFromClasspath() {
        try (InputStream is = getResource(PROPERTIES_FILE)) {
            if (is != null) {
                return Optional.of(loadProperties(is, PROPERTIES_FILE));
            }
        } catch (IOException e) {
            throw new SequencerConfigException("Failed to read " + PROPERTIES_FILE, e);
        }
        try (InputStream is = getResource(YAML_FILE)) {
            if (is != null) {
                return Optional.of(loadYaml(is, YAML_FILE));
            }
        } catch (IOException e) {
            throw new SequencerConfigException("Failed to read " + YAML_FILE, e);
        }
        return Optional.empty();
    }

    private static InputStream getResource(String name) {
        return SequencerConfigLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static SequencerConfig loadProperties(InputStream is, String source) {
        try {
            Properties props = new Properties();
            props.load(is);
            log.info("Loaded config from {}", source);
            return parse(props);
        } catch (IOException e) {
            throw new SequencerConfigException("Failed to load " + source, e);
        }
    }

    private static SequencerConfig loadYaml(InputStream is, String source) {
        Object root;
        try {
            root = new Yaml().load(is);
        } catch (YAMLException e) {
            throw new SequencerConfigException("Failed to parse " + source, e);
        }
        Properties props = new Properties();
        if (root instanceof Map) {
            flatten("", castMap(root), props);
        } else if (root != null) {
            throw new SequencerConfigException(source + " must contain a mapping");
        }
        log.info("Loaded config from {}", source);
        return parse(props);
    }

    private static void flatten(String prefix, Map<String, Object> map, Properties props) {
        for (var entry : map.entrySet()) {
            String key = prefix.isEmpty() ? String.valueOf(entry.getKey()) : prefix + "." + entry.getKey();
            Object val = entry.getValue();
            if (val instanceof Map) {
                flatten(key, castMap(val), props);
            } else if (val instanceof List<?> list) {
                List<String> parts = new ArrayList<>();
                for (Object item : list) parts.add(String.valueOf(item));
                props.setProperty(key, String.join(",", parts));
            } else if (val != null) {
                props.setProperty(key, val.toString());
            }
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> castMap(Object value) {
        return (Map<String, Object>) value;
    }

    static SequencerConfig parse(Properties props) {
        SequencerConfig.Builder b = SequencerConfig.builder();

        getString(props, "sequencer.state.dir").ifPresent(v -> {
            try {
                b.stateDir(v);
            } catch (SequencerConfigException e) {
                log.warn("Invalid state.dir: {}", v);
            }
        });

        getString(props, "sequencer.discovery.packages").ifPresent(v -> {
            List<String> packages = new ArrayList<>();
            for (String p : v.split(",")) {
                if (!p.isBlank()) packages.add(p.strip());
            }
            b.discoveryPackages(packages);
        });
        getString(props, "sequencer.discovery.path")
                .filter(v -> !v.isEmpty())
                .ifPresent(v -> b.discoveryPath(Path.of(v)));
        getBoolean(props, "sequencer.discovery.strict").ifPresent(b::strictDiscovery);

        getString(props, "sequencer.vcs.backend").ifPresent(v -> {
            try {
                b.vcsBackend(VcsBackend.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid vcs.backend: {}", v);
            }
        });
        getString(props, "sequencer.vcs.git.executable")
                .filter(v -> !v.isEmpty())
                .ifPresent(b::gitExecutable);
        getLong(props, "sequencer.vcs.timeout").ifPresent(v -> {
            if (v > 0) {
                b.vcsTimeoutSeconds(v);
            } else {
                log.warn("Invalid vcs.timeout: {}", v);
            }
        });
        getString(props, "sequencer.vcs.author.name").ifPresent(b::authorName);
        getString(props, "sequencer.vcs.author.email").ifPresent(b::authorEmail);
        getBoolean(props, "sequencer.vcs.tag.commits").ifPresent(b::tagCommits);
        getString(props, "sequencer.vcs.tag.prefix").ifPresent(b::tagPrefix);
        getString(props, "sequencer.commit.message.prefix").ifPresent(b::commitMessagePrefix);

        getString(props, "sequencer.alert.level").ifPresent(v -> {
            try {
                b.alertLevel(AlertLevel.valueOf(v.toUpperCase()));
            } catch (IllegalArgumentException e) {
                log.warn("Invalid alert.level: {}", v);
            }
        });

        return b.build();
    }

    private static Optional<String> getString(Properties props, String key) {
        String val = System.getProperty(key);
        if (val == null) val = props.getProperty(key);
        return val != null ? Optional.of(val.trim()) : Optional.empty();
    }

    private static Optional<Long> getLong(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            try {
                return Optional.of(Long.parseLong(v));
            } catch (NumberFormatException e) {
                log.warn("Invalid number for {}: {}", key, v);
                return Optional.empty();
            }
        });
    }

    private static Optional<Boolean> getBoolean(Properties props, String key) {
        return getString(props, key).flatMap(v -> {
            if ("true".equalsIgnoreCase(v) || "false".equalsIgnoreCase(v)) {
                return Optional.of(Boolean.parseBoolean(v));
            }
            log.warn("Invalid boolean for {}: {}", key, v);
            return Optional.empty();
        });
    }
}
