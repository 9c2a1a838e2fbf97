package sequencer.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Central configuration for the migration sequencer.
 *
 * <p>Encapsulates:
 * <ul>
 *   <li>Where run state lives under the working root</li>
 *   <li>Which packages and directory are searched for migrations</li>
 *   <li>The version-control backend and how commits are made</li>
 *   <li>The alert level of the structured event log</li>
 * </ul>
 *
 * <p>Configuration can be loaded from {@code sequencer.properties} or
 * {@code sequencer.yml} using {@link SequencerConfigLoader}.
 */
public final class SequencerConfig {

    public static final SequencerConfig DEFAULTS = builder().build();

    private final String stateDir;
    private final List<String> discoveryPackages;
    private final Path discoveryPath;
    private final boolean strictDiscovery;
    private final VcsBackend vcsBackend;
    private final String gitExecutable;
    private final Duration vcsTimeout;
    private final String authorName;
    private final String authorEmail;
    private final boolean tagCommits;
    private final String tagPrefix;
    private final String commitMessagePrefix;
    private final AlertLevel alertLevel;

    private SequencerConfig(Builder b) {
        this.stateDir = b.stateDir;
        this.discoveryPackages = List.copyOf(b.discoveryPackages);
        this.discoveryPath = b.discoveryPath;
        this.strictDiscovery = b.strictDiscovery;
        this.vcsBackend = b.vcsBackend;
        this.gitExecutable = b.gitExecutable;
        this.vcsTimeout = b.vcsTimeout;
        this.authorName = b.authorName;
        this.authorEmail = b.authorEmail;
        this.tagCommits = b.tagCommits;
        this.tagPrefix = b.tagPrefix;
        this.commitMessagePrefix = b.commitMessagePrefix;
        this.alertLevel = b.alertLevel;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** State directory, relative to the working root. Excluded from cleanliness checks. */
    public String stateDir() { return stateDir; }

    /** Packages scanned for {@code @MigrationUnit} classes. */
    public List<String> discoveryPackages() { return discoveryPackages; }

    /** Directory of compiled migration classes or jars, if configured. */
    public Optional<Path> discoveryPath() { return Optional.ofNullable(discoveryPath); }

    /** Whether one bad migration aborts discovery. */
    public boolean strictDiscovery() { return strictDiscovery; }

    public VcsBackend vcsBackend() { return vcsBackend; }

    public String gitExecutable() { return gitExecutable; }

    /** Upper bound for a single version-control invocation. */
    public Duration vcsTimeout() { return vcsTimeout; }

    public Optional<String> authorName() { return Optional.ofNullable(authorName); }

    public Optional<String> authorEmail() { return Optional.ofNullable(authorEmail); }

    public boolean tagCommits() { return tagCommits; }

    public String tagPrefix() { return tagPrefix; }

    public String commitMessagePrefix() { return commitMessagePrefix; }

    public AlertLevel alertLevel() { return alertLevel; }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.stateDir = stateDir;
        b.discoveryPackages = discoveryPackages;
        b.discoveryPath = discoveryPath;
        b.strictDiscovery = strictDiscovery;
        b.vcsBackend = vcsBackend;
        b.gitExecutable = gitExecutable;
        b.vcsTimeout = vcsTimeout;
        b.authorName = authorName;
        b.authorEmail = authorEmail;
        b.tagCommits = tagCommits;
        b.tagPrefix = tagPrefix;
        b.commitMessagePrefix = commitMessagePrefix;
        b.alertLevel = alertLevel;
        return b;
    }

    @Override
    public String toString() {
        return "SequencerConfig{stateDir=" + stateDir
                + ", discoveryPackages=" + discoveryPackages
                + ", discoveryPath=" + discoveryPath
                + ", strictDiscovery=" + strictDiscovery
                + ", vcsBackend=" + vcsBackend
                + ", vcsTimeout=" + vcsTimeout.toSeconds() + "s"
                + ", tagCommits=" + tagCommits
                + ", alertLevel=" + alertLevel + "}";
    }

    /**
     * Builder for {@link SequencerConfig}. Unset values keep their defaults.
     */
    public static final class Builder {
        private String stateDir = ".sequencer";
        private List<String> discoveryPackages = List.of();
        private Path discoveryPath;
        private boolean strictDiscovery = false;
        private VcsBackend vcsBackend = VcsBackend.GIT;
        private String gitExecutable = "git";
        private Duration vcsTimeout = Duration.ofSeconds(60);
        private String authorName;
        private String authorEmail;
        private boolean tagCommits = false;
        private String tagPrefix = "migration/";
        private String commitMessagePrefix = "[migration]";
        private AlertLevel alertLevel = AlertLevel.WARNING;

        private Builder() {}

        public Builder stateDir(String dir) {
            if (dir == null || dir.isBlank()) {
                throw new SequencerConfigException("State directory must not be blank");
            }
            Path p = Path.of(dir.strip()).normalize();
            if (p.isAbsolute() || p.startsWith("..") || p.toString().isEmpty()) {
                throw new SequencerConfigException("State directory must be relative to the working root: " + dir);
            }
            this.stateDir = p.toString().replace('\\', '/');
            return this;
        }

        public Builder discoveryPackages(List<String> packages) {
            this.discoveryPackages = List.copyOf(Objects.requireNonNull(packages, "packages"));
            return this;
        }

        public Builder discoveryPath(Path path) {
            this.discoveryPath = path;
            return this;
        }

        public Builder strictDiscovery(boolean strict) {
            this.strictDiscovery = strict;
            return this;
        }

        public Builder vcsBackend(VcsBackend backend) {
            this.vcsBackend = Objects.requireNonNull(backend, "backend");
            return this;
        }

        public Builder gitExecutable(String executable) {
            this.gitExecutable = Objects.requireNonNull(executable, "executable");
            return this;
        }

        public Builder vcsTimeoutSeconds(long seconds) {
            if (seconds <= 0) {
                throw new SequencerConfigException("VCS timeout must be positive: " + seconds);
            }
            this.vcsTimeout = Duration.ofSeconds(seconds);
            return this;
        }

        public Builder authorName(String name) {
            this.authorName = name;
            return this;
        }

        public Builder authorEmail(String email) {
            this.authorEmail = email;
            return this;
        }

        public Builder tagCommits(boolean tag) {
            this.tagCommits = tag;
            return this;
        }

        public Builder tagPrefix(String prefix) {
            this.tagPrefix = Objects.requireNonNull(prefix, "prefix");
            return this;
        }

        public Builder commitMessagePrefix(String prefix) {
            this.commitMessagePrefix = Objects.requireNonNull(prefix, "prefix");
            return this;
        }

        public Builder alertLevel(AlertLevel level) {
            this.alertLevel = level != null ? level : AlertLevel.WARNING;
            return this;
        }

        public SequencerConfig build() {
            return new SequencerConfig(this);
        }
    }
}
