package sequencer.vcs;

import sequencer.config.SequencerConfig;
import sequencer.exceptions.VersionControlException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link VersionControl} backed by the git command line tool.
 *
 * <p>Every command runs with the working root as its directory. The working
 * root may be a subdirectory of the repository; changes outside it are neither
 * reported nor committed, but {@link #reset(String)} moves the whole
 * repository's head. The repository must have at least one commit.
 *
 * <p>Requires git 2.26 or newer ({@code --pathspec-from-file}).
 */
public final class GitVersionControl implements VersionControl {

    private static final Logger log = LoggerFactory.getLogger(GitVersionControl.class);

    // how long the output readers may lag behind process exit
    private static final long DRAIN_GRACE_MILLIS = 5000;

    private final Path workingRoot;
    private final String stateDir;
    private final String executable;
    private final Duration timeout;
    private final Map<String, String> identity;
    private final String prefix;

    private GitVersionControl(Path workingRoot, String stateDir, String executable,
                              Duration timeout, Map<String, String> identity, String prefix) {
        this.workingRoot = workingRoot;
        this.stateDir = stateDir;
        this.executable = executable;
        this.timeout = timeout;
        this.identity = identity;
        this.prefix = prefix;
    }

    /**
     * Binds to the git work tree containing the working root.
     *
     * @throws VersionControlException if git cannot be run or the root is not inside a work tree
     */
    public static GitVersionControl open(Path workingRoot, SequencerConfig config) throws VersionControlException {
        Objects.requireNonNull(workingRoot, "workingRoot");
        Objects.requireNonNull(config, "config");

        Map<String, String> identity = new LinkedHashMap<>();
        config.authorName().ifPresent(name -> {
            identity.put("GIT_AUTHOR_NAME", name);
            identity.put("GIT_COMMITTER_NAME", name);
        });
        config.authorEmail().ifPresent(email -> {
            identity.put("GIT_AUTHOR_EMAIL", email);
            identity.put("GIT_COMMITTER_EMAIL", email);
        });

        GitVersionControl candidate = new GitVersionControl(workingRoot.toAbsolutePath().normalize(),
                config.stateDir(), config.gitExecutable(), config.vcsTimeout(), Map.copyOf(identity), "");

        String inside = candidate.runText(null, "rev-parse", "--is-inside-work-tree");
        if (!"true".equals(inside)) {
            throw new VersionControlException("Not inside a git work tree: " + workingRoot);
        }
        String prefix = candidate.runText(null, "rev-parse", "--show-prefix");
        log.debug("Using git work tree at {} (prefix '{}')", candidate.workingRoot, prefix);

        return new GitVersionControl(candidate.workingRoot, candidate.stateDir, candidate.executable,
                candidate.timeout, candidate.identity, prefix);
    }

    // ===== VersionControl =====

    @Override
    public List<String> changedPaths() throws VersionControlException {
        byte[] out = run(null, "status", "--porcelain", "-z", "-uall", "--",
                ".", ":(exclude)" + stateDir);
        String[] tokens = new String(out, StandardCharsets.UTF_8).split("\0");

        TreeSet<String> paths = new TreeSet<>();
        for (int i = 0; i < tokens.length; i++) {
            String entry = tokens[i];
            if (entry.length() < 4) continue;
            char x = entry.charAt(0);
            paths.add(relativize(entry.substring(3)));
            // renames and copies carry the original path as the next token
            if ((x == 'R' || x == 'C') && i + 1 < tokens.length) {
                paths.add(relativize(tokens[++i]));
            }
        }
        return List.copyOf(paths);
    }

    @Override
    public String head() throws VersionControlException {
        return runText(null, "rev-parse", "--verify", "HEAD");
    }

    @Override
    public String commit(List<String> paths, String message) throws VersionControlException {
        Objects.requireNonNull(message, "message");
        if (paths.isEmpty()) {
            run(null, "commit", "--allow-empty", "--no-verify", "-q", "-m", message);
        } else {
            byte[] pathspec = nulSeparated(paths);
            run(pathspec, "--literal-pathspecs", "add", "-A",
                    "--pathspec-from-file=-", "--pathspec-file-nul");
            run(pathspec, "--literal-pathspecs", "commit", "--no-verify", "-q", "-m", message,
                    "--pathspec-from-file=-", "--pathspec-file-nul");
        }
        String ref = head();
        log.debug("Committed {} path(s) as {}", paths.size(), ref);
        return ref;
    }

    @Override
    public void reset(String ref) throws VersionControlException {
        run(null, "reset", "-q", "--hard", ref);
        run(null, "clean", "-q", "-f", "-d", "--", ".", ":(exclude)" + stateDir);
        log.debug("Reset working tree to {}", ref);
    }

    @Override
    public void tag(String ref, String name) throws VersionControlException {
        run(null, "tag", "-f", name, ref);
    }

    // ===== process plumbing =====

    private String relativize(String repoPath) {
        return repoPath.startsWith(prefix) ? repoPath.substring(prefix.length()) : repoPath;
    }

    private static byte[] nulSeparated(List<String> paths) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (String p : paths) {
            out.writeBytes(p.getBytes(StandardCharsets.UTF_8));
            out.write(0);
        }
        return out.toByteArray();
    }

    private String runText(byte[] stdin, String... args) throws VersionControlException {
        return new String(run(stdin, args), StandardCharsets.UTF_8).trim();
    }

    private byte[] run(byte[] stdin, String... args) throws VersionControlException {
        List<String> command = new ArrayList<>(args.length + 1);
        command.add(executable);
        command.addAll(List.of(args));
        String display = String.join(" ", command);
        log.trace("Executing: {}", display);

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workingRoot.toFile());
        pb.redirectErrorStream(false);
        pb.environment().putAll(identity);
        pb.environment().put("GIT_TERMINAL_PROMPT", "0");

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new VersionControlException("Failed to start '" + executable + "'", e);
        }

        ByteArrayOutputStream stdout = new ByteArrayOutputStream();
        ByteArrayOutputStream stderr = new ByteArrayOutputStream();
        // drain both streams concurrently so a full pipe cannot block the child
        AtomicReference<IOException> readFailure = new AtomicReference<>();
        Thread stdoutThread = new Thread(() -> drain(process.getInputStream(), stdout, readFailure), "git-stdout");
        Thread stderrThread = new Thread(() -> drain(process.getErrorStream(), stderr, readFailure), "git-stderr");
        stdoutThread.start();
        stderrThread.start();

        try {
            try (OutputStream in = process.getOutputStream()) {
                if (stdin != null) {
                    in.write(stdin);
                }
            }

            boolean completed = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!completed) {
                process.destroyForcibly();
                throw new VersionControlException(
                        "'" + display + "' timed out after " + timeout.toSeconds() + " seconds");
            }
            stdoutThread.join(DRAIN_GRACE_MILLIS);
            stderrThread.join(DRAIN_GRACE_MILLIS);
            if (stdoutThread.isAlive() || stderrThread.isAlive()) {
                process.destroyForcibly();
                throw new VersionControlException("Output of '" + display + "' was not fully read within "
                        + DRAIN_GRACE_MILLIS + " ms after exit");
            }
        } catch (IOException e) {
            process.destroyForcibly();
            throw new VersionControlException("Failed to write to '" + display + "'", e);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new VersionControlException("Interrupted while running '" + display + "'", e);
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            String err = stderr.toString(StandardCharsets.UTF_8).trim();
            throw new VersionControlException(
                    "'" + display + "' exited with " + exitCode + (err.isEmpty() ? "" : ": " + err));
        }
        if (readFailure.get() != null) {
            throw new VersionControlException("Failed to read output of '" + display + "'", readFailure.get());
        }
        return stdout.toByteArray();
    }

    static void drain(InputStream in, ByteArrayOutputStream sink, AtomicReference<IOException> failure) {
        try (in) {
            in.transferTo(sink);
        } catch (IOException e) {
            log.warn("Error reading git output: {}", e.getMessage());
            failure.compareAndSet(null, e);
        }
    }
}
