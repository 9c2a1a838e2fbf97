package sequencer.exceptions;

import java.util.List;

/**
 * The declared dependencies form a cycle.
 *
 * <p>{@link #cyclePath()} lists the identities along the cycle, starting and
 * ending with the same node, e.g. {@code [A, B, C, A]} for A requires B requires
 * C requires A.
 */
public class CyclicDependencyException extends GraphValidationException {

    private final List<String> cyclePath;

    public CyclicDependencyException(List<String> cyclePath) {
        super("Dependency cycle detected: " + String.join(" -> ", cyclePath), cyclePath.get(0));
        this.cyclePath = List.copyOf(cyclePath);
    }

    public List<String> cyclePath() {
        return cyclePath;
    }
}
