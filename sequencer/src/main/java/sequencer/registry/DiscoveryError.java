package sequencer.registry;

/**
 * A migration that could not be loaded.
 *
 * <p>Discovery errors are collected, not thrown: the failing unit is excluded
 * from the candidate set and discovery continues, unless strict discovery
 * turns the error list into a {@link sequencer.exceptions.DiscoveryException}.
 *
 * @param source where the unit was found (a class name or source label)
 * @param name the unit's identity if it could be determined, otherwise the class name
 * @param reason what is wrong with it
 * @param cause the underlying error, may be null
 */
public record DiscoveryError(String source, String name, String reason, Throwable cause) {

    public DiscoveryError(String source, String name, String reason) {
        this(source, name, reason, null);
    }

    /** One-line description, e.g. {@code B (com.example.B): no no-arg constructor}. */
    public String describe() {
        if (name == null || name.equals(source)) {
            return source + ": " + reason;
        }
        return name + " (" + source + "): " + reason;
    }
}
