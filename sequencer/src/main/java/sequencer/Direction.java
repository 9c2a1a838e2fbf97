package sequencer;

/**
 * Which of a migration's two operations is being executed.
 */
public enum Direction {
    /** Forward operation: {@link Migration#apply(MigrationContext)}. */
    APPLY("Apply", "apply"),
    /** Backward operation: {@link Migration#revert(MigrationContext)}. */
    REVERT("Revert", "revert");

    private final String verb;
    private final String stage;

    Direction(String verb, String stage) {
        this.verb = verb;
        this.stage = stage;
    }

    /** Capitalized verb for messages ("Apply", "Revert"). */
    public String verb() {
        return verb;
    }

    /** Stage name used in exception diagnostics. */
    public String stage() {
        return stage;
    }
}
