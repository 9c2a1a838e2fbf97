package sequencer.exceptions;

/**
 * A migration declares a dependency on an identity that discovery did not produce.
 */
public class UnresolvedDependencyException extends GraphValidationException {

    private final String unit;
    private final String missingId;

    public UnresolvedDependencyException(String unit, String missingId) {
        super("Migration '" + unit + "' depends on unknown migration '" + missingId + "'", unit);
        this.unit = unit;
        this.missingId = missingId;
    }

    /** Identity of the migration that declared the dependency. */
    public String unit() {
        return unit;
    }

    /** The dependency identity that could not be resolved. */
    public String missingId() {
        return missingId;
    }
}
