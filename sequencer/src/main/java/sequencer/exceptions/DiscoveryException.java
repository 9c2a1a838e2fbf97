package sequencer.exceptions;

import sequencer.registry.DiscoveryError;

import java.util.List;

/**
 * Raised by strict discovery when one or more units failed to load.
 */
public class DiscoveryException extends MigrateException {

    private final List<DiscoveryError> errors;

    public DiscoveryException(List<DiscoveryError> errors) {
        super(errors.size() + " migration(s) failed to load: " + errors.get(0).describe(),
                null, "discovery", errors.get(0).cause());
        this.errors = List.copyOf(errors);
    }

    public List<DiscoveryError> errors() {
        return errors;
    }
}
