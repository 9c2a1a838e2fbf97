package sequencer.config;

/**
 * Exception thrown when sequencer configuration cannot be loaded or is invalid.
 *
 * <p>This is an unchecked exception so configuration loading can be part of
 * initialization code without forced exception handling.
 *
 * @see SequencerConfigLoader
 */
public class SequencerConfigException extends RuntimeException {

    public SequencerConfigException(String message) {
        super(message);
    }

    public SequencerConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
