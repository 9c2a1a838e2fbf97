package sequencer.phase;

/**
 * Default no-op implementation used when the caller doesn't supply a listener.
 */
public enum NoopPhaseListener implements MigrationPhaseListener {
    INSTANCE
}
