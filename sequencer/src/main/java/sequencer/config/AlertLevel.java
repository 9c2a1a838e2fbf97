package sequencer.config;

/**
 * Alert level for migration event logging.
 *
 * <p>Controls the minimum severity of events that get logged by
 * {@link sequencer.alert.MigrationAlertLogger}. Configured via
 * {@code sequencer.alert.level}.
 *
 * @see SequencerConfig#alertLevel()
 */
public enum AlertLevel {
    /** All events: run started, each applied/reverted/skipped migration, warnings and errors. */
    DEBUG,

    /** Warnings (lock conflicts, working tree restored) and errors. The default. */
    WARNING,

    /** Errors only: failed migrations and halted runs. */
    ERROR
}
