package sequencer.state;

import java.util.List;

/**
 * Non-durable {@link StateStore} whose ledger lives only as long as the instance.
 *
 * <p>Useful for embedding the engine in a process that tracks state elsewhere,
 * and for tests.
 */
public final class InMemoryStateStore extends AbstractStateStore {

    public InMemoryStateStore() {}

    public InMemoryStateStore(List<ExecutionRecord> initial) {
        restore(initial);
    }

    @Override
    protected void persist(List<ExecutionRecord> history) {
        // nothing to write
    }
}
