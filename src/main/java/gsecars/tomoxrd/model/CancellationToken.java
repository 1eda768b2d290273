package gsecars.tomoxrd.model;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag passed to every blocking step of a run.
 * In-flight hardware calls are never interrupted; holders check the token at loop heads
 * and before issuing the next write.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    /**
     * @return true if this call changed the state
     */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void reset() {
        cancelled.set(false);
    }
}
