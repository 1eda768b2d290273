package gsecars.tomoxrd.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single token shared by scans and geometry moves. Only one operation may hold it.
 *
 * <p>Callers acquire before launching a worker and release in that worker's finally block.</p>
 */
public class ExclusiveOperationGuard {
    private static final Logger logger = LoggerFactory.getLogger(ExclusiveOperationGuard.class);

    private final AtomicReference<ActiveOperation> active = new AtomicReference<>();

    /**
     * @return true if the token was free and is now held by {@code operation}
     */
    public boolean tryAcquire(ActiveOperation operation) {
        boolean acquired = active.compareAndSet(null, operation);
        if (!acquired) {
            logger.info("Ignoring {} request, {} is already running", operation, active.get());
        }
        return acquired;
    }

    /**
     * Releases the token if it is held by {@code operation}.
     */
    public void release(ActiveOperation operation) {
        if (!active.compareAndSet(operation, null)) {
            logger.warn("Release of {} ignored, token held by {}", operation, active.get());
        }
    }

    public Optional<ActiveOperation> current() {
        return Optional.ofNullable(active.get());
    }

    public boolean isHeldBy(ActiveOperation operation) {
        return active.get() == operation;
    }

    public boolean isIdle() {
        return active.get() == null;
    }
}
