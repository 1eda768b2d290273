package gsecars.tomoxrd.model;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable state of the collection in progress.
 *
 * <p>Written by the orchestrator and the scan state machine only; the status poller and
 * elapsed-time ticker read it. Fields are individually thread safe.</p>
 */
public class RunState {

    private volatile boolean running;
    private final CancellationToken cancellation = new CancellationToken();
    private final AtomicReference<ScanState> state = new AtomicReference<>(ScanState.IDLE);
    private final AtomicInteger currentFrame = new AtomicInteger();
    private final AtomicInteger frameCounter = new AtomicInteger();
    private final AtomicInteger totalFrames = new AtomicInteger(1);
    private final AtomicInteger currentCollection = new AtomicInteger();
    private final AtomicInteger totalCollections = new AtomicInteger(1);
    private volatile Instant startTime;

    public boolean isRunning() {
        return running;
    }

    public void setRunning(boolean running) {
        this.running = running;
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    public boolean isAborted() {
        return cancellation.isCancelled();
    }

    public ScanState getState() {
        return state.get();
    }

    /**
     * @return the previous state
     */
    public ScanState setState(ScanState next) {
        return state.getAndSet(next);
    }

    public int getCurrentFrame() {
        return currentFrame.get();
    }

    public void setCurrentFrame(int frame) {
        currentFrame.set(frame);
    }

    public int getFrameCounter() {
        return frameCounter.get();
    }

    public int incrementFrameCounter() {
        return frameCounter.incrementAndGet();
    }

    public int getTotalFrames() {
        return totalFrames.get();
    }

    public void setTotalFrames(int frames) {
        totalFrames.set(frames);
    }

    public int getCurrentCollection() {
        return currentCollection.get();
    }

    public void setCurrentCollection(int index) {
        currentCollection.set(index);
    }

    public int getTotalCollections() {
        return totalCollections.get();
    }

    public Instant getStartTime() {
        return startTime;
    }

    /**
     * Marks the start of a new invocation: clears the abort flag and counters.
     */
    public void begin(int collections) {
        cancellation.reset();
        frameCounter.set(0);
        currentCollection.set(0);
        totalCollections.set(Math.max(1, collections));
        startTime = Instant.now();
        running = true;
    }

    /**
     * Back to idle defaults after a single scan finishes. The abort flag is left for the
     * orchestrator to inspect and is cleared at the next {@link #begin(int)}.
     */
    public void reset() {
        running = false;
        frameCounter.set(0);
        state.set(ScanState.IDLE);
    }
}
