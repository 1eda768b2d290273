package gsecars.tomoxrd.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * ScanEventBus
 *
 * <p>Simple message bus for decoupled communication between the acquisition core and
 * whatever displays it:
 *   - Listeners subscribe once and receive every notification.
 *   - Notifications are fire-and-forget; a failing listener is logged and skipped so a
 *     display fault never stops a collection.
 */
public class ScanEventBus {
    private static final Logger logger = LoggerFactory.getLogger(ScanEventBus.class);

    private final List<ScanListener> listeners = new CopyOnWriteArrayList<>();

    public void subscribe(ScanListener listener) {
        listeners.add(listener);
    }

    public void unsubscribe(ScanListener listener) {
        listeners.remove(listener);
    }

    public void status(String message) {
        logger.info("Status: {}", message);
        dispatch("status", l -> l.onStatusMessage(message));
    }

    public void running(boolean running) {
        dispatch("running", l -> l.onRunningChanged(running));
    }

    public void stateChanged(ScanState from, ScanState to) {
        logger.debug("Scan state {} -> {}", from, to);
        dispatch("state", l -> l.onStateChanged(from, to));
    }

    public void frameNumber(int frame) {
        dispatch("frameNumber", l -> l.onFrameNumber(frame));
    }

    public void frameCounter(int count) {
        dispatch("frameCounter", l -> l.onFrameCounter(count));
    }

    public void totalFrames(int total) {
        dispatch("totalFrames", l -> l.onTotalFrames(total));
    }

    public void collectionProgress(int current, int total) {
        dispatch("collectionProgress", l -> l.onCollectionProgress(current, total));
    }

    public void error(String message) {
        logger.error(message);
        dispatch("error", l -> l.onErrorMessage(message));
    }

    public void conversionRequested(ConversionRequest request) {
        logger.info("Requesting format conversion for {}{}", request.filepath(), request.filename());
        dispatch("conversion", l -> l.onConversionRequested(request));
    }

    public void elapsed(Duration elapsed) {
        dispatch("elapsed", l -> l.onElapsedTime(elapsed));
    }

    public void estimated(double seconds) {
        dispatch("estimated", l -> l.onEstimatedTime(seconds));
    }

    public void geometryMove(ActiveOperation operation, boolean active) {
        dispatch("geometryMove", l -> l.onGeometryMove(operation, active));
    }

    public void snapshot(StatusSnapshot snapshot) {
        dispatch("snapshot", l -> l.onStatusSnapshot(snapshot));
    }

    private void dispatch(String event, Consumer<ScanListener> call) {
        for (ScanListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (RuntimeException e) {
                logger.warn("Listener {} failed on {} event", listener, event, e);
            }
        }
    }
}
