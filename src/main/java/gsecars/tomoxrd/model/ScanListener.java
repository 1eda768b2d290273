package gsecars.tomoxrd.model;

import java.time.Duration;

/**
 * Receiver for scan notifications. All methods default to no-op so listeners override
 * only what they display. Calls arrive on worker threads.
 */
public interface ScanListener {

    default void onStatusMessage(String message) {}

    default void onRunningChanged(boolean running) {}

    default void onStateChanged(ScanState from, ScanState to) {}

    default void onFrameNumber(int frame) {}

    default void onFrameCounter(int count) {}

    default void onTotalFrames(int total) {}

    /**
     * @param current 1-based index of the point being collected, 0 when idle
     * @param total   number of enabled points
     */
    default void onCollectionProgress(int current, int total) {}

    default void onErrorMessage(String message) {}

    default void onConversionRequested(ConversionRequest request) {}

    default void onElapsedTime(Duration elapsed) {}

    default void onEstimatedTime(double seconds) {}

    default void onGeometryMove(ActiveOperation operation, boolean active) {}

    default void onStatusSnapshot(StatusSnapshot snapshot) {}
}
