package gsecars.tomoxrd.controller;

import gsecars.tomoxrd.model.ActiveOperation;
import gsecars.tomoxrd.model.CollectionPoint;
import gsecars.tomoxrd.model.CollectionPoints;
import gsecars.tomoxrd.model.ExclusiveOperationGuard;
import gsecars.tomoxrd.model.GeometryPositions;
import gsecars.tomoxrd.model.RunState;
import gsecars.tomoxrd.model.ScanEventBus;
import gsecars.tomoxrd.model.ScanKind;
import gsecars.tomoxrd.model.ScanRequest;
import gsecars.tomoxrd.model.TimingSettings;
import gsecars.tomoxrd.service.beamline.DetectorSequencer;
import gsecars.tomoxrd.service.beamline.MotorAxis;
import gsecars.tomoxrd.utilities.FileNameSanitizer;
import gsecars.tomoxrd.utilities.MinorFunctions;
import gsecars.tomoxrd.utilities.MotionSyncPlanner;
import gsecars.tomoxrd.utilities.RunLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs collections over the configured points.
 *
 * <p>With no points a single collection is taken where the sample is. Otherwise each
 * enabled point is visited in list order: the three sample axes are limit checked, moved,
 * and the point name is appended to the file name before the scan runs. The sample
 * position from before the run is always restored, however the loop ended.</p>
 *
 * <p>Collections run on the supplied worker executor and hold the
 * {@link ActiveOperation#SCAN} token for their whole duration. Failures are logged and
 * published on the error channel; they never escape the worker.</p>
 *
 * @since 0.1
 */
public class ScanningController {
    private static final Logger logger = LoggerFactory.getLogger(ScanningController.class);

    public static final String NOT_ON_XRD_MESSAGE = "First move to XRD position.";

    private final ScanStateMachine scan;
    private final DetectorSequencer sequencer;
    private final MotorAxis horizontal;
    private final MotorAxis vertical;
    private final MotorAxis focus;
    private final MotorAxis detectorX;
    private final MotorAxis detectorZ;
    private final CollectionPoints points;
    private final RunState runState;
    private final ScanEventBus events;
    private final ExclusiveOperationGuard guard;
    private final GeometryPositions geometry;
    private final TimingSettings timing;
    private final Executor worker;

    private volatile ScanRequest lastRequest;

    /**
     * Sample X/Y/Z captured before a multi-point run.
     */
    private record SamplePosition(double x, double y, double z) {
    }

    public ScanningController(ScanStateMachine scan,
                              DetectorSequencer sequencer,
                              MotorAxis horizontal,
                              MotorAxis vertical,
                              MotorAxis focus,
                              MotorAxis detectorX,
                              MotorAxis detectorZ,
                              CollectionPoints points,
                              RunState runState,
                              ScanEventBus events,
                              ExclusiveOperationGuard guard,
                              GeometryPositions geometry,
                              TimingSettings timing,
                              Executor worker) {
        this.scan = scan;
        this.sequencer = sequencer;
        this.horizontal = horizontal;
        this.vertical = vertical;
        this.focus = focus;
        this.detectorX = detectorX;
        this.detectorZ = detectorZ;
        this.points = points;
        this.runState = runState;
        this.events = events;
        this.guard = guard;
        this.geometry = geometry;
        this.timing = timing;
        this.worker = worker;
    }

    // ==================== Collect / abort ====================

    /**
     * Validates preconditions and starts the collection on the worker.
     *
     * @return a future completing when the collection (including position restore) is over;
     *         already complete if the request was refused
     */
    public CompletableFuture<Void> collect(ScanRequest request) {
        ScanRequest sanitized = new ScanRequest(request.exposure(), request.start(), request.end(), request.step(),
                request.frameStart(),
                FileNameSanitizer.sanitizeFileName(request.filename()),
                FileNameSanitizer.sanitizeFilePath(request.filepath()),
                request.accumulate());

        if (!guard.isIdle()) {
            logger.info("Collect ignored, {} in progress", guard.current().map(ActiveOperation::getDisplayName).orElse("operation"));
            return CompletableFuture.completedFuture(null);
        }
        try {
            if (!isOnXrdPosition()) {
                return refuse(NOT_ON_XRD_MESSAGE);
            }
        } catch (IOException e) {
            logger.error("Failed to read the detector position", e);
            return refuse("Failed to read the detector position: " + e.getMessage());
        }
        if (sanitized.stepExceedsRange()) {
            return refuse(MotionSyncPlanner.STEP_EXCEEDS_RANGE_MESSAGE);
        }
        if (!guard.tryAcquire(ActiveOperation.SCAN)) {
            return CompletableFuture.completedFuture(null);
        }

        int total = totalCollections();
        runState.begin(total);
        lastRequest = sanitized;
        events.running(true);
        events.collectionProgress(0, total);
        events.estimated(estimateTotalSeconds(sanitized));
        logger.info("Starting {} collection {} in {} over {} point(s)",
                sanitized.kind(), sanitized.filename(), sanitized.filepath(), total);

        try {
            return CompletableFuture.runAsync(() -> runCollection(sanitized, total), worker);
        } catch (RuntimeException e) {
            logger.error("Could not start the collection worker", e);
            runState.setRunning(false);
            guard.release(ActiveOperation.SCAN);
            events.running(false);
            events.error("Could not start the collection: " + e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
    }

    private CompletableFuture<Void> refuse(String message) {
        events.running(false);
        events.error(message);
        return CompletableFuture.completedFuture(null);
    }

    private void runCollection(ScanRequest request, int total) {
        try {
            FileNameSanitizer.ensureDirectory(request.filepath());
            try (RunLogger.Session session = RunLogger.start(request.filepath())) {
                sequencer.setFileNames(request.filename());
                if (points.isEmpty()) {
                    collectSinglePoint(request, total);
                } else {
                    collectMultiplePoints(request, total);
                }
            }
        } catch (IOException e) {
            logger.error("Collection {} failed", request.filename(), e);
            events.error("Collection failed: " + e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected error during collection {}", request.filename(), e);
            events.error("Collection failed: " + e.getMessage());
        } finally {
            runState.setRunning(false);
            runState.setCurrentCollection(0);
            events.collectionProgress(0, total);
            events.running(false);
            guard.release(ActiveOperation.SCAN);
        }
    }

    private void collectSinglePoint(ScanRequest request, int total) throws IOException {
        ScanRequest pointRequest = request.isAccumulating() ? request.withFrameStart(1) : request;
        boolean limited = scan.prepareScan(pointRequest);
        if (limited) {
            abort();
            revertSamplePositions(null);
            return;
        }
        if (runState.isAborted()) {
            scan.finishScan();
            return;
        }
        runState.setCurrentCollection(1);
        events.collectionProgress(1, total);
        runScan(pointRequest);
    }

    private void collectMultiplePoints(ScanRequest request, int total) throws IOException {
        SamplePosition previous = new SamplePosition(horizontal.position(), vertical.position(), focus.position());
        logger.info("Sample position before collection: ({}, {}, {})", previous.x(), previous.y(), previous.z());

        IOException failure = null;
        RuntimeException unchecked = null;
        int collectionNumber = 0;
        int nextFrame = request.frameStart();
        try {
            for (CollectionPoint point : points.snapshot()) {
                if (runState.isAborted()) {
                    logger.info("Collection aborted before point {}", point.name());
                    break;
                }
                if (!point.enabled()) {
                    continue;
                }

                collectionNumber++;
                runState.setCurrentCollection(collectionNumber);
                events.collectionProgress(collectionNumber, total);

                double x = point.x() != null ? point.x() : previous.x();
                double y = point.y() != null ? point.y() : previous.y();
                double z = point.z() != null ? point.z() : previous.z();
                if (!moveToPoint(x, y, z)) {
                    abort();
                    break;
                }

                ScanRequest pointRequest = request
                        .withFilename(request.filename() + "_" + point.name())
                        .withFrameStart(request.isAccumulating() ? 1 : nextFrame);
                logger.info("Collecting point {} ({}/{})", point.name(), collectionNumber, total);
                if (scan.prepareScan(pointRequest)) {
                    abort();
                    break;
                }
                runScan(pointRequest);
                nextFrame = nextFrameStart(request, nextFrame);
            }
        } catch (IOException e) {
            failure = e;
        } catch (RuntimeException e) {
            unchecked = e;
        }

        try {
            MinorFunctions.pause(timing.settle());
            revertSamplePositions(previous);
        } catch (IOException e) {
            logger.error("Failed to restore sample position ({}, {}, {})", previous.x(), previous.y(), previous.z(), e);
            if (unchecked != null) {
                unchecked.addSuppressed(e);
            } else if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        }
        if (unchecked != null) {
            throw unchecked;
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Step scans keep their start frame (accumulated ones restart at 1); stills and wide
     * scans continue from the TIFF plugin's next file number.
     */
    private int nextFrameStart(ScanRequest request, int current) throws IOException {
        if (request.kind() == ScanKind.STEP) {
            return request.isAccumulating() ? 1 : current;
        }
        return sequencer.readTiffFileNumber();
    }

    private void runScan(ScanRequest request) throws IOException {
        if (request.kind() == ScanKind.STILL) {
            scan.collectStill();
        } else {
            scan.collectProjections();
        }
    }

    /**
     * Limit checks all three sample axes before moving any of them.
     *
     * @return false if a limit would be violated or the run was aborted
     */
    private boolean moveToPoint(double x, double y, double z) throws IOException {
        events.running(true);
        events.status("Moving");

        List<String> violations = new ArrayList<>();
        addViolation(violations, horizontal, x);
        addViolation(violations, vertical, y);
        addViolation(violations, focus, z);
        if (!violations.isEmpty()) {
            violations.forEach(events::error);
            return false;
        }

        MotorAxis[] axes = {horizontal, vertical, focus};
        double[] targets = {x, y, z};
        for (int i = 0; i < axes.length; i++) {
            if (runState.isAborted()) {
                return false;
            }
            axes[i].moveTo(targets[i], timing.moveTimeout());
        }
        return true;
    }

    private static void addViolation(List<String> violations, MotorAxis axis, double target) throws IOException {
        Optional<String> violation = axis.limitViolation(target);
        violation.ifPresent(violations::add);
    }

    private void revertSamplePositions(SamplePosition previous) throws IOException {
        events.running(true);
        events.status("Moving");
        if (previous != null) {
            horizontal.moveTo(previous.x(), timing.moveTimeout());
            vertical.moveTo(previous.y(), timing.moveTimeout());
            focus.moveTo(previous.z(), timing.moveTimeout());
        }
        events.running(false);
        events.status("Finished");
    }

    /**
     * Stops the current collection at the next check point. No effect when idle.
     */
    public void abort() {
        if (!runState.isRunning() && !guard.isHeldBy(ActiveOperation.SCAN)) {
            logger.debug("Abort ignored, no collection running");
            return;
        }
        logger.info("Collection abort requested");
        scan.abort();
    }

    // ==================== Shutter ====================

    public void toggleShutter(boolean open) {
        try {
            sequencer.setShutter(open);
        } catch (IOException e) {
            logger.error("Failed to {} the shutter", open ? "open" : "close", e);
            events.error("Failed to " + (open ? "open" : "close") + " the shutter: " + e.getMessage());
        }
    }

    // ==================== Points ====================

    public void addPoint(CollectionPoint point) {
        points.addPoint(point);
        pointsChanged();
    }

    /**
     * Adds the current sample position under the next free {@code posN} name.
     */
    public CollectionPoint addPointAtCurrentPosition() throws IOException {
        int index = points.size() + 1;
        while (points.contains("pos" + index)) {
            index++;
        }
        return addPointAtCurrentPosition("pos" + index);
    }

    public CollectionPoint addPointAtCurrentPosition(String name) throws IOException {
        CollectionPoint point = new CollectionPoint(name,
                MinorFunctions.round(horizontal.target(), 4),
                MinorFunctions.round(vertical.target(), 4),
                MinorFunctions.round(focus.target(), 4),
                true);
        addPoint(point);
        return point;
    }

    public boolean deletePoint(String name) {
        boolean removed = points.deletePoint(name);
        pointsChanged();
        return removed;
    }

    public void clearPoints() {
        points.clear();
        pointsChanged();
    }

    public void setPointEnabled(String name, boolean enabled) {
        points.setEnabled(name, enabled);
        pointsChanged();
    }

    public void enableAllPoints() {
        points.enableAll();
        pointsChanged();
    }

    public CollectionPoints getPoints() {
        return points;
    }

    private void pointsChanged() {
        int total = totalCollections();
        if (!runState.isRunning()) {
            events.collectionProgress(0, total);
        }
        ScanRequest request = lastRequest;
        if (request != null) {
            events.estimated(estimateTotalSeconds(request));
        }
    }

    // ==================== Estimates and checks ====================

    /**
     * Number of collections a run would take: 1 without points, else the enabled count.
     */
    public int totalCollections() {
        return points.isEmpty() ? 1 : points.enabledCount();
    }

    public double estimateTotalSeconds(ScanRequest request) {
        double perCollection = MotionSyncPlanner.estimateCollectionSeconds(request);
        return points.isEmpty() ? perCollection : perCollection * points.enabledCount();
    }

    public boolean isOnXrdPosition() throws IOException {
        return MinorFunctions.round(detectorX.position(), 4) == MinorFunctions.round(geometry.xrdX(), 4)
                && MinorFunctions.round(detectorZ.position(), 4) == MinorFunctions.round(geometry.xrdZ(), 4);
    }

    public boolean isRunning() {
        return guard.isHeldBy(ActiveOperation.SCAN);
    }
}
