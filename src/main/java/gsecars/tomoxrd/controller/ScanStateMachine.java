package gsecars.tomoxrd.controller;

import gsecars.tomoxrd.model.AxisSnapshot;
import gsecars.tomoxrd.model.CancellationToken;
import gsecars.tomoxrd.model.ConversionRequest;
import gsecars.tomoxrd.model.DetectorProgram;
import gsecars.tomoxrd.model.MotionProfile;
import gsecars.tomoxrd.model.PathMapping;
import gsecars.tomoxrd.model.RunState;
import gsecars.tomoxrd.model.ScanEventBus;
import gsecars.tomoxrd.model.ScanKind;
import gsecars.tomoxrd.model.ScanRequest;
import gsecars.tomoxrd.model.ScanState;
import gsecars.tomoxrd.model.TimingSettings;
import gsecars.tomoxrd.service.beamline.DetectorSequencer;
import gsecars.tomoxrd.service.beamline.MotorAxis;
import gsecars.tomoxrd.utilities.BeamlineConfigManager;
import gsecars.tomoxrd.utilities.FileNameSanitizer;
import gsecars.tomoxrd.utilities.MinorFunctions;
import gsecars.tomoxrd.utilities.MotionSyncPlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Runs one scan: {@code IDLE -> PREPARING -> (MOVING ->) SCANNING -> FINISHING -> IDLE}.
 *
 * <p>{@link #prepareScan} plans the motion, checks the rotation limits against the taxi
 * extremes and arms the detector. {@link #collectStill} or {@link #collectProjections} then
 * runs the acquisition and always ends in {@link #finishScan}, which closes the shutter,
 * returns the rotation axis and restores the detector exactly once, also on abort or
 * hardware failure.</p>
 *
 * <p>Abort is cooperative: {@link #abort()} sets the run's cancellation token, which is
 * checked before each motion step and on every iteration of the frame wait loop. A blocking
 * move already in progress runs to completion first.</p>
 *
 * @since 0.1
 */
public class ScanStateMachine {
    private static final Logger logger = LoggerFactory.getLogger(ScanStateMachine.class);

    /** Written next to accumulated step scans for the conversion pipeline. */
    public static final String CONVERSION_REQUEST_FILE = "conversion_request.json";

    private final DetectorSequencer sequencer;
    private final MotorAxis rotation;
    private final RunState runState;
    private final ScanEventBus events;
    private final TimingSettings timing;
    private final PathMapping pathMapping;

    private volatile ScanRequest request;
    private volatile MotionProfile profile;
    private volatile DetectorProgram program;
    private volatile String scanDirectory;

    @FunctionalInterface
    private interface ScanBody {
        void run() throws IOException;
    }

    public ScanStateMachine(DetectorSequencer sequencer,
                            MotorAxis rotation,
                            RunState runState,
                            ScanEventBus events,
                            TimingSettings timing,
                            PathMapping pathMapping) {
        this.sequencer = sequencer;
        this.rotation = rotation;
        this.runState = runState;
        this.events = events;
        this.timing = timing;
        this.pathMapping = pathMapping;
    }

    // ==================== Preparing ====================

    /**
     * Plans and arms a scan.
     *
     * @return true if the request was rejected ("limited"); the state is back to IDLE and the
     *         detector was not armed
     * @throws IOException           on hardware failure; anything already armed is restored first
     * @throws IllegalStateException if the axis configuration cannot realize the step
     */
    public boolean prepareScan(ScanRequest scanRequest) throws IOException {
        transition(ScanState.PREPARING);
        runState.setRunning(true);
        events.running(true);
        events.status("Preparing");
        this.request = scanRequest;
        this.profile = null;
        this.program = null;

        if (scanRequest.stepExceedsRange()) {
            return reject(MotionSyncPlanner.STEP_EXCEEDS_RANGE_MESSAGE);
        }
        if (runState.isAborted()) {
            logger.info("Abort requested before {} was armed", scanRequest.filename());
            return reject(null);
        }

        try {
            int imageCount = 1;
            String nextFilepath = scanRequest.filepath();
            if (scanRequest.kind().rotates()) {
                MotionProfile planned;
                try {
                    planned = MotionSyncPlanner.plan(scanRequest, readAxisSnapshot());
                } catch (IllegalArgumentException | IllegalStateException e) {
                    logger.warn("Rejected {} scan {}: {}", scanRequest.kind(), scanRequest.filename(), e.getMessage());
                    return reject(e.getMessage());
                }
                Optional<String> violation = rotation.limitViolation(planned.lowestPosition());
                if (violation.isEmpty()) {
                    violation = rotation.limitViolation(planned.highestPosition());
                }
                if (violation.isPresent()) {
                    return reject(violation.get());
                }
                profile = planned;
                imageCount = planned.numAngles();
                if (scanRequest.kind() == ScanKind.STEP) {
                    nextFilepath = scanRequest.filepath() + scanRequest.filename();
                }
                sequencer.programPulseGenerator(planned);
            }

            runState.setTotalFrames(imageCount);
            events.totalFrames(imageCount);

            FileNameSanitizer.ensureDirectory(nextFilepath);
            scanDirectory = nextFilepath;
            program = DetectorProgram.forRequest(scanRequest, imageCount, pathMapping.toDetectorPath(nextFilepath));
            sequencer.arm(program);
            runState.setCurrentFrame(scanRequest.frameStart());
            return false;
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to prepare {} scan {}", scanRequest.kind(), scanRequest.filename(), e);
            cleanupAfterFailedPrepare(e);
            throw e;
        }
    }

    private boolean reject(String message) {
        if (message != null) {
            events.error(message);
        }
        profile = null;
        program = null;
        runState.setRunning(false);
        events.running(false);
        transition(ScanState.IDLE);
        return true;
    }

    private void cleanupAfterFailedPrepare(Exception cause) {
        try {
            if (profile != null) {
                try {
                    sequencer.disablePulseGenerator();
                } catch (IOException e) {
                    cause.addSuppressed(e);
                }
            }
            sequencer.disarm();
        } catch (IOException e) {
            cause.addSuppressed(e);
        } finally {
            profile = null;
            program = null;
            transition(ScanState.IDLE);
            runState.reset();
            events.running(false);
        }
    }

    AxisSnapshot readAxisSnapshot() throws IOException {
        return new AxisSnapshot(
                sequencer.readCountsPerRotation(),
                sequencer.readEncoderDirection(),
                rotation.direction(),
                rotation.accelerationTime(),
                rotation.maxVelocity());
    }

    // ==================== Collecting ====================

    /**
     * Single internally triggered frame. Never moves the rotation axis.
     */
    public void collectStill() throws IOException {
        requirePrepared(false);
        transition(ScanState.SCANNING);
        events.status("Scanning");
        runAndFinish(() -> {
            sequencer.setShutter(true);
            sequencer.startAcquisition();
            MinorFunctions.pause(timing.settle());
            waitForCollection();
        });
    }

    /**
     * Step or wide scan: taxi to the start at full speed, then sweep to the end at scan speed
     * while the PSO triggers the detector.
     */
    public void collectProjections() throws IOException {
        requirePrepared(true);
        MotionProfile p = profile;
        CancellationToken token = runState.cancellation();
        transition(ScanState.MOVING);
        events.status("Scanning");
        runAndFinish(() -> {
            sequencer.armPulseGenerator();
            MinorFunctions.pause(timing.settle());
            if (token.isCancelled()) {
                return;
            }
            rotation.setVelocity(p.maxSpeed());
            rotation.moveTo(p.taxiStart(), timing.moveTimeout());
            rotation.setVelocity(p.motorSpeed());
            if (token.isCancelled()) {
                return;
            }

            transition(ScanState.SCANNING);
            sequencer.setShutter(true);
            sequencer.startAcquisition();
            MinorFunctions.pause(timing.settle());
            if (token.isCancelled()) {
                return;
            }
            rotation.startMove(p.taxiEnd());
            waitForCollection();
        });
    }

    /**
     * Polls the detector until it disarms, the shutter closes or the run is aborted.
     * Frame number changes are published as they happen.
     */
    void waitForCollection() throws IOException {
        CancellationToken token = runState.cancellation();
        boolean recursiveSum = program.recursiveSum();
        int lastFrame = runState.getCurrentFrame();
        while (!token.isCancelled()) {
            if (!sequencer.isShutterOpen()) {
                logger.info("Shutter closed, leaving frame wait");
                break;
            }
            if (!sequencer.isArmed()) {
                break;
            }
            int frame = sequencer.readFrameNumber(recursiveSum);
            if (frame != lastFrame) {
                lastFrame = frame;
                runState.setCurrentFrame(frame);
                events.frameNumber(frame);
                events.frameCounter(runState.incrementFrameCounter());
            }
            MinorFunctions.pause(timing.pollInterval());
        }
    }

    private void runAndFinish(ScanBody body) throws IOException {
        IOException failure = null;
        try {
            body.run();
        } catch (IOException e) {
            logger.error("Scan failed, cleaning up", e);
            failure = e;
        } finally {
            try {
                finishScan();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    // ==================== Finishing ====================

    /**
     * Closes the shutter, returns the rotation axis to the scan start, requests format
     * conversion for completed accumulated step scans, and restores the detector. Every step
     * is attempted; the first failure is rethrown at the end.
     */
    void finishScan() throws IOException {
        transition(ScanState.FINISHING);
        MotionProfile p = profile;
        DetectorProgram prog = program;
        ScanRequest req = request;
        IOException failure = null;

        try {
            sequencer.setShutter(false);
            MinorFunctions.pause(timing.settle());
        } catch (IOException e) {
            logger.error("Failed to close the shutter", e);
            failure = e;
        }

        if (p != null) {
            try {
                sequencer.disablePulseGenerator();
            } catch (IOException e) {
                logger.error("Failed to disable the PSO", e);
                failure = keepFirst(failure, e);
            }
            try {
                rotation.setVelocity(p.maxSpeed());
                rotation.startMove(p.start());
                rotation.waitForPosition(p.start(), timing.returnTimeout(), timing.pollInterval());
            } catch (IOException e) {
                logger.error("Rotation axis did not return to {}", p.start(), e);
                failure = keepFirst(failure, e);
            }
            if (failure == null && req != null && req.isAccumulating() && !runState.isAborted()) {
                requestConversion(req, p, prog);
            }
        }

        try {
            sequencer.stopAcquisitionIfArmed();
        } catch (IOException e) {
            logger.error("Failed to stop acquisition", e);
            failure = keepFirst(failure, e);
        }
        try {
            sequencer.disarm();
        } catch (IOException e) {
            failure = keepFirst(failure, e);
        }

        profile = null;
        program = null;
        request = null;
        transition(ScanState.IDLE);
        runState.reset();
        events.running(false);
        events.frameCounter(0);
        events.status("Finished");

        if (failure != null) {
            throw failure;
        }
    }

    private void requestConversion(ScanRequest req, MotionProfile p, DetectorProgram prog) {
        ConversionRequest conversion = new ConversionRequest(
                req.filepath(), req.filename(), p.numAngles(),
                p.start(), p.end(), req.step(), req.exposure(),
                prog != null ? prog.firstFrame() : req.frameStart());
        if (scanDirectory != null) {
            Path target = Path.of(scanDirectory, CONVERSION_REQUEST_FILE);
            try {
                BeamlineConfigManager.writeMetadataAsJson(conversion, target);
            } catch (IOException e) {
                logger.warn("Could not write {}", target, e);
            }
        }
        events.conversionRequested(conversion);
    }

    private static IOException keepFirst(IOException first, IOException next) {
        if (first == null) {
            return next;
        }
        first.addSuppressed(next);
        return first;
    }

    // ==================== Abort and state ====================

    /**
     * Requests a cooperative stop of the current run.
     */
    public void abort() {
        runState.cancellation().cancel();
        ScanState current = runState.getState();
        if (current.isAbortable()) {
            transition(ScanState.ABORTING);
        }
        events.status("Aborting");
    }

    public ScanState getState() {
        return runState.getState();
    }

    public MotionProfile getProfile() {
        return profile;
    }

    private void requirePrepared(boolean rotating) {
        if (program == null || request == null) {
            throw new IllegalStateException("No scan has been prepared");
        }
        if (rotating != request.kind().rotates()) {
            throw new IllegalStateException("Prepared a " + request.kind() + " scan, cannot run it as "
                    + (rotating ? "projections" : "a still"));
        }
    }

    private void transition(ScanState next) {
        ScanState previous = runState.getState();
        if (previous == ScanState.ABORTING && (next == ScanState.MOVING || next == ScanState.SCANNING)) {
            return;
        }
        runState.setState(next);
        if (previous != next) {
            events.stateChanged(previous, next);
        }
    }
}
