package gsecars.tomoxrd.controller;

import gsecars.tomoxrd.model.ActiveOperation;
import gsecars.tomoxrd.model.CollectionPoints;
import gsecars.tomoxrd.model.ExclusiveOperationGuard;
import gsecars.tomoxrd.model.GeometryPositions;
import gsecars.tomoxrd.model.PathMapping;
import gsecars.tomoxrd.model.PvNames;
import gsecars.tomoxrd.model.RunState;
import gsecars.tomoxrd.model.ScanEventBus;
import gsecars.tomoxrd.model.StatusSnapshot;
import gsecars.tomoxrd.model.TimingSettings;
import gsecars.tomoxrd.service.beamline.DetectorSequencer;
import gsecars.tomoxrd.service.beamline.MotorAxis;
import gsecars.tomoxrd.service.beamline.ProcessVariableAccess;
import gsecars.tomoxrd.utilities.BeamlineConfigManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Central entry point wiring the acquisition core to one beamline.
 *
 * <p>This controller acts as a facade for the beamline, managing:
 * <ul>
 *   <li>Construction of the sequencer, motors and controllers from the YAML configuration</li>
 *   <li>The worker thread that runs collections and geometry moves</li>
 *   <li>The status poller publishing {@link StatusSnapshot}s</li>
 *   <li>The elapsed-time ticker while a collection runs</li>
 * </ul>
 *
 * <p>The process-variable transport is supplied by the caller.</p>
 *
 * @since 0.2
 */
public class BeamlineController implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(BeamlineController.class);

    private final TimingSettings timing;
    private final RunState runState = new RunState();
    private final ScanEventBus events = new ScanEventBus();
    private final ExclusiveOperationGuard guard = new ExclusiveOperationGuard();
    private final CollectionPoints points = new CollectionPoints();

    private final DetectorSequencer sequencer;
    private final MotorAxis rotation;
    private final MotorAxis horizontal;
    private final MotorAxis vertical;
    private final MotorAxis focus;
    private final MotorAxis detectorX;
    private final MotorAxis detectorZ;

    private final ScanStateMachine scanStateMachine;
    private final ScanningController scanningController;
    private final GeometryController geometryController;

    private final ExecutorService worker = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "TomoXrd-Worker");
        t.setDaemon(true);
        return t;
    });

    private final ScheduledExecutorService poller = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "TomoXrd-StatusPoller");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean pollFailing;
    private volatile boolean started;

    public BeamlineController(BeamlineConfigManager config, ProcessVariableAccess pvs) {
        List<String> missing = config.validateConfiguration();
        if (!missing.isEmpty()) {
            logger.warn("Configuration {} is missing {}; using built-in defaults", config.getSource(), missing);
        }
        PvNames names = config.getPvNames();
        GeometryPositions geometry = config.getGeometryPositions();
        PathMapping pathMapping = config.getPathMapping();
        this.timing = config.getTimingSettings();

        this.sequencer = new DetectorSequencer(pvs, names, timing.ackTimeout());
        this.rotation = new MotorAxis(pvs, names.rotationMotor());
        this.horizontal = new MotorAxis(pvs, names.horizontalMotor());
        this.vertical = new MotorAxis(pvs, names.verticalMotor());
        this.focus = new MotorAxis(pvs, names.focusMotor());
        this.detectorX = new MotorAxis(pvs, names.detectorXMotor());
        this.detectorZ = new MotorAxis(pvs, names.detectorZMotor());

        this.scanStateMachine = new ScanStateMachine(sequencer, rotation, runState, events, timing, pathMapping);
        this.scanningController = new ScanningController(scanStateMachine, sequencer,
                horizontal, vertical, focus, detectorX, detectorZ,
                points, runState, events, guard, geometry, timing, worker);
        this.geometryController = new GeometryController(sequencer, detectorX, detectorZ,
                pvs, names, events, guard, geometry, timing, worker);
    }

    /**
     * Initializes the PSO counts per rotation and starts the status poller and the elapsed
     * ticker. Calling it again has no effect.
     *
     * @throws IOException if the controller cannot be initialized
     */
    public synchronized void start() throws IOException {
        if (started) {
            return;
        }
        double counts = sequencer.initializeCountsPerRotation();
        logger.info("PSO counts per rotation: {}", counts);

        poller.scheduleAtFixedRate(this::pollStatus, 0, timing.pollInterval().toMillis(), TimeUnit.MILLISECONDS);
        poller.scheduleAtFixedRate(this::tickElapsed, 0, timing.elapsedInterval().toMillis(), TimeUnit.MILLISECONDS);
        started = true;
        logger.debug("Started status polling ({} ms) and elapsed ticker ({} ms)",
                timing.pollInterval().toMillis(), timing.elapsedInterval().toMillis());
    }

    void pollStatus() {
        try {
            StatusSnapshot snapshot = new StatusSnapshot(
                    rotation.position(),
                    horizontal.position(),
                    vertical.position(),
                    focus.position(),
                    detectorX.position(),
                    detectorZ.position(),
                    sequencer.isShutterOpen(),
                    sequencer.isArmed(),
                    runState.getFrameCounter(),
                    runState.getTotalFrames(),
                    runState.getCurrentCollection(),
                    runState.getTotalCollections());
            if (pollFailing) {
                logger.info("Status polling recovered");
                pollFailing = false;
            }
            events.snapshot(snapshot);
        } catch (IOException | RuntimeException e) {
            // A failing poll must not cancel the scheduled task
            if (!pollFailing) {
                logger.warn("Status polling failed: {}", e.getMessage(), e);
                pollFailing = true;
            }
        }
    }

    void tickElapsed() {
        Instant startTime = runState.getStartTime();
        if (startTime != null && guard.isHeldBy(ActiveOperation.SCAN)) {
            events.elapsed(Duration.between(startTime, Instant.now()));
        }
    }

    /**
     * Aborts whatever is running: the collection, or a geometry move.
     */
    public void abort() {
        if (guard.isHeldBy(ActiveOperation.SCAN)) {
            scanningController.abort();
        } else {
            geometryController.abort();
        }
    }

    public ScanEventBus getEvents() {
        return events;
    }

    public ScanningController getScanning() {
        return scanningController;
    }

    public GeometryController getGeometry() {
        return geometryController;
    }

    public ScanStateMachine getScanStateMachine() {
        return scanStateMachine;
    }

    public CollectionPoints getPoints() {
        return points;
    }

    public RunState getRunState() {
        return runState;
    }

    public ExclusiveOperationGuard getGuard() {
        return guard;
    }

    public DetectorSequencer getSequencer() {
        return sequencer;
    }

    /**
     * Stops polling and the worker. A running collection is aborted first.
     */
    @Override
    public void close() {
        abort();
        poller.shutdownNow();
        worker.shutdown();
        try {
            if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Worker did not finish within 5 s, interrupting");
                worker.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while shutting down executors", e);
        }
        logger.info("Beamline controller closed");
    }
}
