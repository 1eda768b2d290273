package gsecars.tomoxrd.controller;

import gsecars.tomoxrd.model.ActiveOperation;
import gsecars.tomoxrd.model.CancellationToken;
import gsecars.tomoxrd.model.ExclusiveOperationGuard;
import gsecars.tomoxrd.model.GeometryPositions;
import gsecars.tomoxrd.model.PvNames;
import gsecars.tomoxrd.model.ScanEventBus;
import gsecars.tomoxrd.model.TimingSettings;
import gsecars.tomoxrd.service.beamline.DetectorSequencer;
import gsecars.tomoxrd.service.beamline.MotorAxis;
import gsecars.tomoxrd.service.beamline.ProcessVariableAccess;
import gsecars.tomoxrd.utilities.MinorFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Moves the detector between the tomography and diffraction positions.
 *
 * <p>A move first retracts detector Z to the out position, then (only if Z arrived there)
 * drives X and finally Z to the target. Requesting the same move again while it runs stops
 * it: the operation's own cancellation token is set and every all-stop PV is written.
 * After the move, successful or not, a fixed settle period elapses before the operation
 * releases the stages; repeat requests during that period are ignored.</p>
 *
 * @since 0.2
 */
public class GeometryController {
    private static final Logger logger = LoggerFactory.getLogger(GeometryController.class);

    private final DetectorSequencer sequencer;
    private final MotorAxis detectorX;
    private final MotorAxis detectorZ;
    private final ProcessVariableAccess pvs;
    private final PvNames names;
    private final ScanEventBus events;
    private final ExclusiveOperationGuard guard;
    private final GeometryPositions geometry;
    private final TimingSettings timing;
    private final Executor worker;

    private final CancellationToken tomoCancel = new CancellationToken();
    private final CancellationToken xrdCancel = new CancellationToken();

    public GeometryController(DetectorSequencer sequencer,
                              MotorAxis detectorX,
                              MotorAxis detectorZ,
                              ProcessVariableAccess pvs,
                              PvNames names,
                              ScanEventBus events,
                              ExclusiveOperationGuard guard,
                              GeometryPositions geometry,
                              TimingSettings timing,
                              Executor worker) {
        this.sequencer = sequencer;
        this.detectorX = detectorX;
        this.detectorZ = detectorZ;
        this.pvs = pvs;
        this.names = names;
        this.events = events;
        this.guard = guard;
        this.geometry = geometry;
        this.timing = timing;
        this.worker = worker;
    }

    /**
     * Starts the move to the tomography position, or stops it if it is already running.
     *
     * @return completes with true if the detector reached the position
     */
    public CompletableFuture<Boolean> toggleMoveToTomo() {
        return toggle(ActiveOperation.MOVE_TO_TOMO, geometry.tomoX(), geometry.tomoZ());
    }

    /**
     * Starts the move to the diffraction position, or stops it if it is already running.
     */
    public CompletableFuture<Boolean> toggleMoveToXrd() {
        return toggle(ActiveOperation.MOVE_TO_XRD, geometry.xrdX(), geometry.xrdZ());
    }

    private CompletableFuture<Boolean> toggle(ActiveOperation operation, double x, double z) {
        CancellationToken token = tokenFor(operation);
        if (guard.isHeldBy(operation)) {
            if (token.isCancelled()) {
                logger.debug("{} already stopping", operation.getDisplayName());
            } else {
                requestStop(operation);
            }
            return CompletableFuture.completedFuture(false);
        }
        if (!guard.tryAcquire(operation)) {
            return CompletableFuture.completedFuture(false);
        }
        token.reset();
        events.geometryMove(operation, true);
        try {
            return CompletableFuture.supplyAsync(() -> runMove(operation, token, x, z), worker);
        } catch (RuntimeException e) {
            logger.error("Could not start {}", operation.getDisplayName(), e);
            events.geometryMove(operation, false);
            guard.release(operation);
            return CompletableFuture.completedFuture(false);
        }
    }

    private boolean runMove(ActiveOperation operation, CancellationToken token, double x, double z) {
        boolean arrived = false;
        String target = operation == ActiveOperation.MOVE_TO_TOMO ? "tomo" : "XRD";
        events.status(operation == ActiveOperation.MOVE_TO_TOMO ? "Moving to Tomo" : "Moving to XRD");
        try {
            if (sequencer.isShutterOpen()) {
                events.error("Can't move to " + target + " when the shutter is open!!!");
            } else {
                arrived = moveDetector(token, x, z);
            }
        } catch (IOException e) {
            logger.error("{} failed", operation.getDisplayName(), e);
            events.error(operation.getDisplayName() + " failed: " + e.getMessage());
        } finally {
            try {
                MinorFunctions.pause(timing.geometrySettle());
            } catch (IOException e) {
                logger.warn("Settle after {} interrupted", operation.getDisplayName(), e);
            }
            token.reset();
            events.geometryMove(operation, false);
            events.status("Idle");
            guard.release(operation);
        }
        logger.info("{} {}", operation.getDisplayName(), arrived ? "complete" : "did not complete");
        return arrived;
    }

    private boolean moveDetector(CancellationToken token, double x, double z) throws IOException {
        double out = geometry.detectorOut();
        if (token.isCancelled()) {
            return false;
        }
        detectorZ.moveTo(out, timing.moveTimeout());

        double zReadback = MinorFunctions.round(detectorZ.position(), MotorAxis.POSITION_DECIMALS);
        if (zReadback != MinorFunctions.round(out, MotorAxis.POSITION_DECIMALS)) {
            if (!token.isCancelled()) {
                events.error("Detector Z did not reach the out position " + out + " (at " + zReadback + ")");
            }
            return false;
        }
        if (token.isCancelled()) {
            return false;
        }
        detectorX.moveTo(x, timing.moveTimeout());
        if (token.isCancelled()) {
            return false;
        }
        detectorZ.moveTo(z, timing.moveTimeout());
        return !token.isCancelled();
    }

    /**
     * Cancels the given move and writes 1 to every all-stop PV.
     */
    void requestStop(ActiveOperation operation) {
        logger.info("Stopping {}", operation.getDisplayName());
        events.status("Aborting");
        tokenFor(operation).cancel();
        for (String pv : names.allStop()) {
            try {
                pvs.put(pv, 1);
            } catch (IOException e) {
                logger.error("Failed to write all-stop {}", pv, e);
                events.error("Failed to write all-stop " + pv + ": " + e.getMessage());
            }
        }
    }

    /**
     * Stops whichever geometry move is running. No effect otherwise.
     */
    public void abort() {
        guard.current()
                .filter(op -> op != ActiveOperation.SCAN)
                .ifPresent(this::requestStop);
    }

    public boolean isMoving() {
        return guard.isHeldBy(ActiveOperation.MOVE_TO_TOMO) || guard.isHeldBy(ActiveOperation.MOVE_TO_XRD);
    }

    private CancellationToken tokenFor(ActiveOperation operation) {
        return switch (operation) {
            case MOVE_TO_TOMO -> tomoCancel;
            case MOVE_TO_XRD -> xrdCancel;
            case SCAN -> throw new IllegalArgumentException("Not a geometry move: " + operation);
        };
    }
}
