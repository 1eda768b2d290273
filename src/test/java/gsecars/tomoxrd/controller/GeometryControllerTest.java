package gsecars.tomoxrd.controller;

import gsecars.tomoxrd.RecordingListener;
import gsecars.tomoxrd.SimulatedBeamline;
import gsecars.tomoxrd.model.ActiveOperation;
import gsecars.tomoxrd.model.ExclusiveOperationGuard;
import gsecars.tomoxrd.model.GeometryPositions;
import gsecars.tomoxrd.model.PvNames;
import gsecars.tomoxrd.model.ScanEventBus;
import gsecars.tomoxrd.service.beamline.DetectorSequencer;
import gsecars.tomoxrd.service.beamline.MotorAxis;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the tomography / diffraction geometry moves. Moves run on the calling thread.
 */
class GeometryControllerTest {

    private SimulatedBeamline beamline;
    private PvNames names;
    private ExclusiveOperationGuard guard;
    private RecordingListener listener;
    private GeometryController controller;

    @BeforeEach
    void setUp() {
        beamline = new SimulatedBeamline();
        names = beamline.names();
        guard = new ExclusiveOperationGuard();
        ScanEventBus events = new ScanEventBus();
        listener = new RecordingListener();
        events.subscribe(listener);
        controller = new GeometryController(
                new DetectorSequencer(beamline, names, Duration.ofSeconds(1)),
                new MotorAxis(beamline, names.detectorXMotor()),
                new MotorAxis(beamline, names.detectorZMotor()),
                beamline, names, events, guard, GeometryPositions.defaults(), ScanStateMachineTest.FAST,
                Runnable::run);
    }

    @Test
    @DisplayName("Move to tomo retracts Z, moves X, then sets Z")
    void testMoveToTomo() throws Exception {
        assertTrue(controller.toggleMoveToTomo().get(5, TimeUnit.SECONDS));

        assertEquals(List.of("100.0", "50.0"), beamline.putsTo(names.detectorZMotor() + ".VAL"));
        assertEquals(List.of("-127.0"), beamline.putsTo(names.detectorXMotor() + ".VAL"));
        assertEquals(List.of("Moving to Tomo", "Idle"), listener.statuses);
        assertEquals(List.of("MOVE_TO_TOMO started", "MOVE_TO_TOMO ended"), listener.geometryMoves);
        assertTrue(guard.isIdle());
    }

    @Test
    void testMoveToXrd() throws Exception {
        beamline.addMotor(names.detectorXMotor(), -127.0, -200.0, 200.0);
        beamline.addMotor(names.detectorZMotor(), 50.0, -200.0, 200.0);

        assertTrue(controller.toggleMoveToXrd().get(5, TimeUnit.SECONDS));

        assertEquals(95.0, beamline.doubleValue(names.detectorXMotor() + ".RBV"), 1e-12);
        assertEquals(0.0, beamline.doubleValue(names.detectorZMotor() + ".RBV"), 1e-12);
    }

    @Test
    @DisplayName("No motion with the shutter open")
    void testShutterOpenRefusesMove() throws Exception {
        beamline.set(names.shutter(), 1);

        assertFalse(controller.toggleMoveToTomo().get(5, TimeUnit.SECONDS));

        assertEquals(List.of("Can't move to tomo when the shutter is open!!!"), listener.errors);
        assertTrue(beamline.puts().isEmpty());
        assertTrue(guard.isIdle());
    }

    @Test
    void testShutterOpenRefusesXrdMove() throws Exception {
        beamline.set(names.shutter(), 1);

        assertFalse(controller.toggleMoveToXrd().get(5, TimeUnit.SECONDS));

        assertEquals(List.of("Can't move to XRD when the shutter is open!!!"), listener.errors);
    }

    @Test
    @DisplayName("X does not move if Z did not reach the out position")
    void testStalledRetractStopsSequence() throws Exception {
        beamline.afterPut(names.detectorZMotor() + ".VAL",
                () -> beamline.setReadback(names.detectorZMotor(), 40.0));

        assertFalse(controller.toggleMoveToTomo().get(5, TimeUnit.SECONDS));

        assertTrue(beamline.putsTo(names.detectorXMotor() + ".VAL").isEmpty());
        assertEquals(1, listener.errors.size());
    }

    @Test
    @DisplayName("Toggling during the move stops it and hits every all-stop")
    void testToggleDuringMoveStops() throws Exception {
        AtomicReference<Boolean> secondToggle = new AtomicReference<>();
        beamline.afterPut(names.detectorXMotor() + ".VAL",
                () -> secondToggle.set(controller.toggleMoveToTomo().join()));

        assertFalse(controller.toggleMoveToTomo().get(5, TimeUnit.SECONDS));

        assertEquals(Boolean.FALSE, secondToggle.get());
        for (String stop : names.allStop()) {
            assertEquals(List.of("1"), beamline.putsTo(stop));
        }
        assertEquals(List.of("100.0"), beamline.putsTo(names.detectorZMotor() + ".VAL"));
        assertTrue(listener.statuses.contains("Aborting"));
        assertEquals("Idle", listener.statuses.get(listener.statuses.size() - 1));
        assertTrue(guard.isIdle());
    }

    @Test
    @DisplayName("Geometry moves are refused while a collection holds the stages")
    void testRefusedDuringScan() throws Exception {
        assertTrue(guard.tryAcquire(ActiveOperation.SCAN));

        assertFalse(controller.toggleMoveToTomo().get(5, TimeUnit.SECONDS));

        assertTrue(beamline.puts().isEmpty());
        assertTrue(guard.isHeldBy(ActiveOperation.SCAN));
    }

    @Test
    void testAbortWithoutMoveDoesNothing() {
        controller.abort();
        assertTrue(beamline.puts().isEmpty());
        assertFalse(controller.isMoving());
    }

    @Test
    void testMoveFailureIsReported() throws Exception {
        beamline.failPut(names.detectorXMotor() + ".VAL");

        assertFalse(controller.toggleMoveToTomo().get(5, TimeUnit.SECONDS));

        assertEquals(1, listener.errors.size());
        assertTrue(listener.errors.get(0).startsWith("Move to Tomo failed"));
        assertTrue(guard.isIdle());
    }
}
