package gsecars.tomoxrd.service.beamline;

import gsecars.tomoxrd.model.AxisSnapshot;
import gsecars.tomoxrd.model.MotionProfile;
import gsecars.tomoxrd.model.ScanRequest;
import gsecars.tomoxrd.utilities.MotionSyncPlanner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PulseGeneratorProgramTest {

    @Test
    @DisplayName("Program for a planned step scan")
    void testForProfile() {
        MotionProfile profile = MotionSyncPlanner.plan(
                ScanRequest.step(0.1, 0.0, 80.0, 0.5, 1, "s", "/d/", false),
                new AxisSnapshot(360000.0, 1, 1, 0.5, 10.0));

        List<String> commands = PulseGeneratorProgram.forProfile("X", profile, 0.0001, 3);

        assertEquals(List.of(
                "PSOCONTROL X RESET",
                "PSOOUTPUT X CONTROL 0 1",
                "PSOPULSE X TIME 0.0001,0.0001",
                "PSOOUTPUT X PULSE WINDOW MASK",
                "PSOTRACK X INPUT 3",
                "PSODISTANCE X FIXED 500",
                "PSOWINDOW X 1 INPUT 3",
                "PSOWINDOW X 1 RANGE -255,79755"), commands);
    }

    @Test
    void testPulseWidthFormatting() {
        List<String> commands = PulseGeneratorProgram.forAxis("X")
                .reset().outputControl().pulseWidth(50.0).windowMask()
                .trackInput(1).fixedDistance(10).windowInput(1).windowRange(-5, 15)
                .commands();
        assertEquals("PSOPULSE X TIME 50,50", commands.get(2));
    }

    @Test
    @DisplayName("Steps out of order fail before any command is produced")
    void testOutOfOrderStepIsRejected() {
        PulseGeneratorProgram program = PulseGeneratorProgram.forAxis("X").reset();
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> program.pulseWidth(0.1));
        assertTrue(e.getMessage().contains("PULSE_WIDTH"));
        assertTrue(e.getMessage().contains("RESET"));

        assertThrows(IllegalStateException.class, () -> PulseGeneratorProgram.forAxis("X").outputControl());
    }

    @Test
    void testIncompleteProgramIsRejected() {
        PulseGeneratorProgram program = PulseGeneratorProgram.forAxis("X").reset().outputControl();
        assertThrows(IllegalStateException.class, program::commands);
    }

    @Test
    void testArgumentValidation() {
        assertThrows(IllegalArgumentException.class, () -> PulseGeneratorProgram.forAxis(" "));
        PulseGeneratorProgram program = PulseGeneratorProgram.forAxis("X")
                .reset().outputControl().pulseWidth(1).windowMask().trackInput(1);
        assertThrows(IllegalArgumentException.class, () -> program.fixedDistance(0));

        PulseGeneratorProgram ranged = PulseGeneratorProgram.forAxis("X")
                .reset().outputControl().pulseWidth(1).windowMask().trackInput(1).fixedDistance(1).windowInput(1);
        assertThrows(IllegalArgumentException.class, () -> ranged.windowRange(10, 10));
    }

    @Test
    void testSingleCommands() {
        assertEquals("PSOCONTROL X ARM", PulseGeneratorProgram.arm("X"));
        assertEquals("PSOWINDOW X 1 OFF", PulseGeneratorProgram.windowOff("X"));
        assertEquals("PSOCONTROL X OFF", PulseGeneratorProgram.controlOff("X"));
        assertEquals("UNITSTOCOUNTS(X, 360.0)", PulseGeneratorProgram.unitsToCounts("X"));
    }
}
