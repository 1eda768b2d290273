package gsecars.tomoxrd.service.beamline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MotorAxisTest {

    @Mock
    private ProcessVariableAccess pvs;

    @Test
    void testLimitViolation() throws IOException {
        when(pvs.getDouble("13BMD:m119.LLM")).thenReturn(-10.0);
        when(pvs.getDouble("13BMD:m119.HLM")).thenReturn(10.0);
        MotorAxis axis = new MotorAxis(pvs, "13BMD:m119");

        assertEquals(Optional.of("You have reached the low limit of the 13BMD:m119."), axis.limitViolation(-10.5));
        assertEquals(Optional.of("You have reached the high limit of the 13BMD:m119."), axis.limitViolation(10.5));
        assertEquals(Optional.empty(), axis.limitViolation(10.0));
    }

    @Test
    void testDirection() throws IOException {
        MotorAxis axis = new MotorAxis(pvs, "m1");
        when(pvs.getInt("m1.DIR")).thenReturn(0, 1);
        assertEquals(1, axis.direction());
        assertEquals(-1, axis.direction());
    }

    @Test
    void testMovesWaitOrNot() throws IOException {
        MotorAxis axis = new MotorAxis(pvs, "m1");
        Duration timeout = Duration.ofSeconds(5);

        axis.moveTo(3.0, timeout);
        axis.startMove(4.0);

        verify(pvs).put("m1.VAL", 3.0, true, timeout);
        verify(pvs).put("m1.VAL", 4.0);
    }

    @Test
    @DisplayName("Position wait compares at four decimals")
    void testWaitForPosition() throws IOException {
        MotorAxis axis = new MotorAxis(pvs, "m1");
        when(pvs.getDouble("m1.RBV")).thenReturn(1.0, 4.99, 5.00001);

        axis.waitForPosition(5.0, Duration.ofSeconds(5), Duration.ofMillis(1));

        verify(pvs, times(3)).getDouble("m1.RBV");
    }

    @Test
    void testWaitForPositionTimesOut() throws IOException {
        MotorAxis axis = new MotorAxis(pvs, "m1");
        when(pvs.getDouble(anyString())).thenReturn(0.0);

        HardwareTimeoutException e = assertThrows(HardwareTimeoutException.class,
                () -> axis.waitForPosition(5.0, Duration.ofMillis(20), Duration.ofMillis(5)));
        assertEquals("m1.RBV", e.getProcessVariable());
    }
}
