package gsecars.tomoxrd.model;

import java.time.Duration;

/**
 * Delays, poll periods and hardware timeouts.
 *
 * @param settle           pause after arming the PSO, after starting acquisition and after the shutter closes
 * @param pollInterval     status poll period
 * @param elapsedInterval  elapsed-time tick period
 * @param geometrySettle   pause after every geometry move before the abort flag is cleared
 * @param moveTimeout      limit for blocking motor moves
 * @param returnTimeout    limit for the rotation axis to return to its start after a scan
 * @param ackTimeout       limit for register writes that wait for processing
 */
public record TimingSettings(Duration settle,
                             Duration pollInterval,
                             Duration elapsedInterval,
                             Duration geometrySettle,
                             Duration moveTimeout,
                             Duration returnTimeout,
                             Duration ackTimeout) {

    public static TimingSettings defaults() {
        return new TimingSettings(
                Duration.ofMillis(500),
                Duration.ofMillis(50),
                Duration.ofMillis(100),
                Duration.ofSeconds(2),
                Duration.ofSeconds(300),
                Duration.ofSeconds(300),
                Duration.ofSeconds(300));
    }
}
