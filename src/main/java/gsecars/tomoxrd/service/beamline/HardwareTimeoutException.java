package gsecars.tomoxrd.service.beamline;

import java.time.Duration;

/**
 * Raised when a blocking write or a position wait does not complete in time.
 * Never retried automatically.
 */
public class HardwareTimeoutException extends BeamlineHardwareException {

    private final String processVariable;
    private final Duration timeout;

    public HardwareTimeoutException(String processVariable, Duration timeout) {
        super("Timed out after " + timeout.toMillis() + " ms waiting for " + processVariable);
        this.processVariable = processVariable;
        this.timeout = timeout;
    }

    public String getProcessVariable() {
        return processVariable;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
