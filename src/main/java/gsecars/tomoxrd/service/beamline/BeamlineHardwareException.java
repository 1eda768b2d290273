package gsecars.tomoxrd.service.beamline;

import java.io.IOException;

/**
 * Exception thrown when beamline hardware reports an error or an unexpected value.
 * This exception is used to distinguish between transport errors raised by the
 * process-variable layer and actual hardware problems (e.g. a motor that never
 * reaches its target, or a register that returns something unparseable).
 *
 * @since 0.1
 */
public class BeamlineHardwareException extends IOException {

    /**
     * Constructs a new beamline hardware exception with the specified detail message.
     *
     * @param message the detail message
     */
    public BeamlineHardwareException(String message) {
        super(message);
    }

    /**
     * Constructs a new beamline hardware exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause
     */
    public BeamlineHardwareException(String message, Throwable cause) {
        super(message, cause);
    }
}
