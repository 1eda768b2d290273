package gsecars.tomoxrd.service.beamline;

import java.io.IOException;
import java.time.Duration;

/**
 * Typed key/value access to beamline process variables.
 *
 * <p>Keys are full process-variable names such as {@code 13BMD:m119.VAL} or
 * {@code 13PIL1MCdTe:cam1:Armed}. The transport behind this interface (Channel Access,
 * pvAccess, a simulator) is supplied by the caller; this core only sequences calls.</p>
 *
 * <p>A {@code put} with {@code waitForAck} suspends the calling thread until the
 * record finishes processing or the timeout expires, in which case implementations
 * throw {@link HardwareTimeoutException}.</p>
 */
public interface ProcessVariableAccess {

    /**
     * Reads the current value of a process variable.
     *
     * @param name full process-variable name
     * @return the value (Number, String or Boolean depending on record type), never null
     * @throws IOException if the read fails
     */
    Object get(String name) throws IOException;

    /**
     * Writes a process variable.
     *
     * @param name full process-variable name
     * @param value value to write
     * @param waitForAck block until the write has been processed
     * @param timeout maximum time to wait when {@code waitForAck} is true
     * @throws IOException if the write fails or times out
     */
    void put(String name, Object value, boolean waitForAck, Duration timeout) throws IOException;

    /**
     * Fire-and-forget write.
     */
    default void put(String name, Object value) throws IOException {
        put(name, value, false, Duration.ZERO);
    }

    default double getDouble(String name) throws IOException {
        Object v = get(name);
        if (v instanceof Number n) {
            return n.doubleValue();
        }
        if (v instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        try {
            return Double.parseDouble(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new BeamlineHardwareException("Expected a number from " + name + " but got " + v, e);
        }
    }

    default int getInt(String name) throws IOException {
        return (int) Math.round(getDouble(name));
    }

    default String getString(String name) throws IOException {
        Object v = get(name);
        return v == null ? "" : v.toString();
    }
}
