package gsecars.tomoxrd.service.beamline;

import gsecars.tomoxrd.utilities.MinorFunctions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;

/**
 * A motor record accessed through its standard fields
 * ({@code .VAL .RBV .LLM .HLM .VELO .VMAX .DIR .ACCL}).
 *
 * @since 0.1
 */
public class MotorAxis {
    private static final Logger logger = LoggerFactory.getLogger(MotorAxis.class);

    /** Readbacks are compared with targets at this many decimals. */
    public static final int POSITION_DECIMALS = 4;

    private final ProcessVariableAccess pvs;
    private final String record;

    public MotorAxis(ProcessVariableAccess pvs, String record) {
        this.pvs = pvs;
        this.record = record;
    }

    public String getRecord() {
        return record;
    }

    /** Readback position. */
    public double position() throws IOException {
        return pvs.getDouble(record + ".RBV");
    }

    /** Commanded position. */
    public double target() throws IOException {
        return pvs.getDouble(record + ".VAL");
    }

    public double lowLimit() throws IOException {
        return pvs.getDouble(record + ".LLM");
    }

    public double highLimit() throws IOException {
        return pvs.getDouble(record + ".HLM");
    }

    public double maxVelocity() throws IOException {
        return pvs.getDouble(record + ".VMAX");
    }

    public double accelerationTime() throws IOException {
        return pvs.getDouble(record + ".ACCL");
    }

    /**
     * @return +1 when user and dial directions agree ({@code .DIR == 0}), -1 otherwise
     */
    public int direction() throws IOException {
        return pvs.getInt(record + ".DIR") == 0 ? 1 : -1;
    }

    public void setVelocity(double velocity) throws IOException {
        logger.debug("{} velocity -> {}", record, velocity);
        pvs.put(record + ".VELO", velocity);
    }

    /**
     * Moves and blocks until the record reports completion.
     */
    public void moveTo(double position, Duration timeout) throws IOException {
        logger.info("Moving {} to {}", record, position);
        pvs.put(record + ".VAL", position, true, timeout);
    }

    /**
     * Starts a move without waiting.
     */
    public void startMove(double position) throws IOException {
        logger.info("Starting {} move to {}", record, position);
        pvs.put(record + ".VAL", position);
    }

    /**
     * Checks a position against the soft limits.
     *
     * @return the operator message for the violated limit, or empty if the position is allowed
     */
    public Optional<String> limitViolation(double position) throws IOException {
        if (position < lowLimit()) {
            return Optional.of("You have reached the low limit of the " + record + ".");
        }
        if (position > highLimit()) {
            return Optional.of("You have reached the high limit of the " + record + ".");
        }
        return Optional.empty();
    }

    /**
     * Polls the readback until it matches {@code target} at {@link #POSITION_DECIMALS} decimals.
     *
     * @throws HardwareTimeoutException if the axis is not there within {@code timeout}
     */
    public void waitForPosition(double target, Duration timeout, Duration pollInterval) throws IOException {
        double expected = MinorFunctions.round(target, POSITION_DECIMALS);
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            double readback = MinorFunctions.round(position(), POSITION_DECIMALS);
            if (readback == expected) {
                logger.debug("{} reached {}", record, expected);
                return;
            }
            if (System.nanoTime() - deadline >= 0) {
                logger.error("{} did not reach {} within {} ms (readback {})",
                        record, expected, timeout.toMillis(), readback);
                throw new HardwareTimeoutException(record + ".RBV", timeout);
            }
            MinorFunctions.pause(pollInterval);
        }
    }
}
