package gsecars.tomoxrd.utilities;

import gsecars.tomoxrd.model.AxisSnapshot;
import gsecars.tomoxrd.model.MotionProfile;
import gsecars.tomoxrd.model.ScanKind;
import gsecars.tomoxrd.model.ScanRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MotionSyncPlanner
 *
 * <p>Turns an angular range and exposure into a pulse pattern the PSO controller can
 * realize exactly:
 * <ul>
 *   <li>the step is snapped to a whole number of encoder counts,</li>
 *   <li>the stage gets enough taxi distance to reach constant velocity before the first window,</li>
 *   <li>the pulse window is expressed in counts relative to the taxi start, oriented by the overall sense.</li>
 * </ul>
 *
 * <p>All rounding is half-to-even ({@link Math#rint}), matching the controller-side scripts
 * this was commissioned against. Step and wide scans pad the taxi distance differently;
 * both conventions are kept as separate branches.</p>
 *
 * @since 0.1
 */
public final class MotionSyncPlanner {
    private static final Logger logger = LoggerFactory.getLogger(MotionSyncPlanner.class);

    /** Readout dead time added to every exposure, seconds. */
    public static final double FRAME_OVERHEAD_SECONDS = 0.005;

    /** Counts added on each side of the pulse window to absorb controller jitter. */
    public static final int WINDOW_PADDING_COUNTS = 5;

    /** Relative margin applied to the acceleration distance of wide scans. */
    public static final double WIDE_TAXI_MARGIN = 0.001;

    public static final String STEP_EXCEEDS_RANGE_MESSAGE =
            "Step size cannot be greater than the total range of the collection!";

    private MotionSyncPlanner() {
    }

    /**
     * Pulse window in encoder counts relative to the arm position, padding included.
     */
    public record PulseWindow(long start, long end) {
    }

    /**
     * Overall sense: +1 if the move increases encoder counts, -1 otherwise.
     *
     * @param start           start position in user units
     * @param end             end position in user units
     * @param encoderDirSign  +1/-1, encoder direction relative to dial
     * @param motorDirSign    +1/-1, dial direction relative to user
     * @throws IllegalArgumentException if {@code start == end} or a sign is not ±1
     */
    public static int computeSenses(double start, double end, int encoderDirSign, int motorDirSign) {
        if (start == end) {
            throw new IllegalArgumentException("Start and end positions cannot be equal (" + start + ")");
        }
        requireUnitSign("encoder direction", encoderDirSign);
        requireUnitSign("motor direction", motorDirSign);
        int userDirection = end > start ? 1 : -1;
        return userDirection * motorDirSign * encoderDirSign;
    }

    /**
     * Encoder counts per pulse: the step for step scans, the whole range for wide scans.
     */
    public static int computeEncoderCounts(boolean isWideScan, double rotationStepOrDelta, double countsPerDegree) {
        int counts = (int) Math.rint(rotationStepOrDelta * countsPerDegree);
        logger.debug("{} scan: {} deg at {} counts/deg -> {} counts",
                isWideScan ? "Wide" : "Step", rotationStepOrDelta, countsPerDegree, counts);
        return counts;
    }

    /**
     * Travel added before the start so the stage is at speed when the window opens.
     *
     * <p>Step scans round the acceleration distance to a whole number of steps plus half a
     * step. Wide scans add {@link #WIDE_TAXI_MARGIN} of the acceleration distance and round
     * up to a whole degree.</p>
     */
    public static double computeTaxiDistance(double accelDistance, double rotationStep, boolean isWideScan) {
        if (rotationStep > 0) {
            if (!isWideScan) {
                return Math.ceil(accelDistance / rotationStep + 0.5) * rotationStep;
            }
            return Math.ceil(accelDistance + accelDistance * WIDE_TAXI_MARGIN);
        }
        if (!isWideScan) {
            return Math.floor(accelDistance / rotationStep - 0.5) * rotationStep;
        }
        return Math.ceil(accelDistance - accelDistance * WIDE_TAXI_MARGIN);
    }

    /**
     * Fixed pulse distance of a wide scan: the padded acceleration distance in counts.
     * Also used as the window lead.
     */
    public static int computeWidePulseDistance(double accelDistance, double countsPerDegree) {
        return (int) Math.rint(Math.ceil(accelDistance + accelDistance * WIDE_TAXI_MARGIN) * countsPerDegree);
    }

    /**
     * Builds the pulse window. The window always satisfies {@code start < end}.
     *
     * @param isWideScan            wide scans lead by {@code accelDistanceCounts}, step scans by half a step
     * @param overallSense          ±1 from {@link #computeSenses}
     * @param encoderCountsPerStep  counts between pulses (sign ignored)
     * @param numAngles             number of pulses
     * @param accelDistanceCounts   wide-scan lead in counts
     */
    public static PulseWindow computeWindow(boolean isWideScan,
                                            int overallSense,
                                            int encoderCountsPerStep,
                                            int numAngles,
                                            int accelDistanceCounts) {
        requireUnitSign("overall sense", overallSense);
        long counts = Math.abs((long) encoderCountsPerStep);
        long rangeStart = isWideScan
                ? -(long) accelDistanceCounts * overallSense
                : -(long) Math.rint(counts / 2.0) * overallSense;
        long rangeLength = counts * numAngles;

        long windowStart;
        long windowEnd;
        if (overallSense > 0) {
            windowStart = rangeStart;
            windowEnd = windowStart + rangeLength;
        } else {
            windowEnd = rangeStart;
            windowStart = windowEnd - rangeLength;
        }
        return new PulseWindow(windowStart - WINDOW_PADDING_COUNTS, windowEnd + WINDOW_PADDING_COUNTS);
    }

    /**
     * Full motion profile for a rotating scan.
     *
     * @throws IllegalArgumentException for stills, zero ranges, or a step wider than the range
     * @throws IllegalStateException    if the snapped rotation step or the pulse distance is not
     *                                  positive (bad axis configuration)
     */
    public static MotionProfile plan(ScanRequest request, AxisSnapshot axis) {
        ScanKind kind = request.kind();
        if (!kind.rotates()) {
            throw new IllegalArgumentException("Still collections have no motion profile");
        }
        if (request.stepExceedsRange()) {
            throw new IllegalArgumentException(STEP_EXCEEDS_RANGE_MESSAGE);
        }
        double start = request.start();
        double end = request.end();
        boolean wide = kind == ScanKind.WIDE;
        int overallSense = computeSenses(start, end, axis.encoderDirection(), axis.motorDirection());

        double countsPerDegree = axis.countsPerDegree();
        double delta = Math.abs(end - start);
        int encoderCounts = computeEncoderCounts(wide, wide ? delta : request.step(), countsPerDegree);
        double rotationStep = encoderCounts / countsPerDegree;
        if (!(rotationStep > 0)) {
            throw new IllegalStateException(String.format(
                    "Rotation step %s is not realizable: %d counts at %s counts/deg",
                    rotationStep, encoderCounts, countsPerDegree));
        }

        double timePerAngle = request.exposure() + FRAME_OVERHEAD_SECONDS;
        double motorSpeed = Math.abs(rotationStep / timePerAngle);
        double accelDistance = axis.accelerationTime() / 2.0 * motorSpeed;
        int numAngles = (int) Math.rint(delta / rotationStep);

        int userDirection = end > start ? 1 : -1;
        double taxiDistance = computeTaxiDistance(accelDistance, rotationStep, wide);
        double taxiStart = start - taxiDistance * userDirection;

        int pulseDistance = wide ? computeWidePulseDistance(accelDistance, countsPerDegree) : Math.abs(encoderCounts);
        if (pulseDistance <= 0) {
            throw new IllegalStateException(String.format(
                    "Pulse distance of %d counts is not realizable; check the rotation acceleration time (%s s)",
                    pulseDistance, axis.accelerationTime()));
        }
        PulseWindow window = computeWindow(wide, overallSense, encoderCounts, numAngles, pulseDistance);

        MotionProfile profile = new MotionProfile(kind, start, end, request.exposure(),
                rotationStep, numAngles, encoderCounts, pulseDistance,
                taxiStart, end, overallSense, motorSpeed, axis.maxVelocity(), accelDistance,
                window.start(), window.end());
        logger.info("Planned {} scan {} -> {}: step {} deg ({} counts), {} angles, speed {} deg/s, taxi {} -> {}, window [{}, {}]",
                kind, start, end, rotationStep, encoderCounts, numAngles, motorSpeed,
                taxiStart, end, window.start(), window.end());
        return profile;
    }

    /**
     * Rough duration of one collection, including the fixed settle delays.
     */
    public static double estimateCollectionSeconds(ScanRequest request) {
        if (request.kind() == ScanKind.STEP) {
            return Math.rint(request.range() / request.step()) * request.exposure() + 2.0;
        }
        return request.exposure() + 1.5;
    }

    private static void requireUnitSign(String what, int sign) {
        if (sign != 1 && sign != -1) {
            throw new IllegalArgumentException("The " + what + " must be +1 or -1, got " + sign);
        }
    }
}
