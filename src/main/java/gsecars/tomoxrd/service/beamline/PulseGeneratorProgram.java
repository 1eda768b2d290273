package gsecars.tomoxrd.service.beamline;

import gsecars.tomoxrd.model.MotionProfile;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered command pipeline for the Aerotech PSO output.
 *
 * <p>The controller only ends up in a valid armed state when the commands are issued in
 * {@link Step} order. Each builder method checks that its step directly follows the previous
 * one, and {@link #commands()} refuses an incomplete program, so an out-of-order sequence
 * fails before anything reaches the hardware.</p>
 *
 * <pre>{@code
 * List<String> commands = PulseGeneratorProgram.forAxis("X")
 *         .reset()
 *         .outputControl()
 *         .pulseWidth(0.0001)
 *         .windowMask()
 *         .trackInput(3)
 *         .fixedDistance(500)
 *         .windowInput(3)
 *         .windowRange(-255, 80005)
 *         .commands();
 * }</pre>
 */
public final class PulseGeneratorProgram {

    /**
     * Programming steps in the only order the controller accepts.
     */
    public enum Step {
        RESET,
        OUTPUT_CONTROL,
        PULSE_WIDTH,
        WINDOW_MASK,
        TRACK_INPUT,
        FIXED_DISTANCE,
        WINDOW_INPUT,
        WINDOW_RANGE
    }

    private final String axis;
    private final List<String> commands = new ArrayList<>();
    private Step last;

    private PulseGeneratorProgram(String axis) {
        if (axis == null || axis.isBlank()) {
            throw new IllegalArgumentException("PSO axis name is required");
        }
        this.axis = axis.trim();
    }

    public static PulseGeneratorProgram forAxis(String axis) {
        return new PulseGeneratorProgram(axis);
    }

    /**
     * Full program for a planned scan.
     *
     * @param axis          controller axis name
     * @param profile       planned motion
     * @param pulseWidth    pulse width as configured on the controller
     * @param encoderInput  encoder input used for tracking and windowing
     */
    public static List<String> forProfile(String axis, MotionProfile profile, double pulseWidth, int encoderInput) {
        return forAxis(axis)
                .reset()
                .outputControl()
                .pulseWidth(pulseWidth)
                .windowMask()
                .trackInput(encoderInput)
                .fixedDistance(profile.pulseDistanceCounts())
                .windowInput(encoderInput)
                .windowRange(profile.windowStart(), profile.windowEnd())
                .commands();
    }

    public PulseGeneratorProgram reset() {
        return append(Step.RESET, "PSOCONTROL " + axis + " RESET");
    }

    public PulseGeneratorProgram outputControl() {
        return append(Step.OUTPUT_CONTROL, "PSOOUTPUT " + axis + " CONTROL 0 1");
    }

    public PulseGeneratorProgram pulseWidth(double width) {
        String w = formatNumber(width);
        return append(Step.PULSE_WIDTH, "PSOPULSE " + axis + " TIME " + w + "," + w);
    }

    public PulseGeneratorProgram windowMask() {
        return append(Step.WINDOW_MASK, "PSOOUTPUT " + axis + " PULSE WINDOW MASK");
    }

    public PulseGeneratorProgram trackInput(int input) {
        return append(Step.TRACK_INPUT, "PSOTRACK " + axis + " INPUT " + input);
    }

    public PulseGeneratorProgram fixedDistance(int counts) {
        if (counts <= 0) {
            throw new IllegalArgumentException("PSO distance must be positive, got " + counts);
        }
        return append(Step.FIXED_DISTANCE, "PSODISTANCE " + axis + " FIXED " + counts);
    }

    public PulseGeneratorProgram windowInput(int input) {
        return append(Step.WINDOW_INPUT, "PSOWINDOW " + axis + " 1 INPUT " + input);
    }

    public PulseGeneratorProgram windowRange(long start, long end) {
        if (start >= end) {
            throw new IllegalArgumentException("PSO window start " + start + " must be below end " + end);
        }
        return append(Step.WINDOW_RANGE, "PSOWINDOW " + axis + " 1 RANGE " + start + "," + end);
    }

    /**
     * @return the complete program
     * @throws IllegalStateException if the last step has not been added
     */
    public List<String> commands() {
        if (last != Step.WINDOW_RANGE) {
            throw new IllegalStateException("PSO program incomplete, last step was " + last);
        }
        return Collections.unmodifiableList(commands);
    }

    public static String arm(String axis) {
        return "PSOCONTROL " + axis + " ARM";
    }

    public static String windowOff(String axis) {
        return "PSOWINDOW " + axis + " 1 OFF";
    }

    public static String controlOff(String axis) {
        return "PSOCONTROL " + axis + " OFF";
    }

    public static String unitsToCounts(String axis) {
        return "UNITSTOCOUNTS(" + axis + ", 360.0)";
    }

    private PulseGeneratorProgram append(Step step, String command) {
        int expected = last == null ? 0 : last.ordinal() + 1;
        if (step.ordinal() != expected) {
            throw new IllegalStateException("PSO step " + step + " cannot follow "
                    + (last == null ? "the start of the program" : last));
        }
        commands.add(command);
        last = step;
        return this;
    }

    private static String formatNumber(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
