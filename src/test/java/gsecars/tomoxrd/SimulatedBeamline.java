package gsecars.tomoxrd;

import gsecars.tomoxrd.model.PvNames;
import gsecars.tomoxrd.service.beamline.BeamlineHardwareException;
import gsecars.tomoxrd.service.beamline.ProcessVariableAccess;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * In-memory beamline for testing the acquisition core without Channel Access.
 *
 * <p>The simulation keeps every process variable in a map and reacts to the writes the
 * core issues:</p>
 * <ul>
 *   <li>Motors arrive instantly: a write to {@code .VAL} also sets {@code .RBV}</li>
 *   <li>{@code Acquire=1} starts {@code NumImages} frames; each read of {@code Armed} delivers one</li>
 *   <li>{@code UNITSTOCOUNTS} on the PSO command register answers in {@code BINP}</li>
 *   <li>Error injection for reads and writes of single PVs</li>
 *   <li>Hooks run after a write, for aborting mid-sequence</li>
 * </ul>
 *
 * <p>Reading a PV that was never defined fails, so tests notice unexpected reads.</p>
 *
 * @since 0.1
 */
public class SimulatedBeamline implements ProcessVariableAccess {
    private static final Logger logger = LoggerFactory.getLogger(SimulatedBeamline.class);

    public static final double COUNTS_PER_ROTATION = 360000.0;

    private final PvNames names;
    private final Map<String, Object> values = new HashMap<>();
    private final List<String> puts = new ArrayList<>();
    private final Set<String> failingGets = new HashSet<>();
    private final Set<String> failingPuts = new HashSet<>();
    private final Map<String, Runnable> afterPut = new HashMap<>();
    private int framesRemaining;

    public SimulatedBeamline() {
        this(PvNames.defaults());
    }

    public SimulatedBeamline(PvNames names) {
        this.names = names;

        set(names.pso("PSOAxisName"), "X");
        set(names.pso("PSOEncoderInput"), "3");
        set(names.pso("PSOPulseWidth"), 0.0001);
        set(names.pso("PSOCountsPerRotation"), COUNTS_PER_ROTATION);
        set(names.pso("PSOEncoderCountsPerStep"), 1);
        set(names.pso("PSOCommand.BINP"), "%" + COUNTS_PER_ROTATION);

        set(names.cam("FilePath"), "/data/previous/");
        set(names.cam("FileName"), "previous");
        set(names.cam("FileNumber"), 7);
        set(names.cam("NumImages"), 1);
        set(names.cam("Armed"), 0);
        set(names.cam("ArrayCounter_RBV"), 0);
        set(names.tiff("FilePath"), "/data/previous/");
        set(names.tiff("FileName"), "previous");
        set(names.tiff("FileNumber"), 1);

        set(names.shutter(), 0);

        addMotor(names.rotationMotor(), 0.0, -360.0, 360.0);
        addMotor(names.horizontalMotor(), 0.0, -10.0, 10.0);
        addMotor(names.verticalMotor(), 0.0, -10.0, 10.0);
        addMotor(names.focusMotor(), 0.0, -10.0, 10.0);
        addMotor(names.detectorXMotor(), 95.0, -200.0, 200.0);
        addMotor(names.detectorZMotor(), 0.0, -200.0, 200.0);
    }

    // ==================== Setup ====================

    public synchronized SimulatedBeamline addMotor(String record, double position, double low, double high) {
        set(record + ".VAL", position);
        set(record + ".RBV", position);
        set(record + ".LLM", low);
        set(record + ".HLM", high);
        set(record + ".VMAX", 10.0);
        set(record + ".VELO", 1.0);
        set(record + ".ACCL", 0.5);
        set(record + ".DIR", 0);
        return this;
    }

    public synchronized void set(String name, Object value) {
        values.put(name, value);
    }

    /** Moves a motor readback without commanding it, e.g. a stage that stalled. */
    public synchronized void setReadback(String record, double position) {
        values.put(record + ".RBV", position);
    }

    public synchronized void failGet(String name) {
        failingGets.add(name);
    }

    public synchronized void failPut(String name) {
        failingPuts.add(name);
    }

    /**
     * Runs {@code action} after every successful write to {@code name}.
     */
    public synchronized void afterPut(String name, Runnable action) {
        afterPut.put(name, action);
    }

    public PvNames names() {
        return names;
    }

    // ==================== Inspection ====================

    public synchronized Object value(String name) {
        return values.get(name);
    }

    public synchronized double doubleValue(String name) {
        return ((Number) values.get(name)).doubleValue();
    }

    /** Every write as {@code name=value}, in order. */
    public synchronized List<String> puts() {
        return List.copyOf(puts);
    }

    /** Values written to {@code name}, in order. */
    public synchronized List<String> putsTo(String name) {
        String prefix = name + "=";
        return puts.stream()
                .filter(p -> p.startsWith(prefix))
                .map(p -> p.substring(prefix.length()))
                .collect(Collectors.toList());
    }

    /** PSO commands sent through the command register, in order. */
    public List<String> psoCommands() {
        return putsTo(names.pso("PSOCommand.BOUT"));
    }

    // ==================== ProcessVariableAccess ====================

    @Override
    public Object get(String name) throws BeamlineHardwareException {
        synchronized (this) {
            if (failingGets.contains(name)) {
                throw new BeamlineHardwareException("Simulated read failure: " + name);
            }
            if (name.equals(names.cam("Armed"))) {
                return deliverFrame();
            }
            Object value = values.get(name);
            if (value == null) {
                throw new BeamlineHardwareException("Unknown process variable: " + name);
            }
            return value;
        }
    }

    @Override
    public void put(String name, Object value, boolean waitForAck, Duration timeout) throws BeamlineHardwareException {
        Runnable hook;
        synchronized (this) {
            if (failingPuts.contains(name)) {
                throw new BeamlineHardwareException("Simulated write failure: " + name);
            }
            puts.add(name + "=" + value);
            values.put(name, value);
            logger.trace("{} <- {} (wait {})", name, value, waitForAck);

            if (name.endsWith(".VAL")) {
                String record = name.substring(0, name.length() - ".VAL".length());
                values.put(record + ".RBV", ((Number) value).doubleValue());
            } else if (name.equals(names.cam("Acquire"))) {
                startOrStopAcquisition(((Number) value).intValue() != 0);
            } else if (name.equals(names.pso("PSOCommand.BOUT")) && value.toString().startsWith("UNITSTOCOUNTS")) {
                values.put(names.pso("PSOCommand.BINP"), "%" + COUNTS_PER_ROTATION);
            }
            hook = afterPut.get(name);
        }
        if (hook != null) {
            hook.run();
        }
    }

    private void startOrStopAcquisition(boolean start) {
        if (start) {
            framesRemaining = ((Number) values.get(names.cam("NumImages"))).intValue();
            values.put(names.cam("ArrayCounter_RBV"), 0);
            values.put(names.cam("Armed"), 1);
        } else {
            framesRemaining = 0;
            values.put(names.cam("Armed"), 0);
        }
    }

    private int deliverFrame() {
        if (framesRemaining <= 0) {
            values.put(names.cam("Armed"), 0);
            return 0;
        }
        framesRemaining--;
        values.put(names.tiff("FileNumber"), ((Number) values.get(names.tiff("FileNumber"))).intValue() + 1);
        values.put(names.cam("ArrayCounter_RBV"), ((Number) values.get(names.cam("ArrayCounter_RBV"))).intValue() + 1);
        return 1;
    }
}
