package gsecars.tomoxrd.service.beamline;

import gsecars.tomoxrd.model.DetectorProgram;
import gsecars.tomoxrd.model.MotionProfile;
import gsecars.tomoxrd.model.PvNames;
import gsecars.tomoxrd.model.ScanKind;
import gsecars.tomoxrd.model.TriggerMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Programs the PSO pulse generator, the area detector and the shutter for one scan, and
 * puts the detector back the way it was afterwards.
 *
 * <p>{@link #arm(DetectorProgram)} caches the file path, name and number registers it is
 * about to overwrite; {@link #disarm()} writes them back. Between the two calls this
 * sequencer holds the armed program; it is not meant to be shared by concurrent scans.</p>
 *
 * @since 0.1
 */
public class DetectorSequencer {
    private static final Logger logger = LoggerFactory.getLogger(DetectorSequencer.class);

    private final ProcessVariableAccess pvs;
    private final PvNames names;
    private final Duration ackTimeout;

    private volatile DetectorProgram armedProgram;
    private volatile SavedRegisters saved;

    /**
     * Register values overwritten by {@link #arm}.
     */
    private record SavedRegisters(String tiffFilePath,
                                  String tiffFileName,
                                  String detectorFilePath,
                                  String detectorFileName,
                                  Integer detectorFileNumber) {
    }

    @FunctionalInterface
    private interface HardwareStep {
        void run() throws IOException;
    }

    public DetectorSequencer(ProcessVariableAccess pvs, PvNames names, Duration ackTimeout) {
        this.pvs = pvs;
        this.names = names;
        this.ackTimeout = ackTimeout;
    }

    // ==================== Pulse generator ====================

    public String readPsoAxisName() throws IOException {
        return pvs.getString(names.pso("PSOAxisName")).trim();
    }

    /**
     * Asks the controller how many encoder counts make a full turn and publishes the
     * answer to {@code PSOCountsPerRotation}. The reply carries a one-character status prefix.
     */
    public double initializeCountsPerRotation() throws IOException {
        String axis = readPsoAxisName();
        sendPsoCommand(PulseGeneratorProgram.unitsToCounts(axis));
        String reply = pvs.getString(names.pso("PSOCommand.BINP")).trim();
        if (reply.length() < 2) {
            throw new BeamlineHardwareException("Unexpected UNITSTOCOUNTS reply: '" + reply + "'");
        }
        double countsPerRotation;
        try {
            countsPerRotation = Double.parseDouble(reply.substring(1));
        } catch (NumberFormatException e) {
            throw new BeamlineHardwareException("Unexpected UNITSTOCOUNTS reply: '" + reply + "'", e);
        }
        pvs.put(names.pso("PSOCountsPerRotation"), countsPerRotation);
        logger.info("PSO axis {} has {} counts per rotation", axis, countsPerRotation);
        return countsPerRotation;
    }

    public double readCountsPerRotation() throws IOException {
        return pvs.getDouble(names.pso("PSOCountsPerRotation"));
    }

    /**
     * Sign of the published counts-per-step, i.e. the encoder direction relative to dial.
     */
    public int readEncoderDirection() throws IOException {
        return pvs.getDouble(names.pso("PSOEncoderCountsPerStep")) > 0 ? 1 : -1;
    }

    /**
     * Publishes the planned counts and taxi positions, then issues the PSO program in order.
     * Every command waits for acknowledgement before the next one is sent.
     */
    public void programPulseGenerator(MotionProfile profile) throws IOException {
        String axis = readPsoAxisName();
        int encoderInput = readEncoderInput();
        double pulseWidth = pvs.getDouble(names.pso("PSOPulseWidth"));
        List<String> program = PulseGeneratorProgram.forProfile(axis, profile, pulseWidth, encoderInput);

        pvs.put(names.pso("PSOEncoderCountsPerStep"), profile.encoderCountsPerStep());
        pvs.put(names.pso("PSOStartTaxi"), profile.taxiStart());
        pvs.put(names.pso("PSOEndTaxi"), profile.taxiEnd());
        logger.info("Programming PSO on axis {} ({} commands)", axis, program.size());
        for (String command : program) {
            sendPsoCommand(command);
        }
    }

    private int readEncoderInput() throws IOException {
        String value = pvs.getString(names.pso("PSOEncoderInput")).trim();
        try {
            return (int) Math.round(Double.parseDouble(value));
        } catch (NumberFormatException e) {
            throw new BeamlineHardwareException("Unexpected PSO encoder input: '" + value + "'", e);
        }
    }

    public void armPulseGenerator() throws IOException {
        sendPsoCommand(PulseGeneratorProgram.arm(readPsoAxisName()));
    }

    /**
     * Turns the window and the PSO control off.
     */
    public void disablePulseGenerator() throws IOException {
        String axis = readPsoAxisName();
        sendPsoCommand(PulseGeneratorProgram.windowOff(axis));
        sendPsoCommand(PulseGeneratorProgram.controlOff(axis));
    }

    private void sendPsoCommand(String command) throws IOException {
        logger.debug("PSO <- {}", command);
        pvs.put(names.pso("PSOCommand.BOUT"), command, true, ackTimeout);
    }

    // ==================== Detector ====================

    /**
     * Sets the TIFF plugin and detector file names. Called once before a collection starts.
     */
    public void setFileNames(String fileName) throws IOException {
        pvs.put(names.tiff("FileName"), fileName, true, ackTimeout);
        pvs.put(names.cam("FileName"), fileName, true, ackTimeout);
    }

    /**
     * Writes the detector registers for {@code program} after caching the values it replaces.
     */
    public void arm(DetectorProgram program) throws IOException {
        SavedRegisters previous = new SavedRegisters(
                pvs.getString(names.tiff("FilePath")),
                pvs.getString(names.tiff("FileName")),
                pvs.getString(names.cam("FilePath")),
                pvs.getString(names.cam("FileName")),
                null);
        saved = previous;
        armedProgram = program;

        pvs.put(names.tiff("FilePath"), program.filePath(), true, ackTimeout);

        pvs.put(names.cam("AcquireTime"), program.exposure(), true, ackTimeout);
        pvs.put(names.cam("NumImages"), program.imageCount(), true, ackTimeout);
        pvs.put(names.cam("ArrayCounter"), 0, true, ackTimeout);
        pvs.put(names.cam("TriggerMode"), program.triggerMode().getRegisterValue(), true, ackTimeout);
        pvs.put(names.tiff("FileName"), program.fileName());
        pvs.put(names.cam("FileName"), program.fileName());
        pvs.put(names.tiff("FileNumber"), program.firstFrame());

        if (program.recursiveSum()) {
            int previousNumber = pvs.getInt(names.cam("FileNumber"));
            saved = new SavedRegisters(previous.tiffFilePath(), previous.tiffFileName(),
                    previous.detectorFilePath(), previous.detectorFileName(), previousNumber);
            pvs.put(names.cam("FileNumber"), program.firstFrame(), true, ackTimeout);
            pvs.put(names.cam("FilePath"), pvs.getString(names.tiff("FilePath")));
            pvs.put(names.proc("NumFilter"), program.imageCount(), true, ackTimeout);
            pvs.put(names.proc("EnableFilter"), 1, true, ackTimeout);
            pvs.put(names.proc("FilterType"), DetectorProgram.FILTER_TYPE_SUM, true, ackTimeout);
        }

        pvs.put(names.cam("FileTemplate"), program.detectorTemplate());
        pvs.put(names.tiff("FileTemplate"), program.tiffTemplate());
        logger.info("Detector armed: {} trigger, {} images of {} s, {}{} from frame {}",
                program.triggerMode(), program.imageCount(), program.exposure(),
                program.filePath(), program.fileName(), program.firstFrame());
    }

    /**
     * Restores everything {@link #arm} changed. Each restore is attempted even if an earlier
     * one fails; the first failure is rethrown once all have been tried.
     */
    public void disarm() throws IOException {
        DetectorProgram program = armedProgram;
        SavedRegisters previous = saved;
        if (program == null || previous == null) {
            logger.debug("Detector not armed by this sequencer, nothing to restore");
            return;
        }
        armedProgram = null;
        saved = null;

        List<IOException> failures = new ArrayList<>();
        attempt(failures, "image count", () -> pvs.put(names.cam("NumImages"), 1, true, ackTimeout));
        attempt(failures, "trigger mode", () ->
                pvs.put(names.cam("TriggerMode"), TriggerMode.INTERNAL.getRegisterValue(), true, ackTimeout));
        if (program.kind() == ScanKind.STEP) {
            attempt(failures, "detector template", () ->
                    pvs.put(names.cam("FileTemplate"), DetectorProgram.DEFAULT_DETECTOR_TEMPLATE));
            attempt(failures, "TIFF template", () ->
                    pvs.put(names.tiff("FileTemplate"), DetectorProgram.DEFAULT_TIFF_TEMPLATE));
            if (program.recursiveSum()) {
                attempt(failures, "filter count", () -> pvs.put(names.proc("NumFilter"), 1, true, ackTimeout));
                if (previous.detectorFileNumber() != null) {
                    attempt(failures, "detector file number", () ->
                            pvs.put(names.cam("FileNumber"), previous.detectorFileNumber(), true, ackTimeout));
                }
            }
        }
        attempt(failures, "TIFF file path", () -> pvs.put(names.tiff("FilePath"), previous.tiffFilePath(), true, ackTimeout));
        attempt(failures, "detector file path", () ->
                pvs.put(names.cam("FilePath"), previous.detectorFilePath(), true, ackTimeout));
        attempt(failures, "TIFF file name", () -> pvs.put(names.tiff("FileName"), previous.tiffFileName(), true, ackTimeout));
        attempt(failures, "detector file name", () ->
                pvs.put(names.cam("FileName"), previous.detectorFileName(), true, ackTimeout));

        if (!failures.isEmpty()) {
            IOException first = failures.get(0);
            failures.stream().skip(1).forEach(first::addSuppressed);
            throw first;
        }
        logger.info("Detector registers restored");
    }

    public boolean isArmedByThisSequencer() {
        return armedProgram != null;
    }

    public void startAcquisition() throws IOException {
        pvs.put(names.cam("Acquire"), 1);
    }

    /**
     * Stops acquisition if the detector still reports armed.
     */
    public void stopAcquisitionIfArmed() throws IOException {
        if (isArmed()) {
            logger.info("Detector still armed, stopping acquisition");
            pvs.put(names.cam("Acquire"), 0, true, ackTimeout);
        }
    }

    public boolean isArmed() throws IOException {
        return pvs.getInt(names.cam("Armed")) != 0;
    }

    /**
     * Current frame: the array counter in running-sum mode, otherwise the TIFF plugin's file number.
     */
    public int readFrameNumber(boolean recursiveSum) throws IOException {
        return recursiveSum ? pvs.getInt(names.cam("ArrayCounter_RBV")) : readTiffFileNumber();
    }

    public int readTiffFileNumber() throws IOException {
        return pvs.getInt(names.tiff("FileNumber"));
    }

    // ==================== Shutter ====================

    public void setShutter(boolean open) throws IOException {
        logger.info("Shutter {}", open ? "open" : "close");
        pvs.put(names.shutter(), open ? 1 : 0, true, ackTimeout);
    }

    public boolean isShutterOpen() throws IOException {
        return pvs.getInt(names.shutter()) != 0;
    }

    private static void attempt(List<IOException> failures, String what, HardwareStep step) {
        try {
            step.run();
        } catch (IOException e) {
            logger.error("Failed to restore {}", what, e);
            failures.add(e);
        }
    }
}
