package gsecars.tomoxrd.model;

/**
 * Parameters of one collection as entered by the operator.
 *
 * <p>{@code start} and {@code end} are both present or both absent. With no range the
 * request is a still; with a range and no step it is a wide scan; with all three it is
 * a step scan. {@code accumulate} only has an effect on step scans and selects the
 * running-sum mode that writes one merged frame per run plus the individual frames
 * for later format conversion.</p>
 *
 * @param exposure   exposure time per frame in seconds
 * @param start      omega start in degrees, or null
 * @param end        omega end in degrees, or null
 * @param step       omega step in degrees, or null
 * @param frameStart first file number written by the detector
 * @param filename   base file name
 * @param filepath   target directory, with trailing slash
 * @param accumulate step scans only: enable the recursive-sum filter
 */
public record ScanRequest(double exposure,
                          Double start,
                          Double end,
                          Double step,
                          int frameStart,
                          String filename,
                          String filepath,
                          boolean accumulate) {

    public ScanRequest {
        if ((start == null) != (end == null)) {
            throw new IllegalArgumentException("Start and end must both be set or both be empty");
        }
        if (step != null && start == null) {
            throw new IllegalArgumentException("A step size requires a start and end position");
        }
        if (!(exposure > 0)) {
            throw new IllegalArgumentException("Exposure must be positive, got " + exposure);
        }
        if (filename == null || filepath == null) {
            throw new IllegalArgumentException("File name and path are required");
        }
    }

    public static ScanRequest still(double exposure, int frameStart, String filename, String filepath) {
        return new ScanRequest(exposure, null, null, null, frameStart, filename, filepath, false);
    }

    public static ScanRequest wide(double exposure, double start, double end,
                                   int frameStart, String filename, String filepath) {
        return new ScanRequest(exposure, start, end, null, frameStart, filename, filepath, false);
    }

    public static ScanRequest step(double exposure, double start, double end, double step,
                                   int frameStart, String filename, String filepath, boolean accumulate) {
        return new ScanRequest(exposure, start, end, step, frameStart, filename, filepath, accumulate);
    }

    public ScanKind kind() {
        if (start == null) {
            return ScanKind.STILL;
        }
        return step == null ? ScanKind.WIDE : ScanKind.STEP;
    }

    /** True for step scans in running-sum mode. */
    public boolean isAccumulating() {
        return accumulate && kind() == ScanKind.STEP;
    }

    /** Absolute angular range, 0 for stills. */
    public double range() {
        return start == null ? 0.0 : Math.abs(end - start);
    }

    /** True when a step scan asks for a step wider than its range. */
    public boolean stepExceedsRange() {
        return kind() == ScanKind.STEP && step > range();
    }

    public ScanRequest withFilename(String newFilename) {
        return new ScanRequest(exposure, start, end, step, frameStart, newFilename, filepath, accumulate);
    }

    public ScanRequest withFrameStart(int newFrameStart) {
        return new ScanRequest(exposure, start, end, step, newFrameStart, filename, filepath, accumulate);
    }
}
