package gsecars.tomoxrd.model;

/**
 * Register values written to the detector before a scan.
 *
 * <p>Templates follow the areaDetector convention of path, name, number.</p>
 */
public record DetectorProgram(ScanKind kind,
                              TriggerMode triggerMode,
                              double exposure,
                              int imageCount,
                              String fileName,
                              String filePath,
                              int firstFrame,
                              String detectorTemplate,
                              String tiffTemplate,
                              boolean recursiveSum) {

    public static final String DEFAULT_DETECTOR_TEMPLATE = "%s%s_%4.4d_0001.tif";
    public static final String DEFAULT_TIFF_TEMPLATE = "%s%s_%4.4d.tif";
    public static final String SUM_DETECTOR_TEMPLATE = "%s%s_%4.4d.cbf";
    public static final String SUM_TIFF_TEMPLATE = "%s%s_merged.tif";

    /** Filter type register value for a running sum. */
    public static final int FILTER_TYPE_SUM = 2;

    /**
     * Builds the program for a request.
     *
     * @param request     the scan request
     * @param imageCount  number of frames ({@code numAngles}, 1 for stills)
     * @param filePath    directory the TIFF plugin writes to, already mapped to the detector's view
     */
    public static DetectorProgram forRequest(ScanRequest request, int imageCount, String filePath) {
        boolean sum = request.isAccumulating();
        return new DetectorProgram(
                request.kind(),
                TriggerMode.forKind(request.kind()),
                request.exposure(),
                imageCount,
                request.filename(),
                filePath,
                request.frameStart(),
                sum ? SUM_DETECTOR_TEMPLATE : DEFAULT_DETECTOR_TEMPLATE,
                sum ? SUM_TIFF_TEMPLATE : DEFAULT_TIFF_TEMPLATE,
                sum);
    }
}
