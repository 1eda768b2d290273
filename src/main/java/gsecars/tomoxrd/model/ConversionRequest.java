package gsecars.tomoxrd.model;

/**
 * Notification that an accumulated step scan is on disk and ready for format conversion.
 * The conversion itself belongs to a downstream collaborator.
 */
public record ConversionRequest(String filepath,
                                String filename,
                                int numAngles,
                                double start,
                                double end,
                                double step,
                                double exposure,
                                int firstFrame) {
}
