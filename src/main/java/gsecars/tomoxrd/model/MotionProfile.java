package gsecars.tomoxrd.model;

/**
 * Immutable motion and pulse pattern for one rotating scan.
 *
 * <p>{@code rotationStep} is always {@code encoderCountsPerStep / countsPerDegree}, so every
 * pulse lands on an encoder tick. For step scans {@code pulseDistanceCounts} equals
 * {@code |encoderCountsPerStep|}; for wide scans it is the acceleration lead in counts.</p>
 */
public record MotionProfile(ScanKind kind,
                            double start,
                            double end,
                            double exposure,
                            double rotationStep,
                            int numAngles,
                            int encoderCountsPerStep,
                            int pulseDistanceCounts,
                            double taxiStart,
                            double taxiEnd,
                            int overallSense,
                            double motorSpeed,
                            double maxSpeed,
                            double accelDistance,
                            long windowStart,
                            long windowEnd) {

    /** Lowest commanded rotation position, including taxi. */
    public double lowestPosition() {
        return Math.min(taxiStart, taxiEnd);
    }

    /** Highest commanded rotation position, including taxi. */
    public double highestPosition() {
        return Math.max(taxiStart, taxiEnd);
    }
}
