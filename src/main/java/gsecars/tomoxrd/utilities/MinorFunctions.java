package gsecars.tomoxrd.utilities;

import java.io.InterruptedIOException;
import java.time.Duration;

/**
 * MinorFunctions
 *
 * <p>Miscellaneous small utilities:
 *   - Interruptible pauses that fit the IOException-based hardware call chain.
 *   - Decimal rounding for readbacks.
 */
public final class MinorFunctions {

    private MinorFunctions() {
    }

    /**
     * Sleeps for {@code duration}. An interrupt restores the flag and surfaces as an
     * {@link InterruptedIOException} so callers handle it with their hardware errors.
     */
    public static void pause(Duration duration) throws InterruptedIOException {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException ex = new InterruptedIOException("Interrupted while waiting " + duration.toMillis() + " ms");
            ex.initCause(e);
            throw ex;
        }
    }

    /**
     * Rounds half-to-even to {@code places} decimals.
     */
    public static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.rint(value * scale) / scale;
    }
}
