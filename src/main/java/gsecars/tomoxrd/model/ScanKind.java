package gsecars.tomoxrd.model;

/**
 * The three collection kinds a {@link ScanRequest} can describe.
 */
public enum ScanKind {
    /** Single internally triggered frame, no rotation. */
    STILL,
    /** One continuous exposure swept across the range, a single external trigger. */
    WIDE,
    /** One external trigger per rotation step. */
    STEP;

    public boolean rotates() {
        return this != STILL;
    }
}
