package gsecars.tomoxrd.model;

/**
 * States of a single scan run.
 */
public enum ScanState {
    IDLE,
    PREPARING,
    MOVING,
    SCANNING,
    FINISHING,
    ABORTING;

    /** States from which an abort request moves the run to {@link #ABORTING}. */
    public boolean isAbortable() {
        return this == PREPARING || this == MOVING || this == SCANNING;
    }
}
