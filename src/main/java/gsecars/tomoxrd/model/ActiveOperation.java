package gsecars.tomoxrd.model;

/**
 * Operations that need exclusive use of the stages.
 */
public enum ActiveOperation {
    SCAN("Collection"),
    MOVE_TO_TOMO("Move to Tomo"),
    MOVE_TO_XRD("Move to XRD");

    private final String displayName;

    ActiveOperation(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
