package gsecars.tomoxrd.model;

/**
 * Detector trigger modes as written to the camera {@code TriggerMode} register.
 */
public enum TriggerMode {
    INTERNAL(0),
    EXTERNAL_SINGLE(2),
    EXTERNAL_MULTI(3);

    private final int registerValue;

    TriggerMode(int registerValue) {
        this.registerValue = registerValue;
    }

    public int getRegisterValue() {
        return registerValue;
    }

    public static TriggerMode forKind(ScanKind kind) {
        return switch (kind) {
            case STILL -> INTERNAL;
            case WIDE -> EXTERNAL_SINGLE;
            case STEP -> EXTERNAL_MULTI;
        };
    }
}
