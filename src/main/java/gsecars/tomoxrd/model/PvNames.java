package gsecars.tomoxrd.model;

import java.util.List;

/**
 * Process-variable names for one beamline.
 *
 * <p>Prefixes end with their separator ({@code 13PIL1MCdTe:cam1:}); motors are record names
 * without a field ({@code 13BMD:m119}).</p>
 */
public record PvNames(String camPrefix,
                      String tiffPrefix,
                      String procPrefix,
                      String psoPrefix,
                      String rotationMotor,
                      String horizontalMotor,
                      String verticalMotor,
                      String focusMotor,
                      String detectorXMotor,
                      String detectorZMotor,
                      String shutter,
                      List<String> allStop) {

    public PvNames {
        allStop = List.copyOf(allStop);
    }

    /** 13-BM-D names. */
    public static PvNames defaults() {
        return new PvNames(
                "13PIL1MCdTe:cam1:",
                "13PIL1MCdTe:TIFF1:",
                "13PIL1MCdTe:Proc1:",
                "13BMDPG1:TS:",
                "13BMD:m119",
                "13BMD:m123",
                "13BMD:m115",
                "13BMD:m122",
                "13BMD:m93",
                "13BMD:m94",
                "13BMD:Unidig2Bo10",
                List.of("13BMD_TOMO_XPS:allstop", "13BMD:allstop.VAL"));
    }

    public String cam(String field) {
        return camPrefix + field;
    }

    public String tiff(String field) {
        return tiffPrefix + field;
    }

    public String proc(String field) {
        return procPrefix + field;
    }

    public String pso(String field) {
        return psoPrefix + field;
    }
}
