package gsecars.tomoxrd.model;

/**
 * Detector stage positions for the tomography and diffraction geometries.
 *
 * @param tomoX       detector X in the tomography geometry
 * @param tomoZ       detector Z in the tomography geometry
 * @param xrdX        detector X in the diffraction geometry
 * @param xrdZ        detector Z in the diffraction geometry
 * @param detectorOut detector Z retracted position used while X travels
 */
public record GeometryPositions(double tomoX, double tomoZ, double xrdX, double xrdZ, double detectorOut) {

    public static GeometryPositions defaults() {
        return new GeometryPositions(-127.0, 50.0, 95.0, 0.0, 100.0);
    }
}
