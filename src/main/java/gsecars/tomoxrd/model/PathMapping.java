package gsecars.tomoxrd.model;

/**
 * Translates operator-side directories to the path the detector server mounts them under.
 */
public record PathMapping(String userBase, String detectorBase) {

    public static PathMapping identity() {
        return new PathMapping("", "");
    }

    public String toDetectorPath(String userPath) {
        if (userBase == null || userBase.isEmpty()) {
            return userPath;
        }
        return userPath.replace(userBase, detectorBase);
    }
}
