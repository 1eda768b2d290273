package gsecars.tomoxrd.model;

/**
 * Hardware readbacks the motion planner needs, captured once per scan.
 *
 * @param countsPerRotation  encoder counts for 360 degrees, as reported by the PSO controller
 * @param encoderDirection   +1 if encoder counts increase with dial position, -1 otherwise
 * @param motorDirection     +1 if user and dial coordinates agree ({@code .DIR == 0}), -1 otherwise
 * @param accelerationTime   motor {@code .ACCL} in seconds
 * @param maxVelocity        motor {@code .VMAX} in degrees per second
 */
public record AxisSnapshot(double countsPerRotation,
                           int encoderDirection,
                           int motorDirection,
                           double accelerationTime,
                           double maxVelocity) {

    public double countsPerDegree() {
        return countsPerRotation / 360.0;
    }
}
