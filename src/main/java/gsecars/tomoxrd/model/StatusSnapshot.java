package gsecars.tomoxrd.model;

/**
 * Periodic readback of beamline positions published by the status poller, together with
 * the progress counters of the collection in progress.
 */
public record StatusSnapshot(double omega,
                             double horizontal,
                             double vertical,
                             double focus,
                             double detectorX,
                             double detectorZ,
                             boolean shutterOpen,
                             boolean detectorArmed,
                             int frameCounter,
                             int totalFrames,
                             int currentCollection,
                             int totalCollections) {
}
