package org.lsst.fits.stacker;

/**
 * A master calibration frame needed by one group is not available. Only that
 * group is skipped.
 */
public class MissingDependencyException extends PipelineException {

    public MissingDependencyException(String message) {
        super(message);
    }
}
