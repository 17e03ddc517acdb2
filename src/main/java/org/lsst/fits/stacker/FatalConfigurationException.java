package org.lsst.fits.stacker;

/**
 * Raised when the run cannot produce anything meaningful: unknown telescope,
 * no raw files, no bias frames when bias calibration is required, or no
 * science frames after classification. The run is aborted.
 */
public class FatalConfigurationException extends PipelineException {

    public FatalConfigurationException(String message) {
        super(message);
    }
}
