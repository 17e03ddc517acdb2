package org.lsst.fits.stacker;

/**
 * Base class of the checked exceptions raised while reducing a data
 * directory.
 */
public class PipelineException extends Exception {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
