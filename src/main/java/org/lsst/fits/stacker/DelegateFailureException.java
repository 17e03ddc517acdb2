package org.lsst.fits.stacker;

/**
 * An optional enrichment step (WCS solving, photometry) failed. The stack it
 * was applied to is kept.
 */
public class DelegateFailureException extends PipelineException {

    public DelegateFailureException(String message) {
        super(message);
    }

    public DelegateFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
