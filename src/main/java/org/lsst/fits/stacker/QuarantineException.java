package org.lsst.fits.stacker;

import java.nio.file.Path;

/**
 * A raw frame whose header could not be read. The classifier moves it out of
 * the way and records it as bad.
 */
public class QuarantineException extends PipelineException {

    private final Path file;

    public QuarantineException(Path file, String message) {
        super(message);
        this.file = file;
    }

    public QuarantineException(Path file, String message, Throwable cause) {
        super(message, cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
