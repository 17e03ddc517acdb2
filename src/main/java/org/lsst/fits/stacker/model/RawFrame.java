package org.lsst.fits.stacker.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One classified raw frame, as recorded in the manifest. Only science frames
 * carry an observation time. Frames whose header could not be read have no
 * configuration.
 */
public class RawFrame {

    private final Path path;
    private final String target;
    private final Configuration configuration;
    private final String exposure;
    private final FrameType type;
    private final Double time;

    public RawFrame(Path path, String target, Configuration configuration, String exposure, FrameType type, Double time) {
        this.path = Objects.requireNonNull(path, "path");
        this.target = target == null ? "" : target;
        this.configuration = configuration;
        this.exposure = exposure == null ? "" : exposure;
        this.type = Objects.requireNonNull(type, "type");
        this.time = time;
    }

    /**
     * A frame that was quarantined before any header value could be read.
     *
     * @param path The path the frame was moved to
     * @return The bad frame
     */
    public static RawFrame unreadable(Path path) {
        return new RawFrame(path, "", null, "", FrameType.BAD, null);
    }

    /**
     * @return The same frame at a new location
     */
    public RawFrame withPath(Path newPath) {
        return new RawFrame(newPath, target, configuration, exposure, type, time);
    }

    public Path getPath() {
        return path;
    }

    public String getTarget() {
        return target;
    }

    public Configuration getConfiguration() {
        return configuration;
    }

    public String getExposure() {
        return exposure;
    }

    /**
     * @return The exposure time in seconds, or 0 if none was recorded
     */
    public double getExposureSeconds() {
        if (exposure.isEmpty()) {
            return 0;
        }
        return Double.parseDouble(exposure);
    }

    public FrameType getType() {
        return type;
    }

    public Double getTime() {
        return time;
    }

    public String getFileName() {
        return path.getFileName().toString();
    }

    @Override
    public String toString() {
        return "RawFrame{" + "path=" + path + ", type=" + type + ", target=" + target + ", configuration=" + configuration + '}';
    }

    @Override
    public int hashCode() {
        int hash = 5;
        hash = 71 * hash + Objects.hashCode(this.path);
        hash = 71 * hash + Objects.hashCode(this.type);
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final RawFrame other = (RawFrame) obj;
        return Objects.equals(this.path, other.path)
                && Objects.equals(this.target, other.target)
                && Objects.equals(this.configuration, other.configuration)
                && Objects.equals(this.exposure, other.exposure)
                && this.type == other.type
                && Objects.equals(this.time, other.time);
    }
}
