package org.lsst.fits.stacker.classify;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.fits.stacker.DataDirectory;
import org.lsst.fits.stacker.model.Configuration;
import org.lsst.fits.stacker.model.FrameGroups;
import org.lsst.fits.stacker.model.FrameType;
import org.lsst.fits.stacker.model.RawFrame;

/**
 * The persisted record of a classification: one tab separated row per
 * classified file with the columns {@code File Target Filter Exp Type Time}.
 * File paths are stored relative to the data root. The Filter column holds
 * the full configuration key; Time is empty except for science frames.
 */
public class Manifest {

    private static final Logger LOG = Logger.getLogger(Manifest.class.getName());
    static final String[] COLUMNS = {"File", "Target", "Filter", "Exp", "Type", "Time"};
    private static final String SEPARATOR = "\t";

    private Manifest() {
    }

    public static void write(DataDirectory directory, List<RawFrame> frames) throws IOException {
        Path file = directory.getManifestFile();
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write(String.join(SEPARATOR, COLUMNS));
            writer.newLine();
            for (RawFrame frame : frames) {
                writer.write(String.join(SEPARATOR,
                        directory.relativize(frame.getPath()),
                        frame.getTarget(),
                        frame.getConfiguration() == null ? "" : frame.getConfiguration().key(),
                        frame.getExposure(),
                        frame.getType().name(),
                        frame.getTime() == null ? "" : frame.getTime().toString()));
                writer.newLine();
            }
        }
        LOG.log(Level.INFO, "Wrote {0} rows to {1}", new Object[]{frames.size(), file});
    }

    public static List<RawFrame> read(DataDirectory directory) throws IOException {
        Path file = directory.getManifestFile();
        List<RawFrame> frames = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String header = reader.readLine();
            if (header == null || !header.trim().equals(String.join(SEPARATOR, COLUMNS))) {
                throw new IOException("Unexpected header in " + file + ": " + header);
            }
            int lineNumber = 1;
            for (;;) {
                String line = reader.readLine();
                lineNumber++;
                if (line == null) {
                    break;
                }
                if (line.trim().isEmpty()) {
                    continue;
                }
                frames.add(parse(directory, line, file, lineNumber));
            }
        }
        LOG.log(Level.INFO, "Read {0} rows from {1}", new Object[]{frames.size(), file});
        return frames;
    }

    private static RawFrame parse(DataDirectory directory, String line, Path file, int lineNumber) throws IOException {
        String[] fields = line.split(SEPARATOR, -1);
        if (fields.length != COLUMNS.length) {
            throw new IOException("Expected " + COLUMNS.length + " columns at " + file + ":" + lineNumber + ", got " + fields.length);
        }
        try {
            FrameType type = FrameType.valueOf(fields[4]);
            Configuration configuration = fields[2].isEmpty() ? null : Configuration.parse(fields[2]);
            Double time = fields[5].isEmpty() ? null : Double.valueOf(fields[5]);
            if ((type.isCalibration() || type == FrameType.SCIENCE) && configuration == null) {
                throw new IOException("Missing configuration for " + type + " frame at " + file + ":" + lineNumber);
            }
            if (type == FrameType.SCIENCE && time == null) {
                throw new IOException("Missing observation time at " + file + ":" + lineNumber);
            }
            return new RawFrame(directory.resolve(fields[0]), fields[1], configuration, fields[3], type, time);
        } catch (IllegalArgumentException x) {
            throw new IOException("Invalid row at " + file + ":" + lineNumber + ": " + x.getMessage(), x);
        }
    }

    /**
     * Group manifest rows. Used both after a fresh classification and on
     * reload, so both produce the same groups.
     */
    public static FrameGroups toGroups(List<RawFrame> frames, boolean nearInfrared) {
        FrameGroups.Builder builder = FrameGroups.builder(nearInfrared);
        frames.forEach(builder::add);
        return builder.build();
    }
}
