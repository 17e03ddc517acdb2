package org.lsst.fits.stacker.classify;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import nom.tam.fits.Header;
import org.lsst.fits.stacker.DataDirectory;
import org.lsst.fits.stacker.QuarantineException;
import org.lsst.fits.stacker.Timed;
import org.lsst.fits.stacker.io.FitsImages;
import org.lsst.fits.stacker.model.CalibrationKey;
import org.lsst.fits.stacker.model.FrameGroups;
import org.lsst.fits.stacker.model.FrameType;
import org.lsst.fits.stacker.model.RawFrame;
import org.lsst.fits.stacker.profile.TelescopeProfile;
import org.lsst.fits.stacker.profile.Wavelength;

/**
 * Sorts raw frames by their headers. Every file is moved: classified frames
 * to {@code raw/}, spectra to {@code spec/}, unclassifiable frames to
 * {@code bad/} and files that are not FITS at all to {@code error/}. The
 * manifest is written once, after the whole scan.
 */
public class FileClassifier {

    private static final Logger LOG = Logger.getLogger(FileClassifier.class.getName());

    private final TelescopeProfile profile;
    private final DataDirectory directory;

    public FileClassifier(TelescopeProfile profile, DataDirectory directory) {
        this.profile = profile;
        this.directory = directory;
    }

    /**
     * Classify and relocate the given files, write the manifest and group the
     * result.
     *
     * @param files The raw files, in any order
     * @return The groups
     * @throws IOException If a file cannot be moved or the manifest cannot be
     * written
     */
    public FrameGroups classify(List<Path> files) throws IOException {
        return Timed.execute(() -> {
            List<Path> sorted = new ArrayList<>(files);
            sorted.sort(Comparator.comparing(p -> p.getFileName().toString()));
            List<RawFrame> rows = new ArrayList<>();
            int errors = 0;
            for (Path file : sorted) {
                RawFrame frame = classify(file);
                if (frame == null) {
                    errors++;
                } else {
                    rows.add(frame);
                }
            }
            Manifest.write(directory, rows);
            FrameGroups groups = Manifest.toGroups(rows, profile.getWavelength() == Wavelength.NEAR_INFRARED);
            logCounts(groups, errors);
            return groups;
        }, "Sorted %d files in %.1f s", files.size());
    }

    /**
     * Classify and relocate a single file.
     *
     * @return The manifest row, or null if the file is not readable as FITS
     */
    RawFrame classify(Path file) throws IOException {
        Header header;
        try {
            header = FitsImages.readHeader(file, profile.getRawHeaderExtension());
        } catch (QuarantineException x) {
            LOG.log(Level.WARNING, "Bad header, moving to bad: {0}", x.getMessage());
            return RawFrame.unreadable(directory.moveTo(file, directory.getBadPath()));
        } catch (IOException x) {
            LOG.log(Level.WARNING, "Cannot open " + file + ", moving to error", x);
            directory.moveTo(file, directory.getErrorPath());
            return null;
        }
        FrameType type = typeOf(header);
        if (type == FrameType.BAD) {
            LOG.log(Level.INFO, "Unrecognised frame type, moving to bad: {0}", file);
            return RawFrame.unreadable(directory.moveTo(file, directory.getBadPath()));
        }
        RawFrame frame;
        try {
            Double time = type == FrameType.SCIENCE ? profile.getObservationTime(header) : null;
            frame = toFrame(header, type, time, file);
        } catch (IllegalArgumentException x) {
            LOG.log(Level.WARNING, "Invalid header value in {0}, moving to bad: {1}", new Object[]{file, x.getMessage()});
            return RawFrame.unreadable(directory.moveTo(file, directory.getBadPath()));
        }
        Path destination = type == FrameType.SPEC ? directory.getSpecPath() : directory.getRawPath();
        return frame.withPath(directory.moveTo(file, destination));
    }

    /**
     * Apply the profile's predicates in order; the first match wins.
     */
    FrameType typeOf(Header header) {
        if (profile.getFlatPredicate().matches(header)) {
            return FrameType.FLAT;
        } else if (profile.getSciencePredicate().matches(header)) {
            return FrameType.SCIENCE;
        } else if (profile.getBiasPredicate().matches(header)) {
            return FrameType.BIAS;
        } else if (profile.getDarkPredicate().matches(header)) {
            return FrameType.DARK;
        } else if (profile.getSpecPredicate().matches(header)) {
            return FrameType.SPEC;
        } else {
            return FrameType.BAD;
        }
    }

    private RawFrame toFrame(Header header, FrameType type, Double time, Path location) {
        String target = header.getStringValue(profile.getTargetKeyword());
        target = target == null ? "" : target.replaceAll("\\s+", "");
        return new RawFrame(location, target, profile.getConfiguration(header), profile.getExposure(header), type, time);
    }

    private static void logCounts(FrameGroups groups, int errors) {
        for (Map.Entry<CalibrationKey, List<RawFrame>> entry : groups.getCalibrationGroups().entrySet()) {
            LOG.log(Level.INFO, "{0}: {1} frames", new Object[]{entry.getKey(), entry.getValue().size()});
        }
        LOG.log(Level.INFO, "{0} science frames in {1} groups, {2} spectroscopic, {3} bad, {4} unreadable",
                new Object[]{groups.getScienceFrameCount(), groups.getScienceGroups().size(), groups.getSpecCount(), groups.getBadCount(), errors});
    }
}
