package org.lsst.fits.stacker;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import nom.tam.fits.FitsException;
import org.lsst.fits.stacker.calib.CalibrationCache;
import org.lsst.fits.stacker.classify.FileClassifier;
import org.lsst.fits.stacker.classify.Manifest;
import org.lsst.fits.stacker.io.FitsImages;
import org.lsst.fits.stacker.model.Configuration;
import org.lsst.fits.stacker.model.FrameGroups;
import org.lsst.fits.stacker.model.ImageFrame;
import org.lsst.fits.stacker.model.Masters;
import org.lsst.fits.stacker.model.RawFrame;
import org.lsst.fits.stacker.model.ScienceGroup;
import org.lsst.fits.stacker.model.ScienceKey;
import org.lsst.fits.stacker.profile.TelescopeProfile;
import org.lsst.fits.stacker.profile.Wavelength;
import org.lsst.fits.stacker.quality.QualityDecision;
import org.lsst.fits.stacker.quality.QualityGate;
import org.lsst.fits.stacker.quality.QualityMeter;
import org.lsst.fits.stacker.quality.QualityMetric;
import org.lsst.fits.stacker.sky.FringeCorrector;
import org.lsst.fits.stacker.sky.SkyEstimator;
import org.lsst.fits.stacker.stack.StackBuilder;
import org.lsst.fits.stacker.stack.StackResult;

/**
 * Runs one reduction: classification, master calibrations, then one stack
 * per science group. A failure inside a group is logged and the run moves
 * on to the next group; only configuration problems abort the run.
 */
public class Pipeline {

    private static final Logger LOG = Logger.getLogger(Pipeline.class.getName());

    private final TelescopeProfile profile;
    private final PipelineOptions options;
    private final DataDirectory directory;
    private final SkyEstimator skyEstimator;
    private final FringeCorrector fringeCorrector;
    private final QualityMeter qualityMeter;
    private final QualityGate qualityGate;
    private final StackBuilder stackBuilder;

    public Pipeline(TelescopeProfile profile, PipelineOptions options, DataDirectory directory) {
        this.profile = profile;
        this.options = options;
        this.directory = directory;
        this.skyEstimator = new SkyEstimator();
        this.fringeCorrector = new FringeCorrector();
        this.qualityMeter = new QualityMeter(profile.getPixelScale());
        this.qualityGate = new QualityGate();
        this.stackBuilder = new StackBuilder();
    }

    /**
     * @return The outcome of every science group
     * @throws FatalConfigurationException If there is nothing to reduce or
     * calibrations cannot be built at all
     * @throws IOException If the data directory cannot be scanned or the
     * manifest cannot be read or written
     */
    public Summary run() throws FatalConfigurationException, IOException {
        long start = System.nanoTime();
        Optional<ResetMode> reset = options.getReset();
        if (reset.isPresent()) {
            directory.reset(reset.get());
        }
        FrameGroups groups = loadGroups();
        LOG.log(Level.INFO, "Frame groups: {0}", groups);
        if (!groups.hasScience()) {
            throw new FatalConfigurationException("No science frames to process in " + directory.getRoot());
        }

        Path flatPath = directory.getFlatPath(options.getCalibrationPath().isPresent() ? options.getCalibrationPath() : profile.getDefaultCalibrationPath());
        CalibrationCache calibrations = new CalibrationCache(profile, directory.getRedPath(), flatPath, options.isSkipReduction(), options.isUseDomeFlats());
        calibrations.build(groups);

        Summary summary = new Summary();
        for (ScienceGroup group : groups.getScienceGroups().values()) {
            String name = group.getKey().name();
            if (options.getTarget().isPresent() && !name.contains(options.getTarget().get())) {
                LOG.log(Level.FINE, "Group {0} does not match target {1}", new Object[]{name, options.getTarget().get()});
                continue;
            }
            try {
                Optional<Path> stack = reduce(group, calibrations);
                if (stack.isPresent()) {
                    summary.written.add(stack.get());
                } else {
                    summary.skipped.add(name);
                }
            } catch (MissingDependencyException x) {
                LOG.log(Level.SEVERE, "Skipping group {0}: {1}", new Object[]{name, x.getMessage()});
                summary.skipped.add(name);
            } catch (IOException | FitsException | RuntimeException x) {
                LOG.log(Level.SEVERE, "Reduction of group " + name + " failed", x);
                summary.failed.add(name);
            }
        }
        calibrations.reportStatistics();
        LOG.log(Level.INFO, "{0} stacks written, {1} groups skipped, {2} failed in {3} s",
                new Object[]{summary.written.size(), summary.skipped.size(), summary.failed.size(), elapsed(start)});
        return summary;
    }

    private FrameGroups loadGroups() throws FatalConfigurationException, IOException {
        boolean nearInfrared = profile.getWavelength() == Wavelength.NEAR_INFRARED;
        if (Files.exists(directory.getManifestFile())) {
            return Manifest.toGroups(Manifest.read(directory), nearInfrared);
        }
        List<Path> files = directory.findRawFiles(profile.getRawFilePattern(options.isProcessed()));
        if (files.isEmpty()) {
            throw new FatalConfigurationException("No raw files found in " + directory.getRoot());
        }
        return new FileClassifier(profile, directory).classify(files);
    }

    /**
     * @return The final stack, or empty if it already existed
     */
    private Optional<Path> reduce(ScienceGroup group, CalibrationCache calibrations) throws MissingDependencyException, IOException, FitsException {
        ScienceKey key = group.getKey();
        Path redPath = directory.getRedPath();
        Path stack = profile.getStackPath(redPath, key);
        Path product = profile.runWcs() ? wcsPath(stack) : stack;
        if (options.isSkipReduction() && Files.exists(product)) {
            LOG.log(Level.INFO, "Stack {0} exists, skipping", product);
            if (options.isPhotometry()) {
                photometry(product);
            }
            return Optional.empty();
        }
        long start = System.nanoTime();
        Configuration configuration = key.getConfiguration();
        Set<String> exposures = new LinkedHashSet<>();
        for (RawFrame frame : group.getFrames()) {
            exposures.add(frame.getExposure());
        }
        Masters masters = calibrations.resolve(configuration, exposures, true);

        List<ImageFrame> frames = profile.processScience(group.getFrames(), key, masters, redPath, options.isProcessed());
        if (profile.getWavelength() == Wavelength.NEAR_INFRARED) {
            frames = skyEstimator.subtract(group.getFrames(), frames, redPath);
        } else if (profile.needsFringeCorrection(configuration.getFilter())) {
            frames = fringeCorrector.correct(frames, configuration, redPath);
        }
        for (ImageFrame frame : frames) {
            FitsImages.writeImage(frame);
        }
        LOG.log(Level.INFO, "Reduced {0} frames of {1} in {2} s", new Object[]{frames.size(), key.name(), elapsed(start)});

        boolean[][] staticMask = profile.getStaticMask(options.isProcessed()).orElse(null);
        List<ImageFrame> aligned = profile.align(frames, staticMask);
        List<ImageFrame> measured = new ArrayList<>();
        List<QualityMetric> metrics = new ArrayList<>();
        for (ImageFrame frame : aligned) {
            Optional<QualityMetric> metric = qualityMeter.measure(frame, staticMask);
            if (metric.isPresent()) {
                measured.add(frame);
                metrics.add(metric.get());
            } else {
                LOG.log(Level.WARNING, "No stars measured on {0}, frame excluded", frame.getPath().getFileName());
            }
        }
        if (measured.isEmpty()) {
            throw new IOException("No measurable frames left in group " + key.name());
        }
        QualityDecision decision = qualityGate.evaluate(metrics);
        for (int index : decision.getRejected()) {
            LOG.log(Level.INFO, "Rejected {0}: {1}", new Object[]{measured.get(index).getPath().getFileName(), metrics.get(index)});
        }
        List<ImageFrame> passing = decision.select(measured);
        StackResult result = stackBuilder.build(passing, profile.getReadNoise(passing.get(0).getHeader()));
        stackBuilder.write(result, stack, passing.get(0).getHeader());

        Path output = stack;
        if (profile.runWcs()) {
            try {
                output = profile.solveWcs(stack);
            } catch (DelegateFailureException x) {
                LOG.log(Level.SEVERE, "WCS solution for " + stack.getFileName() + " failed", x);
            }
        }
        if (profile.runPhotometry() || options.isPhotometry()) {
            photometry(output);
        }
        return Optional.of(output);
    }

    private void photometry(Path stack) {
        try {
            Path catalog = profile.runPhotometry(stack);
            LOG.log(Level.INFO, "Photometry of {0} written to {1}", new Object[]{stack.getFileName(), catalog});
        } catch (DelegateFailureException x) {
            LOG.log(Level.SEVERE, "Photometry of " + stack.getFileName() + " failed", x);
        }
    }

    static Path wcsPath(Path stack) {
        return stack.resolveSibling(FitsImages.baseName(stack) + "_wcs.fits");
    }

    private static double elapsed(long start) {
        return (System.nanoTime() - start) / 1e9;
    }

    /**
     * What happened to each science group in a run.
     */
    public static class Summary {

        private final List<Path> written = new ArrayList<>();
        private final List<String> skipped = new ArrayList<>();
        private final List<String> failed = new ArrayList<>();

        public List<Path> getWritten() {
            return Collections.unmodifiableList(written);
        }

        public List<String> getSkipped() {
            return Collections.unmodifiableList(skipped);
        }

        public List<String> getFailed() {
            return Collections.unmodifiableList(failed);
        }
    }
}
