package org.lsst.fits.stacker.calib;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;
import nom.tam.fits.FitsException;
import org.lsst.fits.stacker.FatalConfigurationException;
import org.lsst.fits.stacker.MissingDependencyException;
import org.lsst.fits.stacker.model.CalibrationKey;
import org.lsst.fits.stacker.model.Configuration;
import org.lsst.fits.stacker.model.FrameGroups;
import org.lsst.fits.stacker.model.FrameType;
import org.lsst.fits.stacker.model.ImageFrame;
import org.lsst.fits.stacker.model.Masters;
import org.lsst.fits.stacker.model.RawFrame;
import org.lsst.fits.stacker.profile.TelescopeProfile;
import org.lsst.fits.stacker.profile.Wavelength;

/**
 * Builds or reuses the master calibration frames of a run, in dependency
 * order bias, dark, flat. Whether a master exists is decided purely by the
 * presence of its file, whose name the profile derives from the calibration
 * key. Loaded masters are held in a Caffeine cache keyed by file.
 * <p>
 * A group whose upstream master is missing is skipped and reported; the only
 * fatal condition is an instrument that needs bias frames having none.
 */
public class CalibrationCache {

    private static final Logger LOG = Logger.getLogger(CalibrationCache.class.getName());

    private final TelescopeProfile profile;
    private final Path redPath;
    private final Path flatPath;
    private final boolean skipExisting;
    private final boolean useDomeFlats;
    private final LoadingCache<Path, ImageFrame> masterCache;
    private final CalibrationReport report = new CalibrationReport();

    /**
     * @param profile The instrument
     * @param redPath Where bias and dark masters live
     * @param flatPath Where flat masters live
     * @param skipExisting Reuse masters that already exist instead of
     * rebuilding them
     * @param useDomeFlats For near-infrared instruments, build flats from
     * flat frames rather than from the science frames
     */
    public CalibrationCache(TelescopeProfile profile, Path redPath, Path flatPath, boolean skipExisting, boolean useDomeFlats) {
        this.profile = profile;
        this.redPath = redPath;
        this.flatPath = flatPath;
        this.skipExisting = skipExisting;
        this.useDomeFlats = useDomeFlats;
        this.masterCache = Caffeine.newBuilder()
                .maximumSize(Integer.getInteger("org.lsst.fits.stacker.masterCacheSize", 64))
                .recordStats()
                .build((Path file) -> profile.loadMaster(file));
    }

    /**
     * Build or reuse every master the groups call for.
     *
     * @throws FatalConfigurationException If bias frames are required and
     * there are none
     */
    public CalibrationReport build(FrameGroups groups) throws FatalConfigurationException {
        if (profile.usesBias()) {
            if (groups.getBiasFrameCount() == 0) {
                throw new FatalConfigurationException("No bias frames present, check data before rerunning");
            }
            groups.getCalibrationGroups(FrameType.BIAS).forEach((key, frames)
                    -> ensure(key, frames, redPath, (output) -> profile.createBias(frames, key, output)));
        }
        if (profile.usesDark()) {
            groups.getCalibrationGroups(FrameType.DARK).forEach((key, frames)
                    -> ensure(key, frames, redPath, (output) -> {
                        Masters masters = resolve(configurationOf(frames), null, false);
                        profile.createDark(frames, key, masters, output);
                    }));
        }
        if (profile.usesFlat()) {
            Map<CalibrationKey, List<RawFrame>> flatGroups;
            if (profile.getWavelength() == Wavelength.NEAR_INFRARED && !useDomeFlats) {
                int ignored = groups.getCalibrationGroups(FrameType.FLAT).size();
                if (ignored > 0) {
                    LOG.log(Level.INFO, "Ignoring {0} dome flat groups, building sky flats from science frames", ignored);
                }
                flatGroups = new LinkedHashMap<>();
                for (Map.Entry<Configuration, List<RawFrame>> sky : groups.getSkyGroups().entrySet()) {
                    flatGroups.put(CalibrationKey.flat(sky.getKey()), sky.getValue());
                }
            } else {
                flatGroups = groups.getCalibrationGroups(FrameType.FLAT);
            }
            flatGroups.forEach((key, frames)
                    -> ensure(key, frames, flatPath, (output) -> {
                        Set<String> exposures = new LinkedHashSet<>();
                        frames.forEach(f -> exposures.add(f.getExposure()));
                        Masters masters = resolve(configurationOf(frames), exposures, false);
                        profile.createFlat(frames, key, masters, output);
                    }));
        }
        report.log();
        return report;
    }

    private void ensure(CalibrationKey key, List<RawFrame> frames, Path directory, MasterBuilder builder) {
        Path output = profile.getMasterPath(directory, key);
        if (skipExisting && Files.exists(output)) {
            LOG.log(Level.INFO, "Reusing existing master {0}", output);
            report.record(key, CalibrationReport.Outcome.REUSED, null);
            return;
        }
        try {
            long start = System.nanoTime();
            builder.build(output);
            masterCache.invalidate(output);
            LOG.log(Level.INFO, "Built {0} from {1} frames in {2} s", new Object[]{output.getFileName(), frames.size(), (System.nanoTime() - start) / 1e9});
            report.record(key, CalibrationReport.Outcome.BUILT, null);
        } catch (MissingDependencyException x) {
            LOG.log(Level.SEVERE, "Skipping {0}: {1}", new Object[]{key, x.getMessage()});
            report.record(key, CalibrationReport.Outcome.SKIPPED, x.getMessage());
        } catch (IOException | FitsException | RuntimeException x) {
            LOG.log(Level.SEVERE, "Failed to build " + key, x);
            report.record(key, CalibrationReport.Outcome.FAILED, x.getMessage());
        }
    }

    private static Configuration configurationOf(List<RawFrame> frames) {
        return frames.get(0).getConfiguration();
    }

    /**
     * Collect the masters needed to calibrate frames of one configuration.
     *
     * @param configuration The configuration
     * @param exposures Exposures that need a dark, or null for none
     * @param withFlat Whether a flat is needed
     * @return The masters
     * @throws MissingDependencyException If a needed master does not exist
     * @throws IOException If an existing master cannot be read
     */
    public Masters resolve(Configuration configuration, Collection<String> exposures, boolean withFlat) throws MissingDependencyException, IOException {
        ImageFrame bias = null;
        if (profile.usesBias()) {
            bias = findBias(configuration).orElseThrow(()
                    -> missing(CalibrationKey.bias(configuration), redPath));
        }
        Map<String, ImageFrame> darks = new LinkedHashMap<>();
        if (profile.usesDark() && exposures != null) {
            for (String exposure : exposures) {
                darks.put(exposure, findDark(exposure, configuration).orElseThrow(()
                        -> missing(CalibrationKey.dark(exposure, configuration), redPath)));
            }
        }
        ImageFrame flat = null;
        if (profile.usesFlat() && withFlat) {
            flat = findFlat(configuration).orElseThrow(()
                    -> missing(CalibrationKey.flat(configuration), flatPath));
        }
        return new Masters(bias, darks, flat);
    }

    private MissingDependencyException missing(CalibrationKey key, Path directory) {
        return new MissingDependencyException("No master " + profile.getMasterPath(directory, key).getFileName() + " for " + key);
    }

    public Optional<ImageFrame> findBias(Configuration configuration) throws IOException {
        return find(profile.getMasterPath(redPath, CalibrationKey.bias(configuration)));
    }

    public Optional<ImageFrame> findDark(String exposure, Configuration configuration) throws IOException {
        return find(profile.getMasterPath(redPath, CalibrationKey.dark(exposure, configuration)));
    }

    public Optional<ImageFrame> findFlat(Configuration configuration) throws IOException {
        return find(profile.getMasterPath(flatPath, CalibrationKey.flat(configuration)));
    }

    private Optional<ImageFrame> find(Path file) throws IOException {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(masterCache.get(file));
        } catch (CompletionException x) {
            throw new IOException("Cannot load master " + file, x.getCause());
        }
    }

    /**
     * Log the master cache statistics.
     */
    public void reportStatistics() {
        LOG.log(Level.INFO, "master Cache size {0} stats {1}", new Object[]{masterCache.estimatedSize(), masterCache.stats()});
    }

    @FunctionalInterface
    private interface MasterBuilder {

        void build(Path output) throws IOException, FitsException, MissingDependencyException;
    }
}
