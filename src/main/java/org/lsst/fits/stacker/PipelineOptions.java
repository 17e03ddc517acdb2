package org.lsst.fits.stacker;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Command line options of one run:
 * <pre>
 * telescope data_path [--use_dome_flats] [--skip_red] [--target T]
 *     [--proc true|false] [--cal_path P] [--phot] [--reset raw|all]
 * </pre>
 * Options taking a value accept both {@code --opt value} and
 * {@code --opt=value}. Switches also accept an explicit
 * {@code --opt=true|false}.
 */
public class PipelineOptions {

    public static final String USAGE = "Usage: telescope data_path [--use_dome_flats] [--skip_red] [--target T] "
            + "[--proc true|false] [--cal_path P] [--phot] [--reset raw|all]";

    private String telescope;
    private Path dataPath;
    private boolean useDomeFlats;
    private boolean skipReduction;
    private String target;
    private boolean processed = true;
    private Path calibrationPath;
    private boolean photometry;
    private ResetMode reset;

    private PipelineOptions() {
    }

    /**
     * @param args The command line
     * @return The options
     * @throws IllegalArgumentException On any usage error
     */
    public static PipelineOptions parse(String... args) {
        PipelineOptions options = new PipelineOptions();
        List<String> positional = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (!arg.startsWith("--")) {
                positional.add(arg);
                continue;
            }
            String name = arg;
            String value = null;
            int equals = arg.indexOf('=');
            if (equals > 0) {
                name = arg.substring(0, equals);
                value = arg.substring(equals + 1);
            }
            switch (name) {
                case "--use_dome_flats":
                    options.useDomeFlats = value == null || parseBoolean(name, value);
                    break;
                case "--skip_red":
                    options.skipReduction = value == null || parseBoolean(name, value);
                    break;
                case "--phot":
                    options.photometry = value == null || parseBoolean(name, value);
                    break;
                case "--target":
                case "--proc":
                case "--cal_path":
                case "--reset":
                    if (value == null) {
                        if (i + 1 >= args.length) {
                            throw new IllegalArgumentException("Missing value for " + name);
                        }
                        value = args[++i];
                    }
                    options.setValue(name, value);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option " + arg);
            }
        }
        if (positional.size() != 2) {
            throw new IllegalArgumentException("Expected telescope and data_path, got " + positional);
        }
        options.telescope = positional.get(0);
        options.dataPath = Paths.get(positional.get(1));
        return options;
    }

    private void setValue(String name, String value) {
        switch (name) {
            case "--target":
                target = value;
                break;
            case "--proc":
                processed = parseBoolean(name, value);
                break;
            case "--cal_path":
                calibrationPath = Paths.get(value);
                break;
            default:
                reset = ResetMode.parse(value);
        }
    }

    private static boolean parseBoolean(String name, String value) {
        switch (value.toLowerCase(Locale.ROOT)) {
            case "true":
            case "yes":
                return true;
            case "false":
            case "no":
                return false;
            default:
                throw new IllegalArgumentException("Invalid value for " + name + ": " + value);
        }
    }

    public String getTelescope() {
        return telescope;
    }

    public Path getDataPath() {
        return dataPath;
    }

    public boolean isUseDomeFlats() {
        return useDomeFlats;
    }

    public boolean isSkipReduction() {
        return skipReduction;
    }

    /**
     * @return Only science groups whose name contains this are reduced
     */
    public Optional<String> getTarget() {
        return Optional.ofNullable(target);
    }

    /**
     * @return True when reducing pre-processed data products
     */
    public boolean isProcessed() {
        return processed;
    }

    public Optional<Path> getCalibrationPath() {
        return Optional.ofNullable(calibrationPath);
    }

    public boolean isPhotometry() {
        return photometry;
    }

    public Optional<ResetMode> getReset() {
        return Optional.ofNullable(reset);
    }

    @Override
    public String toString() {
        return "PipelineOptions{" + "telescope=" + telescope + ", dataPath=" + dataPath + ", useDomeFlats=" + useDomeFlats
                + ", skipReduction=" + skipReduction + ", target=" + target + ", processed=" + processed
                + ", calibrationPath=" + calibrationPath + ", photometry=" + photometry + ", reset=" + reset + '}';
    }
}
