package org.lsst.fits.stacker;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import org.lsst.fits.stacker.profile.TelescopeProfile;
import org.lsst.fits.stacker.profile.TelescopeRegistry;

/**
 * Command line entry point. Exit status is 0 on success, 1 when the run is
 * aborted and 2 on a usage error.
 */
public class Main {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());
    private static final DateTimeFormatter LOG_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    public static void main(String[] args) {
        if (System.getProperty("java.awt.headless") == null) {
            System.setProperty("java.awt.headless", "true");
        }
        configureLogging();
        System.exit(run(args));
    }

    static int run(String... args) {
        PipelineOptions options;
        try {
            options = PipelineOptions.parse(args);
        } catch (IllegalArgumentException x) {
            System.err.println(x.getMessage());
            System.err.println(PipelineOptions.USAGE);
            return 2;
        }
        FileHandler logFile = null;
        try {
            TelescopeProfile profile = TelescopeRegistry.defaultRegistry().lookup(options.getTelescope());
            DataDirectory directory = DataDirectory.open(options.getDataPath());
            logFile = openLogFile(directory.getRedPath(), options.getTelescope());
            LOG.log(Level.INFO, "Reducing {0} data in {1} with {2}", new Object[]{profile.getName(), directory.getRoot(), options});
            new Pipeline(profile, options, directory).run();
            return 0;
        } catch (FatalConfigurationException x) {
            LOG.log(Level.SEVERE, "Run aborted: {0}", x.getMessage());
            return 1;
        } catch (IOException x) {
            LOG.log(Level.SEVERE, "Run aborted", x);
            return 1;
        } finally {
            if (logFile != null) {
                Logger.getLogger("").removeHandler(logFile);
                logFile.close();
            }
        }
    }

    private static FileHandler openLogFile(Path redPath, String telescope) throws IOException {
        String stamp = ZonedDateTime.now(ZoneOffset.UTC).format(LOG_STAMP);
        FileHandler handler = new FileHandler(redPath.resolve(telescope + "_log_" + stamp + ".log").toString());
        handler.setFormatter(new SimpleFormatter());
        Logger.getLogger("").addHandler(handler);
        return handler;
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException x) {
            LOG.log(Level.WARNING, "Could not read logging configuration", x);
        }
    }
}
