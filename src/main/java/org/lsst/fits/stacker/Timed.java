package org.lsst.fits.stacker;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Utility for logging how long a pipeline stage took. The elapsed time in
 * seconds is appended as the last format argument.
 */
public class Timed {

    private static final Logger LOG = Logger.getLogger(Timed.class.getName());

    private Timed() {
    }

    public static <T, E extends Exception> T execute(Stage<T, E> stage, String message, Object... args) throws E {
        return execute(Level.INFO, stage, message, args);
    }

    public static <T, E extends Exception> T execute(Level level, Stage<T, E> stage, String message, Object... args) throws E {
        long start = System.nanoTime();
        try {
            return stage.call();
        } finally {
            double seconds = (System.nanoTime() - start) / 1e9;
            if (LOG.isLoggable(level)) {
                Object[] all = new Object[args.length + 1];
                System.arraycopy(args, 0, all, 0, args.length);
                all[args.length] = seconds;
                LOG.log(level, String.format(message, all));
            }
        }
    }

    @FunctionalInterface
    public interface Stage<T, E extends Exception> {

        T call() throws E;
    }
}
