package org.lsst.fits.stacker.wcs;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.HeaderCardException;
import org.lsst.fits.stacker.DelegateFailureException;
import org.lsst.fits.stacker.io.FitsImages;
import org.lsst.fits.stacker.model.ImageFrame;

/**
 * Plate solves stacks with the external ASTAP command line solver. ASTAP
 * writes its solution as a FITS header in a {@code .wcs} file next to the
 * input; the cards of that header are copied onto the stack, which is written
 * again as {@code <stack>_wcs.fits}.
 * <p>
 * The solver is configured with the system properties
 * {@code org.lsst.fits.stacker.astap.path}, {@code ...astap.db} and
 * {@code ...astap.timeout} (seconds).
 */
public class AstapWcsSolver {

    private static final Logger LOG = Logger.getLogger(AstapWcsSolver.class.getName());
    private static final int CARD_LENGTH = 80;

    private final String astapPath;
    private final String databasePath;
    private final long timeoutSeconds;
    private final double searchRadius;

    public AstapWcsSolver() {
        this(System.getProperty("org.lsst.fits.stacker.astap.path"),
                System.getProperty("org.lsst.fits.stacker.astap.db"),
                Long.getLong("org.lsst.fits.stacker.astap.timeout", 60), 30);
    }

    public AstapWcsSolver(String astapPath, String databasePath, long timeoutSeconds, double searchRadius) {
        this.astapPath = astapPath;
        this.databasePath = databasePath;
        this.timeoutSeconds = timeoutSeconds;
        this.searchRadius = searchRadius;
    }

    public boolean isConfigured() {
        return astapPath != null && !astapPath.isEmpty();
    }

    /**
     * @param stack The stack to solve
     * @return The path of the solved copy
     * @throws DelegateFailureException If the solver is not configured, fails
     * or times out
     */
    public Path solve(Path stack) throws DelegateFailureException {
        if (!isConfigured()) {
            throw new DelegateFailureException("ASTAP solver not configured, set org.lsst.fits.stacker.astap.path");
        }
        List<String> command = new ArrayList<>();
        command.add(astapPath);
        command.add("-f");
        command.add(stack.toAbsolutePath().toString());
        command.add("-r");
        command.add(String.valueOf(searchRadius));
        if (databasePath != null && !databasePath.isEmpty()) {
            command.add("-d");
            command.add(databasePath);
        }
        Path base = stack.resolveSibling(FitsImages.baseName(stack));
        Path wcsFile = base.resolveSibling(base.getFileName() + ".wcs");
        try {
            Files.deleteIfExists(wcsFile);
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(base.resolveSibling(base.getFileName() + "_astap.txt").toFile())
                    .start();
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new DelegateFailureException("ASTAP timed out after " + timeoutSeconds + "s on " + stack);
            }
            if (process.exitValue() != 0 || !Files.exists(wcsFile)) {
                throw new DelegateFailureException("ASTAP found no solution for " + stack + " (exit code " + process.exitValue() + ")");
            }
            Map<String, String> solution = parseWcsFile(wcsFile);
            Path output = base.resolveSibling(base.getFileName() + "_wcs.fits");
            ImageFrame image = FitsImages.readImage(stack, 0);
            Header header = image.getHeader();
            for (Map.Entry<String, String> card : solution.entrySet()) {
                applyCard(header, card.getKey(), card.getValue());
            }
            FitsImages.writeImage(image.withPath(output));
            LOG.log(Level.INFO, "WCS solution for {0} written to {1}", new Object[]{stack, output});
            return output;
        } catch (IOException | FitsException x) {
            throw new DelegateFailureException("WCS solution failed for " + stack, x);
        } catch (InterruptedException x) {
            Thread.currentThread().interrupt();
            throw new DelegateFailureException("Interrupted while solving " + stack, x);
        }
    }

    /**
     * Read the cards of an ASTAP {@code .wcs} file. The file is a FITS
     * header, either one card per line or as a single run of 80 character
     * cards.
     *
     * @return Keyword to raw value text, in file order
     */
    static Map<String, String> parseWcsFile(Path wcsFile) throws IOException {
        List<String> cards = new ArrayList<>();
        for (String line : Files.readAllLines(wcsFile, StandardCharsets.ISO_8859_1)) {
            for (int start = 0; start < line.length(); start += CARD_LENGTH) {
                cards.add(line.substring(start, Math.min(line.length(), start + CARD_LENGTH)));
            }
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (String card : cards) {
            int equals = card.indexOf('=');
            if (equals < 1 || equals > 9) {
                continue;
            }
            String key = card.substring(0, equals).trim();
            if (key.isEmpty() || "END".equals(key)) {
                continue;
            }
            result.put(key, valueOf(card.substring(equals + 1)));
        }
        return result;
    }

    private static String valueOf(String field) {
        String text = field.trim();
        if (text.startsWith("'")) {
            int end = text.indexOf('\'', 1);
            return end < 0 ? text : text.substring(0, end + 1);
        }
        int slash = text.indexOf('/');
        return (slash < 0 ? text : text.substring(0, slash)).trim();
    }

    private static void applyCard(Header header, String key, String value) throws HeaderCardException {
        if ("SIMPLE".equals(key) || "BITPIX".equals(key) || key.startsWith("NAXIS")) {
            return;
        }
        header.deleteKey(key);
        if (value.startsWith("'")) {
            header.addValue(key, value.substring(1, Math.max(1, value.length() - 1)).trim(), "WCS solution");
        } else if ("T".equals(value) || "F".equals(value)) {
            header.addValue(key, "T".equals(value), "WCS solution");
        } else {
            try {
                header.addValue(key, Double.parseDouble(value), "WCS solution");
            } catch (NumberFormatException x) {
                LOG.log(Level.FINE, "Keeping non numeric WCS value for {0}: {1}", new Object[]{key, value});
                header.addValue(key, value, "WCS solution");
            }
        }
    }
}
