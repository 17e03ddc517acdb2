package org.lsst.fits.stacker;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * The layout of one data directory. Raw files start at the root and are
 * sorted into {@code raw/}, {@code bad/}, {@code spec/} and {@code error/};
 * all derived products go to {@code red/}. The manifest lives at the root.
 */
public class DataDirectory {

    private static final Logger LOG = Logger.getLogger(DataDirectory.class.getName());
    static final String MANIFEST = "file_list.txt";

    private final Path root;
    private final Path raw;
    private final Path bad;
    private final Path spec;
    private final Path error;
    private final Path red;

    private DataDirectory(Path root) {
        this.root = root;
        this.raw = root.resolve("raw");
        this.bad = root.resolve("bad");
        this.spec = root.resolve("spec");
        this.error = root.resolve("error");
        this.red = root.resolve("red");
    }

    /**
     * Open a data directory, creating the sub directories that do not exist
     * yet.
     *
     * @param root The data root, which must exist
     * @return The data directory
     * @throws FatalConfigurationException If the root is not a directory
     * @throws IOException If a sub directory cannot be created
     */
    public static DataDirectory open(Path root) throws FatalConfigurationException, IOException {
        if (!Files.isDirectory(root)) {
            throw new FatalConfigurationException("Data path " + root + " is not a directory");
        }
        DataDirectory directory = new DataDirectory(root);
        for (Path dir : directory.subDirectories()) {
            Files.createDirectories(dir);
        }
        return directory;
    }

    private List<Path> subDirectories() {
        return Arrays.asList(raw, bad, spec, error, red);
    }

    public Path getRoot() {
        return root;
    }

    public Path getRawPath() {
        return raw;
    }

    public Path getBadPath() {
        return bad;
    }

    public Path getSpecPath() {
        return spec;
    }

    public Path getErrorPath() {
        return error;
    }

    public Path getRedPath() {
        return red;
    }

    public Path getManifestFile() {
        return root.resolve(MANIFEST);
    }

    /**
     * @param calibrationPath The calibration path given on the command line
     * or by the profile, if any
     * @return Where master flats are read and written
     */
    public Path getFlatPath(Optional<Path> calibrationPath) {
        return calibrationPath.orElse(red);
    }

    /**
     * @param glob Pattern for the raw files, for example {@code *.fits}
     * @return The matching regular files at the root, sorted by name
     */
    public List<Path> findRawFiles(String glob) throws IOException {
        List<Path> result = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(root, glob)) {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    result.add(file);
                }
            }
        }
        result.sort(Comparator.comparing(p -> p.getFileName().toString()));
        return result;
    }

    /**
     * Move a file into one of the sorting directories.
     *
     * @return The new location
     */
    public Path moveTo(Path file, Path directory) throws IOException {
        Path target = directory.resolve(file.getFileName());
        if (file.equals(target)) {
            return target;
        }
        return Files.move(file, target, StandardCopyOption.REPLACE_EXISTING);
    }

    /**
     * Undo the sorting of a previous run: delete the manifest and move files
     * back to the root so that they are classified again.
     *
     * @return The number of files moved
     */
    public int reset(ResetMode mode) throws IOException {
        Files.deleteIfExists(getManifestFile());
        List<Path> sources = mode == ResetMode.ALL ? Arrays.asList(raw, bad, spec, error) : Collections.singletonList(raw);
        int moved = 0;
        for (Path dir : sources) {
            if (!Files.isDirectory(dir)) {
                continue;
            }
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
                for (Path file : stream) {
                    moveTo(file, root);
                    moved++;
                }
            }
        }
        LOG.log(Level.INFO, "Reset {0}: moved {1} files back to {2}", new Object[]{mode, moved, root});
        return moved;
    }

    /**
     * @return The path as stored in the manifest, relative to the root where
     * possible
     */
    public String relativize(Path file) {
        if (file.isAbsolute() == root.isAbsolute() && file.startsWith(root)) {
            return root.relativize(file).toString().replace('\\', '/');
        }
        return file.toString();
    }

    public Path resolve(String manifestPath) {
        return root.resolve(manifestPath);
    }
}
