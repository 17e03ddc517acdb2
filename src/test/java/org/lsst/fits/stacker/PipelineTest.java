package org.lsst.fits.stacker;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;
import nom.tam.fits.Fits;
import nom.tam.fits.Header;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.lsst.fits.stacker.model.ImageFrame;
import org.lsst.fits.stacker.profile.GenericCcdProfile;
import org.lsst.fits.stacker.profile.TelescopeProfile;

public class PipelineTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path root;

    @Before
    public void setUp() {
        root = folder.getRoot().toPath();
    }

    private Pipeline.Summary run(String... extra) throws Exception {
        return run(new GenericCcdProfile(), extra);
    }

    private Pipeline.Summary run(TelescopeProfile profile, String... extra) throws Exception {
        String[] args = new String[extra.length + 2];
        args[0] = "GENERIC";
        args[1] = root.toString();
        System.arraycopy(extra, 0, args, 2, extra.length);
        PipelineOptions options = PipelineOptions.parse(args);
        return new Pipeline(profile, options, DataDirectory.open(root)).run();
    }

    private void writeScience(int count) throws Exception {
        for (int i = 0; i < count; i++) {
            FrameFixtures.write(root.resolve("sci" + i + ".fits"), FrameFixtures.starField(64, 0, 0, 200),
                    "IMAGETYP", "object", "OBJECT", "M31", "FILTER", "V", "EXPTIME", 30.0,
                    "DATE-OBS", String.format("2021-03-04T05:%02d:00", 10 * i), "RDNOISE", 6.0);
        }
    }

    private void writeOversizedDataSection(int count) throws Exception {
        for (int i = 0; i < count; i++) {
            FrameFixtures.write(root.resolve("ngc" + i + ".fits"), FrameFixtures.starField(64, 0, 0, 200),
                    "IMAGETYP", "object", "OBJECT", "NGC1", "FILTER", "V", "EXPTIME", 30.0,
                    "DATE-OBS", String.format("2021-03-04T06:%02d:00", 10 * i), "RDNOISE", 6.0,
                    "DATASEC", "[1:100,1:100]");
        }
    }

    @Test
    public void noRawFilesAbortsTheRun() throws Exception {
        try {
            run();
            fail("Expected the run to abort");
        } catch (FatalConfigurationException x) {
            assertTrue(x.getMessage().contains("No raw files"));
        }
        assertFalse(Files.exists(root.resolve("file_list.txt")));
    }

    @Test(expected = FatalConfigurationException.class)
    public void noScienceFramesAbortsTheRun() throws Exception {
        writeScienceSizedCalibrations(true);
        run();
    }

    @Test
    public void missingDarkSkipsGroup() throws Exception {
        writeScienceSizedCalibrations(false);
        writeScience(3);
        Pipeline.Summary summary = run();
        assertEquals(Collections.singletonList("M31_V_A_1x1"), summary.getSkipped());
        assertTrue(summary.getWritten().isEmpty());
        assertTrue(summary.getFailed().isEmpty());
        assertTrue(Files.exists(root.resolve("red/mbias_A_1x1.fits")));
        assertFalse(Files.exists(root.resolve("red/M31_V_A_1x1.fits")));
    }

    private void writeScienceSizedCalibrations(boolean withDark) throws Exception {
        float[][] bias = new float[64][64];
        float[][] dark = new float[64][64];
        float[][] flat = new float[64][64];
        for (int y = 0; y < 64; y++) {
            for (int x = 0; x < 64; x++) {
                bias[y][x] = 100;
                dark[y][x] = 100;
                flat[y][x] = 5100;
            }
        }
        for (int i = 1; i <= 2; i++) {
            FrameFixtures.write(root.resolve("bias" + i + ".fits"), bias, "IMAGETYP", "bias", "EXPTIME", 0.0, "FILTER", "V");
            if (withDark) {
                FrameFixtures.write(root.resolve("dark" + i + ".fits"), dark, "IMAGETYP", "dark", "EXPTIME", 30.0, "FILTER", "V");
            }
            FrameFixtures.write(root.resolve("flat" + i + ".fits"), flat, "IMAGETYP", "domeflat", "EXPTIME", 30.0, "FILTER", "V");
        }
    }

    @Test
    public void fullReduction() throws Exception {
        writeScienceSizedCalibrations(true);
        writeScience(3);
        Pipeline.Summary summary = run();

        Path stack = root.resolve("red/M31_V_A_1x1.fits");
        assertEquals(Collections.singletonList(stack), summary.getWritten());
        assertTrue(Files.exists(root.resolve("red/mdark_30.0_A_1x1.fits")));
        assertTrue(Files.exists(root.resolve("red/mflat_V_A_1x1.fits")));
        assertTrue(Files.exists(root.resolve("red/sci0_red.fits")));
        assertTrue(Files.exists(root.resolve("red/sci0_mask.fits")));
        assertTrue(Files.exists(root.resolve("raw/sci0.fits")));
        try (Fits fits = new Fits(stack.toFile())) {
            Header header = fits.getHDU(0).getHeader();
            assertEquals(3, header.getIntValue("NFILES"));
            assertEquals(90.0, header.getDoubleValue("EXPTOT"), 1e-9);
            assertEquals(6.0 / Math.sqrt(3), header.getDoubleValue("RDNOISE"), 1e-9);
            assertEquals(59277.2152778, header.getDoubleValue("MJD-OBS"), 1e-6);
        }

        // the second run reloads the manifest and keeps the existing stack
        long modified = Files.getLastModifiedTime(stack).toMillis();
        Pipeline.Summary again = run("--skip_red");
        assertEquals(Collections.singletonList("M31_V_A_1x1"), again.getSkipped());
        assertEquals(modified, Files.getLastModifiedTime(stack).toMillis());
    }

    @Test
    public void targetFilterSelectsGroups() throws Exception {
        writeScienceSizedCalibrations(true);
        writeScience(3);
        Pipeline.Summary summary = run("--target", "M33");
        assertTrue(summary.getWritten().isEmpty());
        assertTrue(summary.getSkipped().isEmpty());
        assertTrue(Files.exists(root.resolve("file_list.txt")));
    }

    @Test
    public void badDataSectionFailsOnlyItsGroup() throws Exception {
        writeScienceSizedCalibrations(true);
        writeScience(3);
        writeOversizedDataSection(3);
        Pipeline.Summary summary = run();
        assertEquals(Collections.singletonList(root.resolve("red/M31_V_A_1x1.fits")), summary.getWritten());
        assertEquals(Collections.singletonList("NGC1_V_A_1x1"), summary.getFailed());
        assertFalse(Files.exists(root.resolve("red/NGC1_V_A_1x1.fits")));
    }

    @Test
    public void unexpectedErrorFailsTheGroupAndTheRunGoesOn() throws Exception {
        writeScienceSizedCalibrations(true);
        writeScience(3);
        Pipeline.Summary summary = run(new GenericCcdProfile() {
            @Override
            public List<ImageFrame> align(List<ImageFrame> frames, boolean[][] staticMask) {
                throw new IllegalStateException("alignment broke");
            }
        });
        assertEquals(Collections.singletonList("M31_V_A_1x1"), summary.getFailed());
        assertTrue(summary.getWritten().isEmpty());
    }

    @Test
    public void failedWcsKeepsThePlainStack() throws Exception {
        writeScienceSizedCalibrations(true);
        writeScience(3);
        Pipeline.Summary summary = run(new GenericCcdProfile() {
            @Override
            public boolean runWcs() {
                return true;
            }

            @Override
            public Path solveWcs(Path stack) throws DelegateFailureException {
                throw new DelegateFailureException("No solution for " + stack);
            }
        });
        Path stack = root.resolve("red/M31_V_A_1x1.fits");
        assertEquals(Collections.singletonList(stack), summary.getWritten());
        assertTrue(Files.exists(stack));
        assertFalse(Files.exists(Pipeline.wcsPath(stack)));
        assertTrue(summary.getFailed().isEmpty());
    }
}
