package org.lsst.fits.stacker.classify;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.lsst.fits.stacker.DataDirectory;
import org.lsst.fits.stacker.FrameFixtures;
import org.lsst.fits.stacker.model.Configuration;
import org.lsst.fits.stacker.model.FrameGroups;
import org.lsst.fits.stacker.model.FrameType;
import org.lsst.fits.stacker.model.RawFrame;
import org.lsst.fits.stacker.profile.GenericCcdProfile;

public class ManifestTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private DataDirectory directory;

    @Before
    public void open() throws Exception {
        directory = DataDirectory.open(folder.getRoot().toPath());
    }

    @Test
    public void reloadGivesSameGroups() throws Exception {
        Path root = directory.getRoot();
        FrameFixtures.bias(root, "b1.fits");
        FrameFixtures.flat(root, "f1.fits", "R");
        FrameFixtures.science(root, "s1.fits", "NGC253", "R", "2021-03-04T05:06:07");
        FrameFixtures.science(root, "s2.fits", "NGC253", "R", "2021-03-04T05:08:07");
        FrameFixtures.write(root.resolve("x.fits"), 1, "IMAGETYP", "test");

        FrameGroups classified = new FileClassifier(new GenericCcdProfile(), directory).classify(directory.findRawFiles("*.fits"));
        List<RawFrame> rows = Manifest.read(directory);
        FrameGroups reloaded = Manifest.toGroups(rows, false);

        assertEquals(5, rows.size());
        assertEquals(classified.getCalibrationGroups(), reloaded.getCalibrationGroups());
        assertEquals(classified.getScienceGroups().keySet(), reloaded.getScienceGroups().keySet());
        assertEquals(classified.getScienceGroups().values().iterator().next().getFrames(),
                reloaded.getScienceGroups().values().iterator().next().getFrames());
        assertEquals(classified.getScienceGroups().values().iterator().next().getTimes(),
                reloaded.getScienceGroups().values().iterator().next().getTimes());
        assertEquals(1, reloaded.getBadCount());
        assertEquals(directory.getRawPath().resolve("s1.fits"), rows.get(2).getPath());
    }

    @Test
    public void calibrationRowsHaveEmptyTime() throws Exception {
        Configuration v = new Configuration("V", "A", "1x1");
        Manifest.write(directory, Arrays.asList(
                new RawFrame(directory.getRawPath().resolve("b.fits"), "", v, "0.0", FrameType.BIAS, null),
                new RawFrame(directory.getRawPath().resolve("s.fits"), "M31", v, "30.0", FrameType.SCIENCE, 59000.5)));
        List<String> lines = Files.readAllLines(directory.getManifestFile(), StandardCharsets.UTF_8);
        assertEquals("File\tTarget\tFilter\tExp\tType\tTime", lines.get(0));
        assertEquals("raw/b.fits\t\tV_A_1x1\t0.0\tBIAS\t", lines.get(1));
        assertEquals("raw/s.fits\tM31\tV_A_1x1\t30.0\tSCIENCE\t59000.5", lines.get(2));

        List<RawFrame> rows = Manifest.read(directory);
        assertNull(rows.get(0).getTime());
        assertEquals(59000.5, rows.get(1).getTime(), 0);
        assertEquals(v, rows.get(1).getConfiguration());
    }

    private void writeManifest(String... lines) throws IOException {
        Files.write(directory.getManifestFile(), Arrays.asList(lines), StandardCharsets.UTF_8);
    }

    @Test(expected = IOException.class)
    public void wrongColumnCountIsRejected() throws Exception {
        writeManifest("File\tTarget\tFilter\tExp\tType\tTime", "raw/b.fits\tV_A_1x1\tBIAS");
        Manifest.read(directory);
    }

    @Test(expected = IOException.class)
    public void scienceRowNeedsTime() throws Exception {
        writeManifest("File\tTarget\tFilter\tExp\tType\tTime", "raw/s.fits\tM31\tV_A_1x1\t30.0\tSCIENCE\t");
        Manifest.read(directory);
    }

    @Test(expected = IOException.class)
    public void unknownTypeIsRejected() throws Exception {
        writeManifest("File\tTarget\tFilter\tExp\tType\tTime", "raw/s.fits\tM31\tV_A_1x1\t30.0\tFOCUS\t");
        Manifest.read(directory);
    }

    @Test
    public void blankLinesAreSkipped() throws Exception {
        writeManifest("File\tTarget\tFilter\tExp\tType\tTime", "", "bad/x.fits\t\t\t\tBAD\t");
        List<RawFrame> rows = Manifest.read(directory);
        assertEquals(1, rows.size());
        assertEquals(FrameType.BAD, rows.get(0).getType());
    }
}
