package org.lsst.fits.stacker.stats;

import ij.ImagePlus;
import ij.gui.PolygonRoi;
import ij.gui.Roi;
import ij.gui.Wand;
import ij.measure.Measurements;
import ij.measure.ResultsTable;
import ij.plugin.filter.ParticleAnalyzer;
import ij.process.FloatProcessor;
import ij.process.ImageProcessor;
import ij.process.ImageStatistics;
import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Threshold segmentation with the ImageJ particle analyzer: pixels at or
 * above {@code background + nsigma * rms} are grouped into eight-connected
 * sources, and groups smaller than {@code minPixels} are dropped. The shape of
 * each source is measured on its half maximum isophote.
 */
public class Segmentation {

    private static final int MEASUREMENTS = Measurements.AREA | Measurements.MIN_MAX | Measurements.CENTER_OF_MASS
            | Measurements.RECT | Measurements.INTEGRATED_DENSITY;

    private final double nsigma;
    private final int minPixels;

    public Segmentation(double nsigma, int minPixels) {
        this.nsigma = nsigma;
        this.minPixels = minPixels;
    }

    /**
     * Detect sources using sigma-clipped image statistics as the background
     * level and noise.
     */
    public List<Source> detect(float[][] data) {
        double[] stats = Statistics.clippedStats(data, null, 3.0, 10);
        return detect(data, stats[1], stats[2]);
    }

    /**
     * @return The sources, brightest first
     */
    public List<Source> detect(float[][] data, double background, double rms) {
        List<Source> sources = new ArrayList<>();
        ResultsTable rt = analyze(data, background, rms);
        if (rt == null) {
            return sources;
        }
        FloatProcessor ip = toProcessor(data);
        for (int i = 0; i < rt.getCounter(); i++) {
            double area = rt.getValue("Area", i);
            double peak = rt.getValue("Max", i);
            double x = rt.getValue("XM", i) - 0.5;
            double y = rt.getValue("YM", i) - 0.5;
            int bx = (int) rt.getValue("BX", i);
            int by = (int) rt.getValue("BY", i);
            boolean edge = bx == 0 || by == 0 || bx + (int) rt.getValue("Width", i) == ip.getWidth()
                    || by + (int) rt.getValue("Height", i) == ip.getHeight();
            double flux = rt.getValue("RawIntDen", i) - background * area;
            double[] shape = halfMaximumShape(ip, x, y, background + (peak - background) / 2);
            sources.add(new Source((int) area, flux, x, y, peak, shape[0], shape[1], edge));
        }
        sources.sort(Comparator.comparingDouble(Source::getFlux).reversed());
        return sources;
    }

    /**
     * Build a source mask: true for every pixel that belongs to a detected
     * source.
     */
    public boolean[][] mask(float[][] data) {
        double[] stats = Statistics.clippedStats(data, null, 3.0, 10);
        int height = data.length;
        int width = height == 0 ? 0 : data[0].length;
        boolean[][] mask = new boolean[height][width];
        ResultsTable rt = analyze(data, stats[1], stats[2]);
        if (rt == null) {
            return mask;
        }
        FloatProcessor ip = toProcessor(data);
        double threshold = threshold(stats[1], stats[2]);
        for (int i = 0; i < rt.getCounter(); i++) {
            Roi roi = outline(ip, (int) rt.getValue("XStart", i), (int) rt.getValue("YStart", i), threshold);
            Rectangle bounds = roi.getBounds();
            ImageProcessor roiMask = roi.getMask();
            for (int y = 0; y < bounds.height; y++) {
                for (int x = 0; x < bounds.width; x++) {
                    if (roiMask == null || roiMask.get(x, y) != 0) {
                        mask[bounds.y + y][bounds.x + x] = true;
                    }
                }
            }
        }
        return mask;
    }

    private double threshold(double background, double rms) {
        return background + nsigma * (Double.isNaN(rms) ? 0 : rms);
    }

    /**
     * @return One row per source, or null if nothing rises above the
     * threshold
     */
    private ResultsTable analyze(float[][] data, double background, double rms) {
        if (data.length == 0 || data[0].length == 0) {
            return null;
        }
        FloatProcessor ip = toProcessor(data);
        double threshold = threshold(background, rms);
        if (!(ip.getMax() > threshold)) {
            return null;
        }
        ip.setThreshold(threshold, ip.getMax(), ImageProcessor.NO_LUT_UPDATE);
        ResultsTable rt = new ResultsTable();
        ParticleAnalyzer pa = new ParticleAnalyzer(ParticleAnalyzer.SHOW_NONE | ParticleAnalyzer.RECORD_STARTS,
                MEASUREMENTS, rt, minPixels, Double.POSITIVE_INFINITY);
        pa.analyze(new ImagePlus("", ip));
        return rt.getCounter() == 0 ? null : rt;
    }

    /**
     * @return {FWHM, elongation} from the area and fitted ellipse of the
     * connected region above {@code level} around (x, y), or NaN if the
     * centre is below it
     */
    private static double[] halfMaximumShape(FloatProcessor ip, double x, double y, double level) {
        int px = (int) Math.round(x);
        int py = (int) Math.round(y);
        if (px < 0 || py < 0 || px >= ip.getWidth() || py >= ip.getHeight() || !(ip.getf(px, py) >= level)) {
            return new double[]{Double.NaN, Double.NaN};
        }
        ip.setRoi(outline(ip, px, py, level));
        ImageStatistics stats = ImageStatistics.getStatistics(ip, Measurements.AREA | Measurements.ELLIPSE, null);
        ip.resetRoi();
        double fwhm = 2 * Math.sqrt(stats.pixelCount / Math.PI);
        double elongation = stats.minor > 0 ? stats.major / stats.minor : Double.POSITIVE_INFINITY;
        return new double[]{fwhm, elongation};
    }

    private static Roi outline(ImageProcessor ip, int x, int y, double level) {
        Wand wand = new Wand(ip);
        wand.autoOutline(x, y, level, Float.MAX_VALUE, Wand.EIGHT_CONNECTED);
        return new PolygonRoi(wand.xpoints, wand.ypoints, wand.npoints, Roi.TRACED_ROI);
    }

    private static FloatProcessor toProcessor(float[][] data) {
        int height = data.length;
        int width = data[0].length;
        float[] pixels = new float[width * height];
        for (int y = 0; y < height; y++) {
            System.arraycopy(data[y], 0, pixels, y * width, width);
        }
        return new FloatProcessor(width, height, pixels);
    }
}
