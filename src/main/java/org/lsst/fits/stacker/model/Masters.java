package org.lsst.fits.stacker.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The master calibration frames resolved for one group: an optional bias, the
 * darks by exposure and an optional flat.
 */
public class Masters {

    private final ImageFrame bias;
    private final Map<String, ImageFrame> darks;
    private final ImageFrame flat;

    public Masters(ImageFrame bias, Map<String, ImageFrame> darks, ImageFrame flat) {
        this.bias = bias;
        this.darks = darks == null ? Collections.emptyMap() : new LinkedHashMap<>(darks);
        this.flat = flat;
    }

    public static Masters none() {
        return new Masters(null, null, null);
    }

    public Optional<ImageFrame> getBias() {
        return Optional.ofNullable(bias);
    }

    public Optional<ImageFrame> getDark(String exposure) {
        return Optional.ofNullable(darks.get(exposure));
    }

    public Optional<ImageFrame> getFlat() {
        return Optional.ofNullable(flat);
    }

    public Masters withFlat(ImageFrame newFlat) {
        return new Masters(bias, darks, newFlat);
    }
}
