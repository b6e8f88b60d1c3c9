package com.flowmable.colormatch;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A named target color of a palette (e.g. a Pantone or DIC swatch).
 *
 * @param name display name
 * @param lab  target color
 */
public record PaletteEntry(String name, Lab lab) {

    public PaletteEntry {
        InvalidConfigurationException.requireNonNull(name, "palette entry name");
        InvalidConfigurationException.requireNonNull(lab, "palette entry color");
    }

    public static PaletteEntry ofRgb(String name, int r, int g, int b) {
        return new PaletteEntry(name, ColorSpaceUtils.rgbToLab(r, g, b));
    }

    /** Flat {@code name, labL, labA, labB} view for report writers. */
    public Map<String, Object> summary() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("name", name);
        row.put("labL", lab.l());
        row.put("labA", lab.a());
        row.put("labB", lab.b());
        return row;
    }
}
