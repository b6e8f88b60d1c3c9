package com.flowmable.colormatch;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads palette CSV files.
 * <p>
 * The header decides the color columns: {@code lab_l}/{@code l}, {@code lab_a}/{@code a},
 * {@code lab_b}/{@code b} when any L column is present, otherwise {@code r}, {@code g},
 * {@code b} (converted to Lab). An optional {@code name} column names the entries; unnamed
 * rows become {@code "Color N"}. Rows without finite Lab values are dropped.
 */
public final class PaletteCsvParser {

    private PaletteCsvParser() {}

    private static final Pattern LEADING_NUMBER =
            Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    public static List<PaletteEntry> parse(String csv) {
        try {
            return parse(new StringReader(csv));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static List<PaletteEntry> parse(Reader reader) throws IOException {
        List<String> lines = new ArrayList<>();
        try (BufferedReader in = new BufferedReader(reader)) {
            String line;
            while ((line = in.readLine()) != null) {
                if (!line.trim().isEmpty()) {
                    lines.add(line);
                }
            }
        }
        if (lines.isEmpty()) {
            return List.of();
        }

        List<String> header = Arrays.stream(lines.get(0).split(","))
                .map(s -> s.trim().toLowerCase(Locale.ROOT))
                .toList();
        boolean hasLab = header.contains("lab_l") || header.contains("l");
        boolean hasRgb = header.contains("r") && header.contains("g") && header.contains("b");
        int nameIdx = header.indexOf("name");

        int lIdx = preferred(header, "lab_l", "l");
        int aIdx = preferred(header, "lab_a", "a");
        int bIdx = preferred(header, "lab_b", "b");

        List<PaletteEntry> candidates = new ArrayList<>();
        for (String row : lines.subList(1, lines.size())) {
            String[] cols = Arrays.stream(row.split(",", -1)).map(String::trim).toArray(String[]::new);
            String name = nameIdx >= 0 && nameIdx < cols.length
                    ? cols[nameIdx]
                    : "Color " + (candidates.size() + 1);

            if (hasLab) {
                if (lIdx < 0 || aIdx < 0 || bIdx < 0) continue;
                candidates.add(new PaletteEntry(name,
                        new Lab(number(cols, lIdx), number(cols, aIdx), number(cols, bIdx))));
            } else if (hasRgb) {
                double r = number(cols, header.indexOf("r"));
                double g = number(cols, header.indexOf("g"));
                double b = number(cols, header.indexOf("b"));
                Lab lab = Double.isFinite(r) && Double.isFinite(g) && Double.isFinite(b)
                        ? ColorSpaceUtils.rgbToLab(channel(r), channel(g), channel(b))
                        : new Lab(Double.NaN, Double.NaN, Double.NaN);
                candidates.add(new PaletteEntry(name, lab));
            }
        }

        return candidates.stream().filter(e -> e.lab().isFinite()).toList();
    }

    private static int preferred(List<String> header, String primary, String fallback) {
        int idx = header.indexOf(primary);
        return idx >= 0 ? idx : header.indexOf(fallback);
    }

    /** Lenient number parsing: leading numeric prefix, NaN when there is none. */
    private static double number(String[] cols, int idx) {
        if (idx < 0 || idx >= cols.length) return Double.NaN;
        Matcher m = LEADING_NUMBER.matcher(cols[idx]);
        return m.find() ? Double.parseDouble(m.group()) : Double.NaN;
    }

    private static int channel(double v) {
        return (int) ColorSpaceUtils.clamp(Math.round(v), 0, 255);
    }
}
