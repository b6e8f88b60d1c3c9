package com.flowmable.colormatch;

import java.util.List;

/**
 * A saved palette.
 */
public record PalettePreset(String id, String name, List<PaletteEntry> items) implements Preset {

    public PalettePreset {
        items = List.copyOf(InvalidConfigurationException.requireNonNull(items, "palette items"));
        if (items.isEmpty()) {
            throw new InvalidConfigurationException("Palette preset '" + name + "' has no items");
        }
    }

    /** The entry called {@code entryName}, falling back to the first entry. */
    public PaletteEntry target(String entryName) {
        return items.stream()
                .filter(e -> e.name().equals(entryName))
                .findFirst()
                .orElse(items.get(0));
    }
}
