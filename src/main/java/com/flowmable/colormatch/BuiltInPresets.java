package com.flowmable.colormatch;

import java.util.List;

/**
 * Presets shipped with the application.
 */
public final class BuiltInPresets {

    private BuiltInPresets() {}

    public static final List<PalettePreset> PALETTES = List.of(
            new PalettePreset("neutral-gray", "Neutral Gray",
                    List.of(new PaletteEntry("Neutral Gray", Lab.NEUTRAL_GRAY))),
            new PalettePreset("srgb-primaries", "sRGB Primaries", List.of(
                    PaletteEntry.ofRgb("Red", 255, 0, 0),
                    PaletteEntry.ofRgb("Green", 0, 255, 0),
                    PaletteEntry.ofRgb("Blue", 0, 0, 255)))
    );

    public static final List<RecoveryTargetPreset> RECOVERY_TARGETS = List.of(
            new RecoveryTargetPreset("neutral50", "Neutral (L*50)", new Lab(50, 0, 0)),
            new RecoveryTargetPreset("neutral70", "Bright neutral (L*70)", new Lab(70, 0, 0)),
            new RecoveryTargetPreset("white95", "White reference (L*95)", new Lab(95, 0, 0))
    );

    public static PresetRepository<PalettePreset> paletteRepository() {
        return new InMemoryPresetRepository<>(PALETTES);
    }

    public static PresetRepository<RecoveryTargetPreset> recoveryTargetRepository() {
        return new InMemoryPresetRepository<>(RECOVERY_TARGETS);
    }
}
