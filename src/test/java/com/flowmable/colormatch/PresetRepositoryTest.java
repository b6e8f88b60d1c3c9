package com.flowmable.colormatch;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PresetRepositoryTest {

    @Test
    void builtInPalettes_areSeeded() {
        PresetRepository<PalettePreset> repo = BuiltInPresets.paletteRepository();
        List<PalettePreset> all = repo.findAll();

        assertEquals(List.of("neutral-gray", "srgb-primaries"), all.stream().map(Preset::id).toList());
        PalettePreset primaries = repo.findById("srgb-primaries").orElseThrow();
        assertEquals(3, primaries.items().size());
        assertEquals(ColorSpaceUtils.rgbToLab(0, 0, 255), primaries.target("Blue").lab());
        assertEquals("Red", primaries.target("Magenta").name());
    }

    @Test
    void builtInRecoveryTargets() {
        PresetRepository<RecoveryTargetPreset> repo = BuiltInPresets.recoveryTargetRepository();
        RecoveryTargetPreset white = repo.findById("white95").orElseThrow();
        RecoverySettings settings = white.applyTo(RecoverySettings.DEFAULT);
        assertEquals(new Lab(95, 0, 0), settings.target());
        assertTrue(settings.enabled());
    }

    @Test
    void save_putsNewestFirstAndReplacesSameId() {
        InMemoryPresetRepository<PalettePreset> repo = new InMemoryPresetRepository<>();
        PalettePreset first = new PalettePreset("p1", "Brand", List.of(new PaletteEntry("A", new Lab(40, 10, 10))));
        PalettePreset second = new PalettePreset("p2", "Print", List.of(new PaletteEntry("B", new Lab(60, 0, 0))));
        repo.save(first);
        repo.save(second);
        assertEquals(List.of(second, first), repo.findAll());

        PalettePreset renamed = new PalettePreset("p1", "Brand v2", first.items());
        repo.save(renamed);
        assertEquals(List.of(renamed, second), repo.findAll());
    }

    @Test
    void delete_removesById() {
        InMemoryPresetRepository<ChartPreset> repo = new InMemoryPresetRepository<>();
        LabStats stats = new LabStats(new Lab(52, 1, -1), new Lab(18, 6, 7));
        repo.save(new ChartPreset("c1", "Studio A", stats, 81.0));

        CalibrationReference reference = repo.findById("c1").orElseThrow().toReference();
        assertEquals(CalibrationReference.Source.CHART, reference.source());
        assertFalse(reference.recoveryAvailable());
        assertEquals(81.0, reference.qualityScore());

        assertTrue(repo.delete("c1"));
        assertFalse(repo.delete("c1"));
        assertTrue(repo.findById("c1").isEmpty());
    }

    @Test
    void invalidPresets_rejected() {
        InMemoryPresetRepository<PalettePreset> repo = new InMemoryPresetRepository<>();
        List<PaletteEntry> items = List.of(new PaletteEntry("A", Lab.NEUTRAL_GRAY));

        assertThrows(InvalidConfigurationException.class, () -> repo.save(new PalettePreset("p", "  ", items)));
        assertThrows(InvalidConfigurationException.class, () -> repo.save(new PalettePreset("", "Name", items)));
        assertThrows(InvalidConfigurationException.class, () -> new PalettePreset("p", "Empty", List.of()));
        assertTrue(repo.findAll().isEmpty());
    }
}
