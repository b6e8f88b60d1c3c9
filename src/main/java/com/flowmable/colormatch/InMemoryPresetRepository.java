package com.flowmable.colormatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Thread-safe, process-local {@link PresetRepository}.
 */
public class InMemoryPresetRepository<T extends Preset> implements PresetRepository<T> {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryPresetRepository.class);

    private final List<T> presets = new ArrayList<>();

    public InMemoryPresetRepository() {
    }

    /** Seed with {@code initial}, kept in the given order. */
    public InMemoryPresetRepository(List<T> initial) {
        for (T preset : initial) {
            validate(preset);
            presets.add(preset);
        }
    }

    @Override
    public synchronized List<T> findAll() {
        return List.copyOf(presets);
    }

    @Override
    public synchronized Optional<T> findById(String id) {
        return presets.stream().filter(p -> p.id().equals(id)).findFirst();
    }

    @Override
    public synchronized T save(T preset) {
        validate(preset);
        presets.removeIf(p -> p.id().equals(preset.id()));
        presets.add(0, preset);
        logger.debug("Saved preset {} ({})", preset.id(), preset.name());
        return preset;
    }

    @Override
    public synchronized boolean delete(String id) {
        boolean removed = presets.removeIf(p -> p.id().equals(id));
        if (removed) {
            logger.debug("Deleted preset {}", id);
        }
        return removed;
    }

    private static void validate(Preset preset) {
        InvalidConfigurationException.requireNonNull(preset, "preset");
        if (preset.id() == null || preset.id().isBlank()) {
            throw new InvalidConfigurationException("Preset id must not be blank");
        }
        if (preset.name() == null || preset.name().isBlank()) {
            throw new InvalidConfigurationException("Preset name must not be blank");
        }
    }
}
