package com.flowmable.colormatch;

import java.util.List;
import java.util.Optional;

/**
 * Storage for named presets. Implementations decide where presets live; the correction core
 * only ever receives the values read from a repository.
 *
 * @param <T> preset type
 */
public interface PresetRepository<T extends Preset> {

    /** All presets, most recently saved first. */
    List<T> findAll();

    Optional<T> findById(String id);

    /**
     * Store {@code preset}, replacing any preset with the same id.
     *
     * @throws InvalidConfigurationException if the id or name is blank
     */
    T save(T preset);

    /** @return true if a preset was removed */
    boolean delete(String id);
}
