package com.flowmable.colormatch;

/**
 * A saved recovery target.
 */
public record RecoveryTargetPreset(String id, String name, Lab target) implements Preset {

    public RecoveryTargetPreset {
        InvalidConfigurationException.requireNonNull(target, "recovery target");
    }

    public RecoverySettings applyTo(RecoverySettings settings) {
        return settings.withTarget(target);
    }
}
