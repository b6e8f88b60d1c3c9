package com.flowmable.colormatch;

/**
 * A named, saved piece of configuration.
 */
public interface Preset {

    String id();

    String name();
}
