package com.flowmable.colormatch;

/**
 * A saved chart calibration, so a chart shot once can be reused across sessions.
 *
 * @param stats        reference statistics measured from the chart
 * @param qualityScore chart quality in [0, 100], or null
 */
public record ChartPreset(String id, String name, LabStats stats, Double qualityScore) implements Preset {

    public ChartPreset {
        InvalidConfigurationException.requireNonNull(stats, "chart statistics");
    }

    public CalibrationReference toReference() {
        return CalibrationReference.fromChart(stats, qualityScore);
    }
}
