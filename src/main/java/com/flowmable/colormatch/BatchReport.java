package com.flowmable.colormatch;

import java.util.List;
import java.util.Optional;

/**
 * Aggregated outcome of a batch.
 *
 * @param results    per-image results in input order
 * @param confidence calibration confidence for the batch
 * @param steps      names of the configured steps, in pipeline order
 */
public record BatchReport(
        List<ImageCorrectionResult> results,
        Confidence confidence,
        List<String> steps
) {
    public BatchReport {
        results = List.copyOf(results);
        steps = List.copyOf(steps);
    }

    public long succeededCount() {
        return results.stream().filter(ImageCorrectionResult::succeeded).count();
    }

    public long failedCount() {
        return results.size() - succeededCount();
    }

    public boolean hasFailures() {
        return failedCount() > 0;
    }

    public Optional<ImageCorrectionResult> result(String id) {
        return results.stream().filter(r -> r.id().equals(id)).findFirst();
    }
}
