package com.flowmable.colormatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;

/**
 * Top-level entry point for batch color matching.
 * <p>
 * Per image, in fixed order:
 * 1. Recovery: shift the image's own mean towards the recovery target (reference images only).
 * 2. Re-measure the recovered image; these are the transfer's target statistics.
 * 3. Reinhard transfer against the reference statistics.
 * 4. Palette (spot) shift, if configured.
 * <p>
 * Every image is corrected on a private copy and written back only after all steps succeed,
 * so a failed image keeps its original pixels. Failures are isolated per image.
 */
public class ColorMatchPipeline {

    private static final Logger logger = LoggerFactory.getLogger(ColorMatchPipeline.class);

    private final CorrectionSettings settings;
    private final ConfidenceScorer confidenceScorer;

    public ColorMatchPipeline() {
        this(CorrectionSettings.DEFAULT);
    }

    public ColorMatchPipeline(CorrectionSettings settings) {
        this(settings, new ConfidenceScorer());
    }

    public ColorMatchPipeline(CorrectionSettings settings, ConfidenceScorer confidenceScorer) {
        this.settings = InvalidConfigurationException.requireNonNull(settings, "correction settings");
        this.confidenceScorer = InvalidConfigurationException.requireNonNull(confidenceScorer, "confidence scorer");
    }

    public CorrectionSettings settings() {
        return settings;
    }

    /**
     * Correct one image in place. Never throws for a failure inside the pipeline; the failure is
     * reported in the result and the buffer is left as it was.
     */
    public ImageCorrectionResult correct(String id, PixelBuffer buffer, CalibrationReference reference) {
        try {
            return run(id, buffer, reference);
        } catch (RuntimeException e) {
            logger.warn("Correction failed for image {}", id, e);
            return ImageCorrectionResult.failed(id, describe(e));
        }
    }

    private ImageCorrectionResult run(String id, PixelBuffer buffer, CalibrationReference reference) {
        InvalidConfigurationException.requireNonNull(buffer, "pixel buffer");
        InvalidConfigurationException.requireNonNull(reference, "calibration reference");
        int step = settings.analysisSampleStep();
        PixelBuffer work = buffer.copy();

        // 1. Recovery
        LabStats preStats;
        LabShift recoveryShift = null;
        if (recoveryActive(reference)) {
            LabShifter.RecoveryOutcome recovery = LabShifter.applyRecovery(work, settings.recovery(), step);
            preStats = recovery.preStats();
            recoveryShift = recovery.shift();
            logger.debug("[{}] recovery shift {}", id, recoveryShift);
        } else {
            preStats = LabStatistics.computeLabStats(work, step);
        }

        // 2. Target statistics after recovery
        LabStats targetStats = recoveryShift != null ? LabStatistics.computeLabStats(work, step) : preStats;
        logger.debug("[{}] target stats {}", id, targetStats);

        // 3. Transfer
        ReinhardTransfer.applyReinhardTransfer(work, reference.stats(), targetStats,
                settings.strength(), settings.mode());

        // 4. Palette shift
        LabShift spotShift = settings.hasSpotShift() ? settings.spotShift() : null;
        LabShifter.applyLabShift(work, spotShift, settings.strength());

        buffer.copyFrom(work);
        return ImageCorrectionResult.succeeded(id, preStats, targetStats, recoveryShift, spotShift);
    }

    /**
     * Correct every item sequentially.
     *
     * @param risk environmental risk tier for the confidence score, or {@code null}
     */
    public BatchReport correctAll(List<BatchItem> items, CalibrationReference reference, RiskTier risk) {
        requireBatch(items, reference);
        List<ImageCorrectionResult> results = new ArrayList<>(items.size());
        for (BatchItem item : items) {
            results.add(correct(item.id(), item.buffer(), reference));
        }
        return report(results, reference, risk);
    }

    /**
     * Correct every item as an independent task on {@code executor}. Results keep input order.
     * Items must not share buffers. An item the executor rejects is reported as failed.
     */
    public BatchReport correctAll(List<BatchItem> items, CalibrationReference reference, RiskTier risk,
                                  ExecutorService executor) {
        requireBatch(items, reference);
        InvalidConfigurationException.requireNonNull(executor, "executor");
        List<Future<ImageCorrectionResult>> futures = new ArrayList<>(items.size());
        for (BatchItem item : items) {
            try {
                futures.add(executor.submit(() -> correct(item.id(), item.buffer(), reference)));
            } catch (RejectedExecutionException e) {
                logger.warn("Executor rejected correction of image {}", item.id(), e);
                futures.add(null);
            }
        }

        List<ImageCorrectionResult> results = new ArrayList<>(items.size());
        boolean interrupted = false;
        for (int i = 0; i < futures.size(); i++) {
            String id = items.get(i).id();
            Future<ImageCorrectionResult> future = futures.get(i);
            if (future == null) {
                results.add(ImageCorrectionResult.failed(id, "Rejected by executor"));
                continue;
            }
            if (interrupted) {
                future.cancel(true);
                results.add(ImageCorrectionResult.failed(id, "Interrupted before completion"));
                continue;
            }
            try {
                results.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                future.cancel(true);
                results.add(ImageCorrectionResult.failed(id, "Interrupted before completion"));
            } catch (ExecutionException e) {
                logger.warn("Correction task failed for image {}", id, e.getCause());
                results.add(ImageCorrectionResult.failed(id, describe(e.getCause())));
            }
        }
        return report(results, reference, risk);
    }

    /**
     * Confidence for a batch against {@code reference}.
     */
    public Confidence confidence(CalibrationReference reference, RiskTier risk) {
        return confidenceScorer.score(reference.qualityScore(), reference.recoveryAvailable(),
                settings.recovery().enabled(), risk);
    }

    /**
     * Names of the steps this pipeline runs against {@code reference}, in order.
     */
    public List<String> steps(CalibrationReference reference) {
        List<String> steps = new ArrayList<>();
        if (recoveryActive(reference)) {
            steps.add(settings.recovery().describe());
        }
        steps.add(reference.source() == CalibrationReference.Source.CHART ? "Chart Reinhard" : "Reference Reinhard");
        if (settings.hasSpotShift()) {
            steps.add("Palette Lab Shift");
        }
        return steps;
    }

    private BatchReport report(List<ImageCorrectionResult> results, CalibrationReference reference, RiskTier risk) {
        Confidence confidence = confidence(reference, risk);
        BatchReport report = new BatchReport(results, confidence, steps(reference));
        logger.info("Batch finished: {} succeeded, {} failed, confidence {} ({})",
                report.succeededCount(), report.failedCount(), confidence.score(), confidence.level());
        return report;
    }

    private static void requireBatch(List<BatchItem> items, CalibrationReference reference) {
        InvalidConfigurationException.requireNonNull(items, "batch items");
        InvalidConfigurationException.requireNonNull(reference, "calibration reference");
    }

    private boolean recoveryActive(CalibrationReference reference) {
        return reference.recoveryAvailable() && settings.recovery().enabled();
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return e.getClass().getSimpleName() + (message != null ? ": " + message : "");
    }
}
