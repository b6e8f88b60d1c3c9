package com.flowmable.colormatch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Validates base score selection, risk penalties, clamping and labelling.
 */
class ConfidenceScorerTest {

    private final ConfidenceScorer scorer = new ConfidenceScorer();

    @Test
    void chartQuality_winsOverRecoveryHeuristic() {
        Confidence c = scorer.score(82.0, true, true, RiskTier.LOW);
        assertEquals(82, c.score());
        assertEquals(ConfidenceLevel.HIGH, c.level());
    }

    @Test
    void recoveryEnabled_base55() {
        Confidence c = scorer.score(null, true, true, null);
        assertEquals(55, c.score());
        assertEquals(ConfidenceLevel.MID, c.level());
    }

    @Test
    void recoveryDisabled_base35() {
        Confidence c = scorer.score(null, true, false, null);
        assertEquals(35, c.score());
        assertEquals(ConfidenceLevel.LOW, c.level());
    }

    @Test
    void noRecoveryNoChart_base40() {
        assertEquals(40, scorer.score(null, false, true, null).score());
        assertEquals(40, scorer.score(null, false, false, RiskTier.LOW).score());
    }

    @Test
    void riskPenalties() {
        assertEquals(40, scorer.score(55.0, false, false, RiskTier.HIGH).score());
        assertEquals(48, scorer.score(55.0, false, false, RiskTier.MEDIUM).score());
        assertEquals(55, scorer.score(55.0, false, false, RiskTier.LOW).score());
    }

    @Test
    void score_isClampedToRange() {
        Confidence low = scorer.score(5.0, false, false, RiskTier.HIGH);
        assertEquals(0, low.score());
        assertEquals(ConfidenceLevel.LOW, low.level());

        Confidence high = scorer.score(100.0, false, false, RiskTier.HIGH);
        assertEquals(85, high.score());
        assertTrue(high.score() >= 0 && high.score() <= 100);

        assertEquals(100, scorer.score(250.0, false, false, null).score());
        assertEquals(0, scorer.score(-40.0, false, false, null).score());
    }

    @Test
    void labelBoundaries() {
        assertEquals(ConfidenceLevel.HIGH, scorer.levelFor(70));
        assertEquals(ConfidenceLevel.MID, scorer.levelFor(69));
        assertEquals(ConfidenceLevel.MID, scorer.levelFor(50));
        assertEquals(ConfidenceLevel.LOW, scorer.levelFor(49));
    }

    @Test
    void customPolicy() {
        ConfidencePolicy strict = new ConfidencePolicy(45, 30, 30, 10, 25, 80, 60);
        ConfidenceScorer custom = new ConfidenceScorer(strict);
        Confidence c = custom.score(null, true, true, RiskTier.MEDIUM);
        assertEquals(35, c.score());
        assertEquals(ConfidenceLevel.LOW, c.level());
        assertEquals(ConfidenceLevel.MID, custom.levelFor(75));
    }

    @Test
    void scoreOutsideRange_rejected() {
        assertThrows(InvalidConfigurationException.class, () -> new Confidence(101, ConfidenceLevel.HIGH));
        assertThrows(InvalidConfigurationException.class, () -> new Confidence(-1, ConfidenceLevel.LOW));
    }
}
