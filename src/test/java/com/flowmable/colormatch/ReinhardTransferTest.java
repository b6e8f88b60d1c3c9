package com.flowmable.colormatch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReinhardTransferTest {

    private static final LabStats REFERENCE = new LabStats(new Lab(50, 2, -3), new Lab(10, 5, 5));
    private static final LabStats TARGET = new LabStats(new Lab(40, 0, 0), new Lab(5, 5, 5));

    @Test
    void fullMode_matchesMomentsPerChannel() {
        Lab out = ReinhardTransfer.transferLab(new Lab(45, 1, -1), REFERENCE, TARGET, TransferMode.FULL);
        assertEquals(60.0, out.l(), 1e-9);
        assertEquals(3.0, out.a(), 1e-9);
        assertEquals(-4.0, out.b(), 1e-9);
    }

    @Test
    void luminanceMode_leavesChromaUntouched() {
        Lab out = ReinhardTransfer.transferLab(new Lab(45, 1, -1), REFERENCE, TARGET, TransferMode.LUMINANCE);
        assertEquals(new Lab(60, 1, -1), out);
    }

    @Test
    void chromaticMode_leavesLightnessUntouched() {
        Lab out = ReinhardTransfer.transferLab(new Lab(45, 1, -1), REFERENCE, TARGET, TransferMode.CHROMATIC);
        assertEquals(45.0, out.l());
        assertEquals(3.0, out.a(), 1e-9);
        assertEquals(-4.0, out.b(), 1e-9);
    }

    @Test
    void result_isClampedIntoLabRange() {
        LabStats wide = new LabStats(new Lab(90, 0, 0), new Lab(40, 60, 60));
        Lab out = ReinhardTransfer.transferLab(new Lab(95, 120, -120), wide, TARGET, TransferMode.FULL);
        assertEquals(100.0, out.l());
        assertEquals(127.0, out.a());
        assertEquals(-128.0, out.b());
    }

    @Test
    void identicalStats_leaveBufferUnchangedAtAnyStrength() {
        PixelBuffer original = TestBuffers.noise(42);
        LabStats stats = LabStatistics.computeLabStats(original, 2);

        for (double strength : new double[]{0.0, 0.3, 0.5, 1.0}) {
            PixelBuffer buffer = original.copy();
            ReinhardTransfer.applyReinhardTransfer(buffer, stats, stats, strength, TransferMode.FULL);
            assertTrue(buffer.samePixels(original), "Buffer changed at strength " + strength);
        }
    }

    @Test
    void zeroStrength_leavesBufferUnchanged() {
        PixelBuffer original = TestBuffers.gradient(10, 20, 30, 240, 200, 90);
        PixelBuffer buffer = original.copy();
        ReinhardTransfer.applyReinhardTransfer(buffer, REFERENCE, TARGET, 0.0, TransferMode.FULL);
        assertTrue(buffer.samePixels(original));
    }

    @Test
    void uniformReference_collapsesTargetOntoReferenceColor() {
        PixelBuffer buffer = TestBuffers.gradient(0, 0, 0, 255, 255, 255);
        LabStats target = LabStatistics.computeLabStats(buffer, 1);
        LabStats reference = LabStatistics.computeLabStats(TestBuffers.solid(200, 120, 80), 1);

        PixelBuffer returned = ReinhardTransfer.applyReinhardTransfer(buffer, reference, target, 1.0, TransferMode.FULL);

        assertSame(buffer, returned);
        for (int i = 0; i < buffer.pixelCount(); i++) {
            assertEquals(new Rgb(200, 120, 80), buffer.rgb(i));
        }
    }

    @Test
    void halfStrength_blendsInRgb() {
        PixelBuffer buffer = TestBuffers.gradient(0, 0, 0, 255, 255, 255);
        PixelBuffer full = buffer.copy();
        LabStats target = LabStatistics.computeLabStats(buffer, 1);
        LabStats reference = LabStatistics.computeLabStats(TestBuffers.solid(200, 120, 80), 1);

        ReinhardTransfer.applyReinhardTransfer(buffer, reference, target, 0.5, TransferMode.FULL);

        for (int i = 0; i < buffer.pixelCount(); i++) {
            assertEquals(ColorSpaceUtils.blend(full.red(i), 200, 0.5), buffer.red(i));
            assertEquals(ColorSpaceUtils.blend(full.green(i), 120, 0.5), buffer.green(i));
            assertEquals(ColorSpaceUtils.blend(full.blue(i), 80, 0.5), buffer.blue(i));
        }
    }

    @Test
    void alpha_isNeverTouched() {
        PixelBuffer buffer = TestBuffers.noise(3);
        byte[] alphaBefore = alphas(buffer);
        LabStats target = LabStatistics.computeLabStats(buffer, 1);
        ReinhardTransfer.applyReinhardTransfer(buffer, REFERENCE, target, 1.0, TransferMode.FULL);
        assertArrayEquals(alphaBefore, alphas(buffer));
    }

    @Test
    void invalidStrength_rejectedBeforeTouchingPixels() {
        PixelBuffer original = TestBuffers.noise(5);
        PixelBuffer buffer = original.copy();
        assertThrows(InvalidConfigurationException.class,
                () -> ReinhardTransfer.applyReinhardTransfer(buffer, REFERENCE, TARGET, 1.5, TransferMode.FULL));
        assertThrows(InvalidConfigurationException.class,
                () -> ReinhardTransfer.applyReinhardTransfer(buffer, REFERENCE, TARGET, Double.NaN, TransferMode.FULL));
        assertThrows(InvalidConfigurationException.class,
                () -> ReinhardTransfer.applyReinhardTransfer(buffer, REFERENCE, TARGET, 1.0, null));
        assertTrue(buffer.samePixels(original));
    }

    static byte[] alphas(PixelBuffer buffer) {
        byte[] alpha = new byte[buffer.pixelCount()];
        for (int i = 0; i < alpha.length; i++) {
            alpha[i] = (byte) buffer.alpha(i);
        }
        return alpha;
    }
}
