/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 */
package com.hellblazer.gearforge.gear;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the stock tooth shapes and twist functions
 */
public class ShapeFunctionsTest {

    private static final double EPSILON = 1e-12;

    @Test
    void testSine() {
        assertEquals(1.0, ToothShapes.SINE.height(0), EPSILON);
        assertEquals(0.0, ToothShapes.SINE.height(0.5), EPSILON);
        assertEquals(0.5, ToothShapes.SINE.height(0.25), EPSILON);
    }

    @Test
    void testVAndA() {
        assertEquals(1.0, ToothShapes.V_SHAPE.height(0), EPSILON);
        assertEquals(0.0, ToothShapes.V_SHAPE.height(0.5), EPSILON);
        assertEquals(0.5, ToothShapes.V_SHAPE.height(0.75), EPSILON);
        for (var u = 0.0; u < 1.0; u += 0.05) {
            assertEquals(1.0, ToothShapes.V_SHAPE.height(u) + ToothShapes.A_SHAPE.height(u), EPSILON);
        }
    }

    @Test
    void testHalfSineStaysOnRootForHalfTheSlice() {
        assertEquals(1.0, ToothShapes.HALF_SINE.height(0), EPSILON);
        assertEquals(0.0, ToothShapes.HALF_SINE.height(0.3), EPSILON);
        assertEquals(0.0, ToothShapes.HALF_SINE.height(0.5), EPSILON);
        assertEquals(0.0, ToothShapes.HALF_SINE.height(0.7), EPSILON);
        assertTrue(ToothShapes.HALF_SINE.height(0.9) > 0);
    }

    @Test
    void testConstantShape() {
        assertEquals(0.25, ToothShapes.constant(0.25).height(0.6));
    }

    @Test
    void testTwists() {
        assertEquals(0.0, TwistFunction.none().angle(7));
        assertEquals(0.3, TwistFunction.constant(0.3).angle(7));
        assertEquals(7.0 / 8, TwistFunction.linear(1.0 / 8).angle(7), EPSILON);
    }

    @Test
    void testFishboneFoldsAtMidThickness() {
        var fishbone = TwistFunction.fishbone(0.6, 8);
        assertEquals(0.0, fishbone.angle(0), EPSILON);
        assertEquals(0.3, fishbone.angle(2), EPSILON);
        assertEquals(0.6, fishbone.angle(4), EPSILON);
        assertEquals(0.3, fishbone.angle(6), EPSILON);
        assertEquals(0.0, fishbone.angle(8), EPSILON);
    }

    @Test
    void testOfProgress() {
        var twist = TwistFunction.ofProgress(progress -> progress * 2, 4);
        assertEquals(0.0, twist.angle(0), EPSILON);
        assertEquals(1.0, twist.angle(2), EPSILON);
        assertEquals(2.0, twist.angle(4), EPSILON);
        assertThrows(GearException.InvalidParameterException.class,
                     () -> TwistFunction.ofProgress(progress -> progress, 0));
    }
}
