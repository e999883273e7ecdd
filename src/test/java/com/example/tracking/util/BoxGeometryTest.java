package com.example.tracking.util;

import org.junit.Test;

import static org.junit.Assert.*;

public class BoxGeometryTest {

    private static final double EPS = 1e-9;

    @Test
    public void testIouOfIdenticalBoxesIsOne() {
        double[] box = {10, 20, 110, 220};
        assertEquals(1.0, BoxGeometry.iou(box, box), EPS);
    }

    @Test
    public void testIouOfDisjointBoxesIsZero() {
        double[] a = {0, 0, 10, 10};
        double[] b = {20, 20, 30, 30};
        assertEquals(0.0, BoxGeometry.iou(a, b), EPS);
    }

    @Test
    public void testIouOfTouchingBoxesIsZero() {
        double[] a = {0, 0, 10, 10};
        double[] b = {10, 0, 20, 10};
        assertEquals(0.0, BoxGeometry.iou(a, b), EPS);
    }

    @Test
    public void testIouIsSymmetric() {
        double[] a = {0, 0, 10, 10};
        double[] b = {5, 5, 20, 15};
        assertEquals(BoxGeometry.iou(a, b), BoxGeometry.iou(b, a), EPS);
        // 交集 5*5=25，并集 100+150-25=225
        assertEquals(25.0 / 225.0, BoxGeometry.iou(a, b), EPS);
    }

    @Test
    public void testIouOfZeroAreaBoxesIsZero() {
        double[] point = {5, 5, 5, 5};
        assertEquals(0.0, BoxGeometry.iou(point, point), EPS);
        assertEquals(0.0, BoxGeometry.iou(null, point), EPS);
    }

    @Test
    public void testCenterAndCornerFormConversion() {
        double[] center = BoxGeometry.toCenterForm(new double[]{10, 20, 50, 100});
        assertArrayEquals(new double[]{30, 60, 40, 80}, center, EPS);

        double[] corner = BoxGeometry.toCornerForm(center[0], center[1], center[2], center[3]);
        assertArrayEquals(new double[]{10, 20, 50, 100}, corner, EPS);
    }

    @Test
    public void testWellFormedChecks() {
        assertTrue(BoxGeometry.isWellFormed(new double[]{0, 0, 1, 1}));
        assertFalse("反向框应判为非法", BoxGeometry.isWellFormed(new double[]{10, 0, 5, 1}));
        assertTrue("零宽框不是反向框", BoxGeometry.isWellFormed(new double[]{5, 0, 5, 1}));
        assertTrue(BoxGeometry.isWellFormed(new double[]{5, 3, 5, 3}));
        assertFalse(BoxGeometry.isWellFormed(new double[]{0, 10, 1, 5}));
        assertFalse(BoxGeometry.isWellFormed(new double[]{0, 0, Double.NaN, 1}));
        assertFalse(BoxGeometry.isWellFormed(new double[]{0, 0, 1}));
        assertFalse(BoxGeometry.isWellFormed(null));

        assertTrue(BoxGeometry.isFinite(new double[]{10, 0, 5, 1}));
        assertFalse(BoxGeometry.isFinite(new double[]{0, 0, Double.POSITIVE_INFINITY, 1}));
    }

    @Test
    public void testToPixelsTruncates() {
        assertArrayEquals(new int[]{10, 20, 30, 40}, BoxGeometry.toPixels(new double[]{10.9, 20.2, 30.5, 40.99}));
    }
}
