package com.example.tracking.tracker;

import org.junit.Test;

import static org.junit.Assert.*;

public class HungarianAlgorithmTest {

    @Test
    public void testSquareMatrixOptimalAssignment() {
        double[][] cost = {
                {4, 1, 3},
                {2, 0, 5},
                {3, 2, 2}
        };
        assertArrayEquals(new int[]{1, 0, 2}, HungarianAlgorithm.solve(cost));
    }

    @Test
    public void testMoreColumnsThanRows() {
        double[][] cost = {
                {10, 1, 10},
                {1, 10, 10}
        };
        assertArrayEquals(new int[]{1, 0}, HungarianAlgorithm.solve(cost));
    }

    @Test
    public void testMoreRowsThanColumnsLeavesRowsUnassigned() {
        double[][] cost = {
                {5, 1},
                {1, 5},
                {3, 3}
        };
        assertArrayEquals(new int[]{1, 0, -1}, HungarianAlgorithm.solve(cost));
    }

    @Test
    public void testOptimalBeatsGreedy() {
        // 贪心先取 (0,0)=0.0，再只能取 (1,1)=1.0，总代价1.0；最优为 (0,1)+(1,0)=0.3
        double[][] cost = {
                {0.0, 0.1},
                {0.2, 1.0}
        };
        assertArrayEquals(new int[]{1, 0}, HungarianAlgorithm.solve(cost));
    }

    @Test
    public void testSameInputGivesSameAssignment() {
        double[][] cost = {
                {0.5, 0.5},
                {0.5, 0.5}
        };
        int[] first = HungarianAlgorithm.solve(cost);
        int[] second = HungarianAlgorithm.solve(cost);
        assertArrayEquals(first, second);
        assertNotEquals(first[0], first[1]);
    }

    @Test
    public void testEmptyMatrices() {
        assertEquals(0, HungarianAlgorithm.solve(new double[0][0]).length);
        assertArrayEquals(new int[]{-1, -1}, HungarianAlgorithm.solve(new double[2][0]));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonFiniteCostRejected() {
        HungarianAlgorithm.solve(new double[][]{{0.1, Double.NaN}});
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRaggedMatrixRejected() {
        HungarianAlgorithm.solve(new double[][]{{0.1, 0.2}, {0.3}});
    }
}
