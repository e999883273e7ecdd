package com.example.tracking.tracker;

import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class IouMatcherTest {

    private final IouMatcher matcher = new IouMatcher(0.3);

    @Test
    public void testPicksHigherTotalIouOverGreedyPairing() {
        // 贪心：(0,0)=0.9 + (1,1)=0.1 = 1.0；最优：(0,1)=0.8 + (1,0)=0.85 = 1.65
        double[][] iou = {
                {0.9, 0.8},
                {0.85, 0.1}
        };
        MatchResult result = matcher.match(iou);

        assertEquals(2, result.getMatches().size());
        assertArrayEquals(new int[]{0, 1}, result.getMatches().get(0));
        assertArrayEquals(new int[]{1, 0}, result.getMatches().get(1));
        assertTrue(result.getUnmatchedDetections().isEmpty());
        assertTrue(result.getUnmatchedTracks().isEmpty());
    }

    @Test
    public void testThresholdIsInclusive() {
        MatchResult result = matcher.match(new double[][]{{0.3}});
        assertEquals(1, result.getMatches().size());
    }

    @Test
    public void testLowQualityPairRevertsToUnmatched() {
        MatchResult result = matcher.match(new double[][]{{0.29}});
        assertTrue(result.getMatches().isEmpty());
        assertEquals(Collections.singletonList(0), result.getUnmatchedDetections());
        assertEquals(Collections.singletonList(0), result.getUnmatchedTracks());
    }

    @Test
    public void testRectangularInputs() {
        double[][] iou = {
                {0.0, 0.7, 0.0},
        };
        MatchResult result = matcher.match(iou);
        assertEquals(1, result.getMatches().size());
        assertArrayEquals(new int[]{0, 1}, result.getMatches().get(0));
        assertEquals(Arrays.asList(0, 2), result.getUnmatchedTracks());
    }

    @Test
    public void testNoTracksMeansAllDetectionsUnmatched() {
        List<double[]> detections = Arrays.asList(new double[]{0, 0, 10, 10}, new double[]{20, 20, 30, 30});
        MatchResult result = matcher.match(detections, Collections.emptyList());

        assertTrue(result.getMatches().isEmpty());
        assertEquals(Arrays.asList(0, 1), result.getUnmatchedDetections());
        assertTrue(result.getUnmatchedTracks().isEmpty());
    }

    @Test
    public void testNoDetectionsMeansAllTracksUnmatched() {
        List<double[]> tracks = Arrays.asList(new double[]{0, 0, 10, 10}, new double[]{20, 20, 30, 30});
        MatchResult result = matcher.match(Collections.emptyList(), tracks);

        assertTrue(result.getMatches().isEmpty());
        assertTrue(result.getUnmatchedDetections().isEmpty());
        assertEquals(Arrays.asList(0, 1), result.getUnmatchedTracks());
    }

    @Test
    public void testBuildIouMatrixFromBoxes() {
        List<double[]> detections = Arrays.asList(new double[]{0, 0, 10, 10}, new double[]{100, 100, 110, 110});
        List<double[]> tracks = Collections.singletonList(new double[]{0, 0, 10, 10});

        double[][] iou = IouMatcher.buildIouMatrix(detections, tracks);

        assertEquals(2, iou.length);
        assertEquals(1, iou[0].length);
        assertEquals(1.0, iou[0][0], 1e-9);
        assertEquals(0.0, iou[1][0], 1e-9);

        MatchResult result = matcher.match(detections, tracks);
        assertEquals(1, result.getMatches().size());
        assertEquals(Collections.singletonList(1), result.getUnmatchedDetections());
    }
}
