package com.example.tracking.tracker;

import com.example.tracking.util.BoxGeometry;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 基于IoU的最优一对一匹配
 * <p>
 * 以 1 - IoU 为代价求最小总代价分配（即最大总IoU），
 * 再剔除 IoU 低于阈值的匹配对，两端都退回未匹配。
 */
@Slf4j
public class IouMatcher {

    private final double iouThreshold;

    public IouMatcher(double iouThreshold) {
        this.iouThreshold = iouThreshold;
    }

    /**
     * 构建 D×T 的IoU矩阵，(d, t) = iou(检测d, 跟踪t)
     */
    public static double[][] buildIouMatrix(List<double[]> detectionBoxes, List<double[]> trackBoxes) {
        double[][] iouMatrix = new double[detectionBoxes.size()][trackBoxes.size()];
        for (int d = 0; d < detectionBoxes.size(); d++) {
            for (int t = 0; t < trackBoxes.size(); t++) {
                iouMatrix[d][t] = BoxGeometry.iou(detectionBoxes.get(d), trackBoxes.get(t));
            }
        }
        return iouMatrix;
    }

    public MatchResult match(List<double[]> detectionBoxes, List<double[]> trackBoxes) {
        return match(buildIouMatrix(detectionBoxes, trackBoxes), detectionBoxes.size(), trackBoxes.size());
    }

    public MatchResult match(double[][] iouMatrix) {
        int tracks = iouMatrix.length > 0 ? iouMatrix[0].length : 0;
        return match(iouMatrix, iouMatrix.length, tracks);
    }

    private MatchResult match(double[][] iouMatrix, int detections, int tracks) {
        List<int[]> matches = new ArrayList<>();
        boolean[] detectionMatched = new boolean[detections];
        boolean[] trackMatched = new boolean[tracks];

        if (detections > 0 && tracks > 0) {
            int[] assignment = assign(iouMatrix);
            for (int d = 0; d < assignment.length; d++) {
                int t = assignment[d];
                if (t < 0) continue;
                if (iouMatrix[d][t] >= iouThreshold) {
                    matches.add(new int[]{d, t});
                    detectionMatched[d] = true;
                    trackMatched[t] = true;
                }
            }
        }

        List<Integer> unmatchedDetections = new ArrayList<>();
        for (int d = 0; d < detections; d++) {
            if (!detectionMatched[d]) unmatchedDetections.add(d);
        }
        List<Integer> unmatchedTracks = new ArrayList<>();
        for (int t = 0; t < tracks; t++) {
            if (!trackMatched[t]) unmatchedTracks.add(t);
        }

        return new MatchResult(matches, unmatchedDetections, unmatchedTracks);
    }

    /**
     * 求解失败时视为没有任何匹配
     */
    private int[] assign(double[][] iouMatrix) {
        double[][] cost = new double[iouMatrix.length][];
        for (int d = 0; d < iouMatrix.length; d++) {
            cost[d] = new double[iouMatrix[d].length];
            for (int t = 0; t < iouMatrix[d].length; t++) {
                cost[d][t] = 1.0 - iouMatrix[d][t];
            }
        }

        try {
            return HungarianAlgorithm.solve(cost);
        } catch (RuntimeException e) {
            log.warn("分配求解失败，本帧按无匹配处理: {}", e.getMessage());
            int[] none = new int[iouMatrix.length];
            Arrays.fill(none, -1);
            return none;
        }
    }
}
