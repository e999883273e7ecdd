package com.example.tracking.tracker;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * 检测-跟踪匹配结果，三个集合互不相交
 */
@Getter
public class MatchResult {

    /** 匹配对 [检测下标, 跟踪下标]，按检测下标升序 */
    private final List<int[]> matches;

    /** 未匹配的检测下标（升序） */
    private final List<Integer> unmatchedDetections;

    /** 未匹配的跟踪下标（升序） */
    private final List<Integer> unmatchedTracks;

    public MatchResult(List<int[]> matches, List<Integer> unmatchedDetections, List<Integer> unmatchedTracks) {
        this.matches = Collections.unmodifiableList(matches);
        this.unmatchedDetections = Collections.unmodifiableList(unmatchedDetections);
        this.unmatchedTracks = Collections.unmodifiableList(unmatchedTracks);
    }
}
