package com.example.tracking.util;

/**
 * 边界框几何工具
 * 角点格式 [x1, y1, x2, y2]，中心格式 [cx, cy, w, h]
 */
public final class BoxGeometry {

    private BoxGeometry() {
    }

    /**
     * 计算两个边界框的IoU（交并比），结果在 [0, 1] 之间
     */
    public static double iou(double[] bbox1, double[] bbox2) {
        if (bbox1 == null || bbox2 == null) return 0.0;

        double x1 = Math.max(bbox1[0], bbox2[0]);
        double y1 = Math.max(bbox1[1], bbox2[1]);
        double x2 = Math.min(bbox1[2], bbox2[2]);
        double y2 = Math.min(bbox1[3], bbox2[3]);

        if (x2 <= x1 || y2 <= y1) return 0.0;

        double intersection = (x2 - x1) * (y2 - y1);
        double union = area(bbox1) + area(bbox2) - intersection;

        if (!(union > 0)) return 0.0;

        double iou = intersection / union;
        return Math.max(0.0, Math.min(1.0, iou));
    }

    /**
     * 面积，宽或高为负时按0处理
     */
    public static double area(double[] bbox) {
        return Math.max(0.0, bbox[2] - bbox[0]) * Math.max(0.0, bbox[3] - bbox[1]);
    }

    /**
     * [x1, y1, x2, y2] -> [cx, cy, w, h]
     */
    public static double[] toCenterForm(double[] bbox) {
        double w = bbox[2] - bbox[0];
        double h = bbox[3] - bbox[1];
        return new double[]{bbox[0] + w / 2.0, bbox[1] + h / 2.0, w, h};
    }

    /**
     * [cx, cy, w, h] -> [x1, y1, x2, y2]
     */
    public static double[] toCornerForm(double cx, double cy, double w, double h) {
        return new double[]{cx - w / 2.0, cy - h / 2.0, cx + w / 2.0, cy + h / 2.0};
    }

    /**
     * 四个坐标均为有限值
     */
    public static boolean isFinite(double[] bbox) {
        if (bbox == null || bbox.length < 4) return false;
        for (int i = 0; i < 4; i++) {
            if (!Double.isFinite(bbox[i])) return false;
        }
        return true;
    }

    /**
     * 有限值且未反向（x2 >= x1、y2 >= y1），零宽/零高框视为合法
     */
    public static boolean isWellFormed(double[] bbox) {
        return isFinite(bbox) && bbox[2] >= bbox[0] && bbox[3] >= bbox[1];
    }

    /**
     * 截断为整数像素坐标
     */
    public static int[] toPixels(double[] bbox) {
        return new int[]{(int) bbox[0], (int) bbox[1], (int) bbox[2], (int) bbox[3]};
    }
}
