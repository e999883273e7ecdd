package com.example.tracking.tracker;

import com.example.tracking.util.BoxGeometry;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;

/**
 * 单个目标的卡尔曼跟踪器
 * <p>
 * 状态向量: x = [cx, cy, w, h, vcx, vcy, vw, vh]^T
 * <p>
 * 匀速模型，只观测 [cx, cy, w, h]，速度由滤波推断：
 * <pre>
 * x_{k+1} = F * x_k + w_k
 * z_k     = H * x_k + v_k
 * </pre>
 * 初始协方差对位置/尺寸较小、对速度很大：起始时"位置可信，运动未知"。
 */
public class KalmanBoxTrack {

    private static final int DIM_X = 8;
    private static final int DIM_Z = 4;

    /** w + h 塌缩为非正时钳制的宽度 */
    static final double MIN_WIDTH = 1.0;

    private static final RealMatrix F = transitionMatrix();
    private static final RealMatrix H = measurementMatrix();
    private static final RealMatrix Q = MatrixUtils.createRealDiagonalMatrix(
            new double[]{1, 1, 1, 1, 0.01, 0.01, 0.01, 0.01});
    private static final RealMatrix R = MatrixUtils.createRealIdentityMatrix(DIM_Z).scalarMultiply(10.0);
    private static final RealMatrix I = MatrixUtils.createRealIdentityMatrix(DIM_X);

    private final int id;

    private RealVector x;
    private RealMatrix P;

    private int age;
    private int hits;
    private int hitStreak;
    private int timeSinceUpdate;
    private double lastConfidence;
    private boolean deleted;

    /**
     * @param id         内部ID（从0开始）
     * @param bbox       初始检测框 [x1, y1, x2, y2]
     * @param confidence 初始检测置信度
     */
    public KalmanBoxTrack(int id, double[] bbox, double confidence) {
        this.id = id;
        this.x = new ArrayRealVector(DIM_X);
        this.x.setSubVector(0, new ArrayRealVector(BoxGeometry.toCenterForm(bbox), false));
        this.P = MatrixUtils.createRealDiagonalMatrix(
                new double[]{1, 1, 1, 1, 1000, 1000, 1000, 1000});
        this.lastConfidence = confidence;
    }

    /**
     * 预测下一帧状态，返回预测框
     */
    public double[] predict() {
        if (x.getEntry(2) + x.getEntry(3) <= 0) {
            x.setEntry(2, MIN_WIDTH);
        }

        x = F.operate(x);
        P = F.multiply(P).multiply(F.transpose()).add(Q);
        age++;

        if (timeSinceUpdate > 0) {
            hitStreak = 0;
        }
        timeSinceUpdate++;

        return currentBox();
    }

    /**
     * 用匹配到的检测框校正状态
     *
     * @throws TrackDivergedException 新息协方差奇异或校正后状态非有限
     */
    public void observe(double[] bbox, double confidence) {
        RealVector z = new ArrayRealVector(BoxGeometry.toCenterForm(bbox), false);

        RealMatrix S = H.multiply(P).multiply(H.transpose()).add(R);
        RealMatrix sInverse;
        try {
            sInverse = new LUDecomposition(S).getSolver().getInverse();
        } catch (SingularMatrixException e) {
            throw new TrackDivergedException(id, "新息协方差矩阵奇异", e);
        }
        RealMatrix K = P.multiply(H.transpose()).multiply(sInverse);

        RealVector residual = z.subtract(H.operate(x));
        RealVector corrected = x.add(K.operate(residual));
        if (corrected.isNaN() || corrected.isInfinite()) {
            throw new TrackDivergedException(id, "校正后状态出现非有限值");
        }

        x = corrected;
        P = I.subtract(K.multiply(H)).multiply(P);

        timeSinceUpdate = 0;
        hits++;
        hitStreak++;
        lastConfidence = confidence;
    }

    /**
     * 当前估计框 [x1, y1, x2, y2]，不修改状态
     */
    public double[] currentBox() {
        return BoxGeometry.toCornerForm(x.getEntry(0), x.getEntry(1), x.getEntry(2), x.getEntry(3));
    }

    /**
     * 速度分量 [vcx, vcy, vw, vh]
     */
    public double[] velocity() {
        return x.getSubVector(4, 4).toArray();
    }

    public boolean isConfirmed(int minHits) {
        return hitStreak >= minHits;
    }

    public TrackState state(int minHits) {
        if (deleted) return TrackState.DELETED;
        return isConfirmed(minHits) ? TrackState.CONFIRMED : TrackState.TENTATIVE;
    }

    /**
     * 标记为已删除，删除后不会恢复
     */
    void markDeleted() {
        deleted = true;
    }

    public int getId() { return id; }

    public int getAge() { return age; }

    public int getHits() { return hits; }

    public int getHitStreak() { return hitStreak; }

    public int getTimeSinceUpdate() { return timeSinceUpdate; }

    public double getLastConfidence() { return lastConfidence; }

    private static RealMatrix transitionMatrix() {
        RealMatrix f = MatrixUtils.createRealIdentityMatrix(DIM_X);
        for (int i = 0; i < DIM_Z; i++) {
            f.setEntry(i, i + DIM_Z, 1);
        }
        return f;
    }

    private static RealMatrix measurementMatrix() {
        RealMatrix h = MatrixUtils.createRealMatrix(DIM_Z, DIM_X);
        for (int i = 0; i < DIM_Z; i++) {
            h.setEntry(i, i, 1);
        }
        return h;
    }
}
