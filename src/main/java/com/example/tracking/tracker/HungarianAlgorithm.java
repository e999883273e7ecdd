package com.example.tracking.tracker;

import java.util.Arrays;

/**
 * 匈牙利算法（Kuhn-Munkres，带行/列势能）
 * <p>
 * 求解矩形代价矩阵的最小代价一对一分配，复杂度 O(n^2 * m)。
 * 结果确定：相同输入总是得到相同分配。
 */
public final class HungarianAlgorithm {

    private HungarianAlgorithm() {
    }

    /**
     * @param cost 代价矩阵 [rows][cols]，所有元素必须为有限值
     * @return 每行分配到的列下标，未分配的行为 -1
     */
    public static int[] solve(double[][] cost) {
        int rows = cost.length;
        if (rows == 0) {
            return new int[0];
        }
        int cols = cost[0].length;
        for (double[] row : cost) {
            if (row.length != cols) {
                throw new IllegalArgumentException("代价矩阵不是矩形");
            }
            for (double value : row) {
                if (!Double.isFinite(value)) {
                    throw new IllegalArgumentException("代价矩阵包含非有限值: " + value);
                }
            }
        }

        int[] result = new int[rows];
        Arrays.fill(result, -1);
        if (cols == 0) {
            return result;
        }

        if (rows <= cols) {
            int[] rowToCol = solveRowsNotMoreThanCols(cost, rows, cols);
            System.arraycopy(rowToCol, 0, result, 0, rows);
            return result;
        }

        // 行多于列：转置后求解，再反向映射
        double[][] transposed = new double[cols][rows];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                transposed[j][i] = cost[i][j];
            }
        }
        int[] colToRow = solveRowsNotMoreThanCols(transposed, cols, rows);
        for (int j = 0; j < cols; j++) {
            if (colToRow[j] >= 0) {
                result[colToRow[j]] = j;
            }
        }
        return result;
    }

    /**
     * 要求 n <= m，每一行都会被分配。下标从1开始，0号列为虚拟列。
     */
    private static int[] solveRowsNotMoreThanCols(double[][] a, int n, int m) {
        double[] u = new double[n + 1];
        double[] v = new double[m + 1];
        int[] p = new int[m + 1];
        int[] way = new int[m + 1];

        for (int i = 1; i <= n; i++) {
            p[0] = i;
            int j0 = 0;
            double[] minv = new double[m + 1];
            Arrays.fill(minv, Double.POSITIVE_INFINITY);
            boolean[] used = new boolean[m + 1];

            do {
                used[j0] = true;
                int i0 = p[j0];
                double delta = Double.POSITIVE_INFINITY;
                int j1 = 0;
                for (int j = 1; j <= m; j++) {
                    if (!used[j]) {
                        double cur = a[i0 - 1][j - 1] - u[i0] - v[j];
                        if (cur < minv[j]) {
                            minv[j] = cur;
                            way[j] = j0;
                        }
                        if (minv[j] < delta) {
                            delta = minv[j];
                            j1 = j;
                        }
                    }
                }
                for (int j = 0; j <= m; j++) {
                    if (used[j]) {
                        u[p[j]] += delta;
                        v[j] -= delta;
                    } else {
                        minv[j] -= delta;
                    }
                }
                j0 = j1;
            } while (p[j0] != 0);

            do {
                int j1 = way[j0];
                p[j0] = p[j1];
                j0 = j1;
            } while (j0 != 0);
        }

        int[] rowToCol = new int[n];
        Arrays.fill(rowToCol, -1);
        for (int j = 1; j <= m; j++) {
            if (p[j] != 0) {
                rowToCol[p[j] - 1] = j - 1;
            }
        }
        return rowToCol;
    }
}
