package com.ngramengine.scoring;

import com.ngramengine.vector.SparseVector;

/**
 * Dice 系数评分器，只比较两个向量的非零维度集合，不考虑出现次数。
 */
public final class DiceScorer {

    private DiceScorer() {
        // 工具类，禁止实例化
    }

    /**
     * 2·|a∩b| / (|a| + |b|)，两个空向量返回 0.0。
     */
    public static double dice(SparseVector a, SparseVector b) {
        double denominator = (double) a.dimensionCount() + b.dimensionCount();
        if (denominator == 0) {
            return 0.0;
        }
        return 2.0 * a.overlapCount(b) / denominator;
    }

    /**
     * 按权重分配两个向量长度的 Dice 系数。
     * w = 1.0 只使用 a 的长度；w = 0.5 与 {@link #dice} 相同；w = 0.0 只使用 b 的长度。
     *
     * @param a 通常为查询向量
     * @param b 候选向量
     * @param w 权重，取值 [0, 1]
     * @return 相似度，分母为0时返回 0.0
     */
    public static double diceWeighted(SparseVector a, SparseVector b, double w) {
        if (Double.isNaN(w) || w < 0.0 || w > 1.0) {
            throw new IllegalArgumentException("权重必须位于 [0, 1]: " + w);
        }
        double aMultiplier = w * 2.0;
        double bMultiplier = (1.0 - w) * 2.0;
        double denominator = a.dimensionCount() * aMultiplier + b.dimensionCount() * bMultiplier;
        if (denominator == 0) {
            return 0.0;
        }
        return 2.0 * a.overlapCount(b) / denominator;
    }
}
