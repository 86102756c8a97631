package com.ngramengine.query;

/**
 * 单条命中：条目ID与 Dice 相似度。
 */
public record SearchHit<I>(
        I itemId,
        double score
) {
}
