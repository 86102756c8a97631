package com.ngramengine.vector;

import java.util.Arrays;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 稀疏向量，记录维度ID到出现次数的映射。
 *
 * @param dimensions 严格递增的维度ID数组
 * @param counts 与dimensions同长度的出现次数数组
 */
public record SparseVector(int[] dimensions, int[] counts) {
    private static final SparseVector EMPTY = new SparseVector(new int[0], new int[0]);

    /**
     * 构造时执行防御性校验并复制输入数据，避免外部修改。
     */
    public SparseVector {
        if (dimensions == null || counts == null) {
            throw new IllegalArgumentException("dimensions与counts不能为null");
        }
        if (dimensions.length != counts.length) {
            throw new IllegalArgumentException("dimensions与counts长度不一致: " + dimensions.length + " vs " + counts.length);
        }
        for (int index = 0; index < dimensions.length; index++) {
            if (dimensions[index] < 0) {
                throw new IllegalArgumentException("维度不能为负数，位置=" + index + ", value=" + dimensions[index]);
            }
            if (counts[index] <= 0) {
                throw new IllegalArgumentException("出现次数必须为正数，位置=" + index + ", value=" + counts[index]);
            }
            if (index > 0 && dimensions[index] <= dimensions[index - 1]) {
                throw new IllegalArgumentException("dimensions必须严格递增，位置=" + index + ", current=" + dimensions[index]);
            }
        }
        dimensions = Arrays.copyOf(dimensions, dimensions.length);
        counts = Arrays.copyOf(counts, counts.length);
    }

    public static SparseVector empty() {
        return EMPTY;
    }

    /**
     * 由维度计数映射构造向量，值为0的维度被忽略。
     *
     * @param countsByDimension 维度到次数的映射
     * @return 稀疏向量
     */
    public static SparseVector of(Map<Integer, Integer> countsByDimension) {
        SortedMap<Integer, Integer> sorted = new TreeMap<>(countsByDimension);
        sorted.values().removeIf(count -> count == 0);
        int[] dimensions = new int[sorted.size()];
        int[] counts = new int[sorted.size()];
        int index = 0;
        for (Map.Entry<Integer, Integer> entry : sorted.entrySet()) {
            dimensions[index] = entry.getKey();
            counts[index] = entry.getValue();
            index++;
        }
        return new SparseVector(dimensions, counts);
    }

    /**
     * 非零维度数量，Dice 计算只关心这一集合大小，不考虑次数。
     */
    public int dimensionCount() {
        return dimensions.length;
    }

    public boolean isEmpty() {
        return dimensions.length == 0;
    }

    public int dimension(int index) {
        return dimensions[index];
    }

    public int count(int index) {
        return counts[index];
    }

    /**
     * 查询指定维度的出现次数，未出现返回0。
     */
    public int countOf(int dimension) {
        int position = Arrays.binarySearch(dimensions, dimension);
        return position >= 0 ? counts[position] : 0;
    }

    /**
     * 统计与另一向量共有的维度数量。
     *
     * @param other 另一向量
     * @return 交集大小
     */
    public int overlapCount(SparseVector other) {
        int left = 0;
        int right = 0;
        int overlap = 0;
        while (left < dimensions.length && right < other.dimensions.length) {
            int leftDimension = dimensions[left];
            int rightDimension = other.dimensions[right];
            if (leftDimension == rightDimension) {
                overlap++;
                left++;
                right++;
            } else if (leftDimension < rightDimension) {
                left++;
            } else {
                right++;
            }
        }
        return overlap;
    }

    @Override
    public int[] dimensions() {
        return Arrays.copyOf(dimensions, dimensions.length);
    }

    @Override
    public int[] counts() {
        return Arrays.copyOf(counts, counts.length);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SparseVector that)) {
            return false;
        }
        return Arrays.equals(dimensions, that.dimensions) && Arrays.equals(counts, that.counts);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(dimensions) + Arrays.hashCode(counts);
    }

    @Override
    public String toString() {
        return "SparseVector{dimensions=" + Arrays.toString(dimensions) + ", counts=" + Arrays.toString(counts) + "}";
    }
}
