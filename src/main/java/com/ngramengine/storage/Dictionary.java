package com.ngramengine.storage;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * 冻结后的 n-gram 词典，维护 gram 到维度ID的映射及每个维度的文档频率。
 *
 * <p>构造后不再修改，可被多个线程无锁共享。
 */
public final class Dictionary {
    private final Map<String, Integer> dimensionsByGram;
    private final String[] grams;
    private final int[] docFrequencies;

    /**
     * 由按维度ID排列的 gram 与文档频率构造词典。
     *
     * @param grams 下标即维度ID
     * @param docFrequencies 与grams同长度的文档频率
     */
    public Dictionary(String[] grams, int[] docFrequencies) {
        if (grams == null || docFrequencies == null) {
            throw new IllegalArgumentException("grams与docFrequencies不能为null");
        }
        if (grams.length != docFrequencies.length) {
            throw new IllegalArgumentException("grams与docFrequencies长度不一致: " + grams.length + " vs " + docFrequencies.length);
        }
        Map<String, Integer> index = new HashMap<>(grams.length * 2);
        for (int dimension = 0; dimension < grams.length; dimension++) {
            String gram = grams[dimension];
            if (gram == null || gram.isEmpty()) {
                throw new IllegalArgumentException("gram 不能为空，维度=" + dimension);
            }
            if (docFrequencies[dimension] < 0) {
                throw new IllegalArgumentException("docFrequency不能为负数，维度=" + dimension + ", value=" + docFrequencies[dimension]);
            }
            if (index.put(gram, dimension) != null) {
                throw new IllegalArgumentException("gram 重复: " + gram);
            }
        }
        this.dimensionsByGram = Collections.unmodifiableMap(index);
        this.grams = Arrays.copyOf(grams, grams.length);
        this.docFrequencies = Arrays.copyOf(docFrequencies, docFrequencies.length);
    }

    public static Dictionary empty() {
        return new Dictionary(new String[0], new int[0]);
    }

    /**
     * 精确查找 gram 对应的维度ID。
     *
     * @param gram n-gram
     * @return 维度ID，未收录时为空
     */
    public OptionalInt lookup(String gram) {
        Integer dimension = dimensionsByGram.get(gram);
        return dimension == null ? OptionalInt.empty() : OptionalInt.of(dimension);
    }

    /**
     * 返回维度的文档频率。
     *
     * @param dimension 维度ID
     * @return 包含该维度的插入次数
     * @throws IndexOutOfBoundsException 维度不存在时抛出
     */
    public int docFrequency(int dimension) {
        return docFrequencies[dimension];
    }

    public String gram(int dimension) {
        return grams[dimension];
    }

    public boolean contains(int dimension) {
        return dimension >= 0 && dimension < grams.length;
    }

    /**
     * 获取维度数量。
     */
    public int size() {
        return grams.length;
    }
}
