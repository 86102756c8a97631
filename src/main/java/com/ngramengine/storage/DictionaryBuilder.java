package com.ngramengine.storage;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 构建期词典，首次见到 gram 时分配递增维度ID，ID 一经分配永不改变。
 */
public final class DictionaryBuilder {
    private final Map<String, Integer> dimensionsByGram = new HashMap<>();
    private final List<String> grams = new ArrayList<>();
    private int[] docFrequencies = new int[16];

    /**
     * 查找或注册 gram 对应的维度ID。
     */
    public int resolveOrCreate(String gram) {
        if (gram == null || gram.isEmpty()) {
            throw new IllegalArgumentException("gram 不能为空");
        }
        Integer existing = dimensionsByGram.get(gram);
        if (existing != null) {
            return existing;
        }
        int dimension = grams.size();
        grams.add(gram);
        dimensionsByGram.put(gram, dimension);
        if (dimension == docFrequencies.length) {
            docFrequencies = Arrays.copyOf(docFrequencies, docFrequencies.length * 2);
        }
        return dimension;
    }

    /**
     * 维度的文档频率加一，每次插入对每个命中维度只调用一次。
     */
    public void incrementDocFrequency(int dimension) {
        if (dimension < 0 || dimension >= grams.size()) {
            throw new IllegalArgumentException("维度未注册: " + dimension);
        }
        docFrequencies[dimension]++;
    }

    public int docFrequency(int dimension) {
        if (dimension < 0 || dimension >= grams.size()) {
            throw new IllegalArgumentException("维度未注册: " + dimension);
        }
        return docFrequencies[dimension];
    }

    public int size() {
        return grams.size();
    }

    /**
     * 冻结为不可变词典。
     */
    public Dictionary build() {
        return new Dictionary(grams.toArray(new String[0]), Arrays.copyOf(docFrequencies, grams.size()));
    }
}
