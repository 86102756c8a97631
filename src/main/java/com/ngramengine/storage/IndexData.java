package com.ngramengine.storage;

/**
 * 索引文件承载的全部状态：gram 长度、词典与倒排存储。
 */
public record IndexData<I>(int gramLength, Dictionary dictionary, PostingStore<I> postingStore) {
    public IndexData {
        if (gramLength < 1) {
            throw new IllegalArgumentException("gramLength 必须大于等于1: " + gramLength);
        }
        if (dictionary == null || postingStore == null) {
            throw new IllegalArgumentException("dictionary与postingStore不能为null");
        }
        if (dictionary.size() != postingStore.dimensionCount()) {
            throw new IllegalArgumentException("词典维度数与倒排列表数不一致: "
                + dictionary.size() + " vs " + postingStore.dimensionCount());
        }
    }
}
