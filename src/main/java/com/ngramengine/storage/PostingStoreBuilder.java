package com.ngramengine.storage;

import com.ngramengine.vector.SparseVector;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 构建期倒排存储，按插入顺序为每个向量分配槽位，并在其命中的每个维度下追加倒排项。
 *
 * @param <I> 条目ID类型
 */
public final class PostingStoreBuilder<I> {
    private final List<StoredVector<I>> vectors = new ArrayList<>();
    private final List<GrowablePostings> postingsByDimension = new ArrayList<>();

    /**
     * 追加一个向量，返回其槽位。相同ID重复追加时各自独立保存。
     */
    public int add(I itemId, SparseVector vector) {
        int slot = vectors.size();
        vectors.add(new StoredVector<>(itemId, vector));
        for (int index = 0; index < vector.dimensionCount(); index++) {
            postingsFor(vector.dimension(index)).append(slot, vector.count(index));
        }
        return slot;
    }

    public int size() {
        return vectors.size();
    }

    /**
     * 冻结为不可变倒排存储。
     *
     * @param dimensionCount 词典维度数量，未出现倒排的维度得到空列表
     */
    public PostingStore<I> build(int dimensionCount) {
        if (dimensionCount < postingsByDimension.size()) {
            throw new IllegalArgumentException("维度数量小于倒排列表数量: " + dimensionCount + " < " + postingsByDimension.size());
        }
        PostingList[] postings = new PostingList[dimensionCount];
        for (int dimension = 0; dimension < dimensionCount; dimension++) {
            postings[dimension] = dimension < postingsByDimension.size()
                ? postingsByDimension.get(dimension).toPostingList()
                : PostingList.empty();
        }
        return new PostingStore<>(vectors, postings);
    }

    private GrowablePostings postingsFor(int dimension) {
        while (postingsByDimension.size() <= dimension) {
            postingsByDimension.add(new GrowablePostings());
        }
        return postingsByDimension.get(dimension);
    }

    private static final class GrowablePostings {
        private int[] slots = new int[4];
        private int[] termFreqs = new int[4];
        private int size;

        void append(int slot, int termFreq) {
            if (size == slots.length) {
                slots = Arrays.copyOf(slots, size * 2);
                termFreqs = Arrays.copyOf(termFreqs, size * 2);
            }
            slots[size] = slot;
            termFreqs[size] = termFreq;
            size++;
        }

        PostingList toPostingList() {
            return new PostingList(Arrays.copyOf(slots, size), Arrays.copyOf(termFreqs, size));
        }
    }
}
