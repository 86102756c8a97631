package com.ngramengine.storage;

import java.util.BitSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 不可变倒排存储：每个维度一条倒排列表，槽位指向完整保存的向量。
 *
 * @param <I> 条目ID类型
 */
public final class PostingStore<I> {
    private final List<StoredVector<I>> vectors;
    private final PostingList[] postings;

    public PostingStore(List<StoredVector<I>> vectors, PostingList[] postings) {
        if (vectors == null || postings == null) {
            throw new IllegalArgumentException("vectors与postings不能为null");
        }
        for (int dimension = 0; dimension < postings.length; dimension++) {
            PostingList postingList = postings[dimension];
            if (postingList == null) {
                throw new IllegalArgumentException("倒排列表不能为null，维度=" + dimension);
            }
            if (postingList.size() > 0 && postingList.slot(postingList.size() - 1) >= vectors.size()) {
                throw new IllegalArgumentException("倒排槽位越界，维度=" + dimension);
            }
        }
        this.vectors = List.copyOf(vectors);
        this.postings = postings.clone();
    }

    public static <I> PostingStore<I> empty() {
        return new PostingStore<>(List.of(), new PostingList[0]);
    }

    /**
     * 返回维度的倒排列表。
     */
    public PostingList postings(int dimension) {
        return postings[dimension];
    }

    /**
     * 按槽位取回保存的向量。
     */
    public StoredVector<I> vector(int slot) {
        return vectors.get(slot);
    }

    /**
     * 保存的向量数量。
     */
    public int size() {
        return vectors.size();
    }

    public int dimensionCount() {
        return postings.length;
    }

    /**
     * 惰性返回命中任一给定维度的所有向量（并集，每个槽位只出现一次），按倒排遍历顺序。
     *
     * @param dimensions 维度ID
     * @return 候选向量流
     */
    public Stream<StoredVector<I>> candidates(int[] dimensions) {
        Iterator<StoredVector<I>> iterator = new CandidateIterator(dimensions.clone());
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    private final class CandidateIterator implements Iterator<StoredVector<I>> {
        private final int[] dimensions;
        private final BitSet seenSlots = new BitSet();
        private int dimensionCursor;
        private int postingCursor;
        private int nextSlot = -1;

        private CandidateIterator(int[] dimensions) {
            this.dimensions = dimensions;
        }

        @Override
        public boolean hasNext() {
            while (nextSlot < 0 && dimensionCursor < dimensions.length) {
                PostingList postingList = postings[dimensions[dimensionCursor]];
                if (postingCursor >= postingList.size()) {
                    dimensionCursor++;
                    postingCursor = 0;
                    continue;
                }
                int slot = postingList.slot(postingCursor++);
                if (!seenSlots.get(slot)) {
                    seenSlots.set(slot);
                    nextSlot = slot;
                }
            }
            return nextSlot >= 0;
        }

        @Override
        public StoredVector<I> next() {
            if (!hasNext()) {
                throw new NoSuchElementException("候选向量已耗尽");
            }
            StoredVector<I> candidate = vectors.get(nextSlot);
            nextSlot = -1;
            return candidate;
        }
    }
}
