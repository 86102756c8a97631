package com.ngramengine.index;

import com.ngramengine.query.QueryEngine;
import com.ngramengine.query.SearchHit;
import com.ngramengine.query.SearchResult;
import com.ngramengine.storage.IndexData;
import com.ngramengine.vector.SparseVector;

import java.io.Serializable;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * 不可变的 n-gram 索引，独占词典与倒排存储，可在线程间无锁共享。
 *
 * @param <I> 条目ID类型
 */
public final class NgramIndex<I extends Comparable<? super I> & Serializable> {
    private final IndexData<I> data;
    private final QueryEngine<I> queryEngine;

    NgramIndex(IndexData<I> data) {
        this.data = data;
        this.queryEngine = new QueryEngine<>(data);
    }

    /**
     * 由已加载的索引状态恢复索引。
     */
    public static <I extends Comparable<? super I> & Serializable> NgramIndex<I> fromData(IndexData<I> data) {
        if (data == null) {
            throw new IllegalArgumentException("data 不能为null");
        }
        return new NgramIndex<>(data);
    }

    public Optional<SparseVector> makeQueryVector(String query) {
        return queryEngine.makeQueryVector(query);
    }

    public Stream<SearchHit<I>> find(SparseVector query) {
        return queryEngine.find(query);
    }

    public Stream<SearchHit<I>> findFast(SparseVector query, int tfThreshold) {
        return queryEngine.findFast(query, tfThreshold);
    }

    public Stream<SearchHit<I>> findWeighted(SparseVector query, double w) {
        return queryEngine.findWeighted(query, w);
    }

    public Stream<SearchHit<I>> findWeightedFast(SparseVector query, double w, int tfThreshold) {
        return queryEngine.findWeightedFast(query, w, tfThreshold);
    }

    public SearchResult<I> search(String query, int limit) {
        return queryEngine.search(query, limit);
    }

    public SearchResult<I> search(String query, int limit, double w, int tfThreshold) {
        return queryEngine.search(query, limit, w, tfThreshold);
    }

    public boolean isEmpty() {
        return data.postingStore().size() == 0;
    }

    /**
     * 已索引的向量数量（重复ID各自计数）。
     */
    public int size() {
        return data.postingStore().size();
    }

    public int gramLength() {
        return data.gramLength();
    }

    public int dimensionCount() {
        return data.dictionary().size();
    }

    IndexData<I> data() {
        return data;
    }
}
