package com.ngramengine.index;

import com.ngramengine.storage.DictionaryBuilder;
import com.ngramengine.storage.IndexData;
import com.ngramengine.storage.PostingStoreBuilder;
import com.ngramengine.text.NgramSplitter;
import com.ngramengine.vector.SparseVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;

/**
 * 单写者构建器：逐条插入词项，最后冻结为不可变的 {@link NgramIndex}。
 *
 * <p>build() 之后构建器失效，继续插入或再次 build 会抛出 {@link IllegalStateException}。
 * 非线程安全。
 *
 * @param <I> 条目ID类型
 */
public final class NgramIndexBuilder<I extends Comparable<? super I> & Serializable> {
    private static final Logger logger = LoggerFactory.getLogger(NgramIndexBuilder.class);

    private final int gramLength;
    private DictionaryBuilder dictionary = new DictionaryBuilder();
    private PostingStoreBuilder<I> postingStore = new PostingStoreBuilder<>();

    /**
     * @param gramLength n-gram 长度，必须大于等于1
     */
    public NgramIndexBuilder(int gramLength) {
        if (gramLength < 1) {
            throw new IllegalArgumentException("gramLength 必须大于等于1: " + gramLength);
        }
        this.gramLength = gramLength;
    }

    /**
     * 插入一个词项。码点长度小于 n 的词项被拒绝且不修改任何状态。
     * 相同ID重复插入不会合并，每次插入都保存一份独立向量。
     *
     * @param term 词项
     * @param itemId 调用方给出的条目ID
     * @return 是否插入
     */
    public boolean insert(String term, I itemId) {
        ensureNotBuilt();
        if (term == null || itemId == null) {
            throw new IllegalArgumentException("term与itemId不能为null");
        }
        if (NgramSplitter.codePointLength(term) < gramLength) {
            return false;
        }

        Map<Integer, Integer> counts = new HashMap<>();
        for (String gram : splitTerm(term)) {
            counts.merge(dictionary.resolveOrCreate(gram), 1, Integer::sum);
        }
        SparseVector vector = SparseVector.of(counts);
        for (int dimension : vector.dimensions()) {
            dictionary.incrementDocFrequency(dimension);
        }
        postingStore.add(itemId, vector);
        return true;
    }

    /**
     * 返回词项填充后的 n-gram 序列，与插入时的切分一致。
     */
    public Iterable<String> splitTerm(String term) {
        return NgramSplitter.paddedGrams(term, gramLength);
    }

    public int gramLength() {
        return gramLength;
    }

    /**
     * 已插入的向量数量。
     */
    public int size() {
        ensureNotBuilt();
        return postingStore.size();
    }

    /**
     * 冻结构建状态并生成索引，构建器随之失效。
     */
    public NgramIndex<I> build() {
        ensureNotBuilt();
        int dimensionCount = dictionary.size();
        IndexData<I> data = new IndexData<>(gramLength, dictionary.build(), postingStore.build(dimensionCount));
        dictionary = null;
        postingStore = null;
        logger.debug("索引构建完成: n={}, items={}, dimensions={}",
            gramLength, data.postingStore().size(), dimensionCount);
        return new NgramIndex<>(data);
    }

    private void ensureNotBuilt() {
        if (dictionary == null) {
            throw new IllegalStateException("NgramIndexBuilder 已 build，不能继续使用");
        }
    }
}
