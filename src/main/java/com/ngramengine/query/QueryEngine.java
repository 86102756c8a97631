package com.ngramengine.query;

import com.ngramengine.config.Constants;
import com.ngramengine.scoring.DiceScorer;
import com.ngramengine.storage.Dictionary;
import com.ngramengine.storage.IndexData;
import com.ngramengine.storage.PostingStore;
import com.ngramengine.storage.StoredVector;
import com.ngramengine.text.NgramSplitter;
import com.ngramengine.vector.SparseVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.ToDoubleFunction;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * 基于 n-gram 倒排的模糊查询引擎。
 *
 * <p>只读取冻结后的词典与倒排存储，可被多个线程并发使用。
 *
 * @param <I> 条目ID类型
 */
public class QueryEngine<I extends Comparable<? super I>> {
    private static final Logger logger = LoggerFactory.getLogger(QueryEngine.class);

    private final int gramLength;
    private final Dictionary dictionary;
    private final PostingStore<I> postingStore;

    public QueryEngine(IndexData<I> data) {
        this.gramLength = data.gramLength();
        this.dictionary = data.dictionary();
        this.postingStore = data.postingStore();
    }

    /**
     * 按与插入相同的填充和切分方式构造查询向量，词典中不存在的 gram 被丢弃。
     *
     * @param query 查询字符串
     * @return 查询向量（可能为空向量）；query 为 null 时为空
     */
    public Optional<SparseVector> makeQueryVector(String query) {
        if (query == null) {
            return Optional.empty();
        }
        if (NgramSplitter.codePointLength(query) < gramLength) {
            return Optional.of(SparseVector.empty());
        }
        Map<Integer, Integer> counts = new LinkedHashMap<>();
        for (String gram : NgramSplitter.paddedGrams(query, gramLength)) {
            OptionalInt dimension = dictionary.lookup(gram);
            if (dimension.isPresent()) {
                counts.merge(dimension.getAsInt(), 1, Integer::sum);
            }
        }
        return Optional.of(SparseVector.of(counts));
    }

    /**
     * 返回与查询共享任一维度的所有条目及其 Dice 相似度，顺序不定。
     */
    public Stream<SearchHit<I>> find(SparseVector query) {
        return score(knownDimensions(query), vector -> DiceScorer.dice(query, vector));
    }

    /**
     * 同 {@link #find}，但只遍历文档频率严格小于阈值的查询维度。
     * 只能通过被剪掉维度命中的条目不会出现在结果中。
     */
    public Stream<SearchHit<I>> findFast(SparseVector query, int tfThreshold) {
        return score(selectiveDimensions(query, tfThreshold), vector -> DiceScorer.dice(query, vector));
    }

    /**
     * 加权 Dice 查询，使用默认阈值 {@link Constants#DEFAULT_TF_THRESHOLD} 限制倒排扇出。
     * w = 1.0 只使用查询长度；w = 0.5 两者同等；w = 0.0 只使用结果长度。
     */
    public Stream<SearchHit<I>> findWeighted(SparseVector query, double w) {
        return findWeightedFast(query, w, Constants.DEFAULT_TF_THRESHOLD);
    }

    public Stream<SearchHit<I>> findWeightedFast(SparseVector query, double w, int tfThreshold) {
        if (Double.isNaN(w) || w < 0.0 || w > 1.0) {
            throw new IllegalArgumentException("权重必须位于 [0, 1]: " + w);
        }
        return score(selectiveDimensions(query, tfThreshold), vector -> DiceScorer.diceWeighted(query, vector, w));
    }

    /**
     * 以普通 Dice 执行查询并按分数降序返回前 limit 条。
     */
    public SearchResult<I> search(String queryString, int limit) {
        return search(queryString, limit, Constants.BALANCED_WEIGHT, Integer.MAX_VALUE);
    }

    /**
     * 执行查询并排序：分数降序，分数相同时按条目ID升序。
     *
     * @param queryString 查询字符串
     * @param limit 返回条数上限
     * @param w 加权 Dice 的权重，0.5 等价于普通 Dice
     * @param tfThreshold 维度剪枝阈值，{@link Integer#MAX_VALUE} 表示不剪枝
     * @return 排序后的查询结果
     */
    public SearchResult<I> search(String queryString, int limit, double w, int tfThreshold) {
        long startNanos = System.nanoTime();
        SparseVector query = makeQueryVector(queryString).orElse(SparseVector.empty());
        List<SearchHit<I>> allHits = findWeightedFast(query, w, tfThreshold).toList();

        Comparator<SearchHit<I>> ranking = Comparator.<SearchHit<I>>comparingDouble(SearchHit::score).reversed()
            .thenComparing(SearchHit::itemId);
        List<SearchHit<I>> hits = allHits.stream()
            .sorted(ranking)
            .limit(Math.max(limit, 0))
            .toList();

        long elapsedMs = (System.nanoTime() - startNanos) / 1_000_000;
        logger.debug("查询完成: query={}, dimensions={}, candidates={}, elapsedMs={}",
            queryString, query.dimensionCount(), allHits.size(), elapsedMs);
        return new SearchResult<>(hits, allHits.size(), elapsedMs, queryString);
    }

    private Stream<SearchHit<I>> score(int[] dimensions, ToDoubleFunction<SparseVector> similarity) {
        return postingStore.candidates(dimensions)
            .map((StoredVector<I> candidate) ->
                new SearchHit<>(candidate.itemId(), similarity.applyAsDouble(candidate.vector())));
    }

    private int[] selectiveDimensions(SparseVector query, int tfThreshold) {
        return IntStream.of(query.dimensions())
            .filter(dimension -> docFrequencyOf(dimension) < tfThreshold)
            .toArray();
    }

    private int[] knownDimensions(SparseVector query) {
        int[] dimensions = query.dimensions();
        for (int dimension : dimensions) {
            docFrequencyOf(dimension);
        }
        return dimensions;
    }

    private int docFrequencyOf(int dimension) {
        if (!dictionary.contains(dimension)) {
            throw new IndexCorruptedException("查询维度在词典统计中不存在", dimension);
        }
        return dictionary.docFrequency(dimension);
    }
}
