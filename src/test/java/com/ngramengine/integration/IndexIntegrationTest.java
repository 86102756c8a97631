package com.ngramengine.integration;

import com.ngramengine.index.IndexStore;
import com.ngramengine.index.NgramIndex;
import com.ngramengine.index.NgramIndexBuilder;
import com.ngramengine.query.SearchHit;
import com.ngramengine.query.SearchResult;
import com.ngramengine.storage.ItemIdCodec;
import com.ngramengine.text.NgramSplitter;
import com.ngramengine.vector.SparseVector;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 索引集成测试
 *
 * 覆盖完整流程：插入 → 构建 → 查询 → 持久化 → 重新加载后查询
 */
class IndexIntegrationTest {

    private static final List<String> VOCABULARY = List.of(
        "music", "muskel", "kindergarten", "preschool", "school", "highschool", "to skip school", "kind");

    @TempDir
    Path tempDir;

    private static NgramIndex<Long> buildVocabularyIndex(int gramLength) {
        NgramIndexBuilder<Long> builder = new NgramIndexBuilder<>(gramLength);
        for (int position = 0; position < VOCABULARY.size(); position++) {
            builder.insert(VOCABULARY.get(position), (long) position);
        }
        return builder.build();
    }

    @Test
    void testMisspelledQueryFindsSchoolFirst() {
        NgramIndex<Long> index = buildVocabularyIndex(3);

        SearchResult<Long> result = index.search("shol", VOCABULARY.size());

        assertFalse(result.hits().isEmpty());
        assertEquals("school", VOCABULARY.get(result.hits().get(0).itemId().intValue()));
        List<String> matched = result.hits().stream()
            .map(hit -> VOCABULARY.get(hit.itemId().intValue()))
            .toList();
        assertFalse(matched.contains("music"));
        assertFalse(matched.contains("kindergarten"));
    }

    @Test
    void testSizeTracksInsertions() {
        NgramIndexBuilder<Long> builder = new NgramIndexBuilder<>(3);
        assertEquals(0, builder.size());

        for (int position = 0; position < VOCABULARY.size(); position++) {
            builder.insert(VOCABULARY.get(position), (long) position);
            assertEquals(position + 1, builder.size());
        }

        NgramIndex<Long> index = builder.build();
        assertEquals(VOCABULARY.size(), index.size());
        assertFalse(index.isEmpty());
        assertEquals(3, index.gramLength());
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 4})
    void testInsertedTermIsItsOwnBestMatch(int gramLength) {
        NgramIndex<Long> index = buildVocabularyIndex(gramLength);

        for (int position = 0; position < VOCABULARY.size(); position++) {
            String term = VOCABULARY.get(position);
            SparseVector query = index.makeQueryVector(term).orElseThrow();
            long itemId = position;
            SearchHit<Long> self = index.find(query)
                .filter(hit -> hit.itemId() == itemId)
                .findFirst()
                .orElseThrow();
            assertEquals(1.0, self.score(), 1e-9, term);
        }
    }

    @Test
    void testFindFastWithUnboundedThresholdEqualsFind() {
        NgramIndex<Long> index = buildVocabularyIndex(3);

        for (String queryText : List.of("shol", "kinder", "musik", "skool")) {
            SparseVector query = index.makeQueryVector(queryText).orElseThrow();
            assertEquals(scores(index.find(query).toList()),
                scores(index.findFast(query, Integer.MAX_VALUE).toList()), queryText);
            assertEquals(scores(index.find(query).toList()),
                scores(index.findWeightedFast(query, 0.5, Integer.MAX_VALUE).toList()), queryText);
        }
    }

    @Test
    void testScoresStayInUnitInterval() {
        NgramIndex<Long> index = buildVocabularyIndex(2);
        SparseVector query = index.makeQueryVector("school kid").orElseThrow();

        for (double weight : new double[] {0.0, 0.25, 0.5, 0.75, 1.0}) {
            index.findWeightedFast(query, weight, Integer.MAX_VALUE).forEach(hit -> {
                assertTrue(hit.score() >= 0.0 && hit.score() <= 1.0, hit.toString());
            });
        }
    }

    @Test
    void testEmptyIndexReturnsNothing() {
        NgramIndex<Long> index = new NgramIndexBuilder<Long>(3).build();

        assertTrue(index.isEmpty());
        assertEquals(0, index.search("school", 10).totalMatches());
    }

    @Test
    void testQueryShorterThanGramLengthMatchesNothing() {
        NgramIndex<Long> index = buildVocabularyIndex(3);

        assertTrue(index.makeQueryVector("sc").orElseThrow().isEmpty());
        assertEquals(0, index.search("sc", 10).totalMatches());
    }

    @Test
    void testNonAsciiTermsSplitByCodePoint() {
        NgramIndexBuilder<String> builder = new NgramIndexBuilder<>(2);
        builder.insert("搜索引擎", "zh");
        builder.insert("😀😃😄", "emoji");
        NgramIndex<String> index = builder.build();

        assertEquals(5, NgramSplitter.stream(NgramSplitter.pad("搜索引擎", 1), 2).count());
        assertEquals("zh", index.search("搜索", 1).hits().get(0).itemId());
        assertEquals("emoji", index.search("😃😄", 1).hits().get(0).itemId());
    }

    @Test
    void testPersistedIndexAnswersIdentically() throws IOException {
        NgramIndex<Long> index = buildVocabularyIndex(3);
        Path indexDir = tempDir.resolve("index");

        IndexStore.save(index, indexDir, ItemIdCodec.LONG);
        NgramIndex<Long> reloaded = IndexStore.load(indexDir, ItemIdCodec.LONG);

        assertEquals(index.size(), reloaded.size());
        assertEquals(index.dimensionCount(), reloaded.dimensionCount());
        for (String queryText : List.of("shol", "kinder", "music", "to skip")) {
            SparseVector before = index.makeQueryVector(queryText).orElseThrow();
            SparseVector after = reloaded.makeQueryVector(queryText).orElseThrow();
            assertEquals(before, after);
            assertEquals(scores(index.find(before).toList()), scores(reloaded.find(after).toList()));
            assertEquals(scores(index.findFast(before, 2).toList()), scores(reloaded.findFast(after, 2).toList()));
            assertEquals(index.search(queryText, 5).hits(), reloaded.search(queryText, 5).hits());
        }
    }

    @Test
    void testConcurrentReaders() throws Exception {
        NgramIndex<Long> index = buildVocabularyIndex(3);
        List<SearchHit<Long>> expected = index.search("shol", 10).hits();

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<List<SearchHit<Long>>>> futures = new ArrayList<>();
            for (int attempt = 0; attempt < 32; attempt++) {
                futures.add(executor.submit(() -> index.search("shol", 10).hits()));
            }
            for (Future<List<SearchHit<Long>>> future : futures) {
                assertEquals(expected, future.get());
            }
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testLargeVocabularyPruning() {
        NgramIndexBuilder<Long> builder = new NgramIndexBuilder<>(3);
        IntStream.range(0, 2000).forEach(value -> builder.insert("term" + value, (long) value));
        NgramIndex<Long> index = builder.build();

        SparseVector query = index.makeQueryVector("term1234").orElseThrow();
        List<SearchHit<Long>> all = index.find(query).toList();
        List<SearchHit<Long>> pruned = index.findFast(query, 100).toList();

        assertTrue(pruned.size() < all.size());
        SearchHit<Long> best = pruned.stream()
            .max(Comparator.comparingDouble(SearchHit::score))
            .orElseThrow();
        assertEquals(1234L, best.itemId());
        assertEquals(1.0, best.score(), 1e-9);
    }

    private static Map<Long, Double> scores(List<SearchHit<Long>> hits) {
        return hits.stream().collect(Collectors.toMap(SearchHit::itemId, SearchHit::score));
    }
}
