package com.ngramengine.scoring;

import com.ngramengine.vector.SparseVector;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Dice 评分器测试
 */
class DiceScorerTest {

    private static final double EPSILON = 1e-9;

    private final SparseVector query = vector(1, 2, 3);
    private final SparseVector candidate = vector(2, 3, 4, 5, 6);

    @Test
    @DisplayName("Dice：2·交集 / 维度数之和")
    void testDice() {
        // 交集 {2,3}，2*2 / (3+5)
        assertEquals(0.5, DiceScorer.dice(query, candidate), EPSILON);
    }

    @Test
    @DisplayName("自身相似度为1")
    void testDiceReflexive() {
        assertEquals(1.0, DiceScorer.dice(query, query), EPSILON);
        assertEquals(1.0, DiceScorer.dice(candidate, candidate), EPSILON);
    }

    @Test
    void testDiceSymmetricAndBounded() {
        double forward = DiceScorer.dice(query, candidate);
        double backward = DiceScorer.dice(candidate, query);

        assertEquals(forward, backward, EPSILON);
        assertTrue(forward >= 0.0 && forward <= 1.0);
    }

    @Test
    @DisplayName("空向量或无交集时返回0，不返回NaN")
    void testDiceZeroDenominator() {
        assertEquals(0.0, DiceScorer.dice(SparseVector.empty(), SparseVector.empty()));
        assertEquals(0.0, DiceScorer.dice(query, SparseVector.empty()));
        assertEquals(0.0, DiceScorer.dice(query, vector(7, 8)));
    }

    @Test
    void testDiceIgnoresOccurrenceCounts() {
        SparseVector heavy = new SparseVector(new int[] {1, 2, 3}, new int[] {9, 9, 9});
        assertEquals(1.0, DiceScorer.dice(query, heavy), EPSILON);
    }

    @Test
    @DisplayName("w=0.5 与普通 Dice 相同")
    void testWeightedBalancedEqualsDice() {
        assertEquals(DiceScorer.dice(query, candidate), DiceScorer.diceWeighted(query, candidate, 0.5), EPSILON);
        assertEquals(DiceScorer.dice(candidate, query), DiceScorer.diceWeighted(candidate, query, 0.5), EPSILON);
    }

    @Test
    @DisplayName("w=1 只使用 a 的长度")
    void testWeightedFullQueryWeight() {
        // |交集| / |a| = 2/3
        assertEquals(2.0 / 3.0, DiceScorer.diceWeighted(query, candidate, 1.0), EPSILON);
    }

    @Test
    @DisplayName("w=0 只使用 b 的长度")
    void testWeightedZeroQueryWeight() {
        // |交集| / |b| = 2/5
        assertEquals(2.0 / 5.0, DiceScorer.diceWeighted(query, candidate, 0.0), EPSILON);
    }

    @Test
    void testWeightedZeroDenominator() {
        assertEquals(0.0, DiceScorer.diceWeighted(SparseVector.empty(), candidate, 1.0));
        assertEquals(0.0, DiceScorer.diceWeighted(query, SparseVector.empty(), 0.0));
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.1, 1.5, Double.NaN})
    void testWeightedRejectsOutOfRange(double w) {
        assertThrows(IllegalArgumentException.class, () -> DiceScorer.diceWeighted(query, candidate, w));
    }

    private static SparseVector vector(int... dimensions) {
        int[] counts = new int[dimensions.length];
        Arrays.fill(counts, 1);
        return new SparseVector(dimensions, counts);
    }
}
