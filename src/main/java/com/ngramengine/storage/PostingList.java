package com.ngramengine.storage;

import java.util.Arrays;

/**
 * 单个维度的倒排列表，包含向量槽位与对应词频。
 *
 * @param slots 递增向量槽位数组
 * @param termFreqs 与slots同长度的词频数组
 */
public record PostingList(int[] slots, int[] termFreqs) {
    private static final PostingList EMPTY = new PostingList(new int[0], new int[0]);

    /**
     * 构造时执行防御性校验并复制输入数据，避免外部修改。
     */
    public PostingList {
        if (slots == null || termFreqs == null) {
            throw new IllegalArgumentException("slots与termFreqs不能为null");
        }
        if (slots.length != termFreqs.length) {
            throw new IllegalArgumentException("slots与termFreqs长度不一致: " + slots.length + " vs " + termFreqs.length);
        }
        for (int index = 0; index < slots.length; index++) {
            if (slots[index] < 0) {
                throw new IllegalArgumentException("slot不能为负数，位置=" + index + ", value=" + slots[index]);
            }
            if (termFreqs[index] <= 0) {
                throw new IllegalArgumentException("termFreq必须为正数，位置=" + index + ", value=" + termFreqs[index]);
            }
            if (index > 0 && slots[index] <= slots[index - 1]) {
                throw new IllegalArgumentException("slots必须严格递增，位置=" + index + ", current=" + slots[index]);
            }
        }
        slots = Arrays.copyOf(slots, slots.length);
        termFreqs = Arrays.copyOf(termFreqs, termFreqs.length);
    }

    public static PostingList empty() {
        return EMPTY;
    }

    /**
     * 返回倒排项数量。
     *
     * @return 倒排项数量
     */
    public int size() {
        return slots.length;
    }

    /**
     * 获取指定位置的向量槽位。
     *
     * @param index 倒排项下标
     * @return 向量槽位
     */
    public int slot(int index) {
        return slots[index];
    }

    /**
     * 获取指定位置的词频。
     *
     * @param index 倒排项下标
     * @return 词频
     */
    public int termFreq(int index) {
        return termFreqs[index];
    }

    @Override
    public int[] slots() {
        return Arrays.copyOf(slots, slots.length);
    }

    @Override
    public int[] termFreqs() {
        return Arrays.copyOf(termFreqs, termFreqs.length);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PostingList that)) {
            return false;
        }
        return Arrays.equals(slots, that.slots) && Arrays.equals(termFreqs, that.termFreqs);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(slots) + Arrays.hashCode(termFreqs);
    }
}
