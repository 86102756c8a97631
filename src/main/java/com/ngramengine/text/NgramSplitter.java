package com.ngramengine.text;

import com.ngramengine.config.Constants;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 按 Unicode 码点切分定长 n-gram，并提供边界哨兵填充。
 */
public final class NgramSplitter {

    private NgramSplitter() {
        // 工具类，禁止实例化
    }

    /**
     * 在词项两侧各追加 k 个哨兵字符。
     *
     * @param term 原始词项
     * @param k 单侧哨兵数量
     * @return 填充后的字符串
     */
    public static String pad(String term, int k) {
        if (term == null) {
            throw new IllegalArgumentException("term 不能为null");
        }
        if (k < 0) {
            throw new IllegalArgumentException("填充数量不能为负数: " + k);
        }
        String pads = String.valueOf(Constants.SENTINEL).repeat(k);
        return pads + term + pads;
    }

    /**
     * 返回可重复遍历的 n-gram 序列，每次 iterator() 都从头开始惰性生成。
     *
     * @param text 源文本
     * @param n 窗口长度（码点数）
     * @return 共 codePointLength(text) - n + 1 个窗口，不足时为空
     */
    public static Iterable<String> split(String text, int n) {
        if (text == null) {
            throw new IllegalArgumentException("text 不能为null");
        }
        if (n < 1) {
            throw new IllegalArgumentException("n 必须大于等于1: " + n);
        }
        return () -> new WindowIterator(text.codePoints().toArray(), n);
    }

    /**
     * 以 Stream 形式返回 n-gram 序列。
     */
    public static Stream<String> stream(String text, int n) {
        return StreamSupport.stream(split(text, n).spliterator(), false);
    }

    /**
     * 填充 n-1 个哨兵后切分，即索引与查询共用的切分路径。
     */
    public static Iterable<String> paddedGrams(String term, int n) {
        if (n < 1) {
            throw new IllegalArgumentException("n 必须大于等于1: " + n);
        }
        return split(pad(term, n - 1), n);
    }

    /**
     * 以码点计数的字符长度。
     */
    public static int codePointLength(String text) {
        return text.codePointCount(0, text.length());
    }

    private static final class WindowIterator implements Iterator<String> {
        private final int[] codePoints;
        private final int n;
        private int cursor;

        private WindowIterator(int[] codePoints, int n) {
            this.codePoints = codePoints;
            this.n = n;
        }

        @Override
        public boolean hasNext() {
            return cursor + n <= codePoints.length;
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException("n-gram 序列已耗尽");
            }
            String gram = new String(codePoints, cursor, n);
            cursor++;
            return gram;
        }
    }
}
