package com.ngramengine.query;

/**
 * 索引内部状态不一致，例如查询向量中的维度在词典统计中不存在。
 * 表示索引已损坏，不可恢复。
 */
public class IndexCorruptedException extends RuntimeException {
    private final int dimension;

    public IndexCorruptedException(String message, int dimension) {
        super(message + ": dimension=" + dimension);
        this.dimension = dimension;
    }

    public IndexCorruptedException(String message, int dimension, Throwable cause) {
        super(message + ": dimension=" + dimension, cause);
        this.dimension = dimension;
    }

    public int getDimension() {
        return dimension;
    }
}
