package com.ngramengine.storage;

import com.ngramengine.vector.SparseVector;

/**
 * 索引中保存的一条记录：调用方给出的条目ID与完整词项向量。
 */
public record StoredVector<I>(I itemId, SparseVector vector) {
    public StoredVector {
        if (itemId == null || vector == null) {
            throw new IllegalArgumentException("itemId与vector不能为null");
        }
    }
}
