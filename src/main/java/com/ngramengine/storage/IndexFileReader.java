package com.ngramengine.storage;

import com.ngramengine.config.Constants;
import com.ngramengine.vector.SparseVector;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 索引文件读取器，构造时全量加载并校验文件内容。
 */
public final class IndexFileReader<I> {
    private final IndexData<I> data;

    /**
     * 构造读取器并完成索引加载。
     *
     * @param file 索引文件
     * @param itemIdCodec 条目ID解码方式
     * @throws IOException 文件损坏或解析失败时抛出
     */
    public IndexFileReader(File file, ItemIdCodec<I> itemIdCodec) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("索引文件不能为空");
        }
        if (itemIdCodec == null) {
            throw new IllegalArgumentException("itemIdCodec 不能为空");
        }
        byte[] content;
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(file, "r")) {
            content = StorageFileUtil.readVerifiedData(randomAccessFile, file.getName());
        }
        ByteArrayInputStream source = new ByteArrayInputStream(content);
        DataInputStream in = new DataInputStream(source);
        try {
            int magic = in.readInt();
            if (magic != Constants.INDEX_MAGIC) {
                throw new IOException("索引文件 magic 不匹配: " + file.getName());
            }
            short formatVersion = in.readShort();
            if (formatVersion != Constants.FORMAT_VERSION) {
                throw new IOException("索引文件版本不支持: " + formatVersion);
            }
            int gramLength = in.readInt();
            int dimensionCount = in.readInt();
            int vectorCount = in.readInt();
            if (gramLength < 1 || dimensionCount < 0 || vectorCount < 0) {
                throw new IOException("索引文件头非法: n=" + gramLength + ", dimensions=" + dimensionCount
                    + ", vectors=" + vectorCount + ", file=" + file.getAbsolutePath());
            }
            // 每个维度与向量在文件中至少占1字节
            if (dimensionCount > source.available() || vectorCount > source.available()) {
                throw new IOException("索引文件头计数超过文件内容: dimensions=" + dimensionCount
                    + ", vectors=" + vectorCount + ", available=" + source.available());
            }

            Dictionary dictionary = readDictionary(in, dimensionCount);
            List<StoredVector<I>> vectors = readVectors(in, itemIdCodec, vectorCount, dimensionCount);
            PostingList[] postings = readPostings(in, dimensionCount, vectors);

            if (source.available() != 0) {
                throw new IOException("索引文件包含未解析字节，可能已损坏: " + file.getName());
            }
            this.data = new IndexData<>(gramLength, dictionary, new PostingStore<>(vectors, postings));
        } catch (EOFException exception) {
            throw new IOException("索引文件意外结束，可能已损坏: " + file.getName(), exception);
        } catch (IllegalArgumentException exception) {
            throw new IOException("索引文件内容非法: " + file.getName() + " - " + exception.getMessage(), exception);
        }
    }

    public IndexData<I> getData() {
        return data;
    }

    private Dictionary readDictionary(DataInputStream in, int dimensionCount) throws IOException {
        String[] grams = new String[dimensionCount];
        int[] docFrequencies = new int[dimensionCount];
        for (int dimension = 0; dimension < dimensionCount; dimension++) {
            int gramLength = VarIntCodec.readLength(in);
            byte[] gramBytes = new byte[gramLength];
            in.readFully(gramBytes);
            grams[dimension] = new String(gramBytes, StandardCharsets.UTF_8);
            docFrequencies[dimension] = VarIntCodec.readVarInt(in);
        }
        return new Dictionary(grams, docFrequencies);
    }

    private List<StoredVector<I>> readVectors(
            DataInputStream in,
            ItemIdCodec<I> itemIdCodec,
            int vectorCount,
            int dimensionCount) throws IOException {
        List<StoredVector<I>> vectors = new ArrayList<>(vectorCount);
        for (int slot = 0; slot < vectorCount; slot++) {
            I itemId = itemIdCodec.read(in);
            int size = VarIntCodec.readLength(in);
            int[] dimensions = DeltaCodec.decodeDeltaVarInt(size, in);
            int[] counts = new int[size];
            for (int index = 0; index < size; index++) {
                counts[index] = VarIntCodec.readVarInt(in);
            }
            if (size > 0 && dimensions[size - 1] >= dimensionCount) {
                throw new IOException("向量维度越界: slot=" + slot + ", dimension=" + dimensions[size - 1]);
            }
            vectors.add(new StoredVector<>(itemId, new SparseVector(dimensions, counts)));
        }
        return vectors;
    }

    private PostingList[] readPostings(DataInputStream in, int dimensionCount, List<StoredVector<I>> vectors) throws IOException {
        PostingList[] postings = new PostingList[dimensionCount];
        long postingTotal = 0;
        for (int dimension = 0; dimension < dimensionCount; dimension++) {
            int size = VarIntCodec.readLength(in);
            int[] slots = DeltaCodec.decodeDeltaVarInt(size, in);
            int[] termFreqs = new int[size];
            for (int index = 0; index < size; index++) {
                termFreqs[index] = VarIntCodec.readVarInt(in);
                if (slots[index] >= vectors.size()) {
                    throw new IOException("倒排槽位越界: dimension=" + dimension + ", slot=" + slots[index]);
                }
                int expected = vectors.get(slots[index]).vector().countOf(dimension);
                if (expected != termFreqs[index]) {
                    throw new IOException("倒排与向量不一致: dimension=" + dimension + ", slot=" + slots[index]
                        + ", termFreq=" + termFreqs[index] + ", vectorCount=" + expected);
                }
            }
            postings[dimension] = new PostingList(slots, termFreqs);
            postingTotal += size;
        }
        // 每条倒排都已对应到向量中的一个非零维度，总数相等即两者一一对应
        long vectorDimensionTotal = 0;
        for (StoredVector<I> stored : vectors) {
            vectorDimensionTotal += stored.vector().dimensionCount();
        }
        if (postingTotal != vectorDimensionTotal) {
            throw new IOException("向量维度缺少对应倒排: postings=" + postingTotal + ", vectorDimensions=" + vectorDimensionTotal);
        }
        return postings;
    }
}
