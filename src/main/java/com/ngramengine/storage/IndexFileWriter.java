package com.ngramengine.storage;

import com.ngramengine.config.Constants;
import com.ngramengine.vector.SparseVector;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;

/**
 * 索引文件写入器。
 *
 * <p>布局：文件头（magic、版本、n、维度数、向量数）、词典区、向量区、倒排区，最后追加 CRC32。
 */
public final class IndexFileWriter<I> implements AutoCloseable {
    private final RandomAccessFile randomAccessFile;
    private final String indexFileName;
    private final ItemIdCodec<I> itemIdCodec;
    private boolean written;
    private boolean closed;

    /**
     * 创建索引文件写入器。
     *
     * @param file 目标索引文件
     * @param itemIdCodec 条目ID编码方式
     * @throws IOException 打开文件失败时抛出
     */
    public IndexFileWriter(File file, ItemIdCodec<I> itemIdCodec) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("索引文件不能为空");
        }
        if (itemIdCodec == null) {
            throw new IllegalArgumentException("itemIdCodec 不能为空");
        }
        this.randomAccessFile = new RandomAccessFile(file, "rw");
        this.indexFileName = file.getName();
        this.itemIdCodec = itemIdCodec;
    }

    /**
     * 写入完整索引，每个写入器只能写一次。
     *
     * @param data 索引状态
     * @throws IOException 写入失败时抛出
     */
    public void write(IndexData<I> data) throws IOException {
        ensureOpen();
        if (written) {
            throw new IllegalStateException("IndexFileWriter 只能写入一次");
        }
        Dictionary dictionary = data.dictionary();
        PostingStore<I> postingStore = data.postingStore();

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        DataOutputStream out = new DataOutputStream(buffer);
        out.writeInt(Constants.INDEX_MAGIC);
        out.writeShort(Constants.FORMAT_VERSION);
        out.writeInt(data.gramLength());
        out.writeInt(dictionary.size());
        out.writeInt(postingStore.size());

        for (int dimension = 0; dimension < dictionary.size(); dimension++) {
            byte[] gramBytes = dictionary.gram(dimension).getBytes(StandardCharsets.UTF_8);
            VarIntCodec.writeVarInt(gramBytes.length, out);
            out.write(gramBytes);
            VarIntCodec.writeVarInt(dictionary.docFrequency(dimension), out);
        }

        for (int slot = 0; slot < postingStore.size(); slot++) {
            StoredVector<I> stored = postingStore.vector(slot);
            itemIdCodec.write(stored.itemId(), out);
            SparseVector vector = stored.vector();
            VarIntCodec.writeVarInt(vector.dimensionCount(), out);
            DeltaCodec.encodeDeltaVarInt(vector.dimensions(), out);
            for (int count : vector.counts()) {
                VarIntCodec.writeVarInt(count, out);
            }
        }

        for (int dimension = 0; dimension < postingStore.dimensionCount(); dimension++) {
            PostingList postingList = postingStore.postings(dimension);
            VarIntCodec.writeVarInt(postingList.size(), out);
            DeltaCodec.encodeDeltaVarInt(postingList.slots(), out);
            for (int termFreq : postingList.termFreqs()) {
                VarIntCodec.writeVarInt(termFreq, out);
            }
        }
        out.flush();

        try {
            StorageFileUtil.writeWithCrc32Footer(randomAccessFile, buffer.toByteArray());
        } catch (IOException exception) {
            throw new IOException("写入索引文件失败: file=" + indexFileName + ", items=" + postingStore.size(), exception);
        }
        written = true;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        try {
            randomAccessFile.close();
        } finally {
            closed = true;
        }
    }

    /**
     * 校验写入器状态，防止关闭后继续写入。
     */
    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("IndexFileWriter 已关闭");
        }
    }
}
