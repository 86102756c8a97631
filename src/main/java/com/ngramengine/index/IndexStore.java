package com.ngramengine.index;

import com.ngramengine.config.Constants;
import com.ngramengine.storage.IndexData;
import com.ngramengine.storage.IndexFileReader;
import com.ngramengine.storage.IndexFileWriter;
import com.ngramengine.storage.IndexMeta;
import com.ngramengine.storage.ItemIdCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Serializable;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 索引目录的保存与加载：二进制索引文件 + JSON 元数据。
 */
public final class IndexStore {
    private static final Logger logger = LoggerFactory.getLogger(IndexStore.class);

    private IndexStore() {
    }

    /**
     * 将索引写入目录，已存在的文件被覆盖。
     *
     * @param index 索引
     * @param directory 目标目录
     * @param itemIdCodec 条目ID编码方式
     * @return 写入的元数据
     * @throws IOException 写入失败时抛出
     */
    public static <I extends Comparable<? super I> & Serializable> IndexMeta save(
            NgramIndex<I> index, Path directory, ItemIdCodec<I> itemIdCodec) throws IOException {
        Files.createDirectories(directory);
        File indexFile = directory.resolve(Constants.INDEX_FILE_NAME).toFile();
        try (IndexFileWriter<I> writer = new IndexFileWriter<>(indexFile, itemIdCodec)) {
            writer.write(index.data());
        }
        IndexMeta meta = IndexMeta.describe(index.data());
        meta.writeTo(directory.resolve(Constants.META_FILE_NAME).toFile());
        logger.info("索引已保存: dir={}, items={}, dimensions={}", directory, meta.itemCount(), meta.dimensionCount());
        return meta;
    }

    /**
     * 从目录加载索引，并校验元数据与索引文件一致。
     *
     * @throws IOException 文件缺失、损坏或不一致时抛出
     */
    public static <I extends Comparable<? super I> & Serializable> NgramIndex<I> load(
            Path directory, ItemIdCodec<I> itemIdCodec) throws IOException {
        IndexMeta meta = readMeta(directory);
        if (meta.formatVersion() != Constants.FORMAT_VERSION) {
            throw new IOException("索引元数据版本不支持: " + meta.formatVersion());
        }
        File indexFile = directory.resolve(Constants.INDEX_FILE_NAME).toFile();
        if (!indexFile.isFile()) {
            throw new IOException("索引文件不存在: " + indexFile.getAbsolutePath());
        }
        IndexData<I> data = new IndexFileReader<>(indexFile, itemIdCodec).getData();
        if (!meta.matches(data)) {
            throw new IOException("索引元数据与索引文件不一致: dir=" + directory);
        }
        logger.info("索引已加载: dir={}, n={}, items={}", directory, meta.gramLength(), meta.itemCount());
        return NgramIndex.fromData(data);
    }

    /**
     * 只读取元数据，不加载索引本体。
     */
    public static IndexMeta readMeta(Path directory) throws IOException {
        return IndexMeta.readFrom(directory.resolve(Constants.META_FILE_NAME).toFile());
    }
}
