package com.ngramengine.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ngramengine.config.Constants;

import java.io.File;
import java.io.IOException;
import java.time.Instant;

/**
 * 索引元数据，以 JSON 形式与二进制索引文件并存，供 status 命令读取及加载时交叉校验。
 */
public record IndexMeta(
    int formatVersion,
    int gramLength,
    int itemCount,
    int dimensionCount,
    Instant createTime
) {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public IndexMeta {
        if (gramLength < 1) {
            throw new IllegalArgumentException("gramLength 必须大于等于1: " + gramLength);
        }
        if (itemCount < 0 || dimensionCount < 0) {
            throw new IllegalArgumentException("统计值不能为负数: items=" + itemCount + ", dimensions=" + dimensionCount);
        }
    }

    /**
     * 按当前格式版本描述一份索引状态。
     */
    public static IndexMeta describe(IndexData<?> data) {
        return new IndexMeta(
            Constants.FORMAT_VERSION,
            data.gramLength(),
            data.postingStore().size(),
            data.dictionary().size(),
            Instant.now());
    }

    /**
     * 元数据中的 n、条目数和维度数是否与索引状态一致。
     */
    public boolean matches(IndexData<?> data) {
        return gramLength == data.gramLength()
            && itemCount == data.postingStore().size()
            && dimensionCount == data.dictionary().size();
    }

    public void writeTo(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("元数据文件不能为空");
        }
        try {
            OBJECT_MAPPER.writerWithDefaultPrettyPrinter().writeValue(file, this);
        } catch (IOException exception) {
            throw new IOException("写入索引元数据失败: " + file.getAbsolutePath(), exception);
        }
    }

    /**
     * 读取 JSON 元数据文件，字段缺失或取值非法时按解析失败处理。
     *
     * @param file 元数据文件
     * @return 元数据
     * @throws IOException 文件不存在、读取或解析失败时抛出
     */
    public static IndexMeta readFrom(File file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("元数据文件不能为空");
        }
        if (!file.isFile()) {
            throw new IOException("索引元数据不存在: " + file.getAbsolutePath());
        }
        try {
            return OBJECT_MAPPER.readValue(file, IndexMeta.class);
        } catch (IOException exception) {
            throw new IOException("读取索引元数据失败: " + file.getAbsolutePath(), exception);
        }
    }
}
