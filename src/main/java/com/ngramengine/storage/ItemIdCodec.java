package com.ngramengine.storage;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;

/**
 * 条目ID的持久化方式，写入索引文件的向量区。
 *
 * @param <I> 条目ID类型
 */
public interface ItemIdCodec<I> {

    /** int 型ID，定长4字节。 */
    ItemIdCodec<Integer> INTEGER = new ItemIdCodec<>() {
        @Override
        public void write(Integer itemId, DataOutput out) throws IOException {
            out.writeInt(itemId);
        }

        @Override
        public Integer read(DataInput in) throws IOException {
            return in.readInt();
        }
    };

    /** long 型ID，定长8字节。 */
    ItemIdCodec<Long> LONG = new ItemIdCodec<>() {
        @Override
        public void write(Long itemId, DataOutput out) throws IOException {
            out.writeLong(itemId);
        }

        @Override
        public Long read(DataInput in) throws IOException {
            return in.readLong();
        }
    };

    /** 字符串ID，VarInt长度前缀 + UTF-8 字节。 */
    ItemIdCodec<String> STRING = new ItemIdCodec<>() {
        @Override
        public void write(String itemId, DataOutput out) throws IOException {
            byte[] bytes = itemId.getBytes(StandardCharsets.UTF_8);
            VarIntCodec.writeVarInt(bytes.length, out);
            out.write(bytes);
        }

        @Override
        public String read(DataInput in) throws IOException {
            int length = VarIntCodec.readLength(in);
            byte[] bytes = new byte[length];
            in.readFully(bytes);
            return new String(bytes, StandardCharsets.UTF_8);
        }
    };

    /**
     * 将ID写入输出目标
     *
     * @param itemId 条目ID
     * @param out 输出目标
     * @throws IOException I/O exception
     */
    void write(I itemId, DataOutput out) throws IOException;

    /**
     * 从输入源读取ID
     *
     * @param in 输入源
     * @return 条目ID
     * @throws IOException 读取失败或数据与ID类型不匹配时抛出
     */
    I read(DataInput in) throws IOException;

    /**
     * 基于 Java 对象序列化的通用实现，适用于任意 {@link Serializable} ID。
     *
     * @param type ID 类型，用于读取时校验
     */
    static <I extends Serializable> ItemIdCodec<I> javaSerialization(Class<I> type) {
        return new ItemIdCodec<>() {
            @Override
            public void write(I itemId, DataOutput out) throws IOException {
                ByteArrayOutputStream buffer = new ByteArrayOutputStream();
                try (ObjectOutputStream objectOut = new ObjectOutputStream(buffer)) {
                    objectOut.writeObject(itemId);
                }
                byte[] bytes = buffer.toByteArray();
                VarIntCodec.writeVarInt(bytes.length, out);
                out.write(bytes);
            }

            @Override
            public I read(DataInput in) throws IOException {
                int length = VarIntCodec.readLength(in);
                byte[] bytes = new byte[length];
                in.readFully(bytes);
                try (ObjectInputStream objectIn = new ObjectInputStream(new ByteArrayInputStream(bytes))) {
                    Object value = objectIn.readObject();
                    if (!type.isInstance(value)) {
                        throw new IOException("ID 类型不匹配: expected=" + type.getName()
                            + ", actual=" + (value == null ? "null" : value.getClass().getName()));
                    }
                    return type.cast(value);
                } catch (ClassNotFoundException exception) {
                    throw new IOException("无法解析 ID 类型: " + exception.getMessage(), exception);
                }
            }
        };
    }
}
