package com.ngramengine.storage;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.io.InputStream;

/**
 * VarInt变长整数编解码器
 * 
 * 编码规则：每字节7位有效数据，最高位为续接标志。
 * 维度ID、词频、槽位差值都是小整数，适合用VarInt存储。
 */
public final class VarIntCodec {
    
    private VarIntCodec() {
        // 工具类，禁止实例化
    }
    
    /**
     * 将非负int编码为VarInt写入
     * 
     * @param value 要编码的值（必须非负）
     * @param out 输出目标
     * @throws IOException IO异常
     * @throws IllegalArgumentException 如果value为负数
     */
    public static void writeVarInt(int value, DataOutput out) throws IOException {
        if (value < 0) {
            throw new IllegalArgumentException("VarInt不支持负数: " + value);
        }
        while ((value & ~0x7F) != 0) {
            out.writeByte((value & 0x7F) | 0x80);
            value >>>= 7;
        }
        out.writeByte(value & 0x7F);
    }
    
    /**
     * 读取一个VarInt
     * 
     * @param in 输入源
     * @return 解码后的值
     * @throws java.io.EOFException 数据不足时抛出
     * @throws IOException 超过32位范围时抛出
     */
    public static int readVarInt(DataInput in) throws IOException {
        int result = 0;
        int shift = 0;
        while (shift < 32) {
            int b = in.readUnsignedByte();
            result |= (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return result;
            }
            shift += 7;
        }
        throw new IOException("VarInt超过32位范围");
    }
    
    /**
     * 读取一个长度或数量前缀。每个元素至少占1字节，
     * 输入源为 InputStream 时长度不得超过剩余可读字节数。
     *
     * @param in 输入源
     * @return 非负长度
     * @throws IOException 长度为负或超过剩余数据时抛出
     */
    public static int readLength(DataInput in) throws IOException {
        int length = readVarInt(in);
        if (length < 0) {
            throw new IOException("长度前缀非法: " + length);
        }
        if (in instanceof InputStream stream && length > stream.available()) {
            throw new IOException("长度前缀超过剩余数据: length=" + length + ", available=" + stream.available());
        }
        return length;
    }

    /**
     * 计算int值编码为VarInt所需的字节数
     */
    public static int varIntSize(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("VarInt不支持负数: " + value);
        }
        int size = 1;
        while ((value & ~0x7F) != 0) {
            size++;
            value >>>= 7;
        }
        return size;
    }
}
