package com.ngramengine.storage;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/**
 * Delta编码器
 * 
 * 用于压缩严格递增的整数序列（向量维度、倒排槽位）。
 * 先写首值，其后写相邻差值，配合VarInt编码。
 * 
 * 示例：[10, 15, 20, 25] -> [10, 5, 5, 5]
 */
public final class DeltaCodec {
    
    private DeltaCodec() {
        // 工具类，禁止实例化
    }
    
    /**
     * Delta编码 + VarInt组合编码
     * 
     * @param sortedValues 非负单调递增序列
     * @param out 输出目标
     * @throws IOException IO异常
     * @throws IllegalArgumentException 如果输入非单调递增
     */
    public static void encodeDeltaVarInt(int[] sortedValues, DataOutput out) throws IOException {
        if (sortedValues == null || sortedValues.length == 0) {
            return;
        }
        VarIntCodec.writeVarInt(sortedValues[0], out);
        for (int i = 1; i < sortedValues.length; i++) {
            if (sortedValues[i] < sortedValues[i - 1]) {
                throw new IllegalArgumentException(
                    "输入必须是非负单调递增序列，在位置 " + i + " 处违反"
                );
            }
            VarIntCodec.writeVarInt(sortedValues[i] - sortedValues[i - 1], out);
        }
    }
    
    /**
     * 读取Delta+VarInt编码的数据并还原
     * 
     * @param count 期望读取的值数量
     * @param in 输入源
     * @return 解码后的原始序列
     * @throws IOException IO异常或数据不足
     */
    public static int[] decodeDeltaVarInt(int count, DataInput in) throws IOException {
        if (count < 0) {
            throw new IOException("值数量非法: " + count);
        }
        int[] values = new int[count];
        if (count == 0) {
            return values;
        }
        values[0] = VarIntCodec.readVarInt(in);
        for (int i = 1; i < count; i++) {
            int delta = VarIntCodec.readVarInt(in);
            if (values[i - 1] > Integer.MAX_VALUE - delta) {
                throw new IOException("Delta解码溢出，在位置 " + i + " 处");
            }
            values[i] = values[i - 1] + delta;
        }
        return values;
    }
}
