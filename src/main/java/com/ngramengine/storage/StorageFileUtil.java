package com.ngramengine.storage;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.util.zip.CRC32;

/**
 * 存储文件工具方法，封装 CRC32 页脚的写入与校验。
 */
final class StorageFileUtil {
    private StorageFileUtil() {
    }

    /**
     * 计算字节数组的 CRC32。
     *
     * @param data 数据区
     * @return CRC32 无符号值
     */
    static long computeCrc32(byte[] data) {
        CRC32 crc32 = new CRC32();
        crc32.update(data, 0, data.length);
        return crc32.getValue();
    }

    /**
     * 截断文件后写入数据区并追加 CRC32 页脚。
     *
     * @param randomAccessFile 目标文件
     * @param data 数据区
     * @throws IOException 写入失败时抛出
     */
    static void writeWithCrc32Footer(RandomAccessFile randomAccessFile, byte[] data) throws IOException {
        randomAccessFile.setLength(0L);
        randomAccessFile.write(data);
        randomAccessFile.writeInt((int) computeCrc32(data));
    }

    /**
     * 读取整个文件，验证尾部 CRC32 并返回不含页脚的数据区。
     *
     * @param randomAccessFile 源文件
     * @param fileName 文件名（用于错误消息）
     * @return 数据区字节
     * @throws IOException CRC 不匹配或文件过短时抛出
     */
    static byte[] readVerifiedData(RandomAccessFile randomAccessFile, String fileName) throws IOException {
        long fileLength = randomAccessFile.length();
        if (fileLength < Integer.BYTES) {
            throw new IOException("文件过短，缺少 CRC32 页脚: " + fileName);
        }
        if (fileLength - Integer.BYTES > Integer.MAX_VALUE) {
            throw new IOException("文件过大，无法整体加载: " + fileName + ", length=" + fileLength);
        }
        byte[] content = new byte[(int) fileLength];
        randomAccessFile.seek(0L);
        randomAccessFile.readFully(content);
        int dataLength = content.length - Integer.BYTES;
        long expectedCrc32 = Integer.toUnsignedLong(ByteBuffer.wrap(content, dataLength, Integer.BYTES).getInt());
        byte[] data = new byte[dataLength];
        System.arraycopy(content, 0, data, 0, dataLength);
        long actualCrc32 = computeCrc32(data);
        if (actualCrc32 != expectedCrc32) {
            throw new IOException("CRC32 校验失败: " + fileName + ", expected=" + expectedCrc32 + ", actual=" + actualCrc32);
        }
        return data;
    }
}
