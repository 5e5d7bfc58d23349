package com.ftindex.storage;

import java.io.EOFException;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Path;
import java.util.zip.CRC32;

/**
 * 段文件的 CRC32 页脚读写。页脚为文件最后 4 字节，覆盖其之前的全部数据。
 */
public final class StorageFileUtil {
    private StorageFileUtil() {
    }

    /**
     * 计算文件前 length 字节的 CRC32。
     *
     * @return CRC32 无符号值
     */
    static long computeCrc32(RandomAccessFile randomAccessFile, long length) throws IOException {
        long originalPointer = randomAccessFile.getFilePointer();
        CRC32 crc32 = new CRC32();
        byte[] buffer = new byte[8 * 1024];
        long remainingBytes = length;
        randomAccessFile.seek(0L);
        while (remainingBytes > 0) {
            int chunkSize = (int) Math.min(buffer.length, remainingBytes);
            int readBytes = randomAccessFile.read(buffer, 0, chunkSize);
            if (readBytes < 0) {
                throw new EOFException("计算 CRC32 时遇到 EOF");
            }
            crc32.update(buffer, 0, readBytes);
            remainingBytes -= readBytes;
        }
        randomAccessFile.seek(originalPointer);
        return crc32.getValue();
    }

    /**
     * 在已写完的文件尾部追加 CRC32 页脚。
     *
     * @throws IOException 写入失败时抛出
     */
    public static void appendCrc32Footer(Path path) throws IOException {
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(path.toFile(), "rw")) {
            long dataLength = randomAccessFile.length();
            long crc32Value = computeCrc32(randomAccessFile, dataLength);
            randomAccessFile.seek(dataLength);
            randomAccessFile.writeInt((int) crc32Value);
            randomAccessFile.getFD().sync();
        }
    }

    /**
     * 验证尾部 CRC32 并返回数据区长度。
     *
     * @return 不含 CRC 页脚的数据区长度
     * @throws IOException CRC 不匹配或文件过短时抛出
     */
    public static long verifyCrc32Footer(Path path) throws IOException {
        try (RandomAccessFile randomAccessFile = new RandomAccessFile(path.toFile(), "r")) {
            long fileLength = randomAccessFile.length();
            if (fileLength < Integer.BYTES) {
                throw new IOException("文件过短，缺少 CRC32 页脚: " + path);
            }
            long dataLength = fileLength - Integer.BYTES;
            randomAccessFile.seek(dataLength);
            long expectedCrc32 = Integer.toUnsignedLong(randomAccessFile.readInt());
            long actualCrc32 = computeCrc32(randomAccessFile, dataLength);
            if (actualCrc32 != expectedCrc32) {
                throw new IOException("CRC32 校验失败: " + path + ", expected=" + expectedCrc32 + ", actual=" + actualCrc32);
            }
            return dataLength;
        }
    }
}
