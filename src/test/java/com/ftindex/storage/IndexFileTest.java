package com.ftindex.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 顺序索引文件读写与 CRC32 页脚测试。
 */
class IndexFileTest {

    @TempDir
    Path tempDir;

    @Test
    void writerAndReaderAgreeOnLayoutAndPositions() throws IOException {
        Path file = tempDir.resolve("data.bin");
        try (IndexFileWriter writer = new IndexFileWriter(file, 16)) {
            writer.writeByte(7);
            writer.writeShort((short) 300);
            writer.writeInt(0x46544449);
            writer.writeLong(1L << 40);
            writer.writeVarInt(16384);
            writer.writeBytes(new byte[] {1, 2, 3});
            ByteBuffer buffer = ByteBuffer.wrap(new byte[] {9, 8, 7, 6});
            buffer.position(1);
            writer.writeBytes(buffer);
            assertEquals(1, buffer.position(), "写出不应改变传入缓冲区的状态");
            assertEquals(1 + 2 + 4 + 8 + 3 + 3 + 3, writer.position());
            writer.sync();
        }

        try (IndexFileReader reader = new IndexFileReader(file)) {
            assertEquals(7, reader.readByte());
            assertEquals(300, reader.readShort());
            assertEquals(0x46544449, reader.readInt());
            assertEquals(1L << 40, reader.readLong());
            assertEquals(16384, reader.readVarInt());
            byte[] bytes = new byte[6];
            reader.readFully(bytes);
            assertArrayEquals(new byte[] {1, 2, 3, 8, 7, 6}, bytes);
            assertEquals(Files.size(file), reader.position());
        }
    }

    @Test
    void closedWriterRejectsWrites() throws IOException {
        IndexFileWriter writer = new IndexFileWriter(tempDir.resolve("closed.bin"));
        writer.close();
        writer.close();

        assertThrows(IllegalStateException.class, () -> writer.writeInt(1));
    }

    @Test
    void crcFooterDetectsCorruption() throws IOException {
        Path file = tempDir.resolve("crc.bin");
        try (IndexFileWriter writer = new IndexFileWriter(file)) {
            for (int index = 0; index < 1000; index++) {
                writer.writeInt(index);
            }
        }
        StorageFileUtil.appendCrc32Footer(file);
        assertEquals(4000L, StorageFileUtil.verifyCrc32Footer(file));

        try (RandomAccessFile randomAccessFile = new RandomAccessFile(file.toFile(), "rw")) {
            randomAccessFile.seek(123);
            int original = randomAccessFile.read();
            randomAccessFile.seek(123);
            randomAccessFile.write(original ^ 0xFF);
        }
        IOException exception = assertThrows(IOException.class, () -> StorageFileUtil.verifyCrc32Footer(file));
        assertTrue(exception.getMessage().contains("CRC32"));
    }

    @Test
    void crcFooterRejectsTooShortFile() throws IOException {
        Path file = tempDir.resolve("short.bin");
        Files.write(file, new byte[] {1, 2});

        assertThrows(IOException.class, () -> StorageFileUtil.verifyCrc32Footer(file));
    }
}
