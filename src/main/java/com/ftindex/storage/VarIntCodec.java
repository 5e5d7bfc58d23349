package com.ftindex.storage;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;

/**
 * VarInt变长整数编解码器
 *
 * 编码规则：每字节低7位存数据，最高位为续接标志（1=后面还有字节）。
 * 倒排中的 docId 增量、词频、位置增量都很小，绝大多数只占 1 字节。
 */
public final class VarIntCodec {

    private VarIntCodec() {
        // 工具类，禁止实例化
    }

    /**
     * 将非负 int 编码为 VarInt 写入输出流。
     *
     * @param value 非负整数
     * @param out 输出流
     * @throws IOException 写入失败时抛出
     * @throws IllegalArgumentException value 为负数时抛出
     */
    public static void writeVarInt(int value, OutputStream out) throws IOException {
        checkNonNegative(value);
        while ((value & ~0x7F) != 0) {
            out.write((value & 0x7F) | 0x80);
            value >>>= 7;
        }
        out.write(value);
    }

    /**
     * 从输入流读取一个 VarInt。
     *
     * @param in 输入流
     * @return 解码后的值
     * @throws EOFException 流在 VarInt 中途或开头结束时抛出
     * @throws IOException 超过 32 位范围时抛出
     */
    public static int readVarInt(InputStream in) throws IOException {
        int result = 0;
        for (int shift = 0; shift < 32; shift += 7) {
            int b = in.read();
            if (b == -1) {
                throw new EOFException("读取 VarInt 时遇到流结束");
            }
            result |= (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return result;
            }
        }
        throw new IOException("VarInt超过32位范围");
    }

    /**
     * 将非负 int 编码为 VarInt 写入 ByteBuffer。
     */
    public static void writeVarInt(int value, ByteBuffer buf) {
        checkNonNegative(value);
        while ((value & ~0x7F) != 0) {
            buf.put((byte) ((value & 0x7F) | 0x80));
            value >>>= 7;
        }
        buf.put((byte) value);
    }

    /**
     * 从 ByteBuffer 当前位置读取一个 VarInt，并推进 position。
     *
     * @param buf 字节缓冲区
     * @return 解码后的值
     * @throws IOException 缓冲区不足或格式错误时抛出
     */
    public static int readVarInt(ByteBuffer buf) throws IOException {
        int result = 0;
        for (int shift = 0; shift < 32; shift += 7) {
            if (!buf.hasRemaining()) {
                throw new EOFException("ByteBuffer不足，无法读取完整VarInt");
            }
            int b = buf.get() & 0xFF;
            result |= (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                return result;
            }
        }
        throw new IOException("VarInt超过32位范围");
    }

    /**
     * 计算 VarInt 编码所需字节数。
     */
    public static int varIntSize(int value) {
        checkNonNegative(value);
        int size = 1;
        while ((value & ~0x7F) != 0) {
            size++;
            value >>>= 7;
        }
        return size;
    }

    private static void checkNonNegative(int value) {
        if (value < 0) {
            throw new IllegalArgumentException("VarInt不支持负数: " + value);
        }
    }
}
