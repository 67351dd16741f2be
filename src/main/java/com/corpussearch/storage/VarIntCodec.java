package com.corpussearch.storage;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;

/**
 * VarInt变长整数编解码器
 *
 * 编码规则：每字节7位有效数据，低位在前，最高位为续接标志
 * - 最高位为1：表示后续还有字节
 * - 最高位为0：表示这是最后一个字节
 *
 * 只支持非负int，最多占用5个字节。
 */
public final class VarIntCodec {

    /** int编码后的最大字节数 */
    public static final int MAX_VARINT_BYTES = 5;

    private VarIntCodec() {
        // 工具类，禁止实例化
    }

    /**
     * 将int值编码为VarInt并追加到字节流
     *
     * @param value 要编码的值（必须非负）
     * @param out 输出字节流
     * @throws IllegalArgumentException 如果value为负数
     */
    public static void writeVarInt(int value, ByteArrayOutputStream out) {
        if (value < 0) {
            throw new IllegalArgumentException("VarInt不支持负数: " + value);
        }
        while ((value & ~0x7F) != 0) {
            out.write((value & 0x7F) | 0x80);
            value >>>= 7;
        }
        out.write(value);
    }

    /**
     * 从ByteBuffer当前位置读取一个VarInt
     *
     * @param buf 字节缓冲区
     * @return 解码后的值
     * @throws CorruptedPostingListException 缓冲区在VarInt中途结束或数值超出int范围
     */
    public static int readVarInt(ByteBuffer buf) {
        int start = buf.position();
        int result = 0;
        for (int index = 0; index < MAX_VARINT_BYTES; index++) {
            if (!buf.hasRemaining()) {
                throw new CorruptedPostingListException("VarInt被截断", start);
            }
            int b = buf.get() & 0xFF;
            if (index == MAX_VARINT_BYTES - 1 && (b & 0xF8) != 0) {
                // 第5个字节只允许携带低3位
                throw new CorruptedPostingListException("VarInt超过int范围", start);
            }
            result |= (b & 0x7F) << (7 * index);
            if ((b & 0x80) == 0) {
                return result;
            }
        }
        throw new CorruptedPostingListException("VarInt超过int范围", start);
    }
}
