package com.brianxiadong.vzip;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * 归档格式：帧序列，每帧为 [4 字节长度 L][L 字节压缩数据]
 * 无文件头、无文件尾；长度为 32 位小端有符号整数
 */
public final class ArchiveFormat {
    public static final int LENGTH_FIELD_SIZE = 4;
    public static final ByteOrder BYTE_ORDER = ByteOrder.LITTLE_ENDIAN;
    public static final String DEFAULT_EXTENSION = ".vzip";

    private ArchiveFormat() {
    }

    public static void encodeLength(int length, byte[] dest) {
        ByteBuffer.wrap(dest, 0, LENGTH_FIELD_SIZE).order(BYTE_ORDER).putInt(length);
    }

    public static int decodeLength(byte[] src) {
        return ByteBuffer.wrap(src, 0, LENGTH_FIELD_SIZE).order(BYTE_ORDER).getInt();
    }
}
