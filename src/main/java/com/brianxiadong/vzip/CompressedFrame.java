package com.brianxiadong.vzip;

import java.util.Arrays;

/**
 * 单帧压缩结果：压缩长度 + 压缩字节
 */
public final class CompressedFrame {
    private final byte[] data;

    private CompressedFrame(byte[] data) {
        this.data = data;
    }

    /**
     * 从 worker 的输出缓冲区复制前 length 字节
     */
    public static CompressedFrame copyOf(byte[] buffer, int length) {
        if (length < 0 || length > buffer.length) {
            throw new IllegalArgumentException("invalid frame length " + length);
        }
        return new CompressedFrame(Arrays.copyOf(buffer, length));
    }

    public static CompressedFrame wrap(byte[] data) {
        return new CompressedFrame(data);
    }

    public int getLength() {
        return data.length;
    }

    public byte[] getData() {
        return data;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CompressedFrame))
            return false;
        return Arrays.equals(data, ((CompressedFrame) o).data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "CompressedFrame{length=" + data.length + "}";
    }
}
