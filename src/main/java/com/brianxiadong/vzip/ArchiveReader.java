package com.brianxiadong.vzip;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 顺序读取归档中的帧
 */
public class ArchiveReader implements AutoCloseable {
    /** 负载按块读入，声明的长度只有在数据真实存在时才会占用内存 */
    static final int READ_CHUNK = 64 * 1024;

    private final InputStream in;
    private final long maxFrameLength;
    private final byte[] header = new byte[ArchiveFormat.LENGTH_FIELD_SIZE];
    private int index = 0;

    public ArchiveReader(InputStream in) {
        this(in, Integer.MAX_VALUE);
    }

    /**
     * @param maxFrameLength 单帧负载长度上限，例如归档文件的大小
     */
    public ArchiveReader(InputStream in, long maxFrameLength) {
        if (maxFrameLength < 0) {
            throw new IllegalArgumentException("maxFrameLength must be >= 0: " + maxFrameLength);
        }
        this.in = in;
        this.maxFrameLength = maxFrameLength;
    }

    /**
     * @return 下一帧；到达归档末尾时返回 null
     */
    public CompressedFrame next() throws IOException {
        int n = readFully(header);
        if (n == 0) {
            return null;
        }
        if (n < header.length) {
            throw new EOFException("frame " + index + ": truncated length field (" + n + " bytes)");
        }
        int length = ArchiveFormat.decodeLength(header);
        if (length < 0) {
            throw new IOException("frame " + index + ": negative length " + length);
        }
        if (length > maxFrameLength) {
            throw new IOException("frame " + index + ": length " + length + " exceeds limit " + maxFrameLength);
        }
        byte[] data = readPayload(length);
        index++;
        return CompressedFrame.wrap(data);
    }

    private byte[] readPayload(int length) throws IOException {
        byte[] data = new byte[Math.min(length, READ_CHUNK)];
        int got = 0;
        while (got < length) {
            if (got == data.length) {
                data = Arrays.copyOf(data, (int) Math.min(length, (long) data.length * 2));
            }
            int r = in.read(data, got, data.length - got);
            if (r < 0) {
                throw new EOFException("frame " + index + ": expected " + length + " bytes, got " + got);
            }
            got += r;
        }
        return data;
    }

    public static List<CompressedFrame> readAll(InputStream in) throws IOException {
        List<CompressedFrame> frames = new ArrayList<>();
        ArchiveReader reader = new ArchiveReader(in);
        CompressedFrame f;
        while ((f = reader.next()) != null) {
            frames.add(f);
        }
        return frames;
    }

    private int readFully(byte[] buf) throws IOException {
        int len = 0;
        while (len < buf.length) {
            int r = in.read(buf, len, buf.length - len);
            if (r < 0)
                break;
            len += r;
        }
        return len;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
