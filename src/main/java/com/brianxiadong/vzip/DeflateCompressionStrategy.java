package com.brianxiadong.vzip;

import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * zlib (deflate) 编解码器，固定使用最高压缩级别
 * 每次调用使用独立的 Deflater/Inflater，实例本身可被多个线程共享
 */
public class DeflateCompressionStrategy implements CompressionStrategy {
    public static final String TYPE = "DEFLATE";

    private final int level;

    public DeflateCompressionStrategy() {
        this(Deflater.BEST_COMPRESSION);
    }

    public DeflateCompressionStrategy(int level) {
        if (level < Deflater.NO_COMPRESSION || level > Deflater.BEST_COMPRESSION) {
            throw new IllegalArgumentException("deflate level out of range: " + level);
        }
        this.level = level;
    }

    @Override
    public int compress(byte[] input, int inputLength, byte[] output) throws CodecException {
        Deflater deflater = new Deflater(level);
        try {
            deflater.setInput(input, 0, inputLength);
            deflater.finish();
            int len = 0;
            while (!deflater.finished() && len < output.length) {
                len += deflater.deflate(output, len, output.length - len);
            }
            // 输出缓冲区写满但流未结束
            if (!deflater.finished()) {
                throw new CodecException(TYPE, "stream not finished, output buffer of "
                        + output.length + " bytes too small for " + inputLength + " input bytes");
            }
            return len;
        } finally {
            deflater.end();
        }
    }

    @Override
    public int decompress(byte[] input, int inputLength, byte[] output) throws CodecException {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(input, 0, inputLength);
            int len = 0;
            byte[] probe = new byte[1];
            while (!inflater.finished()) {
                int n;
                if (len < output.length) {
                    n = inflater.inflate(output, len, output.length - len);
                    len += n;
                } else {
                    // 输出已满，只允许剩余的流尾校验
                    n = inflater.inflate(probe);
                    if (n > 0) {
                        throw new CodecException(TYPE, "decompressed data exceeds " + output.length + " bytes");
                    }
                }
                if (n == 0 && !inflater.finished() && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new CodecException(TYPE, "truncated stream");
                }
            }
            return len;
        } catch (DataFormatException e) {
            throw new CodecException(TYPE, "corrupt stream", e);
        } finally {
            inflater.end();
        }
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public int getLevel() {
        return level;
    }
}
