package com.brianxiadong.vzip;

import net.jpountz.lz4.LZ4Compressor;
import net.jpountz.lz4.LZ4Exception;
import net.jpountz.lz4.LZ4Factory;
import net.jpountz.lz4.LZ4SafeDecompressor;

public class LZ4CompressionStrategy implements CompressionStrategy {
    public static final String TYPE = "LZ4";
    // LZ4 HC 最高级别
    public static final int MAX_LEVEL = 17;

    private final LZ4Factory factory = LZ4Factory.fastestInstance();
    private final LZ4Compressor compressor = factory.highCompressor(MAX_LEVEL);
    private final LZ4SafeDecompressor decompressor = factory.safeDecompressor();

    @Override
    public int compress(byte[] input, int inputLength, byte[] output) throws CodecException {
        try {
            return compressor.compress(input, 0, inputLength, output, 0, output.length);
        } catch (LZ4Exception e) {
            throw new CodecException(TYPE, "output buffer of " + output.length
                    + " bytes too small for " + inputLength + " input bytes", e);
        }
    }

    @Override
    public int decompress(byte[] input, int inputLength, byte[] output) throws CodecException {
        try {
            return decompressor.decompress(input, 0, inputLength, output, 0, output.length);
        } catch (LZ4Exception e) {
            throw new CodecException(TYPE, "corrupt or oversized block", e);
        }
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public int getLevel() {
        return MAX_LEVEL;
    }
}
