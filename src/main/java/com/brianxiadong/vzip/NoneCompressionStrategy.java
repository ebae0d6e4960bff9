package com.brianxiadong.vzip;

public class NoneCompressionStrategy implements CompressionStrategy {
    public static final String TYPE = "NONE";

    @Override
    public int compress(byte[] input, int inputLength, byte[] output) throws CodecException {
        return copy(input, inputLength, output);
    }

    @Override
    public int decompress(byte[] input, int inputLength, byte[] output) throws CodecException {
        return copy(input, inputLength, output);
    }

    private static int copy(byte[] input, int inputLength, byte[] output) throws CodecException {
        if (inputLength > output.length) {
            throw new CodecException(TYPE, inputLength + " bytes do not fit in " + output.length);
        }
        System.arraycopy(input, 0, output, 0, inputLength);
        return inputLength;
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public int getLevel() {
        return 0;
    }
}
