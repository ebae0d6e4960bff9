package com.brianxiadong.vzip;

/**
 * 单帧压缩编解码器
 * 一次调用完成整帧压缩，输出必须完整写入给定缓冲区
 */
public interface CompressionStrategy {
    /**
     * 压缩 input[0, inputLength) 到 output
     * @return 压缩后字节数
     */
    int compress(byte[] input, int inputLength, byte[] output) throws CodecException;

    /**
     * 解压 input[0, inputLength) 到 output
     * @return 解压后字节数
     */
    int decompress(byte[] input, int inputLength, byte[] output) throws CodecException;

    String getType();

    int getLevel();
}
