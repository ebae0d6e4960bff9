package com.brianxiadong.vzip;

import java.io.IOException;

/**
 * 已排序的帧序列，位置在并行工作开始前确定
 */
public interface FrameSource {
    int size();

    String getName(int position);

    /**
     * 读取第 position 帧，最多读满 buffer
     * @return 实际读取的字节数
     */
    int read(int position, byte[] buffer) throws IOException;
}
