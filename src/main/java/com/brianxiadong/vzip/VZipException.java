package com.brianxiadong.vzip;

import java.io.IOException;

/**
 * 压缩任务的致命错误
 * 任何一种都会终止整批任务，不会留下不完整的归档
 */
public class VZipException extends IOException {

    public enum Kind {
        /** 无法列出输入或打开输出 */
        SETUP,
        /** 无法读取某一帧 */
        FRAME_IO,
        /** 编解码器未能完整结束 */
        CODEC,
        /** 缓冲区分配失败 */
        RESOURCE_EXHAUSTED,
        /** 等待 worker 时被中断 */
        INTERRUPTED
    }

    private final Kind kind;
    private final int position;

    public VZipException(Kind kind, String message, Throwable cause) {
        this(kind, -1, message, cause);
    }

    public VZipException(Kind kind, int position, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.position = position;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * 出错帧的位置，与具体帧无关时为 -1
     */
    public int getPosition() {
        return position;
    }
}
