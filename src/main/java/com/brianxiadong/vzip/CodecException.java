package com.brianxiadong.vzip;

import java.io.IOException;

/**
 * 压缩/解压调用未能完整结束时抛出
 * 属于致命错误，不做重试
 */
public class CodecException extends IOException {
    private final String codec;

    public CodecException(String codec, String message) {
        super(codec + ": " + message);
        this.codec = codec;
    }

    public CodecException(String codec, String message, Throwable cause) {
        super(codec + ": " + message, cause);
        this.codec = codec;
    }

    public String getCodec() {
        return codec;
    }
}
