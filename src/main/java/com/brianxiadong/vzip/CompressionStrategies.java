package com.brianxiadong.vzip;

import java.util.Locale;

/**
 * 按名称创建编解码器
 */
public final class CompressionStrategies {

    private CompressionStrategies() {
    }

    public static CompressionStrategy forName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("codec name cannot be null");
        }
        switch (name.trim().toUpperCase(Locale.ROOT)) {
            case DeflateCompressionStrategy.TYPE:
            case "ZLIB":
                return new DeflateCompressionStrategy();
            case LZ4CompressionStrategy.TYPE:
                return new LZ4CompressionStrategy();
            case NoneCompressionStrategy.TYPE:
                return new NoneCompressionStrategy();
            default:
                throw new IllegalArgumentException("unknown codec: " + name);
        }
    }
}
