package com.brianxiadong.vzip;

/**
 * 压缩任务配置
 * 默认值可通过 JVM 系统属性覆盖，所有取值在任何 worker 启动前校验
 */
public class VZipConfig {
    public static final String WORKERS_PROPERTY = "vzip.workers";
    public static final String BUFFER_SIZE_PROPERTY = "vzip.buffer.size";
    public static final String CODEC_PROPERTY = "vzip.codec";
    public static final String PARTITION_PROPERTY = "vzip.partition";
    public static final String FRAME_SUFFIX_PROPERTY = "vzip.frame.suffix";
    public static final String OUTPUT_PROPERTY = "vzip.output";

    public static final int DEFAULT_WORKERS = 19;
    public static final int MAX_WORKERS = 1024;
    public static final int DEFAULT_BUFFER_SIZE = 1024 * 1024; // 1MB
    public static final int MAX_BUFFER_SIZE = Integer.MAX_VALUE - 8;
    public static final String DEFAULT_CODEC = DeflateCompressionStrategy.TYPE;
    public static final String DEFAULT_PARTITION = StripedPartitionStrategy.TYPE;
    public static final String DEFAULT_FRAME_SUFFIX = ".ppm";
    public static final String DEFAULT_OUTPUT = "video" + ArchiveFormat.DEFAULT_EXTENSION;

    private final int workers;
    private final int bufferSize;
    private final String codec;
    private final String partition;
    private final String frameSuffix;
    private final String output;

    private VZipConfig(Builder b) {
        this.workers = b.workers;
        this.bufferSize = b.bufferSize;
        this.codec = b.codec;
        this.partition = b.partition;
        this.frameSuffix = b.frameSuffix;
        this.output = b.output;
    }

    public static VZipConfig defaults() {
        return builder().build();
    }

    public static VZipConfig fromSystemProperties() {
        return builderFromSystemProperties().build();
    }

    public static Builder builderFromSystemProperties() {
        Builder b = builder();
        b.workers(intProperty(WORKERS_PROPERTY, DEFAULT_WORKERS));
        b.bufferSize(intProperty(BUFFER_SIZE_PROPERTY, DEFAULT_BUFFER_SIZE));
        b.codec(System.getProperty(CODEC_PROPERTY, DEFAULT_CODEC));
        b.partition(System.getProperty(PARTITION_PROPERTY, DEFAULT_PARTITION));
        b.frameSuffix(System.getProperty(FRAME_SUFFIX_PROPERTY, DEFAULT_FRAME_SUFFIX));
        b.output(System.getProperty(OUTPUT_PROPERTY, DEFAULT_OUTPUT));
        return b;
    }

    public static Builder builder() {
        return new Builder();
    }

    private static int intProperty(String name, int def) {
        String v = System.getProperty(name);
        if (v == null || v.trim().isEmpty())
            return def;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not an integer: " + v, e);
        }
    }

    /**
     * 校验配置，非法时抛出 IllegalArgumentException
     */
    public VZipConfig validate() {
        if (workers < 1 || workers > MAX_WORKERS) {
            throw new IllegalArgumentException("workers must be in [1, " + MAX_WORKERS + "]: " + workers);
        }
        if (bufferSize < 1 || bufferSize > MAX_BUFFER_SIZE) {
            throw new IllegalArgumentException("buffer size must be in [1, " + MAX_BUFFER_SIZE + "]: " + bufferSize);
        }
        if (frameSuffix == null || frameSuffix.isEmpty()) {
            throw new IllegalArgumentException("frame suffix cannot be empty");
        }
        if (output == null || output.trim().isEmpty()) {
            throw new IllegalArgumentException("output cannot be empty");
        }
        createCompressionStrategy();
        createPartitionStrategy();
        return this;
    }

    public CompressionStrategy createCompressionStrategy() {
        return CompressionStrategies.forName(codec);
    }

    public PartitionStrategy createPartitionStrategy() {
        return PartitionStrategy.forName(partition);
    }

    public int getWorkers() {
        return workers;
    }

    public int getBufferSize() {
        return bufferSize;
    }

    public String getCodec() {
        return codec;
    }

    public String getPartition() {
        return partition;
    }

    public String getFrameSuffix() {
        return frameSuffix;
    }

    public String getOutput() {
        return output;
    }

    @Override
    public String toString() {
        return "VZipConfig{workers=" + workers + ", bufferSize=" + bufferSize + ", codec=" + codec
                + ", partition=" + partition + ", frameSuffix=" + frameSuffix + ", output=" + output + "}";
    }

    public static class Builder {
        private int workers = DEFAULT_WORKERS;
        private int bufferSize = DEFAULT_BUFFER_SIZE;
        private String codec = DEFAULT_CODEC;
        private String partition = DEFAULT_PARTITION;
        private String frameSuffix = DEFAULT_FRAME_SUFFIX;
        private String output = DEFAULT_OUTPUT;

        public Builder workers(int workers) {
            this.workers = workers;
            return this;
        }

        public Builder bufferSize(int bufferSize) {
            this.bufferSize = bufferSize;
            return this;
        }

        public Builder codec(String codec) {
            this.codec = codec;
            return this;
        }

        public Builder partition(String partition) {
            this.partition = partition;
            return this;
        }

        public Builder frameSuffix(String frameSuffix) {
            this.frameSuffix = frameSuffix;
            return this;
        }

        public Builder output(String output) {
            this.output = output;
            return this;
        }

        public VZipConfig build() {
            return new VZipConfig(this);
        }
    }
}
