package com.brianxiadong.vzip;

import java.util.Collections;
import java.util.List;

/**
 * 一次压缩任务的结果汇总
 */
public class CompressionSummary {
    private final int frameCount;
    private final long totalIn;
    private final long totalOut;
    private final long archiveBytes;
    private final long elapsedNanos;
    private final List<WorkerStats> workerStats;

    public CompressionSummary(int frameCount, long totalIn, long totalOut, long archiveBytes,
            long elapsedNanos, List<WorkerStats> workerStats) {
        this.frameCount = frameCount;
        this.totalIn = totalIn;
        this.totalOut = totalOut;
        this.archiveBytes = archiveBytes;
        this.elapsedNanos = elapsedNanos;
        this.workerStats = Collections.unmodifiableList(workerStats);
    }

    public int getFrameCount() {
        return frameCount;
    }

    public long getTotalIn() {
        return totalIn;
    }

    public long getTotalOut() {
        return totalOut;
    }

    public long getArchiveBytes() {
        return archiveBytes;
    }

    public long getElapsedNanos() {
        return elapsedNanos;
    }

    public double getElapsedSeconds() {
        return elapsedNanos / 1e9;
    }

    public List<WorkerStats> getWorkerStats() {
        return workerStats;
    }

    /**
     * 压缩率 (totalIn - totalOut) / totalIn，没有输入时为 0
     */
    public double getCompressionRate() {
        if (totalIn == 0)
            return 0.0;
        return (totalIn - totalOut) * 1.0 / totalIn;
    }

    @Override
    public String toString() {
        return String.format("CompressionSummary{frames=%d, in=%d, out=%d, rate=%.2f%%, time=%.2fs}",
                frameCount, totalIn, totalOut, getCompressionRate() * 100, getElapsedSeconds());
    }
}
