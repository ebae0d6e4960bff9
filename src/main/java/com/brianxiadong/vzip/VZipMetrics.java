package com.brianxiadong.vzip;

public interface VZipMetrics {
    void recordFrame(long latencyNanos, long bytesIn, long bytesOut);
    void recordFrameFailure();
    void recordArchiveWrite(long durationNanos, long bytesWritten);
}
