package com.brianxiadong.vzip;

public class NoopVZipMetrics implements VZipMetrics {
    @Override
    public void recordFrame(long latencyNanos, long bytesIn, long bytesOut) {}

    @Override
    public void recordFrameFailure() {}

    @Override
    public void recordArchiveWrite(long durationNanos, long bytesWritten) {}
}
