package com.brianxiadong.vzip;

/**
 * 单个 worker 完成后的局部统计
 */
public final class WorkerStats {
    private final int workerId;
    private final int frames;
    private final long bytesIn;
    private final long bytesOut;

    public WorkerStats(int workerId, int frames, long bytesIn, long bytesOut) {
        this.workerId = workerId;
        this.frames = frames;
        this.bytesIn = bytesIn;
        this.bytesOut = bytesOut;
    }

    public int getWorkerId() {
        return workerId;
    }

    public int getFrames() {
        return frames;
    }

    public long getBytesIn() {
        return bytesIn;
    }

    public long getBytesOut() {
        return bytesOut;
    }

    @Override
    public String toString() {
        return "WorkerStats{worker=" + workerId + ", frames=" + frames
                + ", in=" + bytesIn + ", out=" + bytesOut + "}";
    }
}
