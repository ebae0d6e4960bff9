package com.brianxiadong.vzip;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * 压缩 worker
 * 顺序处理分配给自己的帧位置，输入/输出缓冲区归本 worker 独占并在各帧之间复用
 */
class FrameWorker implements Callable<WorkerStats> {
    private final int workerId;
    private final List<Integer> positions;
    private final FrameSource source;
    private final CompressionStrategy codec;
    private final ResultsTable results;
    private final CompressionCounters counters;
    private final VZipMetrics metrics;
    private final byte[] inputBuffer;
    private final byte[] outputBuffer;

    FrameWorker(int workerId, List<Integer> positions, FrameSource source, CompressionStrategy codec,
            ResultsTable results, CompressionCounters counters, VZipMetrics metrics,
            byte[] inputBuffer, byte[] outputBuffer) {
        this.workerId = workerId;
        this.positions = positions;
        this.source = source;
        this.codec = codec;
        this.results = results;
        this.counters = counters;
        this.metrics = metrics;
        this.inputBuffer = inputBuffer;
        this.outputBuffer = outputBuffer;
    }

    @Override
    public WorkerStats call() throws VZipException {
        int frames = 0;
        long in = 0;
        long out = 0;
        for (int position : positions) {
            if (Thread.currentThread().isInterrupted()) {
                throw new VZipException(VZipException.Kind.INTERRUPTED, position,
                        "worker " + workerId + " interrupted before frame " + position, null);
            }
            long start = System.nanoTime();

            int read;
            try {
                read = source.read(position, inputBuffer);
            } catch (IOException e) {
                metrics.recordFrameFailure();
                throw new VZipException(VZipException.Kind.FRAME_IO, position,
                        "cannot read frame " + position + " (" + source.getName(position) + ")", e);
            }
            counters.addIn(read);

            int compressed;
            try {
                compressed = codec.compress(inputBuffer, read, outputBuffer);
            } catch (CodecException e) {
                metrics.recordFrameFailure();
                throw new VZipException(VZipException.Kind.CODEC, position,
                        "cannot compress frame " + position + " (" + source.getName(position) + ")", e);
            }

            results.fill(position, CompressedFrame.copyOf(outputBuffer, compressed));
            counters.addOut(compressed);

            metrics.recordFrame(System.nanoTime() - start, read, compressed);
            frames++;
            in += read;
            out += compressed;
        }
        return new WorkerStats(workerId, frames, in, out);
    }
}
