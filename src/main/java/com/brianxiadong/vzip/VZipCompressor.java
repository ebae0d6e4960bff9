package com.brianxiadong.vzip;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 并行帧压缩主流程
 * 固定数量的 worker 按分区策略压缩各帧，全部结束后按原始顺序写出归档
 */
public class VZipCompressor {
    private final VZipConfig config;
    private final CompressionStrategy codec;
    private final PartitionStrategy partitioner;
    private final VZipMetrics metrics;
    private final ArchiveWriter writer = new ArchiveWriter();

    public VZipCompressor(VZipConfig config) {
        this(config, new MicrometerVZipMetrics("default"));
    }

    public VZipCompressor(VZipConfig config, VZipMetrics metrics) {
        this.config = config.validate();
        this.codec = config.createCompressionStrategy();
        this.partitioner = config.createPartitionStrategy();
        this.metrics = metrics;
    }

    /**
     * 压缩到文件
     * 先写入同目录下的临时文件，成功后再移动到目标位置，失败时不留下归档
     */
    public CompressionSummary compress(FrameSource source, Path archive) throws IOException {
        Path parent = archive.toAbsolutePath().getParent();
        Path tmp;
        try {
            tmp = Files.createTempFile(parent, archive.getFileName().toString() + ".", ".tmp");
        } catch (IOException e) {
            throw new VZipException(VZipException.Kind.SETUP, "cannot create archive " + archive, e);
        }

        CompressionSummary summary;
        try {
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(tmp))) {
                summary = compress(source, out);
            }
            moveIntoPlace(tmp, archive);
        } catch (IOException | RuntimeException | Error e) {
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException suppressed) {
                e.addSuppressed(suppressed);
            }
            throw e;
        }
        return summary;
    }

    /**
     * 压缩到输出流；出错时流中的内容不可用
     */
    public CompressionSummary compress(FrameSource source, OutputStream out) throws IOException {
        long start = System.nanoTime();
        int frameCount = source.size();
        int workerCount = config.getWorkers();

        List<List<Integer>> assignments = partitioner.partition(frameCount, workerCount);
        ResultsTable results = new ResultsTable(frameCount);
        CompressionCounters counters = new CompressionCounters();

        List<FrameWorker> workers = new ArrayList<>(workerCount);
        try {
            for (int w = 0; w < workerCount; w++) {
                workers.add(new FrameWorker(w, assignments.get(w), source, codec, results, counters, metrics,
                        allocateBuffer(config.getBufferSize()), allocateBuffer(config.getBufferSize())));
            }
        } catch (OutOfMemoryError e) {
            throw new VZipException(VZipException.Kind.RESOURCE_EXHAUSTED,
                    "cannot allocate buffers for " + workerCount + " workers of " + config.getBufferSize() + " bytes", e);
        }

        WorkerStats[] stats = runWorkers(workers);
        // 释放各 worker 的缓冲区
        workers.clear();

        long writeStart = System.nanoTime();
        long archiveBytes = writer.write(results, out);
        metrics.recordArchiveWrite(System.nanoTime() - writeStart, archiveBytes);

        return new CompressionSummary(frameCount, counters.getTotalIn(), counters.getTotalOut(), archiveBytes,
                System.nanoTime() - start, Arrays.asList(stats));
    }

    byte[] allocateBuffer(int size) {
        return new byte[size];
    }

    /**
     * 启动全部 worker 并等待结束；任一 worker 失败即取消其余 worker
     */
    private WorkerStats[] runWorkers(List<FrameWorker> workers) throws VZipException {
        WorkerStats[] stats = new WorkerStats[workers.size()];
        ExecutorService pool = newWorkerPool(workers.size());
        try {
            CompletionService<WorkerStats> cs = new ExecutorCompletionService<>(pool);
            for (FrameWorker w : workers) {
                cs.submit(w);
            }
            for (int i = 0; i < workers.size(); i++) {
                Future<WorkerStats> f = cs.take();
                WorkerStats s = f.get();
                stats[s.getWorkerId()] = s;
            }
            return stats;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VZipException(VZipException.Kind.INTERRUPTED, "interrupted while waiting for workers", e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } finally {
            shutdown(pool);
        }
    }

    private static VZipException unwrap(Throwable cause) {
        if (cause instanceof VZipException) {
            return (VZipException) cause;
        }
        if (cause instanceof OutOfMemoryError) {
            return new VZipException(VZipException.Kind.RESOURCE_EXHAUSTED, "worker ran out of memory", cause);
        }
        if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new VZipException(VZipException.Kind.FRAME_IO, "worker failed", cause);
    }

    private static ExecutorService newWorkerPool(int size) {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newFixedThreadPool(size, r -> {
            Thread t = new Thread(r, "VZip-Worker-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
    }

    private static void shutdown(ExecutorService pool) {
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(1, TimeUnit.MINUTES)) {
                System.err.println("VZip workers did not terminate within 1 minute");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void moveIntoPlace(Path tmp, Path archive) throws IOException {
        try {
            Files.move(tmp, archive, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, archive, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    public CompressionStrategy getCodec() {
        return codec;
    }
}
