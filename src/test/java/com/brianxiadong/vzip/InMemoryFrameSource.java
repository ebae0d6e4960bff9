package com.brianxiadong.vzip;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 测试用帧源：内存中的帧，可配置读取延迟与失败位置
 */
public class InMemoryFrameSource implements FrameSource {

    public interface Delay {
        long millisFor(int position);
    }

    private final List<byte[]> frames;
    private final Delay delay;
    private final Set<Integer> failing = new HashSet<>();
    private final AtomicInteger reads = new AtomicInteger();

    public InMemoryFrameSource(List<byte[]> frames) {
        this(frames, p -> 0L);
    }

    public InMemoryFrameSource(List<byte[]> frames, Delay delay) {
        this.frames = new ArrayList<>(frames);
        this.delay = delay;
    }

    public InMemoryFrameSource failAt(int position) {
        failing.add(position);
        return this;
    }

    @Override
    public int size() {
        return frames.size();
    }

    @Override
    public String getName(int position) {
        return String.format("frame_%03d.ppm", position);
    }

    @Override
    public int read(int position, byte[] buffer) throws IOException {
        reads.incrementAndGet();
        long ms = delay.millisFor(position);
        if (ms > 0) {
            try {
                Thread.sleep(ms);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("interrupted", e);
            }
        }
        if (failing.contains(position)) {
            throw new IOException("simulated read failure at " + position);
        }
        byte[] f = frames.get(position);
        int n = Math.min(f.length, buffer.length);
        System.arraycopy(f, 0, buffer, 0, n);
        return n;
    }

    public int getReadCount() {
        return reads.get();
    }
}
