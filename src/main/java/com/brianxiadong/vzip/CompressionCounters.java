package com.brianxiadong.vzip;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 所有 worker 共享的累计计数器
 * 两个计数器各自原子更新，相互之间不保证顺序
 */
public class CompressionCounters {
    private final AtomicLong totalIn = new AtomicLong();
    private final AtomicLong totalOut = new AtomicLong();

    public void addIn(long bytes) {
        totalIn.addAndGet(bytes);
    }

    public void addOut(long bytes) {
        totalOut.addAndGet(bytes);
    }

    public long getTotalIn() {
        return totalIn.get();
    }

    public long getTotalOut() {
        return totalOut.get();
    }
}
