package com.brianxiadong.vzip;

import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * 按原始位置索引的压缩结果表，大小固定为 N
 * 每个槽位只由其所属 worker 写入一次，join 之后才读取
 */
public class ResultsTable {
    private final AtomicReferenceArray<CompressedFrame> slots;

    public ResultsTable(int size) {
        if (size < 0) {
            throw new IllegalArgumentException("size cannot be negative: " + size);
        }
        this.slots = new AtomicReferenceArray<>(size);
    }

    public void fill(int position, CompressedFrame frame) {
        if (frame == null) {
            throw new IllegalArgumentException("frame cannot be null");
        }
        if (!slots.compareAndSet(position, null, frame)) {
            throw new IllegalStateException("slot " + position + " already filled");
        }
    }

    public CompressedFrame get(int position) {
        CompressedFrame frame = slots.get(position);
        if (frame == null) {
            throw new IllegalStateException("slot " + position + " is empty");
        }
        return frame;
    }

    public boolean isFilled(int position) {
        return slots.get(position) != null;
    }

    public int filledCount() {
        int c = 0;
        for (int i = 0; i < slots.length(); i++) {
            if (slots.get(i) != null)
                c++;
        }
        return c;
    }

    public int size() {
        return slots.length();
    }
}
