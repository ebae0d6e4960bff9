package com.brianxiadong.vzip;

import java.util.ArrayList;
import java.util.List;

/**
 * 连续区间分配：每个 worker 取 ceil(N/W) 个相邻位置
 */
public class ContiguousPartitionStrategy implements PartitionStrategy {
    public static final String TYPE = "contiguous";

    @Override
    public List<Integer> assign(int worker, int itemCount, int workerCount) {
        PartitionStrategy.checkArguments(worker, itemCount, workerCount);
        int chunk = (itemCount + workerCount - 1) / workerCount;
        long start = (long) worker * chunk;
        int end = (int) Math.min(itemCount, start + chunk);
        List<Integer> res = new ArrayList<>();
        for (int i = (int) Math.min(start, itemCount); i < end; i++) {
            res.add(i);
        }
        return res;
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
