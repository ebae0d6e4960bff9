package com.brianxiadong.vzip;

import java.util.ArrayList;
import java.util.List;

/**
 * 条带分配：位置 i 归 worker i mod W
 * 相邻帧落在不同 worker 上，单帧耗时差异被摊平
 */
public class StripedPartitionStrategy implements PartitionStrategy {
    public static final String TYPE = "striped";

    @Override
    public List<Integer> assign(int worker, int itemCount, int workerCount) {
        PartitionStrategy.checkArguments(worker, itemCount, workerCount);
        List<Integer> res = new ArrayList<>();
        for (int i = worker; i < itemCount; i += workerCount) {
            res.add(i);
        }
        return res;
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
