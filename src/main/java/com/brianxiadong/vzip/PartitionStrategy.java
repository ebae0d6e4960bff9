package com.brianxiadong.vzip;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 将 [0, itemCount) 的帧位置静态分配给 workerCount 个 worker
 * 每个位置恰好属于一个 worker
 */
public interface PartitionStrategy {
    List<Integer> assign(int worker, int itemCount, int workerCount);

    String getType();

    default List<List<Integer>> partition(int itemCount, int workerCount) {
        List<List<Integer>> res = new ArrayList<>(workerCount);
        for (int w = 0; w < workerCount; w++) {
            res.add(assign(w, itemCount, workerCount));
        }
        return res;
    }

    static PartitionStrategy forName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("partition strategy cannot be null");
        }
        String n = name.trim().toLowerCase(Locale.ROOT);
        if (StripedPartitionStrategy.TYPE.equals(n)) {
            return new StripedPartitionStrategy();
        }
        if (ContiguousPartitionStrategy.TYPE.equals(n)) {
            return new ContiguousPartitionStrategy();
        }
        throw new IllegalArgumentException("unknown partition strategy: " + name);
    }

    static void checkArguments(int worker, int itemCount, int workerCount) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be positive: " + workerCount);
        }
        if (itemCount < 0) {
            throw new IllegalArgumentException("itemCount cannot be negative: " + itemCount);
        }
        if (worker < 0 || worker >= workerCount) {
            throw new IllegalArgumentException("worker " + worker + " not in [0, " + workerCount + ")");
        }
    }
}
