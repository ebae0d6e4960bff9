package com.brianxiadong.vzip;

import org.junit.Assert;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public class PartitionStrategyTest {

    @Test
    public void testStripedAssignment() {
        StripedPartitionStrategy s = new StripedPartitionStrategy();
        Assert.assertEquals(Arrays.asList(0, 3, 6, 9), s.assign(0, 10, 3));
        Assert.assertEquals(Arrays.asList(1, 4, 7), s.assign(1, 10, 3));
        Assert.assertEquals(Arrays.asList(2, 5, 8), s.assign(2, 10, 3));
    }

    @Test
    public void testStripedCoversAllExactlyOnce() {
        assertCompletePartition(new StripedPartitionStrategy());
    }

    @Test
    public void testContiguousCoversAllExactlyOnce() {
        assertCompletePartition(new ContiguousPartitionStrategy());
    }

    @Test
    public void testContiguousRanges() {
        ContiguousPartitionStrategy s = new ContiguousPartitionStrategy();
        List<List<Integer>> parts = s.partition(7, 3);
        Assert.assertEquals(Arrays.asList(0, 1, 2), parts.get(0));
        Assert.assertEquals(Arrays.asList(3, 4, 5), parts.get(1));
        Assert.assertEquals(Collections.singletonList(6), parts.get(2));
    }

    @Test
    public void testFewerItemsThanWorkers() {
        List<List<Integer>> parts = new StripedPartitionStrategy().partition(1, 4);
        Assert.assertEquals(4, parts.size());
        Assert.assertEquals(Collections.singletonList(0), parts.get(0));
        for (int w = 1; w < 4; w++) {
            Assert.assertTrue(parts.get(w).isEmpty());
        }
    }

    @Test
    public void testEmptyInput() {
        for (List<Integer> p : new StripedPartitionStrategy().partition(0, 5)) {
            Assert.assertTrue(p.isEmpty());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroWorkersRejected() {
        new StripedPartitionStrategy().partition(3, 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeItemCountRejected() {
        new StripedPartitionStrategy().assign(0, -1, 2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWorkerOutOfRangeRejected() {
        new ContiguousPartitionStrategy().assign(2, 10, 2);
    }

    @Test
    public void testForName() {
        Assert.assertTrue(PartitionStrategy.forName("Striped") instanceof StripedPartitionStrategy);
        Assert.assertTrue(PartitionStrategy.forName("contiguous") instanceof ContiguousPartitionStrategy);
        try {
            PartitionStrategy.forName("random");
            Assert.fail("unknown strategy accepted");
        } catch (IllegalArgumentException expected) {
            Assert.assertTrue(expected.getMessage().contains("random"));
        }
    }

    private static void assertCompletePartition(PartitionStrategy s) {
        for (int w = 1; w <= 8; w++) {
            for (int n = 0; n <= 50; n++) {
                int[] seen = new int[n];
                List<List<Integer>> parts = s.partition(n, w);
                Assert.assertEquals(w, parts.size());
                for (List<Integer> p : parts) {
                    int last = -1;
                    for (int pos : p) {
                        Assert.assertTrue("position out of range", pos >= 0 && pos < n);
                        Assert.assertTrue("positions not ascending", pos > last);
                        last = pos;
                        seen[pos]++;
                    }
                }
                for (int i = 0; i < n; i++) {
                    Assert.assertEquals(s.getType() + " n=" + n + " w=" + w + " pos=" + i, 1, seen[i]);
                }
            }
        }
    }
}
