package com.brianxiadong.vzip;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.junit.Assert;
import org.junit.Test;

import java.io.ByteArrayOutputStream;

public class MetricsTest {

    @Test
    public void testSingletonRegistry() {
        MeterRegistry a = MetricsRegistry.get();
        MeterRegistry b = MetricsRegistry.get();
        Assert.assertSame(a, b);
    }

    @Test
    public void testScrapeContainsRecordedMeters() {
        new MicrometerVZipMetrics("scrape-test").recordArchiveWrite(2_000_000L, 4096);
        String text = MetricsRegistry.scrape();
        Assert.assertTrue(text.contains("vzip_archive_bytes"));
        Assert.assertTrue(text.contains("name=\"scrape-test\""));
    }

    @Test
    public void testFrameMetricsRecorded() throws Exception {
        VZipConfig config = VZipConfig.builder().workers(3).bufferSize(16 * 1024).build();
        VZipCompressor c = new VZipCompressor(config, new MicrometerVZipMetrics("metrics-test"));
        CompressionSummary summary = c.compress(new InMemoryFrameSource(TestFrames.ppmFrames(8, 2000)),
                new ByteArrayOutputStream());

        MeterRegistry r = MetricsRegistry.get();
        Counter frames = r.find("vzip.frames.compressed").tag("name", "metrics-test").counter();
        Timer latency = r.find("vzip.frame.compress.latency").tag("name", "metrics-test").timer();
        DistributionSummary in = r.find("vzip.frame.bytes.in").tag("name", "metrics-test").summary();
        DistributionSummary out = r.find("vzip.frame.bytes.out").tag("name", "metrics-test").summary();
        Timer write = r.find("vzip.archive.write.latency").tag("name", "metrics-test").timer();
        Assert.assertNotNull(frames);
        Assert.assertNotNull(latency);
        Assert.assertNotNull(write);
        Assert.assertEquals(8.0, frames.count(), 0.0);
        Assert.assertEquals(8, latency.count());
        Assert.assertEquals(summary.getTotalIn(), in.totalAmount(), 0.0);
        Assert.assertEquals(summary.getTotalOut(), out.totalAmount(), 0.0);
        Assert.assertEquals(1, write.count());
    }

    @Test
    public void testFailureCounter() throws Exception {
        VZipConfig config = VZipConfig.builder().workers(2).bufferSize(4096).build();
        VZipCompressor c = new VZipCompressor(config, new MicrometerVZipMetrics("failure-test"));
        try {
            c.compress(new InMemoryFrameSource(TestFrames.ppmFrames(4, 100)).failAt(3), new ByteArrayOutputStream());
            Assert.fail("read failure ignored");
        } catch (VZipException expected) {
            // 预期
        }
        Counter failures = MetricsRegistry.get().find("vzip.frame.failures").tag("name", "failure-test").counter();
        Assert.assertNotNull(failures);
        Assert.assertTrue(failures.count() >= 1.0);
    }
}
