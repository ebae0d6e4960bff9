package com.brianxiadong.vzip;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

public class MicrometerVZipMetrics implements VZipMetrics {
    private final Timer frameTimer;
    private final DistributionSummary bytesIn;
    private final DistributionSummary bytesOut;
    private final Counter framesCompressed;
    private final Counter frameFailures;
    private final Timer archiveWriteTimer;
    private final DistributionSummary archiveBytes;

    public MicrometerVZipMetrics(String name) {
        MeterRegistry registry = MetricsRegistry.get();
        this.frameTimer = Timer.builder("vzip.frame.compress.latency").tag("name", name).register(registry);
        this.bytesIn = DistributionSummary.builder("vzip.frame.bytes.in").tag("name", name).register(registry);
        this.bytesOut = DistributionSummary.builder("vzip.frame.bytes.out").tag("name", name).register(registry);
        this.framesCompressed = Counter.builder("vzip.frames.compressed").tag("name", name).register(registry);
        this.frameFailures = Counter.builder("vzip.frame.failures").tag("name", name).register(registry);
        this.archiveWriteTimer = Timer.builder("vzip.archive.write.latency").tag("name", name).register(registry);
        this.archiveBytes = DistributionSummary.builder("vzip.archive.bytes").tag("name", name).register(registry);
    }

    @Override
    public void recordFrame(long latencyNanos, long in, long out) {
        frameTimer.record(latencyNanos, TimeUnit.NANOSECONDS);
        bytesIn.record(in);
        bytesOut.record(out);
        framesCompressed.increment();
    }

    @Override
    public void recordFrameFailure() {
        frameFailures.increment();
    }

    @Override
    public void recordArchiveWrite(long durationNanos, long bytesWritten) {
        archiveWriteTimer.record(durationNanos, TimeUnit.NANOSECONDS);
        archiveBytes.record(bytesWritten);
    }
}
