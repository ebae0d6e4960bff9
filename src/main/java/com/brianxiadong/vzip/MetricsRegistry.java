package com.brianxiadong.vzip;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;

/**
 * 进程内共享的 Prometheus 指标注册表
 * 所有压缩任务的 meter 都注册在这里，以 name 标签区分不同任务
 */
public final class MetricsRegistry {
    private static final PrometheusMeterRegistry REGISTRY = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

    private MetricsRegistry() {
    }

    public static MeterRegistry get() {
        return REGISTRY;
    }

    /**
     * @return Prometheus 文本格式的当前指标快照
     */
    public static String scrape() {
        return REGISTRY.scrape();
    }
}
