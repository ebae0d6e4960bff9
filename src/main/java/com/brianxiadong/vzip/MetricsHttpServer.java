package com.brianxiadong.vzip;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;

/**
 * 可选的 Prometheus /metrics 端点
 * 由 vzip.metrics.http.enabled / vzip.metrics.http.port 控制
 */
public class MetricsHttpServer {
    public static final String ENABLED_PROPERTY = "vzip.metrics.http.enabled";
    public static final String PORT_PROPERTY = "vzip.metrics.http.port";

    private static volatile HttpServer server;

    public static synchronized void startIfEnabled() {
        String enabled = System.getProperty(ENABLED_PROPERTY, "false");
        if (!"true".equalsIgnoreCase(enabled))
            return;
        if (server != null)
            return;
        try {
            int port = Integer.parseInt(System.getProperty(PORT_PROPERTY, "9091"));
            HttpServer s = HttpServer.create(new InetSocketAddress(port), 0);
            s.createContext("/metrics", new MetricsHandler());
            s.setExecutor(null);
            s.start();
            server = s;
        } catch (IOException e) {
            throw new UncheckedIOException("cannot start metrics endpoint", e);
        }
    }

    public static synchronized void stopIfRunning() {
        HttpServer s = server;
        if (s != null) {
            try {
                s.stop(0);
            } finally {
                server = null;
            }
        }
    }

    public static boolean isRunning() {
        return server != null;
    }

    /**
     * 只接受 GET，其余方法返回 405
     */
    static class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                    exchange.getResponseHeaders().set("Allow", "GET");
                    exchange.sendResponseHeaders(405, -1);
                    return;
                }
                byte[] data = MetricsRegistry.scrape().getBytes(StandardCharsets.UTF_8);
                exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=UTF-8");
                exchange.sendResponseHeaders(200, data.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(data);
                }
            } finally {
                exchange.close();
            }
        }
    }
}
