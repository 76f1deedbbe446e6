package com.offlinemap.worker;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;

/**
 * Simulates the tile CDN for demos and offline tests.
 *
 * Every URL yields a small fake PNG payload unless {@code failWhen} matches it,
 * in which case the fetch fails like an HTTP error would. An optional latency
 * makes batches overlap the way real network calls do.
 */
public class SimulatedTileServer implements TileFetcher {
    private static final byte[] PNG_MAGIC = {(byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1a, '\n'};

    private final Predicate<String> failWhen;
    private final long latencyMillis;
    private final AtomicInteger served = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();

    public SimulatedTileServer() {
        this(url -> false, 0);
    }

    public SimulatedTileServer(Predicate<String> failWhen, long latencyMillis) {
        this.failWhen = failWhen;
        this.latencyMillis = latencyMillis;
    }

    @Override
    public byte[] fetch(String url) throws IOException {
        if (latencyMillis > 0) {
            try {
                Thread.sleep(latencyMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while fetching " + url, e);
            }
        }
        if (failWhen.test(url)) {
            failed.incrementAndGet();
            throw new IOException("HTTP 503 for " + url);
        }
        served.incrementAndGet();
        byte[] body = url.getBytes(StandardCharsets.UTF_8);
        byte[] payload = new byte[PNG_MAGIC.length + body.length];
        System.arraycopy(PNG_MAGIC, 0, payload, 0, PNG_MAGIC.length);
        System.arraycopy(body, 0, payload, PNG_MAGIC.length, body.length);
        return payload;
    }

    public int getServed() { return served.get(); }
    public int getFailed() { return failed.get(); }

    public double getFailureRate() {
        int total = served.get() + failed.get();
        return total == 0 ? 0 : (double) failed.get() / total * 100;
    }
}
