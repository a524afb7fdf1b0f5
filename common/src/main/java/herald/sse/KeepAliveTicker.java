package herald.sse;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import herald.subscription.SubscriptionRegistry;

/**
 * Periodically publishes a comment frame to every subscriber so that idle connections are not dropped by clients or proxies.
 */
public class KeepAliveTicker {

    private static final Logger log = LoggerFactory.getLogger(KeepAliveTicker.class);

    private final SubscriptionRegistry registry;
    private final long interval;
    private final TimeUnit unit;
    private final long stopTimeoutMillis;
    private ScheduledExecutorService executorService;
    private ScheduledFuture<?> ping;

    public KeepAliveTicker(SubscriptionRegistry registry, long interval, TimeUnit unit, long stopTimeoutMillis) {
        if (interval <= 0) {
            throw new IllegalArgumentException("ping interval must be positive, got " + interval);
        }
        this.registry = registry;
        this.interval = interval;
        this.unit = unit;
        this.stopTimeoutMillis = stopTimeoutMillis;
    }

    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        executorService = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder().setNameFormat("sse-keep-alive-%d").setDaemon(true).build());
        ping = executorService.scheduleAtFixedRate(this::tick, interval, interval, unit);
        log.info("Keep-alive started, sending ping every {} {}", interval, unit.name().toLowerCase());
    }

    /**
     * Cancels the schedule and waits for a tick that is already running to finish.
     */
    public synchronized void stop() {
        if (executorService == null) {
            return;
        }
        ping.cancel(false);
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(stopTimeoutMillis, TimeUnit.MILLISECONDS)) {
                log.warn("Keep-alive did not stop within {}ms", stopTimeoutMillis);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            if (!executorService.isTerminated()) {
                executorService.shutdownNow();
            }
            executorService = null;
            ping = null;
        }
        log.info("Keep-alive stopped");
    }

    public synchronized boolean isRunning() {
        return executorService != null && !executorService.isShutdown();
    }

    void tick() {
        int count = registry.publish(EventFormatter.PING);
        log.trace("Sent ping to {} subscribers", count);
    }
}
