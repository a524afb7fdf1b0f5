package herald.sse;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import herald.api.request.SubscribeRequest;
import herald.common.configuration.SseProperties;
import herald.subscription.DuplicateSubscriptionException;
import herald.subscription.Subscription;
import herald.subscription.SubscriptionRegistry;

/**
 * Entry point for producers and for the connection layer: sends events, admits subscribers and owns the keep-alive lifecycle.
 */
public class EventStreamService {

    private static final Logger log = LoggerFactory.getLogger(EventStreamService.class);

    private final SubscriptionRegistry registry;
    private final KeepAliveTicker ticker;
    private final long stopTimeoutMillis;
    private volatile SubscribeHook beforeSubscribe;
    private ExecutorService publisher;

    public EventStreamService(SubscriptionRegistry registry, SseProperties sseProperties) {
        this(registry, sseProperties.getPingInterval().toMillis(), TimeUnit.MILLISECONDS, sseProperties.getStopTimeout().toMillis());
    }

    public EventStreamService(SubscriptionRegistry registry, long pingInterval, TimeUnit unit, long stopTimeoutMillis) {
        this.registry = registry;
        this.ticker = new KeepAliveTicker(registry, pingInterval, unit, stopTimeoutMillis);
        this.stopTimeoutMillis = stopTimeoutMillis;
    }

    /**
     * Starts the keep-alive ticker and the asynchronous publisher. Call once the server accepts connections.
     */
    public synchronized void start() {
        log.info("Starting {}", this.getClass().getSimpleName());
        ticker.start();
        if (publisher == null) {
            publisher = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder().setNameFormat("sse-publisher-%d").setDaemon(true).build());
        }
    }

    /**
     * Stops the keep-alive ticker and waits for it, drains the asynchronous publisher, then closes every subscription.
     */
    public synchronized void stop() {
        log.info("Stopping {}", this.getClass().getSimpleName());
        ticker.stop();
        if (publisher != null) {
            publisher.shutdown();
            try {
                if (!publisher.awaitTermination(stopTimeoutMillis, TimeUnit.MILLISECONDS)) {
                    log.warn("Publisher did not finish pending sends within {}ms", stopTimeoutMillis);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                if (!publisher.isTerminated()) {
                    publisher.shutdownNow();
                }
                publisher = null;
            }
        }
        registry.close();
    }

    public synchronized boolean isStarted() {
        return publisher != null;
    }

    public int send(String data) {
        return send(data, null, null, null, null);
    }

    public int send(String data, String channelId) {
        return send(data, channelId, null, null, null);
    }

    /**
     * Formats an event and queues it for the channel's subscribers, or for all subscribers when channelId is null.
     *
     * @return the number of subscribers the event was queued for
     */
    public int send(String data, String channelId, String id, String event, Integer retry) {
        return registry.publish(EventFormatter.format(data, id, event, retry), channelId);
    }

    /**
     * Formats the event on the calling thread and publishes it from the publisher thread. Events sent this way reach each subscriber in call order.
     *
     * @throws IllegalStateException
     *             if the service is not started
     */
    public CompletableFuture<Integer> sendAsync(String data, String channelId, String id, String event, Integer retry) {
        byte[] frame = EventFormatter.format(data, id, event, retry);
        ExecutorService executor;
        synchronized (this) {
            executor = publisher;
        }
        if (executor == null) {
            throw new IllegalStateException(this.getClass().getSimpleName() + " is not started");
        }
        return CompletableFuture.supplyAsync(() -> registry.publish(frame, channelId), executor);
    }

    public int publish(byte[] frame, String channelId) {
        return registry.publish(frame, channelId);
    }

    /**
     * Runs the before-subscribe hook, if one is set, and registers the subscriber once it succeeds. If the hook fails the returned future fails with
     * its error and nothing is registered.
     */
    public CompletableFuture<Subscription> subscribe(SubscribeRequest request) {
        SubscribeHook hook = this.beforeSubscribe;
        CompletionStage<Void> gate = null;
        if (hook != null) {
            try {
                gate = hook.beforeSubscribe(request);
            } catch (Exception e) {
                log.debug("Before subscribe hook rejected {}: {}", request, e.getMessage());
                return CompletableFuture.failedFuture(e);
            }
        }
        if (gate == null) {
            gate = CompletableFuture.completedFuture(null);
        }
        return gate.thenApply(v -> {
            try {
                return registry.subscribe(request.getChannelId());
            } catch (DuplicateSubscriptionException e) {
                throw new CompletionException(e);
            }
        }).toCompletableFuture();
    }

    public StreamLoop newStreamLoop(Subscription subscription, EventSink sink) {
        return new StreamLoop(registry, subscription, sink);
    }

    /**
     * @throws IllegalArgumentException
     *             if hook is null
     */
    public void setBeforeSubscribeHook(SubscribeHook hook) {
        if (hook == null) {
            throw new IllegalArgumentException("before subscribe hook must not be null");
        }
        this.beforeSubscribe = hook;
    }

    public SubscribeHook getBeforeSubscribeHook() {
        return beforeSubscribe;
    }

    public SubscriptionRegistry getRegistry() {
        return registry;
    }

    public boolean isKeepAliveRunning() {
        return ticker.isRunning();
    }
}
